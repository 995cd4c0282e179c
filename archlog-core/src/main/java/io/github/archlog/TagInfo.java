package io.github.archlog;

import org.jspecify.annotations.Nullable;

/**
 * A tag of a hosted repository.
 *
 * @param name tag name
 * @param createdAt creation timestamp as reported by the platform, null if unknown
 */
public record TagInfo(String name, @Nullable String createdAt) {

}
