package io.github.archlog;

import org.jspecify.annotations.Nullable;

/**
 * One package entry of the Arch Linux package search API.
 *
 * @param name package name
 * @param base packaging base name (may be null)
 * @param description package description
 * @param upstreamUrl upstream project URL
 * @param repository repository name, e.g. {@code extra}
 * @param architecture package architecture, e.g. {@code x86_64} or {@code any}
 * @param version full package version
 */
public record PackageOverview(String name, @Nullable String base, String description, String upstreamUrl,
		String repository, String architecture, String version) {

}
