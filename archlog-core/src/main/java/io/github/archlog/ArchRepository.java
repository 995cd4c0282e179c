package io.github.archlog;

/**
 * An Arch Linux repository and whether packages are looked up in it.
 *
 * @param name repository name, e.g. {@code extra}
 * @param enabled whether the repository is considered
 */
public record ArchRepository(String name, boolean enabled) {

}
