package io.github.archlog;

/**
 * A commit returned by a tag comparison.
 *
 * @param title first line of the commit message
 * @param createdAt commit timestamp as reported by the platform
 * @param webUrl commit web URL
 */
public record Commit(String title, String createdAt, String webUrl) {

}
