package io.github.archlog;

/**
 * A single commit listed in a package changelog.
 *
 * @param message commit title
 * @param url commit web URL
 * @param versionTag the packaging tag this commit leads up to (grouping key)
 * @param packageName package or upstream project the commit belongs to
 * @param releaseType kind of comparison that produced the entry
 * @param compareUrl web URL of the tag comparison
 */
public record ChangelogEntry(String message, String url, String versionTag, String packageName,
		ReleaseType releaseType, String compareUrl) {

}
