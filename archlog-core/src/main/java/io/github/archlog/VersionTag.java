package io.github.archlog;

/**
 * A packaging version tag split into its upstream ("main") and packaging release ("suffix")
 * parts.
 *
 * <p>
 * Arch Linux versions look like {@code 24.12.2-1} or, with an epoch, {@code 1:15.2.3-2}.
 * Hosting platforms cannot represent {@code :} in tag names, so the packaging GitLab
 * stores the latter as {@code 1-15.2.3-2}. The split rule covers both spellings:
 * <ul>
 * <li>two or more dashes ({@code epoch-main-suffix}): the first segment is the suffix and
 * the second the main</li>
 * <li>exactly one dash: the shorter segment is the suffix, the longer the main</li>
 * </ul>
 *
 * @param raw the tag as given
 * @param main the upstream version part
 * @param suffix the packaging release part, the epoch for tags with two or more dashes
 */
public record VersionTag(String raw, String main, String suffix) {

	/**
	 * Split a raw tag.
	 * @param raw tag such as {@code 24.12.2-1} or {@code 1-15.2.3-2}
	 * @return the split tag
	 * @throws IllegalArgumentException if the tag contains no dash
	 */
	public static VersionTag parse(String raw) {
		String[] parts = raw.split("-", -1);
		if (parts.length < 2) {
			throw new IllegalArgumentException("Version tag has no release separator: " + raw);
		}

		if (parts.length >= 3) {
			return new VersionTag(raw, parts[1], parts[0]);
		}
		if (parts[0].length() < parts[1].length()) {
			return new VersionTag(raw, parts[1], parts[0]);
		}
		return new VersionTag(raw, parts[0], parts[1]);
	}

	/**
	 * Rewrite the epoch separator {@code :} to {@code -} so the version can be looked up
	 * on a hosting platform. Idempotent.
	 * @param version packaging version, e.g. {@code 1:1.2-1}
	 * @return normalized version, e.g. {@code 1-1.2-1}
	 */
	public static String normalizeEpoch(String version) {
		return version.replace(':', '-');
	}

	/**
	 * Whether a packaging version can be split into a tag.
	 * @param version packaging version, possibly containing an epoch colon
	 * @return true if the normalized version contains a release separator
	 */
	public static boolean isPackageVersion(String version) {
		return normalizeEpoch(version).indexOf('-') >= 0;
	}

	/**
	 * Parse a packaging version after epoch normalization.
	 * @param version packaging version, possibly containing an epoch colon
	 * @return the split tag whose {@link #raw()} is the normalized version
	 */
	public static VersionTag fromPackageVersion(String version) {
		return parse(normalizeEpoch(version));
	}

	/**
	 * Returns the packaging release ({@code pkgrel}), the last dash segment of an epoch tag.
	 * @return packaging release
	 */
	public String packageRelease() {
		return hasEpochSegment() ? raw.substring(raw.lastIndexOf('-') + 1) : suffix;
	}

	/**
	 * Returns everything but the packaging release, i.e. epoch and upstream version.
	 * @return versioned part compared when classifying a transition
	 */
	public String releasedVersion() {
		return hasEpochSegment() ? raw.substring(0, raw.lastIndexOf('-')) : main;
	}

	public boolean sameReleasedVersion(VersionTag other) {
		return releasedVersion().equals(other.releasedVersion());
	}

	public boolean samePackageRelease(VersionTag other) {
		return packageRelease().equals(other.packageRelease());
	}

	private boolean hasEpochSegment() {
		return raw.indexOf('-') != raw.lastIndexOf('-');
	}

	@Override
	public String toString() {
		return raw;
	}

}
