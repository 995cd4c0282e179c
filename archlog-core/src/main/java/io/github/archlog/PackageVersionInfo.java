package io.github.archlog;

import org.jspecify.annotations.Nullable;

/**
 * An upgrade candidate enriched with registry metadata.
 *
 * <p>
 * Several binary packages can be built from one recipe (e.g. {@code bluez-libs} from
 * {@code bluez}); {@link #searchName()} is the name under which the packaging repository
 * is found.
 *
 * @param name package name
 * @param base packaging base name, or null if the package is its own base
 * @param description package description
 * @param upstreamUrl upstream project URL from the registry
 * @param currentVersion installed version, raw
 * @param newVersion available version, raw
 */
public record PackageVersionInfo(String name, @Nullable String base, String description, String upstreamUrl,
		String currentVersion, String newVersion) {

	public PackageVersionInfo {
		if (currentVersion.equals(newVersion)) {
			throw new IllegalArgumentException(
					"Current and new version of " + name + " are identical: " + currentVersion);
		}
		requireVersionTag(name, currentVersion);
		requireVersionTag(name, newVersion);
	}

	private static void requireVersionTag(String name, String version) {
		if (!VersionTag.isPackageVersion(version)) {
			throw new IllegalArgumentException("Version " + version + " of " + name + " has no release separator");
		}
	}

	public static PackageVersionInfo of(UpgradeCandidate candidate, PackageOverview overview) {
		return new PackageVersionInfo(candidate.name(), overview.base(), overview.description(),
				overview.upstreamUrl(), candidate.currentVersion(), candidate.newVersion());
	}

	public String searchName() {
		return base != null && !base.isBlank() ? base : name;
	}

	/**
	 * Returns the installed version as a tag, epoch-normalized.
	 * @return current tag
	 * @throws IllegalArgumentException if the version cannot be split
	 */
	public VersionTag currentTag() {
		return VersionTag.fromPackageVersion(currentVersion);
	}

	/**
	 * Returns the available version as a tag, epoch-normalized.
	 * @return new tag
	 * @throws IllegalArgumentException if the version cannot be split
	 */
	public VersionTag newTag() {
		return VersionTag.fromPackageVersion(newVersion);
	}

}
