package io.github.archlog;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of resolving the changelog of one package.
 *
 * <p>
 * A {@link ResolutionState#FAILED} result still carries every entry collected before the
 * failure.
 *
 * @param name package name
 * @param description package description, empty if the registry lookup failed
 * @param base packaging base name, null if none
 * @param currentVersion installed version
 * @param newVersion available version
 * @param entries collected changelog entries in hop order
 * @param state terminal state, {@link ResolutionState#DONE} or
 * {@link ResolutionState#FAILED}
 * @param failureReason why resolution stopped, null when done
 */
public record PackageChangelog(String name, String description, @Nullable String base, String currentVersion,
		String newVersion, List<ChangelogEntry> entries, ResolutionState state, @Nullable String failureReason) {

	public PackageChangelog {
		entries = List.copyOf(entries);
	}

	public static PackageChangelog done(PackageVersionInfo pkg, List<ChangelogEntry> entries) {
		return new PackageChangelog(pkg.name(), pkg.description(), pkg.base(), pkg.currentVersion(),
				pkg.newVersion(), entries, ResolutionState.DONE, null);
	}

	public static PackageChangelog failed(PackageVersionInfo pkg, List<ChangelogEntry> entries, String reason) {
		return new PackageChangelog(pkg.name(), pkg.description(), pkg.base(), pkg.currentVersion(),
				pkg.newVersion(), entries, ResolutionState.FAILED, reason);
	}

	public static PackageChangelog failed(UpgradeCandidate candidate, String reason) {
		return new PackageChangelog(candidate.name(), "", null, candidate.currentVersion(),
				candidate.newVersion(), List.of(), ResolutionState.FAILED, reason);
	}

	public boolean isDone() {
		return state == ResolutionState.DONE;
	}

}
