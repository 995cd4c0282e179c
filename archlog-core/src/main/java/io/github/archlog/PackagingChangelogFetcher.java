package io.github.archlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Lists the commits of the Arch Linux packaging repository between two packaging tags.
 */
public class PackagingChangelogFetcher {

	private static final Logger logger = LoggerFactory.getLogger(PackagingChangelogFetcher.class);

	private final GitLabApi gitLabApi;

	public PackagingChangelogFetcher(GitLabApi gitLabApi) {
		this.gitLabApi = gitLabApi;
	}

	/**
	 * Compare two packaging tags.
	 * @param pkg the package
	 * @param fromTag older epoch-normalized tag
	 * @param toTag newer epoch-normalized tag
	 * @param releaseType {@link ReleaseType#MINOR} or {@link ReleaseType#ARCH}
	 * @return entries tagged with {@code toTag}, empty on failure
	 */
	public List<ChangelogEntry> fetch(PackageVersionInfo pkg, String fromTag, String toTag, ReleaseType releaseType) {
		Optional<GitLabApi.CompareResult> result = compare(pkg, fromTag, toTag);
		if (result.isEmpty()) {
			logger.warn("{}: no packaging changelog for {}...{}", pkg.name(), fromTag, toTag);
			return List.of();
		}

		String compareUrl = compareUrl(pkg.searchName(), fromTag, toTag);
		List<ChangelogEntry> entries = result.get()
			.commits()
			.stream()
			.map(commit -> new ChangelogEntry(commit.title(), commit.webUrl(), toTag, pkg.searchName(), releaseType,
					compareUrl))
			.toList();
		logger.info("{}: {} packaging commits between {} and {}", pkg.name(), entries.size(), fromTag, toTag);
		return entries;
	}

	/**
	 * Raw comparison of two packaging tags, including file diffs.
	 * @param pkg the package
	 * @param fromTag older tag
	 * @param toTag newer tag
	 * @return comparison, empty on failure
	 */
	public Optional<GitLabApi.CompareResult> compare(PackageVersionInfo pkg, String fromTag, String toTag) {
		return gitLabApi.compare(GitLabApi.ARCH_API_BASE_URL, GitLabApi.ARCH_PACKAGES_PATH + pkg.searchName(),
				fromTag, toTag);
	}

	public static String compareUrl(String searchName, String fromTag, String toTag) {
		return GitLabApi.archPackageWebUrl(searchName) + "/-/compare/" + fromTag + "..." + toTag;
	}

}
