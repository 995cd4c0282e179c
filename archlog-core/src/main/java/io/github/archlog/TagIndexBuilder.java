package io.github.archlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Builds newest-first tag indexes for packaging and upstream repositories.
 *
 * <p>
 * Every tag name is epoch-normalized. An empty or failed listing yields
 * {@link Optional#empty()}.
 */
public class TagIndexBuilder {

	private static final Logger logger = LoggerFactory.getLogger(TagIndexBuilder.class);

	private final GitLabApi gitLabApi;

	private final GitHubApi gitHubApi;

	public TagIndexBuilder(GitLabApi gitLabApi, GitHubApi gitHubApi) {
		this.gitLabApi = gitLabApi;
		this.gitHubApi = gitHubApi;
	}

	/**
	 * Tags of the Arch Linux packaging repository of a package.
	 * @param searchName package base or name
	 * @return tag index, or empty if none could be fetched
	 */
	public Optional<TagIndex> getPackagingTags(String searchName) {
		return toIndex(gitLabApi.getTags(GitLabApi.ARCH_API_BASE_URL, GitLabApi.ARCH_PACKAGES_PATH + searchName),
				"packaging repository " + searchName);
	}

	/**
	 * Tags of an upstream repository.
	 * @param target resolved upstream target
	 * @return tag index, or empty if none could be fetched or the target has no tag listing
	 */
	public Optional<TagIndex> getTags(UpstreamTarget target) {
		Optional<List<TagInfo>> tags;
		if (target instanceof UpstreamTarget.GitHub gitHub) {
			tags = gitHubApi.getTags(gitHub.owner(), gitHub.repo());
		}
		else if (target instanceof UpstreamTarget.GitLab gitLab) {
			tags = gitLabApi.getTags(gitLab.apiBaseUrl(), gitLab.projectFullPath());
		}
		else if (target instanceof UpstreamTarget.KdeInvent kde) {
			tags = gitLabApi.getTags(UpstreamTarget.KdeInvent.API_BASE_URL, kde.projectFullPath());
		}
		else {
			logger.debug("{} has no tag listing", target.describe());
			return Optional.empty();
		}
		return toIndex(tags, target.describe());
	}

	private static Optional<TagIndex> toIndex(Optional<List<TagInfo>> tags, String source) {
		if (tags.isEmpty() || tags.get().isEmpty()) {
			logger.warn("No tags found for {}", source);
			return Optional.empty();
		}
		List<TagInfo> normalized = tags.get()
			.stream()
			.map(tag -> new TagInfo(VersionTag.normalizeEpoch(tag.name()), tag.createdAt()))
			.toList();
		if (logger.isDebugEnabled()) {
			normalized.forEach(tag -> logger.debug("Tag of {}: {} created {}", source, tag.name(), tag.createdAt()));
		}
		return Optional.of(new TagIndex(normalized));
	}

}
