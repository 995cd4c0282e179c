package io.github.archlog;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists the upstream commits belonging to a major packaging transition.
 *
 * <p>
 * Packaging tags are aligned with the upstream tags by exact name, by their main part or
 * by {@link FuzzyTagMatcher}. For {@link UpstreamTarget.GenericDiff} the upstream source is
 * read from the {@code .SRCINFO} diff of the transition and fetched from GitHub, GitLab
 * or a cgit log page.
 */
public class UpstreamChangelogFetcher {

	private static final Logger logger = LoggerFactory.getLogger(UpstreamChangelogFetcher.class);

	private final TagIndexBuilder tagIndexBuilder;

	private final FuzzyTagMatcher tagMatcher;

	private final GitHubApi gitHubApi;

	private final GitLabApi gitLabApi;

	private final PackagingChangelogFetcher packagingFetcher;

	private final RecipeSourceExtractor sourceExtractor;

	private final UpstreamSourceResolver sourceResolver;

	private final WebScraper webScraper;

	public UpstreamChangelogFetcher(TagIndexBuilder tagIndexBuilder, FuzzyTagMatcher tagMatcher, GitHubApi gitHubApi,
			GitLabApi gitLabApi, PackagingChangelogFetcher packagingFetcher, RecipeSourceExtractor sourceExtractor,
			UpstreamSourceResolver sourceResolver, WebScraper webScraper) {
		this.tagIndexBuilder = tagIndexBuilder;
		this.tagMatcher = tagMatcher;
		this.gitHubApi = gitHubApi;
		this.gitLabApi = gitLabApi;
		this.packagingFetcher = packagingFetcher;
		this.sourceExtractor = sourceExtractor;
		this.sourceResolver = sourceResolver;
		this.webScraper = webScraper;
	}

	/**
	 * Fetch the upstream commits of one major transition.
	 * @param pkg the package
	 * @param target upstream location
	 * @param from older packaging tag
	 * @param to newer packaging tag
	 * @return entries tagged {@link ReleaseType#MAJOR} with {@code to} as version tag, empty if
	 * the upstream history could not be read
	 */
	public List<ChangelogEntry> fetch(PackageVersionInfo pkg, UpstreamTarget target, VersionTag from, VersionTag to) {
		if (target instanceof UpstreamTarget.GenericDiff) {
			return fetchFromRecipeDiff(pkg, from, to);
		}

		Optional<TagIndex> upstreamTags = tagIndexBuilder.getTags(target);
		if (upstreamTags.isEmpty()) {
			logger.warn("{}: no upstream tags on {}", pkg.name(), target.describe());
			return List.of();
		}

		Optional<String> fromTag = matchTag(from, upstreamTags.get());
		Optional<String> toTag = matchTag(to, upstreamTags.get());
		if (fromTag.isEmpty() || toTag.isEmpty()) {
			logger.warn("{}: couldn't match {} or {} with a tag of {}", pkg.name(), from, to, target.describe());
			return List.of();
		}
		return fetchBetween(pkg, target, fromTag.get(), toTag.get(), to.raw());
	}

	/**
	 * Align a packaging tag with an upstream tag.
	 * @param tag packaging tag
	 * @param upstreamTags upstream tag index
	 * @return upstream tag name, empty if nothing is similar enough
	 */
	Optional<String> matchTag(VersionTag tag, TagIndex upstreamTags) {
		for (String candidate : List.of(tag.raw(), tag.main(), "v" + tag.main())) {
			if (upstreamTags.contains(candidate)) {
				return Optional.of(candidate);
			}
		}
		return tagMatcher.closest(tag.raw(), upstreamTags.names());
	}

	private List<ChangelogEntry> fetchBetween(PackageVersionInfo pkg, UpstreamTarget target, String fromTag,
			String toTag, String versionTag) {
		List<Commit> commits;
		String compareUrl;
		if (target instanceof UpstreamTarget.GitHub gitHub) {
			commits = gitHubApi.getCommitsBetweenTags(gitHub.owner(), gitHub.repo(), fromTag, toTag).orElse(null);
			compareUrl = GitHubApi.compareUrl(gitHub, fromTag, toTag);
		}
		else if (target instanceof UpstreamTarget.GitLab gitLab) {
			commits = gitLabApi.compare(gitLab.apiBaseUrl(), gitLab.projectFullPath(), fromTag, toTag)
				.map(GitLabApi.CompareResult::commits)
				.orElse(null);
			compareUrl = gitLab.webUrl() + "/-/compare/" + fromTag + "..." + toTag;
		}
		else if (target instanceof UpstreamTarget.KdeInvent kde) {
			commits = gitLabApi
				.compare(UpstreamTarget.KdeInvent.API_BASE_URL, kde.projectFullPath(), fromTag, toTag)
				.map(GitLabApi.CompareResult::commits)
				.orElse(null);
			compareUrl = kde.webUrl() + "/-/compare/" + fromTag + "..." + toTag;
		}
		else {
			logger.warn("{}: {} cannot be compared by tag", pkg.name(), target.describe());
			return List.of();
		}

		if (commits == null) {
			logger.warn("{}: upstream comparison {}...{} on {} failed", pkg.name(), fromTag, toTag,
					target.describe());
			return List.of();
		}
		logger.info("{}: {} upstream commits between {} and {} on {}", pkg.name(), commits.size(), fromTag, toTag,
				target.describe());
		return toEntries(commits, pkg, versionTag, compareUrl);
	}

	private List<ChangelogEntry> fetchFromRecipeDiff(PackageVersionInfo pkg, VersionTag from, VersionTag to) {
		Optional<RecipeSourceExtractor.SourceChange> change = packagingFetcher.compare(pkg, from.raw(), to.raw())
			.flatMap(result -> result.diffOf(RecipeSourceExtractor.RECIPE_FILE))
			.flatMap(diff -> sourceExtractor.extract(diff.diff()));
		if (change.isEmpty()) {
			logger.warn("{}: no upstream source change in {} between {} and {}", pkg.name(),
					RecipeSourceExtractor.RECIPE_FILE, from, to);
			return List.of();
		}

		RecipeSourceExtractor.SourceChange source = change.get();
		if (!source.hasTags()) {
			logger.warn("{}: source {} carries no tags", pkg.name(), source.newBaseUrl());
			return List.of();
		}
		String oldTag = source.oldTag();
		String newTag = source.newTag();
		logger.debug("{}: upstream source {} {} -> {}", pkg.name(), source.newBaseUrl(), oldTag, newTag);

		Optional<UpstreamTarget> hosted = sourceResolver.resolveHosted(source.newBaseUrl());
		if (hosted.isPresent()) {
			return fetchBetween(pkg, hosted.get(), oldTag, newTag, to.raw());
		}
		return fetchFromCgitLog(pkg, source.newBaseUrl(), oldTag, newTag, to.raw());
	}

	private List<ChangelogEntry> fetchFromCgitLog(PackageVersionInfo pkg, String baseUrl, String fromTag,
			String toTag, String versionTag) {
		String logUrl = baseUrl + "/log/?qt=range&q=" + fromTag + ".." + toTag;
		Optional<Document> document = webScraper.fetchDocument(logUrl);
		if (document.isEmpty()) {
			return List.of();
		}

		List<Commit> commits = new ArrayList<>();
		for (Element row : document.get().select("table.list tr")) {
			Element link = row.selectFirst("a[href*=commit]");
			if (link == null || link.text().isBlank()) {
				continue;
			}
			Element date = row.selectFirst("span[title]");
			commits.add(new Commit(link.text().trim(), date != null ? date.attr("title") : "", link.absUrl("href")));
		}

		if (commits.isEmpty()) {
			logger.warn("{}: no commits listed on {}", pkg.name(), logUrl);
			return List.of();
		}
		logger.info("{}: {} upstream commits between {} and {} on {}", pkg.name(), commits.size(), fromTag, toTag,
				baseUrl);
		return toEntries(commits, pkg, versionTag, logUrl);
	}

	private static List<ChangelogEntry> toEntries(List<Commit> commits, PackageVersionInfo pkg, String versionTag,
			String compareUrl) {
		return commits.stream()
			.map(commit -> new ChangelogEntry(commit.title(), commit.webUrl(), versionTag, pkg.searchName(),
					ReleaseType.MAJOR, compareUrl))
			.toList();
	}

}
