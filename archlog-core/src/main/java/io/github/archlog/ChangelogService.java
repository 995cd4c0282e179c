package io.github.archlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects the changelog of upgrade candidates, one package after the other.
 *
 * <p>
 * Per package the resolution runs through {@link ResolutionState}: the registry entry of
 * the local architecture in an enabled repository is looked up, the upstream location is
 * resolved, the packaging tag index is built and every hop from the installed to the
 * available version is walked. A failing package ends in {@link ResolutionState#FAILED}
 * with the entries collected so far; the run continues with the next package.
 */
public class ChangelogService {

	private static final Logger logger = LoggerFactory.getLogger(ChangelogService.class);

	private final PacmanClient pacmanClient;

	private final ArchLinuxApi archLinuxApi;

	private final GitLabApi gitLabApi;

	private final NvcheckerConfigParser nvcheckerParser;

	private final UpstreamSourceResolver sourceResolver;

	private final TagIndexBuilder tagIndexBuilder;

	private final IntermediateTagWalker tagWalker;

	private final List<String> enabledRepositories;

	public ChangelogService(PacmanClient pacmanClient, ArchLinuxApi archLinuxApi, GitLabApi gitLabApi,
			NvcheckerConfigParser nvcheckerParser, UpstreamSourceResolver sourceResolver,
			TagIndexBuilder tagIndexBuilder, IntermediateTagWalker tagWalker, List<String> enabledRepositories) {
		this.pacmanClient = pacmanClient;
		this.archLinuxApi = archLinuxApi;
		this.gitLabApi = gitLabApi;
		this.nvcheckerParser = nvcheckerParser;
		this.sourceResolver = sourceResolver;
		this.tagIndexBuilder = tagIndexBuilder;
		this.tagWalker = tagWalker;
		this.enabledRepositories = List.copyOf(enabledRepositories);
	}

	/**
	 * Collect the changelogs of several packages sequentially.
	 * @param candidates upgrade candidates
	 * @return one changelog per candidate, in input order
	 */
	public List<PackageChangelog> collectAll(List<UpgradeCandidate> candidates) {
		List<PackageChangelog> changelogs = new ArrayList<>();
		for (int i = 0; i < candidates.size(); i++) {
			UpgradeCandidate candidate = candidates.get(i);
			logger.info("[{}/{}] Collecting changelog of {} {} -> {}", i + 1, candidates.size(), candidate.name(),
					candidate.currentVersion(), candidate.newVersion());
			changelogs.add(collect(candidate));
		}
		return changelogs;
	}

	/**
	 * Collect the changelog of one package.
	 * @param candidate upgrade candidate
	 * @return the changelog, {@link ResolutionState#FAILED} if a fatal step failed
	 * @throws PackageManagerException if {@code pacman} cannot be run
	 */
	public PackageChangelog collect(UpgradeCandidate candidate) {
		ResolutionState state = enter(candidate.name(), ResolutionState.RESOLVE_REPOSITORY);
		Optional<String> architecture = pacmanClient.getArchitecture(candidate.name());
		if (architecture.isEmpty()) {
			return failed(candidate, state, "architecture of the installed package unknown");
		}
		Optional<PackageOverview> overview = resolveRepository(candidate, architecture.get());
		if (overview.isEmpty()) {
			return failed(candidate, state, "no unique registry entry for architecture " + architecture.get());
		}

		PackageVersionInfo pkg;
		try {
			pkg = PackageVersionInfo.of(candidate, overview.get());
		}
		catch (IllegalArgumentException e) {
			logger.error("{}: {}", candidate.name(), e.getMessage());
			return failed(candidate, state, e.getMessage());
		}
		logger.info("{}: packaging repository {}", pkg.name(), GitLabApi.archPackageWebUrl(pkg.searchName()));

		enter(pkg.name(), ResolutionState.RESOLVE_UPSTREAM);
		String upstreamUrl = upstreamUrl(pkg);
		Optional<UpstreamTarget> target = sourceResolver.resolve(upstreamUrl, pkg.searchName());
		if (target.isEmpty()) {
			logger.warn("{}: upstream of {} could not be resolved, collecting the packaging changelog only",
					pkg.name(), upstreamUrl);
		}

		state = enter(pkg.name(), ResolutionState.BUILD_TAG_INDEX);
		Optional<TagIndex> packagingTags = tagIndexBuilder.getPackagingTags(pkg.searchName());
		if (packagingTags.isEmpty()) {
			logger.error("{}: couldn't find any packaging tags", pkg.name());
			enter(pkg.name(), ResolutionState.FAILED);
			return PackageChangelog.failed(pkg, List.of(), state + ": no packaging tags");
		}

		Optional<List<TagInfo>> intermediate = tagWalker.findIntermediate(packagingTags.get(), pkg.currentVersion(),
				pkg.newVersion());
		List<TagInfo> hops = intermediate.orElse(List.of());
		if (hops.isEmpty()) {
			enter(pkg.name(), ResolutionState.NO_INTERMEDIATE);
			logger.info("{}: no intermediate tags found", pkg.name());
		}
		else {
			enter(pkg.name(), ResolutionState.WALK_INTERMEDIATE);
			logger.info("{}: intermediate tags {}", pkg.name(), hops.stream().map(TagInfo::name).toList());
		}

		List<ChangelogEntry> entries = tagWalker.walk(hops, pkg, target.orElse(null));
		logger.info("{}: {} changelog entries", pkg.name(), entries.size());
		enter(pkg.name(), ResolutionState.DONE);
		return PackageChangelog.done(pkg, entries);
	}

	private static ResolutionState enter(String packageName, ResolutionState state) {
		logger.debug("{}: {}", packageName, state);
		return state;
	}

	private static PackageChangelog failed(UpgradeCandidate candidate, ResolutionState state, String reason) {
		enter(candidate.name(), ResolutionState.FAILED);
		return PackageChangelog.failed(candidate, state + ": " + reason);
	}

	private Optional<PackageOverview> resolveRepository(UpgradeCandidate candidate, String architecture) {
		List<PackageOverview> matches = archLinuxApi.searchPackage(candidate.name())
			.stream()
			.filter(entry -> entry.name().equals(candidate.name()))
			.filter(entry -> enabledRepositories.contains(entry.repository()))
			.filter(entry -> entry.architecture().equals(architecture) || entry.architecture().equals("any"))
			.toList();

		if (matches.size() != 1) {
			if (matches.size() > 1) {
				logger.error("{}: found in several repositories {}. Enable either the stable or the testing "
						+ "repositories in the config file", candidate.name(),
						matches.stream().map(PackageOverview::repository).toList());
			}
			else {
				logger.error("{}: not found for architecture {} in the enabled repositories {}", candidate.name(),
						architecture, enabledRepositories);
			}
			return Optional.empty();
		}

		PackageOverview overview = matches.get(0);
		logger.info("{}: https://archlinux.org/packages/{}/{}/{}", candidate.name(), overview.repository(),
				overview.architecture(), overview.name());
		if (!overview.version().equals(candidate.newVersion())) {
			logger.warn("{}: registry lists version {} but the upgrade offers {}, the package database may be "
					+ "out of sync", candidate.name(), overview.version(), candidate.newVersion());
		}
		return Optional.of(overview);
	}

	private String upstreamUrl(PackageVersionInfo pkg) {
		Optional<String> nvchecker = gitLabApi
			.getFileContent(GitLabApi.ARCH_API_BASE_URL, GitLabApi.ARCH_PACKAGES_PATH + pkg.searchName(),
					NvcheckerConfigParser.FILE_NAME, "main")
			.flatMap(content -> nvcheckerParser.upstreamUrl(content, pkg.searchName()));
		if (nvchecker.isPresent()) {
			logger.debug("{}: upstream URL from {}: {}", pkg.name(), NvcheckerConfigParser.FILE_NAME, nvchecker.get());
			return nvchecker.get();
		}
		return pkg.upstreamUrl();
	}

}
