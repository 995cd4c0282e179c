package io.github.archlog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Finds the packaging releases published between the installed and the available version
 * and collects the changelog of every step.
 *
 * <p>
 * A user may skip several releases, e.g. {@code 1.2-1 -> 1.2-2 -> 1.3-1}. Each consecutive
 * pair of versions is a hop. A {@link ReleaseType#MINOR} hop contributes the packaging
 * commits, a {@link ReleaseType#MAJOR} hop the packaging commits (tagged
 * {@link ReleaseType#ARCH}) followed by the upstream commits. Hops between equal versions
 * are skipped.
 */
public class IntermediateTagWalker {

	private static final Logger logger = LoggerFactory.getLogger(IntermediateTagWalker.class);

	private final PackagingChangelogFetcher packagingFetcher;

	private final UpstreamChangelogFetcher upstreamFetcher;

	public IntermediateTagWalker(PackagingChangelogFetcher packagingFetcher, UpstreamChangelogFetcher upstreamFetcher) {
		this.packagingFetcher = packagingFetcher;
		this.upstreamFetcher = upstreamFetcher;
	}

	/**
	 * Find the tags strictly between two versions.
	 * @param tags packaging tags, newest first
	 * @param currentVersion installed version, epoch normalized before lookup
	 * @param newVersion available version, epoch normalized before lookup
	 * @return the tags in between, oldest first (possibly empty), or empty if either version
	 * has no tag
	 */
	public Optional<List<TagInfo>> findIntermediate(TagIndex tags, String currentVersion, String newVersion) {
		String current = VersionTag.normalizeEpoch(currentVersion);
		String next = VersionTag.normalizeEpoch(newVersion);
		int currentIndex = tags.indexOf(current);
		int newIndex = tags.indexOf(next);

		if (currentIndex < 0 || newIndex < 0) {
			logger.error("Intermediate tags: tag {} or {} not found among {} packaging tags", current, next,
					tags.size());
			return Optional.empty();
		}
		if (newIndex >= currentIndex) {
			logger.debug("Tag {} is not newer than {}, no intermediate tags", next, current);
			return Optional.of(List.of());
		}

		List<TagInfo> between = new ArrayList<>(tags.tags().subList(newIndex + 1, currentIndex));
		Collections.reverse(between);
		return Optional.of(List.copyOf(between));
	}

	/**
	 * Collect the changelog of every hop from the installed version over the intermediate
	 * tags to the available version.
	 * @param intermediateTags tags between both versions, oldest first
	 * @param pkg the package
	 * @param target upstream location, null for a packaging-only changelog
	 * @return entries in hop order
	 */
	public List<ChangelogEntry> walk(List<TagInfo> intermediateTags, PackageVersionInfo pkg,
			@Nullable UpstreamTarget target) {
		List<VersionTag> versions = new ArrayList<>();
		versions.add(pkg.currentTag());
		for (TagInfo tag : intermediateTags) {
			try {
				versions.add(VersionTag.parse(tag.name()));
			}
			catch (IllegalArgumentException e) {
				logger.warn("{}: skipping malformed intermediate tag {}", pkg.name(), tag.name());
			}
		}
		versions.add(pkg.newTag());

		List<ChangelogEntry> entries = new ArrayList<>();
		for (int i = 1; i < versions.size(); i++) {
			entries.addAll(hop(pkg, versions.get(i - 1), versions.get(i), target));
		}
		return entries;
	}

	private List<ChangelogEntry> hop(PackageVersionInfo pkg, VersionTag from, VersionTag to,
			@Nullable UpstreamTarget target) {
		ReleaseType type = ReleaseType.classify(from, to);
		switch (type) {
			case MINOR -> {
				logger.info("{}: {} is a minor release", pkg.name(), to);
				return packagingFetcher.fetch(pkg, from.raw(), to.raw(), ReleaseType.MINOR);
			}
			case MAJOR -> {
				logger.info("{}: {} is a major release", pkg.name(), to);
				List<ChangelogEntry> entries = new ArrayList<>(
						packagingFetcher.fetch(pkg, from.raw(), to.raw(), ReleaseType.ARCH));
				if (target != null) {
					entries.addAll(upstreamFetcher.fetch(pkg, target, from, to));
				}
				else {
					logger.warn("{}: upstream unknown, origin changelog of {} omitted", pkg.name(), to);
				}
				return entries;
			}
			default -> {
				logger.debug("{}: no change between {} and {}", pkg.name(), from, to);
				return List.of();
			}
		}
	}

}
