package io.github.archlog;

import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the upstream source change from a packaging recipe diff.
 *
 * <p>
 * The {@code .SRCINFO} diff between two packaging tags contains the removed and the added
 * {@code source = ...} line. Both are reduced to the base repository URL and the upstream
 * tag, e.g. {@code git+https://github.com/electron/electron.git#tag=v36.8.1} becomes
 * {@code https://github.com/electron/electron} and {@code v36.8.1}.
 */
public class RecipeSourceExtractor {

	private static final Logger logger = LoggerFactory.getLogger(RecipeSourceExtractor.class);

	public static final String RECIPE_FILE = ".SRCINFO";

	private static final Pattern GITHUB_REPOSITORY = Pattern.compile("https://github\\.com/[^/?#]+/[^/?#]+");

	private static final Pattern TAG_FRAGMENT = Pattern.compile("#tag=([^?]+)");

	private static final Pattern ARCHIVE_PATH = Pattern.compile("/(?:download|archive)/([^/]+)");

	private final double similarityThreshold;

	public RecipeSourceExtractor(double similarityThreshold) {
		this.similarityThreshold = similarityThreshold;
	}

	/**
	 * Extract the source change of a unified diff.
	 * @param diff unified diff of the recipe file
	 * @return the old and new source, or empty if no similar source pair was found
	 */
	public Optional<SourceChange> extract(String diff) {
		List<String> removed = new ArrayList<>();
		List<String> added = new ArrayList<>();
		for (String line : diff.split("\n")) {
			if (!line.contains("source =") || !line.contains("https://")) {
				continue;
			}
			if (line.startsWith("-")) {
				removed.add(line);
			}
			else if (line.startsWith("+")) {
				added.add(line);
			}
		}

		if (removed.isEmpty() || added.isEmpty()) {
			logger.debug("No changed source lines in recipe diff");
			return Optional.empty();
		}

		String oldBaseUrl = extractBaseGitUrl(removed.get(0));
		String newBaseUrl = extractBaseGitUrl(added.get(0));
		double similarity = similarity(oldBaseUrl, newBaseUrl);
		if (similarity < similarityThreshold) {
			logger.info("Source URLs {} and {} are not similar enough ({})", oldBaseUrl, newBaseUrl, similarity);
			return Optional.empty();
		}

		return Optional.of(new SourceChange(oldBaseUrl, newBaseUrl, extractTag(removed.get(0)),
				extractTag(added.get(0))));
	}

	/**
	 * Reduce a source line or URL to the base repository URL.
	 * @param source source line, e.g. {@code +\tsource = git+https://host/group/repo.git?signed#tag=1.0}
	 * @return base URL, e.g. {@code https://host/group/repo}
	 */
	public static String extractBaseGitUrl(String source) {
		int start = source.indexOf("https://");
		String url = start >= 0 ? source.substring(start).trim() : source.trim();

		Matcher github = GITHUB_REPOSITORY.matcher(url);
		if (github.find()) {
			return NvcheckerConfigParser.stripGitSuffix(github.group());
		}

		int end = url.length();
		for (char separator : new char[] { '#', '?' }) {
			int index = url.indexOf(separator);
			if (index >= 0 && index < end) {
				end = index;
			}
		}
		url = url.substring(0, end);

		int uiSuffix = url.indexOf("/-/");
		if (uiSuffix >= 0) {
			url = url.substring(0, uiSuffix);
		}
		while (url.endsWith("/")) {
			url = url.substring(0, url.length() - 1);
		}
		return NvcheckerConfigParser.stripGitSuffix(url);
	}

	/**
	 * Extract the upstream tag of a source line.
	 * @param source source line or URL
	 * @return tag from {@code #tag=} or a {@code /download/} or {@code /archive/} path, null if
	 * neither is present
	 */
	@Nullable
	public static String extractTag(String source) {
		Matcher fragment = TAG_FRAGMENT.matcher(source);
		if (fragment.find()) {
			return fragment.group(1).trim();
		}
		Matcher archive = ARCHIVE_PATH.matcher(source);
		if (archive.find()) {
			return archive.group(1);
		}
		return null;
	}

	static double similarity(String a, String b) {
		return FuzzySearch.ratio(a, b) / 100.0;
	}

	/**
	 * The upstream source before and after a packaging change.
	 *
	 * @param oldBaseUrl previous base repository URL
	 * @param newBaseUrl new base repository URL
	 * @param oldTag previous upstream tag, null if unknown
	 * @param newTag new upstream tag, null if unknown
	 */
	public record SourceChange(String oldBaseUrl, String newBaseUrl, @Nullable String oldTag,
			@Nullable String newTag) {

		public boolean hasTags() {
			return oldTag != null && newTag != null;
		}

	}

}
