package io.github.archlog;

import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Aligns a packaging tag with the differently spelled tags of an upstream project.
 *
 * <p>
 * Tag and candidates are normalized before scoring: a leading {@code <digits>-} epoch is
 * removed when the tag has two or more dashes, a leading {@code v} before a digit is
 * removed, {@code _} becomes {@code .} and a trailing {@code -<digits>} release counter is
 * removed. Candidates are scored with FuzzyWuzzy's weighted ratio (0-100).
 */
public class FuzzyTagMatcher {

	private static final Logger logger = LoggerFactory.getLogger(FuzzyTagMatcher.class);

	public static final int DEFAULT_THRESHOLD = 70;

	private static final Pattern LEADING_EPOCH = Pattern.compile("^\\d+-");

	private static final Pattern LEADING_V = Pattern.compile("^[vV](?=\\d)");

	private static final Pattern TRAILING_RELEASE = Pattern.compile("-\\d+$");

	private final int threshold;

	public FuzzyTagMatcher() {
		this(DEFAULT_THRESHOLD);
	}

	public FuzzyTagMatcher(int threshold) {
		this.threshold = threshold;
	}

	/**
	 * Find the candidate closest to {@code tag} with the configured threshold.
	 * @param tag packaging tag, e.g. {@code 1-6.3.90-1}
	 * @param candidates upstream tags
	 * @return best candidate in its original spelling, or empty if none scores high enough
	 */
	public Optional<String> closest(String tag, List<String> candidates) {
		return closest(tag, candidates, threshold);
	}

	/**
	 * Find the candidate closest to {@code tag}. Ties keep the earliest candidate.
	 * @param tag packaging tag
	 * @param candidates upstream tags
	 * @param threshold minimum score (0-100)
	 * @return best candidate in its original spelling, or empty if none scores high enough
	 */
	public Optional<String> closest(String tag, List<String> candidates, int threshold) {
		String normalizedTag = normalize(tag);
		String best = null;
		int bestScore = -1;

		for (String candidate : candidates) {
			int score = FuzzySearch.weightedRatio(normalizedTag, normalize(candidate));
			if (score > bestScore) {
				best = candidate;
				bestScore = score;
			}
		}

		if (best != null && bestScore >= threshold) {
			logger.debug("Closest tag for {} is {} (score {})", tag, best, bestScore);
			return Optional.of(best);
		}
		logger.debug("No tag similar to {} among {} candidates (best score {})", tag, candidates.size(), bestScore);
		return Optional.empty();
	}

	static String normalize(String tag) {
		String result = tag.trim();
		if (dashCount(result) >= 2) {
			result = LEADING_EPOCH.matcher(result).replaceFirst("");
		}
		result = LEADING_V.matcher(result).replaceFirst("");
		result = result.replace('_', '.');
		return TRAILING_RELEASE.matcher(result).replaceFirst("");
	}

	private static int dashCount(String value) {
		int count = 0;
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) == '-') {
				count++;
			}
		}
		return count;
	}

}
