package io.github.archlog;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for changelog collection.
 *
 * <p>
 * Values are read from the user's {@code config.json} by {@link ConfigurationLoader} or
 * set directly and passed to {@link ArchlogBuilder}. Every property has a default that
 * works on an English Arch Linux installation.
 */
public class ArchlogProperties {

	private static final Path HOME = Path.of(System.getProperty("user.home", "."));

	/**
	 * Label of the architecture line in {@code pacman -Q --info} output. Localized
	 * systems print e.g. {@code Architektur}.
	 */
	private String architectureWording = "Architecture";

	/**
	 * Delay between the attempts of a plain web page request.
	 */
	private Duration webscraperDelay = Duration.ofSeconds(1);

	/**
	 * Timeout of a single HTTP request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(10);

	/**
	 * Total attempts per API call, including the first one.
	 */
	private int maxAttempts = 3;

	/**
	 * Base of the exponential backoff in seconds.
	 */
	private int backoffFactor = 2;

	/**
	 * Minimum fuzzy score (0-100) for aligning packaging and upstream tags.
	 */
	private int fuzzyMatchThreshold = FuzzyTagMatcher.DEFAULT_THRESHOLD;

	/**
	 * Minimum similarity (0-1) of old and new source URL in a recipe diff.
	 */
	private double urlSimilarityThreshold = 0.8;

	/**
	 * Maximum number of pages fetched per GitLab tag listing.
	 */
	private int maxGitLabPages = LinkHeaderPagination.DEFAULT_MAX_PAGES;

	private List<ArchRepository> repositories = new ArrayList<>(List.of(new ArchRepository("core", true),
			new ArchRepository("extra", true), new ArchRepository("multilib", true),
			new ArchRepository("core-testing", false), new ArchRepository("extra-testing", false),
			new ArchRepository("multilib-testing", false)));

	private Path configDir = HOME.resolve(".config/archlog");

	private Path changelogDir = HOME.resolve("archlog/changelog");

	private Path logsDir = HOME.resolve(".local/state/archlog/logs");

	public String getArchitectureWording() {
		return architectureWording;
	}

	public void setArchitectureWording(String architectureWording) {
		this.architectureWording = architectureWording;
	}

	public Duration getWebscraperDelay() {
		return webscraperDelay;
	}

	public void setWebscraperDelay(Duration webscraperDelay) {
		this.webscraperDelay = webscraperDelay;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public int getBackoffFactor() {
		return backoffFactor;
	}

	public void setBackoffFactor(int backoffFactor) {
		this.backoffFactor = backoffFactor;
	}

	public int getFuzzyMatchThreshold() {
		return fuzzyMatchThreshold;
	}

	public void setFuzzyMatchThreshold(int fuzzyMatchThreshold) {
		this.fuzzyMatchThreshold = fuzzyMatchThreshold;
	}

	public double getUrlSimilarityThreshold() {
		return urlSimilarityThreshold;
	}

	public void setUrlSimilarityThreshold(double urlSimilarityThreshold) {
		this.urlSimilarityThreshold = urlSimilarityThreshold;
	}

	public int getMaxGitLabPages() {
		return maxGitLabPages;
	}

	public void setMaxGitLabPages(int maxGitLabPages) {
		this.maxGitLabPages = maxGitLabPages;
	}

	public List<ArchRepository> getRepositories() {
		return repositories;
	}

	public void setRepositories(List<ArchRepository> repositories) {
		this.repositories = repositories;
	}

	/**
	 * Names of the repositories packages are looked up in.
	 * @return enabled repository names
	 */
	public List<String> getEnabledRepositories() {
		return repositories.stream().filter(ArchRepository::enabled).map(ArchRepository::name).toList();
	}

	public Path getConfigDir() {
		return configDir;
	}

	public void setConfigDir(Path configDir) {
		this.configDir = configDir;
	}

	public Path getChangelogDir() {
		return changelogDir;
	}

	public void setChangelogDir(Path changelogDir) {
		this.changelogDir = changelogDir;
	}

	public Path getLogsDir() {
		return logsDir;
	}

	public void setLogsDir(Path logsDir) {
		this.logsDir = logsDir;
	}

	public Path getConfigFile() {
		return configDir.resolve(ConfigurationLoader.CONFIG_FILE_NAME);
	}

}
