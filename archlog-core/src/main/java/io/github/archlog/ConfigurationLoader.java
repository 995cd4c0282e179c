package io.github.archlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ArchlogProperties} from the user's {@code config.json}.
 *
 * <p>
 * A missing file is created from the bundled defaults. Keys present in the defaults but
 * missing in an existing file are added to it, keeping every user value.
 */
public class ConfigurationLoader {

	private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

	public static final String CONFIG_FILE_NAME = "config.json";

	static final String DEFAULT_CONFIG_RESOURCE = "default-config.json";

	private final ObjectMapper objectMapper;

	public ConfigurationLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Default location of the configuration file.
	 * @return {@code ~/.config/archlog/config.json}
	 */
	public static Path defaultConfigFile() {
		return new ArchlogProperties().getConfigFile();
	}

	/**
	 * Load the configuration, creating or completing the file as needed.
	 * @param configFile configuration file
	 * @return loaded properties
	 * @throws IllegalStateException if the file cannot be read or holds invalid values
	 */
	public ArchlogProperties load(Path configFile) {
		ObjectNode defaults = readDefaults();
		ObjectNode config;
		try {
			if (Files.notExists(configFile)) {
				logger.debug("Config file not found, creating default: {}", configFile);
				config = defaults.deepCopy();
				write(configFile, config);
			}
			else {
				JsonNode node = objectMapper.readTree(configFile.toFile());
				if (!(node instanceof ObjectNode objectNode)) {
					throw new IllegalStateException("Configuration file " + configFile + " is not a JSON object");
				}
				config = objectNode;
				if (merge(defaults, config)) {
					logger.info("Adding missing config values from default config to {}", configFile);
					write(configFile, config);
				}
			}
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to load configuration " + configFile + ": " + e.getMessage(), e);
		}

		ArchlogProperties properties = toProperties(config);
		properties.setConfigDir(configFile.toAbsolutePath().getParent());
		return properties;
	}

	/**
	 * Recursively add the keys of {@code defaults} missing in {@code config}. Keys keep the
	 * order of the defaults; user keys unknown to the defaults are kept at the end.
	 * @param defaults default configuration
	 * @param config user configuration, modified in place
	 * @return true if anything was added
	 */
	static boolean merge(ObjectNode defaults, ObjectNode config) {
		boolean updated = false;
		ObjectNode merged = config.objectNode();

		Iterator<Map.Entry<String, JsonNode>> fields = defaults.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			JsonNode userValue = config.get(field.getKey());
			if (userValue == null) {
				merged.set(field.getKey(), field.getValue().deepCopy());
				updated = true;
			}
			else {
				if (field.getValue() instanceof ObjectNode defaultObject && userValue instanceof ObjectNode userObject) {
					updated |= merge(defaultObject, userObject);
				}
				merged.set(field.getKey(), userValue);
			}
		}

		Iterator<Map.Entry<String, JsonNode>> userFields = config.fields();
		while (userFields.hasNext()) {
			Map.Entry<String, JsonNode> field = userFields.next();
			if (!merged.has(field.getKey())) {
				merged.set(field.getKey(), field.getValue());
			}
		}

		config.removeAll();
		config.setAll(merged);
		return updated;
	}

	ArchlogProperties toProperties(JsonNode config) {
		ArchlogProperties properties = new ArchlogProperties();
		properties.setArchitectureWording(
				config.path("architecture-wording").asText(properties.getArchitectureWording()));
		double delaySeconds = config.path("webscraper-delay").asDouble(properties.getWebscraperDelay().toSeconds());
		properties.setWebscraperDelay(Duration.ofMillis(Math.round(delaySeconds * 1000)));
		properties.setRequestTimeout(Duration.ofSeconds(
				config.path("request-timeout").asLong(properties.getRequestTimeout().toSeconds())));
		properties.setMaxAttempts(config.path("max-attempts").asInt(properties.getMaxAttempts()));
		properties.setBackoffFactor(config.path("backoff-factor").asInt(properties.getBackoffFactor()));
		properties.setFuzzyMatchThreshold(
				config.path("fuzzy-match-threshold").asInt(properties.getFuzzyMatchThreshold()));
		properties.setUrlSimilarityThreshold(
				config.path("url-similarity-threshold").asDouble(properties.getUrlSimilarityThreshold()));
		properties.setMaxGitLabPages(config.path("max-gitlab-pages").asInt(properties.getMaxGitLabPages()));

		JsonNode repositories = config.path("arch-repositories");
		if (repositories.isArray()) {
			List<ArchRepository> parsed = new ArrayList<>();
			for (JsonNode repository : repositories) {
				String name = repository.path("name").asText("");
				if (name.isBlank()) {
					throw new IllegalStateException("Repository entry without name in configuration: " + repository);
				}
				parsed.add(new ArchRepository(name, repository.path("enabled").asBoolean(false)));
			}
			properties.setRepositories(parsed);
		}

		JsonNode paths = config.path("paths");
		if (paths.hasNonNull("changelog-dir")) {
			properties.setChangelogDir(expandHome(paths.get("changelog-dir").asText()));
		}
		if (paths.hasNonNull("logs-dir")) {
			properties.setLogsDir(expandHome(paths.get("logs-dir").asText()));
		}

		validate(properties);
		return properties;
	}

	private static void validate(ArchlogProperties properties) {
		List<String> errors = new ArrayList<>();
		if (properties.getArchitectureWording().isBlank()) {
			errors.add("architecture-wording must not be empty");
		}
		if (properties.getMaxAttempts() < 1) {
			errors.add("max-attempts must be at least 1 (got: " + properties.getMaxAttempts() + ")");
		}
		if (properties.getBackoffFactor() < 1) {
			errors.add("backoff-factor must be positive (got: " + properties.getBackoffFactor() + ")");
		}
		if (properties.getFuzzyMatchThreshold() < 0 || properties.getFuzzyMatchThreshold() > 100) {
			errors.add("fuzzy-match-threshold must be between 0 and 100 (got: "
					+ properties.getFuzzyMatchThreshold() + ")");
		}
		if (properties.getUrlSimilarityThreshold() < 0 || properties.getUrlSimilarityThreshold() > 1) {
			errors.add("url-similarity-threshold must be between 0 and 1 (got: "
					+ properties.getUrlSimilarityThreshold() + ")");
		}
		if (properties.getMaxGitLabPages() < 1) {
			errors.add("max-gitlab-pages must be at least 1 (got: " + properties.getMaxGitLabPages() + ")");
		}
		if (properties.getWebscraperDelay().isNegative()) {
			errors.add("webscraper-delay must not be negative");
		}
		if (!errors.isEmpty()) {
			throw new IllegalStateException("Invalid configuration:\n  - " + String.join("\n  - ", errors));
		}
	}

	public static Path expandHome(String path) {
		if (path.equals("~") || path.startsWith("~/")) {
			return Path.of(System.getProperty("user.home", ".") + path.substring(1));
		}
		return Path.of(path);
	}

	private ObjectNode readDefaults() {
		try (InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
			if (in == null) {
				throw new IllegalStateException("Missing bundled " + DEFAULT_CONFIG_RESOURCE);
			}
			return (ObjectNode) objectMapper.readTree(in);
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to read bundled " + DEFAULT_CONFIG_RESOURCE, e);
		}
	}

	private void write(Path configFile, JsonNode config) throws IOException {
		Path parent = configFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		objectMapper.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), config);
	}

}
