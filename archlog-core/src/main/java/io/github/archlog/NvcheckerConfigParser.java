package io.github.archlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads the upstream URL from a packaging repository's {@code .nvchecker.toml}.
 *
 * <p>
 * The file holds one table per package. The table named after the package yields:
 * <ul>
 * <li>{@code source = "github"}: {@code https://github.com/<github>}</li>
 * <li>{@code source = "gitlab"}: {@code https://<host or gitlab.com>/<gitlab>}</li>
 * <li>{@code git = ...}: the URL without {@code .git}</li>
 * <li>{@code url = ...}: the URL as is</li>
 * </ul>
 */
public class NvcheckerConfigParser {

	private static final Logger logger = LoggerFactory.getLogger(NvcheckerConfigParser.class);

	public static final String FILE_NAME = ".nvchecker.toml";

	private final TomlMapper tomlMapper;

	public NvcheckerConfigParser(TomlMapper tomlMapper) {
		this.tomlMapper = tomlMapper;
	}

	/**
	 * Extract the upstream URL for a package.
	 * @param content TOML file content
	 * @param packageName table name to read
	 * @return upstream URL, or empty if the table or a usable key is missing
	 */
	public Optional<String> upstreamUrl(String content, String packageName) {
		JsonNode root;
		try {
			root = tomlMapper.readTree(content);
		}
		catch (Exception e) {
			logger.warn("Invalid {} for {}: {}", FILE_NAME, packageName, e.getMessage());
			return Optional.empty();
		}

		JsonNode table = root.path(packageName);
		if (!table.isObject()) {
			logger.debug("No [{}] table in {}", packageName, FILE_NAME);
			return Optional.empty();
		}

		String source = table.path("source").asText("");
		if ("github".equals(source) && table.hasNonNull("github")) {
			return Optional.of("https://github.com/" + table.get("github").asText());
		}
		if ("gitlab".equals(source) && table.hasNonNull("gitlab")) {
			String host = table.path("host").asText("gitlab.com");
			return Optional.of("https://" + host + "/" + table.get("gitlab").asText());
		}
		if (table.hasNonNull("git")) {
			return Optional.of(stripGitSuffix(table.get("git").asText()));
		}
		if (table.hasNonNull("url")) {
			return Optional.of(table.get("url").asText());
		}

		logger.debug("No upstream URL in [{}] of {}", packageName, FILE_NAME);
		return Optional.empty();
	}

	static String stripGitSuffix(String url) {
		return url.endsWith(".git") ? url.substring(0, url.length() - 4) : url;
	}

}
