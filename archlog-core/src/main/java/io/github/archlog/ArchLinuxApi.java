package io.github.archlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for the Arch Linux package search API.
 *
 * <p>
 * Converts the search JSON to {@link PackageOverview} records at the service boundary.
 */
public class ArchLinuxApi {

	private static final Logger logger = LoggerFactory.getLogger(ArchLinuxApi.class);

	static final String SEARCH_URL = "https://archlinux.org/packages/search/json/?name=";

	private final ApiClient client;

	private final ObjectMapper objectMapper;

	public ArchLinuxApi(ApiClient client, ObjectMapper objectMapper) {
		this.client = client;
		this.objectMapper = objectMapper;
	}

	/**
	 * Search packages by exact name. A package name may exist in several repositories and
	 * for several architectures.
	 * @param packageName package name
	 * @return matching entries, empty on failure
	 */
	public List<PackageOverview> searchPackage(String packageName) {
		String url = SEARCH_URL + URLEncoder.encode(packageName, StandardCharsets.UTF_8);
		try {
			JsonNode root = objectMapper.readTree(client.getBody(url));
			List<PackageOverview> results = new ArrayList<>();
			for (JsonNode node : root.path("results")) {
				results.add(parseOverview(node));
			}
			logger.debug("Arch Linux search for {} returned {} results", packageName, results.size());
			return results;
		}
		catch (Exception e) {
			logger.error("Arch Linux package search failed for {}: {}", packageName, e.getMessage());
			return List.of();
		}
	}

	private PackageOverview parseOverview(JsonNode node) {
		String base = node.path("pkgbase").asText("");
		return new PackageOverview(node.path("pkgname").asText(""), base.isEmpty() ? null : base,
				node.path("pkgdesc").asText(""), node.path("url").asText(""), node.path("repo").asText(""),
				node.path("arch").asText(""), formatVersion(node));
	}

	static String formatVersion(JsonNode node) {
		int epoch = node.path("epoch").asInt(0);
		String version = node.path("pkgver").asText("") + "-" + node.path("pkgrel").asText("");
		return epoch > 0 ? epoch + ":" + version : version;
	}

}
