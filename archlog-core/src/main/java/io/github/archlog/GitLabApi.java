package io.github.archlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for the REST API of any GitLab instance.
 *
 * <p>
 * Every operation takes the API base URL (e.g. {@code https://gitlab.archlinux.org/api/v4})
 * and the full project path; the path is URL-encoded into the project id. Failures are
 * logged and reported as empty results.
 */
public class GitLabApi {

	private static final Logger logger = LoggerFactory.getLogger(GitLabApi.class);

	public static final String ARCH_API_BASE_URL = "https://gitlab.archlinux.org/api/v4";

	public static final String ARCH_WEB_BASE_URL = "https://gitlab.archlinux.org";

	public static final String ARCH_PACKAGES_PATH = "archlinux/packaging/packages/";

	static final int PER_PAGE = 100;

	private final ApiClient client;

	private final ObjectMapper objectMapper;

	private final LinkHeaderPagination pagination;

	public GitLabApi(ApiClient client, ObjectMapper objectMapper, int maxPages) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.pagination = new LinkHeaderPagination(client, objectMapper, maxPages);
	}

	/**
	 * Fetch all tags of a project, newest first.
	 * @param apiBaseUrl API base URL
	 * @param projectPath full project path
	 * @return tags, or empty on failure
	 */
	public Optional<List<TagInfo>> getTags(String apiBaseUrl, String projectPath) {
		String url = projectUrl(apiBaseUrl, projectPath) + "/repository/tags";
		try {
			List<TagInfo> tags = new ArrayList<>();
			for (JsonNode node : pagination.fetchAll(url, PER_PAGE)) {
				String createdAt = node.path("created_at").asText("");
				if (createdAt.isEmpty()) {
					createdAt = node.path("commit").path("created_at").asText("");
				}
				tags.add(new TagInfo(node.path("name").asText(""), createdAt.isEmpty() ? null : createdAt));
			}
			return Optional.of(tags);
		}
		catch (Exception e) {
			logger.error("Failed to get tags of {} on {}: {}", projectPath, apiBaseUrl, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Compare two refs of a project.
	 * @param apiBaseUrl API base URL
	 * @param projectPath full project path
	 * @param from older ref
	 * @param to newer ref
	 * @return commits and file diffs, or empty on failure
	 */
	public Optional<CompareResult> compare(String apiBaseUrl, String projectPath, String from, String to) {
		String url = projectUrl(apiBaseUrl, projectPath) + "/repository/compare?from=" + encode(from) + "&to="
				+ encode(to);
		try {
			JsonNode root = objectMapper.readTree(client.getBody(url));
			List<Commit> commits = new ArrayList<>();
			for (JsonNode node : root.path("commits")) {
				commits.add(new Commit(node.path("title").asText(""), node.path("created_at").asText(""),
						node.path("web_url").asText("")));
			}
			List<FileDiff> diffs = new ArrayList<>();
			for (JsonNode node : root.path("diffs")) {
				diffs.add(new FileDiff(node.path("old_path").asText(""), node.path("new_path").asText(""),
						node.path("diff").asText("")));
			}
			return Optional.of(new CompareResult(commits, diffs));
		}
		catch (Exception e) {
			logger.error("Failed to compare {}...{} of {} on {}: {}", from, to, projectPath, apiBaseUrl,
					e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Fetch a raw repository file.
	 * @param apiBaseUrl API base URL
	 * @param projectPath full project path
	 * @param filePath path of the file inside the repository
	 * @param ref branch, tag or commit
	 * @return file content, or empty if absent or on failure
	 */
	public Optional<String> getFileContent(String apiBaseUrl, String projectPath, String filePath, String ref) {
		String url = projectUrl(apiBaseUrl, projectPath) + "/repository/files/" + encode(filePath) + "/raw?ref="
				+ encode(ref);
		try {
			return Optional.of(client.getBody(url));
		}
		catch (ApiException e) {
			if (e.isNotFound()) {
				logger.debug("No {} in {} at {}", filePath, projectPath, ref);
			}
			else {
				logger.warn("Failed to read {} of {} at {}: {}", filePath, projectPath, ref, e.getMessage());
			}
			return Optional.empty();
		}
	}

	/**
	 * Check whether a project exists.
	 * @param apiBaseUrl API base URL
	 * @param projectPath full project path
	 * @return true if the project answers with 2xx
	 */
	public boolean projectExists(String apiBaseUrl, String projectPath) {
		try {
			client.get(projectUrl(apiBaseUrl, projectPath));
			return true;
		}
		catch (ApiException e) {
			logger.debug("Project {} not found on {}: {}", projectPath, apiBaseUrl, e.getMessage());
			return false;
		}
	}

	/**
	 * Web URL of the packaging repository of an Arch Linux package.
	 * @param searchName package base or name
	 * @return web URL
	 */
	public static String archPackageWebUrl(String searchName) {
		return ARCH_WEB_BASE_URL + "/" + ARCH_PACKAGES_PATH + searchName;
	}

	private static String projectUrl(String apiBaseUrl, String projectPath) {
		return apiBaseUrl + "/projects/" + encode(projectPath);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	/**
	 * Result of a ref comparison.
	 *
	 * @param commits commits between both refs, oldest first
	 * @param diffs changed files
	 */
	public record CompareResult(List<Commit> commits, List<FileDiff> diffs) {

		public CompareResult {
			commits = List.copyOf(commits);
			diffs = List.copyOf(diffs);
		}

		public Optional<FileDiff> diffOf(String path) {
			return diffs.stream().filter(d -> d.newPath().equals(path) || d.oldPath().equals(path)).findFirst();
		}

	}

	/**
	 * Unified diff of one file.
	 *
	 * @param oldPath path before the change
	 * @param newPath path after the change
	 * @param diff unified diff text
	 */
	public record FileDiff(String oldPath, String newPath, String diff) {

	}

}
