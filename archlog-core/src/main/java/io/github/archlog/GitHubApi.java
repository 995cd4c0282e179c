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
 * Service for the GitHub REST API.
 *
 * <p>
 * Tags are listed with {@code per_page=100}; only the newest page is read, which covers
 * the releases a pending upgrade can span.
 */
public class GitHubApi {

	private static final Logger logger = LoggerFactory.getLogger(GitHubApi.class);

	static final String API_BASE_URL = "https://api.github.com";

	private final ApiClient client;

	private final ObjectMapper objectMapper;

	public GitHubApi(ApiClient client, ObjectMapper objectMapper) {
		this.client = client;
		this.objectMapper = objectMapper;
	}

	/**
	 * List the tags of a repository, newest first. GitHub reports no tag dates.
	 * @param owner account or organization
	 * @param repo repository name
	 * @return tags, or empty on failure
	 */
	public Optional<List<TagInfo>> getTags(String owner, String repo) {
		String url = API_BASE_URL + "/repos/" + owner + "/" + repo + "/tags?per_page=100";
		try {
			JsonNode nodes = objectMapper.readTree(client.getBody(url));
			List<TagInfo> tags = new ArrayList<>();
			for (JsonNode node : nodes) {
				tags.add(new TagInfo(node.path("name").asText(""), null));
			}
			return Optional.of(tags);
		}
		catch (Exception e) {
			logger.error("Failed to get tags of {}/{}: {}", owner, repo, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * List the commits between two tags.
	 * @param owner account or organization
	 * @param repo repository name
	 * @param from older tag
	 * @param to newer tag
	 * @return commits oldest first, or empty on failure
	 */
	public Optional<List<Commit>> getCommitsBetweenTags(String owner, String repo, String from, String to) {
		String url = API_BASE_URL + "/repos/" + owner + "/" + repo + "/compare/" + encode(from) + "..."
				+ encode(to);
		try {
			JsonNode root = objectMapper.readTree(client.getBody(url));
			List<Commit> commits = new ArrayList<>();
			for (JsonNode node : root.path("commits")) {
				JsonNode commit = node.path("commit");
				commits.add(new Commit(firstLine(commit.path("message").asText("")),
						commit.path("author").path("date").asText(""), node.path("html_url").asText("")));
			}
			return Optional.of(commits);
		}
		catch (Exception e) {
			logger.error("Failed to compare {}...{} of {}/{}: {}", from, to, owner, repo, e.getMessage());
			return Optional.empty();
		}
	}

	public static String compareUrl(UpstreamTarget.GitHub target, String from, String to) {
		return target.webUrl() + "/compare/" + from + "..." + to;
	}

	static String firstLine(String message) {
		int newline = message.indexOf('\n');
		return newline >= 0 ? message.substring(0, newline).trim() : message.trim();
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
