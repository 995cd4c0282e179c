package io.github.archlog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitHubApi Tests")
class GitHubApiTest {

	private final StubApiClient client = new StubApiClient();

	private final GitHubApi api = new GitHubApi(client, ObjectMapperFactory.create());

	@Test
	@DisplayName("Should list tag names")
	void shouldListTags() {
		client.respond("https://api.github.com/repos/owner/foo/tags?per_page=100",
				"[{\"name\":\"v1.3.0\"},{\"name\":\"v1.2.0\"}]");

		assertThat(api.getTags("owner", "foo"))
			.hasValueSatisfying(tags -> assertThat(tags).extracting(TagInfo::name).containsExactly("v1.3.0", "v1.2.0"));
	}

	@Test
	@DisplayName("Should use first line of commit messages")
	void shouldUseFirstLineOfCommitMessage() {
		client.respond("https://api.github.com/repos/owner/foo/compare/v1.2.0...v1.3.0", """
				{"commits": [{"html_url": "https://github.com/owner/foo/commit/abc",
				  "commit": {"message": "Fix parser\\n\\nLonger description", "author": {"date": "2024-05-01T00:00:00Z"}}}]}
				""");

		assertThat(api.getCommitsBetweenTags("owner", "foo", "v1.2.0", "v1.3.0")).hasValueSatisfying(commits -> {
			assertThat(commits).hasSize(1);
			assertThat(commits.get(0).title()).isEqualTo("Fix parser");
			assertThat(commits.get(0).webUrl()).isEqualTo("https://github.com/owner/foo/commit/abc");
		});
	}

	@Test
	@DisplayName("Should return empty on failed comparison")
	void shouldReturnEmptyOnFailure() {
		client.fail("https://api.github.com/repos/owner/foo/compare/a...b", 403);

		assertThat(api.getCommitsBetweenTags("owner", "foo", "a", "b")).isEmpty();
	}

	@Test
	@DisplayName("Should build compare URL")
	void shouldBuildCompareUrl() {
		assertThat(GitHubApi.compareUrl(new UpstreamTarget.GitHub("owner", "foo"), "v1", "v2"))
			.isEqualTo("https://github.com/owner/foo/compare/v1...v2");
	}

}
