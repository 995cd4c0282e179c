package io.github.archlog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitLabApi Tests")
class GitLabApiTest {

	private static final String PROJECT = GitLabApi.ARCH_API_BASE_URL
			+ "/projects/archlinux%2Fpackaging%2Fpackages%2Ffoo";

	private final StubApiClient client = new StubApiClient();

	private final GitLabApi api = new GitLabApi(client, ObjectMapperFactory.create(), 8);

	@Nested
	@DisplayName("Tag Tests")
	class TagTest {

		@Test
		@DisplayName("Should collect tags across pages")
		void shouldCollectTagsAcrossPages() {
			client.respond(PROJECT + "/repository/tags?per_page=100&page=1",
					new ApiResponse(200, "[{\"name\":\"1.3.0-1\",\"created_at\":\"2024-05-02T10:00:00Z\"}]",
							Map.of("Link", List.of("<" + PROJECT + "/repository/tags?page=2>; rel=\"next\""))));
			client.respond(PROJECT + "/repository/tags?page=2",
					"[{\"name\":\"1.2.0-1\",\"commit\":{\"created_at\":\"2024-04-01T10:00:00Z\"}}]");

			Optional<List<TagInfo>> tags = api.getTags(GitLabApi.ARCH_API_BASE_URL, "archlinux/packaging/packages/foo");

			assertThat(tags).hasValueSatisfying(list -> {
				assertThat(list).extracting(TagInfo::name).containsExactly("1.3.0-1", "1.2.0-1");
				assertThat(list.get(1).createdAt()).isEqualTo("2024-04-01T10:00:00Z");
			});
		}

		@Test
		@DisplayName("Should return empty on failure")
		void shouldReturnEmptyOnFailure() {
			assertThat(api.getTags(GitLabApi.ARCH_API_BASE_URL, "archlinux/packaging/packages/foo")).isEmpty();
		}

	}

	@Nested
	@DisplayName("Compare Tests")
	class CompareTest {

		@Test
		@DisplayName("Should parse commits and diffs")
		void shouldParseCompare() {
			client.respond(PROJECT + "/repository/compare?from=1.2.0-1&to=1.3.0-1", """
					{"commits": [{"title": "upgpkg: 1.3.0-1", "created_at": "2024-05-02T10:00:00Z",
					  "web_url": "https://gitlab.archlinux.org/archlinux/packaging/packages/foo/-/commit/abc"}],
					 "diffs": [{"old_path": ".SRCINFO", "new_path": ".SRCINFO", "diff": "-a\\n+b"}]}
					""");

			Optional<GitLabApi.CompareResult> result = api.compare(GitLabApi.ARCH_API_BASE_URL,
					"archlinux/packaging/packages/foo", "1.2.0-1", "1.3.0-1");

			assertThat(result).isPresent();
			assertThat(result.get().commits()).extracting(Commit::title).containsExactly("upgpkg: 1.3.0-1");
			assertThat(result.get().diffOf(".SRCINFO")).isPresent();
			assertThat(result.get().diffOf("PKGBUILD")).isEmpty();
		}

		@Test
		@DisplayName("Should return empty when comparison fails")
		void shouldReturnEmptyOnFailure() {
			client.fail(PROJECT + "/repository/compare?from=a&to=b", 500);

			assertThat(api.compare(GitLabApi.ARCH_API_BASE_URL, "archlinux/packaging/packages/foo", "a", "b"))
				.isEmpty();
		}

	}

	@Nested
	@DisplayName("File And Project Tests")
	class FileAndProjectTest {

		@Test
		@DisplayName("Should read raw file content")
		void shouldReadRawFile() {
			client.respond(PROJECT + "/repository/files/.nvchecker.toml/raw?ref=main", "[foo]\nsource = \"github\"");

			assertThat(api.getFileContent(GitLabApi.ARCH_API_BASE_URL, "archlinux/packaging/packages/foo",
					".nvchecker.toml", "main"))
				.contains("[foo]\nsource = \"github\"");
		}

		@Test
		@DisplayName("Should report missing file as empty")
		void shouldReportMissingFile() {
			assertThat(api.getFileContent(GitLabApi.ARCH_API_BASE_URL, "archlinux/packaging/packages/foo",
					".nvchecker.toml", "main"))
				.isEmpty();
		}

		@Test
		@DisplayName("Should probe project existence")
		void shouldProbeProject() {
			client.respond("https://invent.kde.org/api/v4/projects/plasma%2Fkwin", "{}");

			assertThat(api.projectExists("https://invent.kde.org/api/v4", "plasma/kwin")).isTrue();
			assertThat(api.projectExists("https://invent.kde.org/api/v4", "games/kwin")).isFalse();
		}

		@Test
		@DisplayName("Should build packaging web URL")
		void shouldBuildPackagingWebUrl() {
			assertThat(GitLabApi.archPackageWebUrl("foo"))
				.isEqualTo("https://gitlab.archlinux.org/archlinux/packaging/packages/foo");
		}

	}

}
