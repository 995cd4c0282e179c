package io.github.archlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ChangelogWriter Tests")
class ChangelogWriterTest {

	private static final String ARCH_COMPARE = "https://gitlab.archlinux.org/archlinux/packaging/packages/foo/-/compare/";

	private final ObjectMapper mapper = ObjectMapperFactory.create();

	private final ChangelogWriter writer = new ChangelogWriter(mapper,
			Clock.fixed(Instant.parse("2024-05-01T09:07:00Z"), ZoneOffset.UTC));

	private static PackageChangelog changelog(String base, List<ChangelogEntry> entries) {
		return new PackageChangelog("foo", "Foo tool", base, "1.2.0-1", "1.3.0-1", entries, ResolutionState.DONE,
				null);
	}

	private static ChangelogEntry entry(String message, String versionTag, ReleaseType type, String compareUrl) {
		return new ChangelogEntry(message, "https://example.org/" + message, versionTag, "foo", type, compareUrl);
	}

	@Nested
	@DisplayName("Document Tests")
	class DocumentTest {

		@Test
		@DisplayName("Should group packaging and origin commits by version tag")
		void shouldGroupByVersionTag() {
			JsonNode document = writer.toDocument(List.of(changelog("foo-base",
					List.of(entry("upgpkg", "1.3.0-1", ReleaseType.ARCH, ARCH_COMPARE + "1.2.0-1...1.3.0-1"),
							entry("feature", "1.3.0-1", ReleaseType.MAJOR,
									"https://github.com/owner/foo/compare/v1.2.0...v1.3.0")))));

			assertThat(document.path("packages").get(0).asText()).isEqualTo("foo");
			JsonNode pkg = document.path("changelog").path("foo");
			assertThat(pkg.path("base package").asText()).isEqualTo("foo-base");
			assertThat(pkg.path("versions")).hasSize(1);

			JsonNode version = pkg.path("versions").get(0);
			assertThat(version.path("version-tag").asText()).isEqualTo("1.3.0-1");
			assertThat(version.path("release-type").asText()).isEqualTo("major");
			assertThat(version.path("compare-url-tags-arch").asText()).isEqualTo(ARCH_COMPARE + "1.2.0-1...1.3.0-1");
			assertThat(version.path("compare-url-tags-origin").asText())
				.isEqualTo("https://github.com/owner/foo/compare/v1.2.0...v1.3.0");
			assertThat(version.path("changelog").path("changelog Arch package").get(0).path("commit message").asText())
				.isEqualTo("upgpkg");
			assertThat(version.path("changelog").path("changelog origin package").get(0).path("commit URL").asText())
				.isEqualTo("https://example.org/feature");
		}

		@Test
		@DisplayName("Should mark minor release as not applicable upstream")
		void shouldMarkMinorRelease() {
			JsonNode document = writer.toDocument(List.of(changelog(null,
					List.of(entry("rebuild", "1.2.0-2", ReleaseType.MINOR, ARCH_COMPARE + "1.2.0-1...1.2.0-2")))));

			JsonNode pkg = document.path("changelog").path("foo");
			JsonNode version = pkg.path("versions").get(0);
			assertThat(pkg.path("base package").asText()).isEqualTo("-");
			assertThat(version.path("release-type").asText()).isEqualTo("minor");
			assertThat(version.path("compare-url-tags-origin").asText()).isEqualTo(ChangelogWriter.NOT_APPLICABLE);
			assertThat(version.path("changelog").path("changelog origin package").get(0).asText())
				.isEqualTo(ChangelogWriter.NOT_APPLICABLE);
		}

		@Test
		@DisplayName("Should flag missing origin changelog")
		void shouldFlagMissingOrigin() {
			JsonNode document = writer.toDocument(List.of(changelog("foo",
					List.of(entry("upgpkg", "1.3.0-1", ReleaseType.ARCH, ARCH_COMPARE + "1.2.0-1...1.3.0-1")))));

			JsonNode version = document.path("changelog").path("foo").path("versions").get(0);
			assertThat(version.path("changelog").path("changelog origin package").get(0).asText())
				.isEqualTo(ChangelogWriter.ORIGIN_MISSING);
		}

		@Test
		@DisplayName("Should write unknown group for package without entries")
		void shouldWriteUnknownGroup() {
			JsonNode document = writer.toDocument(List.of(changelog("foo", List.of())));

			JsonNode version = document.path("changelog").path("foo").path("versions").get(0);
			assertThat(version.path("version-tag").asText()).isEqualTo("1.2.0-1");
			assertThat(version.path("release-type").asText()).isEqualTo("unknown");
		}

	}

	@Test
	@DisplayName("Should write timestamped file into created directory")
	void shouldWriteTimestampedFile(@TempDir Path tempDir) throws Exception {
		Path file = writer.writeToDirectory(tempDir.resolve("changelog"), List.of(changelog("foo", List.of())));

		assertThat(file.getFileName().toString()).isEqualTo("20240501-0907-changelog.json");
		assertThat(mapper.readTree(Files.readString(file)).path("packages").get(0).asText()).isEqualTo("foo");
	}

}
