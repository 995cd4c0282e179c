package io.github.archlog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RecipeSourceExtractor Tests")
class RecipeSourceExtractorTest {

	private final RecipeSourceExtractor extractor = new RecipeSourceExtractor(0.8);

	@ParameterizedTest(name = "{0}")
	@CsvSource({
			"'	source = git+https://github.com/owner/foo.git#tag=v1.2.0', https://github.com/owner/foo",
			"'	source = https://github.com/owner/foo/archive/v1.2.0/foo-1.2.0.tar.gz', https://github.com/owner/foo",
			"'	source = git+https://gitlab.gnome.org/GNOME/mutter.git#tag=47.0', https://gitlab.gnome.org/GNOME/mutter",
			"'	source = https://gitlab.freedesktop.org/xorg/lib/libx11/-/archive/1.8/libx11-1.8.tar.gz', https://gitlab.freedesktop.org/xorg/lib/libx11",
			"'	source = git+https://git.kernel.org/pub/scm/utils/foo.git/?signed#tag=1.0', https://git.kernel.org/pub/scm/utils/foo" })
	@DisplayName("Should reduce source line to base repository URL")
	void shouldExtractBaseUrl(String source, String expected) {
		assertThat(RecipeSourceExtractor.extractBaseGitUrl(source)).isEqualTo(expected);
	}

	@Nested
	@DisplayName("Tag Extraction Tests")
	class TagExtractionTest {

		@Test
		@DisplayName("Should read tag fragment")
		void shouldReadTagFragment() {
			assertThat(RecipeSourceExtractor.extractTag("source = git+https://host/foo.git#tag=v1.2.0?signed"))
				.isEqualTo("v1.2.0");
		}

		@Test
		@DisplayName("Should read archive path segment")
		void shouldReadArchivePath() {
			assertThat(RecipeSourceExtractor.extractTag("source = https://github.com/o/foo/archive/v1.2.0.tar.gz"))
				.isEqualTo("v1.2.0.tar.gz");
		}

		@Test
		@DisplayName("Should return null without tag")
		void shouldReturnNullWithoutTag() {
			assertThat(RecipeSourceExtractor.extractTag("source = https://example.org/foo.tar.gz")).isNull();
		}

	}

	@Nested
	@DisplayName("Diff Extraction Tests")
	class DiffExtractionTest {

		@Test
		@DisplayName("Should pair removed and added source lines")
		void shouldExtractSourceChange() {
			String diff = String.join("\n", "@@ -1,5 +1,5 @@", "-\tpkgver = 1.2.0",
					"-\tsource = git+https://git.example.org/foo.git#tag=1.2.0", "+\tpkgver = 1.3.0",
					"+\tsource = git+https://git.example.org/foo.git#tag=1.3.0");

			Optional<RecipeSourceExtractor.SourceChange> change = extractor.extract(diff);

			assertThat(change).isPresent();
			assertThat(change.get().oldBaseUrl()).isEqualTo("https://git.example.org/foo");
			assertThat(change.get().newBaseUrl()).isEqualTo("https://git.example.org/foo");
			assertThat(change.get().oldTag()).isEqualTo("1.2.0");
			assertThat(change.get().newTag()).isEqualTo("1.3.0");
			assertThat(change.get().hasTags()).isTrue();
		}

		@Test
		@DisplayName("Should reject switched upstream project")
		void shouldRejectDissimilarUrls() {
			String diff = String.join("\n", "-\tsource = git+https://github.com/owner/foo.git#tag=1.2.0",
					"+\tsource = https://downloads.sourceforge.net/project/other/bar-2.0.tar.xz");

			assertThat(extractor.extract(diff)).isEmpty();
		}

		@Test
		@DisplayName("Should return empty when source did not change")
		void shouldReturnEmptyWithoutSourceChange() {
			assertThat(extractor.extract("-\tpkgrel = 1\n+\tpkgrel = 2")).isEmpty();
		}

	}

}
