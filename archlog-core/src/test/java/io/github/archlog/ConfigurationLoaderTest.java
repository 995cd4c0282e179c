package io.github.archlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConfigurationLoader Tests")
class ConfigurationLoaderTest {

	private final ObjectMapper mapper = ObjectMapperFactory.create();

	private final ConfigurationLoader loader = new ConfigurationLoader(mapper);

	@Nested
	@DisplayName("Loading Tests")
	class LoadingTest {

		@Test
		@DisplayName("Should create default file when missing")
		void shouldCreateDefaultFile(@TempDir Path tempDir) throws Exception {
			Path configFile = tempDir.resolve("archlog").resolve("config.json");

			ArchlogProperties properties = loader.load(configFile);

			assertThat(configFile).exists();
			assertThat(properties.getEnabledRepositories()).containsExactly("core", "extra", "multilib");
			assertThat(properties.getMaxAttempts()).isEqualTo(3);
			assertThat(properties.getConfigDir()).isEqualTo(configFile.toAbsolutePath().getParent());

			JsonNode paths = mapper.readTree(configFile.toFile()).path("paths");
			assertThat(paths.has("changelog-dir")).isTrue();
			assertThat(paths.has("config-dir")).isFalse();
		}

		@Test
		@DisplayName("Should keep user values and add missing keys")
		void shouldMergeMissingKeys(@TempDir Path tempDir) throws Exception {
			Path configFile = tempDir.resolve("config.json");
			Files.writeString(configFile, """
					{"architecture-wording": "Architektur", "webscraper-delay": 0.5, "custom": true,
					 "paths": {"changelog-dir": "/tmp/changes"}}
					""");

			ArchlogProperties properties = loader.load(configFile);

			assertThat(properties.getArchitectureWording()).isEqualTo("Architektur");
			assertThat(properties.getWebscraperDelay()).isEqualTo(Duration.ofMillis(500));
			assertThat(properties.getChangelogDir()).isEqualTo(Path.of("/tmp/changes"));

			JsonNode written = mapper.readTree(configFile.toFile());
			assertThat(written.path("max-attempts").asInt()).isEqualTo(3);
			assertThat(written.path("custom").asBoolean()).isTrue();
			assertThat(written.path("paths").has("logs-dir")).isTrue();
			assertThat(written.path("paths").path("changelog-dir").asText()).isEqualTo("/tmp/changes");
		}

		@Test
		@DisplayName("Should reject invalid values")
		void shouldRejectInvalidValues(@TempDir Path tempDir) throws Exception {
			Path configFile = tempDir.resolve("config.json");
			Files.writeString(configFile, "{\"max-attempts\": 0, \"fuzzy-match-threshold\": 150}");

			assertThatThrownBy(() -> loader.load(configFile)).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("max-attempts")
				.hasMessageContaining("fuzzy-match-threshold");
		}

		@Test
		@DisplayName("Should reject malformed JSON")
		void shouldRejectMalformedJson(@TempDir Path tempDir) throws Exception {
			Path configFile = tempDir.resolve("config.json");
			Files.writeString(configFile, "{ not json");

			assertThatThrownBy(() -> loader.load(configFile)).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Failed to load configuration");
		}

	}

	@Nested
	@DisplayName("Merge Tests")
	class MergeTest {

		@Test
		@DisplayName("Should report no change for complete configuration")
		void shouldReportNoChange() throws Exception {
			ObjectNode defaults = (ObjectNode) mapper.readTree("{\"a\": 1, \"b\": {\"c\": 2}}");
			ObjectNode config = (ObjectNode) mapper.readTree("{\"b\": {\"c\": 5}, \"a\": 3}");

			assertThat(ConfigurationLoader.merge(defaults, config)).isFalse();
			assertThat(config.path("b").path("c").asInt()).isEqualTo(5);
		}

		@Test
		@DisplayName("Should add nested keys in default order")
		void shouldAddNestedKeys() throws Exception {
			ObjectNode defaults = (ObjectNode) mapper.readTree("{\"a\": 1, \"b\": {\"c\": 2, \"d\": 3}}");
			ObjectNode config = (ObjectNode) mapper.readTree("{\"b\": {\"c\": 5}}");

			assertThat(ConfigurationLoader.merge(defaults, config)).isTrue();
			assertThat(config.fieldNames()).toIterable().containsExactly("a", "b");
			assertThat(config.path("b").path("d").asInt()).isEqualTo(3);
		}

	}

	@Test
	@DisplayName("Should expand home directory")
	void shouldExpandHome() {
		String home = System.getProperty("user.home");

		assertThat(ConfigurationLoader.expandHome("~/archlog")).isEqualTo(Path.of(home + "/archlog"));
		assertThat(ConfigurationLoader.expandHome("/var/log")).isEqualTo(Path.of("/var/log"));
	}

}
