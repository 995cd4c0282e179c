package io.github.archlog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.Assumptions.assumeThat;

@DisplayName("EnvironmentSupport Tests")
class EnvironmentSupportTest {

	private static final String MISSING = "ARCHLOG_TEST_VARIABLE_THAT_IS_NEVER_SET";

	@Test
	@DisplayName("Should return null for unknown variable")
	void shouldReturnNullForUnknownVariable() {
		assertThat(EnvironmentSupport.get(MISSING)).isNull();
	}

	@Test
	@DisplayName("Should return empty token for unknown variable")
	void shouldReturnEmptyToken() {
		assertThat(EnvironmentSupport.token(MISSING)).isEmpty();
	}

	@Test
	@DisplayName("Should resolve system environment variables")
	void shouldResolveSystemEnvironment() {
		String path = System.getenv("PATH");
		assumeThat(path).isNotNull();

		assertThat(EnvironmentSupport.get("PATH")).isNotNull();
	}

}
