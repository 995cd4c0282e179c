package io.github.archlog.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ArchlogCli Tests")
class ArchlogCliTest {

	private final ByteArrayOutputStream output = new ByteArrayOutputStream();

	private int run(String... args) throws Exception {
		return ArchlogCli.run(args, new ByteArrayInputStream(new byte[0]),
				new PrintStream(output, true, StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("Should print help and exit successfully")
	void shouldPrintHelp() throws Exception {
		assertThat(run("--help")).isZero();
		assertThat(output.toString(StandardCharsets.UTF_8)).contains("Usage: archlog");
	}

	@Test
	@DisplayName("Should exit with 1 on invalid arguments")
	void shouldFailOnInvalidArguments() throws Exception {
		assertThat(run("--unknown")).isEqualTo(1);
		assertThat(output.toString(StandardCharsets.UTF_8)).contains("--help");
	}

}
