package io.github.archlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 */
public class ProcessCommandRunner implements CommandRunner {

	private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

	@Override
	public CommandResult run(List<String> command) {
		logger.debug("Running {}", String.join(" ", command));
		try {
			Process process = new ProcessBuilder(command).start();
			CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
			String stdout = read(process.getInputStream());
			int exitCode = process.waitFor();
			return new CommandResult(exitCode, stdout, stderr.join());
		}
		catch (IOException e) {
			throw new PackageManagerException("Cannot run '" + command.get(0) + "': " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PackageManagerException("Interrupted while running '" + command.get(0) + "'", e);
		}
	}

	private static String read(InputStream stream) {
		try (InputStream in = stream) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new PackageManagerException("Failed to read command output: " + e.getMessage(), e);
		}
	}

}
