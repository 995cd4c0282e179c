package io.github.archlog;

import java.util.List;

/**
 * Runs a local command and captures its output. Replaceable in tests.
 */
public interface CommandRunner {

	/**
	 * Run a command to completion.
	 * @param command program and arguments
	 * @return exit code and standard output
	 * @throws PackageManagerException if the program cannot be started
	 */
	CommandResult run(List<String> command);

	/**
	 * Outcome of a finished command.
	 *
	 * @param exitCode process exit code
	 * @param stdout standard output
	 * @param stderr standard error
	 */
	record CommandResult(int exitCode, String stdout, String stderr) {

		public boolean isSuccess() {
			return exitCode == 0;
		}

	}

}
