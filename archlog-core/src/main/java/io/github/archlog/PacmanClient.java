package io.github.archlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Queries the local package manager.
 */
public class PacmanClient {

	private static final Logger logger = LoggerFactory.getLogger(PacmanClient.class);

	private static final Pattern UPGRADE_LINE = Pattern.compile("^(\\S+)\\s+(\\S+)\\s+->\\s+(\\S+)$");

	private final CommandRunner commandRunner;

	private final String architectureWording;

	public PacmanClient(CommandRunner commandRunner, String architectureWording) {
		this.commandRunner = commandRunner;
		this.architectureWording = architectureWording;
	}

	/**
	 * List pending upgrades with {@code checkupdates}.
	 * @return upgrade candidates, empty if the system is up to date
	 * @throws PackageManagerException if {@code checkupdates} is missing or fails
	 */
	public List<UpgradeCandidate> listUpgradable() {
		CommandRunner.CommandResult result = commandRunner.run(List.of("checkupdates"));
		// checkupdates exits with 2 when there are no updates
		if (result.exitCode() == 2) {
			return List.of();
		}
		if (!result.isSuccess()) {
			throw new PackageManagerException(
					"checkupdates failed with exit code " + result.exitCode() + ": " + result.stderr().trim());
		}
		return parseUpgrades(result.stdout());
	}

	static List<UpgradeCandidate> parseUpgrades(String output) {
		List<UpgradeCandidate> candidates = new ArrayList<>();
		for (String line : output.split("\n")) {
			String trimmed = line.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			Matcher matcher = UPGRADE_LINE.matcher(trimmed);
			if (matcher.matches()) {
				candidates.add(new UpgradeCandidate(matcher.group(1), matcher.group(2), matcher.group(3)));
			}
			else {
				logger.warn("Skipping unexpected checkupdates line: {}", trimmed);
			}
		}
		return candidates;
	}

	/**
	 * Read the architecture of an installed package from {@code pacman -Q --info}.
	 * @param packageName installed package
	 * @return architecture, e.g. {@code x86_64}, or empty if the package is not installed or
	 * the output has no line starting with the configured wording
	 * @throws PackageManagerException if {@code pacman} cannot be run
	 */
	public Optional<String> getArchitecture(String packageName) {
		CommandRunner.CommandResult result = commandRunner.run(List.of("pacman", "-Q", "--info", packageName));
		if (!result.isSuccess()) {
			logger.error("pacman -Q --info {} failed: {}", packageName, result.stderr().trim());
			return Optional.empty();
		}

		for (String line : result.stdout().split("\n")) {
			if (line.startsWith(architectureWording)) {
				int colon = line.indexOf(':');
				if (colon >= 0) {
					String architecture = line.substring(colon + 1).trim();
					logger.debug("Architecture of {}: {}", packageName, architecture);
					return Optional.of(architecture);
				}
			}
		}

		logger.error("Couldn't find the package architecture of {}. If your system language is not English, "
				+ "set 'architecture-wording' in the config file to the label shown by 'pacman -Q --info'",
				packageName);
		return Optional.empty();
	}

}
