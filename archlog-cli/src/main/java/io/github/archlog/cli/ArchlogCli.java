package io.github.archlog.cli;

import io.github.archlog.ArchlogBuilder;
import io.github.archlog.ArchlogProperties;
import io.github.archlog.ArgumentParser;
import io.github.archlog.ChangelogEntry;
import io.github.archlog.ChangelogService;
import io.github.archlog.ConfigurationLoader;
import io.github.archlog.ObjectMapperFactory;
import io.github.archlog.PackageChangelog;
import io.github.archlog.PackageManagerException;
import io.github.archlog.ParsedConfiguration;
import io.github.archlog.PacmanClient;
import io.github.archlog.UpgradeCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * archlog command line application.
 *
 * <p>
 * Lists the pending upgrades reported by {@code checkupdates}, lets the user pick
 * packages, collects their packaging and upstream changelogs and writes them to a JSON
 * file in the changelog directory.
 *
 * <p>
 * Usage: java -jar archlog-cli.jar [OPTIONS]
 *
 * <p>
 * Environment Variables: GITHUB_TOKEN, GITLAB_TOKEN - optional access tokens
 */
public class ArchlogCli {

	private static final Logger logger = LoggerFactory.getLogger(ArchlogCli.class);

	public static void main(String[] args) {
		int exitCode;
		try {
			exitCode = run(args);
		}
		catch (Exception e) {
			logger.error("Changelog collection failed: {}", e.getMessage());
			exitCode = 1;
		}
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) throws IOException {
		return run(args, System.in, System.out);
	}

	static int run(String[] args, InputStream in, PrintStream out) throws IOException {
		ArgumentParser argumentParser = new ArgumentParser(new ArchlogProperties());

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			out.println("Run with --help for usage.");
			return 1;
		}

		Path configFile = config.configFile != null ? ConfigurationLoader.expandHome(config.configFile)
				: ConfigurationLoader.defaultConfigFile();
		ArchlogProperties properties;
		try {
			properties = new ConfigurationLoader(ObjectMapperFactory.create()).load(configFile);
		}
		catch (IllegalStateException e) {
			logger.error(e.getMessage());
			return 1;
		}
		LoggingSetup.configure(properties.getLogsDir(), config.verbose);
		Path outputDir = config.outputDir != null ? ConfigurationLoader.expandHome(config.outputDir)
				: properties.getChangelogDir();

		logConfiguration(configFile, properties, outputDir);

		ArchlogBuilder builder = ArchlogBuilder.create().properties(properties).tokensFromEnv();
		PacmanClient pacmanClient = builder.buildPacmanClient();

		List<UpgradeCandidate> upgrades;
		try {
			upgrades = pacmanClient.listUpgradable();
		}
		catch (PackageManagerException e) {
			logger.error("Could not list upgradable packages: {}", e.getMessage());
			return 1;
		}
		if (upgrades.isEmpty()) {
			out.println("No pending upgrades.");
			return 0;
		}

		List<UpgradeCandidate> selected;
		if (config.allPackages) {
			selected = upgrades;
		}
		else if (!config.packages.isEmpty()) {
			selected = PackageSelector.byNames(config.packages, upgrades);
		}
		else {
			out.print(PackageSelector.formatTable(upgrades));
			out.print("Packages to inspect (comma separated indices, 0 for all): ");
			out.flush();
			BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
			String line = reader.readLine();
			if (line == null) {
				logger.error("No selection given");
				return 1;
			}
			try {
				selected = PackageSelector.byIndices(line, upgrades);
			}
			catch (IllegalArgumentException e) {
				logger.error(e.getMessage());
				return 1;
			}
		}
		if (selected.isEmpty()) {
			out.println("No package selected.");
			return 0;
		}

		ChangelogService changelogService = builder.buildChangelogService();
		List<PackageChangelog> changelogs;
		try {
			changelogs = changelogService.collectAll(selected);
		}
		catch (PackageManagerException e) {
			logger.error("Package manager failed: {}", e.getMessage());
			return 1;
		}

		Path file = builder.buildChangelogWriter().writeToDirectory(outputDir, changelogs);
		printChangelogs(changelogs, out);
		logResults(changelogs, file);
		return 0;
	}

	private static void logConfiguration(Path configFile, ArchlogProperties properties, Path outputDir) {
		logger.debug("Configuration:");
		logger.debug("  Config file: {}", configFile);
		logger.debug("  Repositories: {}", properties.getEnabledRepositories());
		logger.debug("  Output directory: {}", outputDir);
		logger.debug("  Logs directory: {}", properties.getLogsDir());
	}

	private static void printChangelogs(List<PackageChangelog> changelogs, PrintStream out) {
		for (PackageChangelog changelog : changelogs) {
			out.println();
			out.println(changelog.name() + " " + changelog.currentVersion() + " -> " + changelog.newVersion());
			if (!changelog.isDone()) {
				out.println("  FAILED: " + changelog.failureReason());
			}
			String currentTag = null;
			for (ChangelogEntry entry : changelog.entries()) {
				if (!entry.versionTag().equals(currentTag)) {
					currentTag = entry.versionTag();
					out.println("  [" + currentTag + "]");
				}
				out.println("    " + entry.message());
				out.println("      " + entry.url());
			}
		}
	}

	private static void logResults(List<PackageChangelog> changelogs, Path file) {
		long done = changelogs.stream().filter(PackageChangelog::isDone).count();
		logger.info("Collected {} of {} changelogs", done, changelogs.size());
		logger.info("Changelog written to {}", file);
	}

}
