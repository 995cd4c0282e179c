package io.github.archlog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the archlog application. Plain Java with no
 * framework dependencies so it can be tested in isolation.
 */
public class ArgumentParser {

	private final ArchlogProperties defaultProperties;

	public ArgumentParser(ArchlogProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-a", "--all":
					config.allPackages = true;
					break;

				case "-p", "--packages":
					String packageList = getRequiredValue(args, i, "packages");
					config.packages = Arrays.stream(packageList.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
					i++; // Skip next argument since we consumed it
					break;

				case "-c", "--config":
					config.configFile = getRequiredValue(args, i, "config");
					i++;
					break;

				case "-o", "--output-dir":
					config.outputDir = getRequiredValue(args, i, "output-dir");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: archlog [OPTIONS]\n");
		help.append("\n");
		help.append("Collect the changelogs of pending Arch Linux package upgrades.\n");
		help.append("Without a selection option the upgradable packages are listed and the\n");
		help.append("packages to inspect are read from standard input (indices, 0 for all).\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -a, --all               Collect changelogs of every upgradable package\n");
		help.append("    -p, --packages LIST     Comma-separated package names to collect\n");
		help.append("    -c, --config FILE       Configuration file (default: ")
			.append(defaultProperties.getConfigFile())
			.append(")\n");
		help.append("    -o, --output-dir DIR    Directory of the changelog file (default: ")
			.append(defaultProperties.getChangelogDir())
			.append(")\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("CONFIGURATION:\n");
		help.append("    The configuration file is created with defaults on first run\n");
		help.append("    Keys added in newer versions are merged into an existing file\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN           GitHub personal access token (optional, raises rate limits)\n");
		help.append("    GITLAB_TOKEN           GitLab personal access token (optional)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    archlog\n");
		help.append("    archlog --all --verbose\n");
		help.append("    archlog --packages linux,firefox --output-dir /tmp/changelogs\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int index, String optionName) {
		if (index + 1 >= args.length) {
			throw new IllegalArgumentException("Option --" + optionName + " requires a value");
		}
		String value = args[index + 1];
		if (value.startsWith("-")) {
			throw new IllegalArgumentException("Option --" + optionName + " requires a value, got option: " + value);
		}
		return value;
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.allPackages && !config.packages.isEmpty()) {
			errors.add("Options --all and --packages cannot be combined");
		}

		if (config.configFile != null && config.configFile.isBlank()) {
			errors.add("Configuration file path must not be blank");
		}

		if (config.outputDir != null && config.outputDir.isBlank()) {
			errors.add("Output directory must not be blank");
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration validation failed:\n" + String.join("\n", errors));
		}
	}

}
