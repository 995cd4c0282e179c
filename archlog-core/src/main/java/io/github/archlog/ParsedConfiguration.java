package io.github.archlog;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Package selection
	public boolean allPackages = false;

	public List<String> packages = new ArrayList<>();

	// Locations, null = from the configuration file
	public @Nullable String configFile = null;

	public @Nullable String outputDir = null;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	/**
	 * Whether the packages were chosen on the command line, so no interactive selection
	 * is needed.
	 * @return true for {@code --all} or {@code --packages}
	 */
	public boolean hasSelection() {
		return allPackages || !packages.isEmpty();
	}

}
