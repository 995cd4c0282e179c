package io.github.archlog.cli;

import io.github.archlog.UpgradeCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the user's choice into the list of upgrades to inspect.
 *
 * <p>
 * Interactive input is a comma separated list of 1-based indices into the displayed
 * table; {@code 0} selects every package.
 */
final class PackageSelector {

	private static final Logger logger = LoggerFactory.getLogger(PackageSelector.class);

	private PackageSelector() {
	}

	/**
	 * Select by indices as typed by the user.
	 * @param input raw input line
	 * @param upgrades displayed upgrades
	 * @return selected upgrades in table order
	 * @throws IllegalArgumentException for non-numeric or out of range indices
	 */
	static List<UpgradeCandidate> byIndices(String input, List<UpgradeCandidate> upgrades) {
		Set<Integer> indices = new LinkedHashSet<>();
		for (String part : input.split(",")) {
			String trimmed = part.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			int index;
			try {
				index = Integer.parseInt(trimmed);
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid index '" + trimmed + "': must be a number");
			}
			if (index < 0 || index > upgrades.size()) {
				throw new IllegalArgumentException(
						"Invalid index " + index + ": must be between 0 and " + upgrades.size());
			}
			if (index == 0) {
				return List.copyOf(upgrades);
			}
			indices.add(index);
		}
		if (indices.isEmpty()) {
			throw new IllegalArgumentException("No package selected");
		}
		List<UpgradeCandidate> selected = new ArrayList<>();
		for (int i = 0; i < upgrades.size(); i++) {
			if (indices.contains(i + 1)) {
				selected.add(upgrades.get(i));
			}
		}
		return selected;
	}

	/**
	 * Select by package names. Names without a pending upgrade are skipped with a warning.
	 * @param names requested package names
	 * @param upgrades upgradable packages
	 * @return selected upgrades in request order
	 */
	static List<UpgradeCandidate> byNames(List<String> names, List<UpgradeCandidate> upgrades) {
		List<UpgradeCandidate> selected = new ArrayList<>();
		for (String name : names) {
			upgrades.stream()
				.filter(upgrade -> upgrade.name().equals(name))
				.findFirst()
				.ifPresentOrElse(selected::add, () -> logger.warn("No pending upgrade for package {}", name));
		}
		return selected;
	}

	/**
	 * Render the upgrade table with aligned columns.
	 * @param upgrades upgradable packages
	 * @return table text, one line per package
	 */
	static String formatTable(List<UpgradeCandidate> upgrades) {
		int indexWidth = String.valueOf(upgrades.size()).length();
		int nameWidth = "Package".length();
		int currentWidth = "Current".length();
		for (UpgradeCandidate upgrade : upgrades) {
			nameWidth = Math.max(nameWidth, upgrade.name().length());
			currentWidth = Math.max(currentWidth, upgrade.currentVersion().length());
		}
		String format = "%" + indexWidth + "s  %-" + nameWidth + "s  %-" + currentWidth + "s  %s%n";

		StringBuilder table = new StringBuilder();
		table.append(String.format(format, "#", "Package", "Current", "New"));
		for (int i = 0; i < upgrades.size(); i++) {
			UpgradeCandidate upgrade = upgrades.get(i);
			table.append(String.format(format, i + 1, upgrade.name(), upgrade.currentVersion(), upgrade.newVersion()));
		}
		return table.toString();
	}

}
