package io.github.archlog;

/**
 * A locally installed package with a newer version available, as reported by
 * {@code checkupdates}.
 *
 * @param name package name
 * @param currentVersion installed version
 * @param newVersion available version
 */
public record UpgradeCandidate(String name, String currentVersion, String newVersion) {

}
