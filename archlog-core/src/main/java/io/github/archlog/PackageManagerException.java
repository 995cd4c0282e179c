package io.github.archlog;

/**
 * Thrown when a local package manager tool ({@code checkupdates}, {@code pacman}) cannot
 * be run or fails.
 */
public class PackageManagerException extends RuntimeException {

	public PackageManagerException(String message) {
		super(message);
	}

	public PackageManagerException(String message, Throwable cause) {
		super(message, cause);
	}

}
