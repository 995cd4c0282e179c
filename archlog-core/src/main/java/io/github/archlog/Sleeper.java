package io.github.archlog;

/**
 * Blocks the calling thread between retry attempts. Replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper THREAD = millis -> {
		try {
			Thread.sleep(millis);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ApiException("Retry interrupted", e);
		}
	};

	void sleep(long millis);

}
