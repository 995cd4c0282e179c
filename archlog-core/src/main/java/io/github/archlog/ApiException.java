package io.github.archlog;

/**
 * Exception thrown when a hosting platform request fails.
 *
 * <p>
 * Carries the retry hints of the response ({@code retry-after},
 * {@code x-ratelimit-remaining}, {@code x-ratelimit-reset}) so that
 * {@link RetryingApiClient} can choose its wait time. A status code of -1 denotes a
 * network failure without response.
 */
public class ApiException extends RuntimeException {

	private final int statusCode;

	private final String responseBody;

	private final long retryAfterSeconds;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	public ApiException(String message, int statusCode, String responseBody) {
		this(message, statusCode, responseBody, -1, -1, -1);
	}

	public ApiException(String message, int statusCode, String responseBody, long retryAfterSeconds,
			int rateLimitRemaining, long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.retryAfterSeconds = retryAfterSeconds;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public ApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = "";
		this.retryAfterSeconds = -1;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getResponseBody() {
		return responseBody;
	}

	/**
	 * Returns the {@code retry-after} value in seconds.
	 * @return seconds, or -1 if the header was absent
	 */
	public long getRetryAfterSeconds() {
		return retryAfterSeconds;
	}

	/**
	 * Returns the {@code x-ratelimit-reset} epoch timestamp.
	 * @return epoch seconds, or -1 if the header was absent
	 */
	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	public boolean isNetworkError() {
		return statusCode == -1;
	}

	/**
	 * Whether the platform rejected the request because the rate limit is exhausted.
	 * @return true for 429, and for 403 with {@code x-ratelimit-remaining: 0}
	 */
	public boolean isRateLimitError() {
		return statusCode == 429 || (statusCode == 403 && rateLimitRemaining == 0);
	}

	public boolean isNotFound() {
		return statusCode == 404;
	}

}
