package io.github.archlog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Decorator that adds bounded retries to an {@link ApiClient}.
 *
 * <p>
 * Which failures are retried and how long to wait is decided by a per-platform
 * {@link RetryPolicy}. No sleep happens after the last attempt. Non-retryable and
 * exhausted failures are logged and rethrown.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * ApiClient github = RetryingApiClient.builder()
 *     .wrapping(HttpApiClient.forGitHub(timeout, token))
 *     .policy(RetryPolicy.rateLimited())
 *     .maxAttempts(3)
 *     .build();
 * }
 * </pre>
 */
public final class RetryingApiClient implements ApiClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingApiClient.class);

	private final ApiClient delegate;

	private final RetryPolicy policy;

	private final int maxAttempts;

	private final int backoffFactor;

	private final Sleeper sleeper;

	private final Clock clock;

	private RetryingApiClient(Builder builder) {
		this.delegate = builder.delegate;
		this.policy = builder.policy;
		this.maxAttempts = builder.maxAttempts;
		this.backoffFactor = builder.backoffFactor;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ApiResponse get(String url) {
		String description = "GET " + url;
		ApiException lastException = null;

		for (int attempt = 0; attempt < maxAttempts; attempt++) {
			try {
				return delegate.get(url);
			}
			catch (ApiException e) {
				lastException = e;

				if (!policy.isRetryable(e)) {
					if (e.isNotFound()) {
						logger.debug("{} not found", description);
					}
					else {
						logger.error("{} failed with status {}: {}", description, e.getStatusCode(), e.getMessage());
						logger.debug("{} response body: {}", description, e.getResponseBody());
					}
					throw e;
				}

				if (attempt < maxAttempts - 1) {
					long waitMs = policy.waitMillis(e, attempt, backoffFactor, clock.instant().getEpochSecond());
					logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
							maxAttempts, e.getMessage(), waitMs);
					sleeper.sleep(waitMs);
				}
			}
		}

		logger.error("{} failed after {} attempts with status {}: {}", description, maxAttempts,
				lastException.getStatusCode(), lastException.getMessage());
		throw lastException;
	}

	/**
	 * Builder for {@link RetryingApiClient}.
	 *
	 * <p>
	 * Defaults: 3 attempts, backoff factor 2, {@link RetryPolicy#standard()}.
	 */
	public static class Builder {

		private @Nullable ApiClient delegate;

		private RetryPolicy policy = RetryPolicy.standard();

		private int maxAttempts = 3;

		private int backoffFactor = 2;

		private Sleeper sleeper = Sleeper.THREAD;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the client to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(ApiClient client) {
			this.delegate = client;
			return this;
		}

		public Builder policy(RetryPolicy policy) {
			this.policy = policy;
			return this;
		}

		/**
		 * Set the total number of attempts per call.
		 * @param maxAttempts attempts including the first one (default: 3)
		 * @return this builder
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		/**
		 * Set the exponential backoff base in seconds.
		 * @param backoffFactor base (default: 2, giving 1s, 2s, 4s ...)
		 * @return this builder
		 */
		public Builder backoffFactor(int backoffFactor) {
			this.backoffFactor = backoffFactor;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the client.
		 * @return configured client
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingApiClient build() {
			if (delegate == null) {
				throw new IllegalStateException("An ApiClient to wrap is required. Call wrapping() first.");
			}
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			if (backoffFactor < 1) {
				throw new IllegalStateException("backoffFactor must be positive");
			}
			return new RetryingApiClient(this);
		}

	}

}
