package io.github.archlog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-platform retry rules used by {@link RetryingApiClient}.
 *
 * <p>
 * Decides which failures are retried and how long to wait before the next attempt. The
 * wait is chosen in this order:
 * <ol>
 * <li>the {@code retry-after} header of the failed response</li>
 * <li>for 403 on a rate-limited platform, the seconds until {@code x-ratelimit-reset}</li>
 * <li>the fixed delay if one is configured, else {@code backoffFactor ^ attempt}
 * seconds</li>
 * </ol>
 */
public final class RetryPolicy {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	/**
	 * Maximum time to wait for a rate limit reset (1 hour). Longer waits fall back to the
	 * backoff delay.
	 */
	static final long MAX_RESET_WAIT_SECONDS = 3600;

	private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

	private final String name;

	private final Set<Integer> retryableStatusCodes;

	private final boolean rateLimitAware;

	private final @Nullable Duration fixedDelay;

	private RetryPolicy(String name, Set<Integer> retryableStatusCodes, boolean rateLimitAware,
			@Nullable Duration fixedDelay) {
		this.name = name;
		this.retryableStatusCodes = Set.copyOf(retryableStatusCodes);
		this.rateLimitAware = rateLimitAware;
		this.fixedDelay = fixedDelay;
	}

	/**
	 * Policy for platforms without primary rate-limit headers (Arch Linux registry,
	 * GitLab instances).
	 */
	public static RetryPolicy standard() {
		return new RetryPolicy("standard", TRANSIENT_STATUS_CODES, false, null);
	}

	/**
	 * Policy for GitHub: additionally retries 403 once the rate limit is exhausted and waits
	 * for its reset.
	 */
	public static RetryPolicy rateLimited() {
		Set<Integer> codes = new HashSet<>(TRANSIENT_STATUS_CODES);
		codes.add(403);
		return new RetryPolicy("rate-limited", codes, true, null);
	}

	/**
	 * Policy for the generic web scraper: transient statuses with a constant delay.
	 * @param delay delay between attempts
	 */
	public static RetryPolicy fixedDelay(Duration delay) {
		return new RetryPolicy("fixed-delay", TRANSIENT_STATUS_CODES, false, delay);
	}

	public boolean isRetryable(ApiException e) {
		if (e.isNetworkError()) {
			return true;
		}
		if (e.getStatusCode() == 403) {
			return retryableStatusCodes.contains(403) && e.isRateLimitError();
		}
		return retryableStatusCodes.contains(e.getStatusCode());
	}

	/**
	 * Compute the wait before the attempt following {@code attempt}.
	 * @param e failure of the current attempt
	 * @param attempt zero-based index of the failed attempt
	 * @param backoffFactor base of the exponential backoff
	 * @param nowEpochSeconds current time
	 * @return wait in milliseconds
	 */
	public long waitMillis(ApiException e, int attempt, int backoffFactor, long nowEpochSeconds) {
		if (e.getRetryAfterSeconds() >= 0) {
			return e.getRetryAfterSeconds() * 1000;
		}
		if (rateLimitAware && e.getStatusCode() == 403 && e.getResetEpochSeconds() > 0) {
			long waitSeconds = Math.max(0, e.getResetEpochSeconds() - nowEpochSeconds);
			if (waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						e.getResetEpochSeconds());
				return waitSeconds * 1000;
			}
			logger.warn("Rate limit reset is {} seconds away (> 1hr), using backoff instead", waitSeconds);
		}
		if (fixedDelay != null) {
			return fixedDelay.toMillis();
		}
		return (long) Math.pow(backoffFactor, attempt) * 1000;
	}

	@Override
	public String toString() {
		return "RetryPolicy[" + name + "]";
	}

}
