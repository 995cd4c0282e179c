package io.github.archlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for one hosting platform using the JDK {@link HttpClient}.
 *
 * <p>
 * The underlying client is created once and reused for every request to the platform.
 * Non-2xx answers are turned into {@link ApiException} carrying the {@code retry-after}
 * and {@code x-ratelimit-*} headers of the response.
 */
public class HttpApiClient implements ApiClient {

	private static final Logger logger = LoggerFactory.getLogger(HttpApiClient.class);

	static final String USER_AGENT = "archlog";

	private final HttpClient httpClient;

	private final Map<String, String> defaultHeaders;

	private final Duration requestTimeout;

	public HttpApiClient(Duration requestTimeout) {
		this(requestTimeout, Map.of());
	}

	public HttpApiClient(Duration requestTimeout, Map<String, String> defaultHeaders) {
		this.requestTimeout = requestTimeout;
		this.defaultHeaders = new LinkedHashMap<>(defaultHeaders);
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Client for the GitHub REST API. The token is optional and only raises rate limits.
	 * @param requestTimeout per-request timeout
	 * @param token GitHub token, or blank for anonymous access
	 * @return configured client
	 */
	public static HttpApiClient forGitHub(Duration requestTimeout, String token) {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Accept", "application/vnd.github+json");
		if (!token.isBlank()) {
			headers.put("Authorization", "Bearer " + token);
		}
		return new HttpApiClient(requestTimeout, headers);
	}

	/**
	 * Client for GitLab instances.
	 * @param requestTimeout per-request timeout
	 * @param token GitLab token, or blank for anonymous access
	 * @return configured client
	 */
	public static HttpApiClient forGitLab(Duration requestTimeout, String token) {
		Map<String, String> headers = new LinkedHashMap<>();
		if (!token.isBlank()) {
			headers.put("PRIVATE-TOKEN", token);
		}
		return new HttpApiClient(requestTimeout, headers);
	}

	@Override
	public ApiResponse get(String url) {
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		URI uri;
		try {
			uri = URI.create(url);
		}
		catch (IllegalArgumentException e) {
			throw new ApiException("Invalid URL: " + url, 0, "");
		}
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(requestTimeout)
			.header("User-Agent", USER_AGENT);
		defaultHeaders.forEach(builder::header);
		HttpRequest request = builder.GET().build();

		try {
			ApiResponse response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.body().length());
			return response;
		}
		catch (ApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private ApiResponse executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return new ApiResponse(statusCode, response.body(), response.headers().map());
			}

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			long retryAfter = parseRetryAfter(response);
			String message = switch (statusCode) {
				case 401 -> "Unauthorized: " + request.uri() + ". Check your access token.";
				case 403 -> remaining == 0 ? "Rate limit exceeded. Resets at epoch: " + reset
						: "Forbidden: " + request.uri();
				case 404 -> "Not found: " + request.uri();
				case 429 -> "Too Many Requests (429): " + request.uri();
				default -> "HTTP error " + statusCode + ": " + request.uri();
			};
			throw new ApiException(message, statusCode, response.body(), retryAfter, remaining, reset);
		}
		catch (IOException e) {
			throw new ApiException("HTTP request failed: " + request.uri() + ": " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ApiException("HTTP request interrupted", e);
		}
	}

	/**
	 * Parses {@code retry-after} given either as delta seconds or as an HTTP date.
	 */
	static long parseRetryAfter(HttpResponse<?> response) {
		return response.headers().firstValue("Retry-After").map(HttpApiClient::parseRetryAfter).orElse(-1L);
	}

	static long parseRetryAfter(String value) {
		String trimmed = value.trim();
		try {
			return Math.max(0, Long.parseLong(trimmed));
		}
		catch (NumberFormatException e) {
			try {
				ZonedDateTime date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
				return Math.max(0, date.toEpochSecond() - Instant.now().getEpochSecond());
			}
			catch (DateTimeParseException ex) {
				logger.debug("Ignoring unparseable Retry-After header: {}", trimmed);
				return -1;
			}
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
