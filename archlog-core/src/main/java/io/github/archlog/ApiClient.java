package io.github.archlog;

/**
 * Interface for HTTP GET operations against a hosting platform.
 *
 * <p>
 * Provides the seam for decorators ({@link RetryingApiClient}) and for mocking in tests.
 * One instance is created per platform and reused for every call to it.
 */
public interface ApiClient {

	/**
	 * Execute a GET request.
	 * @param url absolute URL
	 * @return the successful response
	 * @throws ApiException if the request fails or answers with a non-2xx status
	 */
	ApiResponse get(String url);

	/**
	 * Execute a GET request and return only the body.
	 * @param url absolute URL
	 * @return response body
	 * @throws ApiException if the request fails or answers with a non-2xx status
	 */
	default String getBody(String url) {
		return get(url).body();
	}

}
