package io.github.archlog;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A successful HTTP response.
 *
 * @param statusCode HTTP status code
 * @param body response body
 * @param headers response headers
 */
public record ApiResponse(int statusCode, String body, Map<String, List<String>> headers) {

	private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");

	public ApiResponse {
		headers = Map.copyOf(headers);
	}

	public static ApiResponse ok(String body) {
		return new ApiResponse(200, body, Map.of());
	}

	/**
	 * Returns the first value of a header, ignoring the header name's case.
	 * @param name header name
	 * @return header value if present
	 */
	public Optional<String> firstHeader(String name) {
		for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
				return Optional.of(entry.getValue().get(0));
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns the target of the {@code rel="next"} relation of the {@code Link} header.
	 * @return next page URL, or null if the header is absent or has no next relation
	 */
	@Nullable
	public String nextLink() {
		return firstHeader("Link").map(ApiResponse::parseNextLink).orElse(null);
	}

	public boolean hasLinkHeader() {
		return firstHeader("Link").isPresent();
	}

	@Nullable
	static String parseNextLink(String linkHeader) {
		for (String relation : linkHeader.split(",")) {
			Matcher matcher = NEXT_LINK.matcher(relation.trim());
			if (matcher.find()) {
				return matcher.group(1);
			}
		}
		return null;
	}

}
