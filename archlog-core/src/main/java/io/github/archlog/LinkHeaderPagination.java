package io.github.archlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches every page of a JSON array endpoint.
 *
 * <p>
 * Follows the {@code rel="next"} relation of the {@code Link} header. Without a Link
 * header the next page is requested by number until a page has fewer items than
 * {@code per_page}. At most {@code maxPages} pages are fetched. Items are returned in
 * request order.
 */
public class LinkHeaderPagination {

	private static final Logger logger = LoggerFactory.getLogger(LinkHeaderPagination.class);

	public static final int DEFAULT_MAX_PAGES = 8;

	private final ApiClient client;

	private final ObjectMapper objectMapper;

	private final int maxPages;

	public LinkHeaderPagination(ApiClient client, ObjectMapper objectMapper, int maxPages) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.maxPages = maxPages;
	}

	/**
	 * Fetch all pages of {@code url}.
	 * @param url endpoint URL without paging parameters
	 * @param perPage requested page size
	 * @return items of all pages
	 * @throws ApiException if a page request fails
	 * @throws JsonProcessingException if a page is not valid JSON
	 */
	public List<JsonNode> fetchAll(String url, int perPage) throws JsonProcessingException {
		List<JsonNode> items = new ArrayList<>();
		String next = pageUrl(url, perPage, 1);
		int page = 1;

		while (next != null && page <= maxPages) {
			ApiResponse response = client.get(next);
			JsonNode array = objectMapper.readTree(response.body());
			if (!array.isArray()) {
				logger.warn("Expected a JSON array from {}, stopping pagination", next);
				break;
			}
			array.forEach(items::add);
			logger.debug("Fetched page {} of {} ({} items)", page, url, array.size());

			if (response.hasLinkHeader()) {
				next = response.nextLink();
			}
			else if (array.size() < perPage) {
				next = null;
			}
			else {
				next = pageUrl(url, perPage, page + 1);
			}
			page++;
		}

		if (next != null) {
			logger.info("Stopped pagination of {} after {} pages", url, maxPages);
		}
		return items;
	}

	static String pageUrl(String url, int perPage, int page) {
		String separator = url.contains("?") ? "&" : "?";
		return url + separator + "per_page=" + perPage + "&page=" + page;
	}

}
