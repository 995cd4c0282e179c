package io.github.archlog;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Fetches and parses plain HTML pages (cgit logs, apps.kde.org).
 *
 * <p>
 * Requests go through a client with its own retry policy (3 attempts, fixed delay).
 */
public class WebScraper {

	private static final Logger logger = LoggerFactory.getLogger(WebScraper.class);

	private final ApiClient client;

	public WebScraper(ApiClient client) {
		this.client = client;
	}

	/**
	 * Fetch and parse a page.
	 * @param url page URL
	 * @return parsed document, or empty if the page could not be fetched
	 */
	public Optional<Document> fetchDocument(String url) {
		try {
			String html = client.getBody(url);
			return Optional.of(Jsoup.parse(html, url));
		}
		catch (ApiException e) {
			logger.error("Failed to fetch content from {}: {}", url, e.getMessage());
			return Optional.empty();
		}
	}

}
