package io.github.archlog;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the KDE Invent group of a KDE project.
 *
 * <p>
 * KDE upstream URLs rarely name the repository group ({@code https://apps.kde.org/ark/},
 * {@code https://kde.org/plasma-desktop/}). The group is taken from, in this order: a
 * known category contained in the URL, a project lookup per known category on
 * {@code invent.kde.org}, the category link of the project page on {@code apps.kde.org}.
 */
public class KdeCategoryResolver {

	private static final Logger logger = LoggerFactory.getLogger(KdeCategoryResolver.class);

	public static final List<String> CATEGORIES = List.of("plasma", "frameworks", "utilities", "libraries", "system",
			"graphics", "accessibility", "education", "games", "multimedia", "network", "office", "pim", "sdk");

	static final String APPS_BASE_URL = "https://apps.kde.org/";

	private final GitLabApi gitLabApi;

	private final WebScraper webScraper;

	public KdeCategoryResolver(GitLabApi gitLabApi, WebScraper webScraper) {
		this.gitLabApi = gitLabApi;
		this.webScraper = webScraper;
	}

	/**
	 * Resolve the KDE Invent project of a package.
	 * @param upstreamUrl upstream URL on a {@code kde.org} host
	 * @param repo repository name, the packaging search name
	 * @return the project, or empty if no category could be determined
	 */
	public Optional<UpstreamTarget.KdeInvent> resolve(String upstreamUrl, String repo) {
		Optional<String> category = categoryInUrl(upstreamUrl);
		if (category.isPresent()) {
			logger.debug("KDE category {} found in {}", category.get(), upstreamUrl);
			return Optional.of(new UpstreamTarget.KdeInvent(category.get(), repo));
		}

		for (String candidate : CATEGORIES) {
			if (gitLabApi.projectExists(UpstreamTarget.KdeInvent.API_BASE_URL, candidate + "/" + repo)) {
				logger.debug("KDE project {}/{} found on {}", candidate, repo, UpstreamTarget.KdeInvent.HOST);
				return Optional.of(new UpstreamTarget.KdeInvent(candidate, repo));
			}
		}

		category = categoryFromAppsPage(repo);
		if (category.isPresent()) {
			return Optional.of(new UpstreamTarget.KdeInvent(category.get(), repo));
		}

		logger.warn("Couldn't determine the KDE category of {} ({})", repo, upstreamUrl);
		return Optional.empty();
	}

	static Optional<String> categoryInUrl(String url) {
		String lower = url.toLowerCase(Locale.ROOT);
		return CATEGORIES.stream().filter(lower::contains).findFirst();
	}

	private Optional<String> categoryFromAppsPage(String repo) {
		String url = APPS_BASE_URL + repo;
		Optional<Document> document = webScraper.fetchDocument(url);
		if (document.isEmpty()) {
			return Optional.empty();
		}

		for (Element link : document.get().select("a[href^=/categories/]")) {
			Optional<String> category = categoryInUrl(link.attr("href") + " " + link.text());
			if (category.isPresent()) {
				logger.debug("KDE category {} found on {}", category.get(), url);
				return category;
			}
		}
		logger.debug("No known KDE category linked from {}", url);
		return Optional.empty();
	}

}
