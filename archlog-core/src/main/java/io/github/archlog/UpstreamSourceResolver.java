package io.github.archlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides where the upstream history of a package lives.
 *
 * <p>
 * Rules are tried in order, the first match wins:
 * <ol>
 * <li>a GitLab host ({@code gitlab} in the host name) or {@code invent.kde.org}</li>
 * <li>{@code github.com}</li>
 * <li>any other {@code kde.org} host, through {@link KdeCategoryResolver}</li>
 * <li>anything else: {@link UpstreamTarget.GenericDiff}, the source is read per comparison
 * from the recipe diff</li>
 * </ol>
 */
public class UpstreamSourceResolver {

	private static final Logger logger = LoggerFactory.getLogger(UpstreamSourceResolver.class);

	private final KdeCategoryResolver kdeCategoryResolver;

	public UpstreamSourceResolver(KdeCategoryResolver kdeCategoryResolver) {
		this.kdeCategoryResolver = kdeCategoryResolver;
	}

	/**
	 * Resolve the upstream target of a package.
	 * @param upstreamUrl upstream URL from {@code .nvchecker.toml} or the registry
	 * @param packageName packaging search name, used as repository name for KDE projects
	 * @return the target, or empty if the URL is on a hosting platform but names no
	 * supported project, or a KDE project could not be located
	 */
	public Optional<UpstreamTarget> resolve(String upstreamUrl, String packageName) {
		String host = host(upstreamUrl);
		if (isGitLabHost(host) || isGitHubHost(host)) {
			Optional<UpstreamTarget> hosted = resolveHosted(upstreamUrl);
			if (hosted.isPresent()) {
				logger.debug("Upstream of {} is {}", packageName, hosted.get().describe());
			}
			else {
				logger.warn("Upstream URL {} of {} names no supported project", upstreamUrl, packageName);
			}
			return hosted;
		}

		if (host.equals("kde.org") || host.endsWith(".kde.org")) {
			return kdeCategoryResolver.resolve(upstreamUrl, packageName).map(UpstreamTarget.class::cast);
		}

		logger.debug("No hosting platform recognized in '{}' for {}, using recipe source diff", upstreamUrl,
				packageName);
		return Optional.of(new UpstreamTarget.GenericDiff());
	}

	/**
	 * Apply only the GitLab and GitHub rules. Used for source URLs read from recipes.
	 * @param url repository URL
	 * @return the target, or empty if the URL is on neither platform
	 */
	public Optional<UpstreamTarget> resolveHosted(String url) {
		String host = host(url);
		if (isGitLabHost(host)) {
			return parseGitLab(url);
		}
		if (isGitHubHost(host)) {
			return parseGitHub(url);
		}
		return Optional.empty();
	}

	private static boolean isGitLabHost(String host) {
		return host.contains("gitlab") || host.equals(UpstreamTarget.KdeInvent.HOST);
	}

	private static boolean isGitHubHost(String host) {
		return host.equals("github.com") || host.equals("www.github.com");
	}

	/**
	 * Split a GitLab project URL. UI suffixes ({@code /-/tags}) and {@code .git} are
	 * removed.
	 * @param url e.g. {@code https://gitlab.freedesktop.org/xorg/lib/libXScrnSaver}
	 * @return a {@link UpstreamTarget.GitLab} or {@link UpstreamTarget.KdeInvent}, empty if the
	 * URL has no group and repository
	 */
	static Optional<UpstreamTarget> parseGitLab(String url) {
		String host = host(url);
		List<String> segments = pathSegments(url);
		int uiMarker = segments.indexOf("-");
		if (uiMarker >= 0) {
			segments = segments.subList(0, uiMarker);
		}
		if (segments.size() < 2) {
			logger.warn("GitLab URL {} has no project path", url);
			return Optional.empty();
		}

		String repo = NvcheckerConfigParser.stripGitSuffix(segments.get(segments.size() - 1));
		String projectPath = String.join("/", segments.subList(0, segments.size() - 1));

		if (host.equals(UpstreamTarget.KdeInvent.HOST)) {
			return Optional.of(new UpstreamTarget.KdeInvent(projectPath, repo));
		}

		String[] labels = host.split("\\.");
		if (labels.length < 2 || !labels[0].equals("gitlab")) {
			logger.warn("Unsupported GitLab host {} in {}", host, url);
			return Optional.empty();
		}
		String tld = labels[labels.length - 1];
		String subdomain = labels.length > 2 ? String.join(".", Arrays.copyOfRange(labels, 1, labels.length - 1))
				: null;
		return Optional.of(new UpstreamTarget.GitLab(subdomain, tld, projectPath, repo));
	}

	static Optional<UpstreamTarget> parseGitHub(String url) {
		List<String> segments = pathSegments(url);
		if (segments.size() < 2) {
			logger.warn("GitHub URL {} has no owner and repository", url);
			return Optional.empty();
		}
		return Optional.of(
				new UpstreamTarget.GitHub(segments.get(0), NvcheckerConfigParser.stripGitSuffix(segments.get(1))));
	}

	static String host(String url) {
		try {
			String host = URI.create(url.trim()).getHost();
			return host != null ? host.toLowerCase(Locale.ROOT) : "";
		}
		catch (IllegalArgumentException e) {
			logger.debug("Invalid URL '{}': {}", url, e.getMessage());
			return "";
		}
	}

	private static List<String> pathSegments(String url) {
		String path;
		try {
			path = URI.create(url.trim()).getPath();
		}
		catch (IllegalArgumentException e) {
			return List.of();
		}
		List<String> segments = new ArrayList<>();
		if (path != null) {
			for (String segment : path.split("/")) {
				if (!segment.isEmpty()) {
					segments.add(segment);
				}
			}
		}
		return segments;
	}

}
