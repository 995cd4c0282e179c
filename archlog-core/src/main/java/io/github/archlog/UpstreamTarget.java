package io.github.archlog;

import org.jspecify.annotations.Nullable;

/**
 * The upstream hosting location of a package, resolved once per package by
 * {@link UpstreamSourceResolver}.
 *
 * <p>
 * Exactly one of the nested variants is produced per resolution.
 */
public interface UpstreamTarget {

	/**
	 * Returns a short human readable description for log messages.
	 * @return description
	 */
	String describe();

	/**
	 * A GitHub repository.
	 *
	 * @param owner account or organization
	 * @param repo repository name
	 */
	record GitHub(String owner, String repo) implements UpstreamTarget {

		public String webUrl() {
			return "https://github.com/" + owner + "/" + repo;
		}

		@Override
		public String describe() {
			return "GitHub " + owner + "/" + repo;
		}

	}

	/**
	 * A project on a GitLab instance ({@code gitlab.com} or {@code gitlab.<sub>.<tld>}).
	 *
	 * @param subdomain instance name between {@code gitlab.} and the TLD, null for
	 * gitlab.com
	 * @param tld top level domain, e.g. {@code org}
	 * @param projectPath groups and subgroups, e.g. {@code xorg/lib}
	 * @param repo repository name
	 */
	record GitLab(@Nullable String subdomain, String tld, String projectPath, String repo) implements UpstreamTarget {

		public String host() {
			return subdomain != null ? "gitlab." + subdomain + "." + tld : "gitlab." + tld;
		}

		public String apiBaseUrl() {
			return "https://" + host() + "/api/v4";
		}

		public String projectFullPath() {
			return projectPath + "/" + repo;
		}

		public String webUrl() {
			return "https://" + host() + "/" + projectFullPath();
		}

		@Override
		public String describe() {
			return "GitLab " + host() + "/" + projectFullPath();
		}

	}

	/**
	 * A project on KDE's GitLab instance {@code invent.kde.org}.
	 *
	 * @param category KDE group, e.g. {@code plasma}
	 * @param repo repository name
	 */
	record KdeInvent(String category, String repo) implements UpstreamTarget {

		public static final String HOST = "invent.kde.org";

		public static final String API_BASE_URL = "https://" + HOST + "/api/v4";

		public String projectFullPath() {
			return category + "/" + repo;
		}

		public String webUrl() {
			return "https://" + HOST + "/" + projectFullPath();
		}

		@Override
		public String describe() {
			return "KDE Invent " + projectFullPath();
		}

	}

	/**
	 * No static upstream location is known. The upstream source is read per comparison from
	 * the packaging recipe diff.
	 */
	record GenericDiff() implements UpstreamTarget {

		@Override
		public String describe() {
			return "recipe source diff";
		}

	}

}
