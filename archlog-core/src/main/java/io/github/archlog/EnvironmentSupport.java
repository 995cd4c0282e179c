package io.github.archlog;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Looks up the optional platform access tokens.
 *
 * <p>
 * Dotenv consults the process environment before its file, so a variable exported in the
 * shell wins over {@code ./.env}, which wins over {@code ~/.env}. Both files are read once.
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	public static final String GITLAB_TOKEN = "GITLAB_TOKEN";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Get an optional token.
	 * @param name the variable name
	 * @return the trimmed value, or an empty string if not set
	 */
	public static String token(String name) {
		String value = get(name);
		return value != null ? value.trim() : "";
	}

}
