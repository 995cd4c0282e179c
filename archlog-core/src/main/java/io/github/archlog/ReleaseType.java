package io.github.archlog;

/**
 * Classification of a version transition.
 *
 * <p>
 * {@link #MINOR} means only the packaging changed, {@link #MAJOR} means the upstream code
 * changed. {@link #ARCH} marks packaging-repository entries collected alongside a major
 * transition. {@link #UNKNOWN} is used when no comparison applies.
 */
public enum ReleaseType {

	MINOR("minor"),

	MAJOR("major"),

	ARCH("arch"),

	UNKNOWN("unknown");

	private final String value;

	ReleaseType(String value) {
		this.value = value;
	}

	/**
	 * Returns the lowercase name used in the changelog document.
	 * @return json value
	 */
	public String value() {
		return value;
	}

	/**
	 * Whether entries of this type belong to the packaging side of a changelog.
	 * @return true for {@link #MINOR} and {@link #ARCH}
	 */
	public boolean isPackagingSide() {
		return this == MINOR || this == ARCH;
	}

	public static ReleaseType classify(boolean mainEqual, boolean suffixEqual) {
		if (!mainEqual) {
			return MAJOR;
		}
		if (!suffixEqual) {
			return MINOR;
		}
		return UNKNOWN;
	}

	/**
	 * Classify the transition from {@code from} to {@code to}. Epoch and upstream version
	 * are compared as one unit, so {@code 1-25.0.4-1 -> 1-25.0.4-2} is {@link #MINOR} and an
	 * epoch change is {@link #MAJOR}.
	 * @param from older tag
	 * @param to newer tag
	 * @return {@link #MAJOR}, {@link #MINOR} or {@link #UNKNOWN} if both are equal
	 */
	public static ReleaseType classify(VersionTag from, VersionTag to) {
		return classify(from.sameReleasedVersion(to), from.samePackageRelease(to));
	}

}
