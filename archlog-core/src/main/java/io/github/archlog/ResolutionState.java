package io.github.archlog;

/**
 * Steps of the per-package changelog resolution.
 */
public enum ResolutionState {

	RESOLVE_REPOSITORY,

	RESOLVE_UPSTREAM,

	BUILD_TAG_INDEX,

	NO_INTERMEDIATE,

	WALK_INTERMEDIATE,

	DONE,

	FAILED

}
