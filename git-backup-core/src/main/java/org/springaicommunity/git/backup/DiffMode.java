package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * How a worker decides whether a repository needs a fresh clone.
 */
public enum DiffMode {

	/**
	 * Always clone, then rely on deduplication to drop unchanged bundles.
	 */
	CLONE,

	/**
	 * Compare the remote refs with the latest bundle first and skip the clone when they
	 * match.
	 */
	REFS;

	/**
	 * Parse a configuration value, ignoring case. Blank or null means {@link #CLONE}.
	 * @throws IllegalArgumentException for any other value
	 */
	public static DiffMode parse(@Nullable String value) {
		if (value == null || value.isBlank()) {
			return CLONE;
		}
		return switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "clone" -> CLONE;
			case "refs" -> REFS;
			default -> throw new IllegalArgumentException("Invalid compare mode '" + value + "': must be 'clone' or 'refs'");
		};
	}

}
