package org.springaicommunity.git.backup;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Source of every backup setting and provider token. Both {@code .env} files are read once
 * per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 *
 * <p>
 * Secrets mounted as files (Docker and Kubernetes secrets) are supported through
 * {@link #getOrFile(String)}: when {@code NAME} is unset and {@code NAME_FILE} names a
 * readable file, the file content is used.
 */
public final class EnvironmentSupport {

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
	 * Get an environment variable value.
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
	 * Get an environment variable, falling back to the content of the file named by
	 * {@code <name>_FILE}.
	 * @param name the variable name
	 * @return the value, or {@code null} if neither variable is set
	 * @throws UncheckedIOException if {@code <name>_FILE} is set but cannot be read
	 */
	@Nullable
	public static String getOrFile(String name) {
		return resolveOrFile(EnvironmentSupport::get, name);
	}

	/**
	 * Same as {@link #getOrFile(String)} against an arbitrary lookup function.
	 */
	@Nullable
	static String resolveOrFile(Function<String, @Nullable String> lookup, String name) {
		String value = lookup.apply(name);
		if (value != null && !value.isEmpty()) {
			return value;
		}
		String file = lookup.apply(name + "_FILE");
		if (file == null || file.isBlank()) {
			return value;
		}
		try {
			return Files.readString(Path.of(file.trim()), StandardCharsets.UTF_8).strip();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + name + "_FILE: " + file, e);
		}
	}

}
