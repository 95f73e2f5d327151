package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Runs the {@code git} binary.
 *
 * <p>
 * Abstracts subprocess handling so that {@link GitService} can be tested without a git
 * installation.
 */
public interface GitClient {

	/**
	 * Run git synchronously.
	 * @param workingDirectory directory to run in, or null for the current one
	 * @param args git arguments, e.g. {@code "bundle", "list-heads", "x.bundle"}
	 * @return the structured result, whatever the exit code
	 * @throws GitCommandException if the process cannot be started, times out or is
	 * interrupted
	 */
	GitCommandResult execute(@Nullable Path workingDirectory, String... args);

}
