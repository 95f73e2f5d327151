package org.springaicommunity.git.backup;

import java.util.List;

/**
 * Outcome of one {@code git} invocation.
 *
 * @param command the arguments passed to git, with credentials masked
 * @param exitCode process exit code
 * @param stdout standard output, decoded as UTF-8
 * @param stderr standard error, decoded as UTF-8
 */
public record GitCommandResult(List<String> command, int exitCode, String stdout, String stderr) {

	public GitCommandResult {
		command = List.copyOf(command);
	}

	public boolean isSuccess() {
		return exitCode == 0;
	}

	/**
	 * Throw a {@link GitCommandException} unless the command exited with status zero.
	 * @return this result, for chaining
	 */
	public GitCommandResult orThrow() {
		if (!isSuccess()) {
			throw new GitCommandException(this);
		}
		return this;
	}

}
