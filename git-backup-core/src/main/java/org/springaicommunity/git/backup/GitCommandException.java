package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Thrown when a {@code git} subprocess fails, cannot be started, or runs past its
 * timeout.
 *
 * <p>
 * Messages never carry credentials: the command line and stderr are masked before the
 * exception is built.
 */
public class GitCommandException extends RuntimeException {

	private final List<String> command;

	private final int exitCode;

	private final String stderr;

	public GitCommandException(GitCommandResult result) {
		super(describe(result.command(), result.exitCode(), result.stderr()));
		this.command = result.command();
		this.exitCode = result.exitCode();
		this.stderr = CloneUrls.mask(result.stderr());
	}

	public GitCommandException(String message, List<String> command, @Nullable Throwable cause) {
		super(CloneUrls.mask(message), cause);
		this.command = List.copyOf(command);
		this.exitCode = -1;
		this.stderr = "";
	}

	private static String describe(List<String> command, int exitCode, String stderr) {
		String detail = stderr.strip();
		return CloneUrls.mask("git " + String.join(" ", command) + " exited with " + exitCode
				+ (detail.isEmpty() ? "" : ": " + detail));
	}

	public List<String> getCommand() {
		return command;
	}

	/**
	 * Process exit code, or -1 when the process never completed.
	 */
	public int getExitCode() {
		return exitCode;
	}

	public String getStderr() {
		return stderr;
	}

}
