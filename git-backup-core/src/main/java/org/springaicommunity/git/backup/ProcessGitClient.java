package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link GitClient} backed by {@link ProcessBuilder}.
 *
 * <p>
 * Standard output and error are drained on separate threads. Credential prompts are
 * disabled through {@code GIT_TERMINAL_PROMPT=0}.
 */
public class ProcessGitClient implements GitClient {

	private static final Logger logger = LoggerFactory.getLogger(ProcessGitClient.class);

	private static final AtomicInteger READER_COUNTER = new AtomicInteger();

	// blocking pipe reads stay off the common pool
	private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(runnable -> {
		Thread thread = new Thread(runnable, "git-output-" + READER_COUNTER.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	});

	private final String gitBinary;

	private final Duration timeout;

	/**
	 * @param gitBinary name or path of the git executable
	 * @param timeout maximum run time per invocation; {@link Duration#ZERO} disables it
	 */
	public ProcessGitClient(String gitBinary, Duration timeout) {
		if (timeout.isNegative()) {
			throw new IllegalArgumentException("Git timeout must not be negative: " + timeout);
		}
		this.gitBinary = gitBinary;
		this.timeout = timeout;
	}

	public ProcessGitClient() {
		this("git", Duration.ZERO);
	}

	@Override
	public GitCommandResult execute(@Nullable Path workingDirectory, String... args) {
		List<String> maskedArgs = Arrays.stream(args).map(CloneUrls::mask).toList();
		String printable = "git " + String.join(" ", maskedArgs);
		List<String> command = new ArrayList<>(args.length + 1);
		command.add(gitBinary);
		command.addAll(Arrays.asList(args));

		ProcessBuilder builder = new ProcessBuilder(command);
		if (workingDirectory != null) {
			builder.directory(workingDirectory.toFile());
		}
		builder.environment().put("GIT_TERMINAL_PROMPT", "0");

		logger.debug("Running {}{}", printable, workingDirectory != null ? " in " + workingDirectory : "");
		long start = System.currentTimeMillis();
		Process process;
		try {
			process = builder.start();
		}
		catch (IOException e) {
			throw new GitCommandException("Failed to start " + printable + ": " + e.getMessage(), maskedArgs, e);
		}

		CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()),
				OUTPUT_READERS);
		CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()),
				OUTPUT_READERS);
		try {
			process.getOutputStream().close();
			if (timeout.isZero()) {
				process.waitFor();
			}
			else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
				throw new GitCommandException(printable + " timed out after " + timeout.toSeconds() + "s", maskedArgs,
						null);
			}
			GitCommandResult result = new GitCommandResult(maskedArgs, process.exitValue(), stdout.get(),
					stderr.get());
			logger.debug("{} exited with {} in {}ms", printable, result.exitCode(),
					System.currentTimeMillis() - start);
			return result;
		}
		catch (InterruptedException e) {
			process.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new GitCommandException(printable + " interrupted", maskedArgs, e);
		}
		catch (ExecutionException e) {
			throw new GitCommandException("Failed to read output of " + printable, maskedArgs, e.getCause());
		}
		catch (IOException e) {
			throw new GitCommandException("Failed to close stdin of " + printable, maskedArgs, e);
		}
	}

	private static String drain(InputStream stream) {
		try (InputStream in = stream) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

}
