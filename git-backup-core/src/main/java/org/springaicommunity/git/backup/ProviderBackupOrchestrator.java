package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backs up all repositories of one provider with a fixed pool of worker threads.
 *
 * <p>
 * The repository list is fed through a bounded job queue followed by one end marker per
 * worker; results come back through a bounded result queue. The run is complete when one
 * result per repository has been collected. A failing repository never stops the others.
 */
public class ProviderBackupOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(ProviderBackupOrchestrator.class);

	private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

	private final BackupWorker worker;

	public ProviderBackupOrchestrator(BackupWorker worker) {
		this.worker = worker;
	}

	/**
	 * Back up every repository of a provider.
	 * @param provider provider to back up
	 * @return per-repository results, or a provider-level error when the repository list
	 * could not be retrieved
	 */
	public ProviderBackupResult backup(GitProvider provider) {
		String name = provider.name();
		List<Repository> repositories;
		try {
			repositories = provider.listRepositories();
		}
		catch (RuntimeException e) {
			logger.error("Failed to list {} repositories: {}", name, CloneUrls.mask(String.valueOf(e.getMessage())));
			return ProviderBackupResult.enumerationFailed(name, String.valueOf(e.getMessage()));
		}

		int total = repositories.size();
		if (total == 0) {
			logger.info("No {} repositories to back up", name);
			return ProviderBackupResult.completed(name, List.of());
		}

		int workerCount = provider.workerCount();
		logger.info("Backing up {} {} repositories with {} workers", total, name, workerCount);

		BlockingQueue<Job> jobs = new ArrayBlockingQueue<>(total + workerCount);
		BlockingQueue<RepoBackupResult> results = new ArrayBlockingQueue<>(workerCount);
		List<RepoBackupResult> collected = new ArrayList<>(total);
		ExecutorService pool = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory(name));
		try {
			for (int i = 0; i < workerCount; i++) {
				if (i > 0) {
					pause(provider.workerStartDelay());
				}
				pool.execute(() -> work(provider, jobs, results));
			}
			for (Repository repository : repositories) {
				jobs.put(new Job(repository));
			}
			for (int i = 0; i < workerCount; i++) {
				jobs.put(Job.END);
			}
			while (collected.size() < total) {
				collected.add(results.take());
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			pool.shutdownNow();
			logger.warn("{} backup interrupted after {}/{} repositories", name, collected.size(), total);
			return new ProviderBackupResult(name, collected, "interrupted after " + collected.size() + " of " + total
					+ " repositories");
		}
		finally {
			shutdown(pool, name);
		}

		ProviderBackupResult result = ProviderBackupResult.completed(name, collected);
		logger.info("{} backup finished: {} succeeded, {} failed", name, result.succeeded(), result.failed());
		return result;
	}

	private void work(GitProvider provider, BlockingQueue<Job> jobs, BlockingQueue<RepoBackupResult> results) {
		try {
			while (true) {
				Job job = jobs.take();
				Repository repository = job.repository();
				if (repository == null) {
					return;
				}
				results.put(backupOne(provider, repository));
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private RepoBackupResult backupOne(GitProvider provider, Repository repository) {
		try {
			return worker.backup(repository, provider.credentialedCloneUrl(repository), provider.diffMode(),
					provider.backupsToRetain());
		}
		catch (RuntimeException e) {
			return RepoBackupResult.failed(repository.identifier(), String.valueOf(e.getMessage()));
		}
		catch (Error e) {
			// every job taken from the queue must put exactly one result
			logger.error("Backup of {} aborted by {}", repository.identifier(), e.toString());
			return RepoBackupResult.failed(repository.identifier(), "aborted: " + e);
		}
	}

	private static void pause(Duration delay) throws InterruptedException {
		if (!delay.isZero()) {
			Thread.sleep(delay.toMillis());
		}
	}

	private static void shutdown(ExecutorService pool, String name) {
		pool.shutdown();
		try {
			if (!pool.awaitTermination(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
				logger.warn("{} workers did not stop within {}s", name, SHUTDOWN_TIMEOUT.toSeconds());
				pool.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			pool.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * A queued repository; a null repository marks the end of the jobs for one worker.
	 */
	private record Job(@Nullable Repository repository) {

		static final Job END = new Job(null);

	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final String prefix;

		private final AtomicInteger counter = new AtomicInteger();

		WorkerThreadFactory(String providerName) {
			this.prefix = providerName + "-backup-";
		}

		@Override
		public Thread newThread(Runnable runnable) {
			return new Thread(runnable, prefix + counter.incrementAndGet());
		}

	}

}
