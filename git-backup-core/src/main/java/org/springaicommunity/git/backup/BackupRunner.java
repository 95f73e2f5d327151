package org.springaicommunity.git.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one backup across all configured providers.
 *
 * <p>
 * Providers are processed one after another, each through the
 * {@link ProviderBackupOrchestrator}. When every provider is done the scratch directory is
 * removed, a summary is logged and the listeners are notified.
 */
public class BackupRunner {

	private static final Logger logger = LoggerFactory.getLogger(BackupRunner.class);

	private final List<GitProvider> providers;

	private final ProviderBackupOrchestrator orchestrator;

	private final BackupWorker worker;

	private final List<BackupResultListener> listeners;

	private final Clock clock;

	public BackupRunner(List<GitProvider> providers, ProviderBackupOrchestrator orchestrator, BackupWorker worker,
			List<BackupResultListener> listeners, Clock clock) {
		this.providers = List.copyOf(providers);
		this.orchestrator = orchestrator;
		this.worker = worker;
		this.listeners = List.copyOf(listeners);
		this.clock = clock;
	}

	public List<GitProvider> getProviders() {
		return providers;
	}

	/**
	 * Back up every provider.
	 * @return the aggregate result; check {@link BackupRunResult#hasFailures()}
	 */
	public BackupRunResult run() {
		Instant startedAt = clock.instant();
		logger.info("Starting backup of {} provider(s) into {}", providers.size(), worker.getBackupRoot());

		List<ProviderBackupResult> results = new ArrayList<>(providers.size());
		for (GitProvider provider : providers) {
			try {
				results.add(orchestrator.backup(provider));
			}
			catch (RuntimeException e) {
				logger.error("{} backup aborted: {}", provider.name(), CloneUrls.mask(String.valueOf(e.getMessage())));
				results.add(ProviderBackupResult.enumerationFailed(provider.name(), String.valueOf(e.getMessage())));
			}
		}

		cleanWorkingRoot();

		BackupRunResult result = new BackupRunResult(startedAt, clock.instant(), results);
		logSummary(result);
		notifyListeners(result);
		return result;
	}

	private void cleanWorkingRoot() {
		try {
			FileTrees.deleteRecursively(worker.getWorkingRoot());
		}
		catch (RuntimeException e) {
			logger.warn("Failed to remove working directory {}: {}", worker.getWorkingRoot(), e.getMessage());
		}
	}

	private void logSummary(BackupRunResult result) {
		for (ProviderBackupResult provider : result.providers()) {
			if (provider.error() != null) {
				logger.error("{}: {}", provider.provider(), provider.error());
			}
			for (RepoBackupResult repo : provider.results()) {
				if (!repo.succeeded()) {
					logger.error("{}: {}", repo.repo(), repo.error());
				}
			}
		}
		logger.info("Backup complete: {} succeeded, {} failed", result.succeeded(), result.failed());
	}

	private void notifyListeners(BackupRunResult result) {
		for (BackupResultListener listener : listeners) {
			try {
				listener.onRunComplete(result);
			}
			catch (RuntimeException e) {
				logger.warn("Result listener {} failed: {}", listener.getClass().getSimpleName(),
						CloneUrls.mask(String.valueOf(e.getMessage())));
			}
		}
	}

}
