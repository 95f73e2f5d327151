package org.springaicommunity.git.backup;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one backup run across all configured providers.
 *
 * @param startedAt when the run began
 * @param finishedAt when the last provider finished
 * @param providers per-provider results, in run order
 */
public record BackupRunResult(Instant startedAt, Instant finishedAt, List<ProviderBackupResult> providers) {

	public BackupRunResult {
		providers = List.copyOf(providers);
	}

	public long succeeded() {
		return providers.stream().mapToLong(ProviderBackupResult::succeeded).sum();
	}

	public long failed() {
		return providers.stream().mapToLong(ProviderBackupResult::failed).sum();
	}

	public boolean hasFailures() {
		return failed() > 0;
	}

}
