package org.springaicommunity.git.backup;

import java.time.Duration;

/**
 * Backup settings shared by all provider implementations.
 *
 * @param diffMode change detection strategy
 * @param backupsToRetain bundles kept per repository, zero for all
 * @param workerCount concurrent repository backups
 * @param workerStartDelay pause between worker launches
 */
public record ProviderOptions(DiffMode diffMode, int backupsToRetain, int workerCount, Duration workerStartDelay) {

	public ProviderOptions {
		if (backupsToRetain < 0) {
			throw new IllegalArgumentException("backupsToRetain must not be negative: " + backupsToRetain);
		}
		if (workerCount <= 0) {
			throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
		}
		if (workerStartDelay.isNegative()) {
			throw new IllegalArgumentException("workerStartDelay must not be negative: " + workerStartDelay);
		}
	}

	public static ProviderOptions defaults() {
		return new ProviderOptions(DiffMode.CLONE, BackupProperties.DEFAULT_BACKUPS_TO_RETAIN,
				BackupProperties.DEFAULT_WORKER_COUNT, Duration.ZERO);
	}

}
