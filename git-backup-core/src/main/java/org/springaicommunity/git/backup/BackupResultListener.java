package org.springaicommunity.git.backup;

/**
 * Receives the aggregate result at the end of every backup run.
 */
@FunctionalInterface
public interface BackupResultListener {

	/**
	 * Called once per run, after all providers have finished. Exceptions thrown here are
	 * logged and do not affect the run result.
	 */
	void onRunComplete(BackupRunResult result);

}
