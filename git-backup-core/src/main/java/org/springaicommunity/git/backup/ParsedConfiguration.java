package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	@Nullable
	public String backupDir;

	// Overrides for every provider, null = use provider settings
	@Nullable
	public DiffMode diffMode;

	@Nullable
	public Integer backupsToRetain;

	public int workerCount;

	public Duration gitCommandTimeout;

	@Nullable
	public String webhookUrl;

	public String webhookFormat;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(BackupProperties defaultProperties) {
		this.backupDir = defaultProperties.getBackupDir();
		this.diffMode = defaultProperties.getDiffModeOverride();
		this.backupsToRetain = defaultProperties.getBackupsToRetainOverride();
		this.workerCount = defaultProperties.getWorkerCount();
		this.gitCommandTimeout = defaultProperties.getGitCommandTimeout();
		this.webhookUrl = defaultProperties.getWebhookUrl();
		this.webhookFormat = defaultProperties.getWebhookFormat();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Copy the parsed values onto a properties object.
	 * @param properties target
	 * @return the same properties, for chaining
	 */
	public BackupProperties applyTo(BackupProperties properties) {
		properties.setBackupDir(backupDir);
		properties.setDiffModeOverride(diffMode);
		properties.setBackupsToRetainOverride(backupsToRetain);
		properties.setWorkerCount(workerCount);
		properties.setGitCommandTimeout(gitCommandTimeout);
		properties.setWebhookUrl(webhookUrl);
		properties.setWebhookFormat(webhookFormat);
		properties.setVerbose(verbose);
		return properties;
	}

}
