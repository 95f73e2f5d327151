package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Configuration properties for a backup run.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitBackupBuilder}.
 * {@link ProviderSettings} fills them from the environment; command-line options
 * override individual values.
 */
public class BackupProperties {

	public static final int DEFAULT_BACKUPS_TO_RETAIN = 2;

	public static final int DEFAULT_WORKER_COUNT = 10;

	/**
	 * Root directory receiving all bundles. Required.
	 */
	@Nullable
	private String backupDir;

	/**
	 * Bundles kept per repository when a provider sets no retention of its own.
	 */
	private int defaultBackupsToRetain = DEFAULT_BACKUPS_TO_RETAIN;

	/**
	 * Concurrent repository backups per provider.
	 */
	private int workerCount = DEFAULT_WORKER_COUNT;

	/**
	 * Pause between GitHub worker launches, to stay clear of secondary rate limits.
	 */
	private Duration gitHubWorkerDelay = Duration.ofMillis(500);

	/**
	 * Maximum run time of a single git command; zero disables the limit.
	 */
	private Duration gitCommandTimeout = Duration.ofMinutes(60);

	/**
	 * Name or path of the git executable.
	 */
	private String gitBinary = "git";

	/**
	 * Timeout of a single provider API request.
	 */
	private Duration httpRequestTimeout = Duration.ofSeconds(300);

	/**
	 * Retries of a failed provider API request.
	 */
	private int httpMaxRetries = 2;

	/**
	 * First delay between API retries; doubles on each attempt up to
	 * {@link #httpRetryMaxDelay}.
	 */
	private Duration httpRetryInitialDelay = Duration.ofSeconds(60);

	private Duration httpRetryMaxDelay = Duration.ofSeconds(120);

	/**
	 * Compare mode applied to every provider, overriding per-provider settings.
	 */
	@Nullable
	private DiffMode diffModeOverride;

	/**
	 * Retention applied to every provider, overriding per-provider settings.
	 */
	@Nullable
	private Integer backupsToRetainOverride;

	/**
	 * URL receiving a JSON summary after each run.
	 */
	@Nullable
	private String webhookUrl;

	/**
	 * Webhook payload format: {@code long} includes per-repository results, {@code short}
	 * only the counts.
	 */
	private String webhookFormat = "long";

	private boolean verbose = false;

	@Nullable
	public String getBackupDir() {
		return backupDir;
	}

	public void setBackupDir(@Nullable String backupDir) {
		this.backupDir = backupDir;
	}

	public int getDefaultBackupsToRetain() {
		return defaultBackupsToRetain;
	}

	public void setDefaultBackupsToRetain(int defaultBackupsToRetain) {
		this.defaultBackupsToRetain = defaultBackupsToRetain;
	}

	public int getWorkerCount() {
		return workerCount;
	}

	public void setWorkerCount(int workerCount) {
		this.workerCount = workerCount;
	}

	public Duration getGitHubWorkerDelay() {
		return gitHubWorkerDelay;
	}

	public void setGitHubWorkerDelay(Duration gitHubWorkerDelay) {
		this.gitHubWorkerDelay = gitHubWorkerDelay;
	}

	public Duration getGitCommandTimeout() {
		return gitCommandTimeout;
	}

	public void setGitCommandTimeout(Duration gitCommandTimeout) {
		this.gitCommandTimeout = gitCommandTimeout;
	}

	public String getGitBinary() {
		return gitBinary;
	}

	public void setGitBinary(String gitBinary) {
		this.gitBinary = gitBinary;
	}

	public Duration getHttpRequestTimeout() {
		return httpRequestTimeout;
	}

	public void setHttpRequestTimeout(Duration httpRequestTimeout) {
		this.httpRequestTimeout = httpRequestTimeout;
	}

	public int getHttpMaxRetries() {
		return httpMaxRetries;
	}

	public void setHttpMaxRetries(int httpMaxRetries) {
		this.httpMaxRetries = httpMaxRetries;
	}

	public Duration getHttpRetryInitialDelay() {
		return httpRetryInitialDelay;
	}

	public void setHttpRetryInitialDelay(Duration httpRetryInitialDelay) {
		this.httpRetryInitialDelay = httpRetryInitialDelay;
	}

	public Duration getHttpRetryMaxDelay() {
		return httpRetryMaxDelay;
	}

	public void setHttpRetryMaxDelay(Duration httpRetryMaxDelay) {
		this.httpRetryMaxDelay = httpRetryMaxDelay;
	}

	@Nullable
	public DiffMode getDiffModeOverride() {
		return diffModeOverride;
	}

	public void setDiffModeOverride(@Nullable DiffMode diffModeOverride) {
		this.diffModeOverride = diffModeOverride;
	}

	@Nullable
	public Integer getBackupsToRetainOverride() {
		return backupsToRetainOverride;
	}

	public void setBackupsToRetainOverride(@Nullable Integer backupsToRetainOverride) {
		this.backupsToRetainOverride = backupsToRetainOverride;
	}

	@Nullable
	public String getWebhookUrl() {
		return webhookUrl;
	}

	public void setWebhookUrl(@Nullable String webhookUrl) {
		this.webhookUrl = webhookUrl;
	}

	public String getWebhookFormat() {
		return webhookFormat;
	}

	public void setWebhookFormat(String webhookFormat) {
		this.webhookFormat = webhookFormat;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
