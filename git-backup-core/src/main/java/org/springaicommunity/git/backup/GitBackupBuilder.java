package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for wiring a backup run without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Everything from environment variables
 * BackupRunner runner = GitBackupBuilder.create()
 *     .settings(ProviderSettings.fromEnvironment())
 *     .buildRunner();
 * BackupRunResult result = runner.run();
 *
 * // Explicit providers, e.g. in tests
 * BackupRunner runner = GitBackupBuilder.create()
 *     .properties(props)
 *     .provider(myProvider)
 *     .gitClient(fakeGit)
 *     .buildRunner();
 * }
 * </pre>
 */
public class GitBackupBuilder {

	private BackupProperties properties;

	@Nullable
	private ProviderSettings settings;

	private final List<GitProvider> providers = new ArrayList<>();

	private final List<BackupResultListener> listeners = new ArrayList<>();

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private ApiClient apiClient;

	@Nullable
	private GitClient gitClient;

	@Nullable
	private BundleStore bundleStore;

	@Nullable
	private Clock clock;

	private GitBackupBuilder() {
		this.properties = new BackupProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitBackupBuilder
	 */
	public static GitBackupBuilder create() {
		return new GitBackupBuilder();
	}

	/**
	 * Set backup properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitBackupBuilder properties(@Nullable BackupProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Create providers from environment settings in addition to any added explicitly.
	 * @param settings provider settings (null to add none)
	 * @return this builder
	 */
	public GitBackupBuilder settings(@Nullable ProviderSettings settings) {
		this.settings = settings;
		return this;
	}

	/**
	 * Add a provider to back up.
	 * @param provider provider
	 * @return this builder
	 */
	public GitBackupBuilder provider(GitProvider provider) {
		this.providers.add(provider);
		return this;
	}

	/**
	 * Add a listener notified at the end of every run.
	 * @param listener result listener
	 * @return this builder
	 */
	public GitBackupBuilder listener(BackupResultListener listener) {
		this.listeners.add(listener);
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitBackupBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom ApiClient, used by providers and the webhook notifier.
	 * @param apiClient API client (null for a retrying {@link HttpApiClient})
	 * @return this builder
	 */
	public GitBackupBuilder apiClient(@Nullable ApiClient apiClient) {
		this.apiClient = apiClient;
		return this;
	}

	/**
	 * Set a custom GitClient. Useful for testing without a git installation.
	 * @param gitClient git client (null for a {@link ProcessGitClient})
	 * @return this builder
	 */
	public GitBackupBuilder gitClient(@Nullable GitClient gitClient) {
		this.gitClient = gitClient;
		return this;
	}

	/**
	 * Set a custom BundleStore implementation.
	 * @param bundleStore bundle store (null for a {@link FileSystemBundleStore})
	 * @return this builder
	 */
	public GitBackupBuilder bundleStore(@Nullable BundleStore bundleStore) {
		this.bundleStore = bundleStore;
		return this;
	}

	/**
	 * Set the clock used for bundle timestamps and run times.
	 * @param clock clock (null for the system clock)
	 * @return this builder
	 */
	public GitBackupBuilder clock(@Nullable Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the run coordinator.
	 * @return configured BackupRunner
	 * @throws IllegalStateException if no backup directory or no provider is configured
	 */
	public BackupRunner buildRunner() {
		Components components = buildComponents();
		List<GitProvider> allProviders = new ArrayList<>(providers);
		if (settings != null) {
			allProviders.addAll(settings.createProviders(components.apiClient, components.objectMapper, properties));
		}
		if (allProviders.isEmpty()) {
			throw new IllegalStateException(
					"No providers configured. Set the credentials of at least one provider, e.g. GITHUB_TOKEN or GITLAB_TOKEN.");
		}
		List<BackupResultListener> allListeners = new ArrayList<>(listeners);
		String webhookUrl = properties.getWebhookUrl();
		if (webhookUrl != null && !webhookUrl.isBlank()) {
			allListeners.add(new WebhookNotifier(components.apiClient, components.objectMapper, webhookUrl,
					properties.getWebhookFormat()));
		}
		return new BackupRunner(allProviders, new ProviderBackupOrchestrator(components.worker), components.worker,
				allListeners, components.clock);
	}

	/**
	 * Build a BackupWorker directly (for advanced usage).
	 * @return configured BackupWorker
	 */
	public BackupWorker buildWorker() {
		return buildComponents().worker;
	}

	private Components buildComponents() {
		String backupDir = properties.getBackupDir();
		if (backupDir == null || backupDir.isBlank()) {
			throw new IllegalStateException("Backup directory is required. Set GIT_BACKUP_DIR or --backup-dir.");
		}
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		ApiClient api = this.apiClient != null ? this.apiClient
				: RetryingApiClient.builder()
					.wrapping(new HttpApiClient(properties.getHttpRequestTimeout()))
					.maxRetries(properties.getHttpMaxRetries())
					.initialDelay(properties.getHttpRetryInitialDelay())
					.maxDelay(properties.getHttpRetryMaxDelay())
					.build();
		Clock runClock = this.clock != null ? this.clock : Clock.systemDefaultZone();
		GitClient git = this.gitClient != null ? this.gitClient
				: new ProcessGitClient(properties.getGitBinary(), properties.getGitCommandTimeout());
		GitService gitService = new GitCliService(git);
		BundleStore store = this.bundleStore != null ? this.bundleStore : new FileSystemBundleStore(gitService, runClock);
		BackupWorker worker = new BackupWorker(Path.of(backupDir), gitService, store,
				new RemoteDiffService(gitService, store));
		return new Components(mapper, api, runClock, worker);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ObjectMapper objectMapper, ApiClient apiClient, Clock clock, BackupWorker worker) {
	}

}
