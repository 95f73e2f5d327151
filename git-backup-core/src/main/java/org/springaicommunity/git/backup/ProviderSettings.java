package org.springaicommunity.git.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Reads run and provider configuration from environment variables.
 *
 * <p>
 * A provider is enabled by setting its credentials (and, for Gitea, its API URL). Tokens may
 * also be supplied through {@code <NAME>_FILE}.
 *
 * <table>
 * <caption>Variables</caption>
 * <tr><td>GIT_BACKUP_DIR</td><td>backup root directory</td></tr>
 * <tr><td>GIT_REQUEST_TIMEOUT</td><td>API request timeout in seconds</td></tr>
 * <tr><td>GIT_BACKUP_WORKERS</td><td>concurrent backups per provider</td></tr>
 * <tr><td>GIT_COMMAND_TIMEOUT</td><td>git command timeout in seconds, 0 for none</td></tr>
 * <tr><td>GIT_BACKUP_RETAIN</td><td>bundles kept per repository when a provider sets
 * none</td></tr>
 * <tr><td>GIT_BINARY</td><td>git executable</td></tr>
 * <tr><td>GIT_REQUEST_RETRIES, GIT_REQUEST_RETRY_DELAY,
 * GIT_REQUEST_RETRY_MAX_DELAY</td><td>API retry count and backoff bounds in
 * seconds</td></tr>
 * <tr><td>GITHUB_TOKEN, GITHUB_ORGS, GITHUB_SKIP_USER_REPOS, GITHUB_LIMIT_USER_OWNED,
 * GITHUB_COMPARE, GITHUB_BACKUPS, GITHUB_APIURL, GITHUB_WORKER_DELAY</td><td>GitHub</td></tr>
 * <tr><td>GITLAB_TOKEN, GITLAB_APIURL, GITLAB_COMPARE, GITLAB_BACKUPS,
 * GITLAB_PROJECT_MIN_ACCESS_LEVEL</td><td>GitLab</td></tr>
 * <tr><td>GITEA_APIURL, GITEA_TOKEN, GITEA_ORGS, GITEA_COMPARE, GITEA_BACKUPS</td>
 * <td>Gitea</td></tr>
 * <tr><td>BITBUCKET_EMAIL, BITBUCKET_API_TOKEN (or BITBUCKET_USER, BITBUCKET_KEY,
 * BITBUCKET_SECRET), BITBUCKET_APIURL, BITBUCKET_COMPARE, BITBUCKET_BACKUPS</td>
 * <td>Bitbucket</td></tr>
 * <tr><td>AZURE_DEVOPS_USERNAME, AZURE_DEVOPS_PAT, AZURE_DEVOPS_ORGS,
 * AZURE_DEVOPS_COMPARE, AZURE_DEVOPS_BACKUPS</td><td>Azure DevOps</td></tr>
 * <tr><td>SOURCEHUT_PAT, SOURCEHUT_APIURL, SOURCEHUT_COMPARE, SOURCEHUT_BACKUPS</td>
 * <td>Sourcehut</td></tr>
 * <tr><td>SOBA_WEBHOOK_URL, SOBA_WEBHOOK_FORMAT</td><td>run summary webhook</td></tr>
 * </table>
 */
public class ProviderSettings {

	private static final Logger logger = LoggerFactory.getLogger(ProviderSettings.class);

	private final Function<String, @Nullable String> lookup;

	public ProviderSettings(Function<String, @Nullable String> lookup) {
		this.lookup = lookup;
	}

	/**
	 * Settings backed by {@link EnvironmentSupport}.
	 */
	public static ProviderSettings fromEnvironment() {
		return new ProviderSettings(EnvironmentSupport::get);
	}

	/**
	 * Copy run-wide settings found in the environment onto {@code properties}. Unset
	 * variables leave the current values in place.
	 * @throws IllegalArgumentException if a variable holds an invalid value
	 */
	public void applyTo(BackupProperties properties) {
		String backupDir = value("GIT_BACKUP_DIR");
		if (backupDir != null) {
			properties.setBackupDir(backupDir);
		}
		Integer requestTimeout = nonNegativeInt("GIT_REQUEST_TIMEOUT");
		if (requestTimeout != null && requestTimeout > 0) {
			properties.setHttpRequestTimeout(Duration.ofSeconds(requestTimeout));
		}
		Integer workers = nonNegativeInt("GIT_BACKUP_WORKERS");
		if (workers != null && workers > 0) {
			properties.setWorkerCount(workers);
		}
		Integer gitTimeout = nonNegativeInt("GIT_COMMAND_TIMEOUT");
		if (gitTimeout != null) {
			properties.setGitCommandTimeout(Duration.ofSeconds(gitTimeout));
		}
		Integer gitHubDelay = nonNegativeInt("GITHUB_WORKER_DELAY");
		if (gitHubDelay != null) {
			properties.setGitHubWorkerDelay(Duration.ofMillis(gitHubDelay));
		}
		Integer retain = nonNegativeInt("GIT_BACKUP_RETAIN");
		if (retain != null) {
			properties.setDefaultBackupsToRetain(retain);
		}
		String gitBinary = value("GIT_BINARY");
		if (gitBinary != null) {
			properties.setGitBinary(gitBinary);
		}
		Integer retries = nonNegativeInt("GIT_REQUEST_RETRIES");
		if (retries != null) {
			properties.setHttpMaxRetries(retries);
		}
		Integer retryDelay = nonNegativeInt("GIT_REQUEST_RETRY_DELAY");
		if (retryDelay != null) {
			if (retryDelay == 0) {
				throw new IllegalArgumentException("GIT_REQUEST_RETRY_DELAY must be positive");
			}
			properties.setHttpRetryInitialDelay(Duration.ofSeconds(retryDelay));
		}
		Integer retryMaxDelay = nonNegativeInt("GIT_REQUEST_RETRY_MAX_DELAY");
		if (retryMaxDelay != null) {
			properties.setHttpRetryMaxDelay(Duration.ofSeconds(retryMaxDelay));
		}
		String webhookUrl = value("SOBA_WEBHOOK_URL");
		if (webhookUrl != null) {
			properties.setWebhookUrl(webhookUrl);
		}
		String webhookFormat = value("SOBA_WEBHOOK_FORMAT");
		if (webhookFormat != null) {
			properties.setWebhookFormat(webhookFormat);
		}
	}

	/**
	 * Create every provider that has credentials configured.
	 * @return enabled providers in the order GitHub, GitLab, Gitea, Bitbucket, Azure DevOps,
	 * Sourcehut
	 * @throws IllegalArgumentException if a provider variable holds an invalid value
	 */
	public List<GitProvider> createProviders(ApiClient apiClient, ObjectMapper objectMapper,
			BackupProperties properties) {
		List<GitProvider> providers = new ArrayList<>();

		String gitHubToken = secret("GITHUB_TOKEN");
		if (gitHubToken != null) {
			providers.add(new GitHubProvider(apiClient, objectMapper,
					options("GITHUB", properties, properties.getGitHubWorkerDelay()), gitHubToken,
					value("GITHUB_APIURL"), list("GITHUB_ORGS"), flag("GITHUB_SKIP_USER_REPOS"),
					flag("GITHUB_LIMIT_USER_OWNED")));
		}

		String gitLabToken = secret("GITLAB_TOKEN");
		if (gitLabToken != null) {
			Integer minAccessLevel = nonNegativeInt("GITLAB_PROJECT_MIN_ACCESS_LEVEL");
			providers.add(new GitLabProvider(apiClient, objectMapper, options("GITLAB", properties, Duration.ZERO),
					gitLabToken, value("GITLAB_APIURL"),
					minAccessLevel != null ? minAccessLevel : GitLabProvider.DEFAULT_MIN_ACCESS_LEVEL));
		}

		String giteaToken = secret("GITEA_TOKEN");
		String giteaApiUrl = value("GITEA_APIURL");
		if (giteaToken != null && giteaApiUrl != null) {
			providers.add(new GiteaProvider(apiClient, objectMapper, options("GITEA", properties, Duration.ZERO),
					giteaToken, giteaApiUrl, list("GITEA_ORGS")));
		}
		else if (giteaToken != null || giteaApiUrl != null) {
			logger.warn("Gitea needs both GITEA_APIURL and GITEA_TOKEN; skipping");
		}

		BitbucketProvider.Credentials bitbucketCredentials = bitbucketCredentials();
		if (bitbucketCredentials != null) {
			providers.add(new BitbucketProvider(apiClient, objectMapper, options("BITBUCKET", properties, Duration.ZERO),
					bitbucketCredentials, value("BITBUCKET_APIURL")));
		}

		String azureUser = secret("AZURE_DEVOPS_USERNAME");
		String azurePat = secret("AZURE_DEVOPS_PAT");
		List<String> azureOrgs = list("AZURE_DEVOPS_ORGS");
		if (azureUser != null && azurePat != null && !azureOrgs.isEmpty()) {
			providers.add(new AzureDevOpsProvider(apiClient, objectMapper,
					options("AZURE_DEVOPS", properties, Duration.ZERO), azureUser, azurePat, azureOrgs, null));
		}
		else if (azureUser != null || azurePat != null) {
			logger.warn("Azure DevOps needs AZURE_DEVOPS_USERNAME, AZURE_DEVOPS_PAT and AZURE_DEVOPS_ORGS; skipping");
		}

		String sourcehutToken = secret("SOURCEHUT_PAT");
		if (sourcehutToken != null) {
			providers.add(new SourcehutProvider(apiClient, objectMapper, options("SOURCEHUT", properties, Duration.ZERO),
					sourcehutToken, value("SOURCEHUT_APIURL")));
		}

		return providers;
	}

	private BitbucketProvider.@Nullable Credentials bitbucketCredentials() {
		String email = secret("BITBUCKET_EMAIL");
		String apiToken = secret("BITBUCKET_API_TOKEN");
		if (email != null && apiToken != null) {
			return BitbucketProvider.Credentials.apiToken(email, apiToken);
		}
		String user = secret("BITBUCKET_USER");
		String key = secret("BITBUCKET_KEY");
		String oauthSecret = secret("BITBUCKET_SECRET");
		if (user != null && key != null && oauthSecret != null) {
			return BitbucketProvider.Credentials.oauth(user, key, oauthSecret);
		}
		if (email != null || apiToken != null || user != null || key != null || oauthSecret != null) {
			logger.warn("Bitbucket needs BITBUCKET_EMAIL and BITBUCKET_API_TOKEN, or BITBUCKET_USER, BITBUCKET_KEY "
					+ "and BITBUCKET_SECRET; skipping");
		}
		return null;
	}

	private ProviderOptions options(String prefix, BackupProperties properties, Duration workerStartDelay) {
		DiffMode diffMode = properties.getDiffModeOverride() != null ? properties.getDiffModeOverride()
				: DiffMode.parse(value(prefix + "_COMPARE"));
		Integer retain = properties.getBackupsToRetainOverride();
		if (retain == null) {
			retain = nonNegativeInt(prefix + "_BACKUPS");
		}
		return new ProviderOptions(diffMode, retain != null ? retain : properties.getDefaultBackupsToRetain(),
				properties.getWorkerCount(), workerStartDelay);
	}

	@Nullable
	private String value(String name) {
		String value = lookup.apply(name);
		return value == null || value.isBlank() ? null : value.strip();
	}

	@Nullable
	private String secret(String name) {
		String value = EnvironmentSupport.resolveOrFile(lookup, name);
		return value == null || value.isBlank() ? null : value.strip();
	}

	private boolean flag(String name) {
		String value = value(name);
		return value != null && List.of("true", "yes", "1").contains(value.toLowerCase(Locale.ROOT));
	}

	private List<String> list(String name) {
		String value = value(name);
		if (value == null) {
			return List.of();
		}
		return Arrays.stream(value.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList();
	}

	@Nullable
	private Integer nonNegativeInt(String name) {
		String value = value(name);
		if (value == null) {
			return null;
		}
		try {
			int parsed = Integer.parseInt(value);
			if (parsed < 0) {
				throw new IllegalArgumentException(name + " must not be negative: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a non-negative integer");
		}
	}

}
