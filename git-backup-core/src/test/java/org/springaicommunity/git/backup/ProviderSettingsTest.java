package org.springaicommunity.git.backup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("ProviderSettings Tests")
class ProviderSettingsTest {

	private final ApiClient apiClient = mock(ApiClient.class);

	private static ProviderSettings settings(Map<String, String> env) {
		return new ProviderSettings(env::get);
	}

	private List<GitProvider> providers(Map<String, String> env, BackupProperties properties) {
		return settings(env).createProviders(apiClient, ObjectMapperFactory.create(), properties);
	}

	@Nested
	@DisplayName("Run Settings")
	class RunSettingsTest {

		@Test
		@DisplayName("Should apply run-wide variables")
		void shouldApplyRunVariables() {
			BackupProperties properties = new BackupProperties();

			settings(Map.of("GIT_BACKUP_DIR", "/data", "GIT_REQUEST_TIMEOUT", "30", "GIT_BACKUP_WORKERS", "3",
					"GIT_COMMAND_TIMEOUT", "0", "SOBA_WEBHOOK_URL", "https://hook", "SOBA_WEBHOOK_FORMAT", "short",
					"GITHUB_WORKER_DELAY", "0"))
				.applyTo(properties);

			assertThat(properties.getBackupDir()).isEqualTo("/data");
			assertThat(properties.getHttpRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
			assertThat(properties.getWorkerCount()).isEqualTo(3);
			assertThat(properties.getGitCommandTimeout()).isZero();
			assertThat(properties.getWebhookUrl()).isEqualTo("https://hook");
			assertThat(properties.getWebhookFormat()).isEqualTo("short");
			assertThat(properties.getGitHubWorkerDelay()).isZero();
		}

		@Test
		@DisplayName("Should apply retention, git binary and API retry variables")
		void shouldApplyRetryVariables() {
			BackupProperties properties = new BackupProperties();

			settings(Map.of("GIT_BACKUP_RETAIN", "4", "GIT_BINARY", "/usr/local/bin/git", "GIT_REQUEST_RETRIES", "0",
					"GIT_REQUEST_RETRY_DELAY", "2", "GIT_REQUEST_RETRY_MAX_DELAY", "20"))
				.applyTo(properties);

			assertThat(properties.getDefaultBackupsToRetain()).isEqualTo(4);
			assertThat(properties.getGitBinary()).isEqualTo("/usr/local/bin/git");
			assertThat(properties.getHttpMaxRetries()).isZero();
			assertThat(properties.getHttpRetryInitialDelay()).isEqualTo(Duration.ofSeconds(2));
			assertThat(properties.getHttpRetryMaxDelay()).isEqualTo(Duration.ofSeconds(20));
			assertThat(providers(Map.of("GITLAB_TOKEN", "gl"), properties).get(0).backupsToRetain()).isEqualTo(4);
		}

		@Test
		@DisplayName("Should keep defaults for unset variables")
		void shouldKeepDefaults() {
			BackupProperties properties = new BackupProperties();

			settings(Map.of()).applyTo(properties);

			assertThat(properties.getBackupDir()).isNull();
			assertThat(properties.getGitCommandTimeout()).isEqualTo(Duration.ofMinutes(60));
			assertThat(properties.getGitHubWorkerDelay()).isEqualTo(Duration.ofMillis(500));
		}

		@Test
		@DisplayName("Should reject malformed numbers")
		void shouldRejectMalformedNumbers() {
			assertThatThrownBy(() -> settings(Map.of("GIT_BACKUP_WORKERS", "many")).applyTo(new BackupProperties()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("GIT_BACKUP_WORKERS");
			assertThatThrownBy(() -> settings(Map.of("GIT_REQUEST_RETRY_DELAY", "0")).applyTo(new BackupProperties()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("GIT_REQUEST_RETRY_DELAY");
		}

	}

	@Nested
	@DisplayName("Providers")
	class ProvidersTest {

		@Test
		@DisplayName("Should enable nothing without credentials")
		void shouldEnableNothing() {
			assertThat(providers(Map.of(), new BackupProperties())).isEmpty();
		}

		@Test
		@DisplayName("Should create providers with their own settings")
		void shouldCreateConfiguredProviders() {
			Map<String, String> env = new HashMap<>();
			env.put("GITHUB_TOKEN", "gh");
			env.put("GITHUB_COMPARE", "refs");
			env.put("GITHUB_BACKUPS", "5");
			env.put("GITLAB_TOKEN", "gl");
			env.put("GITEA_TOKEN", "tea");
			env.put("GITEA_APIURL", "https://gitea.example.com/api/v1");

			List<GitProvider> providers = providers(env, new BackupProperties());

			assertThat(providers).extracting(GitProvider::name).containsExactly("GitHub", "GitLab", "Gitea");
			GitProvider gitHub = providers.get(0);
			assertThat(gitHub.diffMode()).isEqualTo(DiffMode.REFS);
			assertThat(gitHub.backupsToRetain()).isEqualTo(5);
			assertThat(gitHub.workerStartDelay()).isEqualTo(Duration.ofMillis(500));
			GitProvider gitLab = providers.get(1);
			assertThat(gitLab.diffMode()).isEqualTo(DiffMode.CLONE);
			assertThat(gitLab.backupsToRetain()).isEqualTo(BackupProperties.DEFAULT_BACKUPS_TO_RETAIN);
			assertThat(gitLab.workerStartDelay()).isZero();
		}

		@Test
		@DisplayName("Should let command-line overrides win over provider variables")
		void shouldApplyOverrides() {
			BackupProperties properties = new BackupProperties();
			properties.setDiffModeOverride(DiffMode.CLONE);
			properties.setBackupsToRetainOverride(0);

			GitProvider gitHub = providers(Map.of("GITHUB_TOKEN", "gh", "GITHUB_COMPARE", "refs", "GITHUB_BACKUPS", "5"),
					properties)
				.get(0);

			assertThat(gitHub.diffMode()).isEqualTo(DiffMode.CLONE);
			assertThat(gitHub.backupsToRetain()).isZero();
		}

		@Test
		@DisplayName("Should skip Gitea without an API URL")
		void shouldSkipIncompleteGitea() {
			assertThat(providers(Map.of("GITEA_TOKEN", "tea"), new BackupProperties())).isEmpty();
		}

		@Test
		@DisplayName("Should create Bitbucket, Azure DevOps and Sourcehut providers")
		void shouldCreateOtherProviders() {
			Map<String, String> env = new HashMap<>();
			env.put("BITBUCKET_EMAIL", "me@example.com");
			env.put("BITBUCKET_API_TOKEN", "atok");
			env.put("BITBUCKET_BACKUPS", "3");
			env.put("AZURE_DEVOPS_USERNAME", "alice");
			env.put("AZURE_DEVOPS_PAT", "pat");
			env.put("AZURE_DEVOPS_ORGS", "acme,globex");
			env.put("AZURE_DEVOPS_COMPARE", "refs");
			env.put("SOURCEHUT_PAT", "srht");

			List<GitProvider> providers = providers(env, new BackupProperties());

			assertThat(providers).extracting(GitProvider::name).containsExactly("BitBucket", "AzureDevOps", "Sourcehut");
			assertThat(providers.get(0).backupsToRetain()).isEqualTo(3);
			assertThat(providers.get(1).diffMode()).isEqualTo(DiffMode.REFS);
			assertThat(providers.get(2).workerStartDelay()).isZero();
		}

		@Test
		@DisplayName("Should accept Bitbucket OAuth credentials")
		void shouldAcceptBitbucketOAuth() {
			List<GitProvider> providers = providers(
					Map.of("BITBUCKET_USER", "alice", "BITBUCKET_KEY", "key", "BITBUCKET_SECRET", "sec"),
					new BackupProperties());

			assertThat(providers).extracting(GitProvider::name).containsExactly("BitBucket");
		}

		@Test
		@DisplayName("Should skip providers with partial credentials")
		void shouldSkipPartialCredentials() {
			Map<String, String> env = Map.of("BITBUCKET_USER", "alice", "BITBUCKET_KEY", "key", "AZURE_DEVOPS_USERNAME",
					"alice", "AZURE_DEVOPS_PAT", "pat");

			assertThat(providers(env, new BackupProperties())).isEmpty();
		}

		@Test
		@DisplayName("Should read token from file indirection")
		void shouldReadTokenFile(@TempDir Path dir) throws Exception {
			Path tokenFile = Files.writeString(dir.resolve("token"), "from-file\n");

			List<GitProvider> providers = providers(Map.of("GITLAB_TOKEN_FILE", tokenFile.toString()),
					new BackupProperties());

			assertThat(providers).extracting(GitProvider::name).containsExactly("GitLab");
		}

		@Test
		@DisplayName("Should reject invalid compare mode")
		void shouldRejectInvalidCompare() {
			assertThatThrownBy(() -> providers(Map.of("GITHUB_TOKEN", "gh", "GITHUB_COMPARE", "hash"),
					new BackupProperties()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("hash");
		}

	}

	@Test
	@DisplayName("Should prefer the variable over its _FILE variant")
	void shouldPreferDirectValue(@TempDir Path dir) throws Exception {
		Path file = Files.writeString(dir.resolve("secret"), "file-value\n");
		Map<String, String> env = Map.of("TOKEN", "direct", "TOKEN_FILE", file.toString());

		assertThat(EnvironmentSupport.resolveOrFile(env::get, "TOKEN")).isEqualTo("direct");
		assertThat(EnvironmentSupport.resolveOrFile(Map.of("TOKEN_FILE", file.toString())::get, "TOKEN"))
			.isEqualTo("file-value");
		assertThat(EnvironmentSupport.resolveOrFile(Map.<String, String>of()::get, "TOKEN")).isNull();
		assertThat(EnvironmentSupport.getOrFile("GIT_BACKUP_TEST_UNSET_VARIABLE")).isNull();
	}

}
