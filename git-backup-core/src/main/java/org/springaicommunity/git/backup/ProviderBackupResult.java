package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of backing up every repository of one provider.
 *
 * @param provider provider name
 * @param results one entry per repository, in completion order
 * @param error set only when the repository list could not be retrieved
 */
public record ProviderBackupResult(String provider, List<RepoBackupResult> results, @Nullable String error) {

	public ProviderBackupResult {
		results = List.copyOf(results);
	}

	public static ProviderBackupResult completed(String provider, List<RepoBackupResult> results) {
		return new ProviderBackupResult(provider, results, null);
	}

	public static ProviderBackupResult enumerationFailed(String provider, String error) {
		return new ProviderBackupResult(provider, List.of(), CloneUrls.mask(error));
	}

	public long succeeded() {
		return results.stream().filter(RepoBackupResult::succeeded).count();
	}

	/**
	 * Failed repositories, plus one when the provider itself failed.
	 */
	public long failed() {
		long failedRepos = results.stream().filter(r -> !r.succeeded()).count();
		return error != null ? failedRepos + 1 : failedRepos;
	}

}
