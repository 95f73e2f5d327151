package org.springaicommunity.git.backup;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of backing up one repository.
 *
 * @param repo repository identifier ({@code domain/owner/name})
 * @param status terminal state
 * @param error masked failure message, set only when {@code status} is FAILED
 */
public record RepoBackupResult(String repo, BackupStatus status, @Nullable String error) {

	public static RepoBackupResult ok(String repo) {
		return new RepoBackupResult(repo, BackupStatus.OK, null);
	}

	public static RepoBackupResult failed(String repo, String error) {
		return new RepoBackupResult(repo, BackupStatus.FAILED, CloneUrls.mask(error));
	}

	public boolean succeeded() {
		return status == BackupStatus.OK;
	}

}
