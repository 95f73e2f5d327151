package org.springaicommunity.git.backup;

import java.time.Duration;
import java.util.List;

/**
 * A git hosting service whose repositories are backed up.
 *
 * <p>
 * The worker and orchestrator only see this interface; nothing downstream branches on the
 * concrete provider.
 */
public interface GitProvider {

	/**
	 * Short name used in logs, results and worker thread names, e.g. {@code GitHub}.
	 */
	String name();

	/**
	 * Enumerate every repository to back up.
	 * @throws ProviderException if the list cannot be retrieved
	 */
	List<Repository> listRepositories();

	/**
	 * URL used to clone and list refs of a repository. Defaults to the token variant,
	 * then the basic-auth variant, then the plain HTTPS URL.
	 */
	default String credentialedCloneUrl(Repository repository) {
		return repository.cloneUrl();
	}

	DiffMode diffMode();

	/**
	 * Number of bundles to keep per repository; zero keeps all of them.
	 */
	int backupsToRetain();

	/**
	 * Maximum number of repositories backed up concurrently.
	 */
	int workerCount();

	/**
	 * Pause between starting consecutive workers, to spread API load.
	 */
	default Duration workerStartDelay() {
		return Duration.ZERO;
	}

}
