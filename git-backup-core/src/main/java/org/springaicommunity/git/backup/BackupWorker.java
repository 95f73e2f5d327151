package org.springaicommunity.git.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Backs up a single repository: optional ref comparison, mirror clone, bundle, then
 * deduplication and retention.
 *
 * <p>
 * Layout under the backup root:
 *
 * <pre>
 * &lt;root&gt;/&lt;domain&gt;/&lt;owner&gt;/&lt;repo&gt;/&lt;repo&gt;.&lt;yyyyMMddHHmmss&gt;.bundle
 * &lt;root&gt;/.working/&lt;domain&gt;/&lt;owner&gt;/&lt;repo&gt;/   (mirror clone, scratch)
 * </pre>
 *
 * <p>
 * A worker never throws for a repository-level problem; every call yields exactly one
 * {@link RepoBackupResult}. Instances are stateless and shared by all worker threads.
 */
public class BackupWorker {

	private static final Logger logger = LoggerFactory.getLogger(BackupWorker.class);

	public static final String WORKING_DIR_NAME = ".working";

	private final Path backupRoot;

	private final GitService gitService;

	private final BundleStore bundleStore;

	private final RemoteDiffService remoteDiffService;

	public BackupWorker(Path backupRoot, GitService gitService, BundleStore bundleStore,
			RemoteDiffService remoteDiffService) {
		this.backupRoot = backupRoot.toAbsolutePath().normalize();
		this.gitService = gitService;
		this.bundleStore = bundleStore;
		this.remoteDiffService = remoteDiffService;
	}

	public Path getBackupRoot() {
		return backupRoot;
	}

	public Path getWorkingRoot() {
		return backupRoot.resolve(WORKING_DIR_NAME);
	}

	/**
	 * Directory holding the bundles of a repository.
	 */
	public Path backupDir(Repository repository) {
		return resolveInside(backupRoot, repository);
	}

	/**
	 * Scratch directory for the mirror clone of a repository.
	 */
	public Path workingDir(Repository repository) {
		return resolveInside(getWorkingRoot(), repository);
	}

	/**
	 * Back up one repository.
	 * @param repository repository to back up
	 * @param cloneUrl URL to clone from, possibly with embedded credentials
	 * @param diffMode whether to compare refs before cloning
	 * @param backupsToRetain bundles to keep, zero for all
	 * @return the outcome; never null, never thrown
	 */
	public RepoBackupResult backup(Repository repository, String cloneUrl, DiffMode diffMode, int backupsToRetain) {
		String id = repository.identifier();
		try {
			return runPipeline(repository, cloneUrl, diffMode, backupsToRetain);
		}
		catch (RuntimeException e) {
			logger.error("Backup of {} failed unexpectedly: {}", id, CloneUrls.mask(String.valueOf(e.getMessage())));
			return RepoBackupResult.failed(id, "unexpected error: " + e.getMessage());
		}
	}

	private RepoBackupResult runPipeline(Repository repository, String cloneUrl, DiffMode diffMode,
			int backupsToRetain) {
		String id = repository.identifier();
		Path backupDir = backupDir(repository);
		Path workingDir = workingDir(repository);

		try {
			FileTrees.deleteRecursively(workingDir);
		}
		catch (RuntimeException e) {
			logger.error("Cannot prepare working directory for {}: {}", id, e.getMessage());
			return RepoBackupResult.failed(id, "failed to prepare working directory: " + e.getMessage());
		}

		if (diffMode == DiffMode.REFS && remoteDiffService.remoteMatchesLocal(cloneUrl, backupDir)) {
			logger.info("Skipping clone of {}: refs match latest bundle", id);
			return RepoBackupResult.ok(id);
		}

		try {
			gitService.mirrorClone(cloneUrl, workingDir);
		}
		catch (GitCommandException e) {
			logger.error("Clone of {} failed: {}", id, e.getMessage());
			return RepoBackupResult.failed(id, "clone failed: " + e.getMessage());
		}

		Optional<BundleFile> bundle;
		try {
			bundle = bundleStore.createSnapshot(workingDir, backupDir, repository.name());
		}
		catch (RuntimeException e) {
			logger.error("Bundle of {} failed: {}", id, e.getMessage());
			return RepoBackupResult.failed(id, "bundle failed: " + e.getMessage());
		}
		finally {
			cleanWorkingDir(id, workingDir);
		}

		if (bundle.isEmpty()) {
			return RepoBackupResult.ok(id);
		}

		postProcess(id, backupDir, backupsToRetain);
		logger.info("Backed up {} to {}", id, bundle.get().name());
		return RepoBackupResult.ok(id);
	}

	private void postProcess(String id, Path backupDir, int backupsToRetain) {
		try {
			bundleStore.deduplicate(backupDir);
		}
		catch (RuntimeException e) {
			logger.warn("Deduplication of {} failed: {}", id, e.getMessage());
		}
		if (backupsToRetain > 0) {
			try {
				int pruned = bundleStore.prune(backupDir, backupsToRetain);
				if (pruned > 0) {
					logger.debug("Pruned {} old bundle(s) of {}", pruned, id);
				}
			}
			catch (RuntimeException e) {
				logger.warn("Pruning of {} failed: {}", id, e.getMessage());
			}
		}
	}

	private void cleanWorkingDir(String id, Path workingDir) {
		try {
			FileTrees.deleteRecursively(workingDir);
		}
		catch (RuntimeException e) {
			logger.warn("Could not remove working directory of {}: {}", id, e.getMessage());
		}
	}

	private static Path resolveInside(Path root, Repository repository) {
		Path dir = root.resolve(repository.domain()).resolve(repository.pathWithNamespace()).normalize();
		if (!dir.startsWith(root) || dir.equals(root)) {
			throw new IllegalArgumentException("Repository path escapes backup root: " + repository.identifier());
		}
		return dir;
	}

}
