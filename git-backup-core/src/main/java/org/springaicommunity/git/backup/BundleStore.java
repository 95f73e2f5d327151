package org.springaicommunity.git.backup;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Manages the bundle files of one repository's backup directory.
 *
 * <p>
 * Every operation takes the backup directory explicitly; implementations hold no
 * per-repository state and can be shared between worker threads.
 */
public interface BundleStore {

	/**
	 * List the bundles in a directory, oldest first. Files that do not follow the bundle
	 * naming scheme are ignored; a missing directory yields an empty list.
	 */
	List<BundleFile> listBundles(Path backupDir);

	/**
	 * Find the most recent bundle by the timestamp in its name.
	 */
	Optional<BundleFile> latestBundle(Path backupDir);

	/**
	 * Read the refs recorded in a bundle.
	 * @throws InvalidBundleException if the file is not a readable bundle
	 */
	GitRefs readHeads(BundleFile bundle);

	/**
	 * Rename a corrupt bundle by appending {@value BundleFile#INVALID_SUFFIX}. The file
	 * is kept for inspection and no longer matches the naming scheme.
	 * @return the new path
	 */
	Path markInvalid(BundleFile bundle);

	/**
	 * Write a bundle of a mirror clone into the backup directory.
	 * @param workingClone mirror clone to snapshot
	 * @param backupDir directory receiving the bundle (created if missing)
	 * @param repoName bundle file name prefix
	 * @return the new bundle, or empty when the clone holds no objects
	 */
	Optional<BundleFile> createSnapshot(Path workingClone, Path backupDir, String repoName);

	/**
	 * Delete the newest bundle when it is byte-identical to the one before it.
	 * @return true if a bundle was deleted
	 */
	boolean deduplicate(Path backupDir);

	/**
	 * Keep the {@code retain} newest bundles and delete the rest, oldest first. A
	 * {@code retain} of zero keeps everything.
	 * @return number of bundles deleted
	 */
	int prune(Path backupDir, int retain);

}
