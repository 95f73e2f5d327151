package org.springaicommunity.git.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides whether a remote has changed since its latest local bundle, without cloning.
 *
 * <p>
 * Every failure resolves to "changed": a spurious clone costs bandwidth, a missed one
 * loses data.
 */
public class RemoteDiffService {

	private static final Logger logger = LoggerFactory.getLogger(RemoteDiffService.class);

	private final GitService gitService;

	private final BundleStore bundleStore;

	public RemoteDiffService(GitService gitService, BundleStore bundleStore) {
		this.gitService = gitService;
		this.bundleStore = bundleStore;
	}

	/**
	 * Compare the refs of a remote with those of the newest readable bundle.
	 * @param cloneUrl remote URL, possibly with embedded credentials
	 * @param backupDir the repository's backup directory
	 * @return true only when both sides hold exactly the same refs at the same commits
	 */
	public boolean remoteMatchesLocal(String cloneUrl, Path backupDir) {
		if (!Files.isDirectory(backupDir)) {
			logger.debug("No backup directory at {}", backupDir);
			return false;
		}
		try {
			Optional<GitRefs> localRefs = latestReadableRefs(backupDir);
			if (localRefs.isEmpty()) {
				return false;
			}
			GitRefs remoteRefs = gitService.listRemoteRefs(cloneUrl);
			boolean matches = localRefs.get().equals(remoteRefs);
			logger.debug("Remote {} {} local bundle ({} remote refs, {} local refs)", CloneUrls.mask(cloneUrl),
					matches ? "matches" : "differs from", remoteRefs.size(), localRefs.get().size());
			return matches;
		}
		catch (RuntimeException e) {
			logger.warn("Ref comparison for {} failed, falling back to clone: {}", backupDir,
					CloneUrls.mask(String.valueOf(e.getMessage())));
			return false;
		}
	}

	private Optional<GitRefs> latestReadableRefs(Path backupDir) {
		Optional<BundleFile> latest = bundleStore.latestBundle(backupDir);
		while (latest.isPresent()) {
			try {
				return Optional.of(bundleStore.readHeads(latest.get()));
			}
			catch (InvalidBundleException e) {
				bundleStore.markInvalid(latest.get());
				latest = bundleStore.latestBundle(backupDir);
			}
		}
		return Optional.empty();
	}

}
