package org.springaicommunity.git.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * {@link GitService} implemented by running git commands through a {@link GitClient}.
 */
public class GitCliService implements GitService {

	private static final Logger logger = LoggerFactory.getLogger(GitCliService.class);

	/**
	 * Marker git prints when asked to read something that is not a bundle.
	 */
	static final String NOT_A_BUNDLE = "does not look like";

	private final GitClient gitClient;

	public GitCliService(GitClient gitClient) {
		this.gitClient = gitClient;
	}

	@Override
	public void mirrorClone(String cloneUrl, Path target) {
		logger.debug("Cloning {} into {}", CloneUrls.mask(cloneUrl), target);
		gitClient.execute(null, "clone", "-v", "--mirror", cloneUrl, target.toString()).orThrow();
	}

	@Override
	public void createBundle(Path repositoryDir, Path bundlePath) {
		gitClient.execute(repositoryDir, "bundle", "create", bundlePath.toString(), "--all").orThrow();
	}

	@Override
	public GitRefs listBundleHeads(Path bundlePath) {
		GitCommandResult result = gitClient.execute(null, "bundle", "list-heads", bundlePath.toString());
		if (!result.isSuccess()) {
			if (result.stderr().contains(NOT_A_BUNDLE)) {
				throw new InvalidBundleException(bundlePath, result);
			}
			throw new GitCommandException(result);
		}
		return GitRefs.parse(result.stdout());
	}

	@Override
	public GitRefs listRemoteRefs(String cloneUrl) {
		return GitRefs.parse(gitClient.execute(null, "ls-remote", cloneUrl).orThrow().stdout());
	}

	@Override
	public ObjectCounts countObjects(Path repositoryDir) {
		return ObjectCounts.parse(gitClient.execute(repositoryDir, "count-objects", "-v").orThrow().stdout());
	}

}
