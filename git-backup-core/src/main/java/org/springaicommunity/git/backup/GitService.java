package org.springaicommunity.git.backup;

import java.nio.file.Path;

/**
 * Typed git operations used by the backup pipeline.
 */
public interface GitService {

	/**
	 * Create a bare mirror clone.
	 * @param cloneUrl source URL, possibly with embedded credentials
	 * @param target directory to create
	 * @throws GitCommandException if the clone fails
	 */
	void mirrorClone(String cloneUrl, Path target);

	/**
	 * Write a bundle containing every ref of a repository.
	 * @param repositoryDir repository to bundle
	 * @param bundlePath file to write
	 * @throws GitCommandException if git cannot write the bundle
	 */
	void createBundle(Path repositoryDir, Path bundlePath);

	/**
	 * Read the refs stored in a bundle.
	 * @throws InvalidBundleException if the file is not a bundle
	 * @throws GitCommandException for any other failure
	 */
	GitRefs listBundleHeads(Path bundlePath);

	/**
	 * List the refs of a live remote.
	 * @throws GitCommandException if the remote cannot be reached
	 */
	GitRefs listRemoteRefs(String cloneUrl);

	/**
	 * Count the objects of a repository.
	 * @throws GitCommandException if git fails
	 */
	ObjectCounts countObjects(Path repositoryDir);

}
