package org.springaicommunity.git.backup;

import java.nio.file.Path;

/**
 * Thrown when git reports that a file is not a readable bundle.
 */
public class InvalidBundleException extends GitCommandException {

	private final Path bundlePath;

	public InvalidBundleException(Path bundlePath, GitCommandResult result) {
		super(result);
		this.bundlePath = bundlePath;
	}

	public Path getBundlePath() {
		return bundlePath;
	}

}
