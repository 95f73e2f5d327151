package org.springaicommunity.git.backup;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Recursive directory removal.
 */
final class FileTrees {

	private FileTrees() {
	}

	/**
	 * Delete a file or directory tree. A missing path is not an error.
	 * @throws UncheckedIOException if any entry cannot be deleted
	 */
	static void deleteRecursively(Path root) {
		if (!Files.exists(root)) {
			return;
		}
		List<Path> entries;
		try (Stream<Path> walk = Files.walk(root)) {
			entries = walk.sorted(Comparator.reverseOrder()).toList();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to walk " + root, e);
		}
		for (Path entry : entries) {
			try {
				// git marks pack files read-only
				entry.toFile().setWritable(true);
				Files.deleteIfExists(entry);
			}
			catch (IOException e) {
				throw new UncheckedIOException("Failed to delete " + entry, e);
			}
		}
	}

}
