package org.springaicommunity.git.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File system implementation of {@link BundleStore}.
 *
 * <p>
 * Bundle timestamps are taken from the supplied {@link Clock} in its zone, truncated to
 * whole seconds.
 */
public class FileSystemBundleStore implements BundleStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemBundleStore.class);

	private final GitService gitService;

	private final Clock clock;

	public FileSystemBundleStore(GitService gitService, Clock clock) {
		this.gitService = gitService;
		this.clock = clock;
	}

	public FileSystemBundleStore(GitService gitService) {
		this(gitService, Clock.systemDefaultZone());
	}

	@Override
	public List<BundleFile> listBundles(Path backupDir) {
		if (!Files.isDirectory(backupDir)) {
			return List.of();
		}
		try (Stream<Path> files = Files.list(backupDir)) {
			return files.filter(Files::isRegularFile)
				.map(BundleFile::from)
				.flatMap(Optional::stream)
				.sorted()
				.toList();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to list bundles in " + backupDir, e);
		}
	}

	@Override
	public Optional<BundleFile> latestBundle(Path backupDir) {
		List<BundleFile> bundles = listBundles(backupDir);
		return bundles.isEmpty() ? Optional.empty() : Optional.of(bundles.get(bundles.size() - 1));
	}

	@Override
	public GitRefs readHeads(BundleFile bundle) {
		return gitService.listBundleHeads(bundle.path());
	}

	@Override
	public Path markInvalid(BundleFile bundle) {
		Path target = bundle.path().resolveSibling(bundle.name() + BundleFile.INVALID_SUFFIX);
		try {
			Files.move(bundle.path(), target, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to rename invalid bundle " + bundle.path(), e);
		}
		logger.warn("Renamed invalid bundle {} to {}", bundle.name(), target.getFileName());
		return target;
	}

	@Override
	public Optional<BundleFile> createSnapshot(Path workingClone, Path backupDir, String repoName) {
		if (gitService.countObjects(workingClone).isEmpty()) {
			logger.info("Skipping bundle of {}: repository is empty", repoName);
			return Optional.empty();
		}
		try {
			Files.createDirectories(backupDir);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to create backup directory " + backupDir, e);
		}

		LocalDateTime created = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
		Path target = backupDir.toAbsolutePath().resolve(BundleFile.fileName(repoName, created));
		while (Files.exists(target)) {
			created = created.plusSeconds(1);
			target = target.resolveSibling(BundleFile.fileName(repoName, created));
		}

		gitService.createBundle(workingClone, target);
		logger.debug("Created bundle {}", target);
		return Optional.of(new BundleFile(target, created));
	}

	@Override
	public boolean deduplicate(Path backupDir) {
		List<BundleFile> bundles = listBundles(backupDir);
		if (bundles.size() < 2) {
			return false;
		}
		BundleFile latest = bundles.get(bundles.size() - 1);
		BundleFile previous = bundles.get(bundles.size() - 2);
		if (latest.sizeBytes() != previous.sizeBytes()) {
			return false;
		}
		if (!latest.contentHash().equals(previous.contentHash())) {
			return false;
		}
		delete(latest);
		logger.info("Removed {}: identical to {}", latest.name(), previous.name());
		return true;
	}

	@Override
	public int prune(Path backupDir, int retain) {
		if (retain < 0) {
			throw new IllegalArgumentException("Retention count must not be negative: " + retain);
		}
		if (retain == 0) {
			return 0;
		}
		List<BundleFile> bundles = listBundles(backupDir);
		int excess = bundles.size() - retain;
		for (int i = 0; i < excess; i++) {
			delete(bundles.get(i));
			logger.debug("Pruned {}", bundles.get(i).name());
		}
		return Math.max(excess, 0);
	}

	private static void delete(BundleFile bundle) {
		try {
			Files.deleteIfExists(bundle.path());
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to delete " + bundle.path(), e);
		}
	}

}
