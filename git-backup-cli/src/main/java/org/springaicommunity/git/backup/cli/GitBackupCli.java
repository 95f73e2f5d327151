package org.springaicommunity.git.backup.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.git.backup.*;

/**
 * Git Backup CLI Application
 *
 * Plain Java command-line application that backs up every repository of the configured
 * GitHub, GitLab and Gitea accounts as timestamped git bundles. Uses GitBackupBuilder
 * for service wiring.
 *
 * Usage: java -jar git-backup-cli.jar [OPTIONS]
 *
 * Exits with status 1 when any repository or provider failed.
 */
public class GitBackupCli {

	private static final Logger logger = LoggerFactory.getLogger(GitBackupCli.class);

	private static final String BASE_PACKAGE = "org.springaicommunity.git.backup";

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Backup failed: {}", CloneUrls.mask(String.valueOf(e.getMessage())));
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		return run(args, ProviderSettings.fromEnvironment());
	}

	static int run(String[] args, ProviderSettings settings) {
		BackupProperties properties = new BackupProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		settings.applyTo(properties);
		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		config.applyTo(properties);

		if (config.verbose) {
			((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(BASE_PACKAGE)).setLevel(Level.DEBUG);
		}
		logConfiguration(properties);

		BackupRunner runner = GitBackupBuilder.create().properties(properties).settings(settings).buildRunner();
		BackupRunResult result = runner.run();
		return result.hasFailures() ? 1 : 0;
	}

	private static void logConfiguration(BackupProperties properties) {
		logger.info("Backup directory: {}", properties.getBackupDir());
		logger.info("Workers per provider: {}", properties.getWorkerCount());
		if (properties.getDiffModeOverride() != null) {
			logger.info("Compare mode: {}", properties.getDiffModeOverride());
		}
		if (properties.getBackupsToRetainOverride() != null) {
			logger.info("Bundles kept per repository: {}", properties.getBackupsToRetainOverride());
		}
		if (properties.getGitCommandTimeout().isZero()) {
			logger.info("Git command timeout: none");
		}
		else {
			logger.info("Git command timeout: {}s", properties.getGitCommandTimeout().toSeconds());
		}
	}

}
