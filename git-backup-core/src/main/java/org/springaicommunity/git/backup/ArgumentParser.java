package org.springaicommunity.git.backup;

import java.time.Duration;
import java.util.List;

/**
 * Command-line argument parser for the backup application.
 */
public class ArgumentParser {

	private final BackupProperties defaultProperties;

	public ArgumentParser(BackupProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-d", "--backup-dir":
					config.backupDir = getRequiredValue(args, i, "backup-dir");
					i++;
					break;

				case "-c", "--compare":
					config.diffMode = DiffMode.parse(getRequiredValue(args, i, "compare"));
					i++;
					break;

				case "-k", "--keep":
					config.backupsToRetain = parseInt(getRequiredValue(args, i, "keep"), "keep", 0);
					i++;
					break;

				case "-w", "--workers":
					config.workerCount = parseInt(getRequiredValue(args, i, "workers"), "workers", 1);
					i++;
					break;

				case "--git-timeout":
					config.gitCommandTimeout = Duration
						.ofSeconds(parseInt(getRequiredValue(args, i, "git-timeout"), "git-timeout", 0));
					i++;
					break;

				case "--webhook":
					config.webhookUrl = getRequiredValue(args, i, "webhook");
					i++;
					break;

				case "--webhook-format":
					String format = getRequiredValue(args, i, "webhook-format").toLowerCase();
					if (!List.of("long", "short").contains(format)) {
						throw new IllegalArgumentException(
								"Invalid webhook format '" + format + "': must be 'long' or 'short'");
					}
					config.webhookFormat = format;
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested && (config.backupDir == null || config.backupDir.isBlank())) {
			throw new IllegalArgumentException("Backup directory is required: set GIT_BACKUP_DIR or pass --backup-dir");
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: git-backup [OPTIONS]\n");
		help.append("\n");
		help.append("Back up all repositories of the configured git providers as timestamped bundles.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help               Show this help message\n");
		help.append("    -d, --backup-dir DIR     Backup root directory (default: $GIT_BACKUP_DIR)\n");
		help.append("    -c, --compare MODE       clone or refs, for every provider (default: per provider)\n");
		help.append("    -k, --keep COUNT         Bundles kept per repository, 0 keeps all (default: ")
			.append(defaultProperties.getDefaultBackupsToRetain())
			.append(")\n");
		help.append("    -w, --workers COUNT      Concurrent backups per provider (default: ")
			.append(defaultProperties.getWorkerCount())
			.append(")\n");
		help.append("    --git-timeout SECONDS    Limit for a single git command, 0 for none (default: ")
			.append(defaultProperties.getGitCommandTimeout().toSeconds())
			.append(")\n");
		help.append("    --webhook URL            Post a JSON run summary to URL\n");
		help.append("    --webhook-format FORMAT  long or short (default: long)\n");
		help.append("    -v, --verbose            Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GIT_BACKUP_DIR, GIT_REQUEST_TIMEOUT, GIT_BACKUP_WORKERS, GIT_COMMAND_TIMEOUT\n");
		help.append("    GIT_BACKUP_RETAIN, GIT_BINARY, GIT_REQUEST_RETRIES, GIT_REQUEST_RETRY_DELAY,\n");
		help.append("        GIT_REQUEST_RETRY_MAX_DELAY\n");
		help.append("    GITHUB_TOKEN, GITHUB_ORGS, GITHUB_SKIP_USER_REPOS, GITHUB_LIMIT_USER_OWNED,\n");
		help.append("        GITHUB_COMPARE, GITHUB_BACKUPS, GITHUB_APIURL, GITHUB_WORKER_DELAY\n");
		help.append("    GITLAB_TOKEN, GITLAB_APIURL, GITLAB_COMPARE, GITLAB_BACKUPS,\n");
		help.append("        GITLAB_PROJECT_MIN_ACCESS_LEVEL\n");
		help.append("    GITEA_APIURL, GITEA_TOKEN, GITEA_ORGS, GITEA_COMPARE, GITEA_BACKUPS\n");
		help.append("    BITBUCKET_EMAIL, BITBUCKET_API_TOKEN, BITBUCKET_USER, BITBUCKET_KEY,\n");
		help.append("        BITBUCKET_SECRET, BITBUCKET_APIURL, BITBUCKET_COMPARE, BITBUCKET_BACKUPS\n");
		help.append("    AZURE_DEVOPS_USERNAME, AZURE_DEVOPS_PAT, AZURE_DEVOPS_ORGS,\n");
		help.append("        AZURE_DEVOPS_COMPARE, AZURE_DEVOPS_BACKUPS\n");
		help.append("    SOURCEHUT_PAT, SOURCEHUT_APIURL, SOURCEHUT_COMPARE, SOURCEHUT_BACKUPS\n");
		help.append("    SOBA_WEBHOOK_URL, SOBA_WEBHOOK_FORMAT\n");
		help.append("    Tokens can also be read from a file named by <NAME>_FILE.\n");
		help.append("\n");
		help.append("EXIT STATUS:\n");
		help.append("    0 when every repository was backed up, 1 otherwise.\n");
		return help.toString();
	}

	private static String getRequiredValue(String[] args, int index, String optionName) {
		if (index + 1 >= args.length || args[index + 1].startsWith("-")) {
			throw new IllegalArgumentException("Option --" + optionName + " requires a value");
		}
		return args[index + 1];
	}

	private static int parseInt(String value, String optionName, int minimum) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed < minimum) {
				throw new IllegalArgumentException(optionName + " must be at least " + minimum + ": " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be an integer");
		}
	}

}
