package org.springaicommunity.git.backup;

/**
 * Terminal state of one repository backup.
 */
public enum BackupStatus {

	OK, FAILED

}
