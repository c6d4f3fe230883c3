package com.notevault.backup.config;

/**
 * What a restore does when one workspace fails inside its transaction.
 *
 * Workspaces committed before the failure stay committed under both policies;
 * there is no cross-workspace rollback.
 */
public enum RestoreFailurePolicy {
    /** Stop at the first failing workspace and fail the whole call. */
    ABORT_ALL,
    /** Roll back the failing workspace, report it, and carry on with the rest. */
    CONTINUE
}
