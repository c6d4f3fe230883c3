package com.notevault.backup.restore;

import java.util.List;

/**
 * Outcome of a whole restore call.
 *
 * {@code restoredPayloads} has one entry per successfully restored workspace,
 * in manifest order; {@code workspaces} has a report for every workspace
 * that was attempted.
 */
public record RestoreResult(
        String                       message,
        List<RestoredPayload>        restoredPayloads,
        List<WorkspaceRestoreReport> workspaces
) {
    public long failedCount() {
        return workspaces.stream().filter(WorkspaceRestoreReport::isFailed).count();
    }
}
