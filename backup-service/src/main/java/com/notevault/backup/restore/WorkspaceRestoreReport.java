package com.notevault.backup.restore;

import java.util.List;

/**
 * What happened to one workspace during a restore.
 *
 * @param error null unless {@code status} is FAILED
 */
public record WorkspaceRestoreReport(
        String            workspaceId,
        Status            status,
        List<StepOutcome> outcomes,
        String            error
) {
    public enum Status { RESTORED, FAILED }

    public static WorkspaceRestoreReport restored(String workspaceId, List<StepOutcome> outcomes) {
        return new WorkspaceRestoreReport(workspaceId, Status.RESTORED, List.copyOf(outcomes), null);
    }

    public static WorkspaceRestoreReport failed(String workspaceId, List<StepOutcome> outcomes, String error) {
        return new WorkspaceRestoreReport(workspaceId, Status.FAILED, List.copyOf(outcomes), error);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
