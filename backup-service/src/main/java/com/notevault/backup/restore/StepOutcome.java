package com.notevault.backup.restore;

/**
 * Result of one per-workspace restore step.
 *
 * SKIPPED means an optional resource was absent, which is not an error.
 */
public record StepOutcome(RestoreStage stage, Status status, String detail) {

    public enum Status { APPLIED, SKIPPED, FAILED }

    public static StepOutcome applied(RestoreStage stage, String detail) {
        return new StepOutcome(stage, Status.APPLIED, detail);
    }

    public static StepOutcome skipped(RestoreStage stage, String detail) {
        return new StepOutcome(stage, Status.SKIPPED, detail);
    }

    public static StepOutcome failed(RestoreStage stage, String detail) {
        return new StepOutcome(stage, Status.FAILED, detail);
    }
}
