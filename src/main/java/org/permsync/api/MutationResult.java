package org.permsync.api;

public class MutationResult {
    private static final MutationResult OK = new MutationResult(true, null);

    private final boolean success;
    private final String failureReason;

    private MutationResult(boolean success, String failureReason) {
        this.success = success;
        this.failureReason = failureReason;
    }

    public static MutationResult ok() {
        return OK;
    }

    public static MutationResult failed(String reason) {
        return new MutationResult(false, (reason == null) ? "unknown failure" : reason);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String toString() {
        return success ? "#<MutationResult OK>" : String.format("#<MutationResult FAILED: %s>", failureReason);
    }
}
