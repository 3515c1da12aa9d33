package com.termcode.models;

/**
 * One stage of a patch application: the delegated version-control merge, then the manual fallback.
 */
public class ApplyAttempt {

    public enum Stage {
        DELEGATED,
        MANUAL
    }

    public enum Status {
        SUCCESS,
        CONFLICTED,
        FAILED,
        SKIPPED
    }

    private final Stage stage;
    private final Status status;
    private final String detail;

    private ApplyAttempt(Stage stage, Status status, String detail) {
        this.stage = stage;
        this.status = status;
        this.detail = detail;
    }

    public static ApplyAttempt delegated(Status status, String detail) {
        return new ApplyAttempt(Stage.DELEGATED, status, detail);
    }

    public static ApplyAttempt manual(Status status, String detail) {
        return new ApplyAttempt(Stage.MANUAL, status, detail);
    }

    public Stage getStage() { return stage; }

    public Status getStatus() { return status; }

    public String getDetail() { return detail; }

    /**
     * A delegated attempt that did not settle the patch, so the manual applier must run.
     */
    public boolean requiresFallback() {
        return stage == Stage.DELEGATED && (status == Status.FAILED || status == Status.SKIPPED);
    }

    @Override
    public String toString() {
        return stage.name().toLowerCase() + ":" + status.name().toLowerCase()
            + (detail != null && !detail.isBlank() ? " (" + detail + ")" : "");
    }
}
