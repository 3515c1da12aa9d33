package com.termcode.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-patch outcome: which files landed, which were rejected, and what needs a second look.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffResult {

    public static final String STRATEGY_VERSION_CONTROL = "version-control";
    public static final String STRATEGY_MANUAL = "manual";
    public static final String STRATEGY_NONE = "none";
    public static final String STRATEGY_ROLLBACK = "rollback";

    private final List<String> applied = new ArrayList<>();
    private final List<String> rejected = new ArrayList<>();
    private final List<ConflictInfo> conflicts = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<FileApplyOutcome> files = new ArrayList<>();
    private final List<ApplyAttempt> attempts = new ArrayList<>();
    private String strategy = STRATEGY_NONE;
    private String fallbackReason;
    private String historyId;
    private boolean dryRun;

    public static DiffResult empty(String warning) {
        DiffResult result = new DiffResult();
        if (warning != null) {
            result.addWarning(warning);
        }
        return result;
    }

    /**
     * Folds a per-file outcome into the aggregate lists.
     */
    public void record(FileApplyOutcome outcome) {
        files.add(outcome);
        if (outcome.isSuccess()) {
            applied.add(outcome.getFile());
        } else {
            rejected.add(outcome.getFile());
        }
        conflicts.addAll(outcome.getConflicts());
        for (String warning : outcome.getWarnings()) {
            warnings.add(outcome.getFile() + ": " + warning);
        }
    }

    public void addApplied(String file) { applied.add(file); }

    public void addConflict(ConflictInfo conflict) { conflicts.add(conflict); }

    public void addWarning(String warning) { warnings.add(warning); }

    public void addAttempt(ApplyAttempt attempt) { attempts.add(attempt); }

    public List<String> getApplied() { return applied; }

    public List<String> getRejected() { return rejected; }

    public List<ConflictInfo> getConflicts() { return conflicts; }

    public List<String> getWarnings() { return warnings; }

    public List<FileApplyOutcome> getFiles() { return files; }

    public List<ApplyAttempt> getAttempts() { return attempts; }

    public String getStrategy() { return strategy; }

    public void setStrategy(String strategy) { this.strategy = strategy; }

    public String getFallbackReason() { return fallbackReason; }

    public void setFallbackReason(String fallbackReason) { this.fallbackReason = fallbackReason; }

    public String getHistoryId() { return historyId; }

    public void setHistoryId(String historyId) { this.historyId = historyId; }

    public boolean isDryRun() { return dryRun; }

    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }
}
