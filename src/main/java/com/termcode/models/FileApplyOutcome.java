package com.termcode.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of applying one {@link FileDiff}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FileApplyOutcome {
    private final String file;
    private final FileDiff.Operation operation;
    private final boolean success;
    private final List<ConflictInfo> conflicts;
    private final List<String> warnings;
    private final String error;
    private String preview;

    private FileApplyOutcome(String file, FileDiff.Operation operation, boolean success,
                             List<ConflictInfo> conflicts, List<String> warnings, String error) {
        this.file = file;
        this.operation = operation;
        this.success = success;
        this.conflicts = conflicts != null ? new ArrayList<>(conflicts) : new ArrayList<>();
        this.warnings = warnings != null ? new ArrayList<>(warnings) : new ArrayList<>();
        this.error = error;
    }

    public static FileApplyOutcome success(String file, FileDiff.Operation operation, List<String> warnings) {
        return new FileApplyOutcome(file, operation, true, null, warnings, null);
    }

    public static FileApplyOutcome failure(String file, FileDiff.Operation operation, String error,
                                           List<ConflictInfo> conflicts, List<String> warnings) {
        return new FileApplyOutcome(file, operation, false, conflicts, warnings, error);
    }

    public String getFile() { return file; }

    public FileDiff.Operation getOperation() { return operation; }

    public boolean isSuccess() { return success; }

    public List<ConflictInfo> getConflicts() { return conflicts; }

    public List<String> getWarnings() { return warnings; }

    public String getError() { return error; }

    /**
     * Unified diff of the would-be change, only filled in for dry runs.
     */
    public String getPreview() { return preview; }

    public void setPreview(String preview) { this.preview = preview; }
}
