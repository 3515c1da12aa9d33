package com.termcode.patch;

import com.termcode.models.ConflictInfo;

import java.util.ArrayList;
import java.util.List;

public class HunkApplyResult {
    private final boolean success;
    private final int newOffset;
    private final List<ConflictInfo> conflicts;
    private final List<String> warnings;
    private final String error;

    private HunkApplyResult(boolean success, int newOffset, List<ConflictInfo> conflicts,
                            List<String> warnings, String error) {
        this.success = success;
        this.newOffset = newOffset;
        this.conflicts = conflicts != null ? conflicts : new ArrayList<>();
        this.warnings = warnings != null ? warnings : new ArrayList<>();
        this.error = error;
    }

    public static HunkApplyResult success(int newOffset, List<String> warnings) {
        return new HunkApplyResult(true, newOffset, null, warnings, null);
    }

    /**
     * The buffer was left untouched; the offset is passed through unchanged.
     */
    public static HunkApplyResult failure(int offset, String error, List<ConflictInfo> conflicts, List<String> warnings) {
        return new HunkApplyResult(false, offset, conflicts, warnings, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getNewOffset() {
        return newOffset;
    }

    public List<ConflictInfo> getConflicts() {
        return conflicts;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public String getError() {
        return error;
    }
}
