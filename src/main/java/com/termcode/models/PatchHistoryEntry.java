package com.termcode.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-application snapshot of every file a manual application touched.
 * A null snapshot means the file did not exist before.
 */
public class PatchHistoryEntry {
    private String id;
    private long appliedAt;
    private final Map<String, String> snapshots = new LinkedHashMap<>();
    private final List<String> files = new ArrayList<>();
    private boolean rolledBack;

    public PatchHistoryEntry() {}

    public PatchHistoryEntry(String id, long appliedAt) {
        this.id = id;
        this.appliedAt = appliedAt;
    }

    /**
     * Keeps the first snapshot seen for a path; later writes to the same path in one patch don't overwrite it.
     */
    public void remember(String file, String originalContent) {
        if (!snapshots.containsKey(file)) {
            snapshots.put(file, originalContent);
            files.add(file);
        }
    }

    public String getId() { return id; }

    public void setId(String id) { this.id = id; }

    public long getAppliedAt() { return appliedAt; }

    public void setAppliedAt(long appliedAt) { this.appliedAt = appliedAt; }

    public List<String> getFiles() { return files; }

    public Map<String, String> snapshots() { return snapshots; }

    public boolean isRolledBack() { return rolledBack; }

    public void setRolledBack(boolean rolledBack) { this.rolledBack = rolledBack; }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }
}
