package com.termcode.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A hunk under interactive review. Selected by default.
 */
public class HunkSelection {
    private final String id;
    private final String filePath;
    private final Hunk hunk;
    private final FileDiff fileDiff;
    private boolean selected = true;

    public HunkSelection(String id, FileDiff fileDiff, Hunk hunk) {
        this.id = id;
        this.fileDiff = fileDiff;
        this.filePath = fileDiff.getFile();
        this.hunk = hunk;
    }

    public String getId() { return id; }

    public String getFilePath() { return filePath; }

    public Hunk getHunk() { return hunk; }

    @JsonIgnore
    public FileDiff getFileDiff() { return fileDiff; }

    public boolean isSelected() { return selected; }

    public void setSelected(boolean selected) { this.selected = selected; }

    public void toggle() {
        this.selected = !this.selected;
    }
}
