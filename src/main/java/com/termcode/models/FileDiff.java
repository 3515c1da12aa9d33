package com.termcode.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All changes to a single file inside a patch.
 */
public class FileDiff {

    public enum Operation {
        CREATE,
        MODIFY,
        DELETE,
        RENAME
    }

    private final String file;
    private final String oldPath;
    private final String newPath;
    private final Operation operation;
    private final List<Hunk> hunks;
    // metadata between "diff --git" and the first hunk (index, mode, ---/+++ lines)
    private final List<String> headerLines;

    public FileDiff(String oldPath, String newPath, Operation operation, List<Hunk> hunks, List<String> headerLines) {
        this.oldPath = oldPath;
        this.newPath = newPath;
        this.operation = operation != null ? operation : Operation.MODIFY;
        this.file = this.operation == Operation.DELETE ? oldPath : newPath;
        this.hunks = hunks != null ? Collections.unmodifiableList(new ArrayList<>(hunks)) : List.of();
        this.headerLines = headerLines != null ? Collections.unmodifiableList(new ArrayList<>(headerLines)) : List.of();
    }

    public String getFile() { return file; }

    public String getOldPath() { return oldPath; }

    public String getNewPath() { return newPath; }

    public Operation getOperation() { return operation; }

    public List<Hunk> getHunks() { return hunks; }

    @JsonIgnore
    public List<String> getHeaderLines() { return headerLines; }

    public String gitHeader() {
        return "diff --git a/" + oldPath + " b/" + newPath;
    }
}
