package com.termcode.models;

/**
 * A single body line of a hunk.
 * Remove and context lines carry an old line number; add and context lines carry a new one.
 */
public class DiffLine {

    public enum Kind {
        ADD('+'),
        REMOVE('-'),
        CONTEXT(' ');

        private final char prefix;

        Kind(char prefix) {
            this.prefix = prefix;
        }

        public char getPrefix() {
            return prefix;
        }
    }

    private final Kind kind;
    private final String content;
    private final Integer oldLineNumber;
    private final Integer newLineNumber;

    public DiffLine(Kind kind, String content, Integer oldLineNumber, Integer newLineNumber) {
        this.kind = kind;
        this.content = content != null ? content : "";
        this.oldLineNumber = oldLineNumber;
        this.newLineNumber = newLineNumber;
    }

    public static DiffLine add(String content, int newLineNumber) {
        return new DiffLine(Kind.ADD, content, null, newLineNumber);
    }

    public static DiffLine remove(String content, int oldLineNumber) {
        return new DiffLine(Kind.REMOVE, content, oldLineNumber, null);
    }

    public static DiffLine context(String content, int oldLineNumber, int newLineNumber) {
        return new DiffLine(Kind.CONTEXT, content, oldLineNumber, newLineNumber);
    }

    public Kind getKind() { return kind; }

    public String getContent() { return content; }

    public Integer getOldLineNumber() { return oldLineNumber; }

    public Integer getNewLineNumber() { return newLineNumber; }

    /**
     * True for lines that must already exist in the target file (context and remove).
     */
    public boolean isOldSide() {
        return kind == Kind.CONTEXT || kind == Kind.REMOVE;
    }

    /**
     * True for lines that exist after the hunk is applied (context and add).
     */
    public boolean isNewSide() {
        return kind == Kind.CONTEXT || kind == Kind.ADD;
    }

    /**
     * The line as it appears in unified-diff text.
     */
    public String toPatchLine() {
        return kind.getPrefix() + content;
    }
}
