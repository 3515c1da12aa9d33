package com.termcode.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A location that needs attention after (or instead of) applying a patch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConflictInfo {

    public enum Kind {
        /** Conflict markers left behind by a three-way merge. */
        MERGE,
        /** Expected context/remove line did not match the file. */
        CONTEXT,
        /** Mismatch that disappears once whitespace is ignored. */
        WHITESPACE
    }

    private final String file;
    private final int line;
    private final Kind kind;
    private final String message;
    private final String original;
    private final String incoming;

    public ConflictInfo(String file, int line, Kind kind, String message, String original, String incoming) {
        this.file = file;
        this.line = line;
        this.kind = kind;
        this.message = message;
        this.original = original;
        this.incoming = incoming;
    }

    public String getFile() { return file; }

    public int getLine() { return line; }

    public Kind getKind() { return kind; }

    public String getMessage() { return message; }

    public String getOriginal() { return original; }

    public String getIncoming() { return incoming; }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + file + ":" + line + " " + message;
    }
}
