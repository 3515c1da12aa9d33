package com.termcode.patch;

import java.util.ArrayList;
import java.util.List;

/**
 * A file's content as an editable list of lines, remembering its line separator and
 * whether it ended with one so it can be written back unchanged apart from the edits.
 */
public final class LineBuffer {

    private final List<String> lines;
    private final String separator;
    private final boolean trailingNewline;

    private LineBuffer(List<String> lines, String separator, boolean trailingNewline) {
        this.lines = lines;
        this.separator = separator;
        this.trailingNewline = trailingNewline;
    }

    public static LineBuffer of(String content) {
        if (content == null || content.isEmpty()) {
            return new LineBuffer(new ArrayList<>(), "\n", true);
        }
        String separator = content.contains("\r\n") ? "\r\n" : "\n";
        boolean trailing = content.endsWith("\n");
        String body = content;
        if (trailing) {
            body = content.endsWith(separator)
                ? content.substring(0, content.length() - separator.length())
                : content.substring(0, content.length() - 1);
        }
        List<String> lines = new ArrayList<>(List.of(body.split(separator, -1)));
        return new LineBuffer(lines, separator, trailing);
    }

    /**
     * The live, mutable line list.
     */
    public List<String> lines() {
        return lines;
    }

    public String separator() {
        return separator;
    }

    public String join() {
        if (lines.isEmpty()) {
            return "";
        }
        String joined = String.join(separator, lines);
        return trailingNewline ? joined + separator : joined;
    }
}
