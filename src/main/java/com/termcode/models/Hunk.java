package com.termcode.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@code @@ -a,b +c,d @@} block of a file diff.
 * Line numbers in the header always refer to the original, pre-edit file.
 */
public class Hunk {
    private final int oldStart;
    private final int oldCount;
    private final int newStart;
    private final int newCount;
    private final String context;
    private final String header;
    private final List<DiffLine> lines;
    // verbatim body text including "\ No newline at end of file" markers
    private final List<String> rawLines;

    public Hunk(int oldStart, int oldCount, int newStart, int newCount, String context, String header,
                List<DiffLine> lines, List<String> rawLines) {
        this.oldStart = oldStart;
        this.oldCount = oldCount;
        this.newStart = newStart;
        this.newCount = newCount;
        this.context = context != null ? context : "";
        this.header = header != null ? header : formatHeader(oldStart, oldCount, newStart, newCount, this.context);
        this.lines = lines != null ? Collections.unmodifiableList(new ArrayList<>(lines)) : List.of();
        this.rawLines = rawLines != null ? Collections.unmodifiableList(new ArrayList<>(rawLines)) : List.of();
    }

    public static String formatHeader(int oldStart, int oldCount, int newStart, int newCount, String context) {
        String header = "@@ -" + oldStart + "," + oldCount + " +" + newStart + "," + newCount + " @@";
        if (context != null && !context.isEmpty()) {
            header += " " + context;
        }
        return header;
    }

    public int getOldStart() { return oldStart; }

    public int getOldCount() { return oldCount; }

    public int getNewStart() { return newStart; }

    public int getNewCount() { return newCount; }

    public String getContext() { return context; }

    public String getHeader() { return header; }

    public List<DiffLine> getLines() { return lines; }

    @JsonIgnore
    public List<String> getRawLines() { return rawLines; }

    /**
     * Number of context + remove lines, i.e. how many lines of the target file this hunk consumes.
     */
    public int countOldSideLines() {
        int count = 0;
        for (DiffLine line : lines) {
            if (line.isOldSide()) count++;
        }
        return count;
    }

    public int countNewSideLines() {
        int count = 0;
        for (DiffLine line : lines) {
            if (line.isNewSide()) count++;
        }
        return count;
    }

    /**
     * Whether the declared header counts agree with the tagged body lines.
     */
    public boolean hasConsistentCounts() {
        return countOldSideLines() == oldCount && countNewSideLines() == newCount;
    }

    /**
     * Header plus body exactly as parsed, one entry per line.
     */
    public List<String> toPatchLines() {
        List<String> out = new ArrayList<>();
        out.add(header);
        if (!rawLines.isEmpty()) {
            out.addAll(rawLines);
        } else {
            for (DiffLine line : lines) {
                out.add(line.toPatchLine());
            }
        }
        return out;
    }
}
