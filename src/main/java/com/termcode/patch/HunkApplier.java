package com.termcode.patch;

import com.termcode.models.ConflictInfo;
import com.termcode.models.DiffLine;
import com.termcode.models.Hunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies one hunk to an in-memory line buffer.
 * <p>
 * Hunk headers number lines against the original file, so the caller threads a running offset
 * (net lines added by earlier hunks of the same file) from one call to the next. Hunks of a file
 * must be applied in source order. A hunk either applies completely or leaves the buffer untouched.
 */
public class HunkApplier {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;

    private final double fuzzyThreshold;

    public HunkApplier() {
        this(DEFAULT_FUZZY_THRESHOLD);
    }

    public HunkApplier(double fuzzyThreshold) {
        if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("Fuzzy threshold must be between 0 and 1: " + fuzzyThreshold);
        }
        this.fuzzyThreshold = fuzzyThreshold;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public HunkApplyResult applyHunk(List<String> lines, Hunk hunk, int runningOffset) {
        return applyHunk(lines, hunk, runningOffset, null);
    }

    /**
     * @param lines         mutable buffer, edited in place on success
     * @param hunk          the hunk to apply
     * @param runningOffset net line delta of the hunks already applied to this buffer
     * @param file          file name for conflict reports, may be null
     */
    public HunkApplyResult applyHunk(List<String> lines, Hunk hunk, int runningOffset, String file) {
        List<String> warnings = new ArrayList<>();
        int startIdx = startIndex(hunk) + runningOffset;

        if (startIdx < 0 || startIdx > lines.size()) {
            String error = "Hunk " + hunk.getHeader() + " starts at line " + (startIdx + 1)
                + " but the file has " + lines.size() + " lines";
            ConflictInfo conflict = new ConflictInfo(file, Math.max(startIdx + 1, 0), ConflictInfo.Kind.CONTEXT,
                error, null, null);
            return HunkApplyResult.failure(runningOffset, error, List.of(conflict), warnings);
        }

        // Verify every context/remove line before touching the buffer
        List<String> replacement = new ArrayList<>();
        int idx = startIdx;
        for (DiffLine line : hunk.getLines()) {
            if (line.getKind() == DiffLine.Kind.ADD) {
                replacement.add(line.getContent());
                continue;
            }
            int lineNumber = idx + 1;
            if (idx >= lines.size()) {
                String error = "Context mismatch at line " + lineNumber + ": expected '" + line.getContent()
                    + "' but reached end of file";
                ConflictInfo conflict = new ConflictInfo(file, lineNumber, ConflictInfo.Kind.CONTEXT, error,
                    null, line.getContent());
                return HunkApplyResult.failure(runningOffset, error, List.of(conflict), warnings);
            }

            String actual = lines.get(idx);
            String expectedTrimmed = line.getContent().trim();
            String actualTrimmed = actual.trim();
            if (!expectedTrimmed.equals(actualTrimmed)) {
                double score = SimilarityMatcher.similarity(expectedTrimmed, actualTrimmed);
                if (score < fuzzyThreshold) {
                    ConflictInfo.Kind kind = sameIgnoringWhitespace(expectedTrimmed, actualTrimmed)
                        ? ConflictInfo.Kind.WHITESPACE
                        : ConflictInfo.Kind.CONTEXT;
                    String error = "Context mismatch at line " + lineNumber + ": expected '" + line.getContent()
                        + "' but found '" + actual + "' (similarity " + format(score) + ")";
                    ConflictInfo conflict = new ConflictInfo(file, lineNumber, kind, error, actual, line.getContent());
                    return HunkApplyResult.failure(runningOffset, error, List.of(conflict), warnings);
                }
                warnings.add("Fuzzy matched line " + lineNumber + " (similarity " + format(score) + ")");
            }

            if (line.getKind() == DiffLine.Kind.CONTEXT) {
                // the file's own text wins for context lines, fuzzy matched or not
                replacement.add(actual);
            }
            idx++;
        }

        int removedCount = idx - startIdx;
        lines.subList(startIdx, startIdx + removedCount).clear();
        lines.addAll(startIdx, replacement);

        return HunkApplyResult.success(runningOffset + (replacement.size() - removedCount), warnings);
    }

    /**
     * Zero-based buffer index where the hunk begins, before any offset.
     * A hunk that consumes no old lines ({@code -N,0}) inserts after line N.
     */
    static int startIndex(Hunk hunk) {
        if (hunk.getOldCount() == 0 && hunk.countOldSideLines() == 0) {
            return hunk.getOldStart();
        }
        return Math.max(hunk.getOldStart() - 1, 0);
    }

    private static boolean sameIgnoringWhitespace(String a, String b) {
        return a.replaceAll("\\s+", "").equals(b.replaceAll("\\s+", ""));
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
