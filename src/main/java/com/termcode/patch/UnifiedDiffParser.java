package com.termcode.patch;

import com.termcode.models.DiffLine;
import com.termcode.models.FileDiff;
import com.termcode.models.Hunk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses git-style unified diff text into {@link FileDiff}s.
 * <p>
 * Input usually comes straight from a model reply, so parsing is permissive: prose before, between
 * or after file blocks is ignored, and a {@code diff --git} line that can't be read drops its whole
 * block instead of failing the parse. Nothing here throws on malformed input.
 */
public class UnifiedDiffParser {

    static final Pattern FILE_HEADER = Pattern.compile("^diff --git a/(.+?) b/(.+)$");
    static final Pattern HUNK_HEADER = Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@(.*)$");

    private static final String DEV_NULL = "/dev/null";

    public List<FileDiff> parse(String patchText) {
        return parseDetailed(patchText).getFiles();
    }

    public ParseResult parseDetailed(String patchText) {
        if (patchText == null || patchText.isBlank()) {
            return new ParseResult(List.of(), List.of());
        }

        List<FileDiff> files = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        FileBuilder file = null;
        HunkBuilder hunk = null;

        String[] lines = patchText.split("\\r?\\n", -1);
        // the terminating newline is not an extra blank line
        int lineCount = lines.length > 0 && lines[lines.length - 1].isEmpty() ? lines.length - 1 : lines.length;

        for (int i = 0; i < lineCount; i++) {
            String line = lines[i];
            if (line.startsWith("diff --git ")) {
                if (file != null) {
                    file.finishHunk(hunk);
                    files.add(file.build());
                }
                hunk = null;
                Matcher m = FILE_HEADER.matcher(line);
                if (m.matches()) {
                    file = new FileBuilder(m.group(1), m.group(2));
                } else {
                    skipped.add(line);
                    file = null;
                }
                continue;
            }
            if (file == null) {
                continue;
            }

            if (hunk != null) {
                if (line.startsWith("\\")) {
                    // "\ No newline at end of file"
                    hunk.raw.add(line);
                    continue;
                }
                if (line.isEmpty() && hunk.expectsMore()) {
                    // blank context line whose leading space was stripped
                    hunk.addContext("");
                    continue;
                }
                if (!line.isEmpty()) {
                    char tag = line.charAt(0);
                    if (tag == '+') {
                        hunk.addAdd(line.substring(1));
                        continue;
                    }
                    if (tag == '-') {
                        hunk.addRemove(line.substring(1));
                        continue;
                    }
                    if (tag == ' ') {
                        hunk.addContext(line.substring(1));
                        continue;
                    }
                }
                file.finishHunk(hunk);
                hunk = null;
            }

            Matcher m = HUNK_HEADER.matcher(line);
            if (m.matches()) {
                hunk = new HunkBuilder(
                    Integer.parseInt(m.group(1)),
                    m.group(2) != null ? Integer.parseInt(m.group(2)) : 1,
                    Integer.parseInt(m.group(3)),
                    m.group(4) != null ? Integer.parseInt(m.group(4)) : 1,
                    m.group(5).stripLeading(),
                    line);
                continue;
            }

            if (!file.hasHunks()) {
                file.metadata(line);
            }
        }

        if (file != null) {
            file.finishHunk(hunk);
            files.add(file.build());
        }
        return new ParseResult(files, skipped);
    }

    /**
     * Parsed files plus the {@code diff --git} lines whose blocks were dropped.
     */
    public static class ParseResult {
        private final List<FileDiff> files;
        private final List<String> skippedHeaders;

        public ParseResult(List<FileDiff> files, List<String> skippedHeaders) {
            this.files = Collections.unmodifiableList(new ArrayList<>(files));
            this.skippedHeaders = Collections.unmodifiableList(new ArrayList<>(skippedHeaders));
        }

        public List<FileDiff> getFiles() {
            return files;
        }

        public List<String> getSkippedHeaders() {
            return skippedHeaders;
        }

        public boolean isEmpty() {
            return files.isEmpty();
        }
    }

    private static final class FileBuilder {
        private String oldPath;
        private String newPath;
        private boolean created;
        private boolean deleted;
        private final List<String> headerLines = new ArrayList<>();
        private final List<Hunk> hunks = new ArrayList<>();

        FileBuilder(String oldPath, String newPath) {
            this.oldPath = oldPath;
            this.newPath = newPath;
        }

        boolean hasHunks() {
            return !hunks.isEmpty();
        }

        void metadata(String line) {
            if (line.isBlank()) {
                return;
            }
            headerLines.add(line);
            if (line.startsWith("new file mode")) {
                created = true;
            } else if (line.startsWith("deleted file mode")) {
                deleted = true;
            } else if (line.startsWith("rename from ")) {
                oldPath = line.substring("rename from ".length()).trim();
            } else if (line.startsWith("rename to ")) {
                newPath = line.substring("rename to ".length()).trim();
            } else if (line.startsWith("--- ") && DEV_NULL.equals(line.substring(4).trim())) {
                created = true;
            } else if (line.startsWith("+++ ") && DEV_NULL.equals(line.substring(4).trim())) {
                deleted = true;
            }
        }

        void finishHunk(HunkBuilder hunk) {
            if (hunk != null) {
                hunks.add(hunk.build());
            }
        }

        FileDiff build() {
            FileDiff.Operation operation;
            if (created) {
                operation = FileDiff.Operation.CREATE;
            } else if (deleted) {
                operation = FileDiff.Operation.DELETE;
            } else if (!oldPath.equals(newPath)) {
                operation = FileDiff.Operation.RENAME;
            } else {
                operation = FileDiff.Operation.MODIFY;
            }
            return new FileDiff(oldPath, newPath, operation, hunks, headerLines);
        }
    }

    private static final class HunkBuilder {
        private final int oldStart;
        private final int oldCount;
        private final int newStart;
        private final int newCount;
        private final String context;
        private final String header;
        private final List<DiffLine> lines = new ArrayList<>();
        private final List<String> raw = new ArrayList<>();
        private int oldLine;
        private int newLine;

        HunkBuilder(int oldStart, int oldCount, int newStart, int newCount, String context, String header) {
            this.oldStart = oldStart;
            this.oldCount = oldCount;
            this.newStart = newStart;
            this.newCount = newCount;
            this.context = context;
            this.header = header;
            this.oldLine = oldStart;
            this.newLine = newStart;
        }

        boolean expectsMore() {
            return (oldLine - oldStart) < oldCount || (newLine - newStart) < newCount;
        }

        void addAdd(String content) {
            lines.add(DiffLine.add(content, newLine++));
            raw.add("+" + content);
        }

        void addRemove(String content) {
            lines.add(DiffLine.remove(content, oldLine++));
            raw.add("-" + content);
        }

        void addContext(String content) {
            lines.add(DiffLine.context(content, oldLine++, newLine++));
            raw.add(" " + content);
        }

        Hunk build() {
            return new Hunk(oldStart, oldCount, newStart, newCount, context, header, lines, raw);
        }
    }
}
