package com.termcode.patch;

import com.termcode.AppLogger;
import com.termcode.WorkspaceService;
import com.termcode.models.ConflictInfo;
import com.termcode.vcs.VersionControl;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds conflict-marker blocks in files version control reports as unmerged.
 */
public class ConflictExtractor {

    static final String OURS_MARKER = "<<<<<<<";
    static final String BASE_MARKER = "|||||||";
    static final String SEPARATOR_MARKER = "=======";
    static final String THEIRS_MARKER = ">>>>>>>";

    private final WorkspaceService workspaceService;
    private final VersionControl versionControl;

    public ConflictExtractor(WorkspaceService workspaceService, VersionControl versionControl) {
        this.workspaceService = workspaceService;
        this.versionControl = versionControl;
    }

    /**
     * Scans every unmerged file. Files that can't be read are skipped.
     */
    public List<ConflictInfo> findConflicts() {
        List<ConflictInfo> conflicts = new ArrayList<>();
        for (String file : versionControl.listUnmergedFiles()) {
            try {
                String content = workspaceService.readFile(file);
                conflicts.addAll(extract(file, content));
            } catch (IOException | SecurityException e) {
                log("Skipping unreadable unmerged file " + file + ": " + e.getMessage());
            }
        }
        return conflicts;
    }

    /**
     * Extracts every {@code <<<<<<< / ======= / >>>>>>>} block from one file's content.
     * diff3-style base sections ({@code |||||||}) are left out of both sides.
     */
    public static List<ConflictInfo> extract(String file, String content) {
        List<ConflictInfo> conflicts = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return conflicts;
        }
        String[] lines = content.split("\\r?\\n", -1);

        int i = 0;
        while (i < lines.length) {
            if (!lines[i].startsWith(OURS_MARKER)) {
                i++;
                continue;
            }
            int startLine = i + 1;
            String oursLabel = label(lines[i], OURS_MARKER);
            List<String> original = new ArrayList<>();
            List<String> incoming = new ArrayList<>();
            String theirsLabel = null;
            boolean inBase = false;
            boolean inIncoming = false;
            boolean closed = false;

            i++;
            while (i < lines.length) {
                String line = lines[i];
                if (line.startsWith(THEIRS_MARKER) && inIncoming) {
                    theirsLabel = label(line, THEIRS_MARKER);
                    closed = true;
                    i++;
                    break;
                }
                if (line.startsWith(SEPARATOR_MARKER) && !inIncoming) {
                    inIncoming = true;
                    inBase = false;
                } else if (line.startsWith(BASE_MARKER) && !inIncoming) {
                    inBase = true;
                } else if (inIncoming) {
                    incoming.add(line);
                } else if (!inBase) {
                    original.add(line);
                }
                i++;
            }

            String message;
            if (closed) {
                message = "Merge conflict between " + describe(oursLabel, "ours") + " and " + describe(theirsLabel, "theirs");
            } else {
                message = "Unterminated merge conflict starting at line " + startLine;
            }
            conflicts.add(new ConflictInfo(file, startLine, ConflictInfo.Kind.MERGE, message,
                String.join("\n", original), String.join("\n", incoming)));
        }
        return conflicts;
    }

    private static String label(String markerLine, String marker) {
        String label = markerLine.substring(marker.length()).trim();
        return label.isEmpty() ? null : label;
    }

    private static String describe(String label, String fallback) {
        return label != null ? label : fallback;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[ConflictExtractor] " + message);
        }
    }
}
