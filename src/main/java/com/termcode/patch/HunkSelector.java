package com.termcode.patch;

import com.termcode.models.FileDiff;
import com.termcode.models.Hunk;
import com.termcode.models.HunkSelection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a patch into per-hunk selections and back into a patch containing only the selected hunks.
 * The regenerated text keeps hunk headers and bodies verbatim so it goes through the normal
 * parse/apply pipeline untouched.
 */
public class HunkSelector {

    private final UnifiedDiffParser parser;

    public HunkSelector() {
        this(new UnifiedDiffParser());
    }

    public HunkSelector(UnifiedDiffParser parser) {
        this.parser = parser;
    }

    /**
     * One selection per hunk, in patch order, ids {@code hunk-1..n}. Files without hunks have nothing to review.
     */
    public List<HunkSelection> parseForReview(String patchText) {
        List<HunkSelection> selections = new ArrayList<>();
        int counter = 0;
        for (FileDiff file : parser.parse(patchText)) {
            for (Hunk hunk : file.getHunks()) {
                selections.add(new HunkSelection("hunk-" + (++counter), file, hunk));
            }
        }
        return selections;
    }

    public static HunkSelection toggle(List<HunkSelection> selections, String id) {
        HunkSelection selection = find(selections, id);
        selection.toggle();
        return selection;
    }

    public static void selectAll(List<HunkSelection> selections) {
        selections.forEach(s -> s.setSelected(true));
    }

    public static void deselectAll(List<HunkSelection> selections) {
        selections.forEach(s -> s.setSelected(false));
    }

    /**
     * Deselects everything when all hunks are selected, otherwise selects everything.
     */
    public static void toggleAll(List<HunkSelection> selections) {
        boolean allSelected = selections.stream().allMatch(HunkSelection::isSelected);
        selections.forEach(s -> s.setSelected(!allSelected));
    }

    public static HunkSelection find(List<HunkSelection> selections, String id) {
        for (HunkSelection selection : selections) {
            if (selection.getId().equals(id)) {
                return selection;
            }
        }
        throw new IllegalArgumentException("Unknown hunk: " + id);
    }

    /**
     * Regenerates patch text from the selected hunks. Files with no selected hunk are dropped entirely.
     */
    public static String renderFiltered(List<HunkSelection> selections) {
        Map<FileDiff, List<Hunk>> byFile = new LinkedHashMap<>();
        for (HunkSelection selection : selections) {
            if (selection.isSelected()) {
                byFile.computeIfAbsent(selection.getFileDiff(), f -> new ArrayList<>()).add(selection.getHunk());
            }
        }

        StringBuilder out = new StringBuilder();
        for (Map.Entry<FileDiff, List<Hunk>> entry : byFile.entrySet()) {
            FileDiff file = entry.getKey();
            out.append(file.gitHeader()).append('\n');
            for (String header : file.getHeaderLines()) {
                out.append(header).append('\n');
            }
            for (Hunk hunk : entry.getValue()) {
                for (String line : hunk.toPatchLines()) {
                    out.append(line).append('\n');
                }
            }
        }
        return out.toString();
    }

    public static SelectionSummary summarize(List<HunkSelection> selections) {
        int selected = 0;
        Set<String> files = new LinkedHashSet<>();
        for (HunkSelection selection : selections) {
            if (selection.isSelected()) {
                selected++;
                files.add(selection.getFilePath());
            }
        }
        return new SelectionSummary(selections.size(), selected, new ArrayList<>(files));
    }

    public record SelectionSummary(int totalHunks, int selectedHunks, List<String> affectedFiles) {}
}
