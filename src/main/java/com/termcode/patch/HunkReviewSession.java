package com.termcode.patch;

import com.termcode.models.HunkSelection;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Line-oriented review loop: shows one hunk at a time and reads one command per line
 * until {@code q} or end of input.
 *
 * <pre>
 *   s   select/deselect the current hunk
 *   n   next hunk
 *   p   previous hunk
 *   a   select all, or deselect all when everything is selected
 *   q   finish
 * </pre>
 */
public class HunkReviewSession {

    private static final String COMMANDS = "Commands: [s]elect/deselect  [n]ext  [p]rev  [a]ll  [q]uit";

    private final BufferedReader in;
    private final PrintStream out;

    public HunkReviewSession(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Runs the loop, mutating the selections in place, and returns them.
     */
    public List<HunkSelection> run(List<HunkSelection> selections) throws IOException {
        if (selections.isEmpty()) {
            out.println("No hunks to review.");
            return selections;
        }

        int current = 0;
        show(selections, current);

        String input;
        while ((input = in.readLine()) != null) {
            String command = input.trim().toLowerCase();
            if ("q".equals(command)) {
                break;
            }
            switch (command) {
                case "s":
                case "space":
                    selections.get(current).toggle();
                    show(selections, current);
                    break;
                case "n":
                    if (current < selections.size() - 1) {
                        current++;
                        show(selections, current);
                    } else {
                        out.println("Already at the last hunk.");
                    }
                    break;
                case "p":
                    if (current > 0) {
                        current--;
                        show(selections, current);
                    } else {
                        out.println("Already at the first hunk.");
                    }
                    break;
                case "a":
                    HunkSelector.toggleAll(selections);
                    show(selections, current);
                    break;
                default:
                    out.println("Unknown command '" + input.trim() + "'. Use s, n, p, a, or q");
                    break;
            }
        }

        HunkSelector.SelectionSummary summary = HunkSelector.summarize(selections);
        out.println();
        out.println("Selected " + summary.selectedHunks() + " of " + summary.totalHunks() + " hunks for application");
        return selections;
    }

    private void show(List<HunkSelection> selections, int index) {
        HunkSelection selection = selections.get(index);
        out.println();
        out.println("Hunk " + (index + 1) + " of " + selections.size());
        out.println("File: " + selection.getFilePath());
        out.println("Status: " + (selection.isSelected() ? "[x] selected" : "[ ] skipped"));
        out.println();
        for (String line : selection.getHunk().toPatchLines()) {
            out.println(line);
        }
        out.println();
        out.println(COMMANDS);
    }
}
