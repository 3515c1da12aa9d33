package com.termcode;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.termcode.PatchConfigStore.PatchEngineConfig;
import com.termcode.models.ApplyAttempt;
import com.termcode.models.ConflictInfo;
import com.termcode.models.DiffResult;
import com.termcode.models.FileApplyOutcome;
import com.termcode.models.FileDiff;
import com.termcode.models.Hunk;
import com.termcode.models.PatchHistoryEntry;
import com.termcode.patch.ConflictExtractor;
import com.termcode.patch.HunkApplier;
import com.termcode.patch.HunkApplyResult;
import com.termcode.patch.LineBuffer;
import com.termcode.patch.UnifiedDiffParser;
import com.termcode.vcs.CommandResult;
import com.termcode.vcs.VersionControl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies unified diffs to one repository.
 * <p>
 * The patch is first handed to version control as a three-way merge. If that can't settle it, the
 * patch is parsed and applied file by file with {@link HunkApplier}. A failing hunk rejects only its
 * own file; nothing is written for a rejected file and the remaining files still go through.
 */
public class PatchService {

    private final WorkspaceService workspaceService;
    private final VersionControl versionControl;
    private final PatchEngineConfig config;
    private final UnifiedDiffParser parser = new UnifiedDiffParser();
    private final HunkApplier hunkApplier;
    private final ConflictExtractor conflictExtractor;
    private final Deque<PatchHistoryEntry> history = new ArrayDeque<>();
    private final AtomicInteger counter = new AtomicInteger(0);

    public PatchService(WorkspaceService workspaceService, VersionControl versionControl, PatchEngineConfig config) {
        this.workspaceService = workspaceService;
        this.versionControl = versionControl;
        this.config = config != null ? config : new PatchEngineConfig();
        this.hunkApplier = new HunkApplier(this.config.getFuzzyThreshold());
        this.conflictExtractor = new ConflictExtractor(workspaceService, versionControl);
    }

    public PatchEngineConfig getConfig() {
        return config;
    }

    public List<FileDiff> parsePatch(String patchText) {
        return parser.parse(patchText);
    }

    public List<ConflictInfo> findConflicts() {
        return conflictExtractor.findConflicts();
    }

    public DiffResult applyPatch(String patchText) {
        return applyPatch(patchText, false);
    }

    /**
     * @param dryRun compute everything in memory, skip version control and write nothing
     */
    public synchronized DiffResult applyPatch(String patchText, boolean dryRun) {
        if (patchText == null || patchText.isBlank()) {
            return DiffResult.empty("Patch is empty; nothing to apply");
        }

        DiffResult result = new DiffResult();
        result.setDryRun(dryRun);

        ApplyAttempt delegated = dryRun
            ? ApplyAttempt.delegated(ApplyAttempt.Status.SKIPPED, "dry run")
            : applyWithVersionControl(patchText, result);
        result.addAttempt(delegated);
        if (!delegated.requiresFallback()) {
            result.setStrategy(DiffResult.STRATEGY_VERSION_CONTROL);
            log("Patch applied by version control: " + result.getApplied().size() + " file(s), "
                + result.getConflicts().size() + " conflict(s)");
            return result;
        }
        result.setFallbackReason(delegated.getDetail());
        if (delegated.getStatus() == ApplyAttempt.Status.FAILED) {
            logWarn("Version-control apply failed, trying manual patch application: " + delegated.getDetail());
        }

        applyManually(patchText, dryRun, result);
        return result;
    }

    // -------------------------------------------------------------------------
    // Delegated three-way merge
    // -------------------------------------------------------------------------

    private ApplyAttempt applyWithVersionControl(String patchText, DiffResult result) {
        if (!config.isUseVersionControl()) {
            return ApplyAttempt.delegated(ApplyAttempt.Status.SKIPPED, "version control disabled");
        }
        if (versionControl == null || !versionControl.isRepository()) {
            return ApplyAttempt.delegated(ApplyAttempt.Status.SKIPPED, "not a version-controlled repository");
        }

        Path tempPatch = null;
        CommandResult applied;
        try {
            tempPatch = Files.createTempFile("termcode-", ".patch");
            String text = patchText.endsWith("\n") ? patchText : patchText + "\n";
            Files.write(tempPatch, text.getBytes(StandardCharsets.UTF_8));
            applied = versionControl.apply(tempPatch, true, config.isWhitespaceFix());
        } catch (IOException e) {
            return ApplyAttempt.delegated(ApplyAttempt.Status.FAILED, "could not write temporary patch: " + e.getMessage());
        } finally {
            deleteQuietly(tempPatch);
        }

        Set<String> touched = patchPaths(patchText);
        if (applied.isSuccess()) {
            versionControl.listStagedFiles().forEach(result::addApplied);
            List<ConflictInfo> conflicts = conflictsIn(touched);
            conflicts.forEach(result::addConflict);
            return conflicts.isEmpty()
                ? ApplyAttempt.delegated(ApplyAttempt.Status.SUCCESS, null)
                : ApplyAttempt.delegated(ApplyAttempt.Status.CONFLICTED, conflicts.size() + " conflict block(s)");
        }

        // A three-way merge that stopped on this patch's files has already touched the tree; don't patch over it.
        // Unmerged files the patch doesn't name are left alone and the manual fallback still runs.
        List<ConflictInfo> conflicts = conflictsIn(touched);
        if (!conflicts.isEmpty()) {
            versionControl.listStagedFiles().stream()
                .filter(touched::contains)
                .forEach(result::addApplied);
            for (ConflictInfo conflict : conflicts) {
                result.addConflict(conflict);
                if (!result.getApplied().contains(conflict.getFile())) {
                    result.addApplied(conflict.getFile());
                }
            }
            return ApplyAttempt.delegated(ApplyAttempt.Status.CONFLICTED, firstLine(applied.stderr()));
        }
        return ApplyAttempt.delegated(ApplyAttempt.Status.FAILED, firstLine(applied.stderr()));
    }

    private Set<String> patchPaths(String patchText) {
        Set<String> paths = new LinkedHashSet<>();
        for (FileDiff fileDiff : parser.parse(patchText)) {
            paths.add(fileDiff.getFile());
            if (fileDiff.getOldPath() != null) {
                paths.add(fileDiff.getOldPath());
            }
            if (fileDiff.getNewPath() != null) {
                paths.add(fileDiff.getNewPath());
            }
        }
        return paths;
    }

    private List<ConflictInfo> conflictsIn(Set<String> paths) {
        List<ConflictInfo> conflicts = new ArrayList<>();
        for (ConflictInfo conflict : conflictExtractor.findConflicts()) {
            if (paths.contains(conflict.getFile())) {
                conflicts.add(conflict);
            }
        }
        return conflicts;
    }

    // -------------------------------------------------------------------------
    // Manual fallback
    // -------------------------------------------------------------------------

    private void applyManually(String patchText, boolean dryRun, DiffResult result) {
        result.setStrategy(DiffResult.STRATEGY_MANUAL);
        UnifiedDiffParser.ParseResult parsed = parser.parseDetailed(patchText);
        for (String header : parsed.getSkippedHeaders()) {
            result.addWarning("Skipped unparsable file block: " + header);
            logWarn("Skipped unparsable file block: " + header);
        }
        if (parsed.isEmpty()) {
            result.setStrategy(DiffResult.STRATEGY_NONE);
            result.addWarning("No file diffs found in patch");
            result.addAttempt(ApplyAttempt.manual(ApplyAttempt.Status.SKIPPED, "nothing to apply"));
            return;
        }

        PatchHistoryEntry entry = dryRun ? null : new PatchHistoryEntry("apply-" + counter.incrementAndGet(),
            System.currentTimeMillis());
        for (FileDiff fileDiff : parsed.getFiles()) {
            FileApplyOutcome outcome = applyFileDiff(fileDiff, entry, dryRun);
            if (!outcome.isSuccess()) {
                logWarn("Rejected " + outcome.getFile() + ": " + outcome.getError());
            }
            result.record(outcome);
        }

        int total = parsed.getFiles().size();
        String detail = result.getApplied().size() + " of " + total + " file(s) applied";
        result.addAttempt(ApplyAttempt.manual(
            result.hasRejections() ? ApplyAttempt.Status.FAILED : ApplyAttempt.Status.SUCCESS, detail));
        log("Manual patch application: " + detail + (dryRun ? " (dry run)" : ""));

        if (entry != null && !entry.isEmpty()) {
            history.addFirst(entry);
            while (history.size() > Math.max(config.getHistoryLimit(), 1)) {
                history.removeLast();
            }
            result.setHistoryId(entry.getId());
        }
    }

    private FileApplyOutcome applyFileDiff(FileDiff fileDiff, PatchHistoryEntry entry, boolean dryRun) {
        String file = fileDiff.getFile();
        FileDiff.Operation operation = fileDiff.getOperation();
        List<String> warnings = new ArrayList<>();
        try {
            if (operation == FileDiff.Operation.DELETE) {
                String original = workspaceService.readFile(file);
                FileApplyOutcome outcome = FileApplyOutcome.success(file, operation, warnings);
                if (dryRun) {
                    outcome.setPreview(preview(file, original, ""));
                } else {
                    entry.remember(file, original);
                    workspaceService.deleteFile(file);
                }
                return outcome;
            }

            String source = operation == FileDiff.Operation.RENAME ? fileDiff.getOldPath() : file;
            String original = workspaceService.readFileIfExists(source);
            if (original == null) {
                if (operation != FileDiff.Operation.CREATE) {
                    warnings.add("Expected " + source + " to exist; treating it as empty");
                }
                original = "";
            }

            if (config.isStrictHunkCounts()) {
                String countError = validateCounts(fileDiff);
                if (countError != null) {
                    return FileApplyOutcome.failure(file, operation, countError, List.of(), warnings);
                }
            }

            LineBuffer buffer = LineBuffer.of(original);
            int offset = 0;
            List<Hunk> hunks = fileDiff.getHunks();
            for (int i = 0; i < hunks.size(); i++) {
                HunkApplyResult applied = hunkApplier.applyHunk(buffer.lines(), hunks.get(i), offset, file);
                warnings.addAll(applied.getWarnings());
                if (!applied.isSuccess()) {
                    return FileApplyOutcome.failure(file, operation,
                        "Hunk " + (i + 1) + " of " + hunks.size() + " failed: " + applied.getError(),
                        applied.getConflicts(), warnings);
                }
                offset = applied.getNewOffset();
            }
            String updated = buffer.join();

            FileApplyOutcome outcome = FileApplyOutcome.success(file, operation, warnings);
            if (dryRun) {
                outcome.setPreview(preview(file, original, updated));
                return outcome;
            }

            entry.remember(file, workspaceService.readFileIfExists(file));
            workspaceService.writeFile(file, updated);
            if (operation == FileDiff.Operation.RENAME && !source.equals(file) && workspaceService.exists(source)) {
                entry.remember(source, original);
                try {
                    workspaceService.deleteFile(source);
                } catch (IOException e) {
                    outcome.getWarnings().add("Could not remove old path " + source + ": " + e.getMessage());
                }
            }
            return outcome;
        } catch (IOException | RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return FileApplyOutcome.failure(file, operation, message, List.of(), warnings);
        }
    }

    private static String validateCounts(FileDiff fileDiff) {
        List<Hunk> hunks = fileDiff.getHunks();
        for (int i = 0; i < hunks.size(); i++) {
            Hunk hunk = hunks.get(i);
            if (!hunk.hasConsistentCounts()) {
                return "Hunk " + (i + 1) + " header " + hunk.getHeader() + " declares "
                    + hunk.getOldCount() + " old / " + hunk.getNewCount() + " new lines but the body has "
                    + hunk.countOldSideLines() + " old / " + hunk.countNewSideLines() + " new";
            }
        }
        return null;
    }

    private static String preview(String file, String original, String updated) {
        List<String> before = LineBuffer.of(original).lines();
        List<String> after = LineBuffer.of(updated).lines();
        Patch<String> patch = DiffUtils.diff(before, after);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff("a/" + file, "b/" + file, before, patch, 3);
        return String.join("\n", unified);
    }

    // -------------------------------------------------------------------------
    // History / rollback
    // -------------------------------------------------------------------------

    public synchronized List<PatchHistoryEntry> history() {
        return new ArrayList<>(history);
    }

    /**
     * Restores every file touched by a manual application to its pre-application content.
     * Files the application created are deleted again.
     */
    public synchronized DiffResult rollback(String historyId) {
        PatchHistoryEntry entry = history.stream()
            .filter(e -> e.getId().equals(historyId))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown patch history entry: " + historyId));

        DiffResult result = new DiffResult();
        result.setStrategy(DiffResult.STRATEGY_ROLLBACK);
        if (entry.isRolledBack()) {
            result.addWarning(historyId + " was already rolled back");
            return result;
        }

        for (Map.Entry<String, String> snapshot : entry.snapshots().entrySet()) {
            String file = snapshot.getKey();
            FileDiff.Operation operation = snapshot.getValue() == null
                ? FileDiff.Operation.DELETE
                : FileDiff.Operation.MODIFY;
            try {
                if (snapshot.getValue() == null) {
                    if (workspaceService.exists(file)) {
                        workspaceService.deleteFile(file);
                    }
                } else {
                    workspaceService.writeFile(file, snapshot.getValue());
                }
                result.record(FileApplyOutcome.success(file, operation, List.of()));
            } catch (IOException | RuntimeException e) {
                result.record(FileApplyOutcome.failure(file, operation, e.getMessage(), List.of(), List.of()));
            }
        }
        entry.setRolledBack(true);
        log("Rolled back " + historyId + ": " + result.getApplied().size() + " file(s) restored");
        return result;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static String firstLine(String text) {
        if (text == null || text.isBlank()) {
            return "version control reported failure";
        }
        return text.strip().split("\\r?\\n", 2)[0];
    }

    private void deleteQuietly(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logWarn("Failed to delete temporary patch " + path + ": " + e.getMessage());
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[PatchService] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[PatchService] " + message);
        }
    }
}
