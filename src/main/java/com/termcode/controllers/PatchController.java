package com.termcode.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termcode.AppLogger;
import com.termcode.ProjectContext;
import com.termcode.models.ConflictInfo;
import com.termcode.models.DiffResult;
import com.termcode.models.HunkSelection;
import com.termcode.models.PatchHistoryEntry;
import com.termcode.patch.HunkSelector;
import com.termcode.patch.UnifiedDiffParser;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PatchController implements Controller {

    private final ProjectContext projectContext;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public PatchController(ProjectContext projectContext, ObjectMapper objectMapper) {
        this.projectContext = projectContext;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/patches/parse", this::parsePatch);
        app.post("/api/patches/apply", this::applyPatch);
        app.post("/api/patches/review", this::reviewPatch);
        app.post("/api/patches/render", this::renderSelection);
        app.get("/api/patches/history", this::listHistory);
        app.post("/api/patches/history/{id}/rollback", this::rollback);
        app.get("/api/conflicts", this::listConflicts);
    }

    private void parsePatch(Context ctx) {
        try {
            String patch = requirePatch(objectMapper.readTree(ctx.body()));
            UnifiedDiffParser.ParseResult parsed = new UnifiedDiffParser().parseDetailed(patch);
            Map<String, Object> payload = new HashMap<>();
            payload.put("files", parsed.getFiles());
            payload.put("skippedHeaders", parsed.getSkippedHeaders());
            ctx.json(payload);
        } catch (Exception e) {
            logWarn("Failed to parse patch: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    /**
     * Body: {@code {"patch": "...", "dryRun": false, "selected": ["hunk-1", ...]}}.
     * When {@code selected} is present only those hunks are applied.
     */
    private void applyPatch(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String patch = requirePatch(json);
            boolean dryRun = json.has("dryRun") && json.get("dryRun").asBoolean(false);
            if (json.has("selected")) {
                patch = HunkSelector.renderFiltered(select(patch, json.get("selected")));
            }
            DiffResult result = projectContext.patches().applyPatch(patch, dryRun);
            ctx.json(result);
        } catch (Exception e) {
            logWarn("Failed to apply patch: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void reviewPatch(Context ctx) {
        try {
            String patch = requirePatch(objectMapper.readTree(ctx.body()));
            List<HunkSelection> selections = projectContext.hunkSelector().parseForReview(patch);
            Map<String, Object> payload = new HashMap<>();
            payload.put("hunks", selections);
            payload.put("summary", HunkSelector.summarize(selections));
            ctx.json(payload);
        } catch (Exception e) {
            logWarn("Failed to prepare review: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void renderSelection(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String patch = requirePatch(json);
            List<HunkSelection> selections = json.has("selected")
                ? select(patch, json.get("selected"))
                : projectContext.hunkSelector().parseForReview(patch);
            Map<String, Object> payload = new HashMap<>();
            payload.put("patch", HunkSelector.renderFiltered(selections));
            payload.put("summary", HunkSelector.summarize(selections));
            ctx.json(payload);
        } catch (Exception e) {
            logWarn("Failed to render selection: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void listHistory(Context ctx) {
        List<PatchHistoryEntry> entries = projectContext.patches().history();
        ctx.json(Map.of("history", entries));
    }

    private void rollback(Context ctx) {
        String id = ctx.pathParam("id");
        try {
            ctx.json(projectContext.patches().rollback(id));
        } catch (IllegalArgumentException e) {
            ctx.status(404).json(Controller.errorBody(e));
        }
    }

    private void listConflicts(Context ctx) {
        List<ConflictInfo> conflicts = projectContext.patches().findConflicts();
        ctx.json(Map.of("conflicts", conflicts));
    }

    private List<HunkSelection> select(String patch, JsonNode selectedNode) {
        if (!selectedNode.isArray()) {
            throw new IllegalArgumentException("selected must be an array of hunk ids");
        }
        Set<String> wanted = new HashSet<>();
        selectedNode.forEach(node -> wanted.add(node.asText()));
        List<HunkSelection> selections = projectContext.hunkSelector().parseForReview(patch);
        for (String id : wanted) {
            HunkSelector.find(selections, id);
        }
        for (HunkSelection selection : selections) {
            selection.setSelected(wanted.contains(selection.getId()));
        }
        return selections;
    }

    private static String requirePatch(JsonNode json) {
        if (json == null || !json.hasNonNull("patch") || !json.get("patch").isTextual()) {
            throw new IllegalArgumentException("patch is required");
        }
        return json.get("patch").asText();
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[PatchController] " + message);
        }
    }
}
