package com.termcode;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.termcode.PatchConfigStore.PatchEngineConfig;
import com.termcode.controllers.PatchController;
import com.termcode.models.ConflictInfo;
import com.termcode.models.DiffResult;
import com.termcode.models.FileApplyOutcome;
import com.termcode.models.FileDiff;
import com.termcode.models.HunkSelection;
import com.termcode.patch.HunkReviewSession;
import com.termcode.patch.HunkSelector;
import com.termcode.patch.UnifiedDiffParser;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_USAGE = 2;

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);
    private static AppLogger logger;

    public static void main(String[] args) {
        int exitCode = run(args, System.in, System.out, System.err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one command. Serve mode returns once the server is listening.
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        AppConfig config;
        try {
            config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            err.println(AppConfig.usage());
            return EXIT_USAGE;
        }

        try {
            AppLogger.initialize(config.getLogPath(), config.isVerbose());
        } catch (IOException e) {
            err.println("Failed to open log file " + config.getLogPath() + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        logger = AppLogger.get();
        logger.info("Command " + config.getCommand() + " in " + config.getRepoPath());

        ProjectContext context = new ProjectContext(config.getRepoPath(), objectMapper, null, overrides(config));

        try {
            switch (config.getCommand()) {
                case APPLY:
                    return apply(config, context, readPatch(config, in), out);
                case PARSE:
                    return parse(config, readPatch(config, in), out);
                case REVIEW:
                    if (config.getPatchSource() == null || "-".equals(config.getPatchSource())) {
                        err.println("Error: review reads commands from stdin; pass the patch as a file");
                        return EXIT_USAGE;
                    }
                    return review(config, context, readPatch(config, in), in, out);
                case CONFLICTS:
                    return conflicts(config, context, out);
                case SERVE:
                    serve(config, context);
                    return EXIT_OK;
                default:
                    err.println(AppConfig.usage());
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            logger.error("Failed to read patch: " + e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static Consumer<PatchEngineConfig> overrides(AppConfig config) {
        return engineConfig -> {
            if (config.isNoGit()) {
                engineConfig.setUseVersionControl(false);
            }
            if (config.isStrictCounts()) {
                engineConfig.setStrictHunkCounts(true);
            }
            if (config.getFuzzyThreshold() != null) {
                engineConfig.setFuzzyThreshold(config.getFuzzyThreshold());
            }
        };
    }

    private static String readPatch(AppConfig config, InputStream in) throws IOException {
        String source = config.getPatchSource();
        if (source == null || "-".equals(source)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Path.of(source);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Patch file not found: " + source);
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    // -------------------------------------------------------------------------
    // Commands
    // -------------------------------------------------------------------------

    private static int apply(AppConfig config, ProjectContext context, String patch, PrintStream out)
            throws IOException {
        DiffResult result = context.patches().applyPatch(patch, config.isDryRun());
        printResult(config, result, out);
        return result.hasRejections() ? EXIT_REJECTED : EXIT_OK;
    }

    private static int parse(AppConfig config, String patch, PrintStream out) throws IOException {
        UnifiedDiffParser.ParseResult parsed = new UnifiedDiffParser().parseDetailed(patch);
        if (config.isJson()) {
            out.println(objectMapper.writeValueAsString(Map.of(
                "files", parsed.getFiles(),
                "skippedHeaders", parsed.getSkippedHeaders())));
            return EXIT_OK;
        }
        if (parsed.isEmpty()) {
            out.println("No file diffs found.");
        }
        for (FileDiff file : parsed.getFiles()) {
            out.println(file.getOperation().name().toLowerCase() + " " + describePaths(file)
                + " (" + file.getHunks().size() + " hunk" + (file.getHunks().size() == 1 ? "" : "s") + ")");
            file.getHunks().forEach(hunk -> out.println("  " + hunk.getHeader()));
        }
        for (String skipped : parsed.getSkippedHeaders()) {
            out.println("skipped: " + skipped);
        }
        return EXIT_OK;
    }

    private static int review(AppConfig config, ProjectContext context, String patch, InputStream in,
                              PrintStream out) throws IOException {
        List<HunkSelection> selections = context.hunkSelector().parseForReview(patch);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        new HunkReviewSession(reader, out).run(selections);

        HunkSelector.SelectionSummary summary = HunkSelector.summarize(selections);
        if (summary.selectedHunks() == 0) {
            out.println("Nothing selected; no changes applied.");
            return EXIT_OK;
        }
        return apply(config, context, HunkSelector.renderFiltered(selections), out);
    }

    private static int conflicts(AppConfig config, ProjectContext context, PrintStream out) throws IOException {
        List<ConflictInfo> conflicts = context.patches().findConflicts();
        if (config.isJson()) {
            out.println(objectMapper.writeValueAsString(Map.of("conflicts", conflicts)));
        } else if (conflicts.isEmpty()) {
            out.println("No merge conflicts.");
        } else {
            conflicts.forEach(conflict -> out.println(conflict));
        }
        return EXIT_OK;
    }

    private static void serve(AppConfig config, ProjectContext context) {
        printBanner(config);

        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper, false));
            cfg.http.defaultContentType = "application/json";
        });

        new PatchController(context, objectMapper).registerRoutes(app);
        registerExceptionHandlers(app);

        app.start(config.getPort());

        String url = "http://localhost:" + config.getPort() + "/";
        logger.info("Server started on " + url);
        logger.console("  Listening on " + url);
        logger.console("  Repository: " + config.getRepoPath());
        logger.console("  Log file: " + config.getLogPath());
        logger.console("========================================");
        logger.console("  Press Ctrl+C to stop");
        logger.console("========================================");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down...");
            app.stop();
            logger.close();
        }));
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  TermCode v" + VERSION);
        logger.console("========================================");
        if (config.isVerbose()) {
            logger.console("  Mode: Verbose");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(FileNotFoundException.class, (e, ctx) -> {
            logger.warn("File not found: " + e.getMessage());
            ctx.status(404).json(Map.of("error", String.valueOf(e.getMessage())));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Map.of("error", String.valueOf(e.getMessage())));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Map.of("error", String.valueOf(e.getMessage())));
        });
    }

    // -------------------------------------------------------------------------
    // Output
    // -------------------------------------------------------------------------

    private static void printResult(AppConfig config, DiffResult result, PrintStream out) throws IOException {
        if (config.isJson()) {
            out.println(objectMapper.writeValueAsString(result));
            return;
        }
        String mode = result.isDryRun() ? " (dry run)" : "";
        out.println("Strategy: " + result.getStrategy() + mode
            + (result.getFallbackReason() != null ? " (fallback: " + result.getFallbackReason() + ")" : ""));
        if (!result.getApplied().isEmpty()) {
            out.println((result.isDryRun() ? "Would apply: " : "Applied: ") + String.join(", ", result.getApplied()));
        }
        for (FileApplyOutcome outcome : result.getFiles()) {
            if (!outcome.isSuccess()) {
                out.println("Rejected " + outcome.getFile() + ": " + outcome.getError());
            }
        }
        for (ConflictInfo conflict : result.getConflicts()) {
            out.println("Conflict " + conflict);
        }
        for (String warning : result.getWarnings()) {
            out.println("Warning: " + warning);
        }
        for (FileApplyOutcome outcome : result.getFiles()) {
            if (outcome.getPreview() != null && !outcome.getPreview().isEmpty()) {
                out.println(outcome.getPreview());
            }
        }
        if (result.getHistoryId() != null) {
            out.println("History id: " + result.getHistoryId());
        }
    }

    private static String describePaths(FileDiff file) {
        if (file.getOperation() == FileDiff.Operation.RENAME) {
            return file.getOldPath() + " -> " + file.getNewPath();
        }
        return file.getFile();
    }
}
