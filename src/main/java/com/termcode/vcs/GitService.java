package com.termcode.vcs;

import com.termcode.AppLogger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * {@link VersionControl} backed by the {@code git} executable.
 */
public class GitService implements VersionControl {

    private static final long TIMEOUT_SECONDS = 60;

    private final Path repoRoot;
    private final String gitExecutable;

    public GitService(Path repoRoot) {
        this(repoRoot, "git");
    }

    public GitService(Path repoRoot, String gitExecutable) {
        this.repoRoot = repoRoot.toAbsolutePath().normalize();
        this.gitExecutable = gitExecutable;
    }

    @Override
    public boolean isRepository() {
        return run("rev-parse", "--git-dir").isSuccess();
    }

    @Override
    public CommandResult apply(Path patchFile, boolean threeWay, boolean whitespaceFix) {
        List<String> args = new ArrayList<>();
        args.add("apply");
        if (threeWay) {
            args.add("--3way");
        }
        if (whitespaceFix) {
            args.add("--whitespace=fix");
        }
        args.add(patchFile.toAbsolutePath().toString());
        return run(args.toArray(new String[0]));
    }

    @Override
    public List<String> listStagedFiles() {
        CommandResult result = run("diff", "--cached", "--name-only");
        if (!result.isSuccess()) {
            log("Listing staged files failed: " + result.stderr().trim());
            return List.of();
        }
        return result.stdoutLines();
    }

    @Override
    public List<String> listUnmergedFiles() {
        CommandResult result = run("diff", "--name-only", "--diff-filter=U");
        if (!result.isSuccess()) {
            log("Listing unmerged files failed: " + result.stderr().trim());
            return List.of();
        }
        return result.stdoutLines().stream().distinct().collect(Collectors.toList());
    }

    /**
     * Runs git in the repository root. Launch failures come back as a failed result, never as an exception.
     */
    public CommandResult run(String... args) {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(List.of(args));
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(repoRoot.toFile());
            Process process = pb.start();
            process.getOutputStream().close();

            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            String stdout = readFully(process.getInputStream());

            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return CommandResult.failure("git " + args[0] + " timed out after " + TIMEOUT_SECONDS + "s");
            }
            return new CommandResult(process.exitValue(), stdout, stderr.join());
        } catch (IOException | UncheckedIOException | CompletionException e) {
            log("Failed to run git " + String.join(" ", args) + ": " + e.getMessage());
            return CommandResult.failure(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CommandResult.failure("Interrupted while running git " + args[0]);
        }
    }

    private static String readFully(InputStream in) {
        try (InputStream stream = in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            stream.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[GitService] " + message);
        }
    }
}
