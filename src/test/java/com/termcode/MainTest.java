package com.termcode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path repo;

    @TempDir
    Path logs;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private static final String PATCH = String.join("\n",
        "diff --git a/a.txt b/a.txt",
        "@@ -1,2 +1,2 @@",
        " one",
        "-two",
        "+TWO",
        "@@ -5,2 +5,2 @@",
        " five",
        "-six",
        "+SIX") + "\n";

    private int run(String stdin, String... args) {
        String[] full = new String[args.length + 4];
        System.arraycopy(args, 0, full, 0, args.length);
        full[args.length] = "--repo=" + repo;
        full[args.length + 1] = "--log-dir=" + logs;
        full[args.length + 2] = "--no-git";
        full[args.length + 3] = "--fuzzy-threshold=0.8";
        return Main.run(full,
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private void writeTarget() throws Exception {
        Files.writeString(repo.resolve("a.txt"), "one\ntwo\nthree\nfour\nfive\nsix\n");
    }

    @Test
    void appliesPatchFile() throws Exception {
        writeTarget();
        Path patch = Files.writeString(logs.resolve("fix.patch"), PATCH);

        int exit = run("", "apply", patch.toString());

        assertEquals(Main.EXIT_OK, exit);
        assertEquals("one\nTWO\nthree\nfour\nfive\nSIX\n", Files.readString(repo.resolve("a.txt")));
        assertTrue(stdout().contains("Applied: a.txt"));
        assertTrue(stdout().contains("Strategy: manual"));
    }

    @Test
    void readsPatchFromStdinAndPrintsJson() throws Exception {
        writeTarget();

        int exit = run(PATCH, "apply", "-", "--json", "--dry-run");

        assertEquals(Main.EXIT_OK, exit);
        JsonNode json = new ObjectMapper().readTree(stdout());
        assertEquals("manual", json.get("strategy").asText());
        assertTrue(json.get("dryRun").asBoolean());
        assertEquals("a.txt", json.get("applied").get(0).asText());
        assertEquals("one\ntwo\nthree\nfour\nfive\nsix\n", Files.readString(repo.resolve("a.txt")));
    }

    @Test
    void rejectionGivesExitCodeOne() throws Exception {
        Files.writeString(repo.resolve("a.txt"), "nothing\nalike\n");

        int exit = run(PATCH, "apply");

        assertEquals(Main.EXIT_REJECTED, exit);
        assertTrue(stdout().contains("Rejected a.txt: Hunk 1 of 2 failed"));
    }

    @Test
    void parsePrintsStructure() {
        int exit = run(PATCH, "parse");

        assertEquals(Main.EXIT_OK, exit);
        assertTrue(stdout().contains("modify a.txt (2 hunks)"));
        assertTrue(stdout().contains("@@ -5,2 +5,2 @@"));
    }

    @Test
    void reviewAppliesOnlySelectedHunks() throws Exception {
        writeTarget();
        Path patch = Files.writeString(logs.resolve("fix.patch"), PATCH);

        int exit = run("n\ns\nq\n", "review", patch.toString());

        assertEquals(Main.EXIT_OK, exit);
        assertTrue(stdout().contains("Selected 1 of 2 hunks for application"));
        assertEquals("one\nTWO\nthree\nfour\nfive\nsix\n", Files.readString(repo.resolve("a.txt")));
    }

    @Test
    void reviewWithNothingSelectedChangesNothing() throws Exception {
        writeTarget();
        Path patch = Files.writeString(logs.resolve("fix.patch"), PATCH);

        int exit = run("a\nq\n", "review", patch.toString());

        assertEquals(Main.EXIT_OK, exit);
        assertTrue(stdout().contains("Nothing selected"));
        assertEquals("one\ntwo\nthree\nfour\nfive\nsix\n", Files.readString(repo.resolve("a.txt")));
    }

    @Test
    void reviewNeedsPatchFile() {
        assertEquals(Main.EXIT_USAGE, run(PATCH, "review"));
    }

    @Test
    void missingPatchFileIsUsageError() {
        int exit = run("", "apply", repo.resolve("missing.patch").toString());

        assertEquals(Main.EXIT_USAGE, exit);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Patch file not found"));
    }

    @Test
    void badArgumentsPrintUsage() {
        int exit = run("", "frobnicate");

        assertEquals(Main.EXIT_USAGE, exit);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: termcode"));
    }
}
