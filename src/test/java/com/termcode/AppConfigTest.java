package com.termcode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path logs;

    private AppConfig parse(String... args) throws Exception {
        return new AppConfig.Builder()
            .logDirectory(logs)
            .parseArgs(args)
            .build();
    }

    @Test
    void parsesCommandAndPositionalPatch() throws Exception {
        AppConfig config = parse("apply", "fix.patch");

        assertEquals(AppConfig.Command.APPLY, config.getCommand());
        assertEquals("fix.patch", config.getPatchSource());
        assertFalse(config.isDryRun());
        assertNull(config.getFuzzyThreshold());
        assertEquals(logs.resolve("termcode.log"), config.getLogPath());
    }

    @Test
    void acceptsBothOptionForms(@TempDir Path repo) throws Exception {
        AppConfig spaced = parse("apply", "--repo", repo.toString(), "--fuzzy-threshold", "0.6");
        AppConfig joined = parse("apply", "--repo=" + repo, "--fuzzy-threshold=0.6");

        assertEquals(repo.toAbsolutePath().normalize(), spaced.getRepoPath());
        assertEquals(spaced.getRepoPath(), joined.getRepoPath());
        assertEquals(0.6, spaced.getFuzzyThreshold());
        assertEquals(0.6, joined.getFuzzyThreshold());
    }

    @Test
    void parsesFlags() throws Exception {
        AppConfig config = parse("--json", "--dry-run", "--no-git", "--strict-counts", "--dev", "apply", "-");

        assertTrue(config.isJson());
        assertTrue(config.isDryRun());
        assertTrue(config.isNoGit());
        assertTrue(config.isStrictCounts());
        assertTrue(config.isVerbose());
        assertEquals("-", config.getPatchSource());
    }

    @Test
    void patchOptionOverridesPositionalSlot() throws Exception {
        AppConfig config = parse("parse", "--patch=changes.diff");

        assertEquals(AppConfig.Command.PARSE, config.getCommand());
        assertEquals("changes.diff", config.getPatchSource());
    }

    @Test
    void repoDefaultsToWorkingDirectory() throws Exception {
        AppConfig config = parse("conflicts");

        assertEquals(Path.of("").toAbsolutePath().normalize(), config.getRepoPath());
    }

    @Test
    void logDirOptionIsCreated() throws Exception {
        Path dir = logs.resolve("nested/logs");

        AppConfig config = new AppConfig.Builder().parseArgs(new String[]{"parse", "--log-dir", dir.toString()}).build();

        assertTrue(Files.isDirectory(dir));
        assertEquals(dir.resolve("termcode.log"), config.getLogPath());
    }

    @Test
    void commandIsCaseInsensitive() throws Exception {
        assertEquals(AppConfig.Command.SERVE, parse("SERVE", "--port", "0").getCommand());
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> parse("explode"));
        assertThrows(IllegalArgumentException.class, () -> parse("apply", "--unknown"));
        assertThrows(IllegalArgumentException.class, () -> parse("apply", "a.patch", "b.patch"));
        assertThrows(IllegalArgumentException.class, () -> parse("apply", "--fuzzy-threshold", "1.5"));
        assertThrows(IllegalArgumentException.class, () -> parse("apply", "--fuzzy-threshold=abc"));
        assertThrows(IllegalArgumentException.class, () -> parse("serve", "--port", "eighty"));
        assertThrows(IllegalArgumentException.class, () -> parse("--json"));
    }

    @Test
    void usageListsCommands() {
        String usage = AppConfig.usage();

        for (AppConfig.Command command : AppConfig.Command.values()) {
            assertTrue(usage.contains(command.name().toLowerCase()));
        }
    }
}
