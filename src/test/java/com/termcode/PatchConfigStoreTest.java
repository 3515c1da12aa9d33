package com.termcode;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.termcode.PatchConfigStore.PatchEngineConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PatchConfigStoreTest {

    @TempDir
    Path repo;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileYieldsDefaults() {
        PatchEngineConfig config = new PatchConfigStore(repo, mapper).loadOrDefault(null);

        assertEquals(0.8, config.getFuzzyThreshold());
        assertFalse(config.isStrictHunkCounts());
        assertTrue(config.isUseVersionControl());
        assertTrue(config.isWhitespaceFix());
        assertEquals(100, config.getHistoryLimit());
    }

    @Test
    void storedValuesOverrideDefaults() throws Exception {
        Path file = repo.resolve(".termcode/patch-config.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"fuzzyThreshold\":0.65,\"useVersionControl\":false,\"historyLimit\":5,\"extra\":1}");

        PatchEngineConfig config = new PatchConfigStore(repo, mapper).loadOrDefault(new PatchEngineConfig());

        assertEquals(0.65, config.getFuzzyThreshold());
        assertFalse(config.isUseVersionControl());
        assertEquals(5, config.getHistoryLimit());
        assertTrue(config.isWhitespaceFix());
    }

    @Test
    void absentFlagsKeepCallerDefaults() throws Exception {
        Path file = repo.resolve(".termcode/patch-config.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"fuzzyThreshold\":0.7}");
        PatchEngineConfig defaults = new PatchEngineConfig();
        defaults.setStrictHunkCounts(true);
        defaults.setUseVersionControl(false);
        defaults.setWhitespaceFix(false);

        PatchEngineConfig config = new PatchConfigStore(repo, mapper).loadOrDefault(defaults);

        assertEquals(0.7, config.getFuzzyThreshold());
        assertTrue(config.isStrictHunkCounts());
        assertFalse(config.isUseVersionControl());
        assertFalse(config.isWhitespaceFix());
    }

    @Test
    void outOfRangeValuesFallBackToDefaults() throws Exception {
        Path file = repo.resolve(".termcode/patch-config.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"fuzzyThreshold\":3.0,\"historyLimit\":0}");

        PatchEngineConfig config = new PatchConfigStore(repo, mapper).loadOrDefault(new PatchEngineConfig());

        assertEquals(0.8, config.getFuzzyThreshold());
        assertEquals(100, config.getHistoryLimit());
    }

    @Test
    void unreadableFileYieldsDefaults() throws Exception {
        Path file = repo.resolve(".termcode/patch-config.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        PatchEngineConfig config = new PatchConfigStore(repo, mapper).loadOrDefault(new PatchEngineConfig());

        assertEquals(0.8, config.getFuzzyThreshold());
    }

    @Test
    void saveThenLoad() throws Exception {
        PatchConfigStore store = new PatchConfigStore(repo, mapper);
        PatchEngineConfig config = new PatchEngineConfig();
        config.setStrictHunkCounts(true);
        config.setFuzzyThreshold(0.9);

        store.save(config);
        PatchEngineConfig loaded = store.loadOrDefault(new PatchEngineConfig());

        assertTrue(Files.exists(store.getConfigPath()));
        assertTrue(loaded.isStrictHunkCounts());
        assertEquals(0.9, loaded.getFuzzyThreshold());
    }
}
