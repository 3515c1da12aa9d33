package com.termcode;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads per-repository patch engine settings from {@code .termcode/patch-config.json}.
 */
public class PatchConfigStore {

    static final String CONFIG_DIR = ".termcode";
    static final String CONFIG_FILE = "patch-config.json";

    private final Path configPath;
    private final ObjectMapper mapper;
    private final AppLogger logger = AppLogger.get();

    public PatchConfigStore(Path repoRoot, ObjectMapper mapper) {
        this.configPath = repoRoot.resolve(CONFIG_DIR).resolve(CONFIG_FILE);
        this.mapper = mapper;
    }

    public Path getConfigPath() {
        return configPath;
    }

    public PatchEngineConfig loadOrDefault(PatchEngineConfig defaults) {
        PatchEngineConfig base = defaults != null ? defaults : new PatchEngineConfig();
        if (!Files.exists(configPath)) {
            return base;
        }

        try {
            JsonNode node = mapper.readTree(configPath.toFile());
            PatchEngineConfig stored = mapper.treeToValue(node, PatchEngineConfig.class);
            log("Loaded patch config from " + configPath);
            return merge(base, stored, node);
        } catch (Exception e) {
            logWarn("Failed to load patch config, using defaults: " + e.getMessage());
            return base;
        }
    }

    public void save(PatchEngineConfig config) throws IOException {
        if (config == null) return;
        Files.createDirectories(configPath.getParent());
        mapper.writerWithDefaultPrettyPrinter().writeValue(configPath.toFile(), config);
        log("Saved patch config to " + configPath);
    }

    /**
     * Keys missing from the stored file keep the value from {@code defaults}.
     */
    private PatchEngineConfig merge(PatchEngineConfig defaults, PatchEngineConfig stored, JsonNode node) {
        if (stored == null) {
            return defaults;
        }
        PatchEngineConfig result = new PatchEngineConfig();
        double threshold = stored.getFuzzyThreshold();
        result.setFuzzyThreshold(threshold > 0 && threshold <= 1 ? threshold : defaults.getFuzzyThreshold());
        result.setStrictHunkCounts(node.has("strictHunkCounts")
            ? stored.isStrictHunkCounts() : defaults.isStrictHunkCounts());
        result.setUseVersionControl(node.has("useVersionControl")
            ? stored.isUseVersionControl() : defaults.isUseVersionControl());
        result.setWhitespaceFix(node.has("whitespaceFix")
            ? stored.isWhitespaceFix() : defaults.isWhitespaceFix());
        result.setHistoryLimit(stored.getHistoryLimit() > 0 ? stored.getHistoryLimit() : defaults.getHistoryLimit());
        return result;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[PatchConfigStore] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[PatchConfigStore] " + message);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PatchEngineConfig {
        public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;

        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private boolean strictHunkCounts = false;
        private boolean useVersionControl = true;
        private boolean whitespaceFix = true;
        private int historyLimit = 100;

        public double getFuzzyThreshold() {
            return fuzzyThreshold;
        }

        public void setFuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
        }

        public boolean isStrictHunkCounts() {
            return strictHunkCounts;
        }

        public void setStrictHunkCounts(boolean strictHunkCounts) {
            this.strictHunkCounts = strictHunkCounts;
        }

        public boolean isUseVersionControl() {
            return useVersionControl;
        }

        public void setUseVersionControl(boolean useVersionControl) {
            this.useVersionControl = useVersionControl;
        }

        public boolean isWhitespaceFix() {
            return whitespaceFix;
        }

        public void setWhitespaceFix(boolean whitespaceFix) {
            this.whitespaceFix = whitespaceFix;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }
    }
}
