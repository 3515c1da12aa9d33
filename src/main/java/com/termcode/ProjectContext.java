package com.termcode;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.termcode.PatchConfigStore.PatchEngineConfig;
import com.termcode.patch.HunkSelector;
import com.termcode.vcs.GitService;
import com.termcode.vcs.VersionControl;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Runtime holder for the services bound to one repository root.
 */
public class ProjectContext {
    private final ObjectMapper objectMapper;
    private WorkspaceService workspaceService;
    private VersionControl versionControl;
    private PatchConfigStore patchConfigStore;
    private PatchService patchService;
    private HunkSelector hunkSelector;
    private final AppLogger logger = AppLogger.get();

    public ProjectContext(Path repoRoot, ObjectMapper objectMapper) {
        this(repoRoot, objectMapper, null, null);
    }

    /**
     * @param versionControl  null to use git in the repository root
     * @param configOverrides applied on top of the stored settings, may be null
     */
    public ProjectContext(Path repoRoot, ObjectMapper objectMapper, VersionControl versionControl,
                          Consumer<PatchEngineConfig> configOverrides) {
        this.objectMapper = objectMapper;
        load(repoRoot, versionControl, configOverrides);
    }

    private synchronized void load(Path repoRoot, VersionControl vcs, Consumer<PatchEngineConfig> configOverrides) {
        this.workspaceService = new WorkspaceService(repoRoot);
        Path root = workspaceService.getWorkspaceRoot();
        this.versionControl = vcs != null ? vcs : new GitService(root);
        this.patchConfigStore = new PatchConfigStore(root, objectMapper);
        PatchEngineConfig config = patchConfigStore.loadOrDefault(new PatchEngineConfig());
        if (configOverrides != null) {
            configOverrides.accept(config);
        }
        this.patchService = new PatchService(workspaceService, versionControl, config);
        this.hunkSelector = new HunkSelector();
        if (logger != null) {
            logger.info("Project context loaded for " + root);
        }
    }

    public WorkspaceService workspace() {
        return workspaceService;
    }

    public VersionControl versionControl() {
        return versionControl;
    }

    public PatchConfigStore patchConfig() {
        return patchConfigStore;
    }

    public PatchService patches() {
        return patchService;
    }

    public HunkSelector hunkSelector() {
        return hunkSelector;
    }
}
