package com.termcode.vcs;

import java.nio.file.Path;
import java.util.List;

/**
 * The version-control primitives the patch engine relies on.
 */
public interface VersionControl {

    /**
     * Whether the repository root is under this version-control system at all.
     */
    boolean isRepository();

    /**
     * Applies a patch file, optionally with a three-way merge and whitespace repair.
     */
    CommandResult apply(Path patchFile, boolean threeWay, boolean whitespaceFix);

    /**
     * Files staged by the last apply.
     */
    List<String> listStagedFiles();

    /**
     * Files left in an unmerged (both modified) state.
     */
    List<String> listUnmergedFiles();
}
