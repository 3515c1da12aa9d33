package com.termcode.vcs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Scriptable {@link VersionControl} for tests.
 */
public class FakeVersionControl implements VersionControl {

    public boolean repository = true;
    public CommandResult applyResult = new CommandResult(0, "", "");
    public List<String> staged = new ArrayList<>();
    public List<String> unmerged = new ArrayList<>();
    /** Runs when apply is called, e.g. to write conflict markers into the tree. */
    public Consumer<String> onApply;

    public int applyCalls;
    public String lastPatch;
    public Path lastPatchFile;
    public boolean lastThreeWay;
    public boolean lastWhitespaceFix;

    @Override
    public boolean isRepository() {
        return repository;
    }

    @Override
    public CommandResult apply(Path patchFile, boolean threeWay, boolean whitespaceFix) {
        applyCalls++;
        lastPatchFile = patchFile;
        lastThreeWay = threeWay;
        lastWhitespaceFix = whitespaceFix;
        try {
            lastPatch = new String(Files.readAllBytes(patchFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (onApply != null) {
            onApply.accept(lastPatch);
        }
        return applyResult;
    }

    @Override
    public List<String> listStagedFiles() {
        return staged;
    }

    @Override
    public List<String> listUnmergedFiles() {
        return unmerged;
    }
}
