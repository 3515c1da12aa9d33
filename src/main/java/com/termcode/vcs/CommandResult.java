package com.termcode.vcs;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exit code and captured output of one external command.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public static CommandResult failure(String message) {
        return new CommandResult(-1, "", message != null ? message : "");
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Non-blank stdout lines, trimmed.
     */
    public List<String> stdoutLines() {
        if (stdout == null || stdout.isBlank()) {
            return List.of();
        }
        return Arrays.stream(stdout.split("\\r?\\n"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
    }
}
