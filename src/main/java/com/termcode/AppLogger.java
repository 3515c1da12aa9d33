package com.termcode;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to a log file and, in verbose mode, the console.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final PrintStream errorOutput;
    private final boolean verbose;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean verbose) throws IOException {
        this.consoleOutput = System.out;
        this.errorOutput = System.err;
        this.verbose = verbose;

        // Open log file in append mode
        FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
        this.fileOutput = new PrintStream(fos, true, "UTF-8");

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("TermCode started at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    public static synchronized void initialize(Path logFile, boolean verbose) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, verbose);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (verbose) {
            t.printStackTrace(errorOutput);
        }
    }

    private void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] %s", timestamp, level, message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (verbose) {
            errorOutput.println(line);
        }
    }

    /**
     * User-facing output. Always printed, also mirrored to the log file.
     */
    public void console(String message) {
        consoleOutput.println(message);
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
