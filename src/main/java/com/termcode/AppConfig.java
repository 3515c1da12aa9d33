package com.termcode;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line configuration: which command to run, against which repository, with which overrides.
 */
public class AppConfig {

    private static final String APP_NAME = "TermCode";

    public enum Command {
        APPLY,
        PARSE,
        REVIEW,
        CONFLICTS,
        SERVE
    }

    private final Command command;
    private final Path repoPath;
    private final String patchSource;
    private final Path logPath;
    private final int port;
    private final boolean verbose;
    private final boolean json;
    private final boolean dryRun;
    private final boolean noGit;
    private final boolean strictCounts;
    private final Double fuzzyThreshold;

    private AppConfig(Builder builder, Path repoPath, Path logPath, int port) {
        this.command = builder.command;
        this.repoPath = repoPath;
        this.patchSource = builder.patchSource;
        this.logPath = logPath;
        this.port = port;
        this.verbose = builder.verbose;
        this.json = builder.json;
        this.dryRun = builder.dryRun;
        this.noGit = builder.noGit;
        this.strictCounts = builder.strictCounts;
        this.fuzzyThreshold = builder.fuzzyThreshold;
    }

    public Command getCommand() { return command; }

    public Path getRepoPath() { return repoPath; }

    /**
     * Patch file path, "-" for stdin, or null when none was given.
     */
    public String getPatchSource() { return patchSource; }

    public Path getLogPath() { return logPath; }

    public int getPort() { return port; }

    public boolean isVerbose() { return verbose; }

    public boolean isJson() { return json; }

    public boolean isDryRun() { return dryRun; }

    public boolean isNoGit() { return noGit; }

    public boolean isStrictCounts() { return strictCounts; }

    /**
     * Fuzzy threshold override, or null to keep the repository setting.
     */
    public Double getFuzzyThreshold() { return fuzzyThreshold; }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\TermCode\logs
     * macOS: ~/Library/Logs/TermCode
     * Linux: ~/.local/share/TermCode/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // Let the server fail later with a clear error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static String usage() {
        return String.join("\n",
            "Usage: termcode <command> [options] [patch-file]",
            "",
            "Commands:",
            "  apply       Apply a unified diff to the repository",
            "  parse       Print the parsed structure of a unified diff",
            "  review      Select hunks interactively, then apply the selection",
            "  conflicts   List merge-conflict blocks in unmerged files",
            "  serve       Start the HTTP API",
            "",
            "Options:",
            "  --repo <dir>             Repository root (default: current directory)",
            "  --patch <file>           Patch file, '-' for stdin",
            "  --port <n>               HTTP port for serve (default: 8080)",
            "  --log-dir <dir>          Directory for termcode.log (default: per-OS user log directory)",
            "  --json                   Print results as JSON",
            "  --dry-run                Compute the result without writing files",
            "  --no-git                 Skip the version-control three-way merge",
            "  --strict-counts          Reject hunks whose header counts disagree with their lines",
            "  --fuzzy-threshold <x>    Minimum similarity for fuzzy context matches (0..1)",
            "  --verbose, --dev         Echo log records to stderr");
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Command command;
        private Path repoPath;
        private String patchSource;
        private Path logDirectory;
        private int preferredPort = 8080;
        private boolean verbose = false;
        private boolean json = false;
        private boolean dryRun = false;
        private boolean noGit = false;
        private boolean strictCounts = false;
        private Double fuzzyThreshold;

        public Builder command(Command command) {
            this.command = command;
            return this;
        }

        public Builder repoPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.repoPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logDirectory(Path logDirectory) {
            this.logDirectory = logDirectory;
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--repo=")) {
                    repoPath(arg.substring("--repo=".length()));
                } else if ("--repo".equals(arg) && i + 1 < args.length) {
                    repoPath(args[++i]);
                } else if (arg.startsWith("--patch=")) {
                    this.patchSource = arg.substring("--patch=".length());
                } else if ("--patch".equals(arg) && i + 1 < args.length) {
                    this.patchSource = args[++i];
                } else if (arg.startsWith("--log-dir=")) {
                    logDirectory(Paths.get(arg.substring("--log-dir=".length())));
                } else if ("--log-dir".equals(arg) && i + 1 < args.length) {
                    logDirectory(Paths.get(args[++i]));
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = parseInt(arg.substring("--port=".length()), "--port");
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parseInt(args[++i], "--port");
                } else if (arg.startsWith("--fuzzy-threshold=")) {
                    this.fuzzyThreshold = parseThreshold(arg.substring("--fuzzy-threshold=".length()));
                } else if ("--fuzzy-threshold".equals(arg) && i + 1 < args.length) {
                    this.fuzzyThreshold = parseThreshold(args[++i]);
                } else if ("--verbose".equals(arg) || "--dev".equals(arg)) {
                    this.verbose = true;
                } else if ("--json".equals(arg)) {
                    this.json = true;
                } else if ("--dry-run".equals(arg)) {
                    this.dryRun = true;
                } else if ("--no-git".equals(arg)) {
                    this.noGit = true;
                } else if ("--strict-counts".equals(arg)) {
                    this.strictCounts = true;
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else if (command == null) {
                    this.command = parseCommand(arg);
                } else if (patchSource == null) {
                    this.patchSource = arg;
                } else {
                    throw new IllegalArgumentException("Unexpected argument: " + arg);
                }
            }
            return this;
        }

        private static Command parseCommand(String value) {
            try {
                return Command.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown command: " + value);
            }
        }

        private static int parseInt(String value, String option) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number, got: " + value);
            }
        }

        private static double parseThreshold(String value) {
            double threshold;
            try {
                threshold = Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--fuzzy-threshold expects a number, got: " + value);
            }
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("--fuzzy-threshold must be between 0 and 1");
            }
            return threshold;
        }

        public AppConfig build() throws IOException {
            if (command == null) {
                throw new IllegalArgumentException("A command is required");
            }
            Path repo = repoPath != null ? repoPath : Paths.get("").toAbsolutePath().normalize();

            int port = command == Command.SERVE ? findAvailablePort(preferredPort) : preferredPort;

            Path logDir = logDirectory != null ? logDirectory : getLogDirectory();
            Files.createDirectories(logDir);
            Path logPath = logDir.resolve("termcode.log");

            return new AppConfig(this, repo, logPath, port);
        }
    }
}
