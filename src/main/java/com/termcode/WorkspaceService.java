package com.termcode;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem access scoped to one repository root.
 * All paths are repository-relative; absolute paths are resolved internally.
 */
public class WorkspaceService {

    private final Path workspaceRoot;

    public WorkspaceService(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        log("WorkspaceService initialized with root: " + this.workspaceRoot);
    }

    // -------------------------------------------------------------------------
    // Path Resolution
    // -------------------------------------------------------------------------

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Resolves a repository-relative path to an absolute path.
     * Validates that the resolved path stays within the repository root.
     *
     * @param relativePath repository-relative path (empty or null means root)
     * @return absolute path within the repository
     * @throws SecurityException if path escapes the repository root
     */
    public Path resolvePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || ".".equals(relativePath)) {
            return workspaceRoot;
        }

        String normalized = relativePath.replace('\\', '/');

        // Treat "/src/A.java" as repository-relative "src/A.java"
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }

        if (normalized.isEmpty()) {
            return workspaceRoot;
        }

        Path resolved = workspaceRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(workspaceRoot)) {
            throw new SecurityException("Path escapes repository root: " + relativePath);
        }
        return resolved;
    }

    // -------------------------------------------------------------------------
    // File Read/Write
    // -------------------------------------------------------------------------

    /**
     * Reads file content as a UTF-8 string.
     *
     * @throws FileNotFoundException if the file doesn't exist
     * @throws IOException if the path is a directory or can't be read
     */
    public String readFile(String relativePath) throws IOException {
        Path path = resolvePath(relativePath);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File not found: " + relativePath);
        }
        if (Files.isDirectory(path)) {
            throw new IOException("Cannot read directory as file: " + relativePath);
        }
        log("Reading file: " + relativePath);
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Reads file content, or returns null when the file does not exist.
     */
    public String readFileIfExists(String relativePath) throws IOException {
        Path path = resolvePath(relativePath);
        if (!Files.exists(path)) {
            return null;
        }
        return readFile(relativePath);
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     * Overwrites existing file content.
     */
    public void writeFile(String relativePath, String content) throws IOException {
        Path path = resolvePath(relativePath);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        log("Wrote file: " + relativePath);
    }

    /**
     * Deletes a single file.
     *
     * @throws FileNotFoundException if the file doesn't exist
     * @throws IOException if the path is a directory or deletion fails
     */
    public void deleteFile(String relativePath) throws IOException {
        Path path = resolvePath(relativePath);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File not found: " + relativePath);
        }
        if (Files.isDirectory(path)) {
            throw new IOException("Refusing to delete directory: " + relativePath);
        }
        Files.delete(path);
        log("Deleted file: " + relativePath);
    }

    // -------------------------------------------------------------------------
    // Utility Methods
    // -------------------------------------------------------------------------

    public boolean exists(String relativePath) {
        try {
            return Files.exists(resolvePath(relativePath));
        } catch (SecurityException e) {
            return false;
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[WorkspaceService] " + message);
        }
    }
}
