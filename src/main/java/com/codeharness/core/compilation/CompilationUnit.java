package com.codeharness.core.compilation;

import com.codeharness.core.language.Language;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * One role's source, its language, where its artifact goes, and the file timestamps last observed.
 *
 * @param sourceModified   source mtime, {@code null} when missing or unreadable
 * @param artifactModified artifact mtime, {@code null} when missing or unreadable
 */
public record CompilationUnit(
        String role,
        Path source,
        Language language,
        Path artifact,
        Instant sourceModified,
        Instant artifactModified
) {

    public static CompilationUnit observe(String role, Path source, Language language, Path artifact) {
        return new CompilationUnit(role, source, language, artifact, modifiedTime(source), modifiedTime(artifact));
    }

    /** Re-reads both timestamps from disk. */
    public CompilationUnit refresh() {
        return observe(role, source, language, artifact);
    }

    /**
     * A unit is stale iff its language builds and the artifact is missing, the source is missing,
     * or the source is strictly newer than the artifact. Unreadable timestamps count as stale.
     */
    public boolean isStale(boolean buildRequired) {
        if (!buildRequired) {
            return false;
        }
        if (artifactModified == null || sourceModified == null) {
            return true;
        }
        return sourceModified.isAfter(artifactModified);
    }

    public String fileName() {
        return source.getFileName().toString();
    }

    private static Instant modifiedTime(Path path) {
        if (path == null || !Files.exists(path)) {
            return null;
        }
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            return null;
        }
    }
}
