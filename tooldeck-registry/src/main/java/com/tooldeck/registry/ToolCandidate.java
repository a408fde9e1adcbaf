package com.tooldeck.registry;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A directory entry whose name matches the tool naming convention. Not validated yet; produced by
 * {@link ToolSourceScanner} and consumed right away by {@link ToolLoader}.
 */
public final class ToolCandidate {

    private final String fileName;
    private final Path path;

    public ToolCandidate(String fileName, Path path) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.path = Objects.requireNonNull(path, "path");
    }

    /** File name only (e.g. {@code code10.jar}). */
    public String getFileName() {
        return fileName;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String toString() {
        return fileName;
    }
}
