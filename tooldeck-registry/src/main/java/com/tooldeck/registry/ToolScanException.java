package com.tooldeck.registry;

import java.nio.file.Path;

/**
 * Thrown when the tools directory cannot be listed. This is the only discovery failure that is not
 * recovered: it means the host is deployed with a broken tools directory.
 */
public final class ToolScanException extends RuntimeException {

    private final Path directory;

    public ToolScanException(Path directory, String message) {
        super(message);
        this.directory = directory;
    }

    public ToolScanException(Path directory, String message, Throwable cause) {
        super(message, cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
