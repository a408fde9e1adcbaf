package com.tooldeck.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Lists tool candidates: regular files directly inside the tools directory whose name starts with
 * the configured prefix and ends with the configured suffix. Subdirectories are not scanned.
 * Candidates are returned sorted by file name; that order is the scan order used when two tools
 * end up with the same display name.
 */
public final class ToolSourceScanner {

    private static final Logger log = LoggerFactory.getLogger(ToolSourceScanner.class);

    private final String prefix;
    private final String suffix;

    public ToolSourceScanner(String prefix, String suffix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
    }

    /**
     * @param toolsDir directory to scan
     * @return matching candidates sorted by file name; empty if none match
     * @throws ToolScanException if the directory does not exist, is not a directory, or cannot be listed
     */
    public List<ToolCandidate> scan(Path toolsDir) {
        Objects.requireNonNull(toolsDir, "toolsDir");
        if (!Files.isDirectory(toolsDir)) {
            throw new ToolScanException(toolsDir, "Tools directory does not exist or is not a directory: "
                    + toolsDir.toAbsolutePath());
        }
        List<ToolCandidate> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(toolsDir, this::matches)) {
            for (Path entry : stream) {
                candidates.add(new ToolCandidate(entry.getFileName().toString(), entry));
            }
        } catch (IOException e) {
            throw new ToolScanException(toolsDir, "Failed to list tools directory " + toolsDir.toAbsolutePath()
                    + ": " + e.getMessage(), e);
        }
        candidates.sort(Comparator.comparing(ToolCandidate::getFileName));
        log.debug("Scanned {}: {} candidate(s) matching {}*{}", toolsDir, candidates.size(), prefix, suffix);
        return candidates;
    }

    boolean matches(Path entry) {
        String name = entry.getFileName().toString();
        return name.startsWith(prefix)
                && name.endsWith(suffix)
                && name.length() >= prefix.length() + suffix.length()
                && Files.isRegularFile(entry);
    }
}
