package com.tooldeck.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolSourceScannerTest {

    @TempDir
    Path tempDir;

    private final ToolSourceScanner scanner = new ToolSourceScanner("code", ".jar");

    @Test
    void scan_returnsOnlyMatchingFilesSortedByName() throws Exception {
        Files.createFile(tempDir.resolve("code5.jar"));
        Files.createFile(tempDir.resolve("code10.jar"));
        Files.createFile(tempDir.resolve("code_app.jar"));
        Files.createFile(tempDir.resolve("app.jar"));
        Files.createFile(tempDir.resolve("code1.txt"));
        Files.createFile(tempDir.resolve("mycode2.jar"));

        List<String> names = scanner.scan(tempDir).stream()
                .map(ToolCandidate::getFileName)
                .collect(Collectors.toList());

        assertEquals(List.of("code10.jar", "code5.jar", "code_app.jar"), names);
    }

    @Test
    void scan_doesNotDescendIntoSubdirectories() throws Exception {
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Files.createFile(nested.resolve("code1.jar"));
        Files.createDirectories(tempDir.resolve("code_dir.jar"));

        assertTrue(scanner.scan(tempDir).isEmpty());
    }

    @Test
    void scan_candidatePathPointsIntoDirectory() throws Exception {
        Path jar = Files.createFile(tempDir.resolve("code1.jar"));

        ToolCandidate candidate = scanner.scan(tempDir).get(0);

        assertEquals(jar, candidate.getPath());
    }

    @Test
    void scan_emptyDirectoryReturnsNothing() {
        assertTrue(scanner.scan(tempDir).isEmpty());
    }

    @Test
    void scan_missingDirectoryThrows() {
        Path missing = tempDir.resolve("missing");

        ToolScanException e = assertThrows(ToolScanException.class, () -> scanner.scan(missing));

        assertEquals(missing, e.getDirectory());
    }

    @Test
    void scan_fileInsteadOfDirectoryThrows() throws Exception {
        Path file = Files.createFile(tempDir.resolve("tools"));

        assertThrows(ToolScanException.class, () -> scanner.scan(file));
    }
}
