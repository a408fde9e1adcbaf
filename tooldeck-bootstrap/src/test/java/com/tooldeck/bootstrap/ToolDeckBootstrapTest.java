package com.tooldeck.bootstrap;

import com.tooldeck.annotations.ResourceCleanup;
import com.tooldeck.config.ToolDeckConfig;
import com.tooldeck.registry.ResolvedUnit;
import com.tooldeck.registry.ToolRegistry;
import com.tooldeck.tools.Tool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class ToolDeckBootstrapTest {

    static final class CleanupTool implements Tool, ResourceCleanup {
        final AtomicInteger exits = new AtomicInteger();
        private final boolean failOnExit;

        CleanupTool(boolean failOnExit) {
            this.failOnExit = failOnExit;
        }

        @Override
        public void run() {
        }

        @Override
        public void onExit() {
            exits.incrementAndGet();
            if (failOnExit) {
                throw new IllegalStateException("cleanup failed");
            }
        }
    }

    @TempDir
    Path toolsDir;

    @Test
    void initialize_discoversLazilyAndOnlyOnce() throws Exception {
        Files.createFile(toolsDir.resolve("code1.jar"));
        AtomicInteger resolutions = new AtomicInteger();
        Tool tool = () -> { };
        ToolDeckConfig config = ToolDeckConfig.builder().toolsDir(toolsDir).build();

        BootstrapContext ctx = ToolDeckBootstrap.initialize(config, candidate -> {
            resolutions.incrementAndGet();
            return ResolvedUnit.of(tool);
        });

        assertFalse(ctx.getRegistryCache().isLoaded());
        assertEquals(0, resolutions.get());
        ToolRegistry first = ctx.getRegistry();
        ToolRegistry second = ctx.getRegistry();

        assertSame(first, second);
        assertEquals(1, resolutions.get());
        assertEquals(List.of("Code1"), first.getDisplayNames());
        assertSame(config, ctx.getConfig());
    }

    @Test
    void applyArgs_firstArgumentOverridesToolsDir() {
        ToolDeckConfig config = ToolDeckConfig.builder().toolPrefix("tool").build();

        ToolDeckConfig applied = ToolDeckBootstrap.applyArgs(config, new String[]{toolsDir.toString()});

        assertEquals(toolsDir, applied.getToolsDir());
        assertEquals("tool", applied.getToolPrefix());
    }

    @Test
    void applyArgs_noArgumentsKeepsConfig() {
        ToolDeckConfig config = ToolDeckConfig.builder().build();

        assertSame(config, ToolDeckBootstrap.applyArgs(config, new String[0]));
        assertSame(config, ToolDeckBootstrap.applyArgs(config, null));
        assertSame(config, ToolDeckBootstrap.applyArgs(config, new String[]{" "}));
    }

    @Test
    void runResourceCleanup_callsOnExitOnceForEveryTool() throws Exception {
        Files.createFile(toolsDir.resolve("code1.jar"));
        Files.createFile(toolsDir.resolve("code2.jar"));
        CleanupTool failing = new CleanupTool(true);
        CleanupTool healthy = new CleanupTool(false);
        ToolDeckConfig config = ToolDeckConfig.builder().toolsDir(toolsDir).build();
        BootstrapContext ctx = ToolDeckBootstrap.initialize(config,
                candidate -> ResolvedUnit.of(candidate.getFileName().equals("code1.jar") ? failing : healthy));
        ctx.getRegistry();

        ctx.runResourceCleanup();
        ctx.runResourceCleanup();

        assertEquals(1, failing.exits.get());
        assertEquals(1, healthy.exits.get());
    }

    @Test
    void runResourceCleanup_withoutDiscoveryDoesNotScan() {
        ToolDeckConfig config = ToolDeckConfig.builder().toolsDir(toolsDir.resolve("missing")).build();
        BootstrapContext ctx = ToolDeckBootstrap.initialize(config);

        ctx.runResourceCleanup();

        assertFalse(ctx.getRegistryCache().isLoaded());
    }
}
