package com.tooldeck.host;

import com.tooldeck.bootstrap.BootstrapContext;
import com.tooldeck.bootstrap.ToolDeckBootstrap;
import com.tooldeck.config.ToolDeckConfigException;
import com.tooldeck.host.console.ConsoleRenderer;
import com.tooldeck.host.console.ConsoleToolHost;
import com.tooldeck.host.dispatch.ToolDispatcher;
import com.tooldeck.registry.ToolRegistry;
import com.tooldeck.registry.ToolScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Tool Deck entry point. The first argument, when given, is the tools directory.
 * <p>
 * Discovery runs before the console opens. Failing tools never stop the host; a tools directory
 * that cannot be scanned does (exit status 1). The shutdown hook runs tool cleanup and closes the
 * tool class loaders.
 */
public final class ToolDeckApplication {

    private static final Logger log = LoggerFactory.getLogger(ToolDeckApplication.class);

    private ToolDeckApplication() {
    }

    public static void main(String[] args) {
        int status = run(args, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, BufferedReader in) {
        BootstrapContext ctx;
        try {
            ctx = ToolDeckBootstrap.initialize(args);
        } catch (ToolDeckConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage(), e);
            return 1;
        }
        ToolRegistry registry;
        try {
            registry = ctx.getRegistry();
        } catch (ToolScanException e) {
            log.error("Cannot scan tools directory {}: {}", e.getDirectory(), e.getMessage(), e);
            return 1;
        }
        log.info("Starting Tool Deck | tools: {} | load errors: {}", registry.size(), registry.getErrors().size());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down Tool Deck...");
            ctx.runResourceCleanup();
        }, "tooldeck-shutdown"));

        ConsoleToolHost host = new ConsoleToolHost(ctx.getRegistryCache(),
                new ToolDispatcher(ctx.getRegistryCache()),
                new ConsoleRenderer(System.out, ctx.getConfig()));
        try {
            host.run(in);
        } catch (IOException e) {
            log.error("Console input failed: {}", e.getMessage(), e);
            return 1;
        } finally {
            ctx.runResourceCleanup();
        }
        return 0;
    }
}
