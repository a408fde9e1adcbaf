package com.tooldeck.bootstrap;

import com.tooldeck.config.ToolDeckConfig;
import com.tooldeck.registry.ToolDiscovery;
import com.tooldeck.registry.ToolRegistryCache;
import com.tooldeck.registry.UnitResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Bootstrap for the Tool Deck host: loads configuration (environment, optional config file, first
 * command-line argument as tools directory) and wires discovery into a {@link ToolRegistryCache}.
 * Discovery itself does not run here; it runs on the first read of the cache.
 */
public final class ToolDeckBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ToolDeckBootstrap.class);

    private ToolDeckBootstrap() {
    }

    /**
     * Creates configuration from environment and the optional tools directory argument.
     *
     * @param args command-line arguments; {@code args[0]}, when present, overrides the tools directory
     * @return bootstrap context with config and an empty registry cache
     */
    public static BootstrapContext initialize(String[] args) {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(applyArgs(ToolDeckConfig.fromEnvironment(), args));
    }

    /** Wires discovery of JAR tools for an already built configuration. */
    public static BootstrapContext initialize(ToolDeckConfig config) {
        return initialize(config, null);
    }

    /**
     * Wires discovery with the given resolver.
     *
     * @param resolver resolver for candidates; null = JAR files
     */
    public static BootstrapContext initialize(ToolDeckConfig config, UnitResolver resolver) {
        ToolDiscovery discovery = resolver != null
                ? ToolDiscovery.fromConfig(config, resolver)
                : ToolDiscovery.fromConfig(config);
        log.info("Bootstrap: toolsDir={}, pattern={}*{}, ordering={}",
                config.getToolsDir().toAbsolutePath(), config.getToolPrefix(), config.getToolSuffix(), config.getOrdering());
        return new BootstrapContext(config, new ToolRegistryCache(discovery::discover));
    }

    static ToolDeckConfig applyArgs(ToolDeckConfig config, String[] args) {
        if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
            return config;
        }
        return config.withToolsDir(Path.of(args[0].trim()));
    }
}
