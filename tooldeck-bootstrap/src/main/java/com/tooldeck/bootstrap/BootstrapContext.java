package com.tooldeck.bootstrap;

import com.tooldeck.annotations.ResourceCleanup;
import com.tooldeck.config.ToolDeckConfig;
import com.tooldeck.registry.LoadedTool;
import com.tooldeck.registry.ToolRegistry;
import com.tooldeck.registry.ToolRegistryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wrapper object returned from bootstrap. Holds the resolved configuration and the registry cache
 * owned by the host for its whole lifetime.
 */
public final class BootstrapContext {

    private static final Logger log = LoggerFactory.getLogger(BootstrapContext.class);

    private final ToolDeckConfig config;
    private final ToolRegistryCache registryCache;
    private final AtomicBoolean cleanedUp = new AtomicBoolean();

    public BootstrapContext(ToolDeckConfig config, ToolRegistryCache registryCache) {
        this.config = Objects.requireNonNull(config, "config");
        this.registryCache = Objects.requireNonNull(registryCache, "registryCache");
    }

    /** Configuration from environment, config file and command line. */
    public ToolDeckConfig getConfig() {
        return config;
    }

    /** Cache holding the one registry of this process. */
    public ToolRegistryCache getRegistryCache() {
        return registryCache;
    }

    /** Same as {@code getRegistryCache().get()}: runs discovery on first call. */
    public ToolRegistry getRegistry() {
        return registryCache.get();
    }

    /**
     * Invokes {@link ResourceCleanup#onExit()} on every loaded tool implementing it, then closes the
     * tool class loaders. Runs at most once; does nothing when discovery never ran.
     */
    public void runResourceCleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        Optional<ToolRegistry> registry = registryCache.peek();
        if (registry.isEmpty()) {
            return;
        }
        for (LoadedTool tool : registry.get().getOrderedTools()) {
            Object instance = tool.getInstance();
            if (instance instanceof ResourceCleanup) {
                try {
                    ((ResourceCleanup) instance).onExit();
                } catch (Exception ex) {
                    log.warn("Tool {} onExit failed: {}", tool.getDisplayName(), ex.getMessage());
                }
            }
            tool.close();
        }
    }
}
