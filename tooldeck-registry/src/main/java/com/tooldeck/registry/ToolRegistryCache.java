package com.tooldeck.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Holds the registry for the host's lifetime. Discovery runs lazily on the first {@link #get()} and at
 * most once: concurrent first callers wait for the single pass and all receive the same registry.
 * There is no invalidation; restarting the host is the only way to rediscover tools.
 * <p>
 * A pass that throws is not remembered. The exception reaches the caller and a later {@code get()}
 * tries again.
 */
public final class ToolRegistryCache {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistryCache.class);

    private final Supplier<ToolRegistry> discovery;
    private final Object lock = new Object();
    private volatile ToolRegistry registry;

    public ToolRegistryCache(Supplier<ToolRegistry> discovery) {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
    }

    public ToolRegistry get() {
        ToolRegistry existing = registry;
        if (existing != null) {
            return existing;
        }
        synchronized (lock) {
            if (registry == null) {
                long start = System.nanoTime();
                ToolRegistry computed = Objects.requireNonNull(discovery.get(), "discovery returned null");
                registry = computed;
                log.info("Tool registry ready in {} ms ({} tool(s))",
                        (System.nanoTime() - start) / 1_000_000, computed.size());
            }
            return registry;
        }
    }

    /** Whether discovery has completed. */
    public boolean isLoaded() {
        return registry != null;
    }

    /** Registry if already computed; never triggers discovery. */
    public Optional<ToolRegistry> peek() {
        return Optional.ofNullable(registry);
    }
}
