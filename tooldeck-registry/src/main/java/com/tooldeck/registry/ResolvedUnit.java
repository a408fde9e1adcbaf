package com.tooldeck.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Object produced by a {@link UnitResolver} together with the class loader that defined it.
 * The loader is closed when the tool is rejected, replaced by a later tool of the same name, or when
 * the host shuts down.
 */
public final class ResolvedUnit {

    private static final Logger log = LoggerFactory.getLogger(ResolvedUnit.class);

    private final Object instance;
    private final ClassLoader classLoader;

    public ResolvedUnit(Object instance, ClassLoader classLoader) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.classLoader = classLoader;
    }

    /** Unit without a dedicated class loader (e.g. registered in-process). */
    public static ResolvedUnit of(Object instance) {
        return new ResolvedUnit(instance, null);
    }

    public Object getInstance() {
        return instance;
    }

    /** Class loader owning the unit; null when the unit was not loaded from its own archive. */
    public ClassLoader getClassLoader() {
        return classLoader;
    }

    /** Closes the class loader if it is closeable. Failures are logged, not thrown. */
    public void close() {
        if (!(classLoader instanceof Closeable)) {
            return;
        }
        try {
            ((Closeable) classLoader).close();
        } catch (IOException e) {
            log.warn("Failed to close class loader of {}: {}", instance.getClass().getName(), e.getMessage());
        }
    }
}
