package com.tooldeck.annotations;

/**
 * Contract for resource cleanup when the host is shutting down.
 * Tools that hold resources (connections, threads, temp files) should implement this
 * and release them in {@link #onExit()}. The host invokes {@code onExit()} on every loaded
 * tool during shutdown, before the tool class loaders are closed.
 */
public interface ResourceCleanup {

    /**
     * Called once when the host is shutting down. Implementations should release resources.
     * Exceptions are logged by the host and not rethrown so other tools still get a chance
     * to clean up.
     */
    void onExit();
}
