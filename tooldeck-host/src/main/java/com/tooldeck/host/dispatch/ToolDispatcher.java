package com.tooldeck.host.dispatch;

import com.tooldeck.registry.LoadedTool;
import com.tooldeck.registry.ToolRegistry;
import com.tooldeck.registry.ToolRegistryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Invokes the selected tool once per request cycle and contains whatever it throws.
 * <p>
 * The registry is read from the cache on every call and never modified. A failing tool is reported
 * and stays selectable; the host keeps running. A {@link StackOverflowError} from runaway recursion
 * is reported like any other failure; other {@link VirtualMachineError}s (e.g. out of memory) are rethrown. There is no timeout: the dispatcher waits for {@code run()} to return.
 */
public final class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    /** Returned with {@link DispatchStatus#NO_TOOLS}. */
    public static final String NO_TOOLS_GUIDANCE =
            "No tools available. Add tool JARs to the tools directory and restart the host.";

    private final ToolRegistryCache registryCache;

    public ToolDispatcher(ToolRegistryCache registryCache) {
        this.registryCache = Objects.requireNonNull(registryCache, "registryCache");
    }

    /**
     * Runs one cycle for the given selection.
     *
     * @param selection display name of the tool to run
     * @return result describing what happened; never null
     */
    public DispatchResult dispatch(String selection) {
        ToolRegistry registry = registryCache.get();
        if (registry.isEmpty()) {
            return DispatchResult.noTools(selection, NO_TOOLS_GUIDANCE);
        }
        Optional<LoadedTool> selected = registry.find(selection);
        if (selected.isEmpty()) {
            log.debug("Unknown tool selection '{}'", selection);
            return DispatchResult.unknownSelection(selection);
        }
        return invoke(selected.get());
    }

    private DispatchResult invoke(LoadedTool tool) {
        String name = tool.getDisplayName();
        log.info("Running tool '{}' ({})", name, tool.getFileName());
        long start = System.nanoTime();
        try {
            tool.getTool().run();
        } catch (StackOverflowError e) {
            return failed(name, start, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return failed(name, start, e);
        }
        long elapsed = elapsedMillis(start);
        log.info("Tool '{}' completed in {} ms", name, elapsed);
        return DispatchResult.completed(name, elapsed);
    }

    private static DispatchResult failed(String name, long startNanos, Throwable e) {
        long elapsed = elapsedMillis(startNanos);
        log.error("Tool '{}' failed after {} ms", name, elapsed, e);
        return DispatchResult.failed(DispatchFailureReport.of(name, e), elapsed);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
