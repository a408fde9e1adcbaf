package com.tooldeck.registry;

import com.tooldeck.tools.Tool;

import java.util.Objects;

/**
 * Outcome of loading one candidate: either a validated entry point or a {@link LoadError}.
 */
public final class ToolLoadResult {

    private final Tool tool;
    private final ResolvedUnit unit;
    private final LoadError error;

    private ToolLoadResult(Tool tool, ResolvedUnit unit, LoadError error) {
        this.tool = tool;
        this.unit = unit;
        this.error = error;
    }

    static ToolLoadResult loaded(Tool tool, ResolvedUnit unit) {
        return new ToolLoadResult(Objects.requireNonNull(tool, "tool"), Objects.requireNonNull(unit, "unit"), null);
    }

    static ToolLoadResult failed(LoadError error) {
        return new ToolLoadResult(null, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isLoaded() {
        return error == null;
    }

    /** Validated entry point; null when {@link #isLoaded()} is false. */
    public Tool getTool() {
        return tool;
    }

    /** Resolved unit; null when {@link #isLoaded()} is false. */
    public ResolvedUnit getUnit() {
        return unit;
    }

    /** Class carrying the tool's metadata annotation; null when {@link #isLoaded()} is false. */
    public Class<?> getEntryClass() {
        return unit != null ? unit.getInstance().getClass() : null;
    }

    /** Load error; null when {@link #isLoaded()} is true. */
    public LoadError getError() {
        return error;
    }
}
