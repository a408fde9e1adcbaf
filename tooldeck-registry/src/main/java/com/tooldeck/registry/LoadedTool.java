package com.tooldeck.registry;

import com.tooldeck.tools.Tool;

import java.util.Objects;

/**
 * A validated tool in the registry: entry point, metadata and source file.
 */
public final class LoadedTool {

    private final ToolDescriptor descriptor;
    private final Tool tool;
    private final String fileName;
    private final ResolvedUnit unit;

    public LoadedTool(ToolDescriptor descriptor, Tool tool, String fileName, ResolvedUnit unit) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.tool = Objects.requireNonNull(tool, "tool");
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.unit = unit != null ? unit : ResolvedUnit.of(tool);
    }

    public ToolDescriptor getDescriptor() {
        return descriptor;
    }

    public String getDisplayName() {
        return descriptor.getDisplayName();
    }

    /** Entry point; invoked by the dispatcher. */
    public Tool getTool() {
        return tool;
    }

    /** Source file name (e.g. {@code code2.jar}). */
    public String getFileName() {
        return fileName;
    }

    /** The object created from the tool's entry class. */
    public Object getInstance() {
        return unit.getInstance();
    }

    /** Releases the tool's class loader. Called at shutdown or when the tool is replaced. */
    public void close() {
        unit.close();
    }

    @Override
    public String toString() {
        return "LoadedTool{" + descriptor.getDisplayName() + " from " + fileName + "}";
    }
}
