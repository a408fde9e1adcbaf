package com.tooldeck.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, read-only view of the loaded tools keyed by display name, plus every {@link LoadError}
 * collected during discovery. Built once per host lifetime by {@link ToolDiscovery}.
 * <p>
 * Display names are unique: when two candidates produce the same name, the one later in scan order
 * replaces the earlier one (see {@link Builder#put(LoadedTool)}).
 */
public final class ToolRegistry {

    private final Map<String, LoadedTool> tools;
    private final List<LoadError> errors;

    private ToolRegistry(Map<String, LoadedTool> tools, List<LoadError> errors) {
        this.tools = Collections.unmodifiableMap(tools);
        this.errors = Collections.unmodifiableList(errors);
    }

    public static ToolRegistry empty() {
        return new ToolRegistry(new LinkedHashMap<>(), new ArrayList<>());
    }

    /** Display name → tool, iteration in list order. */
    public Map<String, LoadedTool> getTools() {
        return tools;
    }

    /** Display names in list order. */
    public List<String> getDisplayNames() {
        return List.copyOf(tools.keySet());
    }

    /** Tools in list order. */
    public List<LoadedTool> getOrderedTools() {
        return List.copyOf(tools.values());
    }

    public Optional<LoadedTool> find(String displayName) {
        return displayName != null ? Optional.ofNullable(tools.get(displayName)) : Optional.empty();
    }

    /** Load errors in scan order. */
    public List<LoadError> getErrors() {
        return errors;
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public int size() {
        return tools.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects tools and errors during discovery. Not thread-safe; used by a single discovery pass.
     */
    public static final class Builder {

        private final Map<String, LoadedTool> tools = new LinkedHashMap<>();
        private final List<LoadError> errors = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a tool under its display name. A tool already registered under that name is replaced
         * (last write wins) and returned so the caller can release it; no load error is recorded for it.
         *
         * @return the replaced tool, or null
         */
        public LoadedTool put(LoadedTool tool) {
            Objects.requireNonNull(tool, "tool");
            return tools.put(tool.getDisplayName(), tool);
        }

        public Builder addError(LoadError error) {
            errors.add(Objects.requireNonNull(error, "error"));
            return this;
        }

        /** Sorts the collected tools with the given comparator and freezes the result. */
        public ToolRegistry build(Comparator<ToolDescriptor> ordering) {
            Objects.requireNonNull(ordering, "ordering");
            List<LoadedTool> sorted = new ArrayList<>(tools.values());
            sorted.sort(Comparator.comparing(LoadedTool::getDescriptor, ordering));
            Map<String, LoadedTool> ordered = new LinkedHashMap<>();
            for (LoadedTool tool : sorted) {
                ordered.put(tool.getDisplayName(), tool);
            }
            return new ToolRegistry(ordered, new ArrayList<>(errors));
        }
    }
}
