package com.tooldeck.registry;

import com.tooldeck.annotations.DeckTool;

import java.util.Objects;

/**
 * Metadata of a loaded tool, built once at load time. Every field has a value; defaults are applied by
 * {@link ToolMetadataExtractor}: empty description, priority {@value DeckTool#DEFAULT_ORDER},
 * numeric id {@value #NO_NUMERIC_ID}.
 */
public final class ToolDescriptor {

    /** Numeric id of a tool whose file name carries no digits after the prefix; sorts last. */
    public static final int NO_NUMERIC_ID = 999_999;

    private final String displayName;
    private final String description;
    private final int priority;
    private final int numericId;

    public ToolDescriptor(String displayName, String description, int priority, int numericId) {
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.description = description != null ? description : "";
        this.priority = priority;
        this.numericId = numericId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /** Declared sort priority; lower first. */
    public int getPriority() {
        return priority;
    }

    /** Number parsed from the file name, or {@link #NO_NUMERIC_ID}. */
    public int getNumericId() {
        return numericId;
    }

    public boolean hasNumericId() {
        return numericId != NO_NUMERIC_ID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolDescriptor)) return false;
        ToolDescriptor that = (ToolDescriptor) o;
        return priority == that.priority
                && numericId == that.numericId
                && displayName.equals(that.displayName)
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(displayName, description, priority, numericId);
    }

    @Override
    public String toString() {
        return "ToolDescriptor{" + displayName + ", priority=" + priority + ", numericId=" + numericId + "}";
    }
}
