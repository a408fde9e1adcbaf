package com.tooldeck.registry;

import com.tooldeck.config.OrderingMode;

import java.util.Comparator;
import java.util.Objects;

/**
 * Comparators for the tool list. Both end with the display name, which is unique in a registry,
 * so the resulting order is total.
 */
public final class OrderingPolicy {

    /** (priority, display name). */
    public static final Comparator<ToolDescriptor> BY_PRIORITY =
            Comparator.comparingInt(ToolDescriptor::getPriority)
                    .thenComparing(ToolDescriptor::getDisplayName);

    /** (numeric id from file name, priority, display name); the file name number dominates. */
    public static final Comparator<ToolDescriptor> BY_NUMERIC_ID =
            Comparator.comparingInt(ToolDescriptor::getNumericId)
                    .thenComparing(BY_PRIORITY);

    private OrderingPolicy() {
    }

    public static Comparator<ToolDescriptor> forMode(OrderingMode mode) {
        Objects.requireNonNull(mode, "mode");
        switch (mode) {
            case PRIORITY:
                return BY_PRIORITY;
            case NUMERIC_ID:
                return BY_NUMERIC_ID;
            default:
                throw new IllegalArgumentException("Unsupported ordering: " + mode);
        }
    }
}
