package com.tooldeck.registry;

/**
 * Resolution failure detected by the host itself (as opposed to an exception thrown by the tool's code),
 * e.g. a JAR without a {@code Tool-Class} manifest attribute.
 */
public final class ToolResolutionException extends Exception {

    public ToolResolutionException(String message) {
        super(message);
    }
}
