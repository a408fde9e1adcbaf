package com.tooldeck.tools;

/**
 * Entry point of a tool. A tool JAR names its entry class in the manifest attribute
 * {@value #MANIFEST_ATTRIBUTE}; the host instantiates it with the public no-argument constructor
 * and calls {@link #run()} each time the operator selects the tool.
 * <p>
 * Implementing this interface is the preferred contract. A class that does not implement it is
 * still accepted when it declares a public zero-argument method named {@code run}.
 * Metadata (display name, description, order) is declared with
 * {@link com.tooldeck.annotations.DeckTool} on the entry class.
 * <p>
 * <b>Threading:</b> the host invokes {@code run()} from its request cycle and waits for it to
 * return; there is no timeout and no cancellation. Everything {@code run()} does (I/O, output)
 * is the tool's own business.
 */
@FunctionalInterface
public interface Tool {

    /** Manifest main attribute naming the entry class of a tool JAR. */
    String MANIFEST_ATTRIBUTE = "Tool-Class";

    /** Name of the entry point the host looks for on classes that do not implement this interface. */
    String ENTRY_POINT = "run";

    /**
     * Runs the tool once.
     *
     * @throws Exception on any failure; the host reports it and keeps running
     */
    void run() throws Exception;
}
