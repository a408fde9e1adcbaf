package com.tooldeck.registry;

/**
 * Turns a candidate into a live object. Implementations may fail for any reason (bad archive,
 * missing class, exception in the tool's initialization); {@link ToolLoader} converts every such
 * failure into a {@link LoadError} so one broken tool never stops discovery of the others.
 */
@FunctionalInterface
public interface UnitResolver {

    /**
     * @param candidate candidate from the scanner
     * @return the resolved object with the class loader that owns it
     * @throws Exception on any resolution failure
     */
    ResolvedUnit resolve(ToolCandidate candidate) throws Exception;
}
