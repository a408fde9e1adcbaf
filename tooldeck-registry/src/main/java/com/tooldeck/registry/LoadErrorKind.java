package com.tooldeck.registry;

/**
 * Why a candidate did not become a tool. Each kind has its own label so the operator can tell a
 * crash during loading apart from a contract violation.
 */
public enum LoadErrorKind {

    /** Resolution threw (bad archive, missing class, exception in static init or constructor). */
    LOAD_EXCEPTION("[load failed]"),

    /** The entry class exposes nothing named {@code run}. */
    MISSING_ENTRY_POINT("[missing run()]"),

    /** The entry class exposes something named {@code run} that cannot be invoked without arguments. */
    NOT_CALLABLE("[not callable]");

    private final String label;

    LoadErrorKind(String label) {
        this.label = label;
    }

    /** Prefix used in the operator-facing error list. */
    public String getLabel() {
        return label;
    }
}
