package com.tooldeck.host.dispatch;

/**
 * Outcome category of one dispatch cycle.
 */
public enum DispatchStatus {

    /** The tool's {@code run()} returned normally. */
    COMPLETED,

    /** The tool's {@code run()} threw; see {@link DispatchResult#getFailure()}. */
    FAILED,

    /** The registry holds no tools; nothing was invoked. */
    NO_TOOLS,

    /** The selection does not name a registered tool; nothing was invoked. */
    UNKNOWN_SELECTION
}
