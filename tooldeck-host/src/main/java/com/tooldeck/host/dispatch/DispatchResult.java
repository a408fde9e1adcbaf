package com.tooldeck.host.dispatch;

import java.util.Objects;

/**
 * Result of one dispatch cycle. Never carries an exception out of the dispatcher; failures are
 * described by a {@link DispatchFailureReport}.
 */
public final class DispatchResult {

    private final DispatchStatus status;
    private final String selection;
    private final long elapsedMillis;
    private final DispatchFailureReport failure;
    private final String message;

    private DispatchResult(DispatchStatus status, String selection, long elapsedMillis,
                           DispatchFailureReport failure, String message) {
        this.status = Objects.requireNonNull(status, "status");
        this.selection = selection;
        this.elapsedMillis = elapsedMillis;
        this.failure = failure;
        this.message = message != null ? message : "";
    }

    static DispatchResult completed(String toolName, long elapsedMillis) {
        return new DispatchResult(DispatchStatus.COMPLETED, toolName, elapsedMillis, null, null);
    }

    static DispatchResult failed(DispatchFailureReport failure, long elapsedMillis) {
        Objects.requireNonNull(failure, "failure");
        return new DispatchResult(DispatchStatus.FAILED, failure.getToolName(), elapsedMillis, failure,
                "Error running '" + failure.getToolName() + "'");
    }

    static DispatchResult noTools(String selection, String guidance) {
        return new DispatchResult(DispatchStatus.NO_TOOLS, selection, 0, null, guidance);
    }

    static DispatchResult unknownSelection(String selection) {
        return new DispatchResult(DispatchStatus.UNKNOWN_SELECTION, selection, 0, null,
                "No tool named '" + selection + "'");
    }

    public DispatchStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == DispatchStatus.COMPLETED;
    }

    /** Display name of the invoked tool, or the raw selection when nothing was invoked. */
    public String getSelection() {
        return selection;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /** Failure report; null unless status is {@link DispatchStatus#FAILED}. */
    public DispatchFailureReport getFailure() {
        return failure;
    }

    /** Operator-facing message (guidance for {@link DispatchStatus#NO_TOOLS}); empty on success. */
    public String getMessage() {
        return message;
    }
}
