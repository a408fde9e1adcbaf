package com.tooldeck.host.dispatch;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * What the operator sees when a tool fails: the tool, the kind of error, its message and the full trace.
 */
public final class DispatchFailureReport {

    /** Static remediation hint shown with every failure. */
    public static final String HINT = "Tip: check the tool's code or contact the tool developer.";

    private final String toolName;
    private final String errorType;
    private final String message;
    private final String stackTrace;

    public DispatchFailureReport(String toolName, String errorType, String message, String stackTrace) {
        this.toolName = Objects.requireNonNull(toolName, "toolName");
        this.errorType = Objects.requireNonNull(errorType, "errorType");
        this.message = message != null ? message : "";
        this.stackTrace = stackTrace != null ? stackTrace : "";
    }

    /** Builds the report for a throwable raised by the named tool. */
    public static DispatchFailureReport of(String toolName, Throwable error) {
        Objects.requireNonNull(error, "error");
        StringWriter trace = new StringWriter();
        try (PrintWriter pw = new PrintWriter(trace)) {
            error.printStackTrace(pw);
        }
        return new DispatchFailureReport(toolName, error.getClass().getSimpleName(), error.getMessage(), trace.toString());
    }

    public String getToolName() {
        return toolName;
    }

    /** Simple class name of the throwable (e.g. {@code IllegalStateException}). */
    public String getErrorType() {
        return errorType;
    }

    /** Message of the throwable; empty when it had none. */
    public String getMessage() {
        return message;
    }

    public String getStackTrace() {
        return stackTrace;
    }

    public String getHint() {
        return HINT;
    }
}
