package com.tooldeck.registry;

import java.util.Objects;

/**
 * Immutable record of a candidate that failed to resolve or validate.
 */
public final class LoadError {

    private final String candidateName;
    private final LoadErrorKind kind;
    private final String message;

    public LoadError(String candidateName, LoadErrorKind kind, String message) {
        this.candidateName = Objects.requireNonNull(candidateName, "candidateName");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
    }

    /** File name of the candidate (e.g. {@code code3.jar}). */
    public String getCandidateName() {
        return candidateName;
    }

    public LoadErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /** Line shown in the operator-facing error list: label followed by the message. */
    public String format() {
        return kind.getLabel() + " " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LoadError)) return false;
        LoadError that = (LoadError) o;
        return candidateName.equals(that.candidateName) && kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidateName, kind, message);
    }

    @Override
    public String toString() {
        return "LoadError{" + candidateName + ", " + kind + ", " + message + "}";
    }
}
