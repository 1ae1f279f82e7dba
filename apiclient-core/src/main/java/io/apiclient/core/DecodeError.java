package io.apiclient.core;

import java.util.Objects;

/**
 * Structured description of why a body could not be decoded.
 *
 * @param kind what went wrong
 * @param expectedType name of the type the decoder expected at {@code path} (may be null)
 * @param path location within the payload, {@code ""} for the root, e.g. {@code /users/0/id}
 * @param message human-readable detail
 * @param cause underlying decoder exception (may be null)
 */
public record DecodeError(Kind kind, String expectedType, String path, String message, Throwable cause) {

    public enum Kind {
        /** A value was present but had the wrong type. */
        TYPE_MISMATCH,
        /** A required value was null. */
        VALUE_NOT_FOUND,
        /** A required key was absent. */
        KEY_NOT_FOUND,
        /** The bytes were not well-formed for the format. */
        DATA_CORRUPTED
    }

    public DecodeError {
        Objects.requireNonNull(kind, "kind");
        path = path == null ? "" : path;
        message = message == null ? kind.name() : message;
    }

    public static DecodeError dataCorrupted(String message, Throwable cause) {
        return new DecodeError(Kind.DATA_CORRUPTED, null, "", message, cause);
    }

    /**
     * Renders kind, path and expected type on one line.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (!path.isEmpty()) sb.append(" at ").append(path);
        if (expectedType != null) sb.append(" (expected ").append(expectedType).append(')');
        sb.append(": ").append(message);
        return sb.toString();
    }
}
