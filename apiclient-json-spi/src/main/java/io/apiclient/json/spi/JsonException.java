package io.apiclient.json.spi;

import io.apiclient.core.DecodeError;

/**
 * Base exception for JSON serialization and deserialization errors.
 *
 * <p>Deserialization failures carry where in the payload decoding stopped and what was
 * expected there, so they convert losslessly to a {@link DecodeError}.
 */
public class JsonException extends Exception {

    private final DecodeError.Kind kind;
    private final String path;
    private final String expectedType;

    public JsonException(String message) {
        this(message, null);
    }

    public JsonException(String message, Throwable cause) {
        this(DecodeError.Kind.DATA_CORRUPTED, "", null, message, cause);
    }

    public JsonException(DecodeError.Kind kind, String path, String expectedType, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path == null ? "" : path;
        this.expectedType = expectedType;
    }

    public DecodeError.Kind kind() {
        return kind;
    }

    /**
     * Location within the payload, {@code ""} for the root.
     */
    public String path() {
        return path;
    }

    public String expectedType() {
        return expectedType;
    }

    public DecodeError toDecodeError() {
        return new DecodeError(kind, expectedType, path, getMessage(), getCause() != null ? getCause() : this);
    }
}
