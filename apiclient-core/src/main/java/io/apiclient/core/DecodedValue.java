package io.apiclient.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Parse result of an {@link AnyEndpoint}: success with a value whose type is not exposed, or
 * a {@link DecodeError}.
 *
 * <p>The decoded value is intentionally not reachable from this type. Code holding an
 * {@code AnyEndpoint} selects stub behavior by endpoint shape, never by result type.
 */
public final class DecodedValue {

    private final boolean success;
    // held for equality only; arrays compare by content
    private final Object value;
    private final DecodeError error;

    private DecodedValue(boolean success, Object value, DecodeError error) {
        this.success = success;
        this.value = value;
        this.error = error;
    }

    static DecodedValue of(Decoded<?> decoded) {
        Objects.requireNonNull(decoded, "decoded");
        if (decoded instanceof Decoded.Failure<?> f) {
            return new DecodedValue(false, null, f.error());
        }
        return new DecodedValue(true, ((Decoded.Success<?>) decoded).value(), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<DecodeError> failure() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedValue)) return false;
        DecodedValue other = (DecodedValue) o;
        return success == other.success
                && Objects.deepEquals(value, other.value)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, Arrays.deepHashCode(new Object[] {value}), error);
    }

    @Override
    public String toString() {
        return success ? "DecodedValue[success]" : "DecodedValue[" + error.describe() + "]";
    }
}
