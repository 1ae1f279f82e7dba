package io.apiclient.core;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Captures a full generic type for decoders.
 *
 * <p>Use {@link #of(Class)} for plain classes and an anonymous subclass for generic types:
 * <pre>{@code
 * ValueType<List<User>> users = new ValueType<>() {};
 * }</pre>
 *
 * @param <T> the captured type
 */
public abstract class ValueType<T> {

    private final Type type;

    protected ValueType() {
        Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType)) {
            throw new IllegalStateException("ValueType must be created with a type argument");
        }
        this.type = ((ParameterizedType) superclass).getActualTypeArguments()[0];
    }

    private ValueType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> ValueType<T> of(Class<T> type) {
        return new ValueType<T>(type) {};
    }

    public Type type() {
        return type;
    }

    /**
     * Short name used in decode errors, e.g. {@code java.util.List<User>}.
     */
    public String typeName() {
        return type.getTypeName();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValueType<?> other && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return "ValueType[" + type.getTypeName() + "]";
    }
}
