package io.apiclient.core;

import java.util.Objects;

/**
 * Anything that renders to a request path relative to a client's base URL.
 */
@FunctionalInterface
public interface PathConvertible {

    String path();

    static PathConvertible of(String path) {
        Objects.requireNonNull(path, "path");
        return () -> path;
    }
}
