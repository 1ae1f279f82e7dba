package io.apiclient.client;

import java.util.Map;
import java.util.Optional;

/**
 * The client's mutable state as read once at the start of a call.
 */
record CallSnapshot<E extends Exception>(Map<String, String> headers, StubBehavior<E> stubBehavior) {

    Optional<StubBehavior<E>> stub() {
        return Optional.ofNullable(stubBehavior);
    }
}
