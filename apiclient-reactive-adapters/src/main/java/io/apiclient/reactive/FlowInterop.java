package io.apiclient.reactive;

import org.reactivestreams.FlowAdapters;
import org.reactivestreams.Publisher;

import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Bridges the client's {@link Flow.Publisher}s to Reactive Streams, the type Reactor and
 * RxJava accept. Signals, demand and cancellation pass through unchanged, so a call still
 * runs once per subscription.
 */
public final class FlowInterop {
    private FlowInterop() {}

    public static <T> Publisher<T> toReactiveStreams(Flow.Publisher<T> publisher) {
        return FlowAdapters.toPublisher(Objects.requireNonNull(publisher, "publisher"));
    }

    /**
     * Inverse of {@link #toReactiveStreams}; unwraps instead of double-wrapping.
     */
    public static <T> Flow.Publisher<T> toFlow(Publisher<T> publisher) {
        return FlowAdapters.toFlowPublisher(Objects.requireNonNull(publisher, "publisher"));
    }
}
