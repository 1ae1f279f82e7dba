package io.apiclient.client;

import io.apiclient.core.CancelableOperation;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cancel handle for a callback-style call. Delivery and cancellation race on one state word,
 * so the callback fires at most once and never after a successful cancel.
 */
final class CallbackOperation implements CancelableOperation {
    private static final int PENDING = 0;
    private static final int DELIVERED = 1;
    private static final int CANCELLED = 2;

    private final AtomicInteger state = new AtomicInteger(PENDING);
    private final Future<?> exchange;

    CallbackOperation(Future<?> exchange) {
        this.exchange = exchange;
    }

    /**
     * Claims the right to deliver; false if cancelled or already delivered.
     */
    boolean claimDelivery() {
        return state.compareAndSet(PENDING, DELIVERED);
    }

    @Override
    public void cancel() {
        if (state.compareAndSet(PENDING, CANCELLED)) {
            exchange.cancel(true);
        }
    }

    @Override
    public boolean isCancelled() {
        return state.get() == CANCELLED;
    }
}
