package io.apiclient.core;

/**
 * Handle to an in-flight call started with a completion callback.
 *
 * <p>{@link #cancel()} is idempotent. Cancelling before the transport completes suppresses
 * the callback (best effort, depending on the transport); cancelling afterwards is a no-op.
 */
public interface CancelableOperation {

    void cancel();

    boolean isCancelled();

    /**
     * Operation returned when the result was already delivered, e.g. by a stub.
     */
    static CancelableOperation noop() {
        return Noop.INSTANCE;
    }

    final class Noop implements CancelableOperation {
        private static final Noop INSTANCE = new Noop();

        private Noop() {}

        @Override
        public void cancel() {
        }

        @Override
        public boolean isCancelled() {
            return false;
        }
    }
}
