package io.apiclient.client;

/**
 * Completion callback for {@link ApiClient#load(io.apiclient.core.RemoteEndpoint, ApiCallback)}.
 * Exactly one of the two methods is invoked per call, unless the call is cancelled first.
 */
public interface ApiCallback<T, E extends Exception> {

    void onSuccess(T value);

    void onFailure(E error);
}
