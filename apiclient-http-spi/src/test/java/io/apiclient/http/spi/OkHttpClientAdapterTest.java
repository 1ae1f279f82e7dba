package io.apiclient.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkHttpClientAdapterTest extends HttpClientAdapterContractTest {

    @Override
    protected HttpClientAdapter createAdapter() {
        return OkHttpClientAdapter.create();
    }

    @Test
    void requestTimeoutIsReportedAsTimeout() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        HttpClientRequest request = HttpClientRequest.get(server.url("/slow").uri())
                .timeout(Duration.ofMillis(200))
                .build();

        assertThatThrownBy(() -> adapter.execute(request).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(HttpTimeoutException.class)
                .hasCauseInstanceOf(SocketTimeoutException.class);
    }
}
