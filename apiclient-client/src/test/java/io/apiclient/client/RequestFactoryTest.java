package io.apiclient.client;

import io.apiclient.core.HttpMethod;
import io.apiclient.core.MalformedRequestException;
import io.apiclient.core.Parser;
import io.apiclient.core.RemoteEndpoint;
import io.apiclient.http.spi.HttpClientRequest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestFactoryTest {

    @Test
    void joinsBaseUrlPathAndQuery() {
        RemoteEndpoint<String> endpoint = RemoteEndpoint.builder("/search", Parser.utf8())
                .parameter("q", "a b")
                .parameter("page", "2")
                .build();

        HttpClientRequest request = RequestFactory.create("https://api.example.com/v1", endpoint, null);

        assertThat(request.uri().toString()).isEqualTo("https://api.example.com/v1/search?page=2&q=a%20b");
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.body()).isNull();
        assertThat(request.timeout()).isNull();
    }

    @Test
    void carriesMethodBodyHeadersAndTimeout() {
        RemoteEndpoint<String> endpoint = RemoteEndpoint.builder("/users/1", Parser.utf8())
                .method(HttpMethod.put(new byte[] {1, 2}))
                .header("If-Match", "v1")
                .build();

        HttpClientRequest request = RequestFactory.create("https://api.example.com", endpoint, Duration.ofSeconds(3));

        assertThat(request.method()).isEqualTo("PUT");
        assertThat(request.body()).containsExactly(1, 2);
        assertThat(request.headers()).containsEntry("If-Match", "v1");
        assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void bodylessPostSendsNoBody() {
        RemoteEndpoint<String> endpoint = RemoteEndpoint.builder("/jobs", Parser.utf8()).method(HttpMethod.post()).build();

        assertThat(RequestFactory.create("https://api.example.com", endpoint, null).body()).isNull();
    }

    @Test
    void relativeUrlIsMalformed() {
        RemoteEndpoint<String> endpoint = RemoteEndpoint.get("/users", Parser.utf8());

        assertThatThrownBy(() -> RequestFactory.create("api.example.com", endpoint, null))
                .isInstanceOf(MalformedRequestException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }
}
