package io.apiclient.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HttpMethodTest {

    @Test
    void onlyPostPutPatchCarryBodies() {
        byte[] body = "x".getBytes(StandardCharsets.UTF_8);

        assertThat(HttpMethod.post(body).body()).hasValueSatisfying(b -> assertThat(b).isEqualTo(body));
        assertThat(HttpMethod.put(body).body()).isPresent();
        assertThat(HttpMethod.patch(body).body()).isPresent();
        assertThat(HttpMethod.post().body()).isEmpty();
        assertThat(HttpMethod.GET.body()).isEmpty();
        assertThat(HttpMethod.DELETE.body()).isEmpty();
    }

    @Test
    void wireNames() {
        assertThat(HttpMethod.OPTIONS.name()).isEqualTo("OPTIONS");
        assertThat(HttpMethod.HEAD.name()).isEqualTo("HEAD");
        assertThat(HttpMethod.TRACE.name()).isEqualTo("TRACE");
        assertThat(HttpMethod.CONNECT.name()).isEqualTo("CONNECT");
        assertThat(HttpMethod.patch().name()).isEqualTo("PATCH");
    }

    @Test
    void equalityComparesBodyContent() {
        assertThat(HttpMethod.post("a".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(HttpMethod.post("a".getBytes(StandardCharsets.UTF_8)))
                .isNotEqualTo(HttpMethod.post("b".getBytes(StandardCharsets.UTF_8)))
                .isNotEqualTo(HttpMethod.put("a".getBytes(StandardCharsets.UTF_8)));
    }
}
