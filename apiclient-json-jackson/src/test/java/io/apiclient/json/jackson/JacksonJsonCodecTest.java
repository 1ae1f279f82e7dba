package io.apiclient.json.jackson;

import io.apiclient.core.DecodeError;
import io.apiclient.core.Decoded;
import io.apiclient.core.ValueType;
import io.apiclient.json.spi.JsonCodecs;
import io.apiclient.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    record User(int id, String name) {}

    record Team(String title, List<User> members) {}

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static DecodeError failure(Decoded<?> decoded) {
        assertThat(decoded).isInstanceOf(Decoded.Failure.class);
        return ((Decoded.Failure<?>) decoded).error();
    }

    @Test
    void decodesRecord() throws Exception {
        assertThat(codec.readValue(json("{\"id\":1,\"name\":\"a\"}"), User.class)).isEqualTo(new User(1, "a"));
    }

    @Test
    void decodesGenericType() throws Exception {
        List<User> users = codec.readValue(json("[{\"id\":1,\"name\":\"a\"},{\"id\":2,\"name\":\"b\"}]"),
                new ValueType<List<User>>() {});

        assertThat(users).containsExactly(new User(1, "a"), new User(2, "b"));
    }

    @Test
    void unknownPropertiesAreIgnored() {
        Decoded<User> decoded = codec.parser(User.class).parse(json("{\"id\":1,\"name\":\"a\",\"extra\":true}"));

        assertThat(decoded).isEqualTo(Decoded.success(new User(1, "a")));
    }

    @Test
    void malformedJsonIsDataCorrupted() {
        DecodeError error = failure(codec.parser(User.class).parse(json("{\"id\":")));

        assertThat(error.kind()).isEqualTo(DecodeError.Kind.DATA_CORRUPTED);
        assertThat(error.cause()).isNotNull();
    }

    @Test
    void emptyBodyIsDataCorrupted() {
        DecodeError error = failure(codec.parser(User.class).parse(new byte[0]));

        assertThat(error.kind()).isEqualTo(DecodeError.Kind.DATA_CORRUPTED);
    }

    @Test
    void wrongValueTypeReportsPathAndExpectedType() {
        DecodeError error = failure(codec.parser(User.class).parse(json("{\"id\":\"x\",\"name\":\"a\"}")));

        assertThat(error.kind()).isEqualTo(DecodeError.Kind.TYPE_MISMATCH);
        assertThat(error.path()).isEqualTo("/id");
        assertThat(error.expectedType()).isEqualTo("int");
    }

    @Test
    void nestedPathIncludesArrayIndex() {
        byte[] body = json("{\"title\":\"t\",\"members\":[{\"id\":1,\"name\":\"a\"},{\"id\":\"x\",\"name\":\"b\"}]}");

        DecodeError error = failure(codec.parser(Team.class).parse(body));

        assertThat(error.kind()).isEqualTo(DecodeError.Kind.TYPE_MISMATCH);
        assertThat(error.path()).isEqualTo("/members/1/id");
    }

    @Test
    void missingPropertyIsKeyNotFound() {
        DecodeError error = failure(codec.parser(User.class).parse(json("{\"id\":1}")));

        assertThat(error.kind()).isEqualTo(DecodeError.Kind.KEY_NOT_FOUND);
        assertThat(error.path()).endsWith("/name");
    }

    @Test
    void readValueThrowsStructuredException() {
        assertThatThrownBy(() -> codec.readValue(json("{\"id\":\"x\",\"name\":\"a\"}"), User.class))
                .isInstanceOfSatisfying(JsonException.class, e -> {
                    assertThat(e.kind()).isEqualTo(DecodeError.Kind.TYPE_MISMATCH);
                    assertThat(e.path()).isEqualTo("/id");
                });
    }

    @Test
    void writesBytes() throws Exception {
        assertThat(new String(codec.writeBytes(new User(7, "z")), StandardCharsets.UTF_8))
                .isEqualTo("{\"id\":7,\"name\":\"z\"}");
    }

    @Test
    void providerIsDiscovered() {
        assertThat(JsonCodecs.load()).isInstanceOf(JacksonJsonCodec.class);
    }
}
