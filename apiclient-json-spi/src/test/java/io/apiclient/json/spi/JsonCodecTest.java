package io.apiclient.json.spi;

import io.apiclient.core.DecodeError;
import io.apiclient.core.Decoded;
import io.apiclient.core.Parser;
import io.apiclient.core.ValueType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecTest {

    /** Decodes bare JSON integers only. */
    private static final class IntegerCodec implements JsonCodec {
        @Override
        public byte[] writeBytes(Object value) {
            return String.valueOf(value).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
            return readValue(data, ValueType.of(type));
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> T readValue(byte[] data, ValueType<T> type) throws JsonException {
            if (!type.type().equals(Integer.class)) {
                throw new JsonException(DecodeError.Kind.TYPE_MISMATCH, "", type.typeName(), "only integers", null);
            }
            String text = new String(data, StandardCharsets.UTF_8).trim();
            try {
                return (T) Integer.valueOf(text);
            } catch (NumberFormatException e) {
                throw new JsonException("not a number: " + text, e);
            }
        }
    }

    private final JsonCodec codec = new IntegerCodec();

    @Test
    void parserDecodesValue() {
        Parser<Integer> parser = codec.parser(Integer.class);

        assertThat(parser.parse("42".getBytes(StandardCharsets.UTF_8))).isEqualTo(Decoded.success(42));
    }

    @Test
    void readFailureBecomesDecodeFailure() {
        Decoded<Integer> decoded = codec.decode("x".getBytes(StandardCharsets.UTF_8), ValueType.of(Integer.class));

        assertThat(decoded).isInstanceOf(Decoded.Failure.class);
        DecodeError error = ((Decoded.Failure<Integer>) decoded).error();
        assertThat(error.kind()).isEqualTo(DecodeError.Kind.DATA_CORRUPTED);
        assertThat(error.message()).isEqualTo("not a number: x");
        assertThat(error.cause()).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void structuredExceptionKeepsKindPathAndType() {
        Decoded<String> decoded = codec.decode("1".getBytes(StandardCharsets.UTF_8), ValueType.of(String.class));

        DecodeError error = ((Decoded.Failure<String>) decoded).error();
        assertThat(error.kind()).isEqualTo(DecodeError.Kind.TYPE_MISMATCH);
        assertThat(error.expectedType()).isEqualTo("java.lang.String");
        assertThat(error.path()).isEmpty();
        assertThat(error.cause()).isInstanceOf(JsonException.class);
    }

    @Test
    void loadWithoutProviderFails() {
        ClassLoader empty = new ClassLoader(null) {};

        assertThatThrownBy(() -> JsonCodecs.load(empty))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No JsonCodecProvider");
    }
}
