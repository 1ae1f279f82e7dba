package io.apiclient.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.function.IntPredicate;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseValidatorTest {

    private static final IntPredicate DEFAULT_RULE = StatusCodes::expected200to300;
    private static final byte[] BODY = "{}".getBytes(StandardCharsets.UTF_8);

    @Test
    void every2xxWithBodyPasses() {
        for (int code = 200; code < 300; code++) {
            Outcome<byte[]> outcome = ResponseValidator.validate(code, BODY, DEFAULT_RULE);
            assertThat(outcome).as("status %d", code).isEqualTo(Outcome.success(BODY));
        }
    }

    @Test
    void everyStatusOutside2xxIsRejectedByDefaultRule() {
        for (int code = 100; code < 600; code++) {
            if (code >= 200 && code < 300) continue;
            Outcome<byte[]> outcome = ResponseValidator.validate(code, BODY, DEFAULT_RULE);
            assertThat(outcome).as("status %d", code).isInstanceOf(Outcome.Failure.class);
            assertThat(((Outcome.Failure<byte[]>) outcome).error()).isEqualTo(new ClientError.StatusRejected(code));
        }
    }

    @Test
    void acceptedStatusesOtherThan204RequireBody() {
        IntPredicate acceptAll = code -> true;
        for (int code = 100; code < 600; code++) {
            Outcome<byte[]> empty = ResponseValidator.validate(code, new byte[0], acceptAll);
            Outcome<byte[]> missing = ResponseValidator.validate(code, null, acceptAll);
            if (code == 204) {
                assertThat(empty.isSuccess()).isTrue();
                assertThat(missing.isSuccess()).isTrue();
            } else {
                assertThat(((Outcome.Failure<byte[]>) empty).error()).isEqualTo(new ClientError.EmptyBodyRejected(code));
                assertThat(((Outcome.Failure<byte[]>) missing).error()).isEqualTo(new ClientError.EmptyBodyRejected(code));
            }
        }
    }

    @Test
    void noContentPassesWhetherOrNotBodyIsPresent() {
        assertThat(ResponseValidator.validate(204, new byte[0], DEFAULT_RULE).isSuccess()).isTrue();
        assertThat(ResponseValidator.validate(204, null, DEFAULT_RULE).isSuccess()).isTrue();
        assertThat(ResponseValidator.validate(204, BODY, DEFAULT_RULE).isSuccess()).isTrue();
    }

    @Test
    void notModifiedIsNotExemptFromBodyCheck() {
        Outcome<byte[]> outcome = ResponseValidator.validate(304, new byte[0], code -> code == 304);

        assertThat(((Outcome.Failure<byte[]>) outcome).error()).isEqualTo(new ClientError.EmptyBodyRejected(304));
    }

    @Test
    void statusCheckRunsBeforeBodyCheck() {
        Outcome<byte[]> outcome = ResponseValidator.validate(500, new byte[0], DEFAULT_RULE);

        assertThat(((Outcome.Failure<byte[]>) outcome).error()).isEqualTo(new ClientError.StatusRejected(500));
    }

    @Test
    void customRuleCanAcceptNon2xx() {
        Outcome<byte[]> outcome = ResponseValidator.validate(404, BODY, code -> code == 404);

        assertThat(outcome.isSuccess()).isTrue();
    }

    @Test
    void rejectionKeepsRawBody() {
        byte[] problem = "{\"error\":\"nope\"}".getBytes(StandardCharsets.UTF_8);

        Outcome<byte[]> outcome = ResponseValidator.validate(422, problem, DEFAULT_RULE);

        assertThat(((Outcome.Failure<byte[]>) outcome).body()).isEqualTo(problem);
    }
}
