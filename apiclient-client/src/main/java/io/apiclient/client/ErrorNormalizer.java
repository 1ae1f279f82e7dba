package io.apiclient.client;

import io.apiclient.core.Outcome;

import java.util.Objects;

/**
 * Applies the caller's {@link ErrorMapper} to a failed {@link Outcome}.
 */
final class ErrorNormalizer<E extends Exception> {

    private final ErrorMapper<E> errorMapper;

    ErrorNormalizer(ErrorMapper<E> errorMapper) {
        this.errorMapper = Objects.requireNonNull(errorMapper, "errorMapper");
    }

    <T> Result<T, E> normalize(Outcome<T> outcome) {
        if (outcome instanceof Outcome.Success<T> s) {
            return Result.success(s.value());
        }
        Outcome.Failure<T> f = (Outcome.Failure<T>) outcome;
        E error = errorMapper.map(f.error(), f.body());
        return Result.failure(Objects.requireNonNull(error, "errorMapper returned null"));
    }
}
