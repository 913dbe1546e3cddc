package io.github.jakubt4.kaal.service;

import io.github.jakubt4.kaal.error.ErrorKind;
import io.github.jakubt4.kaal.error.KaalException;

import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a facade call: either a value or a typed failure. Callers switch
 * over the two cases instead of catching exceptions.
 *
 * @param <T> type of the successful value
 */
public sealed interface Calculation<T> permits Calculation.Success, Calculation.Failure {

    record Success<T>(T value) implements Calculation<T> {
    }

    /**
     * @param context reproduction details: instant, location, system ...
     */
    record Failure<T>(ErrorKind kind, String message, Map<String, Object> context) implements Calculation<T> {

        static <T> Failure<T> of(final KaalException e) {
            return new Failure<>(e.kind(), e.getMessage(), e.context());
        }
    }

    /**
     * Runs {@code body}, turning a {@link KaalException} into a {@link Failure}.
     * Other exceptions are programming errors and propagate.
     */
    static <T> Calculation<T> of(final Supplier<T> body) {
        try {
            return new Success<>(body.get());
        } catch (final KaalException e) {
            return Failure.of(e);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * The value, or the failure re-raised as an {@link IllegalStateException}.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        final var failure = (Failure<T>) this;
        throw new IllegalStateException(failure.kind() + ": " + failure.message());
    }

    default <R> Calculation<R> map(final Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        final var failure = (Failure<T>) this;
        return new Failure<>(failure.kind(), failure.message(), failure.context());
    }

    default <R> Calculation<R> flatMap(final Function<? super T, Calculation<R>> mapper) {
        if (this instanceof Success<T> success) {
            return mapper.apply(success.value());
        }
        final var failure = (Failure<T>) this;
        return new Failure<>(failure.kind(), failure.message(), failure.context());
    }
}
