package com.filter.core.pipeline;

import com.filter.core.error.FilterException;

import java.util.function.Function;

/**
 * Outcome of a pipeline: either a value or the first failure, tagged with the step that raised it.
 *
 * @param <T> success value type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    record Success<T>(T value) implements Result<T> {
    }

    record Failure<T>(String step, FilterException error) implements Result<T> {
        public Failure {
            if (step == null || step.isBlank()) {
                throw new IllegalArgumentException("step cannot be null or blank");
            }
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }

        /**
         * Re-types this failure; a failure carries no value so the cast is free.
         */
        public <U> Failure<U> retype() {
            return new Failure<>(step, error);
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(String step, FilterException error) {
        return new Failure<>(step, error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return ((Failure<T>) this).retype();
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (this instanceof Success<T> success) {
            return mapper.apply(success.value());
        }
        return ((Failure<T>) this).retype();
    }

    /**
     * @return the success value
     * @throws FilterException the original error of a failure
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw ((Failure<T>) this).error();
    }
}
