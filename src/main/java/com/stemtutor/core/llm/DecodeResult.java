package com.stemtutor.core.llm;

import java.util.Optional;

/**
 * Outcome of a lenient decode: either a value or the reason decoding failed.
 */
public interface DecodeResult<T> {

    record Success<T>(T value) implements DecodeResult<T> {}

    record Failure<T>(String reason, Throwable cause) implements DecodeResult<T> {}

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    default Optional<T> asOptional() {
        return this instanceof Success<T> s ? Optional.ofNullable(s.value()) : Optional.empty();
    }

    /**
     * Returns the decoded value or throws {@link LlmParseException} with the failure reason.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        var failure = (Failure<T>) this;
        throw new LlmParseException(failure.reason(), failure.cause());
    }
}
