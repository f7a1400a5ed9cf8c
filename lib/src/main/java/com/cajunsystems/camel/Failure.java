package com.cajunsystems.camel;

import java.util.Objects;

/**
 * Negative reply a consumer actor sends to fail an exchange.
 * The cause becomes the exception of the exchange; callers see it as the cause of the execution error.
 *
 * @param cause the error to report, never null
 */
public record Failure(Throwable cause) {

    public Failure {
        Objects.requireNonNull(cause, "cause");
    }
}
