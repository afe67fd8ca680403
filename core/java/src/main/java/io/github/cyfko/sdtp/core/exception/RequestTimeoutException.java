package io.github.cyfko.sdtp.core.exception;

import java.time.Duration;

/**
 * Thrown by the dispatcher when row retrieval did not finish within the request budget.
 * The in-flight work is cancelled before this exception is raised.
 *
 * @since 1.0.0
 */
public class RequestTimeoutException extends SdtpException {

    private final Duration budget;

    public RequestTimeoutException(String tableName, Duration budget) {
        super(ErrorKind.TIMEOUT,
                String.format("Request on table '%s' exceeded its budget of %d ms", tableName, budget.toMillis()),
                null);
        this.budget = budget;
    }

    public Duration budget() {
        return budget;
    }
}
