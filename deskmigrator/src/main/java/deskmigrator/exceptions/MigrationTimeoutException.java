package deskmigrator.exceptions;

import java.time.Duration;

/**
 * Exception thrown when an adapter call exceeds its configured timeout.
 *
 * <p>Unchecked so that timeout protection wraps adapter calls without changing
 * their signatures. The component migrator converts it to an
 * {@link AdapterException}.
 *
 * @see deskmigrator.engine.TimeoutExecutor
 */
public class MigrationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     */
    public MigrationTimeoutException(String operation, Duration timeout) {
        super(formatMessage(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Creates a new timeout exception with a cause.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     * @param cause the underlying cause (typically TimeoutException or InterruptedException)
     */
    public MigrationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /** Returns the name of the operation that timed out, e.g. {@code fetch(macros)}. */
    public String getOperation() {
        return operation;
    }

    /** Returns the configured timeout that was exceeded. */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis());
    }
}
