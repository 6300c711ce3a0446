package io.schemagate.core.error;

/**
 * Abstract base for schemagate infrastructure failures. Invalid data and
 * refused state changes are never reported this way: they come back as error
 * lists or {@code false} results. This hierarchy covers faults the caller could
 * not have prevented, such as an unreadable store file.
 */
public abstract class SchemagateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected SchemagateException(String message) {
        super(message);
    }

    protected SchemagateException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
