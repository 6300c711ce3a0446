package io.schemagate.core.error;

import java.util.List;

/**
 * Thrown when a store file cannot be read, written, or fails structural
 * validation on load. Carries the file that caused the error and, for
 * structural failures, the individual violations.
 */
public final class SchemaStoreException extends SchemagateException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final List<String> violations;

    public SchemaStoreException(String message, String source) {
        this(message, source, List.of());
    }

    public SchemaStoreException(String message, String source, List<String> violations) {
        super(message);
        this.source = source;
        this.violations = List.copyOf(violations);
    }

    public SchemaStoreException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
        this.violations = List.of();
    }

    /** The file path that caused the error. */
    public String source() {
        return source;
    }

    /** Structural violations found on load; empty for I/O failures. */
    public List<String> violations() {
        return violations;
    }
}
