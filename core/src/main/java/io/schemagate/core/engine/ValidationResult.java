package io.schemagate.core.engine;

import io.schemagate.core.model.SemanticVersion;
import java.util.List;

/**
 * Outcome of validating one record against a schema version.
 *
 * @param valid   true iff {@code errors} is empty
 * @param errors  every violation found, in field order then unknown keys
 * @param version version validated against; null if the requested version does not exist
 */
public record ValidationResult(boolean valid, List<String> errors, SemanticVersion version) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ValidationResult of(List<String> errors, SemanticVersion version) {
        return new ValidationResult(errors.isEmpty(), errors, version);
    }
}
