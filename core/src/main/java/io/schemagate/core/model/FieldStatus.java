package io.schemagate.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle state of a field. Fields are never physically removed from a
 * version; removal moves them to {@link Deprecated}, recording the version in
 * which that happened.
 */
public sealed interface FieldStatus permits FieldStatus.Active, FieldStatus.Deprecated {

    /** Shared instance for live fields. */
    FieldStatus ACTIVE = new Active();

    static FieldStatus deprecatedSince(SemanticVersion version) {
        return new Deprecated(version);
    }

    default boolean isDeprecated() {
        return this instanceof Deprecated;
    }

    /** The version the field was deprecated in, or empty for active fields. */
    default Optional<SemanticVersion> since() {
        return this instanceof Deprecated d ? Optional.of(d.version()) : Optional.empty();
    }

    /** The field is live and participates in validation. */
    record Active() implements FieldStatus {}

    /** The field is retained for backward compatibility but no longer validated. */
    record Deprecated(SemanticVersion version) implements FieldStatus {
        public Deprecated {
            Objects.requireNonNull(version, "deprecated fields must record the version they were deprecated in");
        }
    }
}
