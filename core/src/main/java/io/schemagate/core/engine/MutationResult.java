package io.schemagate.core.engine;

import io.schemagate.core.model.SemanticVersion;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a field mutation. An applied result names the version that was
 * written; a rejected one explains why nothing changed.
 *
 * @param applied     whether the mutation was persisted
 * @param baseVersion version the mutation was based on; null when rejected
 * @param version     version the mutation was written to; null when rejected
 * @param reason      rejection reason; null when applied
 */
public record MutationResult(boolean applied, SemanticVersion baseVersion, SemanticVersion version, String reason) {

    public static MutationResult applied(SemanticVersion baseVersion, SemanticVersion version) {
        return new MutationResult(
                true,
                Objects.requireNonNull(baseVersion, "baseVersion must not be null"),
                Objects.requireNonNull(version, "version must not be null"),
                null);
    }

    public static MutationResult rejected(String reason) {
        return new MutationResult(false, null, null, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public Optional<SemanticVersion> appliedVersion() {
        return Optional.ofNullable(version);
    }
}
