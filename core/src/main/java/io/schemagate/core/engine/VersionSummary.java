package io.schemagate.core.engine;

import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SemanticVersion;
import java.time.Instant;
import java.util.List;

/**
 * One entry of the evolution history.
 *
 * @param version            the version
 * @param description        version description
 * @param createdAt          creation time
 * @param active             active flag
 * @param backwardCompatible compatibility flag
 * @param fieldCount         fields in the version, deprecated included
 * @param migrations         migrations whose target is this version, oldest first
 */
public record VersionSummary(
        SemanticVersion version,
        String description,
        Instant createdAt,
        boolean active,
        boolean backwardCompatible,
        int fieldCount,
        List<Migration> migrations) {

    public VersionSummary {
        migrations = migrations != null ? List.copyOf(migrations) : List.of();
    }
}
