package io.schemagate.core.store;

import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What {@link SchemaStore#load()} found on disk: every version keyed and
 * ordered by semver, plus the migration log in append order.
 *
 * @param versions   versions in ascending semver order
 * @param migrations migration log, oldest first
 */
public record StoreSnapshot(Map<SemanticVersion, SchemaVersion> versions, List<Migration> migrations) {

    public StoreSnapshot {
        versions = Collections.unmodifiableMap(new TreeMap<>(versions != null ? versions : Map.of()));
        migrations = migrations != null ? List.copyOf(migrations) : List.of();
    }

    public static StoreSnapshot empty() {
        return new StoreSnapshot(Map.of(), List.of());
    }

    public boolean isEmpty() {
        return versions.isEmpty();
    }
}
