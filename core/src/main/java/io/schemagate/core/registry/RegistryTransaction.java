package io.schemagate.core.registry;

import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Working copy handed to {@link SchemaRegistry#mutate}. Changes are staged
 * here and become visible, and durable, only when the mutation function
 * returns normally and the store write succeeds.
 *
 * <p>
 * Confined to the thread holding the registry's write lock.
 */
public final class RegistryTransaction {

    private final NavigableMap<SemanticVersion, SchemaVersion> versions;
    private final List<Migration> migrations;
    private boolean dirty;

    RegistryTransaction(NavigableMap<SemanticVersion, SchemaVersion> versions, List<Migration> migrations) {
        this.versions = new TreeMap<>(versions);
        this.migrations = new ArrayList<>(migrations);
    }

    /** Highest active version, or 1.0.0 when none is active. */
    public SchemaVersion current() {
        return SchemaRegistry.currentOf(versions);
    }

    public Optional<SchemaVersion> version(SemanticVersion version) {
        return Optional.ofNullable(versions.get(version));
    }

    /** Highest existing version strictly below {@code version}, if any. */
    public Optional<SchemaVersion> versionBelow(SemanticVersion version) {
        var entry = versions.lowerEntry(version);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    /**
     * Returns {@code target}, creating it as an active clone of {@code base}'s
     * fields if it does not exist yet.
     *
     * @throws IllegalArgumentException if {@code base} does not exist
     */
    public SchemaVersion ensureVersion(SemanticVersion target, SemanticVersion base, String description, Instant at) {
        SchemaVersion existing = versions.get(target);
        if (existing != null) {
            return existing;
        }
        SchemaVersion source = versions.get(base);
        if (source == null) {
            throw new IllegalArgumentException("Base version " + base + " does not exist");
        }
        SchemaVersion created = source.cloneAs(target, description, at);
        put(created);
        return created;
    }

    /** Inserts or replaces a version. */
    public void put(SchemaVersion version) {
        versions.put(version.version(), version);
        dirty = true;
    }

    /**
     * Appends to the log. The staged versions must already show the change,
     * otherwise the entry would be dropped on the next load.
     *
     * @throws IllegalArgumentException if the target version does not reflect {@code migration}
     */
    public void appendMigration(Migration migration) {
        if (!migration.isReflectedIn(versions.get(migration.toVersion()))) {
            throw new IllegalArgumentException("Version " + migration.toVersion() + " does not reflect "
                    + migration.type().wireName() + " of field '" + migration.fieldName() + "'");
        }
        migrations.add(migration);
        dirty = true;
    }

    boolean dirty() {
        return dirty;
    }

    NavigableMap<SemanticVersion, SchemaVersion> versions() {
        return versions;
    }

    List<Migration> migrations() {
        return migrations;
    }
}
