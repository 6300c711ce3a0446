package io.schemagate.core.registry;

import io.schemagate.core.error.SchemaStoreException;
import io.schemagate.core.model.CoreFields;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import io.schemagate.core.store.SchemaStore;
import io.schemagate.core.store.StoreSnapshot;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Semver-keyed collection of schema versions plus the append-only migration
 * log, persisted through a {@link SchemaStore}.
 *
 * <p>
 * The "current" version is the highest active one. Version 1.0.0 always
 * exists: when the store holds no 1.0.0, {@link #open} creates it from the
 * core field definitions and persists it.
 *
 * <p>
 * Thread-safe. Reads take the read lock and return immutable values. Writes
 * go through {@link #mutate}, which runs the read-modify-persist sequence
 * under the write lock on a working copy; the in-memory state is replaced
 * only after the store write succeeds, so a failed write leaves memory and
 * disk agreeing.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final SchemaStore store;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private NavigableMap<SemanticVersion, SchemaVersion> versions;
    private List<Migration> migrations;

    private SchemaRegistry(SchemaStore store, Clock clock, StoreSnapshot snapshot) {
        this.store = store;
        this.clock = clock;
        this.versions = new TreeMap<>(snapshot.versions());
        this.migrations = new ArrayList<>(snapshot.migrations());
    }

    /**
     * Loads the registry from {@code store}, bootstrapping 1.0.0 if missing.
     *
     * @throws SchemaStoreException if the store cannot be read or the bootstrap
     *                              version cannot be written
     */
    public static SchemaRegistry open(SchemaStore store, Clock clock) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        SchemaRegistry registry = new SchemaRegistry(store, clock, store.load());
        registry.bootstrapIfNeeded();
        return registry;
    }

    private void bootstrapIfNeeded() {
        SchemaVersion initial = versions.get(SemanticVersion.INITIAL);
        if (initial == null) {
            mutate(tx -> {
                tx.put(SchemaVersion.bootstrap(clock.instant()));
                return null;
            });
            LOG.info(
                    "Bootstrapped schema version {} with {} core fields",
                    SemanticVersion.INITIAL,
                    CoreFields.names().size());
            return;
        }
        for (String core : CoreFields.names()) {
            if (!initial.hasField(core)) {
                LOG.warn("Stored version {} is missing core field '{}'", SemanticVersion.INITIAL, core);
            }
        }
    }

    public Clock clock() {
        return clock;
    }

    public SchemaStore store() {
        return store;
    }

    /** Highest active version, or 1.0.0 when no version is active. */
    public SchemaVersion getCurrent() {
        lock.readLock().lock();
        try {
            return currentOf(versions);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<SchemaVersion> getVersion(SemanticVersion version) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(versions.get(version));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** All versions in ascending semver order. */
    public List<SchemaVersion> versions() {
        lock.readLock().lock();
        try {
            return List.copyOf(versions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** The migration log, oldest first. */
    public List<Migration> migrations() {
        lock.readLock().lock();
        try {
            return List.copyOf(migrations);
        } finally {
            lock.readLock().unlock();
        }
    }

    public static SemanticVersion incrementVersion(SemanticVersion version, SemanticVersion.Bump kind) {
        return version.bump(kind);
    }

    /**
     * Returns {@code target}, creating it as an active clone of {@code base} if
     * it does not exist. Creation is persisted.
     *
     * @throws IllegalArgumentException if {@code target} is new and {@code base} does not exist
     */
    public SchemaVersion ensureVersion(SemanticVersion target, SemanticVersion base) {
        return mutate(tx -> tx.ensureVersion(target, base, "Derived from " + base, clock.instant()));
    }

    /**
     * Appends one entry to the migration log and persists.
     *
     * @throws IllegalArgumentException if the stored target version does not
     *                                  show the change, see {@link Migration#isReflectedIn}
     */
    public void appendMigration(Migration migration) {
        Objects.requireNonNull(migration, "migration must not be null");
        mutate(tx -> {
            tx.appendMigration(migration);
            return null;
        });
    }

    /**
     * Runs {@code action} against a working copy under the write lock. If the
     * action staged any change, both store files are rewritten and the copy
     * becomes the registry state. If the action throws, or the write fails,
     * nothing changes.
     *
     * @param action mutation; its result is returned to the caller
     * @throws SchemaStoreException if persisting fails
     */
    public <T> T mutate(Function<RegistryTransaction, T> action) {
        lock.writeLock().lock();
        try {
            RegistryTransaction tx = new RegistryTransaction(versions, migrations);
            T result = action.apply(tx);
            if (tx.dirty()) {
                store.save(tx.versions().values(), tx.migrations());
                versions = tx.versions();
                migrations = tx.migrations();
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    static SchemaVersion currentOf(NavigableMap<SemanticVersion, SchemaVersion> versions) {
        for (SchemaVersion candidate : versions.descendingMap().values()) {
            if (candidate.active()) {
                return candidate;
            }
        }
        SchemaVersion initial = versions.get(SemanticVersion.INITIAL);
        if (initial == null) {
            throw new IllegalStateException("Registry holds no version " + SemanticVersion.INITIAL);
        }
        return initial;
    }
}
