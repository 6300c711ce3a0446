package io.schemagate.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.error.SchemaStoreException;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable home of the version snapshot ({@code schemas.json}) and the
 * migration log ({@code migrations.json}) inside one storage directory.
 *
 * <p>
 * Each save rewrites both files in full, migration log first, each through a
 * temporary file and an atomic rename. A crash between the two renames leaves
 * migrations that point at a version the snapshot does not know; {@link #load()}
 * drops those with a warning, so the log never references a missing version.
 *
 * <p>
 * Not synchronized: the registry calls {@link #save} under its write lock.
 */
public final class SchemaStore {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaStore.class);

    public static final String SCHEMAS_FILE = "schemas.json";
    public static final String MIGRATIONS_FILE = "migrations.json";

    private final Path directory;
    private final SchemaJsonCodec codec;
    private final StoreFileValidator schemasValidator;
    private final StoreFileValidator migrationsValidator;

    public SchemaStore(Path directory, SchemaJsonCodec codec) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.schemasValidator = StoreFileValidator.forResource(StoreFileValidator.SCHEMAS_FILE_SCHEMA);
        this.migrationsValidator = StoreFileValidator.forResource(StoreFileValidator.MIGRATIONS_FILE_SCHEMA);
    }

    public Path directory() {
        return directory;
    }

    public Path schemasFile() {
        return directory.resolve(SCHEMAS_FILE);
    }

    public Path migrationsFile() {
        return directory.resolve(MIGRATIONS_FILE);
    }

    /**
     * Reads both files. Missing files count as empty.
     *
     * @return the stored versions and migrations
     * @throws SchemaStoreException if a file is unreadable, violates its JSON
     *                              Schema, or holds values the model rejects
     */
    public StoreSnapshot load() {
        Map<SemanticVersion, SchemaVersion> versions = loadVersions();
        List<Migration> migrations = new ArrayList<>();
        for (Migration migration : loadMigrations()) {
            if (reflectedIn(migration, versions)) {
                migrations.add(migration);
            } else {
                LOG.warn(
                        "Dropping {} migration of field '{}' to {}: snapshot does not reflect it",
                        migration.type().wireName(),
                        migration.fieldName(),
                        migration.toVersion());
            }
        }
        LOG.info(
                "Loaded schema store from {}: versions={}, migrations={}",
                directory,
                versions.size(),
                migrations.size());
        return new StoreSnapshot(versions, migrations);
    }

    /**
     * Persists the full version set and migration log.
     *
     * @throws SchemaStoreException if either file cannot be written
     */
    public void save(Collection<SchemaVersion> versions, List<Migration> migrations) {
        ObjectNode migrationsDoc = codec.mapper().createObjectNode();
        ArrayNode log = migrationsDoc.putArray("migrations");
        migrations.forEach(m -> log.add(codec.migrationToJson(m)));

        ObjectNode schemasDoc = codec.mapper().createObjectNode();
        ObjectNode byVersion = schemasDoc.putObject("schemas");
        versions.stream()
                .sorted((a, b) -> a.version().compareTo(b.version()))
                .forEach(v -> byVersion.set(v.version().toString(), codec.versionToJson(v)));

        StoreFiles.writeAtomically(codec.mapper(), migrationsFile(), migrationsDoc);
        StoreFiles.writeAtomically(codec.mapper(), schemasFile(), schemasDoc);
    }

    private Map<SemanticVersion, SchemaVersion> loadVersions() {
        Path file = schemasFile();
        Optional<JsonNode> doc = StoreFiles.readIfPresent(codec.mapper(), file);
        Map<SemanticVersion, SchemaVersion> versions = new LinkedHashMap<>();
        if (doc.isEmpty()) {
            return versions;
        }
        schemasValidator.check(doc.get(), file.toString());
        Iterator<Map.Entry<String, JsonNode>> it = doc.get().get("schemas").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            SchemaVersion version = decode(file, () -> codec.versionFromJson(entry.getValue()));
            if (!version.version().toString().equals(entry.getKey())) {
                throw new SchemaStoreException(
                        "Version key '" + entry.getKey() + "' does not match its version '" + version.version() + "'",
                        file.toString());
            }
            versions.put(version.version(), version);
        }
        return versions;
    }

    private List<Migration> loadMigrations() {
        Path file = migrationsFile();
        Optional<JsonNode> doc = StoreFiles.readIfPresent(codec.mapper(), file);
        List<Migration> migrations = new ArrayList<>();
        if (doc.isEmpty()) {
            return migrations;
        }
        migrationsValidator.check(doc.get(), file.toString());
        for (JsonNode node : doc.get().get("migrations")) {
            migrations.add(decode(file, () -> codec.migrationFromJson(node)));
        }
        return migrations;
    }

    /**
     * The log is written before the snapshot, so a crash between the two
     * writes leaves entries the snapshot never received.
     */
    private static boolean reflectedIn(Migration migration, Map<SemanticVersion, SchemaVersion> versions) {
        return migration.isReflectedIn(versions.get(migration.toVersion()));
    }

    static <T> T decode(Path file, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (IllegalArgumentException | NullPointerException | DateTimeException e) {
            throw new SchemaStoreException("Invalid content in " + file + ": " + e.getMessage(), e, file.toString());
        }
    }
}
