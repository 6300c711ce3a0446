package io.schemagate.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemagate.core.error.SchemaStoreException;
import io.schemagate.core.model.CoreFields;
import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SchemaField;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import io.schemagate.core.store.SchemaJsonCodec;
import io.schemagate.core.store.SchemaStore;
import io.schemagate.core.store.StoreSnapshot;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SchemaRegistry")
class SchemaRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
    private static final SemanticVersion V110 = SemanticVersion.parse("1.1.0");

    @TempDir
    Path dir;

    private SchemaStore store;

    @BeforeEach
    void setUp() {
        store = new SchemaStore(dir, new SchemaJsonCodec(new ObjectMapper()));
    }

    @Test
    @DisplayName("Opening an empty directory bootstraps 1.0.0 with the core fields and writes it")
    void bootstrapsInitialVersion() {
        SchemaRegistry registry = SchemaRegistry.open(store, CLOCK);

        SchemaVersion current = registry.getCurrent();
        assertThat(current.version()).isEqualTo(SemanticVersion.INITIAL);
        assertThat(current.fields().keySet()).containsExactlyInAnyOrderElementsOf(CoreFields.names());
        assertThat(current.fields().values()).allMatch(SchemaField::core).allMatch(SchemaField::required);
        assertThat(Files.exists(store.schemasFile())).isTrue();
    }

    @Test
    void ensureVersionClonesBaseAndPersists() {
        SchemaRegistry registry = SchemaRegistry.open(store, CLOCK);

        SchemaVersion created = registry.ensureVersion(V110, SemanticVersion.INITIAL);

        assertThat(created.active()).isTrue();
        assertThat(created.fields()).isEqualTo(registry.getVersion(SemanticVersion.INITIAL).orElseThrow().fields());
        assertThat(registry.getCurrent().version()).isEqualTo(V110);
        assertThat(SchemaRegistry.open(store, CLOCK).getVersion(V110)).isPresent();
    }

    @Test
    void ensureVersionReturnsExistingTargetUnchanged() {
        SchemaRegistry registry = SchemaRegistry.open(store, CLOCK);
        SchemaVersion first = registry.ensureVersion(V110, SemanticVersion.INITIAL);
        assertThat(registry.ensureVersion(V110, SemanticVersion.INITIAL)).isSameAs(first);
    }

    @Test
    void ensureVersionRejectsUnknownBase() {
        SchemaRegistry registry = SchemaRegistry.open(store, CLOCK);
        assertThatThrownBy(() -> registry.ensureVersion(V110, SemanticVersion.parse("0.9.0")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Current is the highest active version")
    void currentSkipsInactiveVersions() {
        SchemaRegistry registry = SchemaRegistry.open(store, CLOCK);
        registry.mutate(tx -> {
            tx.put(tx.current().cloneAs(V110, "inactive", CLOCK.instant()).withActive(false));
            return null;
        });
        assertThat(registry.getCurrent().version()).isEqualTo(SemanticVersion.INITIAL);
        assertThat(registry.versions()).extracting(SchemaVersion::version)
                .containsExactly(SemanticVersion.INITIAL, V110);
    }

    @Test
    void appendMigrationPersistsTheLog() {
        SchemaRegistry registry = SchemaRegistry.open(store, CLOCK);
        SchemaField x = SchemaField.of("x", FieldType.STRING, "", null).withAddedInVersion(V110);
        registry.mutate(tx -> {
            tx.put(tx.current().cloneAs(V110, "with x", CLOCK.instant()).withField(x));
            return null;
        });
        Migration m = new Migration(
                SemanticVersion.INITIAL, V110, Migration.Type.ADD_FIELD, "x", null, null, CLOCK.instant());

        registry.appendMigration(m);

        assertThat(registry.migrations()).containsExactly(m);
        assertThat(SchemaRegistry.open(store, CLOCK).migrations()).containsExactly(m);
    }

    @Test
    @DisplayName("A migration the stored version does not show is refused and nothing is written")
    void appendMigrationRefusesUnreflectedEntries() {
        SchemaRegistry registry = SchemaRegistry.open(store, CLOCK);
        registry.ensureVersion(V110, SemanticVersion.INITIAL);
        Migration addMissing = new Migration(
                SemanticVersion.INITIAL, V110, Migration.Type.ADD_FIELD, "x", null, null, CLOCK.instant());
        Migration removeLive = new Migration(
                SemanticVersion.INITIAL, V110, Migration.Type.REMOVE_FIELD, "title", null, null, CLOCK.instant());
        Migration unknownTarget = new Migration(
                V110, SemanticVersion.parse("1.2.0"), Migration.Type.ADD_FIELD, "x", null, null, CLOCK.instant());

        assertThatThrownBy(() -> registry.appendMigration(addMissing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not reflect add_field of field 'x'");
        assertThatThrownBy(() -> registry.appendMigration(removeLive)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.appendMigration(unknownTarget)).isInstanceOf(IllegalArgumentException.class);

        assertThat(registry.migrations()).isEmpty();
        assertThat(SchemaRegistry.open(store, CLOCK).migrations()).isEmpty();
    }

    @Test
    @DisplayName("A failed save leaves the in-memory state untouched")
    void failedSaveKeepsPreviousState() {
        SchemaStore failing = mock(SchemaStore.class);
        when(failing.load()).thenReturn(StoreSnapshot.empty());
        SchemaRegistry registry = SchemaRegistry.open(failing, CLOCK);
        doThrow(new SchemaStoreException("disk full", "schemas.json"))
                .when(failing)
                .save(any(), anyList());

        assertThatThrownBy(() -> registry.ensureVersion(V110, SemanticVersion.INITIAL))
                .isInstanceOf(SchemaStoreException.class);

        assertThat(registry.getVersion(V110)).isEmpty();
        assertThat(registry.getCurrent().version()).isEqualTo(SemanticVersion.INITIAL);
    }

    @Test
    void readOnlyTransactionDoesNotWrite() {
        SchemaStore spyStore = mock(SchemaStore.class);
        when(spyStore.load()).thenReturn(new StoreSnapshot(
                Map.of(SemanticVersion.INITIAL, SchemaVersion.bootstrap(CLOCK.instant())),
                List.of()));
        SchemaRegistry registry = SchemaRegistry.open(spyStore, CLOCK);

        FieldType type = registry.mutate(tx -> tx.current().field("title").orElseThrow().type());

        assertThat(type).isEqualTo(FieldType.STRING);
        verify(spyStore, never()).save(any(), anyList());
    }
}
