package io.schemagate.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemagate.core.model.CoreFields;
import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.FieldValidation;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SchemaField;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import io.schemagate.core.registry.SchemaRegistry;
import io.schemagate.core.spi.GovernanceListener;
import io.schemagate.core.store.SchemaJsonCodec;
import io.schemagate.core.store.SchemaStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SchemaEvolutionEngine")
class SchemaEvolutionEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
    private static final SemanticVersion V101 = SemanticVersion.parse("1.0.1");
    private static final SemanticVersion V110 = SemanticVersion.parse("1.1.0");
    private static final SemanticVersion V120 = SemanticVersion.parse("1.2.0");
    private static final SemanticVersion V200 = SemanticVersion.parse("2.0.0");

    @TempDir
    Path dir;

    private SchemaStore store;
    private SchemaEvolutionEngine engine;

    @BeforeEach
    void setUp() {
        store = new SchemaStore(dir, new SchemaJsonCodec(new ObjectMapper()));
        engine = new SchemaEvolutionEngine(SchemaRegistry.open(store, CLOCK));
    }

    private static SchemaField optionalString(String name) {
        return SchemaField.of(name, FieldType.STRING, name, FieldValidation.optional());
    }

    private static Map<String, Object> compliantRecord() {
        Map<String, Object> record = new HashMap<>();
        record.put("content_id", "x");
        record.put("title", "t");
        record.put("content_type", "experience");
        record.put("created_at", "2024-01-15T10:30:00");
        record.put("updated_at", "2024-01-15T10:30:00Z");
        return record;
    }

    @Nested
    @DisplayName("addField")
    class AddField {

        @Test
        @DisplayName("Default target is current with minor bumped")
        void bumpsMinor() {
            assertThat(engine.addField(optionalString("priority"))).isTrue();

            SchemaVersion current = engine.currentSchema();
            assertThat(current.version()).isEqualTo(V110);
            assertThat(current.field("priority")).get()
                    .extracting(SchemaField::addedInVersion)
                    .isEqualTo(V110);
            assertThat(current.backwardCompatible()).isTrue();
        }

        @Test
        void recordsMigrationWithScripts() {
            engine.addField(optionalString("priority"));

            assertThat(engine.registry().migrations()).singleElement().satisfies(m -> {
                assertThat(m.fromVersion()).isEqualTo(SemanticVersion.INITIAL);
                assertThat(m.toVersion()).isEqualTo(V110);
                assertThat(m.type()).isEqualTo(Migration.Type.ADD_FIELD);
                assertThat(m.migrationScript()).isEqualTo("ADD FIELD priority string");
                assertThat(m.rollbackScript()).isEqualTo("DROP FIELD priority");
            });
        }

        @Test
        void requiredFieldBreaksCompatibility() {
            SchemaField tag = SchemaField.of("tag", FieldType.LIST, "", FieldValidation.requiredOnly());
            assertThat(engine.addField(tag)).isTrue();
            assertThat(engine.currentSchema().backwardCompatible()).isFalse();
        }

        @Test
        @DisplayName("A minor component at its maximum refuses the default bump")
        void refusesBumpPastMaximum() {
            SemanticVersion top = new SemanticVersion(1, Integer.MAX_VALUE, 0);
            assertThat(engine.applyAdd(optionalString("priority"), top).applied()).isTrue();

            MutationResult next = engine.applyAdd(optionalString("mood"), null);

            assertThat(next.applied()).isFalse();
            assertThat(next.reason()).isEqualTo("Version " + top + " has no minor successor");
            assertThat(engine.currentSchema().version()).isEqualTo(top);
            assertThat(engine.registry().migrations()).hasSize(1);
        }

        @Test
        void refusesDuplicateName() {
            engine.addField(optionalString("priority"));
            MutationResult again = engine.applyAdd(optionalString("priority"), null);

            assertThat(again.applied()).isFalse();
            assertThat(again.reason()).contains("already exists");
            assertThat(engine.currentSchema().version()).isEqualTo(V110);
        }

        @Test
        @DisplayName("Earlier versions are never modified")
        void leavesBaseUntouched() {
            SchemaVersion before = engine.registry().getVersion(SemanticVersion.INITIAL).orElseThrow();
            engine.addField(optionalString("priority"));
            assertThat(engine.registry().getVersion(SemanticVersion.INITIAL)).contains(before);
        }
    }

    @Nested
    @DisplayName("Explicit targets")
    class ExplicitTargets {

        @Test
        void newTargetMustBeGreaterThanCurrent() {
            engine.addField(optionalString("a"));
            MutationResult result = engine.applyAdd(optionalString("b"), V101);

            assertThat(result.applied()).isFalse();
            assertThat(result.reason()).contains("must be greater than current version 1.1.0");
        }

        @Test
        void initialVersionIsImmutable() {
            MutationResult result = engine.applyAdd(optionalString("b"), SemanticVersion.INITIAL);
            assertThat(result.applied()).isFalse();
        }

        @Test
        @DisplayName("A new explicit target above current becomes the current version")
        void jumpsToExplicitTarget() {
            assertThat(engine.addField(optionalString("a"), V200)).isTrue();

            assertThat(engine.currentSchema().version()).isEqualTo(V200);
            assertThat(engine.registry().migrations().get(0).fromVersion()).isEqualTo(SemanticVersion.INITIAL);
        }

        @Test
        @DisplayName("An existing target is edited in place, based on the version below it")
        void editsExistingTarget() {
            engine.addField(optionalString("a"));
            engine.addField(optionalString("b"), V110);

            assertThat(engine.registry().versions()).extracting(SchemaVersion::version)
                    .containsExactly(SemanticVersion.INITIAL, V110);
            assertThat(engine.currentSchema().fields()).containsKeys("a", "b");
            assertThat(engine.registry().migrations())
                    .extracting(Migration::fromVersion)
                    .containsOnly(SemanticVersion.INITIAL);
        }
    }

    @Nested
    @DisplayName("removeField")
    class RemoveField {

        @Test
        @DisplayName("Removal deprecates and keeps the field")
        void softDeletes() {
            engine.addField(optionalString("priority"));
            assertThat(engine.removeField("priority")).isTrue();

            SchemaField field = engine.currentSchema().field("priority").orElseThrow();
            assertThat(engine.currentSchema().version()).isEqualTo(V120);
            assertThat(field.deprecated()).isTrue();
            assertThat(field.status().since()).contains(V120);
        }

        @Test
        void coreFieldsAreNeverRemoved() {
            for (String core : CoreFields.names()) {
                int before = engine.currentSchema().fields().size();
                assertThat(engine.removeField(core)).as(core).isFalse();
                assertThat(engine.currentSchema().fields()).hasSize(before);
                assertThat(engine.currentSchema().field(core).orElseThrow().deprecated()).isFalse();
            }
            assertThat(engine.registry().versions()).hasSize(1);
        }

        @Test
        void refusesUnknownOrDeprecatedFields() {
            assertThat(engine.removeField("nope")).isFalse();
            engine.addField(optionalString("priority"));
            engine.removeField("priority");
            assertThat(engine.applyRemove("priority", null).reason()).contains("already deprecated");
        }
    }

    @Nested
    @DisplayName("modifyField")
    class ModifyField {

        @Test
        void bumpsPatchAndKeepsIdentity() {
            engine.addField(optionalString("priority"));
            SchemaField redefined = SchemaField.of("priority", FieldType.STRING, "Urgency", FieldValidation.optional());

            assertThat(engine.modifyField("priority", redefined)).isTrue();

            SchemaVersion current = engine.currentSchema();
            assertThat(current.version()).hasToString("1.1.1");
            SchemaField field = current.field("priority").orElseThrow();
            assertThat(field.description()).isEqualTo("Urgency");
            assertThat(field.addedInVersion()).isEqualTo(V110);
            assertThat(current.backwardCompatible()).isTrue();
            assertThat(engine.registry().migrations().get(1).rollbackScript())
                    .isEqualTo("REVERT FIELD priority TO string");
        }

        @Test
        void typeChangeBreaksCompatibility() {
            engine.addField(optionalString("score"));
            engine.modifyField("score", SchemaField.of("score", FieldType.INTEGER, "", FieldValidation.optional()));
            assertThat(engine.currentSchema().backwardCompatible()).isFalse();
        }

        @Test
        void makingRequiredBreaksCompatibility() {
            engine.addField(optionalString("score"));
            engine.modifyField("score", SchemaField.of("score", FieldType.STRING, "", FieldValidation.requiredOnly()));
            assertThat(engine.currentSchema().backwardCompatible()).isFalse();
        }

        @Test
        void refusesUnknownField() {
            assertThat(engine.modifyField("ghost", optionalString("ghost"))).isFalse();
            assertThat(engine.registry().versions()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Every successful mutation produces a strictly greater version")
    void versionsStrictlyIncrease() {
        SemanticVersion previous = engine.currentSchema().version();
        for (int i = 0; i < 5; i++) {
            MutationResult result = engine.applyAdd(optionalString("f" + i), null);
            assertThat(result.version()).isGreaterThan(result.baseVersion());
            assertThat(result.version()).isGreaterThan(previous);
            previous = result.version();
        }
    }

    @Test
    @DisplayName("A reopened registry reproduces versions, statuses and migrations")
    void reloadReproducesState() {
        engine.addField(optionalString("priority"));
        engine.removeField("priority");

        SchemaRegistry reopened = SchemaRegistry.open(store, CLOCK);

        assertThat(reopened.versions()).isEqualTo(engine.registry().versions());
        assertThat(reopened.migrations()).isEqualTo(engine.registry().migrations());
    }

    @Nested
    @DisplayName("validateData")
    class ValidateData {

        @Test
        @DisplayName("A compliant record validates against the bootstrap schema")
        void compliantRecordIsValid() {
            ValidationResult result = engine.validateData(compliantRecord());
            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(engine.validateData(compliantRecord())).isEqualTo(result);
        }

        @Test
        void missingRequiredFieldIsReported() {
            Map<String, Object> record = compliantRecord();
            record.remove("content_id");

            ValidationResult result = engine.validateData(record);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Missing required field: content_id");
        }

        @Test
        void unknownKeysAreReported() {
            Map<String, Object> record = compliantRecord();
            record.put("colour", "red");
            assertThat(engine.validateData(record).errors()).containsExactly("Unknown field: colour");
        }

        @Test
        @DisplayName("Deprecated fields are skipped whether present or not")
        void deprecatedFieldsAreSkipped() {
            engine.addField(SchemaField.of("legacy", FieldType.INTEGER, "", FieldValidation.requiredOnly()));
            engine.removeField("legacy");

            Map<String, Object> record = compliantRecord();
            assertThat(engine.validateData(record).valid()).isTrue();
            record.put("legacy", "not a number");
            assertThat(engine.validateData(record).valid()).isTrue();
        }

        @Test
        void validatesAgainstOlderVersion() {
            engine.addField(SchemaField.of("tag", FieldType.STRING, "", FieldValidation.requiredOnly()));

            assertThat(engine.validateData(compliantRecord()).valid()).isFalse();
            assertThat(engine.validateData(compliantRecord(), SemanticVersion.INITIAL).valid()).isTrue();
        }

        @Test
        void unknownVersionIsAnError() {
            ValidationResult result = engine.validateData(compliantRecord(), V200);
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Schema version 2.0.0 does not exist");
        }
    }

    @Nested
    @DisplayName("Usage analysis and suggestions")
    class Analysis {

        @Test
        void emptySamplesYieldEmptyReportAndNoSuggestions() {
            UsageReport report = engine.analyzeUsage(List.of());
            assertThat(report.isEmpty()).isTrue();
            assertThat(engine.suggestImprovements(report)).isEmpty();
        }

        @Test
        void countsUsageAndUnknownFields() {
            engine.addField(optionalString("rare"));
            engine.addField(optionalString("common"));
            List<Map<String, Object>> samples = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                Map<String, Object> sample = compliantRecord();
                sample.put("common", "x");
                if (i < 3) {
                    sample.put("mood", "happy");
                }
                samples.add(sample);
            }

            UsageReport report = engine.analyzeUsage(samples);

            assertThat(report.totalSamples()).isEqualTo(20);
            assertThat(report.fieldUsage().get("rare").usageRate()).isZero();
            assertThat(report.fieldUsage().get("common").usageRate()).isEqualTo(1.0);
            assertThat(report.unknownFields()).containsEntry("mood", 3);

            List<Suggestion> suggestions = engine.suggestImprovements(report);
            assertThat(suggestions).extracting(Suggestion::kind, Suggestion::fieldName)
                    .containsExactlyInAnyOrder(
                            tuple(Suggestion.Kind.ADD_FIELD, "mood"),
                            tuple(Suggestion.Kind.DEPRECATE_FIELD, "rare"),
                            tuple(Suggestion.Kind.MAKE_REQUIRED, "common"));
            assertThat(suggestions).filteredOn(s -> s.fieldName().equals("rare"))
                    .singleElement()
                    .extracting(Suggestion::reason)
                    .isEqualTo("Low usage rate (0.0%)");
        }

        @Test
        void policyThresholdsAreHonoured() {
            SchemaEvolutionEngine strict = new SchemaEvolutionEngine(
                    engine.registry(), new SuggestionPolicy(0.5, 0.0, 1.0), GovernanceListener.NONE);
            Map<String, Object> sample = compliantRecord();
            sample.put("mood", "happy");
            List<Map<String, Object>> samples = List.of(sample, compliantRecord(), compliantRecord());

            assertThat(strict.suggestImprovements(strict.analyzeUsage(samples))).isEmpty();
        }
    }

    @Test
    void historyListsVersionsWithTheirMigrations() {
        engine.addField(optionalString("a"));
        engine.removeField("a");

        List<VersionSummary> history = engine.history();

        assertThat(history).extracting(VersionSummary::version)
                .containsExactly(SemanticVersion.INITIAL, V110, V120);
        assertThat(history.get(0).migrations()).isEmpty();
        assertThat(history.get(2).migrations()).singleElement()
                .extracting(Migration::type)
                .isEqualTo(Migration.Type.REMOVE_FIELD);
    }

    @Test
    @DisplayName("Listener failures do not affect the mutation")
    void listenerFailureIsContained() {
        GovernanceListener listener = mock(GovernanceListener.class);
        doThrow(new IllegalStateException("boom")).when(listener).onFieldMutated(any());
        SchemaEvolutionEngine observed =
                new SchemaEvolutionEngine(engine.registry(), SuggestionPolicy.DEFAULT, listener);

        assertThat(observed.addField(optionalString("priority"))).isTrue();
        assertThat(observed.removeField("content_id")).isFalse();

        verify(listener).onFieldMutated(any());
        verify(listener).onMutationRejected(any());
    }
}
