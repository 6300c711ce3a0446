package io.schemagate.core.engine;

import io.schemagate.core.model.CoreFields;
import io.schemagate.core.model.FieldStatus;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.SchemaField;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import io.schemagate.core.registry.RegistryTransaction;
import io.schemagate.core.registry.SchemaRegistry;
import io.schemagate.core.spi.GovernanceListener;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutates, validates and analyzes schema versions held by a
 * {@link SchemaRegistry}.
 *
 * <p>
 * <b>Mutations.</b> {@code addField}, {@code removeField} and
 * {@code modifyField} each write to a target version: by default the current
 * version bumped (minor for add and remove, patch for modify), or an explicit
 * target. A target that does not exist yet is created by cloning the current
 * version and must be strictly greater than it; an existing target is changed
 * in place, with the highest version below it as its base. Version 1.0.0 is
 * never a target. Every applied mutation appends exactly one migration. Checks
 * run before anything is staged, so a refused mutation leaves the registry
 * untouched.
 *
 * <p>
 * <b>Validation and analysis</b> are read-only: invalid records produce error
 * lists, never exceptions.
 *
 * <p>
 * Thread-safe: all state lives in the registry, which serializes writers.
 */
public final class SchemaEvolutionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaEvolutionEngine.class);

    private final SchemaRegistry registry;
    private final FieldValidator validator;
    private final SuggestionPolicy suggestionPolicy;
    private final GovernanceListener listener;

    public SchemaEvolutionEngine(SchemaRegistry registry) {
        this(registry, SuggestionPolicy.DEFAULT, GovernanceListener.NONE);
    }

    /**
     * @param registry         version registry to operate on
     * @param suggestionPolicy thresholds for improvement suggestions
     * @param listener         governance observer, may be {@link GovernanceListener#NONE}
     */
    public SchemaEvolutionEngine(
            SchemaRegistry registry, SuggestionPolicy suggestionPolicy, GovernanceListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.suggestionPolicy = Objects.requireNonNull(suggestionPolicy, "suggestionPolicy must not be null");
        this.listener = listener != null ? listener : GovernanceListener.NONE;
        this.validator = new FieldValidator();
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public SchemaVersion currentSchema() {
        return registry.getCurrent();
    }

    // --- Mutations ---

    /** Adds {@code field} to the current version bumped by minor. */
    public boolean addField(SchemaField field) {
        return applyAdd(field, null).applied();
    }

    public boolean addField(SchemaField field, SemanticVersion targetVersion) {
        return applyAdd(field, targetVersion).applied();
    }

    /**
     * Adds a field. Refused if a field of that name already exists in the
     * version being written.
     *
     * @param field         the field; its {@code addedInVersion} is replaced by the target
     * @param targetVersion explicit target, or null for current bumped by minor
     */
    public MutationResult applyAdd(SchemaField field, SemanticVersion targetVersion) {
        Objects.requireNonNull(field, "field must not be null");
        MutationStep step = (effective, target) -> {
            if (effective.hasField(field.name())) {
                return Change.refused("Field '" + field.name() + "' already exists in version " + effective.version());
            }
            SchemaField added = field.withStatus(FieldStatus.ACTIVE).withAddedInVersion(target);
            return new Change(
                    added,
                    "ADD FIELD " + field.name() + " " + field.type().wireName(),
                    "DROP FIELD " + field.name(),
                    field.required(),
                    null);
        };
        return apply(Migration.Type.ADD_FIELD, field.name(), targetVersion, SemanticVersion.Bump.MINOR, step);
    }

    /** Deprecates {@code fieldName} in the current version bumped by minor. */
    public boolean removeField(String fieldName) {
        return applyRemove(fieldName, null).applied();
    }

    public boolean removeField(String fieldName, SemanticVersion targetVersion) {
        return applyRemove(fieldName, targetVersion).applied();
    }

    /**
     * Soft-deletes a field: it stays in the version with status
     * {@code Deprecated(target)}. Refused for core fields, unknown fields and
     * fields that are already deprecated.
     */
    public MutationResult applyRemove(String fieldName, SemanticVersion targetVersion) {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        if (CoreFields.isCore(fieldName)) {
            return refuse(Migration.Type.REMOVE_FIELD, fieldName, "Core field '" + fieldName + "' cannot be removed");
        }
        MutationStep step = (effective, target) -> {
            Optional<SchemaField> existing = effective.field(fieldName);
            if (existing.isEmpty()) {
                return Change.refused("Field '" + fieldName + "' does not exist in version " + effective.version());
            }
            if (existing.get().core()) {
                return Change.refused("Core field '" + fieldName + "' cannot be removed");
            }
            if (existing.get().deprecated()) {
                return Change.refused("Field '" + fieldName + "' is already deprecated");
            }
            return new Change(
                    existing.get().withStatus(FieldStatus.deprecatedSince(target)),
                    "DEPRECATE FIELD " + fieldName,
                    "RESTORE FIELD " + fieldName,
                    false,
                    null);
        };
        return apply(Migration.Type.REMOVE_FIELD, fieldName, targetVersion, SemanticVersion.Bump.MINOR, step);
    }

    /** Modifies {@code fieldName} in the current version bumped by patch. */
    public boolean modifyField(String fieldName, SchemaField newDefinition) {
        return applyModify(fieldName, newDefinition, null).applied();
    }

    public boolean modifyField(String fieldName, SchemaField newDefinition, SemanticVersion targetVersion) {
        return applyModify(fieldName, newDefinition, targetVersion).applied();
    }

    /**
     * Replaces a field's type, description and validation. Name, core flag,
     * status and {@code addedInVersion} are preserved. Changing the type or
     * making an optional field required marks the target version as not
     * backward compatible.
     */
    public MutationResult applyModify(String fieldName, SchemaField newDefinition, SemanticVersion targetVersion) {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(newDefinition, "newDefinition must not be null");
        MutationStep step = (effective, target) -> {
            Optional<SchemaField> existing = effective.field(fieldName);
            if (existing.isEmpty()) {
                return Change.refused("Field '" + fieldName + "' does not exist in version " + effective.version());
            }
            SchemaField old = existing.get();
            SchemaField updated =
                    old.withDefinition(newDefinition.type(), newDefinition.description(), newDefinition.validation());
            boolean breaking = old.type() != updated.type() || (!old.required() && updated.required());
            return new Change(
                    updated,
                    "MODIFY FIELD " + fieldName,
                    "REVERT FIELD " + fieldName + " TO " + old.type().wireName(),
                    breaking,
                    null);
        };
        return apply(Migration.Type.MODIFY_FIELD, fieldName, targetVersion, SemanticVersion.Bump.PATCH, step);
    }

    /** Staged outcome of one mutation step, or the reason it was refused. */
    private record Change(SchemaField field, String script, String rollback, boolean breaking, String refusal) {
        static Change refused(String reason) {
            return new Change(null, null, null, false, reason);
        }
    }

    @FunctionalInterface
    private interface MutationStep {
        Change plan(SchemaVersion effective, SemanticVersion target);
    }

    private MutationResult apply(
            Migration.Type type,
            String fieldName,
            SemanticVersion explicitTarget,
            SemanticVersion.Bump defaultBump,
            MutationStep step) {
        MutationResult result = registry.mutate(tx -> {
            Instant now = registry.clock().instant();
            SchemaVersion base;
            SchemaVersion existingTarget;
            SemanticVersion target;
            if (explicitTarget == null) {
                base = tx.current();
                if (!base.version().canBump(defaultBump)) {
                    return MutationResult.rejected("Version " + base.version() + " has no "
                            + defaultBump.name().toLowerCase(Locale.ROOT) + " successor");
                }
                target = SchemaRegistry.incrementVersion(base.version(), defaultBump);
                existingTarget = tx.version(target).orElse(null);
            } else {
                target = explicitTarget;
                if (target.equals(SemanticVersion.INITIAL)) {
                    return MutationResult.rejected("Version " + SemanticVersion.INITIAL + " cannot be modified");
                }
                existingTarget = tx.version(target).orElse(null);
                if (existingTarget == null) {
                    base = tx.current();
                    if (!target.isAfter(base.version())) {
                        return MutationResult.rejected(
                                "Target version " + target + " must be greater than current version " + base.version());
                    }
                } else {
                    base = null;
                }
            }
            if (existingTarget != null) {
                Optional<SchemaVersion> below = tx.versionBelow(target);
                if (below.isEmpty()) {
                    return MutationResult.rejected("Version " + target + " has no base version");
                }
                base = below.get();
            }

            SchemaVersion effective = existingTarget != null ? existingTarget : base;
            Change change = step.plan(effective, target);
            if (change.refusal() != null) {
                return MutationResult.rejected(change.refusal());
            }

            SchemaVersion written = existingTarget != null
                    ? existingTarget
                    : base.cloneAs(target, describe(type, fieldName), now);
            written = written.withField(change.field());
            if (change.breaking()) {
                written = written.withBackwardCompatible(false);
            }
            if (explicitTarget == null) {
                written = written.withActive(true);
            }
            stage(tx, written, new Migration(
                    base.version(), target, type, fieldName, change.script(), change.rollback(), now));
            return MutationResult.applied(base.version(), target);
        });

        if (result.applied()) {
            LOG.info(
                    "Applied {} of field '{}': {} -> {}",
                    type.wireName(),
                    fieldName,
                    result.baseVersion(),
                    result.version());
            notifyMutated(type, fieldName, result);
        } else {
            LOG.warn("Refused {} of field '{}': {}", type.wireName(), fieldName, result.reason());
            notifyRejected(type, fieldName, result.reason());
        }
        return result;
    }

    private static void stage(RegistryTransaction tx, SchemaVersion written, Migration migration) {
        tx.put(written);
        tx.appendMigration(migration);
    }

    private MutationResult refuse(Migration.Type type, String fieldName, String reason) {
        LOG.warn("Refused {} of field '{}': {}", type.wireName(), fieldName, reason);
        notifyRejected(type, fieldName, reason);
        return MutationResult.rejected(reason);
    }

    private static String describe(Migration.Type type, String fieldName) {
        return switch (type) {
            case ADD_FIELD -> "Add field " + fieldName;
            case REMOVE_FIELD -> "Deprecate field " + fieldName;
            case MODIFY_FIELD -> "Modify field " + fieldName;
        };
    }

    // --- Validation ---

    /** Validates {@code record} against the current version. */
    public ValidationResult validateData(Map<String, ?> record) {
        return validateData(record, null);
    }

    /**
     * Validates a record. Deprecated fields are skipped, whether present or
     * not; keys the version does not define are reported as unknown.
     *
     * @param record  field values keyed by name
     * @param version version to validate against, or null for current
     */
    public ValidationResult validateData(Map<String, ?> record, SemanticVersion version) {
        Objects.requireNonNull(record, "record must not be null");
        SchemaVersion schema;
        if (version == null) {
            schema = registry.getCurrent();
        } else {
            Optional<SchemaVersion> found = registry.getVersion(version);
            if (found.isEmpty()) {
                return ValidationResult.of(List.of("Schema version " + version + " does not exist"), null);
            }
            schema = found.get();
        }

        List<String> errors = new ArrayList<>();
        for (SchemaField field : schema.fields().values()) {
            if (field.deprecated()) {
                continue;
            }
            if (!record.containsKey(field.name())) {
                if (field.required()) {
                    errors.add("Missing required field: " + field.name());
                }
                continue;
            }
            errors.addAll(validator.validateValue(field, record.get(field.name())));
        }
        for (String key : record.keySet()) {
            if (!schema.hasField(key)) {
                errors.add("Unknown field: " + key);
            }
        }
        return ValidationResult.of(errors, schema.version());
    }

    // --- Analysis ---

    /**
     * Measures how the current version's fields are used across
     * {@code samples}. An empty sample set yields {@link UsageReport#empty}.
     */
    public UsageReport analyzeUsage(List<? extends Map<String, ?>> samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        SchemaVersion schema = registry.getCurrent();
        if (samples.isEmpty()) {
            return UsageReport.empty(schema.version());
        }
        int total = samples.size();
        Map<String, FieldUsage> usage = new LinkedHashMap<>();
        int compliant = 0;
        for (SchemaField field : schema.fields().values()) {
            int used = 0;
            for (Map<String, ?> sample : samples) {
                if (sample.containsKey(field.name())) {
                    used++;
                }
            }
            double rate = (double) used / total;
            if (rate > 0.8) {
                compliant++;
            }
            usage.put(
                    field.name(),
                    new FieldUsage(
                            field.name(),
                            used,
                            rate,
                            total - used,
                            field.required(),
                            field.core(),
                            field.deprecated()));
        }
        Map<String, Integer> unknown = new LinkedHashMap<>();
        for (Map<String, ?> sample : samples) {
            for (String key : sample.keySet()) {
                if (!schema.hasField(key)) {
                    unknown.merge(key, 1, Integer::sum);
                }
            }
        }
        double compliance = usage.isEmpty() ? 0.0 : (double) compliant / usage.size();
        return new UsageReport(total, schema.version(), usage, unknown, compliance);
    }

    /**
     * Derives improvement suggestions from a usage report. Pure: nothing is
     * mutated. Deprecated fields are never suggested.
     */
    public List<Suggestion> suggestImprovements(UsageReport report) {
        Objects.requireNonNull(report, "report must not be null");
        List<Suggestion> suggestions = new ArrayList<>();
        if (report.isEmpty()) {
            return suggestions;
        }
        report.unknownFields().forEach((name, count) -> {
            double rate = (double) count / report.totalSamples();
            if (rate >= suggestionPolicy.unknownFieldMinRate()) {
                suggestions.add(new Suggestion(
                        Suggestion.Kind.ADD_FIELD,
                        name,
                        "Field appears in " + count + " of " + report.totalSamples()
                                + " samples but is not defined in the schema",
                        Suggestion.Priority.MEDIUM));
            }
        });
        for (FieldUsage stat : report.fieldUsage().values()) {
            if (!stat.deprecated()
                    && !stat.core()
                    && !stat.required()
                    && stat.usageRate() < suggestionPolicy.deprecateBelowRate()) {
                suggestions.add(new Suggestion(
                        Suggestion.Kind.DEPRECATE_FIELD,
                        stat.fieldName(),
                        "Low usage rate (" + percent(stat.usageRate()) + ")",
                        Suggestion.Priority.LOW));
            }
        }
        for (FieldUsage stat : report.fieldUsage().values()) {
            if (!stat.deprecated() && !stat.required() && stat.usageRate() > suggestionPolicy.requireAboveRate()) {
                suggestions.add(new Suggestion(
                        Suggestion.Kind.MAKE_REQUIRED,
                        stat.fieldName(),
                        "High usage rate (" + percent(stat.usageRate()) + "), consider making it required",
                        Suggestion.Priority.MEDIUM));
            }
        }
        return suggestions;
    }

    /** Every version in semver order, each with the migrations that produced it. */
    public List<VersionSummary> history() {
        List<Migration> migrations = registry.migrations();
        List<VersionSummary> history = new ArrayList<>();
        for (SchemaVersion version : registry.versions()) {
            List<Migration> into = migrations.stream()
                    .filter(m -> m.toVersion().equals(version.version()))
                    .toList();
            history.add(new VersionSummary(
                    version.version(),
                    version.description(),
                    version.createdAt(),
                    version.active(),
                    version.backwardCompatible(),
                    version.fields().size(),
                    into));
        }
        return history;
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100.0);
    }

    // --- Listener notification ---

    private void notifyMutated(Migration.Type type, String fieldName, MutationResult result) {
        try {
            listener.onFieldMutated(new GovernanceListener.FieldMutatedEvent(
                    type, fieldName, result.baseVersion(), result.version()));
        } catch (Exception e) {
            LOG.warn("GovernanceListener.onFieldMutated failed", e);
        }
    }

    private void notifyRejected(Migration.Type type, String fieldName, String reason) {
        try {
            listener.onMutationRejected(new GovernanceListener.MutationRejectedEvent(type, fieldName, reason));
        } catch (Exception e) {
            LOG.warn("GovernanceListener.onMutationRejected failed", e);
        }
    }
}
