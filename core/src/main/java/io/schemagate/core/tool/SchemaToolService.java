package io.schemagate.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.approval.ChangeApprovalGate;
import io.schemagate.core.engine.FieldUsage;
import io.schemagate.core.engine.SchemaEvolutionEngine;
import io.schemagate.core.engine.Suggestion;
import io.schemagate.core.engine.UsageReport;
import io.schemagate.core.engine.ValidationResult;
import io.schemagate.core.engine.VersionSummary;
import io.schemagate.core.model.ChangeDetails;
import io.schemagate.core.model.ChangeRequest;
import io.schemagate.core.model.ChangeType;
import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.FieldValidation;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.RequestStatus;
import io.schemagate.core.model.ReviewAction;
import io.schemagate.core.model.SchemaField;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import io.schemagate.core.store.SchemaJsonCodec;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The schema operations offered to the hosting tool-invocation layer, shaped
 * as JSON objects.
 *
 * <p>
 * No method throws. Every response carries a boolean {@code success}; a
 * failed call also carries {@code error}. Arguments arrive the way a tool
 * caller sends them: strings for enums and versions, JSON trees for records
 * and payloads.
 *
 * <p>
 * The field operations ({@link #addField}, {@link #removeField},
 * {@link #modifyField}) never touch the engine directly. They submit a
 * change request on behalf of {@value #TOOL_PROPOSER} and report whether it was
 * applied, rejected, or left pending for review.
 */
public final class SchemaToolService {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaToolService.class);

    static final String TOOL_PROPOSER = "tool";
    static final int DEFAULT_HISTORY_LIMIT = 50;

    private final SchemaEvolutionEngine engine;
    private final ChangeApprovalGate gate;
    private final SchemaJsonCodec codec;

    public SchemaToolService(SchemaEvolutionEngine engine, ChangeApprovalGate gate, SchemaJsonCodec codec) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    // --- Schema ---

    public ObjectNode getCurrentSchema() {
        return guarded("getCurrentSchema", () -> {
            SchemaVersion current = engine.currentSchema();
            ObjectNode out = ok();
            out.put("schema_version", current.version().toString());
            out.put("description", current.description());
            out.put("created_at", current.createdAt().toString());
            out.put("is_active", current.active());
            out.put("backward_compatible", current.backwardCompatible());
            out.put("total_fields", current.fields().size());
            out.put("core_fields_count", current.coreFieldCount());
            out.put("deprecated_fields_count", current.deprecatedFieldCount());
            ObjectNode fields = out.putObject("fields");
            current.fields().forEach((name, field) -> fields.set(name, fieldSummary(field)));
            return out;
        });
    }

    // --- Field changes (through the approval gate) ---

    /**
     * Proposes adding a field.
     *
     * @param validationRules snake_case validation keys, may be null
     */
    public ObjectNode addField(
            String name, String type, String description, boolean required, JsonNode validationRules) {
        return guarded("addField", () -> {
            requireFieldName(name);
            FieldType fieldType = FieldType.fromWire(type);
            FieldValidation validation = validationRules != null
                    ? codec.validationFromJson(validationRules, FieldValidation.optional())
                    : null;
            boolean requiredByRules = validationRules != null
                    && validationRules.path("required").asBoolean(false);
            ChangeDetails details = new ChangeDetails(fieldType, description, required || requiredByRules, validation);
            return submit(ChangeType.ADD_FIELD, name, details, "Add field '" + name + "' via tool");
        });
    }

    public ObjectNode removeField(String name) {
        return guarded("removeField", () -> {
            requireFieldName(name);
            return submit(ChangeType.REMOVE_FIELD, name, ChangeDetails.empty(), "Remove field '" + name + "' via tool");
        });
    }

    /**
     * Proposes modifying a field. Null arguments leave that aspect unchanged;
     * validation rules are layered over the field's current validation. A
     * {@code required} key in the rules is treated as the {@code required}
     * argument when that is null.
     */
    public ObjectNode modifyField(
            String name, String type, String description, Boolean required, JsonNode validationRules) {
        return guarded("modifyField", () -> {
            requireFieldName(name);
            Optional<SchemaField> existing = engine.currentSchema().field(name);
            if (existing.isEmpty()) {
                return error("Field '" + name + "' does not exist in the current schema");
            }
            FieldType fieldType = type != null ? FieldType.fromWire(type) : null;
            FieldValidation validation = validationRules != null
                    ? codec.validationFromJson(validationRules, existing.get().validation())
                    : null;
            Boolean requiredChange = required;
            if (requiredChange == null && validationRules != null && validationRules.hasNonNull("required")) {
                requiredChange = validationRules.get("required").asBoolean();
            }
            ChangeDetails details = new ChangeDetails(fieldType, description, requiredChange, validation);
            return submit(ChangeType.MODIFY_FIELD, name, details, "Modify field '" + name + "' via tool");
        });
    }

    private ObjectNode submit(ChangeType changeType, String fieldName, ChangeDetails details, String justification) {
        String id = gate.createChangeRequest(changeType, fieldName, details, TOOL_PROPOSER, justification);
        ChangeRequest request = gate.findRequest(id)
                .orElseThrow(() -> new IllegalStateException("Change request " + id + " vanished after creation"));
        ObjectNode out = request.status() == RequestStatus.REJECTED
                ? error(request.reviewComments())
                : ok();
        out.put("status", request.status().wireName());
        out.put("request_id", id);
        out.put("risk_level", request.riskLevel().wireName());
        out.put("required_approval_level", request.requiredApprovalLevel().wireName());
        switch (request.status()) {
            case APPROVED -> {
                SchemaVersion current = engine.currentSchema();
                out.put("schema_version", current.version().toString());
                current.field(fieldName).ifPresent(f -> out.set("field", fieldSummary(f)));
                out.put("message", "Change to field '" + fieldName + "' applied in version " + current.version());
            }
            case PENDING -> out.put(
                    "message",
                    "Change to field '" + fieldName + "' awaits "
                            + request.requiredApprovalLevel().wireName() + " approval");
            case REJECTED -> out.put("message", "Change to field '" + fieldName + "' was rejected");
        }
        return out;
    }

    // --- Validation and analysis ---

    /**
     * Validates a record.
     *
     * @param record  JSON object of field values
     * @param version version string, or null for the current version
     */
    public ObjectNode validateData(JsonNode record, String version) {
        return guarded("validateData", () -> {
            if (record == null || !record.isObject()) {
                return error("Record must be a JSON object");
            }
            SemanticVersion target = version != null ? SemanticVersion.parse(version) : null;
            ValidationResult result = engine.validateData(toRecord(record), target);
            ObjectNode out = ok();
            out.put("is_valid", result.valid());
            out.put("schema_version", result.version() != null ? result.version().toString() : version);
            ArrayNode errors = out.putArray("validation_errors");
            result.errors().forEach(errors::add);
            out.put("error_count", result.errors().size());
            out.put(
                    "message",
                    result.valid()
                            ? "Record is valid"
                            : "Record is invalid: " + result.errors().size() + " error(s)");
            return out;
        });
    }

    /** Analyzes field usage over a JSON array of sample records. */
    public ObjectNode analyzeUsage(JsonNode samples) {
        return guarded("analyzeUsage", () -> {
            List<Map<String, Object>> records = toSamples(samples);
            if (records.isEmpty()) {
                ObjectNode out = error("Sample records are required for usage analysis");
                out.put("total_samples", 0);
                return out;
            }
            UsageReport report = engine.analyzeUsage(records);
            ObjectNode out = ok();
            writeReport(out, report);
            ObjectNode summary = out.putObject("summary");
            ArrayNode high = summary.putArray("high_usage_fields");
            ArrayNode low = summary.putArray("low_usage_fields");
            for (FieldUsage usage : report.fieldUsage().values()) {
                if (usage.usageRate() > 0.8) {
                    high.add(usage.fieldName());
                }
                if (usage.usageRate() < 0.2 && !usage.core()) {
                    low.add(usage.fieldName());
                }
            }
            summary.put("compliance_level", report.complianceRate() > 0.7 ? "good" : "poor");
            summary.put("suggestions_available", !low.isEmpty() || !report.unknownFields().isEmpty());
            return out;
        });
    }

    /** Analyzes the samples and returns suggestions, most urgent first. */
    public ObjectNode getSuggestions(JsonNode samples) {
        return guarded("getSuggestions", () -> {
            List<Map<String, Object>> records = toSamples(samples);
            if (records.isEmpty()) {
                ObjectNode out = error("Sample records are required to generate suggestions");
                out.putArray("suggestions");
                return out;
            }
            UsageReport report = engine.analyzeUsage(records);
            List<Suggestion> suggestions = new ArrayList<>(engine.suggestImprovements(report));
            suggestions.sort(Comparator.comparing(Suggestion::priority).reversed());

            ObjectNode out = ok();
            ObjectNode summary = out.putObject("analysis_summary");
            summary.put("total_samples", report.totalSamples());
            summary.put("schema_version", report.schemaVersion().toString());
            summary.put("compliance_rate", report.complianceRate());
            out.put("suggestion_count", suggestions.size());
            ArrayNode list = out.putArray("suggestions");
            for (Suggestion s : suggestions) {
                ObjectNode node = list.addObject();
                node.put("type", s.kind().wireName());
                node.put("field_name", s.fieldName());
                node.put("reason", s.reason());
                node.put("priority", s.priority().wireName());
            }
            out.put(
                    "message",
                    "Generated " + suggestions.size() + " suggestion(s) from " + report.totalSamples() + " sample(s)");
            return out;
        });
    }

    public ObjectNode getEvolutionHistory() {
        return guarded("getEvolutionHistory", () -> {
            List<VersionSummary> history = engine.history();
            ObjectNode out = ok();
            out.put("total_versions", history.size());
            out.put("active_versions", history.stream().filter(VersionSummary::active).count());
            out.put("total_migrations", history.stream().mapToInt(v -> v.migrations().size()).sum());
            ArrayNode entries = out.putArray("evolution_history");
            for (VersionSummary v : history) {
                ObjectNode node = entries.addObject();
                node.put("version", v.version().toString());
                node.put("description", v.description());
                node.put("created_at", v.createdAt().toString());
                node.put("is_active", v.active());
                node.put("backward_compatible", v.backwardCompatible());
                node.put("field_count", v.fieldCount());
                ArrayNode migrations = node.putArray("migrations");
                for (Migration m : v.migrations()) {
                    ObjectNode mn = migrations.addObject();
                    mn.put("type", m.type().wireName());
                    mn.put("field", m.fieldName());
                    mn.put("from_version", m.fromVersion().toString());
                }
            }
            ObjectNode summary = out.putObject("summary");
            if (history.isEmpty()) {
                summary.putNull("first_version");
                summary.putNull("latest_version");
                summary.putNull("most_changes");
            } else {
                summary.put("first_version", history.get(0).version().toString());
                summary.put("latest_version", history.get(history.size() - 1).version().toString());
                VersionSummary busiest = history.get(0);
                for (VersionSummary v : history) {
                    if (v.migrations().size() > busiest.migrations().size()) {
                        busiest = v;
                    }
                }
                summary.put("most_changes", busiest.version().toString());
            }
            return out;
        });
    }

    // --- Approval workflow ---

    /**
     * Creates a change request.
     *
     * @param changeType {@code add_field}, {@code remove_field}, {@code modify_field} or {@code rename_field}
     * @param details    JSON object with optional {@code field_type}, {@code description},
     *                   {@code required} and {@code validation}
     */
    public ObjectNode createChangeRequest(
            String changeType, String fieldName, JsonNode details, String proposedBy, String justification) {
        return guarded("createChangeRequest", () -> {
            requireFieldName(fieldName);
            ChangeType type = ChangeType.fromWire(changeType);
            String id = gate.createChangeRequest(
                    type, fieldName, codec.detailsFromJson(details), proposedBy, justification);
            ChangeRequest request = gate.findRequest(id)
                    .orElseThrow(() -> new IllegalStateException("Change request " + id + " vanished after creation"));
            ObjectNode out = ok();
            out.put("request_id", id);
            out.put("status", request.status().wireName());
            out.put("risk_level", request.riskLevel().wireName());
            out.put("required_approval_level", request.requiredApprovalLevel().wireName());
            out.set("impact_analysis", codec.impactToJson(request.impactAnalysis()));
            if (request.status() != RequestStatus.PENDING) {
                out.put("review_comments", request.reviewComments());
            }
            return out;
        });
    }

    /**
     * Reviews a pending request.
     *
     * @param action {@code approve} or {@code reject}
     */
    public ObjectNode reviewRequest(String requestId, String reviewer, String action, String comments) {
        return guarded("reviewRequest", () -> {
            Optional<ReviewAction> parsed = ReviewAction.parse(action);
            if (parsed.isEmpty()) {
                return error("Unknown review action '" + action + "', expected approve or reject");
            }
            boolean reviewed = gate.reviewRequest(requestId, reviewer, parsed.get(), comments);
            if (!reviewed) {
                ObjectNode out = error("Request " + requestId + " is not pending or '" + reviewer
                        + "' is not authorized to review it");
                out.put("request_id", requestId);
                return out;
            }
            ChangeRequest request = gate.findRequest(requestId).orElseThrow();
            ObjectNode out = ok();
            out.put("request_id", requestId);
            out.put("status", request.status().wireName());
            out.put("reviewed_by", request.reviewedBy());
            out.put("review_comments", request.reviewComments());
            return out;
        });
    }

    /** @param reviewer when non-null, only requests this reviewer may decide */
    public ObjectNode getPendingRequests(String reviewer) {
        return guarded("getPendingRequests", () -> {
            List<ChangeRequest> pending = gate.getPendingRequests(reviewer);
            ObjectNode out = ok();
            out.put("count", pending.size());
            ArrayNode list = out.putArray("requests");
            pending.forEach(r -> list.add(codec.requestToJson(r)));
            return out;
        });
    }

    /** @param limit maximum entries, most recent last; non-positive yields none */
    public ObjectNode getApprovalHistory(int limit) {
        return guarded("getApprovalHistory", () -> {
            List<ChangeRequest> history = gate.getApprovalHistory(limit);
            ObjectNode out = ok();
            out.put("count", history.size());
            ArrayNode list = out.putArray("history");
            history.forEach(r -> list.add(codec.requestToJson(r)));
            return out;
        });
    }

    public ObjectNode getApprovalHistory() {
        return getApprovalHistory(DEFAULT_HISTORY_LIMIT);
    }

    // --- Helpers ---

    private ObjectNode fieldSummary(SchemaField field) {
        ObjectNode node = codec.mapper().createObjectNode();
        node.put("type", field.type().wireName());
        node.put("description", field.description());
        node.put("required", field.required());
        node.put("is_core", field.core());
        node.put("deprecated", field.deprecated());
        node.put("added_in_version", field.addedInVersion() != null ? field.addedInVersion().toString() : null);
        node.put(
                "deprecated_in_version",
                field.status().since().map(SemanticVersion::toString).orElse(null));
        ObjectNode rules = codec.validationToJson(field.validation());
        rules.remove("required");
        node.set("validation_rules", rules);
        return node;
    }

    private void writeReport(ObjectNode out, UsageReport report) {
        out.put("total_samples", report.totalSamples());
        out.put("current_schema_version", report.schemaVersion().toString());
        ObjectNode stats = out.putObject("field_usage_stats");
        report.fieldUsage().forEach((name, usage) -> {
            ObjectNode node = stats.putObject(name);
            node.put("usage_count", usage.usageCount());
            node.put("usage_rate", usage.usageRate());
            node.put("missing_count", usage.missingCount());
            node.put("is_required", usage.required());
            node.put("is_core", usage.core());
            node.put("deprecated", usage.deprecated());
        });
        ObjectNode unknown = out.putObject("unknown_fields");
        report.unknownFields().forEach((name, count) -> unknown.put(name, count.intValue()));
        out.put("schema_compliance_rate", report.complianceRate());
    }

    private Map<String, Object> toRecord(JsonNode node) {
        Map<String, Object> record = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> record.put(e.getKey(), codec.toPlain(e.getValue())));
        return record;
    }

    private List<Map<String, Object>> toSamples(JsonNode samples) {
        List<Map<String, Object>> records = new ArrayList<>();
        if (samples == null || samples.isNull()) {
            return records;
        }
        if (!samples.isArray()) {
            throw new IllegalArgumentException("Samples must be a JSON array of objects");
        }
        for (JsonNode sample : samples) {
            if (!sample.isObject()) {
                throw new IllegalArgumentException("Every sample must be a JSON object");
            }
            records.add(toRecord(sample));
        }
        return records;
    }

    private static void requireFieldName(String name) {
        if (!SchemaField.isValidName(name)) {
            throw new IllegalArgumentException("Field name '" + name + "' is not a valid identifier");
        }
    }

    private ObjectNode ok() {
        ObjectNode out = codec.mapper().createObjectNode();
        out.put("success", true);
        return out;
    }

    private ObjectNode error(String message) {
        ObjectNode out = codec.mapper().createObjectNode();
        out.put("success", false);
        out.put("error", message);
        return out;
    }

    private ObjectNode guarded(String operation, Supplier<ObjectNode> body) {
        try {
            return body.get();
        } catch (IllegalArgumentException | NullPointerException e) {
            LOG.warn("Tool operation {} rejected: {}", operation, e.getMessage());
            return error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (RuntimeException e) {
            LOG.error("Tool operation {} failed", operation, e);
            return error(operation + " failed: " + e.getMessage());
        }
    }
}
