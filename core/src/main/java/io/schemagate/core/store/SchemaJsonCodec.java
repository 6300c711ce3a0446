package io.schemagate.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.model.ApprovalLevel;
import io.schemagate.core.model.ChangeDetails;
import io.schemagate.core.model.ChangeRequest;
import io.schemagate.core.model.ChangeType;
import io.schemagate.core.model.FieldStatus;
import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.FieldValidation;
import io.schemagate.core.model.ImpactAnalysis;
import io.schemagate.core.model.Migration;
import io.schemagate.core.model.RequestStatus;
import io.schemagate.core.model.RiskLevel;
import io.schemagate.core.model.SchemaField;
import io.schemagate.core.model.SchemaVersion;
import io.schemagate.core.model.SemanticVersion;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts model objects to and from the snake_case JSON shapes used by the
 * store files and by tool responses.
 *
 * <p>
 * Mapping is done by hand over Jackson trees so the model stays free of
 * serialization annotations and the on-disk shape is spelled out in one place.
 * Readers are lenient about optional keys (missing means default) and strict
 * about required ones, which the file-level JSON Schemas check before any
 * reader runs.
 *
 * <p>
 * Thread-safe: stateless apart from the shared {@link ObjectMapper}.
 */
public final class SchemaJsonCodec {

    private final ObjectMapper mapper;

    public SchemaJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // --- Validation ---

    public ObjectNode validationToJson(FieldValidation v) {
        ObjectNode node = mapper.createObjectNode();
        node.put("required", v.required());
        putNullable(node, "min_length", v.minLength());
        putNullable(node, "max_length", v.maxLength());
        node.put("pattern", v.pattern());
        putNullable(node, "min_value", v.minValue());
        putNullable(node, "max_value", v.maxValue());
        node.set("allowed_values", v.allowedValues() != null ? mapper.valueToTree(v.allowedValues()) : null);
        node.set("default_value", mapper.valueToTree(v.defaultValue()));
        return node;
    }

    /**
     * Reads a validation block, layering the keys present in {@code node} over
     * {@code base}. Keys that are absent or null keep the base value; unknown
     * keys are ignored.
     */
    public FieldValidation validationFromJson(JsonNode node, FieldValidation base) {
        FieldValidation.Builder b = base.toBuilder();
        if (node == null || node.isNull() || !node.isObject()) {
            return b.build();
        }
        if (present(node, "required")) b.required(node.get("required").asBoolean());
        if (present(node, "min_length")) b.minLength(node.get("min_length").asInt());
        if (present(node, "max_length")) b.maxLength(node.get("max_length").asInt());
        if (present(node, "pattern")) b.pattern(node.get("pattern").asText());
        if (present(node, "min_value")) b.minValue(node.get("min_value").asDouble());
        if (present(node, "max_value")) b.maxValue(node.get("max_value").asDouble());
        if (present(node, "allowed_values")) b.allowedValues(toList(node.get("allowed_values")));
        if (present(node, "default_value")) b.defaultValue(toPlain(node.get("default_value")));
        return b.build();
    }

    // --- Fields ---

    public ObjectNode fieldToJson(SchemaField field) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", field.name());
        node.put("type", field.type().wireName());
        node.put("description", field.description());
        node.set("validation", validationToJson(field.validation()));
        node.put("is_core", field.core());
        node.put("deprecated", field.deprecated());
        node.put("added_in_version", versionText(field.addedInVersion()));
        node.put("deprecated_in_version", field.status().since().map(SemanticVersion::toString).orElse(null));
        return node;
    }

    public SchemaField fieldFromJson(String name, JsonNode node) {
        String typeText = present(node, "type") ? node.get("type").asText() : node.path("field_type").asText(null);
        FieldType type = FieldType.fromWire(typeText);
        FieldValidation validation = validationFromJson(node.get("validation"), FieldValidation.optional());
        FieldStatus status = FieldStatus.ACTIVE;
        if (node.path("deprecated").asBoolean(false)) {
            String since = textOrNull(node, "deprecated_in_version");
            String added = textOrNull(node, "added_in_version");
            // a deprecated entry without a version falls back to the version it was added in
            String effective = since != null ? since : (added != null ? added : SemanticVersion.INITIAL.toString());
            status = FieldStatus.deprecatedSince(SemanticVersion.parse(effective));
        }
        String added = textOrNull(node, "added_in_version");
        return new SchemaField(
                name,
                type,
                textOrNull(node, "description"),
                validation,
                node.path("is_core").asBoolean(false),
                status,
                added != null ? SemanticVersion.parse(added) : null);
    }

    // --- Versions ---

    public ObjectNode versionToJson(SchemaVersion version) {
        ObjectNode node = mapper.createObjectNode();
        node.put("version", version.version().toString());
        node.put("description", version.description());
        node.put("created_at", version.createdAt().toString());
        node.put("is_active", version.active());
        node.put("backward_compatible", version.backwardCompatible());
        ObjectNode fields = node.putObject("fields");
        version.fields().forEach((name, field) -> fields.set(name, fieldToJson(field)));
        return node;
    }

    public SchemaVersion versionFromJson(JsonNode node) {
        Map<String, SchemaField> fields = new LinkedHashMap<>();
        JsonNode fieldsNode = node.path("fields");
        Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), fieldFromJson(entry.getKey(), entry.getValue()));
        }
        return new SchemaVersion(
                SemanticVersion.parse(node.get("version").asText()),
                textOrNull(node, "description"),
                parseInstant(textOrNull(node, "created_at")),
                node.path("is_active").asBoolean(true),
                node.path("backward_compatible").asBoolean(true),
                fields);
    }

    // --- Migrations ---

    public ObjectNode migrationToJson(Migration m) {
        ObjectNode node = mapper.createObjectNode();
        node.put("from_version", m.fromVersion().toString());
        node.put("to_version", m.toVersion().toString());
        node.put("migration_type", m.type().wireName());
        node.put("field_name", m.fieldName());
        node.put("migration_script", m.migrationScript());
        node.put("rollback_script", m.rollbackScript());
        node.put("created_at", m.createdAt().toString());
        return node;
    }

    public Migration migrationFromJson(JsonNode node) {
        return new Migration(
                SemanticVersion.parse(node.get("from_version").asText()),
                SemanticVersion.parse(node.get("to_version").asText()),
                Migration.Type.fromWire(node.get("migration_type").asText()),
                node.get("field_name").asText(),
                textOrNull(node, "migration_script"),
                textOrNull(node, "rollback_script"),
                parseInstant(textOrNull(node, "created_at")));
    }

    // --- Change requests ---

    public ObjectNode detailsToJson(ChangeDetails d) {
        ObjectNode node = mapper.createObjectNode();
        if (d.fieldType() != null) node.put("field_type", d.fieldType().wireName());
        if (d.description() != null) node.put("description", d.description());
        if (d.required() != null) node.put("required", d.required());
        if (d.validation() != null) node.set("validation", validationToJson(d.validation()));
        return node;
    }

    /**
     * Reads a change-details payload. Only the keys present become non-null
     * components, which keeps "not touched" distinguishable from "set to the
     * default". A {@code required} key inside {@code validation} counts as the
     * top-level {@code required} when that one is absent.
     *
     * @throws IllegalArgumentException if {@code field_type} names an unknown type
     */
    public ChangeDetails detailsFromJson(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            return ChangeDetails.empty();
        }
        FieldType type = present(node, "field_type") ? FieldType.fromWire(node.get("field_type").asText()) : null;
        if (type == null && present(node, "type")) {
            type = FieldType.fromWire(node.get("type").asText());
        }
        String description = present(node, "description") ? node.get("description").asText() : null;
        Boolean required = present(node, "required") ? node.get("required").asBoolean() : null;
        if (required == null && present(node.path("validation"), "required")) {
            required = node.get("validation").get("required").asBoolean();
        }
        FieldValidation validation = present(node, "validation")
                ? validationFromJson(node.get("validation"), FieldValidation.optional())
                : null;
        return new ChangeDetails(type, description, required, validation);
    }

    public ObjectNode impactToJson(ImpactAnalysis impact) {
        ObjectNode node = mapper.createObjectNode();
        node.put("breaking_change", impact.breakingChange());
        node.put("data_migration_required", impact.migrationRequired());
        ArrayNode affected = node.putArray("affected_fields");
        impact.affectedFields().forEach(affected::add);
        node.put("risk_level", impact.riskLevel().wireName());
        node.put("estimated_effort", impact.estimatedEffort());
        node.put("estimated_downtime", impact.estimatedDowntime());
        node.put("rollback_complexity", impact.rollbackComplexity());
        return node;
    }

    public ImpactAnalysis impactFromJson(JsonNode node) {
        List<String> affected = new ArrayList<>();
        node.path("affected_fields").forEach(n -> affected.add(n.asText()));
        return new ImpactAnalysis(
                node.path("breaking_change").asBoolean(false),
                node.path("data_migration_required").asBoolean(false),
                affected,
                RiskLevel.fromWire(node.path("risk_level").asText("low")),
                node.path("estimated_effort").asText("minimal"),
                node.path("estimated_downtime").asText("0 minutes"),
                node.path("rollback_complexity").asText("simple"));
    }

    public ObjectNode requestToJson(ChangeRequest r) {
        ObjectNode node = mapper.createObjectNode();
        node.put("request_id", r.id());
        node.put("change_type", r.changeType().wireName());
        node.put("field_name", r.fieldName());
        node.set("change_details", detailsToJson(r.details()));
        node.put("risk_level", r.riskLevel().wireName());
        node.put("required_approval_level", r.requiredApprovalLevel().wireName());
        node.put("proposed_by", r.proposedBy());
        node.put("proposed_at", r.proposedAt().toString());
        node.put("justification", r.justification());
        node.put("status", r.status().wireName());
        node.put("reviewed_by", r.reviewedBy());
        node.put("reviewed_at", r.reviewedAt() != null ? r.reviewedAt().toString() : null);
        node.put("review_comments", r.reviewComments());
        node.set("impact_analysis", impactToJson(r.impactAnalysis()));
        return node;
    }

    public ChangeRequest requestFromJson(JsonNode node) {
        String reviewedAt = textOrNull(node, "reviewed_at");
        return new ChangeRequest(
                node.get("request_id").asText(),
                ChangeType.fromWire(node.get("change_type").asText()),
                node.get("field_name").asText(),
                detailsFromJson(node.get("change_details")),
                RiskLevel.fromWire(node.get("risk_level").asText()),
                ApprovalLevel.fromWire(node.get("required_approval_level").asText()),
                textOrNull(node, "proposed_by"),
                parseInstant(textOrNull(node, "proposed_at")),
                textOrNull(node, "justification"),
                RequestStatus.fromWire(node.get("status").asText()),
                textOrNull(node, "reviewed_by"),
                reviewedAt != null ? parseInstant(reviewedAt) : null,
                textOrNull(node, "review_comments"),
                impactFromJson(node.path("impact_analysis")));
    }

    // --- Helpers ---

    /**
     * Parses a timestamp. Accepts ISO-8601 instants and offset-less local
     * date-times (with {@code T} or a space separator), the latter read as UTC.
     * A missing value maps to the epoch.
     */
    public static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text.trim().replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        }
    }

    /** Converts a JSON tree into plain Java values (maps, lists, strings, numbers). */
    public Object toPlain(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot convert JSON value: " + e.getOriginalMessage(), e);
        }
    }

    private List<Object> toList(JsonNode node) {
        List<Object> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> values.add(toPlain(n)));
        } else {
            values.add(toPlain(node));
        }
        return values;
    }

    private static boolean present(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    private static String textOrNull(JsonNode node, String field) {
        return present(node, field) ? node.get(field).asText() : null;
    }

    private static String versionText(SemanticVersion version) {
        return version != null ? version.toString() : null;
    }

    private static void putNullable(ObjectNode node, String field, Integer value) {
        if (value != null) {
            node.put(field, value);
        } else {
            node.putNull(field);
        }
    }

    private static void putNullable(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        } else {
            node.putNull(field);
        }
    }
}
