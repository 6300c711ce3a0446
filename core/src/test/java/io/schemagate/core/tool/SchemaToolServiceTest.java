package io.schemagate.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.Schemagate;
import io.schemagate.core.store.InMemoryApprovalStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SchemaToolService")
class SchemaToolServiceTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private SchemaToolService tools;

    @BeforeEach
    void setUp() {
        tools = Schemagate.builder()
                .storageDir(dir)
                .clock(CLOCK)
                .approvalStore(new InMemoryApprovalStore())
                .build()
                .tools();
    }

    private static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static final String COMPLIANT = """
            {"content_id": "x", "title": "t", "content_type": "experience",
             "created_at": "2024-01-15T10:30:00", "updated_at": "2024-01-15T10:30:00"}
            """;

    @Test
    void describesTheBootstrapSchema() {
        ObjectNode schema = tools.getCurrentSchema();

        assertThat(schema.get("success").asBoolean()).isTrue();
        assertThat(schema.get("schema_version").asText()).isEqualTo("1.0.0");
        assertThat(schema.get("total_fields").asInt()).isEqualTo(5);
        assertThat(schema.get("core_fields_count").asInt()).isEqualTo(5);
        assertThat(schema.at("/fields/title/required").asBoolean()).isTrue();
    }

    @Nested
    @DisplayName("Field changes")
    class FieldChanges {

        @Test
        void optionalAddIsAppliedImmediately() {
            ObjectNode out = tools.addField("priority", "string", "Priority", false,
                    json("{\"allowed_values\": [\"low\", \"high\"]}"));

            assertThat(out.get("success").asBoolean()).isTrue();
            assertThat(out.get("status").asText()).isEqualTo("approved");
            assertThat(out.get("schema_version").asText()).isEqualTo("1.1.0");
            assertThat(out.at("/field/type").asText()).isEqualTo("string");
        }

        @Test
        void requiredAddIsLeftPending() {
            ObjectNode out = tools.addField("tag", "list", "Tag", true, null);

            assertThat(out.get("success").asBoolean()).isTrue();
            assertThat(out.get("status").asText()).isEqualTo("pending");
            assertThat(out.get("required_approval_level").asText()).isEqualTo("reviewer");
            assertThat(tools.getPendingRequests("schema_reviewer").get("count").asInt()).isEqualTo(1);
        }

        @Test
        void unknownTypeIsAnErrorResponse() {
            ObjectNode out = tools.addField("x", "blob", "", false, null);
            assertThat(out.get("success").asBoolean()).isFalse();
            assertThat(out.get("error").asText()).isNotBlank();
        }

        @Test
        void invalidNameIsAnErrorResponse() {
            ObjectNode out = tools.addField("1bad", "string", "", false, null);
            assertThat(out.get("success").asBoolean()).isFalse();
        }

        @Test
        void modifyOfMissingFieldIsAnErrorResponse() {
            ObjectNode out = tools.modifyField("ghost", null, "new", null, null);
            assertThat(out.get("success").asBoolean()).isFalse();
            assertThat(out.get("error").asText()).contains("does not exist");
        }

        @Test
        void descriptionOnlyModifyIsApplied() {
            tools.addField("priority", "string", "Priority", false, null);
            ObjectNode out = tools.modifyField("priority", null, "Urgency", null, null);

            assertThat(out.get("status").asText()).isEqualTo("approved");
            assertThat(tools.getCurrentSchema().at("/fields/priority/description").asText()).isEqualTo("Urgency");
        }

        @Test
        @DisplayName("Making a field required through validation rules waits for a reviewer")
        void requiredInValidationRulesIsReviewed() {
            tools.addField("priority", "string", "Priority", false, null);

            ObjectNode out = tools.modifyField("priority", null, null, null, json("{\"required\": true}"));

            assertThat(out.get("status").asText()).isEqualTo("pending");
            assertThat(out.get("risk_level").asText()).isEqualTo("medium");
            assertThat(tools.getCurrentSchema().at("/fields/priority/required").asBoolean()).isFalse();
        }

        @Test
        void validationOnlyModifyKeepsTheRequiredFlag() {
            tools.addField("priority", "string", "Priority", false, null);

            ObjectNode out = tools.modifyField("priority", null, null, null, json("{\"max_length\": 5}"));

            assertThat(out.get("status").asText()).isEqualTo("approved");
            assertThat(out.get("risk_level").asText()).isEqualTo("low");
            assertThat(tools.getCurrentSchema().at("/fields/priority/required").asBoolean()).isFalse();
        }

        @Test
        void removalNeedsAnAdmin() {
            tools.addField("priority", "string", "Priority", false, null);
            ObjectNode out = tools.removeField("priority");

            assertThat(out.get("status").asText()).isEqualTo("pending");
            assertThat(out.get("required_approval_level").asText()).isEqualTo("admin");
        }
    }

    @Nested
    @DisplayName("Validation and analysis")
    class Analysis {

        @Test
        void validRecord() {
            ObjectNode out = tools.validateData(json(COMPLIANT), null);
            assertThat(out.get("is_valid").asBoolean()).isTrue();
            assertThat(out.get("error_count").asInt()).isZero();
        }

        @Test
        void missingContentIdIsReported() {
            ObjectNode record = (ObjectNode) json(COMPLIANT);
            record.remove("content_id");

            ObjectNode out = tools.validateData(record, "1.0.0");

            assertThat(out.get("is_valid").asBoolean()).isFalse();
            assertThat(out.get("validation_errors")).hasSize(1);
            assertThat(out.at("/validation_errors/0").asText()).contains("content_id");
        }

        @Test
        void nonObjectRecordIsAnError() {
            assertThat(tools.validateData(json("[1, 2]"), null).get("success").asBoolean()).isFalse();
        }

        @Test
        void malformedVersionIsAnError() {
            assertThat(tools.validateData(json(COMPLIANT), "one").get("success").asBoolean()).isFalse();
        }

        @Test
        void emptySamplesAreAnError() {
            assertThat(tools.analyzeUsage(json("[]")).get("success").asBoolean()).isFalse();
            assertThat(tools.getSuggestions(json("[]")).get("success").asBoolean()).isFalse();
        }

        @Test
        void suggestionsAreSortedByPriority() {
            tools.addField("rare", "string", "", false, null);
            ObjectNode sample = (ObjectNode) json(COMPLIANT);
            sample.put("mood", "happy");

            ObjectNode out = tools.getSuggestions(JSON.createArrayNode().add(sample).add(json(COMPLIANT)));

            assertThat(out.get("success").asBoolean()).isTrue();
            assertThat(out.get("suggestion_count").asInt()).isEqualTo(2);
            assertThat(out.at("/suggestions/0/priority").asText()).isEqualTo("medium");
            assertThat(out.at("/suggestions/0/field_name").asText()).isEqualTo("mood");
            assertThat(out.at("/suggestions/1/type").asText()).isEqualTo("deprecate_field");
        }
    }

    @Test
    void historySummarisesVersions() {
        tools.addField("a", "string", "", false, null);

        ObjectNode out = tools.getEvolutionHistory();

        assertThat(out.get("total_versions").asInt()).isEqualTo(2);
        assertThat(out.get("total_migrations").asInt()).isEqualTo(1);
        assertThat(out.at("/summary/latest_version").asText()).isEqualTo("1.1.0");
        assertThat(out.at("/summary/most_changes").asText()).isEqualTo("1.1.0");
    }

    @Nested
    @DisplayName("Approval workflow")
    class Workflow {

        @Test
        void createAndReviewRequest() {
            ObjectNode created = tools.createChangeRequest(
                    "add_field", "tag", json("{\"field_type\": \"list\", \"required\": true}"), "alice", "triage");
            String id = created.get("request_id").asText();
            assertThat(created.get("status").asText()).isEqualTo("pending");
            assertThat(created.at("/impact_analysis/data_migration_required").asBoolean()).isTrue();

            ObjectNode reviewed = tools.reviewRequest(id, "schema_reviewer", "approve", "ok");

            assertThat(reviewed.get("success").asBoolean()).isTrue();
            assertThat(reviewed.get("status").asText()).isEqualTo("approved");
            assertThat(tools.getApprovalHistory().get("count").asInt()).isEqualTo(1);
        }

        @Test
        void unauthorizedReviewIsAnErrorResponse() {
            String id = tools.removeField("content_id").get("request_id").asText();

            ObjectNode out = tools.reviewRequest(id, "schema_reviewer", "approve", "");

            assertThat(out.get("success").asBoolean()).isFalse();
            assertThat(tools.getPendingRequests(null).get("count").asInt()).isEqualTo(1);
        }

        @Test
        void unknownActionIsAnErrorResponse() {
            ObjectNode out = tools.reviewRequest("id", "admin", "maybe", "");
            assertThat(out.get("success").asBoolean()).isFalse();
        }

        @Test
        void unknownChangeTypeIsAnErrorResponse() {
            ObjectNode out = tools.createChangeRequest("drop_table", "x", null, "alice", "");
            assertThat(out.get("success").asBoolean()).isFalse();
        }
    }
}
