package io.schemagate.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemagate.core.error.SchemaStoreException;
import io.schemagate.core.model.ApprovalLevel;
import io.schemagate.core.model.ChangeDetails;
import io.schemagate.core.model.ChangeRequest;
import io.schemagate.core.model.ChangeType;
import io.schemagate.core.model.FieldType;
import io.schemagate.core.model.ImpactAnalysis;
import io.schemagate.core.model.RequestStatus;
import io.schemagate.core.model.RiskLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileApprovalStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path dir;

    private FileApprovalStore store;

    @BeforeEach
    void setUp() {
        store = new FileApprovalStore(dir, new SchemaJsonCodec(new ObjectMapper()));
    }

    private static ChangeRequest pendingRequest(String id) {
        return new ChangeRequest(
                id,
                ChangeType.ADD_FIELD,
                "priority",
                new ChangeDetails(FieldType.STRING, "Priority", true, null),
                RiskLevel.MEDIUM,
                ApprovalLevel.REVIEWER,
                "alice",
                T0,
                "needed for triage",
                RequestStatus.PENDING,
                null,
                null,
                null,
                new ImpactAnalysis(false, true, List.of("priority"), RiskLevel.MEDIUM, "moderate", "5-10 minutes",
                        "simple"));
    }

    @Test
    void loadsEmptyStateWhenFileIsMissing() {
        assertThat(store.load()).isEqualTo(ApprovalState.empty());
    }

    @Test
    void reopenedStoreReturnsSameRequests() {
        ChangeRequest open = pendingRequest("r-1");
        ChangeRequest decided = pendingRequest("r-2")
                .finalized(RequestStatus.APPROVED, "admin", T0.plusSeconds(60), "ok");
        store.save(new ApprovalState(List.of(open), List.of(decided)));

        ApprovalState reloaded = new FileApprovalStore(dir, new SchemaJsonCodec(new ObjectMapper())).load();

        assertThat(reloaded.pending()).containsExactly(open);
        assertThat(reloaded.history()).containsExactly(decided);
    }

    @Test
    void rejectsFileMissingSections() throws IOException {
        Files.writeString(store.file(), "{\"pending\": []}");
        assertThatThrownBy(store::load).isInstanceOf(SchemaStoreException.class);
    }

    @Test
    void rejectsUnknownStatus() throws IOException {
        Files.writeString(store.file(), """
                {"pending": [], "history": [{
                    "request_id": "x", "change_type": "add_field", "field_name": "f",
                    "risk_level": "low", "required_approval_level": "automatic",
                    "status": "maybe"
                }]}
                """);
        assertThatThrownBy(store::load).isInstanceOf(SchemaStoreException.class);
    }
}
