package io.schemagate.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.model.ChangeRequest;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores approval state as {@code approvals.json} in the storage directory,
 * so requests proposed by one process can be reviewed from another (the admin
 * CLI). Writes go through a temporary file and an atomic rename.
 */
public final class FileApprovalStore implements ApprovalStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileApprovalStore.class);

    public static final String APPROVALS_FILE = "approvals.json";

    private final Path file;
    private final SchemaJsonCodec codec;
    private final StoreFileValidator validator;

    public FileApprovalStore(Path directory, SchemaJsonCodec codec) {
        this.file = Objects.requireNonNull(directory, "directory must not be null").resolve(APPROVALS_FILE);
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.validator = StoreFileValidator.forResource(StoreFileValidator.APPROVALS_FILE_SCHEMA);
    }

    public Path file() {
        return file;
    }

    @Override
    public ApprovalState load() {
        Optional<JsonNode> doc = StoreFiles.readIfPresent(codec.mapper(), file);
        if (doc.isEmpty()) {
            return ApprovalState.empty();
        }
        validator.check(doc.get(), file.toString());
        List<ChangeRequest> pending = readRequests(doc.get().get("pending"));
        List<ChangeRequest> history = readRequests(doc.get().get("history"));
        LOG.debug("Loaded {}: pending={}, history={}", file, pending.size(), history.size());
        return new ApprovalState(pending, history);
    }

    @Override
    public void save(ApprovalState state) {
        ObjectNode doc = codec.mapper().createObjectNode();
        ArrayNode pending = doc.putArray("pending");
        state.pending().forEach(r -> pending.add(codec.requestToJson(r)));
        ArrayNode history = doc.putArray("history");
        state.history().forEach(r -> history.add(codec.requestToJson(r)));
        StoreFiles.writeAtomically(codec.mapper(), file, doc);
    }

    private List<ChangeRequest> readRequests(JsonNode array) {
        List<ChangeRequest> requests = new ArrayList<>();
        for (JsonNode node : array) {
            requests.add(SchemaStore.decode(file, () -> codec.requestFromJson(node)));
        }
        return requests;
    }
}
