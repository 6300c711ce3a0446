package io.schemagate.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemagate.core.approval.ChangeApprovalGate;
import io.schemagate.core.approval.ReviewerDirectory;
import io.schemagate.core.engine.SchemaEvolutionEngine;
import io.schemagate.core.engine.SuggestionPolicy;
import io.schemagate.core.registry.SchemaRegistry;
import io.schemagate.core.spi.GovernanceListener;
import io.schemagate.core.store.ApprovalStore;
import io.schemagate.core.store.FileApprovalStore;
import io.schemagate.core.store.SchemaJsonCodec;
import io.schemagate.core.store.SchemaStore;
import io.schemagate.core.tool.SchemaToolService;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Set;

/**
 * Wires the registry, evolution engine, approval gate and tool facade over one
 * storage directory. Build it once at process start and hand the pieces to
 * whoever needs them; there is no global instance.
 *
 * <pre>{@code
 * Schemagate schemagate = Schemagate.builder()
 *         .storageDir(Path.of("./schema_storage"))
 *         .build();
 * schemagate.tools().addField("priority", "string", "Priority", false, null);
 * }</pre>
 */
public final class Schemagate {

    private final SchemaRegistry registry;
    private final SchemaEvolutionEngine engine;
    private final ChangeApprovalGate gate;
    private final SchemaToolService tools;
    private final SchemaJsonCodec codec;

    private Schemagate(Builder b) {
        this.codec = new SchemaJsonCodec(b.mapper != null ? b.mapper : new ObjectMapper());
        this.registry = SchemaRegistry.open(new SchemaStore(b.storageDir, codec), b.clock);
        this.engine = new SchemaEvolutionEngine(registry, b.suggestionPolicy, b.listener);
        ApprovalStore approvals =
                b.approvalStore != null ? b.approvalStore : new FileApprovalStore(b.storageDir, codec);
        this.gate = new ChangeApprovalGate(
                engine, new ReviewerDirectory(b.reviewers, b.admins), approvals, b.clock, b.listener);
        this.tools = new SchemaToolService(engine, gate, codec);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public SchemaEvolutionEngine engine() {
        return engine;
    }

    public ChangeApprovalGate gate() {
        return gate;
    }

    public SchemaToolService tools() {
        return tools;
    }

    public SchemaJsonCodec codec() {
        return codec;
    }

    /** Builder for {@link Schemagate}. Only the storage directory is mandatory. */
    public static final class Builder {

        private Path storageDir;
        private Set<String> reviewers = ReviewerDirectory.DEFAULT_REVIEWERS;
        private Set<String> admins = ReviewerDirectory.DEFAULT_ADMINS;
        private SuggestionPolicy suggestionPolicy = SuggestionPolicy.DEFAULT;
        private GovernanceListener listener = GovernanceListener.NONE;
        private Clock clock = Clock.systemUTC();
        private ApprovalStore approvalStore;
        private ObjectMapper mapper;

        Builder() {}

        /** Directory holding {@code schemas.json}, {@code migrations.json} and {@code approvals.json}. */
        public Builder storageDir(Path storageDir) {
            this.storageDir = storageDir;
            return this;
        }

        public Builder reviewers(Set<String> reviewers) {
            this.reviewers = reviewers;
            return this;
        }

        public Builder admins(Set<String> admins) {
            this.admins = admins;
            return this;
        }

        public Builder suggestionPolicy(SuggestionPolicy suggestionPolicy) {
            this.suggestionPolicy = suggestionPolicy;
            return this;
        }

        public Builder listener(GovernanceListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Overrides the default file-backed approval store. */
        public Builder approvalStore(ApprovalStore approvalStore) {
            this.approvalStore = approvalStore;
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        /**
         * Loads (or bootstraps) the stored state and wires the components.
         *
         * @throws io.schemagate.core.error.SchemaStoreException if stored files are unreadable or malformed
         */
        public Schemagate build() {
            Objects.requireNonNull(storageDir, "storageDir must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            Objects.requireNonNull(suggestionPolicy, "suggestionPolicy must not be null");
            return new Schemagate(this);
        }
    }
}
