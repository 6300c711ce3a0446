package io.schemagate.admin.config;

import io.schemagate.core.approval.ReviewerDirectory;
import io.schemagate.core.engine.SuggestionPolicy;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Root configuration for the admin tool.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param storageDir       directory holding the schema, migration and approval files
 * @param reviewers        names allowed to decide reviewer-level requests
 * @param admins           names allowed to decide admin- and committee-level requests
 * @param suggestionPolicy thresholds used when suggesting schema improvements
 * @param loggingFormat    json or text
 * @param loggingLevel     root log level
 */
public record AdminConfig(
        Path storageDir,
        Set<String> reviewers,
        Set<String> admins,
        SuggestionPolicy suggestionPolicy,
        String loggingFormat,
        String loggingLevel) {

    public AdminConfig {
        Objects.requireNonNull(storageDir, "storageDir must not be null");
        reviewers = Set.copyOf(reviewers);
        admins = Set.copyOf(admins);
        Objects.requireNonNull(suggestionPolicy, "suggestionPolicy must not be null");
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link AdminConfig}. */
    public static final class Builder {
        private String storageDir = "./schema_storage";
        private Set<String> reviewers = ReviewerDirectory.DEFAULT_REVIEWERS;
        private Set<String> admins = ReviewerDirectory.DEFAULT_ADMINS;
        private double unknownFieldMinRate = SuggestionPolicy.DEFAULT.unknownFieldMinRate();
        private double deprecateBelowRate = SuggestionPolicy.DEFAULT.deprecateBelowRate();
        private double requireAboveRate = SuggestionPolicy.DEFAULT.requireAboveRate();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder storageDir(String storageDir) {
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

        public Builder unknownFieldMinRate(double rate) {
            this.unknownFieldMinRate = rate;
            return this;
        }

        public Builder deprecateBelowRate(double rate) {
            this.deprecateBelowRate = rate;
            return this;
        }

        public Builder requireAboveRate(double rate) {
            this.requireAboveRate = rate;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if the reviewer sets are empty or a rate is out of range
         */
        public AdminConfig build() {
            if (storageDir == null || storageDir.isBlank()) {
                throw new ConfigLoadException("storage.dir must not be blank");
            }
            if (reviewers == null || reviewers.isEmpty()) {
                throw new ConfigLoadException("approval.reviewers must name at least one reviewer");
            }
            if (admins == null || admins.isEmpty()) {
                throw new ConfigLoadException("approval.admins must name at least one admin");
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'json' or 'text', got '" + loggingFormat + "'");
            }
            SuggestionPolicy policy;
            try {
                policy = new SuggestionPolicy(unknownFieldMinRate, deprecateBelowRate, requireAboveRate);
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("Invalid suggestions configuration: " + e.getMessage(), e);
            }
            return new AdminConfig(
                    Path.of(storageDir), reviewers, admins, policy, loggingFormat.toLowerCase(), loggingLevel);
        }
    }
}
