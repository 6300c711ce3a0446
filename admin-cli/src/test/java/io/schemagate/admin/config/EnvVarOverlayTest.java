package io.schemagate.admin.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Environment variables take precedence over YAML values. A variable is
 * "set" only when it is defined and its trimmed value is non-empty.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Test
    void storageDirOverridesYaml() {
        envVars.put("SCHEMAGATE_STORAGE_DIR", "/override");
        assertThat(ConfigLoader.load(fullConfigPath, envLookup()).storageDir()).isEqualTo(Path.of("/override"));
    }

    @Test
    void reviewerListsAreCommaSeparated() {
        envVars.put("SCHEMAGATE_REVIEWERS", " dave , erin,,");
        envVars.put("SCHEMAGATE_ADMINS", "frank");

        AdminConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.reviewers()).containsExactlyInAnyOrder("dave", "erin");
        assertThat(config.admins()).containsExactly("frank");
    }

    @Test
    void loggingOverridesYaml() {
        envVars.put("LOG_FORMAT", "text");
        envVars.put("LOG_LEVEL", "WARN");

        AdminConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("WARN");
    }

    @Test
    void suggestionRatesOverrideYaml() {
        envVars.put("SCHEMAGATE_SUGGEST_UNKNOWN_MIN_RATE", "0.3");
        envVars.put("SCHEMAGATE_SUGGEST_DEPRECATE_BELOW_RATE", "0.2");
        envVars.put("SCHEMAGATE_SUGGEST_REQUIRE_ABOVE_RATE", "0.8");

        AdminConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.suggestionPolicy().unknownFieldMinRate()).isEqualTo(0.3);
        assertThat(config.suggestionPolicy().deprecateBelowRate()).isEqualTo(0.2);
        assertThat(config.suggestionPolicy().requireAboveRate()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Blank values are treated as unset")
    void blankValuesAreIgnored() {
        envVars.put("SCHEMAGATE_STORAGE_DIR", "   ");
        envVars.put("SCHEMAGATE_REVIEWERS", "");

        AdminConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.storageDir()).isEqualTo(Path.of("/var/lib/schemagate"));
        assertThat(config.reviewers()).containsExactlyInAnyOrder("alice", "bob");
    }

    @Test
    void nonNumericRateIsReported() {
        envVars.put("SCHEMAGATE_SUGGEST_REQUIRE_ABOVE_RATE", "high");
        assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("SCHEMAGATE_SUGGEST_REQUIRE_ABOVE_RATE");
    }
}
