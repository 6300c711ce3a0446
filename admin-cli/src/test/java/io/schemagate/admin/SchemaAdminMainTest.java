package io.schemagate.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemagate.admin.cli.SchemaAdminCli;
import io.schemagate.admin.config.ConfigLoadException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaAdminMainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void configOptionIsStrippedBeforeTheCommand() {
        assertThat(SchemaAdminMain.withoutConfigOption(new String[] {"--config", "a.yaml", "list", "--reviewer", "x"}))
                .containsExactly("list", "--reviewer", "x");
        assertThat(SchemaAdminMain.withoutConfigOption(new String[] {"schema"})).containsExactly("schema");
    }

    @Test
    void runsACommandAgainstTheConfiguredStorage() throws Exception {
        Path storage = dir.resolve("storage");
        Path config = Files.writeString(
                dir.resolve("admin.yaml"), "storage:\n  dir: " + storage.toString().replace('\\', '/') + "\n");

        String[] args = {"--config", config.toString(), "request", "add", "mood", "string"};
        int code = SchemaAdminMain.run(args, dir, name -> null, out);

        assertThat(code).isEqualTo(SchemaAdminCli.EXIT_OK);
        assertThat(storage.resolve("schemas.json")).exists();
        assertThat(storage.resolve("approvals.json")).exists();
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("approved");
    }

    @Test
    void environmentSelectsStorageWithoutAConfigFile() {
        Path storage = dir.resolve("env-storage");

        int code = SchemaAdminMain.run(
                new String[] {"schema"}, dir, Map.of("SCHEMAGATE_STORAGE_DIR", storage.toString())::get, out);

        assertThat(code).isEqualTo(SchemaAdminCli.EXIT_OK);
        assertThat(storage.resolve("schemas.json")).exists();
    }

    @Test
    void missingExplicitConfigFails() {
        String[] args = {"--config", dir.resolve("missing.yaml").toString(), "schema"};
        assertThatThrownBy(() -> SchemaAdminMain.run(args, dir, name -> null, out))
                .isInstanceOf(ConfigLoadException.class);
    }
}
