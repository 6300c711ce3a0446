package io.schemagate.admin;

import io.schemagate.admin.cli.SchemaAdminCli;
import io.schemagate.admin.config.AdminConfig;
import io.schemagate.admin.config.ConfigLoader;
import io.schemagate.core.Schemagate;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the schema admin tool.
 *
 * <p>
 * Loads configuration, sets up logging, opens the storage directory and runs
 * one {@link SchemaAdminCli} command. Startup failures are logged and end
 * the process with exit code 1.
 */
public final class SchemaAdminMain {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaAdminMain.class);

    private SchemaAdminMain() {
        // utility class
    }

    /** @param args {@code [--config path] <command> ...} */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code;
        try {
            code = run(args, Path.of("").toAbsolutePath(), System::getenv, System.out);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            code = SchemaAdminCli.EXIT_ERROR;
        }
        System.exit(code);
    }

    /**
     * Runs one command.
     *
     * @throws io.schemagate.admin.config.ConfigLoadException if configuration is invalid
     * @throws io.schemagate.core.error.SchemaStoreException  if the stored files cannot be loaded
     */
    static int run(String[] args, Path workingDir, Function<String, String> envLookup, PrintStream out) {
        AdminConfig config = ConfigLoader.resolve(args, workingDir, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.debug("Using storage directory {}", config.storageDir().toAbsolutePath());

        Schemagate schemagate = Schemagate.builder()
                .storageDir(config.storageDir())
                .reviewers(config.reviewers())
                .admins(config.admins())
                .suggestionPolicy(config.suggestionPolicy())
                .build();
        SchemaAdminCli cli = new SchemaAdminCli(schemagate.gate(), schemagate.engine(), out);
        return cli.run(withoutConfigOption(args));
    }

    static List<String> withoutConfigOption(String[] args) {
        List<String> rest = new ArrayList<>(Arrays.asList(args));
        int i = rest.indexOf("--config");
        if (i >= 0) {
            rest.remove(i);
            if (i < rest.size()) {
                rest.remove(i);
            }
        }
        return rest;
    }
}
