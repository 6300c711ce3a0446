package io.schemagate.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemagate.core.error.SchemaStoreException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** File helpers shared by the JSON-backed stores. */
final class StoreFiles {

    private static final Logger LOG = LoggerFactory.getLogger(StoreFiles.class);

    private StoreFiles() {
        // utility
    }

    /**
     * Reads a JSON file. Returns empty when the file does not exist.
     *
     * @throws SchemaStoreException if the file exists but cannot be read or parsed
     */
    static Optional<JsonNode> readIfPresent(ObjectMapper mapper, Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new SchemaStoreException(
                    "Failed to read or parse " + file + ": " + e.getMessage(), e, file.toString());
        }
    }

    /**
     * Writes {@code document} to a temporary file next to {@code target} and
     * moves it into place, so readers see either the old or the new content.
     * Falls back to a plain replacing move on file systems without atomic
     * rename.
     *
     * @throws SchemaStoreException on any I/O failure; the target is left untouched
     */
    static void writeAtomically(ObjectMapper mapper, Path target, JsonNode document) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, document);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported in {}, using replacing move", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Wrote {}", target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new SchemaStoreException("Failed to write " + target + ": " + e.getMessage(), e, target.toString());
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary file {}", tmp, e);
        }
    }
}
