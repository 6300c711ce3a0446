package io.schemagate.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.schemagate.core.error.SchemaStoreException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * Structural check of a store file against its bundled JSON Schema
 * (draft 2020-12). Runs before any decoding so that a hand-edited or
 * truncated file fails with the full list of violations instead of the first
 * null pointer the decoder would hit.
 *
 * <p>
 * Thread-safe: compiled schemas are immutable.
 */
public final class StoreFileValidator {

    static final String SCHEMAS_FILE_SCHEMA = "/schemas/schemas-file.schema.json";
    static final String MIGRATIONS_FILE_SCHEMA = "/schemas/migrations-file.schema.json";
    static final String APPROVALS_FILE_SCHEMA = "/schemas/approvals-file.schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;
    private final String resource;

    private StoreFileValidator(JsonSchema schema, String resource) {
        this.schema = schema;
        this.resource = resource;
    }

    /**
     * Loads and compiles a bundled schema from the classpath.
     *
     * @param resource classpath location, e.g. {@value #SCHEMAS_FILE_SCHEMA}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static StoreFileValidator forResource(String resource) {
        try (InputStream in = StoreFileValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled schema not found on classpath: " + resource);
            }
            return new StoreFileValidator(SCHEMA_FACTORY.getSchema(in), resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled schema " + resource, e);
        }
    }

    /**
     * Validates {@code document} and throws if it does not conform.
     *
     * @param document parsed file contents
     * @param source   file path, reported in the exception
     * @throws SchemaStoreException listing every violation
     */
    public void check(JsonNode document, String source) {
        Set<ValidationMessage> errors = schema.validate(document);
        if (!errors.isEmpty()) {
            List<String> violations =
                    errors.stream().map(ValidationMessage::getMessage).sorted().toList();
            throw new SchemaStoreException(
                    "Malformed store file " + source + ": " + String.join("; ", violations), source, violations);
        }
    }

    public String resource() {
        return resource;
    }
}
