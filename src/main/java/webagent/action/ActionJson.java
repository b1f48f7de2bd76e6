package webagent.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webagent.model.Candidate;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * Serializes {@link Action}s and candidate lists to their JSON wire shapes and
 * validates action JSON against {@code action-schema.json}.
 *
 * <p>The schema pins the exact field set of every variant, so a validated action
 * has no extra and no missing fields.
 */
public final class ActionJson {

    private static final Logger log = LoggerFactory.getLogger(ActionJson.class);
    private static final String SCHEMA_RESOURCE = "/action-schema.json";

    /** Singleton ObjectMapper; thread-safe after configuration. */
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    /** Loaded once from classpath; null until first use. */
    private static volatile JsonSchema ACTION_SCHEMA = null;

    private ActionJson() {}

    // ── Serialization ─────────────────────────────────────────────────────

    /**
     * Serializes an action to its flat, {@code type}-tagged JSON object.
     */
    public static String toJson(Action action) {
        try {
            return MAPPER.writerFor(Action.class).writeValueAsString(action);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + action, e);
        }
    }

    /** Serializes an action to a Jackson tree. */
    public static JsonNode toJsonTree(Action action) {
        try {
            return MAPPER.readTree(toJson(action));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot re-read serialized " + action, e);
        }
    }

    /** Serializes a candidate list as the JSON array handed to the prompt builder. */
    public static String toJson(List<Candidate> candidates) {
        try {
            return MAPPER.writeValueAsString(candidates);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize candidate list", e);
        }
    }

    /** Reads an action back from its wire JSON. */
    public static Action fromJson(String json) throws IOException {
        return MAPPER.readValue(json, Action.class);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    /**
     * Serializes and validates an action in one step.
     *
     * @throws ActionSchemaException if the JSON does not match its variant's shape
     */
    public static JsonNode toValidatedTree(Action action) {
        JsonNode tree = toJsonTree(action);
        validate(tree);
        return tree;
    }

    /**
     * Validates action JSON against the bundled schema.
     *
     * @param actionJson one serialized action
     * @throws ActionSchemaException listing every violation when the JSON is invalid
     */
    public static void validate(JsonNode actionJson) {
        Set<ValidationMessage> errors = getSchema().validate(actionJson);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Action schema validation failed for ")
                    .append(actionJson).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new ActionSchemaException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (ACTION_SCHEMA == null) {
            synchronized (ActionJson.class) {
                if (ACTION_SCHEMA == null) {
                    try (InputStream is = ActionJson.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        ACTION_SCHEMA = factory.getSchema(is);
                        log.debug("Action schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        throw new IllegalStateException("Failed to load " + SCHEMA_RESOURCE, e);
                    }
                }
            }
        }
        return ACTION_SCHEMA;
    }
}
