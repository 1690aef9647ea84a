package io.bridgeconfig.core.canonical;

import static io.bridgeconfig.core.canonical.FieldNames.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.bridgeconfig.core.error.ConfigIssue;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Structural JSON Schema (2020-12) of a state file without its checksum: required members,
 * JSON types and no unknown members. Value ranges are not part of the schema; they are
 * enforced by the model records.
 *
 * <p>
 * The schema is derived from {@link FieldNames}. Thread-safe.
 */
public final class StateFileSchema {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /** Chain id keys as accepted before normalization: optional whitespace and sign. */
    static final String CHAIN_KEY_PATTERN = "^\\s*[+-]?[0-9]+\\s*$";

    private static final ObjectNode SCHEMA_NODE = buildSchema();
    private static final JsonSchema SCHEMA = SCHEMA_FACTORY.getSchema(SCHEMA_NODE);

    private StateFileSchema() {}

    /** The schema document, for tooling that wants to publish it. Returns a copy. */
    public static ObjectNode document() {
        return SCHEMA_NODE.deepCopy();
    }

    /**
     * Validates the structure of {@code data} and returns one issue per violation, in the
     * order the validator reports them. An empty list means the structure is valid.
     */
    public static List<ConfigIssue> validate(JsonNode data) {
        Set<ValidationMessage> messages = SCHEMA.validate(data);
        List<ConfigIssue> issues = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            String path = message.getInstanceLocation().toString();
            issues.add(new ConfigIssue(path, stripLocation(message.getMessage(), path)));
        }
        return issues;
    }

    private static String stripLocation(String message, String path) {
        String prefix = path + ": ";
        return message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }

    private static ObjectNode buildSchema() {
        ObjectNode token = strictObject(TOKEN_FIELDS);
        integer(token, TRANSFER_LIMIT);
        integer(token, ETH_IN_TOKEN);

        ObjectNode chain = strictObject(CHAIN_FIELDS);
        integer(chain, FINALITY_PERIOD);
        integer(chain, TARGET_WEIGHT_PPM);
        integer(chain, TRANSFER_COST);

        ObjectNode requestManager = strictObject(REQUEST_MANAGER_FIELDS);
        integer(requestManager, MIN_FEE_PPM);
        integer(requestManager, LP_FEE_PPM);
        integer(requestManager, PROTOCOL_FEE_PPM);
        ObjectNode chains = property(requestManager, CHAINS).put("type", "object");
        chains.putObject("propertyNames").put("pattern", CHAIN_KEY_PATTERN);
        chains.set("additionalProperties", chain);
        property(requestManager, TOKENS).put("type", "object").set("additionalProperties", token);
        stringArray(requestManager, WHITELIST);

        ObjectNode fillManager = strictObject(FILL_MANAGER_FIELDS);
        stringArray(fillManager, WHITELIST);

        ObjectNode root = strictObject(CONFIGURATION);
        integer(root, BLOCK);
        integer(root, CHAIN_ID);
        property(root, TOKEN_ADDRESSES)
                .put("type", "object")
                .putObject("additionalProperties")
                .put("type", "string");
        properties(root).set(REQUEST_MANAGER, requestManager);
        properties(root).set(FILL_MANAGER, fillManager);
        return root;
    }

    private static ObjectNode strictObject(List<String> required) {
        ObjectNode node = NODES.objectNode();
        node.put("type", "object");
        node.putObject("properties");
        ArrayNode requiredNode = node.putArray("required");
        for (String name : required) {
            requiredNode.add(name);
        }
        node.put("additionalProperties", false);
        return node;
    }

    private static ObjectNode properties(ObjectNode object) {
        return (ObjectNode) object.get("properties");
    }

    private static ObjectNode property(ObjectNode object, String name) {
        return properties(object).putObject(name);
    }

    private static void integer(ObjectNode object, String name) {
        property(object, name).put("type", "integer");
    }

    private static void stringArray(ObjectNode object, String name) {
        property(object, name).put("type", "array").putObject("items").put("type", "string");
    }
}
