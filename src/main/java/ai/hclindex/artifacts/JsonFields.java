package ai.hclindex.artifacts;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient field access for state and plan documents: wrong types read as absent.
 */
final class JsonFields {

    private JsonFields() {
    }

    static String text(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    static String textOr(JsonNode node, String field, String fallback) {
        final String value = text(node, field);
        return value != null ? value : fallback;
    }

    static Long integer(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isIntegralNumber() ? value.longValue() : null;
    }

    /**
     * The field when it is a JSON object, otherwise null.
     */
    static JsonNode object(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isObject() ? value : null;
    }

    /**
     * The field as a present-but-possibly-null JSON value (null when missing).
     */
    static JsonNode any(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        return value == null || value.isMissingNode() ? null : value;
    }

    static List<JsonNode> array(JsonNode node, String field) {
        final List<JsonNode> out = new ArrayList<>();
        final JsonNode value = node.get(field);
        if (value != null && value.isArray()) {
            value.forEach(out::add);
        }
        return out;
    }

    /**
     * "data" for data sources, "managed" for everything else.
     */
    static String mode(JsonNode node) {
        return "data".equals(text(node, "mode")) ? "data" : "managed";
    }

    /**
     * {@code resource.TYPE.NAME} or {@code data.TYPE.NAME}, for entries that carry no address.
     */
    static String address(JsonNode node) {
        final String prefix = "data".equals(mode(node)) ? "data" : "resource";
        return prefix + "." + textOr(node, "type", "unknown") + "." + textOr(node, "name", "unknown");
    }
}
