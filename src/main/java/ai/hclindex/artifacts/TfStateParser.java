package ai.hclindex.artifacts;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Normalizes state files. Unknown or mistyped fields are read as absent rather than rejected;
 * only unreadable JSON fails.
 */
public final class TfStateParser {

    private static final Logger log = LoggerFactory.getLogger(TfStateParser.class);

    private final ObjectMapper mapper;

    public TfStateParser() {
        this(new ObjectMapper());
    }

    public TfStateParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public StateFile parseFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        log.info("Parsing state {}", file);
        return parse(mapper.readTree(file.toFile()), file.toString());
    }

    public StateFile parse(JsonNode root, String source) {
        final JsonNode data = root != null && root.isObject() ? root : MissingNode.getInstance();

        final List<StateFile.Resource> resources = new ArrayList<>();
        for (JsonNode resource : JsonFields.array(data, "resources")) {
            resources.add(resource(resource.isObject() ? resource : MissingNode.getInstance()));
        }

        final Map<String, StateFile.Output> outputs = new LinkedHashMap<>();
        final JsonNode rawOutputs = JsonFields.object(data, "outputs");
        if (rawOutputs != null) {
            final Iterator<Map.Entry<String, JsonNode>> fields = rawOutputs.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                outputs.put(field.getKey(), output(field.getValue()));
            }
        }

        return new StateFile(
                version(data.get("version")),
                JsonFields.text(data, "terraform_version"),
                JsonFields.integer(data, "serial"),
                JsonFields.text(data, "lineage"),
                outputs,
                resources,
                source);
    }

    private static StateFile.Resource resource(JsonNode data) {
        final List<StateFile.Instance> instances = new ArrayList<>();
        for (JsonNode instance : JsonFields.array(data, "instances")) {
            instances.add(instance(instance.isObject() ? instance : MissingNode.getInstance()));
        }
        return new StateFile.Resource(
                JsonFields.text(data, "module"),
                JsonFields.mode(data),
                JsonFields.textOr(data, "type", "unknown"),
                JsonFields.textOr(data, "name", "unknown"),
                JsonFields.text(data, "provider"),
                instances);
    }

    private static StateFile.Instance instance(JsonNode data) {
        JsonNode indexKey = data.get("index_key");
        if (!isKey(indexKey)) {
            indexKey = data.get("index");
        }
        JsonNode attributes = JsonFields.object(data, "attributes");
        if (attributes == null) {
            attributes = JsonFields.object(data, "attributes_flat");
        }
        return new StateFile.Instance(isKey(indexKey) ? indexKey : null, attributes, JsonFields.text(data, "status"));
    }

    private static boolean isKey(JsonNode node) {
        return node != null && (node.isTextual() || node.isIntegralNumber());
    }

    /**
     * Outputs are normally {@code {value, type, sensitive}}; anything else is taken as the bare value.
     */
    private static StateFile.Output output(JsonNode node) {
        if (node != null && node.isObject()) {
            final JsonNode sensitive = node.get("sensitive");
            return new StateFile.Output(
                    node.has("value") ? node.get("value") : node,
                    JsonFields.any(node, "type"),
                    sensitive != null && sensitive.asBoolean(false));
        }
        return new StateFile.Output(node, null, false);
    }

    private static int version(JsonNode node) {
        if (node == null) {
            return 0;
        }
        if (node.isIntegralNumber()) {
            return node.intValue();
        }
        if (node.isTextual() && node.asText().matches("\\d+")) {
            try {
                return Integer.parseInt(node.asText());
            } catch (NumberFormatException tooLarge) {
                return 0;
            }
        }
        return 0;
    }
}
