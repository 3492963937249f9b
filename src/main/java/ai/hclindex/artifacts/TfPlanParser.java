package ai.hclindex.artifacts;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Normalizes JSON plans: the planned root module tree and the list of resource changes.
 */
public final class TfPlanParser {

    private static final Logger log = LoggerFactory.getLogger(TfPlanParser.class);

    private final ObjectMapper mapper;

    public TfPlanParser() {
        this(new ObjectMapper());
    }

    public TfPlanParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public PlanFile parseFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        log.info("Parsing plan {}", file);
        return parse(mapper.readTree(file.toFile()), file.toString());
    }

    public PlanFile parse(JsonNode root, String source) {
        final JsonNode data = root != null && root.isObject() ? root : MissingNode.getInstance();

        PlanFile.PlannedValues planned = null;
        final JsonNode plannedValues = JsonFields.object(data, "planned_values");
        if (plannedValues != null) {
            final JsonNode rootModule = JsonFields.object(plannedValues, "root_module");
            planned = new PlanFile.PlannedValues(module(rootModule != null ? rootModule : MissingNode.getInstance()));
        }

        final List<PlanFile.ResourceChange> changes = new ArrayList<>();
        for (JsonNode change : JsonFields.array(data, "resource_changes")) {
            changes.add(resourceChange(change.isObject() ? change : MissingNode.getInstance()));
        }

        return new PlanFile(
                JsonFields.text(data, "format_version"),
                JsonFields.text(data, "terraform_version"),
                planned,
                changes,
                source);
    }

    private static PlanFile.Module module(JsonNode data) {
        final List<PlanFile.Resource> resources = new ArrayList<>();
        for (JsonNode resource : JsonFields.array(data, "resources")) {
            resources.add(resource(resource.isObject() ? resource : MissingNode.getInstance()));
        }
        final List<PlanFile.Module> children = new ArrayList<>();
        for (JsonNode child : JsonFields.array(data, "child_modules")) {
            children.add(module(child.isObject() ? child : MissingNode.getInstance()));
        }
        return new PlanFile.Module(JsonFields.text(data, "address"), resources, children);
    }

    private static PlanFile.Resource resource(JsonNode data) {
        return new PlanFile.Resource(
                JsonFields.textOr(data, "address", JsonFields.address(data)),
                JsonFields.mode(data),
                JsonFields.textOr(data, "type", "unknown"),
                JsonFields.textOr(data, "name", "unknown"),
                JsonFields.text(data, "provider_name"),
                JsonFields.object(data, "values"));
    }

    private static PlanFile.ResourceChange resourceChange(JsonNode data) {
        final JsonNode change = JsonFields.object(data, "change");
        final JsonNode c = change != null ? change : MissingNode.getInstance();

        final List<String> actions = new ArrayList<>();
        for (JsonNode action : JsonFields.array(c, "actions")) {
            if (action.isTextual()) {
                actions.add(action.asText());
            }
        }

        return new PlanFile.ResourceChange(
                JsonFields.textOr(data, "address", JsonFields.address(data)),
                JsonFields.text(data, "module_address"),
                JsonFields.mode(data),
                JsonFields.textOr(data, "type", "unknown"),
                JsonFields.textOr(data, "name", "unknown"),
                JsonFields.text(data, "provider_name"),
                new PlanFile.Change(
                        actions,
                        JsonFields.any(c, "before"),
                        JsonFields.any(c, "after"),
                        JsonFields.object(c, "after_unknown"),
                        JsonFields.object(c, "before_sensitive"),
                        JsonFields.object(c, "after_sensitive")));
    }
}
