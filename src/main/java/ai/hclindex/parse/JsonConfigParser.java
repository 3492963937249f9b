package ai.hclindex.parse;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.hclindex.model.ArrayValue;
import ai.hclindex.model.DataBlock;
import ai.hclindex.model.Document;
import ai.hclindex.model.DynamicBlock;
import ai.hclindex.model.LiteralValue;
import ai.hclindex.model.LocalValue;
import ai.hclindex.model.ModuleBlock;
import ai.hclindex.model.ObjectValue;
import ai.hclindex.model.OutputBlock;
import ai.hclindex.model.ProviderBlock;
import ai.hclindex.model.Reference;
import ai.hclindex.model.ResourceBlock;
import ai.hclindex.model.TerraformSettingsBlock;
import ai.hclindex.model.Value;
import ai.hclindex.model.VariableBlock;
import ai.hclindex.model.VariableValidation;

/**
 * Maps the JSON configuration syntax ({@code *.tf.json}) onto the same records as the native syntax.
 * <p>
 * JSON strings are templates: a string containing an interpolation is classified as one, any other
 * string is a literal. Attributes whose JSON form is a bare expression string
 * ({@code depends_on}, {@code condition}) are classified as expressions.
 */
public final class JsonConfigParser {

    private static final Logger log = LoggerFactory.getLogger(JsonConfigParser.class);

    private static final Set<String> EXPRESSION_KEYS = Set.of("depends_on", "condition");

    private final ObjectMapper mapper;

    public JsonConfigParser() {
        this(new ObjectMapper());
    }

    public JsonConfigParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Document parseFile(Path file) throws IOException {
        final JsonNode root = mapper.readTree(file.toFile());
        return parse(root, file.toString());
    }

    public Document parse(JsonNode root, String source) {
        final Document doc = Document.empty();
        if (root == null || !root.isObject()) {
            log.warn("{} is not a JSON object; nothing to parse", source);
            return doc;
        }

        for (JsonNode cfg : objects(root.get("terraform"))) {
            doc.terraform().add(new TerraformSettingsBlock(attributes(cfg, Set.of()), List.of(), cfg.toString(), source));
        }
        forEachField(root.get("provider"), (name, config) -> {
            for (JsonNode cfg : objects(config)) {
                final JsonNode alias = cfg.get("alias");
                doc.provider().add(new ProviderBlock(
                        name,
                        alias != null && alias.isTextual() ? alias.asText() : null,
                        attributes(cfg, Set.of("alias")),
                        List.of(),
                        cfg.toString(),
                        source));
            }
        });
        forEachField(root.get("variable"), (name, config) -> {
            for (JsonNode cfg : objects(config)) {
                doc.variable().add(variable(name, cfg, source));
            }
        });
        forEachField(root.get("output"), (name, config) -> {
            for (JsonNode cfg : objects(config)) {
                doc.output().add(new OutputBlock(
                        name,
                        text(cfg.get("description")),
                        cfg.has("value") ? convert(cfg.get("value")) : null,
                        bool(cfg.get("sensitive")),
                        cfg.has("depends_on") ? convertExpression(cfg.get("depends_on")) : null,
                        List.of(),
                        cfg.toString(),
                        source));
            }
        });
        for (JsonNode locals : objects(root.get("locals"))) {
            forEachField(locals, (name, value) -> {
                final Value converted = convert(value);
                doc.locals().add(new LocalValue(name, Values.tag(converted), converted, converted.raw(), source));
            });
        }
        forEachField(root.get("module"), (name, config) -> {
            for (JsonNode cfg : objects(config)) {
                final Map<String, Value> properties = new LinkedHashMap<>();
                final Map<String, Value> meta = new LinkedHashMap<>();
                splitMeta(cfg, BlockParser.MODULE_META, properties, meta);
                doc.module().add(new ModuleBlock(
                        name,
                        text(cfg.get("source")),
                        text(cfg.get("version")),
                        properties,
                        meta,
                        cfg.toString(),
                        source));
            }
        });
        forEachField(root.get("resource"), (type, byName) -> forEachField(byName, (name, config) -> {
            for (JsonNode cfg : objects(config)) {
                final Members m = members(cfg);
                doc.resource().add(new ResourceBlock(type, name, m.properties, m.meta, List.of(), m.dynamicBlocks,
                        cfg.toString(), source));
            }
        }));
        forEachField(root.get("data"), (type, byName) -> forEachField(byName, (name, config) -> {
            for (JsonNode cfg : objects(config)) {
                final Members m = members(cfg);
                doc.data().add(new DataBlock(type, name, m.properties, m.meta, List.of(), m.dynamicBlocks,
                        cfg.toString(), source));
            }
        }));

        log.debug("Parsed {} block(s) from {}", doc.blockCount(), source);
        return doc;
    }

    private VariableBlock variable(String name, JsonNode cfg, String source) {
        final String type = text(cfg.get("type"));
        final List<VariableValidation> validations = new ArrayList<>();
        for (JsonNode validation : objects(cfg.get("validation"))) {
            validations.add(new VariableValidation(
                    validation.has("condition") ? convertExpression(validation.get("condition")) : null,
                    validation.has("error_message") ? convert(validation.get("error_message")) : null));
        }
        return new VariableBlock(
                name,
                text(cfg.get("description")),
                type,
                type != null ? TypeConstraintParser.parse(type) : null,
                cfg.has("default") ? convert(cfg.get("default")) : null,
                validations,
                bool(cfg.get("sensitive")),
                bool(cfg.get("nullable")),
                cfg.toString(),
                source);
    }

    private Members members(JsonNode cfg) {
        final Members m = new Members();
        final Iterator<Map.Entry<String, JsonNode>> fields = cfg.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String key = field.getKey();
            if ("dynamic".equals(key)) {
                forEachField(field.getValue(), (label, dyn) -> {
                    for (JsonNode d : objects(dyn)) {
                        final JsonNode content = d.get("content");
                        m.dynamicBlocks.add(new DynamicBlock(
                                label,
                                d.has("for_each") ? convert(d.get("for_each")) : null,
                                text(d.get("iterator")),
                                content != null && content.isObject() ? attributes(content, Set.of()) : Map.of(),
                                List.of(),
                                d.toString()));
                    }
                });
            } else if (BlockParser.RESOURCE_META.contains(key)) {
                m.meta.put(key, convertField(key, field.getValue()));
            } else {
                m.properties.put(key, convertField(key, field.getValue()));
            }
        }
        return m;
    }

    private void splitMeta(JsonNode cfg, Set<String> metaKeys, Map<String, Value> properties, Map<String, Value> meta) {
        forEachField(cfg, (key, value) -> {
            if (metaKeys.contains(key)) {
                meta.put(key, convertField(key, value));
            } else {
                properties.put(key, convertField(key, value));
            }
        });
    }

    private Map<String, Value> attributes(JsonNode cfg, Set<String> skip) {
        final Map<String, Value> out = new LinkedHashMap<>();
        forEachField(cfg, (key, value) -> {
            if (!skip.contains(key)) {
                out.put(key, convertField(key, value));
            }
        });
        return out;
    }

    private Value convertField(String key, JsonNode node) {
        return EXPRESSION_KEYS.contains(key) ? convertExpression(node) : convert(node);
    }

    /**
     * Converts a JSON value; also used for {@code *.tfvars.json} assignments.
     */
    public Value convert(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new LiteralValue(null, "null");
        }
        if (node.isTextual()) {
            final String s = node.asText();
            if (ValueClassifier.hasInterpolation(s)) {
                return ValueClassifier.classify(quote(s));
            }
            return new LiteralValue(s, s);
        }
        if (node.isBoolean()) {
            return new LiteralValue(node.booleanValue(), node.asText());
        }
        if (node.isIntegralNumber()) {
            if (node.canConvertToLong()) {
                return new LiteralValue(node.longValue(), node.asText());
            }
            return new LiteralValue(node.doubleValue(), node.asText());
        }
        if (node.isNumber()) {
            return new LiteralValue(node.doubleValue(), node.asText());
        }
        if (node.isArray()) {
            final List<Value> elements = new ArrayList<>(node.size());
            final List<Reference> refs = new ArrayList<>();
            for (JsonNode item : node) {
                final Value v = convert(item);
                elements.add(v);
                refs.addAll(v.references());
            }
            return new ArrayValue(elements, node.toString(), ReferenceExtractor.unique(refs));
        }
        if (node.isObject()) {
            final Map<String, Value> entries = new LinkedHashMap<>();
            forEachField(node, (key, value) -> entries.put(key, convertField(key, value)));
            return new ObjectValue(entries, node.toString(), ReferenceExtractor.unique(Values.references(entries)));
        }
        return new LiteralValue(node.asText(), node.asText());
    }

    /**
     * Strings are read as bare expressions, e.g. {@code "depends_on": ["aws_s3_bucket.logs"]}.
     */
    private Value convertExpression(JsonNode node) {
        if (node != null && node.isTextual()) {
            return ValueClassifier.classify(node.asText());
        }
        if (node != null && node.isArray()) {
            final List<Value> elements = new ArrayList<>(node.size());
            final List<Reference> refs = new ArrayList<>();
            for (JsonNode item : node) {
                final Value v = convertExpression(item);
                elements.add(v);
                refs.addAll(v.references());
            }
            return new ArrayValue(elements, node.toString(), ReferenceExtractor.unique(refs));
        }
        return convert(node);
    }

    private static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static Boolean bool(JsonNode node) {
        return node != null && node.isBoolean() ? node.booleanValue() : null;
    }

    /**
     * A single object or an array of objects, as the JSON syntax allows for repeated blocks.
     */
    private static List<JsonNode> objects(JsonNode node) {
        final List<JsonNode> out = new ArrayList<>();
        if (node == null) {
            return out;
        }
        if (node.isObject()) {
            out.add(node);
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) {
                    out.add(item);
                }
            }
        }
        return out;
    }

    private static void forEachField(JsonNode node, FieldVisitor visitor) {
        if (node == null || !node.isObject()) {
            return;
        }
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            visitor.visit(field.getKey(), field.getValue());
        }
    }

    @FunctionalInterface
    private interface FieldVisitor {
        void visit(String name, JsonNode value);
    }

    private static final class Members {
        final Map<String, Value> properties = new LinkedHashMap<>();
        final Map<String, Value> meta = new LinkedHashMap<>();
        final List<DynamicBlock> dynamicBlocks = new ArrayList<>();
    }
}
