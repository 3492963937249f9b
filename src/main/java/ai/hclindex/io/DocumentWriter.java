package ai.hclindex.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import ai.hclindex.graph.DependencyGraph;
import ai.hclindex.graph.GraphBuilder;
import ai.hclindex.model.Diagnostic;
import ai.hclindex.model.Document;
import ai.hclindex.parse.DirectoryParseResult;
import ai.hclindex.parse.FileParseResult;

/**
 * Renders parse results as JSON or YAML (snake_case keys, 2-space indent) and writes the
 * output directory layout:
 * - document.(json|yaml)
 * - graph.(json|yaml)
 * - index.json
 * <p>
 * Pruning drops nulls and empty arrays/objects, recursively. It applies to documents only:
 * a graph or an artifact is always rendered in full.
 */
public final class DocumentWriter {

    public static final String EXPORT_VERSION = "1.0.0";
    public static final String SCHEMA_VERSION = "hcl-index/v1";

    public enum Format {
        JSON,
        YAML;

        public String extension() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Format parse(String value) {
            for (Format f : values()) {
                if (f.extension().equalsIgnoreCase(value)) {
                    return f;
                }
            }
            throw new IllegalArgumentException("Unsupported format: " + value + " (expected json or yaml)");
        }
    }

    private final Format format;
    private final boolean pruneEmpty;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DocumentWriter() {
        this(Format.JSON, true);
    }

    public DocumentWriter(Format format, boolean pruneEmpty) {
        this.format = Objects.requireNonNull(format, "format");
        this.pruneEmpty = pruneEmpty;
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public Format format() {
        return format;
    }

    /**
     * {@code {version, document, graph}} for a document.
     */
    public static Export export(Document document) {
        Objects.requireNonNull(document, "document");
        return new Export(EXPORT_VERSION, document, new GraphBuilder().build(document));
    }

    public String render(Object data) throws IOException {
        final JsonNode tree = toTree(data);
        final ObjectMapper mapper = format == Format.YAML ? yamlMapper : jsonMapper;
        return mapper.writeValueAsString(tree);
    }

    /**
     * The JSON tree that {@link #render(Object)} serializes, after pruning where it applies.
     */
    public JsonNode toTree(Object data) {
        final JsonNode tree = jsonMapper.valueToTree(data);
        if (!pruneEmpty) {
            return tree;
        }
        if (data instanceof Export && tree instanceof ObjectNode export) {
            export.set("document", pruneOrEmpty(export.get("document")));
            return export;
        }
        if (data instanceof Document || data instanceof FileParseResult || data instanceof DirectoryParseResult) {
            return pruneOrEmpty(tree);
        }
        return tree;
    }

    public void writeAll(Path outDir, List<FileParseResult> files, Document document, DependencyGraph graph,
                         String generatedAt) throws IOException {
        Objects.requireNonNull(outDir, "outDir");
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        final String documentName = "document." + format.extension();
        final String graphName = "graph." + format.extension();
        writeText(outDir.resolve(documentName), render(document));
        writeText(outDir.resolve(graphName), render(graph));

        final List<String> paths = new ArrayList<>(files.size());
        final List<String> diagnostics = new ArrayList<>();
        for (FileParseResult file : files) {
            paths.add(file.path());
            for (Diagnostic d : file.diagnostics()) {
                diagnostics.add(d.format());
            }
        }

        final Summary summary = new Summary(
                blockCounts(document),
                graph.nodes().size(),
                graph.edges().size(),
                graph.orphanReferences().size(),
                diagnostics
        );
        final MasterIndex idx = new MasterIndex(SCHEMA_VERSION, EXPORT_VERSION, generatedAt, paths, documentName,
                graphName, summary);

        // index is always JSON so tooling can find the rest
        jsonMapper.writeValue(outDir.resolve("index.json").toFile(), idx);
    }

    private static void writeText(Path file, String text) throws IOException {
        Files.writeString(file, text.endsWith("\n") ? text : text + "\n", StandardCharsets.UTF_8);
    }

    static Map<String, Integer> blockCounts(Document document) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("terraform", document.terraform().size());
        counts.put("provider", document.provider().size());
        counts.put("variable", document.variable().size());
        counts.put("output", document.output().size());
        counts.put("module", document.module().size());
        counts.put("resource", document.resource().size());
        counts.put("data", document.data().size());
        counts.put("locals", document.locals().size());
        counts.put("moved", document.moved().size());
        counts.put("import", document.imports().size());
        counts.put("check", document.check().size());
        counts.put("terraform_data", document.terraformData().size());
        counts.put("unknown", document.unknown().size());
        return counts;
    }

    private static JsonNode pruneOrEmpty(JsonNode node) {
        final JsonNode pruned = prune(node);
        return pruned != null ? pruned : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Drops nulls and empty containers; returns null when nothing is left.
     */
    static JsonNode prune(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isArray()) {
            final ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode item : node) {
                final JsonNode pruned = prune(item);
                if (pruned != null) {
                    out.add(pruned);
                }
            }
            return out.isEmpty() ? null : out;
        }
        if (node.isObject()) {
            final ObjectNode out = JsonNodeFactory.instance.objectNode();
            final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                final JsonNode pruned = prune(field.getValue());
                if (pruned != null) {
                    out.set(field.getKey(), pruned);
                }
            }
            return out.isEmpty() ? null : out;
        }
        return node;
    }

    public record Export(String version, Document document, DependencyGraph graph) {
    }

    // --- index records ---

    public record MasterIndex(
            String schema,
            String exportVersion,
            String generatedAt,
            List<String> files,
            String document,
            String graph,
            Summary summary
    ) {
    }

    public record Summary(
            Map<String, Integer> blocks,
            int nodes,
            int edges,
            int orphanReferences,
            List<String> diagnostics
    ) {
    }
}
