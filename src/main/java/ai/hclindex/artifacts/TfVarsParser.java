package ai.hclindex.artifacts;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.hclindex.model.Value;
import ai.hclindex.parse.BodyParser;
import ai.hclindex.parse.JsonConfigParser;

/**
 * Reads variable definition files. Native files are parsed as a single block body; JSON files
 * ({@code *.json}) map each top-level field to a value.
 */
public final class TfVarsParser {

    private static final Logger log = LoggerFactory.getLogger(TfVarsParser.class);

    private final ObjectMapper mapper;
    private final JsonConfigParser json;

    public TfVarsParser() {
        this(new ObjectMapper());
    }

    public TfVarsParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.json = new JsonConfigParser(mapper);
    }

    public TfVarsFile parseFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        log.info("Parsing variable definitions {}", file);
        if (file.getFileName() != null && file.getFileName().toString().endsWith(".json")) {
            return parseJson(mapper.readTree(file.toFile()), file.toString());
        }
        return parseText(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    public TfVarsFile parseText(String content, String source) {
        return new TfVarsFile(source, content, BodyParser.parse(content).attributes());
    }

    public TfVarsFile parseJson(JsonNode root, String source) {
        final Map<String, Value> assignments = new LinkedHashMap<>();
        if (root != null && root.isObject()) {
            final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                assignments.put(field.getKey(), json.convert(field.getValue()));
            }
        } else {
            log.warn("{} is not a JSON object; no assignments read", source);
        }
        return new TfVarsFile(source, root == null ? "" : root.toString(), assignments);
    }
}
