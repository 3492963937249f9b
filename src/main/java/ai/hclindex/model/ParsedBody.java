package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes (unique names, last assignment wins) and nested blocks of one block body.
 */
public record ParsedBody(Map<String, Value> attributes, List<NestedBlock> blocks) {

    public ParsedBody {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        blocks = List.copyOf(blocks);
    }

    public static ParsedBody empty() {
        return new ParsedBody(Map.of(), List.of());
    }
}
