package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ModuleBlock(
        String name,
        String moduleSource, // literal "source" attribute, or its raw text
        String version,
        Map<String, Value> properties,
        Map<String, Value> meta, // count, for_each, providers, depends_on
        String raw,
        String source
) {
    public ModuleBlock {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }
}
