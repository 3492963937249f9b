package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProviderBlock(
        String name,
        String alias,  // null for the default configuration
        Map<String, Value> properties,
        List<NestedBlock> blocks,
        String raw,
        String source
) {
    public ProviderBlock {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        blocks = List.copyOf(blocks);
    }
}
