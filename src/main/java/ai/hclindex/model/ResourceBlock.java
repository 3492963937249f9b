package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ResourceBlock(
        String type,
        String name,
        Map<String, Value> properties,
        Map<String, Value> meta, // count, for_each, provider, depends_on, lifecycle
        List<NestedBlock> blocks,
        List<DynamicBlock> dynamicBlocks,
        String raw,
        String source
) {
    public ResourceBlock {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        blocks = List.copyOf(blocks);
        dynamicBlocks = List.copyOf(dynamicBlocks);
    }
}
