package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record NestedBlock(
        String type,
        List<String> labels,
        Map<String, Value> attributes,
        List<NestedBlock> blocks,
        String raw
) {
    public NestedBlock {
        labels = List.copyOf(labels);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        blocks = List.copyOf(blocks);
    }
}
