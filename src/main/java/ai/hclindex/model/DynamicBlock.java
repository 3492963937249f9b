package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * dynamic "LABEL" { for_each = ..., iterator = ..., content { ... } }
 */
public record DynamicBlock(
        String label,
        Value forEach,
        String iterator,            // null means the label is the iterator name
        Map<String, Value> content,
        List<NestedBlock> contentBlocks,
        String raw
) {
    public DynamicBlock {
        content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
        contentBlocks = List.copyOf(contentBlocks);
    }

    public String iteratorName() {
        return iterator != null ? iterator : label;
    }
}
