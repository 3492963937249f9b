package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * moved, import, check, terraform_data and unrecognized keywords.
 */
public record GenericBlock(
        String type, // the keyword as written
        List<String> labels,
        Map<String, Value> properties,
        List<NestedBlock> blocks,
        String raw,
        String source
) {
    public GenericBlock {
        labels = List.copyOf(labels);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        blocks = List.copyOf(blocks);
    }

    public String firstLabelOr(String fallback) {
        return labels.isEmpty() ? fallback : labels.get(0);
    }
}
