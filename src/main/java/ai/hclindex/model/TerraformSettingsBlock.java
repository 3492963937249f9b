package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record TerraformSettingsBlock(
        Map<String, Value> properties,
        List<NestedBlock> blocks, // required_providers, backend, cloud, ...
        String raw,
        String source
) {
    public TerraformSettingsBlock {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        blocks = List.copyOf(blocks);
    }
}
