package ai.hclindex.artifacts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized {@code terraform.tfstate}.
 */
public record StateFile(
        int version,
        String terraformVersion,
        Long serial,
        String lineage,
        Map<String, Output> outputs,
        List<Resource> resources,
        String source
) {
    public StateFile {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        resources = List.copyOf(resources);
    }

    public record Output(JsonNode value, JsonNode type, boolean sensitive) {
    }

    public record Resource(
            String module,
            String mode,      // managed | data
            String type,
            String name,
            String provider,
            List<Instance> instances
    ) {
        public Resource {
            instances = List.copyOf(instances);
        }
    }

    /**
     * indexKey is a number (count) or string (for_each), null for single instances.
     */
    public record Instance(JsonNode indexKey, JsonNode attributes, String status) {
    }
}
