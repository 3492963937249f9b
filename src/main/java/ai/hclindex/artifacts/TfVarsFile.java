package ai.hclindex.artifacts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ai.hclindex.model.Value;

/**
 * Variable assignments of a {@code .tfvars} or {@code .tfvars.json} file, in file order.
 */
public record TfVarsFile(String source, String raw, Map<String, Value> assignments) {

    public TfVarsFile {
        assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }
}
