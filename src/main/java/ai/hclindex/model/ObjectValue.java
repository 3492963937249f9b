package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ObjectValue(
        Map<String, Value> entries, // insertion order kept
        String raw,
        List<Reference> references
) implements Value {

    public ObjectValue {
        Objects.requireNonNull(raw, "raw");
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        references = List.copyOf(references);
    }
}
