package ai.hclindex.model;

import java.util.List;
import java.util.Objects;

public record ArrayValue(
        List<Value> elements,
        String raw,
        List<Reference> references
) implements Value {

    public ArrayValue {
        Objects.requireNonNull(raw, "raw");
        elements = List.copyOf(elements);
        references = List.copyOf(references);
    }
}
