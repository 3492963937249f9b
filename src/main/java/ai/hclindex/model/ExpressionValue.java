package ai.hclindex.model;

import java.util.List;
import java.util.Objects;

public record ExpressionValue(
        ExpressionKind kind,
        String raw,
        List<Reference> references
) implements Value {

    public ExpressionValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(raw, "raw");
        references = List.copyOf(references);
    }
}
