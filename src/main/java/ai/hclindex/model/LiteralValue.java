package ai.hclindex.model;

import java.util.List;

/**
 * value: String | Long | Double | Boolean | null
 */
public record LiteralValue(Object value, String raw) implements Value {

    @Override
    public List<Reference> references() {
        return List.of();
    }
}
