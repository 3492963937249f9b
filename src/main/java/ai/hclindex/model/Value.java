package ai.hclindex.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Classified attribute value.
 * <p>
 * {@link #references()} always holds the complete, deduplicated set of references reachable from
 * the value, including those of array elements, object entries and template interpolations.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LiteralValue.class, name = "literal"),
        @JsonSubTypes.Type(value = ArrayValue.class, name = "array"),
        @JsonSubTypes.Type(value = ObjectValue.class, name = "object"),
        @JsonSubTypes.Type(value = ExpressionValue.class, name = "expression")
})
public sealed interface Value permits LiteralValue, ArrayValue, ObjectValue, ExpressionValue {

    String raw();

    List<Reference> references();
}
