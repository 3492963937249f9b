package ai.hclindex.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * tuple([T1, T2, ...])
 */
@JsonPropertyOrder({"base", "elements", "optional", "raw"})
public record TupleType(
        List<TypeConstraint> elements,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean optional,
        String raw
) implements TypeConstraint {

    public TupleType {
        elements = List.copyOf(elements);
    }

    @Override
    @JsonProperty("base")
    public String base() {
        return "tuple";
    }

    @Override
    public TypeConstraint asOptional(String raw) {
        return new TupleType(elements, true, raw);
    }
}
