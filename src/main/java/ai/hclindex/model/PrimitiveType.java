package ai.hclindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * string, number, bool, any
 */
public record PrimitiveType(
        String base,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean optional,
        String raw
) implements TypeConstraint {

    @Override
    public TypeConstraint asOptional(String raw) {
        return new PrimitiveType(base, true, raw);
    }
}
