package ai.hclindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Anything the type grammar does not recognize; base is the verbatim text.
 */
public record OpaqueType(
        String base,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean optional,
        String raw
) implements TypeConstraint {

    @Override
    public TypeConstraint asOptional(String raw) {
        return new OpaqueType(base, true, raw);
    }
}
