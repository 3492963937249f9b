package ai.hclindex.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * list(T), set(T), map(T)
 */
public record CollectionType(
        String base,
        TypeConstraint element,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean optional,
        String raw
) implements TypeConstraint {

    public CollectionType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public TypeConstraint asOptional(String raw) {
        return new CollectionType(base, element, true, raw);
    }
}
