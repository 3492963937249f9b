package ai.hclindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * TYPE.NAME[.ATTR]; {@code splat} is set when the chain used {@code [*]} or {@code .*}.
 */
public record ResourceReference(
        String resourceType,
        String name,
        String attribute, // null when the whole resource is referenced
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean splat
) implements Reference {

    public ResourceReference(String resourceType, String name, String attribute) {
        this(resourceType, name, attribute, false);
    }
}
