package ai.hclindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * data.TYPE.NAME[.ATTR]
 */
public record DataReference(
        String dataType,
        String name,
        String attribute,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean splat
) implements Reference {

    public DataReference(String dataType, String name, String attribute) {
        this(dataType, name, attribute, false);
    }
}
