package ai.hclindex.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * object({ name = T, ... })
 */
@JsonPropertyOrder({"base", "attributes", "optional", "raw"})
public record ObjectType(
        Map<String, TypeConstraint> attributes,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean optional,
        String raw
) implements TypeConstraint {

    public ObjectType {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    @JsonProperty("base")
    public String base() {
        return "object";
    }

    @Override
    public TypeConstraint asOptional(String raw) {
        return new ObjectType(attributes, true, raw);
    }
}
