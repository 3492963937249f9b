package ai.hclindex.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VariableBlock(
        String name,
        String description,
        String type,                    // raw type expression
        TypeConstraint typeConstraint,  // parsed form of type, null when absent
        @JsonProperty("default") Value defaultValue,
        List<VariableValidation> validations,
        Boolean sensitive,
        Boolean nullable,
        String raw,
        String source
) {
    public VariableBlock {
        validations = List.copyOf(validations);
    }
}
