package ai.hclindex.model;

public record VariableValidation(Value condition, Value errorMessage) {
}
