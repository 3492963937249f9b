package ai.hclindex.model;

/**
 * var.NAME
 */
public record VariableReference(String name) implements Reference {
}
