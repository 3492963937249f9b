package ai.hclindex.model;

/**
 * local.NAME
 */
public record LocalReference(String name) implements Reference {
}
