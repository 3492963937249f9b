package ai.hclindex.model;

/**
 * each.key or each.value
 */
public record EachReference(String property) implements Reference {
}
