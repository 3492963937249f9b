package ai.hclindex.model;

/**
 * One entry of a locals block. type is the tag of the classified value (literal, array, ...).
 */
public record LocalValue(
        String name,
        String type,
        Value value,
        String raw,
        String source
) {
}
