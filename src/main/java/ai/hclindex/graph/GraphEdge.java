package ai.hclindex.graph;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

import ai.hclindex.model.Reference;

/**
 * from depends on to, through reference.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphEdge(
        String from,
        String to,
        Reference reference,
        String source
) {
    public GraphEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(reference, "reference");
    }
}
