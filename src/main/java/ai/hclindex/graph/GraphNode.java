package ai.hclindex.graph;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * kind is a block keyword (terraform, provider, variable, ...) or a placeholder kind
 * (module_output, path); type is the resource/data type, provider name or module name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphNode(
        String id,
        String kind,
        String name,
        String type,
        String source
) {
    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    public static GraphNode placeholder(String id, String kind, String name, String type) {
        return new GraphNode(id, kind, name, type, null);
    }
}
