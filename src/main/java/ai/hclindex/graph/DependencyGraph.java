package ai.hclindex.graph;

import java.util.List;
import java.util.Optional;

import ai.hclindex.model.Reference;

/**
 * Built graph, independent of the document it came from.
 * - nodes: unique by id, declaration order then placeholder creation order
 * - edges: unique by (from, to, reference)
 * - orphanReferences: references with no node kind (each, count, self)
 */
public record DependencyGraph(
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        List<Reference> orphanReferences
) {
    public DependencyGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        orphanReferences = List.copyOf(orphanReferences);
    }

    public Optional<GraphNode> node(String id) {
        for (GraphNode node : nodes) {
            if (node.id().equals(id)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
