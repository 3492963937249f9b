package ai.hclindex.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.hclindex.model.DataReference;
import ai.hclindex.model.Ids;
import ai.hclindex.model.LocalReference;
import ai.hclindex.model.ModuleOutputReference;
import ai.hclindex.model.PathReference;
import ai.hclindex.model.Reference;
import ai.hclindex.model.ResourceReference;
import ai.hclindex.model.VariableReference;

/**
 * id -> node, in insertion order.
 * Declared nodes are registered first; referenced-but-undeclared targets are added as placeholders
 * while edges are resolved.
 */
final class NodeRegistry {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();

    /**
     * Registers the node unless its id is taken; returns the node now registered under that id.
     */
    GraphNode register(GraphNode node) {
        final GraphNode existing = nodes.putIfAbsent(node.id(), node);
        return existing != null ? existing : node;
    }

    GraphNode get(String id) {
        return nodes.get(id);
    }

    /**
     * Node a reference points at, created as a placeholder when undeclared.
     * Returns null for contextual references (each, count, self), which have no node.
     */
    GraphNode resolve(Reference ref) {
        final GraphNode placeholder = placeholderFor(ref);
        return placeholder == null ? null : register(placeholder);
    }

    /**
     * Provider configuration node, created as a placeholder when undeclared.
     */
    GraphNode resolveProvider(String name, String alias) {
        final String id = Ids.providerId(name, alias);
        return register(GraphNode.placeholder(id, "provider", alias != null ? alias : name, name));
    }

    List<GraphNode> nodes() {
        return new ArrayList<>(nodes.values());
    }

    static GraphNode placeholderFor(Reference ref) {
        if (ref instanceof VariableReference v) {
            return GraphNode.placeholder(Ids.nodeId("variable", v.name()), "variable", v.name(), null);
        }
        if (ref instanceof LocalReference l) {
            return GraphNode.placeholder(Ids.nodeId("locals", l.name()), "locals", l.name(), null);
        }
        if (ref instanceof ModuleOutputReference m) {
            return GraphNode.placeholder(Ids.nodeId("module_output", m.module(), m.outputName()),
                    "module_output", m.outputName(), m.module());
        }
        if (ref instanceof DataReference d) {
            return GraphNode.placeholder(Ids.dataId(d.dataType(), d.name()), "data", d.name(), d.dataType());
        }
        if (ref instanceof ResourceReference r) {
            return GraphNode.placeholder(Ids.resourceId(r.resourceType(), r.name()), "resource", r.name(),
                    r.resourceType());
        }
        if (ref instanceof PathReference p) {
            return GraphNode.placeholder(Ids.nodeId("path", p.pathType()), "path", p.pathType(), null);
        }
        return null;
    }
}
