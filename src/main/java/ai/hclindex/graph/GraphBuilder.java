package ai.hclindex.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.hclindex.model.DataBlock;
import ai.hclindex.model.Document;
import ai.hclindex.model.DynamicBlock;
import ai.hclindex.model.GenericBlock;
import ai.hclindex.model.Ids;
import ai.hclindex.model.LocalValue;
import ai.hclindex.model.ModuleBlock;
import ai.hclindex.model.NestedBlock;
import ai.hclindex.model.OutputBlock;
import ai.hclindex.model.ProviderBlock;
import ai.hclindex.model.Reference;
import ai.hclindex.model.ResourceBlock;
import ai.hclindex.model.ResourceReference;
import ai.hclindex.model.TerraformSettingsBlock;
import ai.hclindex.model.Value;
import ai.hclindex.model.VariableBlock;
import ai.hclindex.model.VariableValidation;
import ai.hclindex.parse.Values;

/**
 * Builds the dependency graph of a document.
 * <p>
 * Step 1 registers one node per declared element, kind by kind in document order.
 * Step 2 walks the same elements again and adds an edge per reference, creating placeholder nodes
 * for undeclared targets. Output order is therefore a pure function of the document.
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public DependencyGraph build(Document document) {
        Objects.requireNonNull(document, "document");

        final Run run = new Run();
        registerDeclared(document, run.nodes);

        for (TerraformSettingsBlock block : document.terraform()) {
            final GraphNode node = run.nodes.get(Ids.TERRAFORM_SETTINGS);
            run.addEdges(node, Values.references(block.properties()), block.source());
            run.addEdges(node, blockReferences(block.blocks(), Set.of()), block.source());
        }

        for (ProviderBlock provider : document.provider()) {
            final GraphNode node = run.nodes.get(Ids.providerId(provider.name(), provider.alias()));
            run.addEdges(node, Values.references(provider.properties()), provider.source());
            run.addEdges(node, blockReferences(provider.blocks(), Set.of()), provider.source());
        }

        for (VariableBlock variable : document.variable()) {
            final GraphNode node = run.nodes.get(Ids.nodeId("variable", variable.name()));
            run.addEdges(node, references(variable.defaultValue()), variable.source());
            for (VariableValidation validation : variable.validations()) {
                run.addEdges(node, references(validation.condition()), variable.source());
                run.addEdges(node, references(validation.errorMessage()), variable.source());
            }
        }

        for (OutputBlock output : document.output()) {
            final GraphNode node = run.nodes.get(Ids.nodeId("output", output.name()));
            run.addEdges(node, references(output.value()), output.source());
            run.addEdges(node, references(output.dependsOn()), output.source());
            run.addEdges(node, blockReferences(output.blocks(), Set.of()), output.source());
        }

        for (ModuleBlock module : document.module()) {
            final GraphNode node = run.nodes.get(Ids.nodeId("module", module.name()));
            run.addEdges(node, Values.references(module.properties()), module.source());
            run.addMetaEdges(node, module.meta(), module.source());
        }

        for (ResourceBlock resource : document.resource()) {
            final GraphNode node = run.nodes.get(Ids.resourceId(resource.type(), resource.name()));
            run.addEdges(node, Values.references(resource.properties()), resource.source());
            run.addMetaEdges(node, resource.meta(), resource.source());
            run.addDynamicEdges(node, resource.dynamicBlocks(), resource.source());
            run.addEdges(node, blockReferences(resource.blocks(), Set.of()), resource.source());
        }

        for (DataBlock data : document.data()) {
            final GraphNode node = run.nodes.get(Ids.dataId(data.dataType(), data.name()));
            run.addEdges(node, Values.references(data.properties()), data.source());
            run.addMetaEdges(node, data.meta(), data.source());
            run.addDynamicEdges(node, data.dynamicBlocks(), data.source());
            run.addEdges(node, blockReferences(data.blocks(), Set.of()), data.source());
        }

        for (LocalValue local : document.locals()) {
            final GraphNode node = run.nodes.get(Ids.nodeId("locals", local.name()));
            run.addEdges(node, references(local.value()), local.source());
        }

        // moved, import, check, terraform_data, unknown: nodes are created on first sight
        for (GenericBlock block : document.genericBlocks()) {
            final String label = block.firstLabelOr("default");
            final GraphNode node = run.nodes.register(
                    new GraphNode(Ids.nodeId(block.type(), label), block.type(), label, null, block.source()));
            run.addEdges(node, Values.references(block.properties()), block.source());
            run.addEdges(node, blockReferences(block.blocks(), Set.of()), block.source());
        }

        final DependencyGraph graph = new DependencyGraph(run.nodes.nodes(), run.edges, run.orphans);
        log.debug("Built graph: {} node(s), {} edge(s), {} orphan reference(s)",
                graph.nodes().size(), graph.edges().size(), graph.orphanReferences().size());
        return graph;
    }

    private static void registerDeclared(Document document, NodeRegistry nodes) {
        if (!document.terraform().isEmpty()) {
            nodes.register(new GraphNode(Ids.TERRAFORM_SETTINGS, "terraform", "settings", null,
                    document.terraform().get(0).source()));
        }
        for (ProviderBlock p : document.provider()) {
            nodes.register(new GraphNode(Ids.providerId(p.name(), p.alias()), "provider",
                    p.alias() != null ? p.alias() : p.name(), p.name(), p.source()));
        }
        for (VariableBlock v : document.variable()) {
            nodes.register(new GraphNode(Ids.nodeId("variable", v.name()), "variable", v.name(), null, v.source()));
        }
        for (OutputBlock o : document.output()) {
            nodes.register(new GraphNode(Ids.nodeId("output", o.name()), "output", o.name(), null, o.source()));
        }
        for (ModuleBlock m : document.module()) {
            nodes.register(new GraphNode(Ids.nodeId("module", m.name()), "module", m.name(), null, m.source()));
        }
        for (ResourceBlock r : document.resource()) {
            nodes.register(new GraphNode(Ids.resourceId(r.type(), r.name()), "resource", r.name(), r.type(),
                    r.source()));
        }
        for (DataBlock d : document.data()) {
            nodes.register(new GraphNode(Ids.dataId(d.dataType(), d.name()), "data", d.name(), d.dataType(),
                    d.source()));
        }
        for (LocalValue l : document.locals()) {
            nodes.register(new GraphNode(Ids.nodeId("locals", l.name()), "locals", l.name(), null, l.source()));
        }
    }

    private static List<Reference> references(Value value) {
        return value == null ? List.of() : value.references();
    }

    /**
     * References of nested blocks, recursively. Inside a {@code dynamic} block, chains rooted at the
     * iterator name refer to the current element and are dropped.
     */
    static List<Reference> blockReferences(List<NestedBlock> blocks, Set<String> iterators) {
        final List<Reference> refs = new ArrayList<>();
        for (NestedBlock block : blocks) {
            Set<String> scope = iterators;
            if ("dynamic".equals(block.type())) {
                final String label = block.labels().isEmpty() ? "dynamic" : block.labels().get(0);
                final String iterator = Values.text(block.attributes().get("iterator"));
                scope = new HashSet<>(iterators);
                scope.add(iterator != null ? iterator : label);
                refs.addAll(withoutIterators(references(block.attributes().get("for_each")), iterators));
                for (Map.Entry<String, Value> attr : block.attributes().entrySet()) {
                    if (!"for_each".equals(attr.getKey())) {
                        refs.addAll(withoutIterators(attr.getValue().references(), scope));
                    }
                }
            } else {
                refs.addAll(withoutIterators(Values.references(block.attributes()), scope));
            }
            refs.addAll(blockReferences(block.blocks(), scope));
        }
        return refs;
    }

    static List<Reference> withoutIterators(List<Reference> refs, Set<String> iterators) {
        if (iterators.isEmpty()) {
            return refs;
        }
        final List<Reference> out = new ArrayList<>(refs.size());
        for (Reference ref : refs) {
            if (ref instanceof ResourceReference r && iterators.contains(r.resourceType())) {
                continue;
            }
            out.add(ref);
        }
        return out;
    }

    /**
     * Mutable state of one build.
     */
    private static final class Run {

        private final NodeRegistry nodes = new NodeRegistry();
        private final List<GraphEdge> edges = new ArrayList<>();
        private final Set<EdgeKey> edgeKeys = new HashSet<>();
        private final List<Reference> orphans = new ArrayList<>();

        void addEdges(GraphNode from, List<Reference> refs, String source) {
            if (from == null) {
                return;
            }
            for (Reference ref : refs) {
                final GraphNode target = nodes.resolve(ref);
                if (target == null) {
                    orphans.add(ref);
                    continue;
                }
                addEdge(from, target, ref, source);
            }
        }

        /**
         * A {@code provider = aws.west} / {@code providers = { aws = aws.west }} chain names a provider
         * configuration, not a resource.
         */
        void addMetaEdges(GraphNode from, Map<String, Value> meta, String source) {
            for (Map.Entry<String, Value> e : meta.entrySet()) {
                final List<Reference> refs = references(e.getValue());
                if (!"provider".equals(e.getKey()) && !"providers".equals(e.getKey())) {
                    addEdges(from, refs, source);
                    continue;
                }
                for (Reference ref : refs) {
                    if (ref instanceof ResourceReference r && r.attribute() == null) {
                        addEdge(from, nodes.resolveProvider(r.resourceType(), r.name()), ref, source);
                    } else {
                        addEdges(from, List.of(ref), source);
                    }
                }
            }
        }

        void addDynamicEdges(GraphNode from, List<DynamicBlock> dynamicBlocks, String source) {
            for (DynamicBlock dyn : dynamicBlocks) {
                final Set<String> scope = Set.of(dyn.iteratorName());
                addEdges(from, references(dyn.forEach()), source);
                addEdges(from, withoutIterators(Values.references(dyn.content()), scope), source);
                addEdges(from, blockReferences(dyn.contentBlocks(), scope), source);
            }
        }

        private void addEdge(GraphNode from, GraphNode to, Reference ref, String source) {
            if (from.id().equals(to.id())) {
                return;
            }
            if (edgeKeys.add(new EdgeKey(from.id(), to.id(), ref))) {
                edges.add(new GraphEdge(from.id(), to.id(), ref, source));
            }
        }
    }

    private record EdgeKey(String from, String to, Reference reference) {
    }
}
