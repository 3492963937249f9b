package ai.hclindex.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.hclindex.model.ArrayValue;
import ai.hclindex.model.LiteralValue;
import ai.hclindex.model.NestedBlock;
import ai.hclindex.model.ObjectValue;
import ai.hclindex.model.Reference;
import ai.hclindex.model.Value;

/**
 * Small accessors over classified values.
 */
public final class Values {

    private Values() {
    }

    /**
     * The string of a string literal, otherwise null.
     */
    public static String literalString(Value value) {
        if (value instanceof LiteralValue literal && literal.value() instanceof String s) {
            return s;
        }
        return null;
    }

    public static Boolean literalBoolean(Value value) {
        if (value instanceof LiteralValue literal && literal.value() instanceof Boolean b) {
            return b;
        }
        return null;
    }

    /**
     * The string of a string literal, else the raw text; null for a missing value.
     */
    public static String text(Value value) {
        if (value == null) {
            return null;
        }
        final String literal = literalString(value);
        return literal != null ? literal : value.raw();
    }

    public static String tag(Value value) {
        if (value instanceof LiteralValue) {
            return "literal";
        }
        if (value instanceof ArrayValue) {
            return "array";
        }
        if (value instanceof ObjectValue) {
            return "object";
        }
        return "expression";
    }

    /**
     * All references of a set of attributes, in attribute order.
     */
    public static List<Reference> references(Map<String, Value> attributes) {
        final List<Reference> refs = new ArrayList<>();
        for (Value value : attributes.values()) {
            if (value != null) {
                refs.addAll(value.references());
            }
        }
        return refs;
    }

    /**
     * All references of nested blocks and their descendants.
     */
    public static List<Reference> references(List<NestedBlock> blocks) {
        final List<Reference> refs = new ArrayList<>();
        for (NestedBlock block : blocks) {
            refs.addAll(references(block.attributes()));
            refs.addAll(references(block.blocks()));
        }
        return refs;
    }

    /**
     * Presents a nested block (e.g. {@code lifecycle { ... }}) as an object value.
     * Child blocks become object entries keyed by type; repeated types are grouped into an array.
     */
    public static ObjectValue blockAsObject(NestedBlock block) {
        final Map<String, Value> entries = new LinkedHashMap<>(block.attributes());
        final Map<String, List<Value>> children = new LinkedHashMap<>();
        for (NestedBlock child : block.blocks()) {
            children.computeIfAbsent(child.type(), k -> new ArrayList<>()).add(blockAsObject(child));
        }
        for (Map.Entry<String, List<Value>> child : children.entrySet()) {
            final List<Value> values = child.getValue();
            if (values.size() == 1) {
                entries.put(child.getKey(), values.get(0));
            } else {
                final List<Reference> refs = new ArrayList<>();
                final List<String> raws = new ArrayList<>();
                for (Value v : values) {
                    refs.addAll(v.references());
                    raws.add(v.raw());
                }
                entries.put(child.getKey(),
                        new ArrayValue(values, "[" + String.join(", ", raws) + "]", ReferenceExtractor.unique(refs)));
            }
        }

        final List<Reference> refs = new ArrayList<>(references(block.attributes()));
        refs.addAll(references(block.blocks()));
        return new ObjectValue(entries, block.raw(), ReferenceExtractor.unique(refs));
    }
}
