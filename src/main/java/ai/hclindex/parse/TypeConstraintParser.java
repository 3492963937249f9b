package ai.hclindex.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.hclindex.model.CollectionType;
import ai.hclindex.model.ObjectType;
import ai.hclindex.model.OpaqueType;
import ai.hclindex.model.PrimitiveType;
import ai.hclindex.model.TupleType;
import ai.hclindex.model.TypeConstraint;
import ai.hclindex.scan.HclLexer;

/**
 * Parses variable type expressions:
 * - string, number, bool, any
 * - list(T), set(T), map(T)
 * - tuple([T, ...]), object({ name = T, ... })
 * - optional(T[, default])
 * Everything else is kept as an opaque type.
 */
public final class TypeConstraintParser {

    private static final Set<String> PRIMITIVES = Set.of("string", "number", "bool", "any");
    private static final Set<String> COLLECTIONS = Set.of("list", "set", "map");

    private TypeConstraintParser() {
    }

    public static TypeConstraint parse(String raw) {
        final String text = raw == null ? "" : raw.strip();
        if (PRIMITIVES.contains(text)) {
            return new PrimitiveType(text, false, text);
        }

        final String keyword = HclLexer.readIdentifier(text, 0);
        final int open = skipSpaces(text, keyword.length());
        if (keyword.isEmpty() || open >= text.length() || text.charAt(open) != '(') {
            return opaque(text);
        }
        final int close = HclLexer.findMatchingDelimiter(text, open, '(', ')');
        if (close != text.length() - 1) {
            return opaque(text);
        }
        final String inner = text.substring(open + 1, close).strip();

        if (COLLECTIONS.contains(keyword)) {
            return new CollectionType(keyword, parse(inner), false, text);
        }
        switch (keyword) {
            case "optional": {
                // optional(T, default): the default is not part of the type
                final List<String> args = splitTopLevel(inner);
                if (args.isEmpty()) {
                    return opaque(text);
                }
                return parse(args.get(0)).asOptional(text);
            }
            case "tuple":
                return tuple(inner, text);
            case "object":
                return object(inner, text);
            default:
                return opaque(text);
        }
    }

    private static TypeConstraint tuple(String inner, String text) {
        if (!inner.startsWith("[") || HclLexer.findMatchingDelimiter(inner, 0, '[', ']') != inner.length() - 1) {
            return opaque(text);
        }
        final List<TypeConstraint> elements = new ArrayList<>();
        for (String element : splitTopLevel(inner.substring(1, inner.length() - 1))) {
            elements.add(parse(element));
        }
        return new TupleType(elements, false, text);
    }

    private static TypeConstraint object(String inner, String text) {
        if (!inner.startsWith("{") || HclLexer.findMatchingDelimiter(inner, 0, '{', '}') != inner.length() - 1) {
            return opaque(text);
        }
        final Map<String, TypeConstraint> attributes = new LinkedHashMap<>();
        for (HclLexer.ObjectEntry entry : HclLexer.splitObjectEntries(inner)) {
            attributes.put(entry.key(), parse(entry.value()));
        }
        return new ObjectType(attributes, false, text);
    }

    private static OpaqueType opaque(String text) {
        return new OpaqueType(text, false, text);
    }

    /**
     * Splits on commas outside of any bracket pair or string.
     */
    static List<String> splitTopLevel(String text) {
        final List<String> parts = new ArrayList<>();
        final int length = text.length();
        int depth = 0;
        int start = 0;
        int index = 0;
        while (index < length) {
            final char c = text.charAt(index);
            if (HclLexer.isQuote(c)) {
                index = HclLexer.skipString(text, index);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addPart(parts, text.substring(start, index));
                start = index + 1;
            }
            index++;
        }
        addPart(parts, text.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        final String trimmed = part.strip();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    private static int skipSpaces(String text, int pos) {
        int index = pos;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }
}
