package ai.hclindex.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import ai.hclindex.model.ArrayValue;
import ai.hclindex.model.ExpressionKind;
import ai.hclindex.model.ExpressionValue;
import ai.hclindex.model.LiteralValue;
import ai.hclindex.model.ObjectValue;
import ai.hclindex.model.Reference;
import ai.hclindex.model.Value;
import ai.hclindex.scan.HclLexer;

/**
 * Classifies raw attribute text into a {@link Value}. Never throws: anything unrecognized
 * becomes an expression of kind {@link ExpressionKind#UNKNOWN}.
 */
public final class ValueClassifier {

    /**
     * Arrays and objects nested deeper than this are kept as unknown expressions.
     */
    public static final int MAX_DEPTH = 64;

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?");
    private static final Pattern FUNCTION_CALL = Pattern.compile("^[A-Za-z_][\\w:.-]*\\(", Pattern.DOTALL);
    private static final Pattern FOR_HEAD = Pattern.compile("^[\\[{]\\s*for\\s", Pattern.DOTALL);
    private static final Pattern FOR_EXPR = Pattern.compile("^[\\[{]\\s*for\\s+.+\\s+in\\s+.+:.*", Pattern.DOTALL);
    private static final Pattern LEGACY_SPLAT = Pattern.compile("\\.\\*(?![\\w])");
    private static final Pattern TRAVERSAL = Pattern.compile(
            "^[A-Za-z_][\\w-]*(?:\\[[^\\]]*+\\])*+(?:\\.(?:[A-Za-z_][\\w-]*|\\d+|\\*)(?:\\[[^\\]]*+\\])*+)*+$");

    private ValueClassifier() {
    }

    public static Value classify(String raw) {
        return classify(raw, 0);
    }

    static Value classify(String raw, int depth) {
        final String trimmed = raw == null ? "" : raw.strip();
        if (trimmed.isEmpty()) {
            return new ExpressionValue(ExpressionKind.UNKNOWN, "", List.of());
        }

        final LiteralValue literal = keywordOrNumber(trimmed);
        if (literal != null) {
            return literal;
        }

        final char first = trimmed.charAt(0);
        if (HclLexer.isQuote(first) && HclLexer.findStringEnd(trimmed, 0) == trimmed.length() - 1) {
            final String content = trimmed.substring(1, trimmed.length() - 1);
            if (hasInterpolation(content)) {
                return expression(ExpressionKind.TEMPLATE, trimmed);
            }
            return new LiteralValue(HclLexer.decode(content, first), trimmed);
        }

        if (first == '<' && HclLexer.isHeredocStart(trimmed, 0)) {
            return expression(ExpressionKind.TEMPLATE, trimmed);
        }

        if (first == '[' || first == '{') {
            final char close = first == '[' ? ']' : '}';
            if (HclLexer.findMatchingDelimiter(trimmed, 0, first, close) == trimmed.length() - 1) {
                if (FOR_HEAD.matcher(trimmed).find()) {
                    return expression(ExpressionKind.FOR_EXPR, trimmed);
                }
                if (depth >= MAX_DEPTH) {
                    return expression(ExpressionKind.UNKNOWN, trimmed);
                }
                return first == '[' ? array(trimmed, depth) : object(trimmed, depth);
            }
        }

        return expression(detectKind(trimmed), trimmed);
    }

    private static LiteralValue keywordOrNumber(String text) {
        switch (text) {
            case "true":
                return new LiteralValue(Boolean.TRUE, text);
            case "false":
                return new LiteralValue(Boolean.FALSE, text);
            case "null":
                return new LiteralValue(null, text);
            default:
                break;
        }
        if (!NUMBER.matcher(text).matches()) {
            return null;
        }
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            try {
                return new LiteralValue(Long.parseLong(text), text);
            } catch (NumberFormatException overflow) {
                // too large for a long; keep it as a double
                return new LiteralValue(Double.parseDouble(text), text);
            }
        }
        return new LiteralValue(Double.parseDouble(text), text);
    }

    private static ArrayValue array(String raw, int depth) {
        final List<Value> elements = new ArrayList<>();
        final List<Reference> refs = new ArrayList<>();
        for (String element : HclLexer.splitArrayElements(raw)) {
            final Value value = classify(element, depth + 1);
            elements.add(value);
            refs.addAll(value.references());
        }
        return new ArrayValue(elements, raw, ReferenceExtractor.unique(refs));
    }

    private static ObjectValue object(String raw, int depth) {
        final Map<String, Value> entries = new LinkedHashMap<>();
        for (HclLexer.ObjectEntry entry : HclLexer.splitObjectEntries(raw)) {
            entries.put(entry.key(), classify(entry.value(), depth + 1));
        }
        final List<Reference> refs = new ArrayList<>();
        for (Value value : entries.values()) {
            refs.addAll(value.references());
        }
        // parenthesized keys are expressions too
        for (String key : entries.keySet()) {
            if (key.startsWith("(")) {
                refs.addAll(ReferenceExtractor.extract(key));
            }
        }
        return new ObjectValue(entries, raw, ReferenceExtractor.unique(refs));
    }

    private static ExpressionValue expression(ExpressionKind kind, String raw) {
        return new ExpressionValue(kind, raw, ReferenceExtractor.extract(raw));
    }

    /**
     * Kind priority: template, conditional, function call, for, splat, traversal.
     */
    static ExpressionKind detectKind(String raw) {
        if (hasInterpolation(raw)) {
            return ExpressionKind.TEMPLATE;
        }
        if (hasTopLevelConditional(raw)) {
            return ExpressionKind.CONDITIONAL;
        }
        if (FUNCTION_CALL.matcher(raw).find()) {
            return ExpressionKind.FUNCTION_CALL;
        }
        if (FOR_EXPR.matcher(raw).matches()) {
            return ExpressionKind.FOR_EXPR;
        }
        if (raw.contains("[*]") || LEGACY_SPLAT.matcher(raw).find()) {
            return ExpressionKind.SPLAT;
        }
        if (TRAVERSAL.matcher(raw).matches()) {
            return ExpressionKind.TRAVERSAL;
        }
        return ExpressionKind.UNKNOWN;
    }

    /**
     * True when the text contains {@code ${} or {@code %{} that is not escaped as {@code $${} / {@code %%{}.
     */
    static boolean hasInterpolation(String text) {
        for (int i = 0; i + 1 < text.length(); i++) {
            final char c = text.charAt(i);
            if ((c == '$' || c == '%') && text.charAt(i + 1) == '{') {
                if (i > 0 && text.charAt(i - 1) == c) {
                    continue;
                }
                return true;
            }
        }
        return false;
    }

    private static boolean hasTopLevelConditional(String raw) {
        final int length = raw.length();
        int depth = 0;
        boolean question = false;
        int index = 0;
        while (index < length) {
            final char c = raw.charAt(index);
            if (HclLexer.isQuote(c)) {
                index = HclLexer.skipString(raw, index);
                continue;
            }
            if (c == '<' && HclLexer.isHeredocStart(raw, index)) {
                index = HclLexer.consumeHeredoc(raw, index);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0 && c == '?') {
                question = true;
            } else if (depth == 0 && c == ':' && question) {
                return true;
            }
            index++;
        }
        return false;
    }
}
