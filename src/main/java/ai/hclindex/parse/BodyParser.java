package ai.hclindex.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.hclindex.model.NestedBlock;
import ai.hclindex.model.ParsedBody;
import ai.hclindex.model.Value;
import ai.hclindex.scan.HclLexer;

/**
 * Splits a block body into attributes ({@code name = value}) and nested blocks
 * ({@code type "label"... { ... }}), recursively.
 */
public final class BodyParser {

    private static final Logger log = LoggerFactory.getLogger(BodyParser.class);

    /**
     * Nested blocks deeper than this keep their raw text only.
     */
    public static final int MAX_DEPTH = 64;

    private BodyParser() {
    }

    public static ParsedBody parse(String body) {
        return parse(body, 0);
    }

    static ParsedBody parse(String body, int depth) {
        if (body == null || body.isBlank()) {
            return ParsedBody.empty();
        }

        final Map<String, Value> attributes = new LinkedHashMap<>();
        final List<NestedBlock> blocks = new ArrayList<>();
        final int length = body.length();
        int index = 0;

        while (index < length) {
            index = HclLexer.skipInsignificant(body, index);
            if (index >= length) {
                break;
            }

            if (HclLexer.isQuote(body.charAt(index))) {
                index = HclLexer.skipString(body, index);
                continue;
            }

            final int start = index;
            final String identifier = HclLexer.readDottedIdentifier(body, index);
            if (identifier.isEmpty()) {
                index++;
                continue;
            }
            index = HclLexer.skipInsignificant(body, index + identifier.length());

            if (index < length && body.charAt(index) == '='
                    && (index + 1 >= length || body.charAt(index + 1) != '=')) {
                final HclLexer.ValueSpan span = HclLexer.readValue(body, index + 1);
                final Value value = ValueClassifier.classify(span.raw(), depth);
                if (attributes.put(identifier, value) != null) {
                    log.debug("Duplicate attribute '{}', keeping the last assignment", identifier);
                }
                index = span.end();
                continue;
            }

            final List<String> labels = new ArrayList<>();
            while (index < length && HclLexer.isQuote(body.charAt(index))) {
                final HclLexer.QuotedString label = HclLexer.consumeQuotedString(body, index);
                labels.add(label.value());
                index = HclLexer.skipInsignificant(body, label.end());
            }

            if (index < length && body.charAt(index) == '{') {
                final int close = HclLexer.findMatchingDelimiter(body, index, '{', '}');
                final int innerEnd = close == HclLexer.NOT_FOUND ? length : close;
                final int blockEnd = close == HclLexer.NOT_FOUND ? length : close + 1;
                final String inner = body.substring(index + 1, innerEnd);
                final String raw = body.substring(start, blockEnd).strip();

                final ParsedBody nested;
                if (depth + 1 > MAX_DEPTH) {
                    log.warn("Block '{}' nested deeper than {} levels; keeping raw text only", identifier, MAX_DEPTH);
                    nested = ParsedBody.empty();
                } else {
                    nested = parse(inner, depth + 1);
                }
                blocks.add(new NestedBlock(identifier, labels, nested.attributes(), nested.blocks(), raw));
                index = blockEnd;
                continue;
            }

            // neither an attribute nor a block; move on
            index = Math.max(index, start + 1);
        }

        return new ParsedBody(attributes, blocks);
    }
}
