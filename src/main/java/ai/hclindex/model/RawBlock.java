package ai.hclindex.model;

import java.util.List;

/**
 * Top-level block as found by the scanner, before its body is parsed.
 * <p>
 * start/end span the header start to the closing brace (inclusive);
 * bodyStart/bodyEnd span the text between the braces.
 */
public record RawBlock(
        String keyword,
        BlockKind kind,
        List<String> labels,   // 0..2 in practice
        String body,           // trimmed text between the braces
        String raw,            // normalized block text
        String source,
        int start,
        int end,
        int bodyStart,
        int bodyEnd
) {
    public RawBlock {
        labels = List.copyOf(labels);
    }

    public String label(int index, String fallback) {
        return index < labels.size() ? labels.get(index) : fallback;
    }
}
