package ai.hclindex.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.hclindex.model.BlockKind;
import ai.hclindex.model.Diagnostic;
import ai.hclindex.model.HclParseException;
import ai.hclindex.model.RawBlock;
import ai.hclindex.model.SourceLocation;

/**
 * Finds top-level blocks: keyword, up to two quoted labels, and a brace-delimited body.
 * <p>
 * An unterminated block stops the scan. By default the blocks found so far are returned with a
 * diagnostic; in strict mode an {@link HclParseException} is thrown instead.
 */
public final class BlockScanner {

    private static final Logger log = LoggerFactory.getLogger(BlockScanner.class);

    // alignment padding around '=' but not around '==', '=>', '!=', '<=', '>='
    private static final Pattern PAD_BEFORE_EQ = Pattern.compile("(?<![=!<>])[ \\t]{2,}=(?![=>])[ \\t]*");
    private static final Pattern PAD_AFTER_EQ = Pattern.compile("(?<![=!<>])[ \\t]*=(?![=>])[ \\t]{2,}");

    private final boolean strict;

    public BlockScanner() {
        this(false);
    }

    public BlockScanner(boolean strict) {
        this.strict = strict;
    }

    public ScanResult scan(String content, String source) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");

        final List<RawBlock> blocks = new ArrayList<>();
        final List<Diagnostic> diagnostics = new ArrayList<>();
        final int length = content.length();
        int index = 0;

        while (index < length) {
            index = HclLexer.skipInsignificant(content, index);
            if (index >= length) {
                break;
            }

            if (HclLexer.isQuote(content.charAt(index))) {
                index = HclLexer.skipString(content, index);
                continue;
            }

            final int headerStart = index;
            final String keyword = HclLexer.readIdentifier(content, index);
            if (keyword.isEmpty()) {
                index++;
                continue;
            }

            index = HclLexer.skipInsignificant(content, index + keyword.length());

            final List<String> labels = new ArrayList<>(2);
            while (index < length && HclLexer.isQuote(content.charAt(index))) {
                final HclLexer.QuotedString label = HclLexer.consumeQuotedString(content, index);
                labels.add(label.value());
                index = HclLexer.skipInsignificant(content, label.end());
            }

            if (index >= length || content.charAt(index) != '{') {
                // not a block header; resume right after the identifier
                index = headerStart + keyword.length();
                continue;
            }

            final int openBrace = index;
            final int closeBrace = HclLexer.findMatchingDelimiter(content, openBrace, '{', '}');
            if (closeBrace == HclLexer.NOT_FOUND) {
                final SourceLocation location = SourceLocation.of(content, openBrace);
                final String message = "Unclosed block '" + keyword + "': missing closing '}'";
                if (strict) {
                    throw new HclParseException(message, source, location);
                }
                final Diagnostic diagnostic = new Diagnostic(message, source, location);
                diagnostics.add(diagnostic);
                log.warn(diagnostic.format());
                break;
            }

            blocks.add(new RawBlock(
                    keyword,
                    BlockKind.fromKeyword(keyword),
                    labels,
                    content.substring(openBrace + 1, closeBrace).trim(),
                    normalizeRaw(content.substring(headerStart, closeBrace + 1)),
                    source,
                    headerStart,
                    closeBrace,
                    openBrace + 1,
                    closeBrace
            ));

            index = closeBrace + 1;
        }

        log.debug("Scanned {} block(s) from {}", blocks.size(), source);
        return new ScanResult(blocks, diagnostics);
    }

    /**
     * Strips the common indentation of all lines after the first and collapses alignment
     * padding around {@code =}, so the same block compares equal however it was indented.
     */
    static String normalizeRaw(String raw) {
        final String trimmed = raw.strip();
        final String[] lines = trimmed.split("\\r?\\n", -1);
        if (lines.length == 1) {
            return lines[0];
        }

        int minIndent = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            final String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            int indent = 0;
            while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
                indent++;
            }
            minIndent = Math.min(minIndent, indent);
        }
        if (minIndent == Integer.MAX_VALUE) {
            minIndent = 0;
        }

        final StringBuilder sb = new StringBuilder(trimmed.length());
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0) {
                line = line.substring(Math.min(minIndent, leadingWhitespace(line)));
                sb.append('\n');
            }
            line = PAD_BEFORE_EQ.matcher(line).replaceAll(" = ");
            line = PAD_AFTER_EQ.matcher(line).replaceAll(" = ");
            sb.append(line.stripTrailing());
        }
        return sb.toString();
    }

    private static int leadingWhitespace(String line) {
        int n = 0;
        while (n < line.length() && Character.isWhitespace(line.charAt(n))) {
            n++;
        }
        return n;
    }

    public record ScanResult(List<RawBlock> blocks, List<Diagnostic> diagnostics) {
        public ScanResult {
            blocks = List.copyOf(blocks);
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
