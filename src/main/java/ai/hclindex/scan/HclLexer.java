package ai.hclindex.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Position-based scanning primitives for HCL text.
 * <p>
 * Every method takes an explicit position and returns a new one; nothing here keeps a cursor.
 * All primitives fail open: malformed input yields the end of the text or {@link #NOT_FOUND},
 * never an exception. Callers decide what to report.
 */
public final class HclLexer {

    public static final int NOT_FOUND = -1;

    /**
     * Interpolations nested deeper than this are skipped by brace counting alone; quotes inside
     * them no longer open strings.
     */
    public static final int MAX_TEMPLATE_DEPTH = 64;

    private static final Pattern HEREDOC_HEADER = Pattern.compile("<<-?[ \\t]*\"?([A-Za-z0-9_]+)\"?");

    private HclLexer() {
    }

    public static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    public static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    public static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    /**
     * A character is escaped iff it is preceded by an odd number of backslashes.
     */
    public static boolean isEscaped(String text, int index) {
        int count = 0;
        int pos = index - 1;
        while (pos >= 0 && text.charAt(pos) == '\\') {
            count++;
            pos--;
        }
        return count % 2 == 1;
    }

    /**
     * Skips whitespace and {@code //}, {@code #} and {@code /* *}{@code /} comments.
     * Never enters quoted strings.
     *
     * @return position of the next significant character, or {@code text.length()}
     */
    public static int skipInsignificant(String text, int pos) {
        final int length = text.length();
        int index = pos;
        while (index < length) {
            final char c = text.charAt(index);
            if (Character.isWhitespace(c)) {
                index++;
                continue;
            }
            final int afterComment = skipComment(text, index);
            if (afterComment != index) {
                index = afterComment;
                continue;
            }
            break;
        }
        return index;
    }

    /**
     * Skips spaces and tabs only; a newline is significant to attribute values.
     */
    public static int skipHorizontalSpace(String text, int pos) {
        int index = pos;
        while (index < text.length() && (text.charAt(index) == ' ' || text.charAt(index) == '\t')) {
            index++;
        }
        return index;
    }

    /**
     * If a comment starts at {@code pos}, returns the position just past it; otherwise returns {@code pos}.
     * Line comments end after their newline.
     */
    public static int skipComment(String text, int pos) {
        final int length = text.length();
        if (pos >= length) {
            return pos;
        }
        final char c = text.charAt(pos);
        final char next = pos + 1 < length ? text.charAt(pos + 1) : '\0';
        if (c == '/' && next == '*') {
            final int end = text.indexOf("*/", pos + 2);
            return end < 0 ? length : end + 2;
        }
        if ((c == '/' && next == '/') || c == '#') {
            final int end = text.indexOf('\n', pos + 1);
            return end < 0 ? length : end + 1;
        }
        return pos;
    }

    public static boolean isCommentStart(String text, int pos) {
        return skipComment(text, pos) != pos;
    }

    /**
     * Index of the closing quote of the string opened at {@code pos}, or {@link #NOT_FOUND}.
     * Template interpolations ({@code ${ }} and {@code %{ }}) are skipped with their own nesting,
     * so quotes inside them do not close the outer string.
     */
    public static int findStringEnd(String text, int pos) {
        return findStringEnd(text, pos, 0);
    }

    private static int findStringEnd(String text, int pos, int templateDepth) {
        final int length = text.length();
        final char quote = text.charAt(pos);
        int index = pos + 1;
        while (index < length) {
            final char c = text.charAt(index);
            if (c == '\\') {
                index += 2;
                continue;
            }
            if (c == quote) {
                return index;
            }
            if ((c == '$' || c == '%') && index + 1 < length) {
                final char next = text.charAt(index + 1);
                if (next == c && index + 2 < length && text.charAt(index + 2) == '{') {
                    // $${ and %%{ are literal
                    index += 3;
                    continue;
                }
                if (next == '{') {
                    index = skipInterpolation(text, index + 1, templateDepth + 1);
                    continue;
                }
            }
            index++;
        }
        return NOT_FOUND;
    }

    /**
     * Skips a quoted string starting at {@code pos}.
     *
     * @return position after the closing quote, or {@code text.length()} when unterminated
     */
    public static int skipString(String text, int pos) {
        final int end = findStringEnd(text, pos);
        return end == NOT_FOUND ? text.length() : end + 1;
    }

    /**
     * Skips a template interpolation whose opening brace is at {@code openBrace}.
     *
     * @return position after the closing brace, or {@code text.length()}
     */
    public static int skipInterpolation(String text, int openBrace) {
        return skipInterpolation(text, openBrace, 1);
    }

    private static int skipInterpolation(String text, int openBrace, int templateDepth) {
        final int length = text.length();
        int braces = 0;
        int index = openBrace;
        while (index < length) {
            final char c = text.charAt(index);
            if (isQuote(c) && templateDepth < MAX_TEMPLATE_DEPTH) {
                final int close = findStringEnd(text, index, templateDepth);
                index = close == NOT_FOUND ? length : close + 1;
                continue;
            }
            if (c == '{') {
                braces++;
            } else if (c == '}') {
                braces--;
                if (braces == 0) {
                    return index + 1;
                }
            }
            index++;
        }
        return length;
    }

    /**
     * Reads a quoted string and decodes {@code \n}, {@code \t}, {@code \r}, {@code \\} and escaped quotes.
     * Other escapes are kept verbatim.
     */
    public static QuotedString consumeQuotedString(String text, int pos) {
        final char quote = text.charAt(pos);
        final int close = findStringEnd(text, pos);
        final int contentEnd = close == NOT_FOUND ? text.length() : close;
        final int end = close == NOT_FOUND ? text.length() : close + 1;
        return new QuotedString(decode(text.substring(pos + 1, contentEnd), quote), end, close != NOT_FOUND);
    }

    /**
     * Decodes escape sequences of quoted string content (without the quotes).
     * The template escapes {@code $${} and {@code %%{} decode to {@code ${} and {@code %{}.
     */
    public static String decode(String content, char quote) {
        if (content.indexOf('\\') < 0 && !content.contains("$${") && !content.contains("%%{")) {
            return content;
        }
        final StringBuilder sb = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            final char c = content.charAt(i);
            if (c == '\\' && i + 1 < content.length()) {
                final char next = content.charAt(i + 1);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    default -> {
                        if (next == quote || next == '"') {
                            sb.append(next);
                        } else {
                            sb.append(c).append(next);
                        }
                    }
                }
                i += 2;
                continue;
            }
            if ((c == '$' || c == '%') && i + 2 < content.length()
                    && content.charAt(i + 1) == c && content.charAt(i + 2) == '{') {
                sb.append(c).append('{');
                i += 3;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    public static boolean isHeredocStart(String text, int pos) {
        return text.startsWith("<<", pos) && heredocMarker(text, pos) != null;
    }

    /**
     * Skips a heredoc ({@code <<IDENT} or {@code <<-IDENT}) starting at {@code pos}.
     * The terminator is the first following line equal to IDENT after trimming.
     *
     * @return end of the terminator line (before its newline); {@code text.length()} if the
     * terminator is missing; {@code pos + 2} if no heredoc header is present
     */
    public static int consumeHeredoc(String text, int pos) {
        final Matcher header = headerAt(text, pos);
        if (header == null) {
            return Math.min(pos + 2, text.length());
        }
        final String marker = header.group(1);
        int newline = text.indexOf('\n', header.end());
        while (newline >= 0) {
            final int lineStart = newline + 1;
            final int nextNewline = text.indexOf('\n', lineStart);
            final int lineEnd = nextNewline < 0 ? text.length() : nextNewline;
            if (text.substring(lineStart, lineEnd).trim().equals(marker)) {
                return lineEnd;
            }
            newline = nextNewline;
        }
        return text.length();
    }

    /**
     * Marker of the heredoc opened at {@code pos}, or null.
     */
    public static String heredocMarker(String text, int pos) {
        final Matcher header = headerAt(text, pos);
        return header == null ? null : header.group(1);
    }

    /**
     * Position just after the heredoc header (marker included), or {@link #NOT_FOUND}.
     */
    public static int heredocBodyStart(String text, int pos) {
        final Matcher header = headerAt(text, pos);
        return header == null ? NOT_FOUND : header.end();
    }

    private static Matcher headerAt(String text, int pos) {
        if (pos < 0 || pos >= text.length()) {
            return null;
        }
        final Matcher m = HEREDOC_HEADER.matcher(text);
        m.region(pos, text.length());
        return m.lookingAt() ? m : null;
    }

    /**
     * Finds the delimiter closing the one at {@code openPos}, counting nested pairs and skipping
     * quoted strings, heredocs and comments.
     *
     * @return index of the matching close delimiter, or {@link #NOT_FOUND}
     */
    public static int findMatchingDelimiter(String text, int openPos, char open, char close) {
        if (openPos < 0 || openPos >= text.length() || text.charAt(openPos) != open) {
            return NOT_FOUND;
        }
        final int length = text.length();
        int depth = 0;
        int index = openPos;
        while (index < length) {
            final char c = text.charAt(index);
            if (isQuote(c)) {
                index = skipString(text, index);
                continue;
            }
            if (c == '<' && isHeredocStart(text, index)) {
                index = consumeHeredoc(text, index);
                continue;
            }
            final int afterComment = skipComment(text, index);
            if (afterComment != index) {
                index = afterComment;
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return index;
                }
            }
            index++;
        }
        return NOT_FOUND;
    }

    /**
     * Reads {@code [A-Za-z_][A-Za-z0-9_-]*}; empty when no identifier starts at {@code pos}.
     */
    public static String readIdentifier(String text, int pos) {
        if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
            return "";
        }
        int end = pos + 1;
        while (end < text.length() && isIdentifierPart(text.charAt(end))) {
            end++;
        }
        return text.substring(pos, end);
    }

    /**
     * Like {@link #readIdentifier} but also accepts dots, e.g. {@code aws_instance.main.id}.
     */
    public static String readDottedIdentifier(String text, int pos) {
        if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
            return "";
        }
        int end = pos + 1;
        while (end < text.length() && (isIdentifierPart(text.charAt(end)) || text.charAt(end) == '.')) {
            end++;
        }
        return text.substring(pos, end);
    }

    /**
     * Reads an attribute value starting at {@code pos} (just after {@code =}).
     * <p>
     * The value ends at the first newline outside of brackets, so multi-line arrays, objects and
     * calls are captured whole. Heredocs run to their terminator line. A comment at bracket depth 0
     * ends the value.
     */
    public static ValueSpan readValue(String text, int pos) {
        final int length = text.length();
        int index = skipHorizontalSpace(text, pos);
        final int start = index;
        int depth = 0;

        while (index < length) {
            final char c = text.charAt(index);
            if (isQuote(c)) {
                index = skipString(text, index);
                continue;
            }
            if (c == '<' && isHeredocStart(text, index)) {
                index = consumeHeredoc(text, index);
                continue;
            }
            if (isCommentStart(text, index)) {
                if (depth == 0 && !(c == '/' && text.charAt(index + 1) == '*')) {
                    break;
                }
                index = skipComment(text, index);
                continue;
            }
            if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth = Math.max(depth - 1, 0);
            } else if ((c == '\n' || c == '\r') && depth == 0) {
                break;
            }
            index++;
        }
        return new ValueSpan(text.substring(start, index).trim(), index);
    }

    /**
     * Splits {@code [a, b, c]} into element texts, respecting nesting, strings and heredocs.
     * Comments between elements are dropped.
     */
    public static List<String> splitArrayElements(String raw) {
        final List<String> elements = new ArrayList<>();
        final String inner = innerOf(raw);
        if (inner.isBlank()) {
            return elements;
        }

        final StringBuilder current = new StringBuilder();
        final int length = inner.length();
        int depth = 0;
        int index = 0;
        while (index < length) {
            final char c = inner.charAt(index);
            if (isQuote(c)) {
                final int end = skipString(inner, index);
                current.append(inner, index, end);
                index = end;
                continue;
            }
            if (c == '<' && isHeredocStart(inner, index)) {
                final int end = consumeHeredoc(inner, index);
                current.append(inner, index, end);
                index = end;
                continue;
            }
            final int afterComment = skipComment(inner, index);
            if (afterComment != index) {
                current.append(' ');
                index = afterComment;
                continue;
            }
            if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addChunk(elements, current);
                current.setLength(0);
                index++;
                continue;
            }
            current.append(c);
            index++;
        }
        addChunk(elements, current);
        return elements;
    }

    /**
     * Splits {@code { key = value, "k2": v2 }} into entries. Keys may be bare (dotted) identifiers,
     * quoted strings or parenthesized expressions; entries are separated by commas or newlines.
     */
    public static List<ObjectEntry> splitObjectEntries(String raw) {
        final List<ObjectEntry> entries = new ArrayList<>();
        final String inner = innerOf(raw);
        final int length = inner.length();
        int index = 0;

        while (index < length) {
            index = skipInsignificant(inner, index);
            if (index >= length) {
                break;
            }
            if (inner.charAt(index) == ',') {
                index++;
                continue;
            }

            final String key;
            final char c = inner.charAt(index);
            if (isQuote(c)) {
                final QuotedString q = consumeQuotedString(inner, index);
                key = q.value();
                index = q.end();
            } else if (c == '(') {
                final int close = findMatchingDelimiter(inner, index, '(', ')');
                final int end = close == NOT_FOUND ? length : close + 1;
                key = inner.substring(index, end);
                index = end;
            } else {
                key = readDottedIdentifier(inner, index);
                index += key.length();
            }
            if (key.isEmpty()) {
                index++;
                continue;
            }

            index = skipHorizontalSpace(inner, index);
            if (index < length && (inner.charAt(index) == '=' || inner.charAt(index) == ':')) {
                index++;
            }

            final ValueSpan value = readEntryValue(inner, index);
            entries.add(new ObjectEntry(key, value.raw()));
            index = value.end();
        }
        return entries;
    }

    private static ValueSpan readEntryValue(String text, int pos) {
        final int length = text.length();
        int index = skipHorizontalSpace(text, pos);
        final int start = index;
        int depth = 0;

        while (index < length) {
            final char c = text.charAt(index);
            if (isQuote(c)) {
                index = skipString(text, index);
                continue;
            }
            if (c == '<' && isHeredocStart(text, index)) {
                index = consumeHeredoc(text, index);
                continue;
            }
            if (isCommentStart(text, index)) {
                if (depth == 0 && !(c == '/' && text.charAt(index + 1) == '*')) {
                    break;
                }
                index = skipComment(text, index);
                continue;
            }
            if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if ((c == ',' || c == '\n') && depth == 0) {
                break;
            }
            index++;
        }
        return new ValueSpan(text.substring(start, index).trim(), index);
    }

    private static String innerOf(String raw) {
        final String trimmed = raw.trim();
        if (trimmed.length() < 2) {
            return "";
        }
        return trimmed.substring(1, trimmed.length() - 1);
    }

    private static void addChunk(List<String> out, StringBuilder chunk) {
        final String s = chunk.toString().trim();
        if (!s.isEmpty()) {
            out.add(s);
        }
    }

    public record QuotedString(String value, int end, boolean terminated) {
    }

    public record ValueSpan(String raw, int end) {
    }

    public record ObjectEntry(String key, String value) {
    }
}
