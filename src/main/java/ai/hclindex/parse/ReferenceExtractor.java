package ai.hclindex.parse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.hclindex.model.CountReference;
import ai.hclindex.model.DataReference;
import ai.hclindex.model.EachReference;
import ai.hclindex.model.Ids;
import ai.hclindex.model.LocalReference;
import ai.hclindex.model.ModuleOutputReference;
import ai.hclindex.model.PathReference;
import ai.hclindex.model.Reference;
import ai.hclindex.model.ResourceReference;
import ai.hclindex.model.SelfReference;
import ai.hclindex.model.VariableReference;
import ai.hclindex.scan.HclLexer;

/**
 * Extracts references from expression text by indexing dotted traversal chains.
 * <p>
 * Literal text of strings and heredocs is masked first, so only interpolations are scanned.
 * Names bound by {@code for} expressions or directives are not references.
 */
public final class ReferenceExtractor {

    private static final String IDENT = "[A-Za-z_][\\w-]*";
    // quantifiers are possessive so long index text cannot overflow the regex stack
    private static final String INDEX = "\\[(?:[^\\[\\]]++|\\[[^\\[\\]]*+\\])*+\\]";

    private static final Pattern TRAVERSAL = Pattern.compile(
            "(?<![\\w.])" + IDENT + "(?:" + INDEX + ")*+(?:\\.(?:" + IDENT + "|\\*|\\d+)(?:" + INDEX + ")*+)++");

    private static final Pattern INDEX_CONTENT = Pattern.compile(INDEX);

    private static final Pattern FOR_BINDING = Pattern.compile(
            "\\bfor\\s+(" + IDENT + ")(?:\\s*,\\s*(" + IDENT + "))?\\s+in\\b");

    private ReferenceExtractor() {
    }

    public static List<Reference> extract(String raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        final String text = scannableText(raw);
        final Set<String> bound = boundNames(text);
        final Set<Reference> refs = new LinkedHashSet<>();
        collect(text, bound, refs);
        return List.copyOf(refs);
    }

    /**
     * Deduplicates by structural equality, keeping first occurrence order.
     */
    public static List<Reference> unique(Collection<Reference> refs) {
        return List.copyOf(new LinkedHashSet<>(refs));
    }

    private static void collect(String text, Set<String> bound, Set<Reference> out) {
        final Matcher m = TRAVERSAL.matcher(text);
        while (m.find()) {
            final String chain = m.group();
            final Reference ref = classifyChain(chain, bound);
            if (ref != null) {
                out.add(ref);
            }
            // references used as index keys, e.g. aws_subnet.main[var.zone]
            final Matcher idx = INDEX_CONTENT.matcher(chain);
            while (idx.find()) {
                final String inner = idx.group();
                if (!"[*]".equals(inner)) {
                    collect(inner.substring(1, inner.length() - 1), bound, out);
                }
            }
        }
    }

    static Reference classifyChain(String chain, Set<String> bound) {
        final List<String> segments = splitSegments(chain);
        final boolean splat = chain.contains("[*]") || segments.contains("*");

        final List<String> parts = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            final String part = Ids.stripIndexes(segments.get(i));
            if (i > 0 && ("*".equals(part) || isDigits(part))) {
                continue;
            }
            parts.add(part);
        }
        if (parts.size() < 2 || bound.contains(parts.get(0))) {
            return null;
        }

        final String head = parts.get(0);
        switch (head) {
            case "var":
                return new VariableReference(parts.get(1));
            case "local":
                return new LocalReference(parts.get(1));
            case "module": {
                final String rest = join(parts, 2);
                return new ModuleOutputReference(parts.get(1), rest != null ? rest : parts.get(1));
            }
            case "data":
                if (parts.size() < 3) {
                    return null;
                }
                return new DataReference(parts.get(1), parts.get(2), join(parts, 3), splat);
            case "path":
                return new PathReference(parts.get(1));
            case "each":
                return "key".equals(parts.get(1)) || "value".equals(parts.get(1))
                        ? new EachReference(parts.get(1))
                        : null;
            case "count":
                return "index".equals(parts.get(1)) ? new CountReference() : null;
            case "self":
                return new SelfReference(parts.get(1));
            default:
                return new ResourceReference(head, parts.get(1), join(parts, 2), splat);
        }
    }

    private static List<String> splitSegments(String chain) {
        final List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < chain.length(); i++) {
            final char c = chain.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == '.' && depth == 0) {
                out.add(chain.substring(start, i));
                start = i + 1;
            }
        }
        out.add(chain.substring(start));
        return out;
    }

    private static String join(List<String> parts, int from) {
        if (parts.size() <= from) {
            return null;
        }
        return String.join(".", parts.subList(from, parts.size()));
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> boundNames(String text) {
        final Set<String> names = new HashSet<>();
        final Matcher m = FOR_BINDING.matcher(text);
        while (m.find()) {
            names.add(m.group(1));
            if (m.group(2) != null) {
                names.add(m.group(2));
            }
        }
        return names;
    }

    /**
     * Copy of {@code raw} where comments and literal string/heredoc text are blanked out,
     * leaving code and template interpolations in place.
     */
    static String scannableText(String raw) {
        return scannableText(raw, 0);
    }

    private static String scannableText(String raw, int templateDepth) {
        final StringBuilder out = new StringBuilder(raw.length());
        final int length = raw.length();
        int index = 0;
        while (index < length) {
            final char c = raw.charAt(index);
            if (HclLexer.isQuote(c)) {
                final int close = HclLexer.findStringEnd(raw, index);
                final int contentEnd = close == HclLexer.NOT_FOUND ? length : close;
                out.append(' ');
                maskTemplate(raw, index + 1, contentEnd, out, templateDepth);
                if (close != HclLexer.NOT_FOUND) {
                    out.append(' ');
                }
                index = close == HclLexer.NOT_FOUND ? length : close + 1;
                continue;
            }
            if (c == '<' && HclLexer.isHeredocStart(raw, index)) {
                final int bodyStart = HclLexer.heredocBodyStart(raw, index);
                final int end = HclLexer.consumeHeredoc(raw, index);
                blank(out, bodyStart - index);
                maskTemplate(raw, bodyStart, end, out, templateDepth);
                index = end;
                continue;
            }
            final int afterComment = HclLexer.skipComment(raw, index);
            if (afterComment != index) {
                blank(out, afterComment - index);
                index = afterComment;
                continue;
            }
            out.append(c);
            index++;
        }
        return out.toString();
    }

    private static void maskTemplate(String raw, int from, int to, StringBuilder out, int templateDepth) {
        int i = from;
        while (i < to) {
            final char c = raw.charAt(i);
            if (c == '\\') {
                blank(out, Math.min(2, to - i));
                i += 2;
                continue;
            }
            if ((c == '$' || c == '%') && i + 1 < to) {
                final char next = raw.charAt(i + 1);
                if (next == c && i + 2 < to && raw.charAt(i + 2) == '{') {
                    blank(out, 3);
                    i += 3;
                    continue;
                }
                if (next == '{') {
                    final int end = Math.min(HclLexer.skipInterpolation(raw, i + 1), to);
                    final boolean closed = end > i + 2 && raw.charAt(end - 1) == '}';
                    final int innerEnd = closed ? end - 1 : end;
                    blank(out, 2);
                    if (templateDepth + 1 < HclLexer.MAX_TEMPLATE_DEPTH) {
                        out.append(scannableText(raw.substring(i + 2, innerEnd), templateDepth + 1));
                    } else {
                        blank(out, innerEnd - (i + 2));
                    }
                    if (closed) {
                        out.append(' ');
                    }
                    i = end;
                    continue;
                }
            }
            out.append(c == '\n' ? '\n' : ' ');
            i++;
        }
    }

    private static void blank(StringBuilder out, int count) {
        for (int i = 0; i < count; i++) {
            out.append(' ');
        }
    }
}
