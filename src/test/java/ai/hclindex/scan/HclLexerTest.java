package ai.hclindex.scan;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class HclLexerTest {

    @Test
    void skipInsignificant_skipsAllCommentStyles() {
        final String text = "  # hash\n // slashes\n /* block */ x";
        assertEquals(text.indexOf('x'), HclLexer.skipInsignificant(text, 0));
    }

    @Test
    void findMatchingDelimiter_ignoresBracesInStringsAndComments() {
        final String text = "{ a = \"}\" # }\n }";
        assertEquals(text.length() - 1, HclLexer.findMatchingDelimiter(text, 0, '{', '}'));
    }

    @Test
    void findMatchingDelimiter_returnsNotFound_whenUnbalanced() {
        assertEquals(HclLexer.NOT_FOUND, HclLexer.findMatchingDelimiter("{ a = [1, 2 }", 6, '[', ']'));
        assertEquals(HclLexer.NOT_FOUND, HclLexer.findMatchingDelimiter("{ a = 1", 0, '{', '}'));
    }

    @Test
    void findStringEnd_skipsQuotesInsideInterpolation() {
        final String text = "\"a ${\"}\"} b\"";
        assertEquals(text.length() - 1, HclLexer.findStringEnd(text, 0));
    }

    @Test
    void findStringEnd_honoursEscapes() {
        final String text = "\"say \\\"hi\\\"\" rest";
        assertEquals(text.indexOf(" rest") - 1, HclLexer.findStringEnd(text, 0));
    }

    @Test
    void consumeHeredoc_stopsAtTerminatorLine() {
        final String text = "<<EOT\nhello\nEOT\nrest";
        assertEquals(text.indexOf("\nrest"), HclLexer.consumeHeredoc(text, 0));
        assertEquals("EOT", HclLexer.heredocMarker(text, 0));
    }

    @Test
    void consumeHeredoc_acceptsIndentedTerminator() {
        final String text = "<<-EOT\n    indented\n    EOT\n";
        assertEquals(text.length() - 1, HclLexer.consumeHeredoc(text, 0));
    }

    @Test
    void readValue_capturesMultiLineArray() {
        final String text = "[\n  1,\n  2\n]\nnext = 1";
        assertEquals("[\n  1,\n  2\n]", HclLexer.readValue(text, 0).raw());
    }

    @Test
    void readValue_stopsAtTrailingComment() {
        assertEquals("var.x", HclLexer.readValue(" var.x # note\nb = 2", 0).raw());
    }

    @Test
    void splitArrayElements_respectsNesting() {
        final List<String> elements = HclLexer.splitArrayElements("[a, [b, c], { d = \"e,f\" }, f(g, h)]");
        assertEquals(List.of("a", "[b, c]", "{ d = \"e,f\" }", "f(g, h)"), elements);
    }

    @Test
    void splitObjectEntries_acceptsNewlinesCommasAndQuotedKeys() {
        final List<HclLexer.ObjectEntry> entries = HclLexer.splitObjectEntries(
                "{\n  name = \"web\"\n  \"Cost-Center\" = 42, (var.key) = true\n}");

        assertEquals(3, entries.size());
        assertEquals(new HclLexer.ObjectEntry("name", "\"web\""), entries.get(0));
        assertEquals(new HclLexer.ObjectEntry("Cost-Center", "42"), entries.get(1));
        assertEquals(new HclLexer.ObjectEntry("(var.key)", "true"), entries.get(2));
    }

    @Test
    void decode_handlesEscapes() {
        assertEquals("a\"b\nc", HclLexer.decode("a\\\"b\\nc", '"'));
    }

    @Test
    void findStringEnd_survivesDeeplyNestedInterpolations() {
        final int depth = 5_000;
        final String text = "\"" + "${\"".repeat(depth) + "x" + "\"}".repeat(depth) + "\" tail";

        assertEquals(text.indexOf(" tail") - 1, HclLexer.findStringEnd(text, 0));
    }

    @Test
    void decode_unescapesTemplateMarkers() {
        assertEquals("${a} %{b} $c", HclLexer.decode("$${a} %%{b} $c", '"'));
    }
}
