package ai.hclindex.parse;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.hclindex.model.ArrayValue;
import ai.hclindex.model.ExpressionKind;
import ai.hclindex.model.ExpressionValue;
import ai.hclindex.model.LiteralValue;
import ai.hclindex.model.LocalReference;
import ai.hclindex.model.ObjectValue;
import ai.hclindex.model.ResourceReference;
import ai.hclindex.model.Value;
import ai.hclindex.model.VariableReference;

import static org.junit.jupiter.api.Assertions.*;

final class ValueClassifierTest {

    @Test
    void classifiesKeywordsAndNumbers() {
        assertEquals(new LiteralValue(Boolean.TRUE, "true"), ValueClassifier.classify("true"));
        assertEquals(new LiteralValue(Boolean.FALSE, "false"), ValueClassifier.classify(" false "));
        assertEquals(new LiteralValue(null, "null"), ValueClassifier.classify("null"));
        assertEquals(new LiteralValue(42L, "42"), ValueClassifier.classify("42"));
        assertEquals(new LiteralValue(-5L, "-5"), ValueClassifier.classify("-5"));
        assertEquals(new LiteralValue(3.14, "3.14"), ValueClassifier.classify("3.14"));
        assertEquals(new LiteralValue(1000.0, "1e3"), ValueClassifier.classify("1e3"));
    }

    @Test
    void hugeInteger_fallsBackToDouble() {
        final LiteralValue v = (LiteralValue) ValueClassifier.classify("99999999999999999999");
        assertInstanceOf(Double.class, v.value());
    }

    @Test
    void quotedString_isDecodedLiteral() {
        final Value v = ValueClassifier.classify("\"hello \\\"world\\\"\"");

        assertEquals(new LiteralValue("hello \"world\"", "\"hello \\\"world\\\"\""), v);
        assertTrue(v.references().isEmpty());
    }

    @Test
    void interpolatedString_isTemplateWithReferences() {
        final Value v = ValueClassifier.classify("\"${var.env}-bucket\"");

        final ExpressionValue e = assertInstanceOf(ExpressionValue.class, v);
        assertEquals(ExpressionKind.TEMPLATE, e.kind());
        assertEquals("\"${var.env}-bucket\"", e.raw());
        assertEquals(List.of(new VariableReference("env")), e.references());
    }

    @Test
    void heredoc_isTemplate() {
        final ExpressionValue e = (ExpressionValue) ValueClassifier.classify("<<EOT\nhello ${var.name}\nEOT");

        assertEquals(ExpressionKind.TEMPLATE, e.kind());
        assertEquals(List.of(new VariableReference("name")), e.references());
    }

    @Test
    void array_collectsDeduplicatedElementReferences() {
        final ArrayValue a = assertInstanceOf(ArrayValue.class, ValueClassifier.classify("[var.a, local.b, var.a]"));

        assertEquals(3, a.elements().size());
        assertEquals(List.of(new VariableReference("a"), new LocalReference("b")), a.references());
    }

    @Test
    void object_keepsEntryOrderAndNestedReferences() {
        final ObjectValue o = assertInstanceOf(ObjectValue.class,
                ValueClassifier.classify("{\n  name = var.n\n  tags = { env = local.e }\n}"));

        assertEquals(List.of("name", "tags"), List.copyOf(o.entries().keySet()));
        assertInstanceOf(ObjectValue.class, o.entries().get("tags"));
        assertEquals(List.of(new VariableReference("n"), new LocalReference("e")), o.references());
    }

    @Test
    void parenthesizedKey_contributesReferences() {
        final ObjectValue o = (ObjectValue) ValueClassifier.classify("{ (var.key) = 1 }");

        assertEquals(List.of(new VariableReference("key")), o.references());
    }

    @Test
    void detectsExpressionKinds() {
        assertEquals(ExpressionKind.CONDITIONAL, kindOf("var.enabled ? 1 : 0"));
        assertEquals(ExpressionKind.FUNCTION_CALL, kindOf("length(var.list)"));
        assertEquals(ExpressionKind.FOR_EXPR, kindOf("[for s in var.subnets : s.id]"));
        assertEquals(ExpressionKind.FOR_EXPR, kindOf("{ for k, v in var.m : k => v }"));
        assertEquals(ExpressionKind.SPLAT, kindOf("aws_instance.web[*].id"));
        assertEquals(ExpressionKind.SPLAT, kindOf("aws_instance.web.*.id"));
        assertEquals(ExpressionKind.TRAVERSAL, kindOf("aws_s3_bucket.demo.arn"));
        assertEquals(ExpressionKind.TRAVERSAL, kindOf("identifier"));
        assertEquals(ExpressionKind.UNKNOWN, kindOf("a + b"));
    }

    @Test
    void traversal_yieldsResourceReference() {
        assertEquals(List.of(new ResourceReference("aws_s3_bucket", "demo", "arn")),
                ValueClassifier.classify("aws_s3_bucket.demo.arn").references());
    }

    @Test
    void unbalancedOrTrailingBrackets_areExpressions() {
        assertInstanceOf(ExpressionValue.class, ValueClassifier.classify("[1, 2"));
        assertInstanceOf(ExpressionValue.class, ValueClassifier.classify("[1, 2][0]"));
        assertInstanceOf(ExpressionValue.class, ValueClassifier.classify("\"unterminated"));
    }

    @Test
    void emptyInput_isUnknownExpression() {
        assertEquals(new ExpressionValue(ExpressionKind.UNKNOWN, "", List.of()), ValueClassifier.classify("   "));
        assertEquals(new ExpressionValue(ExpressionKind.UNKNOWN, "", List.of()), ValueClassifier.classify(null));
    }

    @Test
    void deepNesting_stopsAtDepthLimit_keepingReferences() {
        final String raw = "[".repeat(70) + "var.x" + "]".repeat(70);

        Value v = assertDoesNotThrow(() -> ValueClassifier.classify(raw));

        assertEquals(List.of(new VariableReference("x")), v.references());
        int arrays = 0;
        while (v instanceof ArrayValue a) {
            arrays++;
            v = a.elements().get(0);
        }
        assertEquals(ValueClassifier.MAX_DEPTH, arrays);
        assertEquals(ExpressionKind.UNKNOWN, ((ExpressionValue) v).kind());
    }

    @Test
    void reclassifyingRaw_isStable() {
        for (String raw : List.of("42", "\"hello\"", "[1, \"a\", var.x]", "{ a = 1, b = \"x\" }",
                "\"${local.p}-x\"", "length(var.l)", "true")) {
            final Value first = ValueClassifier.classify(raw);
            assertEquals(first, ValueClassifier.classify(first.raw()), raw);
        }
    }

    @Test
    void hasInterpolation_ignoresEscapedMarkers() {
        assertTrue(ValueClassifier.hasInterpolation("a ${b}"));
        assertTrue(ValueClassifier.hasInterpolation("%{ if x }y%{ endif }"));
        assertFalse(ValueClassifier.hasInterpolation("a $${b}"));
        assertFalse(ValueClassifier.hasInterpolation("plain"));
    }

    private static ExpressionKind kindOf(String raw) {
        return ((ExpressionValue) ValueClassifier.classify(raw)).kind();
    }

    @Test
    void longIndexText_isClassifiedAsTraversal() {
        final String raw = "var.docs[\"" + "x".repeat(60_000) + "\"]";

        final ExpressionValue e = assertInstanceOf(ExpressionValue.class, ValueClassifier.classify(raw));

        assertEquals(ExpressionKind.TRAVERSAL, e.kind());
        assertEquals(List.of(new VariableReference("docs")), e.references());
    }

    @Test
    void longIndexTextInsideTemplate_keepsReference() {
        final String raw = "\"${local.tags[\"" + "y".repeat(60_000) + "\"]}\"";

        final ExpressionValue e = assertInstanceOf(ExpressionValue.class, ValueClassifier.classify(raw));

        assertEquals(ExpressionKind.TEMPLATE, e.kind());
        assertEquals(List.of(new LocalReference("tags")), e.references());
    }

    @Test
    void escapedInterpolation_isDecodedLiteral() {
        assertEquals(new LiteralValue("${foo}", "\"$${foo}\""), ValueClassifier.classify("\"$${foo}\""));
        assertEquals(new LiteralValue("%{ if x }", "\"%%{ if x }\""), ValueClassifier.classify("\"%%{ if x }\""));
    }
}
