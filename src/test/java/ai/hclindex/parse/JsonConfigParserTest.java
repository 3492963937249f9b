package ai.hclindex.parse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import ai.hclindex.model.ArrayValue;
import ai.hclindex.model.Document;
import ai.hclindex.model.DynamicBlock;
import ai.hclindex.model.ExpressionKind;
import ai.hclindex.model.ExpressionValue;
import ai.hclindex.model.LiteralValue;
import ai.hclindex.model.LocalReference;
import ai.hclindex.model.PrimitiveType;
import ai.hclindex.model.ResourceBlock;
import ai.hclindex.model.ResourceReference;
import ai.hclindex.model.VariableBlock;
import ai.hclindex.model.VariableReference;

import static org.junit.jupiter.api.Assertions.*;

final class JsonConfigParserTest {

    private static final String CONFIG = """
            {
              "variable": {"region": {"type": "string", "default": "us-east-1",
                "validation": [{"condition": "length(var.region) > 0", "error_message": "empty"}]}},
              "provider": {"aws": [{"region": "${var.region}"}, {"alias": "west", "region": "us-west-2"}]},
              "resource": {"aws_s3_bucket": {"logs": {
                "bucket": "${local.prefix}-logs",
                "count": 2,
                "depends_on": ["aws_s3_bucket.other"],
                "dynamic": {"rule": {"for_each": "${var.rules}", "content": {"id": "${rule.value}"}}}
              }}},
              "locals": {"prefix": "demo"},
              "output": {"arn": {"value": "${aws_s3_bucket.logs.arn}", "sensitive": true}}
            }
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonConfigParser parser = new JsonConfigParser(mapper);

    @TempDir
    Path dir;

    @Test
    void mapsBlocksOntoNativeRecords() throws IOException {
        final Document doc = parser.parse(mapper.readTree(CONFIG), "main.tf.json");

        final VariableBlock v = doc.variable().get(0);
        assertEquals("region", v.name());
        assertEquals(new PrimitiveType("string", false, "string"), v.typeConstraint());
        assertEquals(new LiteralValue("us-east-1", "us-east-1"), v.defaultValue());
        assertEquals(ExpressionKind.FUNCTION_CALL,
                assertInstanceOf(ExpressionValue.class, v.validations().get(0).condition()).kind());

        assertEquals(2, doc.provider().size());
        assertNull(doc.provider().get(0).alias());
        assertEquals("west", doc.provider().get(1).alias());
        assertFalse(doc.provider().get(1).properties().containsKey("alias"));

        assertEquals(new LiteralValue("demo", "demo"), doc.locals().get(0).value());
        assertEquals(List.of(new ResourceReference("aws_s3_bucket", "logs", "arn")),
                doc.output().get(0).value().references());
        assertEquals(Boolean.TRUE, doc.output().get(0).sensitive());
    }

    @Test
    void resourceStrings_areTemplatesOnlyWhenInterpolated() throws IOException {
        final ResourceBlock r = parser.parse(mapper.readTree(CONFIG), "main.tf.json").resource().get(0);

        final ExpressionValue bucket = assertInstanceOf(ExpressionValue.class, r.properties().get("bucket"));
        assertEquals(ExpressionKind.TEMPLATE, bucket.kind());
        assertEquals(List.of(new LocalReference("prefix")), bucket.references());

        assertEquals(new LiteralValue(2L, "2"), r.meta().get("count"));
        final ArrayValue dependsOn = assertInstanceOf(ArrayValue.class, r.meta().get("depends_on"));
        assertEquals(List.of(new ResourceReference("aws_s3_bucket", "other", null)), dependsOn.references());

        assertEquals(1, r.dynamicBlocks().size());
        final DynamicBlock rule = r.dynamicBlocks().get(0);
        assertEquals("rule", rule.label());
        assertEquals(List.of(new VariableReference("rules")), rule.forEach().references());
        assertTrue(rule.content().containsKey("id"));
        assertFalse(r.properties().containsKey("dynamic"));
    }

    @Test
    void nonObjectRoot_yieldsEmptyDocument() throws IOException {
        assertEquals(0, parser.parse(mapper.readTree("[1, 2]"), "x.tf.json").blockCount());
    }

    @Test
    void parseFile_readsFromDisk() throws IOException {
        final Path file = Files.writeString(dir.resolve("main.tf.json"), CONFIG);

        assertEquals(1, parser.parseFile(file).resource().size());
    }

    @Test
    void convert_mapsJsonScalarsAndContainers() throws IOException {
        assertEquals(new LiteralValue(null, "null"), parser.convert(mapper.readTree("null")));
        assertEquals(new LiteralValue(Boolean.TRUE, "true"), parser.convert(mapper.readTree("true")));
        assertEquals(new LiteralValue(1.5, "1.5"), parser.convert(mapper.readTree("1.5")));
        final ArrayValue a = assertInstanceOf(ArrayValue.class, parser.convert(mapper.readTree("[\"${var.a}\", \"b\"]")));
        assertEquals(List.of(new VariableReference("a")), a.references());
    }
}
