package ai.hclindex.scan;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.hclindex.model.BlockKind;
import ai.hclindex.model.HclParseException;
import ai.hclindex.model.RawBlock;

import static org.junit.jupiter.api.Assertions.*;

final class BlockScannerTest {

    @Test
    void scansKeywordLabelsAndBody() {
        final String content = """
                resource "aws_s3_bucket" "demo" {
                  bucket = "x"
                }
                """;

        final BlockScanner.ScanResult result = new BlockScanner().scan(content, "main.tf");

        assertEquals(1, result.blocks().size());
        assertTrue(result.diagnostics().isEmpty());
        final RawBlock block = result.blocks().get(0);
        assertEquals("resource", block.keyword());
        assertEquals(BlockKind.RESOURCE, block.kind());
        assertEquals(List.of("aws_s3_bucket", "demo"), block.labels());
        assertEquals("bucket = \"x\"", block.body());
        assertEquals("main.tf", block.source());
    }

    @Test
    void bracesInStringsAndComments_doNotEndBlocks() {
        final String content = """
                locals {
                  a = "}"
                  # }
                  /* { */
                }
                variable "v" {}
                """;

        final List<RawBlock> blocks = new BlockScanner().scan(content, "x.tf").blocks();

        assertEquals(2, blocks.size());
        assertEquals(BlockKind.LOCALS, blocks.get(0).kind());
        assertEquals(BlockKind.VARIABLE, blocks.get(1).kind());
        assertEquals("", blocks.get(1).body());
    }

    @Test
    void unknownKeyword_isKeptAsUnknownKind() {
        final List<RawBlock> blocks = new BlockScanner().scan("weird \"x\" { a = 1 }", "x.tf").blocks();

        assertEquals(1, blocks.size());
        assertEquals(BlockKind.UNKNOWN, blocks.get(0).kind());
        assertEquals("weird", blocks.get(0).keyword());
    }

    @Test
    void unterminatedBlock_reportsDiagnostic_whenLenient() {
        final String content = "variable \"ok\" {}\nresource \"a\" \"b\" {\n  x = 1\n";

        final BlockScanner.ScanResult result = assertDoesNotThrow(() -> new BlockScanner().scan(content, "x.tf"));

        assertEquals(1, result.blocks().size());
        assertEquals(1, result.diagnostics().size());
        assertEquals(2, result.diagnostics().get(0).location().line());
        assertTrue(result.diagnostics().get(0).message().contains("resource"));
    }

    @Test
    void unterminatedBlock_throws_whenStrict() {
        final HclParseException ex = assertThrows(HclParseException.class,
                () -> new BlockScanner(true).scan("resource \"a\" \"b\" {", "x.tf"));

        assertEquals("x.tf", ex.source());
        assertEquals(1, ex.location().line());
    }

    @Test
    void normalizeRaw_collapsesAlignmentPadding() {
        final String raw = "locals {\n  a    = 1\n  bb   = 2\n}";

        assertEquals("locals {\n  a = 1\n  bb = 2\n}", BlockScanner.normalizeRaw(raw));
    }

    @Test
    void normalizeRaw_keepsComparisonOperators() {
        final String raw = "locals {\n  a = x  == y\n}";

        assertEquals(raw, BlockScanner.normalizeRaw(raw));
    }

    @Test
    void emptyContent_yieldsNothing() {
        final BlockScanner.ScanResult result = new BlockScanner().scan("# only a comment\n", "x.tf");

        assertTrue(result.blocks().isEmpty());
        assertTrue(result.diagnostics().isEmpty());
    }
}
