package ai.hclindex.parse;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ai.hclindex.model.CountReference;
import ai.hclindex.model.DataReference;
import ai.hclindex.model.EachReference;
import ai.hclindex.model.LocalReference;
import ai.hclindex.model.ModuleOutputReference;
import ai.hclindex.model.PathReference;
import ai.hclindex.model.Reference;
import ai.hclindex.model.ResourceReference;
import ai.hclindex.model.SelfReference;
import ai.hclindex.model.VariableReference;

import static org.junit.jupiter.api.Assertions.*;

final class ReferenceExtractorTest {

    @Test
    void classifiesChainHeads() {
        assertEquals(List.of(new VariableReference("region")), ReferenceExtractor.extract("var.region"));
        assertEquals(List.of(new LocalReference("prefix")), ReferenceExtractor.extract("local.prefix"));
        assertEquals(List.of(new ModuleOutputReference("vpc", "vpc_id")), ReferenceExtractor.extract("module.vpc.vpc_id"));
        assertEquals(List.of(new DataReference("aws_ami", "ubuntu", "id")),
                ReferenceExtractor.extract("data.aws_ami.ubuntu.id"));
        assertEquals(List.of(new PathReference("module")), ReferenceExtractor.extract("path.module"));
        assertEquals(List.of(new SelfReference("private_ip")), ReferenceExtractor.extract("self.private_ip"));
        assertEquals(List.of(new ResourceReference("aws_instance", "web", null)),
                ReferenceExtractor.extract("aws_instance.web"));
    }

    @Test
    void moduleWithoutOutput_usesModuleName() {
        assertEquals(List.of(new ModuleOutputReference("vpc", "vpc")), ReferenceExtractor.extract("module.vpc"));
    }

    @Test
    void incompleteDataChain_isIgnored() {
        assertTrue(ReferenceExtractor.extract("data.aws_ami").isEmpty());
    }

    @Test
    void contextualReferences() {
        assertEquals(List.of(new EachReference("key"), new CountReference()),
                ReferenceExtractor.extract("\"${each.key}-${count.index}\""));
        assertEquals(List.of(new EachReference("value")), ReferenceExtractor.extract("each.value.name"));
        assertTrue(ReferenceExtractor.extract("each.other").isEmpty());
    }

    @Test
    void indexesAreStripped_andSplatsFlagged() {
        assertEquals(List.of(new ResourceReference("aws_instance", "web", "id")),
                ReferenceExtractor.extract("aws_instance.web[0].id"));
        assertEquals(List.of(new ResourceReference("aws_instance", "web", "id", true)),
                ReferenceExtractor.extract("aws_instance.web[*].id"));
        assertEquals(List.of(new ResourceReference("aws_instance", "web", "id", true)),
                ReferenceExtractor.extract("aws_instance.web.*.id"));
    }

    @Test
    void referencesInsideIndexBrackets_areFound() {
        assertEquals(List.of(new ResourceReference("aws_subnet", "private", "id"), new VariableReference("zone")),
                ReferenceExtractor.extract("aws_subnet.private[var.zone].id"));
    }

    @Test
    void forBoundNames_areNotReferences() {
        assertEquals(List.of(new VariableReference("subnets")),
                ReferenceExtractor.extract("[for s in var.subnets : s.id]"));
        assertEquals(List.of(new VariableReference("m")),
                ReferenceExtractor.extract("{ for k, v in var.m : k => v.name }"));
    }

    @Test
    void literalTextAndComments_areNotScanned() {
        assertEquals(List.of(new LocalReference("real")),
                ReferenceExtractor.extract("\"prefix var.ignored ${local.real}\""));
        assertEquals(List.of(new VariableReference("m")), ReferenceExtractor.extract("lookup(var.m, \"var.not\")"));
        assertEquals(List.of(new VariableReference("real")),
                ReferenceExtractor.extract("# var.commented\nvar.real"));
    }

    @Test
    void duplicates_areCollapsedInFirstSeenOrder() {
        assertEquals(List.of(new VariableReference("a"), new VariableReference("b")),
                ReferenceExtractor.extract("\"${var.a} ${var.b} ${var.a}\""));
        final List<Reference> unique = ReferenceExtractor.unique(
                List.of(new LocalReference("x"), new LocalReference("y"), new LocalReference("x")));
        assertEquals(List.of(new LocalReference("x"), new LocalReference("y")), unique);
    }

    @Test
    void classifyChain_skipsBoundHeads() {
        assertNull(ReferenceExtractor.classifyChain("item.value", Set.of("item")));
        assertEquals(new ResourceReference("item", "value", null),
                ReferenceExtractor.classifyChain("item.value", Set.of()));
    }

    @Test
    void numbersAndBareIdentifiers_haveNoReferences() {
        assertTrue(ReferenceExtractor.extract("1.5").isEmpty());
        assertTrue(ReferenceExtractor.extract("identifier").isEmpty());
        assertTrue(ReferenceExtractor.extract("").isEmpty());
    }

    @Test
    void longArithmeticIndex_isScannedWithoutFailure() {
        final String raw = "aws_subnet.a[" + "1 + ".repeat(20_000) + "var.offset].id";

        assertEquals(List.of(new ResourceReference("aws_subnet", "a", "id"), new VariableReference("offset")),
                ReferenceExtractor.extract(raw));
    }

    @Test
    void deeplyNestedInterpolations_keepOuterReferences() {
        final int depth = 5_000;
        final String raw = "\"${var.top}-" + "${\"".repeat(depth) + "x" + "\"}".repeat(depth) + "\"";

        assertEquals(List.of(new VariableReference("top")), ReferenceExtractor.extract(raw));
    }
}
