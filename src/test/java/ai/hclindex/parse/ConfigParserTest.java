package ai.hclindex.parse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.hclindex.model.ArrayValue;
import ai.hclindex.model.DataReference;
import ai.hclindex.model.Document;
import ai.hclindex.model.DynamicBlock;
import ai.hclindex.model.HclParseException;
import ai.hclindex.model.LiteralValue;
import ai.hclindex.model.LocalValue;
import ai.hclindex.model.ModuleBlock;
import ai.hclindex.model.ObjectValue;
import ai.hclindex.model.OutputBlock;
import ai.hclindex.model.PrimitiveType;
import ai.hclindex.model.ProviderBlock;
import ai.hclindex.model.ResourceBlock;
import ai.hclindex.model.ResourceReference;
import ai.hclindex.model.VariableBlock;
import ai.hclindex.model.VariableReference;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigParserTest {

    @TempDir
    Path dir;

    private final ConfigParser parser = new ConfigParser();

    @Test
    void resource_splitsPropertiesMetaAndBlocks() {
        final String content = """
                resource "aws_instance" "web" {
                  count      = 2
                  ami        = data.aws_ami.ubuntu.id
                  provider   = aws.west
                  depends_on = [aws_s3_bucket.logs]

                  lifecycle {
                    create_before_destroy = true
                  }

                  dynamic "ebs_block_device" {
                    for_each = var.disks
                    content {
                      device_name = ebs_block_device.value.name
                    }
                  }

                  root_block_device {
                    volume_size = var.size
                  }
                }
                """;

        final Document doc = parser.parseText(content, "main.tf").document();

        assertEquals(1, doc.resource().size());
        final ResourceBlock r = doc.resource().get(0);
        assertEquals("aws_instance", r.type());
        assertEquals("web", r.name());
        assertEquals(List.of("ami"), List.copyOf(r.properties().keySet()));
        assertEquals(List.of(new DataReference("aws_ami", "ubuntu", "id")), r.properties().get("ami").references());
        assertTrue(r.meta().keySet().containsAll(List.of("count", "provider", "depends_on", "lifecycle")));
        assertEquals(4, r.meta().size());
        assertInstanceOf(ObjectValue.class, r.meta().get("lifecycle"));
        assertEquals(List.of(new ResourceReference("aws_s3_bucket", "logs", null)),
                r.meta().get("depends_on").references());

        assertEquals(1, r.blocks().size());
        assertEquals("root_block_device", r.blocks().get(0).type());

        assertEquals(1, r.dynamicBlocks().size());
        final DynamicBlock dyn = r.dynamicBlocks().get(0);
        assertEquals("ebs_block_device", dyn.label());
        assertNull(dyn.iterator());
        assertEquals("ebs_block_device", dyn.iteratorName());
        assertEquals(List.of(new VariableReference("disks")), dyn.forEach().references());
        assertTrue(dyn.content().containsKey("device_name"));
    }

    @Test
    void variable_withTypeDefaultAndValidation() {
        final String content = """
                variable "env" {
                  type        = string
                  default     = "dev"
                  description = "Environment"
                  sensitive   = false

                  validation {
                    condition     = contains(["dev", "prod"], var.env)
                    error_message = "Invalid env."
                  }
                }
                """;

        final VariableBlock v = parser.parseText(content, "variables.tf").document().variable().get(0);

        assertEquals("env", v.name());
        assertEquals("string", v.type());
        assertEquals(new PrimitiveType("string", false, "string"), v.typeConstraint());
        assertEquals(new LiteralValue("dev", "\"dev\""), v.defaultValue());
        assertEquals("Environment", v.description());
        assertEquals(Boolean.FALSE, v.sensitive());
        assertNull(v.nullable());
        assertEquals(1, v.validations().size());
        assertEquals(List.of(new VariableReference("env")), v.validations().get(0).condition().references());
    }

    @Test
    void locals_becomeOneEntryEach() {
        final List<LocalValue> locals = parser.parseText("locals {\n  a = 1\n  b = [local.a]\n}", "x.tf")
                .document().locals();

        assertEquals(2, locals.size());
        assertEquals("a", locals.get(0).name());
        assertEquals("literal", locals.get(0).type());
        assertEquals("array", locals.get(1).type());
        assertEquals("[local.a]", locals.get(1).raw());
        assertEquals("x.tf", locals.get(1).source());
    }

    @Test
    void providerOutputModuleAndGenericBlocks() {
        final String content = """
                terraform {
                  required_version = ">= 1.5"
                  required_providers {
                    aws = { source = "hashicorp/aws" }
                  }
                }
                provider "aws" {
                  alias  = "west"
                  region = "us-west-2"
                }
                output "vpc_id" {
                  value       = module.vpc.vpc_id
                  description = "VPC id"
                  sensitive   = true
                }
                module "vpc" {
                  source    = "terraform-aws-modules/vpc/aws"
                  version   = "5.0.0"
                  cidr      = var.cidr
                  providers = { aws = aws.west }
                }
                moved {
                  from = aws_instance.old
                  to   = aws_instance.new
                }
                check "health" {
                  assert {
                    condition     = true
                    error_message = "down"
                  }
                }
                mystery "x" {
                  a = 1
                }
                """;

        final Document doc = parser.parseText(content, "main.tf").document();

        assertEquals(1, doc.terraform().size());
        assertEquals(1, doc.terraform().get(0).blocks().size());

        final ProviderBlock p = doc.provider().get(0);
        assertEquals("aws", p.name());
        assertEquals("west", p.alias());

        final OutputBlock o = doc.output().get(0);
        assertEquals("VPC id", o.description());
        assertEquals(Boolean.TRUE, o.sensitive());

        final ModuleBlock m = doc.module().get(0);
        assertEquals("terraform-aws-modules/vpc/aws", m.moduleSource());
        assertEquals("5.0.0", m.version());
        assertTrue(m.meta().containsKey("providers"));
        assertTrue(m.properties().containsKey("cidr"));
        assertTrue(m.properties().containsKey("source"));

        assertEquals(1, doc.moved().size());
        assertEquals(1, doc.check().size());
        assertEquals("health", doc.check().get(0).firstLabelOr("default"));
        assertEquals(1, doc.unknown().size());
        assertEquals("mystery", doc.unknown().get(0).type());
        assertEquals(7, doc.blockCount());
    }

    @Test
    void missingLabels_useDefaults() {
        final Document doc = parser.parseText("provider {}\nvariable {}\nmodule {}\nresource {}", "x.tf").document();

        assertEquals("default", doc.provider().get(0).name());
        assertEquals("unknown", doc.variable().get(0).name());
        assertEquals("unnamed", doc.module().get(0).name());
        assertEquals("unknown", doc.resource().get(0).type());
        assertEquals("unnamed", doc.resource().get(0).name());
    }

    @Test
    void unterminatedBlock_keepsEarlierBlocks_whenLenient() {
        final FileParseResult result = parser.parseText("variable \"a\" {}\nresource \"x\" \"y\" {", "x.tf");

        assertEquals(1, result.document().variable().size());
        assertEquals(1, result.diagnostics().size());
    }

    @Test
    void unterminatedBlock_throws_whenStrict() {
        assertThrows(HclParseException.class,
                () -> new ConfigParser(true).parseText("resource \"x\" \"y\" {", "x.tf"));
    }

    @Test
    void parseDirectory_combinesFilesInSortedOrder() throws IOException {
        Files.createDirectories(dir.resolve("sub"));
        Files.createDirectories(dir.resolve(".terraform"));
        Files.writeString(dir.resolve("a.tf"), "resource \"t\" \"first\" {}\nvariable \"v\" {}");
        Files.writeString(dir.resolve("b.tf"), "resource \"t\" \"second\" {}");
        Files.writeString(dir.resolve("sub/c.tf.json"), "{\"locals\": {\"x\": 1}}");
        Files.writeString(dir.resolve(".terraform/ignored.tf"), "resource \"t\" \"ignored\" {}");

        final DirectoryParseResult result = parser.parseDirectory(dir);

        assertEquals(3, result.files().size());
        final Document combined = result.combined();
        assertEquals(List.of("first", "second"), combined.resource().stream().map(ResourceBlock::name).toList());
        assertEquals(1, combined.variable().size());
        assertEquals(1, combined.locals().size());
        assertEquals(new LiteralValue(1L, "1"), combined.locals().get(0).value());
        assertTrue(result.allDiagnostics().isEmpty());
    }

    @Test
    void parseFile_rejectsMissingFile() {
        assertThrows(IOException.class, () -> parser.parseFile(dir.resolve("absent.tf")));
    }

    @Test
    void parseDirectory_rejectsNonDirectory() throws IOException {
        final Path file = Files.writeString(dir.resolve("main.tf"), "");

        final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> parser.parseDirectory(file));
        assertTrue(ex.getMessage().startsWith("Invalid directory path"));
    }

    @Test
    void combine_concatenatesPerKind() {
        final Document a = parser.parseText("resource \"t\" \"a\" {}", "a.tf").document();
        final Document b = parser.parseText("resource \"t\" \"b\" {}\nlocals {\n  x = 1\n}", "b.tf").document();

        final Document combined = parser.combine(List.of(a, b));

        assertEquals(2, combined.resource().size());
        assertEquals("b", combined.resource().get(1).name());
        assertEquals(1, combined.locals().size());
        assertInstanceOf(ArrayValue.class,
                parser.parseText("locals {\n  l = [1]\n}", "c.tf").document().locals().get(0).value());
    }

    @Test
    void longIndexText_doesNotLoseTheFile() {
        final String content = "resource \"aws_s3_bucket_policy\" \"p\" {\n  policy = var.docs[\""
                + "z".repeat(20_000) + "\"]\n}\nvariable \"docs\" {}\n";

        final Document doc = parser.parseText(content, "m.tf").document();

        assertEquals(1, doc.resource().size());
        assertEquals(1, doc.variable().size());
        assertEquals(List.of(new VariableReference("docs")),
                doc.resource().get(0).properties().get("policy").references());
    }

    @Test
    void parsedBlocks_areImmutable() {
        final Document doc = parser.parseText("resource \"t\" \"a\" {\n  x = 1\n}\nvariable \"v\" {}", "x.tf")
                .document();
        final ResourceBlock r = doc.resource().get(0);

        assertThrows(UnsupportedOperationException.class, () -> r.properties().remove("x"));
        assertThrows(UnsupportedOperationException.class, () -> r.meta().clear());
        assertThrows(UnsupportedOperationException.class, () -> r.blocks().clear());
        assertThrows(UnsupportedOperationException.class, () -> doc.variable().get(0).validations().clear());
    }
}
