package ai.hclindex.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.hclindex.model.DataBlock;
import ai.hclindex.model.Document;
import ai.hclindex.model.DynamicBlock;
import ai.hclindex.model.GenericBlock;
import ai.hclindex.model.LocalValue;
import ai.hclindex.model.ModuleBlock;
import ai.hclindex.model.NestedBlock;
import ai.hclindex.model.OutputBlock;
import ai.hclindex.model.ParsedBody;
import ai.hclindex.model.ProviderBlock;
import ai.hclindex.model.RawBlock;
import ai.hclindex.model.ResourceBlock;
import ai.hclindex.model.TerraformSettingsBlock;
import ai.hclindex.model.TypeConstraint;
import ai.hclindex.model.Value;
import ai.hclindex.model.VariableBlock;
import ai.hclindex.model.VariableValidation;

/**
 * Turns scanned top-level blocks into their typed records and files them into a {@link Document}.
 */
public final class BlockParser {

    static final Set<String> RESOURCE_META = Set.of("count", "for_each", "provider", "depends_on", "lifecycle");
    static final Set<String> MODULE_META = Set.of("count", "for_each", "providers", "depends_on");

    public void parseInto(RawBlock block, Document document) {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(document, "document");

        switch (block.kind()) {
            case TERRAFORM -> document.terraform().add(parseTerraform(block));
            case PROVIDER -> document.provider().add(parseProvider(block));
            case VARIABLE -> document.variable().add(parseVariable(block));
            case OUTPUT -> document.output().add(parseOutput(block));
            case MODULE -> document.module().add(parseModule(block));
            case RESOURCE -> document.resource().add(parseResource(block));
            case DATA -> document.data().add(parseData(block));
            case LOCALS -> document.locals().addAll(parseLocals(block));
            case MOVED -> document.moved().add(parseGeneric(block));
            case IMPORT -> document.imports().add(parseGeneric(block));
            case CHECK -> document.check().add(parseGeneric(block));
            case TERRAFORM_DATA -> document.terraformData().add(parseGeneric(block));
            case UNKNOWN -> document.unknown().add(parseGeneric(block));
        }
    }

    public TerraformSettingsBlock parseTerraform(RawBlock block) {
        final ParsedBody body = BodyParser.parse(block.body());
        return new TerraformSettingsBlock(body.attributes(), body.blocks(), block.raw(), block.source());
    }

    public ProviderBlock parseProvider(RawBlock block) {
        final ParsedBody body = BodyParser.parse(block.body());
        return new ProviderBlock(
                block.label(0, "default"),
                Values.text(body.attributes().get("alias")),
                body.attributes(),
                body.blocks(),
                block.raw(),
                block.source());
    }

    public VariableBlock parseVariable(RawBlock block) {
        final ParsedBody body = BodyParser.parse(block.body());
        final Map<String, Value> attrs = body.attributes();

        final String type = Values.text(attrs.get("type"));
        final TypeConstraint typeConstraint = type != null ? TypeConstraintParser.parse(type) : null;

        final List<VariableValidation> validations = new ArrayList<>();
        for (NestedBlock nested : body.blocks()) {
            if ("validation".equals(nested.type())) {
                validations.add(new VariableValidation(
                        nested.attributes().get("condition"),
                        nested.attributes().get("error_message")));
            }
        }

        return new VariableBlock(
                block.label(0, "unknown"),
                Values.text(attrs.get("description")),
                type,
                typeConstraint,
                attrs.get("default"),
                validations,
                Values.literalBoolean(attrs.get("sensitive")),
                Values.literalBoolean(attrs.get("nullable")),
                block.raw(),
                block.source());
    }

    public OutputBlock parseOutput(RawBlock block) {
        final ParsedBody body = BodyParser.parse(block.body());
        final Map<String, Value> attrs = body.attributes();
        return new OutputBlock(
                block.label(0, "unknown"),
                Values.text(attrs.get("description")),
                attrs.get("value"),
                Values.literalBoolean(attrs.get("sensitive")),
                attrs.get("depends_on"),
                body.blocks(),
                block.raw(),
                block.source());
    }

    public ModuleBlock parseModule(RawBlock block) {
        final ParsedBody body = BodyParser.parse(block.body());
        final Map<String, Value> properties = new LinkedHashMap<>();
        final Map<String, Value> meta = new LinkedHashMap<>();
        splitMeta(body.attributes(), MODULE_META, properties, meta);

        return new ModuleBlock(
                block.label(0, "unnamed"),
                Values.text(body.attributes().get("source")),
                Values.text(body.attributes().get("version")),
                properties,
                meta,
                block.raw(),
                block.source());
    }

    public ResourceBlock parseResource(RawBlock block) {
        final Members members = members(BodyParser.parse(block.body()));
        return new ResourceBlock(
                block.label(0, "unknown"),
                block.label(1, "unnamed"),
                members.properties,
                members.meta,
                members.blocks,
                members.dynamicBlocks,
                block.raw(),
                block.source());
    }

    public DataBlock parseData(RawBlock block) {
        final Members members = members(BodyParser.parse(block.body()));
        return new DataBlock(
                block.label(0, "unknown"),
                block.label(1, "unnamed"),
                members.properties,
                members.meta,
                members.blocks,
                members.dynamicBlocks,
                block.raw(),
                block.source());
    }

    public List<LocalValue> parseLocals(RawBlock block) {
        final ParsedBody body = BodyParser.parse(block.body());
        final List<LocalValue> locals = new ArrayList<>(body.attributes().size());
        for (Map.Entry<String, Value> e : body.attributes().entrySet()) {
            final Value value = e.getValue();
            locals.add(new LocalValue(e.getKey(), Values.tag(value), value, value.raw(), block.source()));
        }
        return locals;
    }

    public GenericBlock parseGeneric(RawBlock block) {
        final ParsedBody body = BodyParser.parse(block.body());
        return new GenericBlock(
                block.keyword(),
                block.labels(),
                body.attributes(),
                body.blocks(),
                block.raw(),
                block.source());
    }

    /**
     * Resource/data body split into properties, meta-arguments, plain nested blocks and dynamic blocks.
     * A nested {@code lifecycle} block counts as the lifecycle meta-argument.
     */
    private static Members members(ParsedBody body) {
        final Members m = new Members();
        splitMeta(body.attributes(), RESOURCE_META, m.properties, m.meta);

        for (NestedBlock nested : body.blocks()) {
            if ("dynamic".equals(nested.type())) {
                m.dynamicBlocks.add(dynamicBlock(nested));
            } else if ("lifecycle".equals(nested.type()) && !m.meta.containsKey("lifecycle")) {
                m.meta.put("lifecycle", Values.blockAsObject(nested));
            } else {
                m.blocks.add(nested);
            }
        }
        return m;
    }

    private static void splitMeta(Map<String, Value> attributes, Set<String> metaKeys,
                                  Map<String, Value> properties, Map<String, Value> meta) {
        for (Map.Entry<String, Value> e : attributes.entrySet()) {
            if (metaKeys.contains(e.getKey())) {
                meta.put(e.getKey(), e.getValue());
            } else {
                properties.put(e.getKey(), e.getValue());
            }
        }
    }

    static DynamicBlock dynamicBlock(NestedBlock nested) {
        final String label = nested.labels().isEmpty() ? "dynamic" : nested.labels().get(0);
        NestedBlock content = null;
        for (NestedBlock child : nested.blocks()) {
            if ("content".equals(child.type())) {
                content = child;
                break;
            }
        }
        return new DynamicBlock(
                label,
                nested.attributes().get("for_each"),
                Values.text(nested.attributes().get("iterator")),
                content != null ? content.attributes() : Map.of(),
                content != null ? content.blocks() : List.of(),
                nested.raw());
    }

    private static final class Members {
        final Map<String, Value> properties = new LinkedHashMap<>();
        final Map<String, Value> meta = new LinkedHashMap<>();
        final List<NestedBlock> blocks = new ArrayList<>();
        final List<DynamicBlock> dynamicBlocks = new ArrayList<>();
    }
}
