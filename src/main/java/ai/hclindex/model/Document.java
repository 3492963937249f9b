package ai.hclindex.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parsed configuration: one list per block kind, in source order.
 * <p>
 * Lists are mutable while a file is being assembled; {@link #combine(List)} concatenates
 * per kind (document order, then in-document order) without deduplication.
 */
public record Document(
        List<TerraformSettingsBlock> terraform,
        List<ProviderBlock> provider,
        List<VariableBlock> variable,
        List<OutputBlock> output,
        List<ModuleBlock> module,
        List<ResourceBlock> resource,
        List<DataBlock> data,
        List<LocalValue> locals,
        List<GenericBlock> moved,
        @JsonProperty("import") List<GenericBlock> imports,
        List<GenericBlock> check,
        List<GenericBlock> terraformData,
        List<GenericBlock> unknown
) {

    public static Document empty() {
        return new Document(
                new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
                new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
                new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
                new ArrayList<>());
    }

    public static Document combine(List<Document> documents) {
        final Document combined = empty();
        for (Document doc : documents) {
            combined.terraform.addAll(doc.terraform);
            combined.provider.addAll(doc.provider);
            combined.variable.addAll(doc.variable);
            combined.output.addAll(doc.output);
            combined.module.addAll(doc.module);
            combined.resource.addAll(doc.resource);
            combined.data.addAll(doc.data);
            combined.locals.addAll(doc.locals);
            combined.moved.addAll(doc.moved);
            combined.imports.addAll(doc.imports);
            combined.check.addAll(doc.check);
            combined.terraformData.addAll(doc.terraformData);
            combined.unknown.addAll(doc.unknown);
        }
        return combined;
    }

    /**
     * Generic-shaped blocks in graph order: moved, import, check, terraform_data, unknown.
     */
    public List<GenericBlock> genericBlocks() {
        final List<GenericBlock> out = new ArrayList<>();
        out.addAll(moved);
        out.addAll(imports);
        out.addAll(check);
        out.addAll(terraformData);
        out.addAll(unknown);
        return out;
    }

    public int blockCount() {
        return terraform.size() + provider.size() + variable.size() + output.size()
                + module.size() + resource.size() + data.size() + locals.size()
                + genericBlocks().size();
    }
}
