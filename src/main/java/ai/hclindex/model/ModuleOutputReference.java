package ai.hclindex.model;

/**
 * module.MODULE.OUTPUT; a bare {@code module.MODULE} uses the module name as output name.
 */
public record ModuleOutputReference(String module, String outputName) implements Reference {
}
