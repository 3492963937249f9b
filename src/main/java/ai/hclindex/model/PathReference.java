package ai.hclindex.model;

/**
 * path.module, path.root, path.cwd
 */
public record PathReference(String pathType) implements Reference {
}
