package ai.hclindex.model;

/**
 * self.ATTR inside provisioners and connection blocks.
 */
public record SelfReference(String attribute) implements Reference {
}
