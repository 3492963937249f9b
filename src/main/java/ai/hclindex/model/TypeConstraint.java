package ai.hclindex.model;

/**
 * Structural description of a variable {@code type} expression.
 * Every variant reports its {@code base} keyword and whether it was wrapped in {@code optional(...)}.
 */
public sealed interface TypeConstraint permits PrimitiveType, CollectionType, TupleType, ObjectType, OpaqueType {

    String base();

    boolean optional();

    String raw();

    /**
     * Copy marked optional, keeping the wrapper text as raw.
     */
    TypeConstraint asOptional(String raw);
}
