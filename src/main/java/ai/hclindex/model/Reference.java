package ai.hclindex.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Reference to another configuration element (or to a contextual value such as
 * {@code each.key}) found inside an expression.
 * <p>
 * Implementations are records, so equality is structural; deduplication relies on it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = VariableReference.class, name = "variable"),
        @JsonSubTypes.Type(value = LocalReference.class, name = "local"),
        @JsonSubTypes.Type(value = ResourceReference.class, name = "resource"),
        @JsonSubTypes.Type(value = DataReference.class, name = "data"),
        @JsonSubTypes.Type(value = ModuleOutputReference.class, name = "module_output"),
        @JsonSubTypes.Type(value = PathReference.class, name = "path"),
        @JsonSubTypes.Type(value = EachReference.class, name = "each"),
        @JsonSubTypes.Type(value = CountReference.class, name = "count"),
        @JsonSubTypes.Type(value = SelfReference.class, name = "self")
})
public sealed interface Reference permits VariableReference, LocalReference, ResourceReference,
        DataReference, ModuleOutputReference, PathReference, EachReference, CountReference, SelfReference {
}
