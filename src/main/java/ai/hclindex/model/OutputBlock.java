package ai.hclindex.model;

import java.util.List;

public record OutputBlock(
        String name,
        String description,
        Value value,
        Boolean sensitive,
        Value dependsOn,
        List<NestedBlock> blocks, // precondition blocks
        String raw,
        String source
) {
    public OutputBlock {
        blocks = List.copyOf(blocks);
    }
}
