package ai.hclindex.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Top-level block keywords; anything else maps to {@link #UNKNOWN} but is still parsed.
 */
public enum BlockKind {
    TERRAFORM,
    PROVIDER,
    VARIABLE,
    OUTPUT,
    MODULE,
    RESOURCE,
    DATA,
    LOCALS,
    MOVED,
    IMPORT,
    CHECK,
    TERRAFORM_DATA,
    UNKNOWN;

    @JsonValue
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BlockKind fromKeyword(String keyword) {
        if (keyword == null) {
            return UNKNOWN;
        }
        for (BlockKind kind : values()) {
            if (kind != UNKNOWN && kind.keyword().equals(keyword)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
