package ai.hclindex.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExpressionKind {
    TRAVERSAL,
    FUNCTION_CALL,
    TEMPLATE,
    CONDITIONAL,
    SPLAT,
    FOR_EXPR,
    UNKNOWN;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
