package ai.hclindex.model;

import java.util.Objects;

/**
 * Graph node ids: {@code kind.primary} or {@code kind.primary.secondary}.
 */
public final class Ids {

    public static final String TERRAFORM_SETTINGS = "terraform.settings";

    private Ids() {
    }

    public static String nodeId(String kind, String primary) {
        return nodeId(kind, primary, null);
    }

    public static String nodeId(String kind, String primary, String secondary) {
        Objects.requireNonNull(kind, "kind");
        final StringBuilder sb = new StringBuilder(kind);
        if (primary != null && !primary.isEmpty()) {
            sb.append('.').append(primary);
        }
        if (secondary != null && !secondary.isEmpty()) {
            sb.append('.').append(secondary);
        }
        return sb.toString();
    }

    public static String providerId(String name, String alias) {
        return nodeId("provider", name, alias);
    }

    public static String resourceId(String type, String name) {
        return nodeId("resource", type, name);
    }

    public static String dataId(String type, String name) {
        return nodeId("data", type, name);
    }

    /**
     * Strips index brackets from a traversal segment: {@code web[0]} becomes {@code web}.
     */
    public static String stripIndexes(String segment) {
        if (segment == null || segment.indexOf('[') < 0) {
            return segment;
        }
        final StringBuilder sb = new StringBuilder(segment.length());
        int depth = 0;
        for (int i = 0; i < segment.length(); i++) {
            final char c = segment.charAt(i);
            if (c == '[') {
                depth++;
                continue;
            }
            if (c == ']') {
                if (depth > 0) {
                    depth--;
                }
                continue;
            }
            if (depth == 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
