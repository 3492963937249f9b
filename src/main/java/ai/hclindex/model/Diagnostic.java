package ai.hclindex.model;

/**
 * Recoverable structural problem found while scanning (e.g. an unterminated block).
 */
public record Diagnostic(String message, String source, SourceLocation location) {

    public String format() {
        return message + " in " + source + ":" + location;
    }
}
