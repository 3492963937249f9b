package ai.hclindex.model;

import java.util.Objects;

/**
 * Structural scan failure. Only raised when strict scanning is requested;
 * the default mode reports a {@link Diagnostic} instead.
 */
public class HclParseException extends RuntimeException {

    private final String source;
    private final SourceLocation location;

    public HclParseException(String message, String source, SourceLocation location) {
        super(message + " at " + source + ":" + location);
        this.source = Objects.requireNonNull(source, "source");
        this.location = Objects.requireNonNull(location, "location");
    }

    public String source() {
        return source;
    }

    public SourceLocation location() {
        return location;
    }
}
