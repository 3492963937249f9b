package ai.hclindex.model;

/**
 * 1-based line/column, 0-based offset.
 */
public record SourceLocation(int line, int column, int offset) {

    public static SourceLocation of(String content, int offset) {
        final int safeOffset = Math.max(0, Math.min(offset, content.length()));
        int line = 1;
        int column = 1;
        for (int i = 0; i < safeOffset; i++) {
            if (content.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new SourceLocation(line, column, safeOffset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
