package org.pragmatica.odata.tree;

/**
 * A position in source text (line and column are 1-based, offset is 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    /**
     * Resolve line and column of the given offset by scanning the source up to it.
     */
    public static SourceLocation of(String source, int offset) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
