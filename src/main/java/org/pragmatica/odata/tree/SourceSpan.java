package org.pragmatica.odata.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    /**
     * Span covering {@code length} characters of {@code source} from the given location.
     */
    public static SourceSpan of(String source, SourceLocation start, int length) {
        var endOffset = Math.min(source.length(), start.offset() + Math.max(0, length));
        return new SourceSpan(start, SourceLocation.of(source, endOffset));
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
