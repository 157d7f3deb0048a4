package org.pragmatica.odata.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceLocationTest {

    @Test
    void of_countsLinesAndColumns() {
        var location = SourceLocation.of("ab\ncd", 4);

        assertEquals(new SourceLocation(2, 2, 4), location);
        assertEquals("2:2", location.toString());
    }

    @Test
    void span_clampsToEndOfSource() {
        var source = "abc";
        var span = SourceSpan.of(source, SourceLocation.of(source, 1), 10);

        assertEquals(2, span.length());
        assertEquals("bc", span.extract(source));
        assertEquals("1:2-1:4", span.toString());
    }

    @Test
    void span_negativeLength_isEmpty() {
        var span = SourceSpan.of("abc", SourceLocation.of("abc", 1), -1);

        assertEquals(0, span.length());
    }
}
