package org.pragmatica.odata.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputTest {

    @Test
    void of_startsAtOffsetZero() {
        var input = Input.of("abc");

        assertEquals(0, input.offset());
        assertEquals(3, input.remaining());
        assertFalse(input.isAtEnd());
        assertEquals('a', input.peek());
    }

    @Test
    void advance_returnsNewView() {
        var input = Input.of("abc");
        var rest = input.advance(2);

        assertEquals(0, input.offset());
        assertEquals(2, rest.offset());
        assertEquals("c", rest.rest());
        assertEquals("ab", input.textUpTo(rest));
    }

    @Test
    void advance_pastEnd_throws() {
        assertThrows(IllegalArgumentException.class, () -> Input.of("ab").advance(3));
    }

    @Test
    void nullSource_throws() {
        assertThrows(IllegalArgumentException.class, () -> Input.of(null));
    }

    @Test
    void matches_checksCharacterAhead() {
        var input = Input.of("1a");

        assertTrue(input.matches(0, Chars::isDigit));
        assertFalse(input.matches(1, Chars::isDigit));
        assertFalse(input.matches(2, Chars::isDigit));
    }

    @Test
    void codePoint_readsSurrogatePairAsOne() {
        var input = Input.of("\uD835\uDC9Cb");

        assertEquals(0x1D49C, input.codePoint());
        assertEquals(2, input.advanceCodePoint().offset());
        assertEquals("\uD835\uDC9C", input.found());
    }

    @Test
    void startsWithIgnoreCase_ignoresCase() {
        var input = Input.of("Duration'P1D'");

        assertTrue(input.startsWithIgnoreCase("duration'"));
        assertFalse(input.startsWith("duration'"));
    }

    @Test
    void countWhile_stopsAtMax() {
        var input = Input.of("123456");

        assertEquals(4, input.countWhile(Chars::isDigit, 4));
        assertEquals(6, input.countWhile(Chars::isDigit, Integer.MAX_VALUE));
    }

    @Test
    void location_tracksLinesAndColumns() {
        var input = new Input("ab\ncd", 4);
        var location = input.location();

        assertEquals(2, location.line());
        assertEquals(2, location.column());
        assertEquals(4, location.offset());
    }

    @Test
    void found_atEnd_describesEndOfInput() {
        var input = Input.of("a").advance(1);

        assertTrue(input.isAtEnd());
        assertEquals("end of input", input.found());
    }
}
