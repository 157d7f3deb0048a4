package org.pragmatica.odata.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.odata.ODataParser;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void invalidValue_underlinesWholeToken() {
        var source = "2023-02-29";
        var error = ODataParser.parseLiteral(source).getLeft();

        var diagnostic = Diagnostic.of(error, source);

        assertEquals("E0300", diagnostic.code());
        assertEquals("""
                     error[E0300]: invalid date
                       --> 1:1
                       |
                     1 | 2023-02-29
                       | ^^^^^^^^^^ day 29 is out of range for 2023-02
                       |
                     """, diagnostic.format(source));
    }

    @Test
    void trailingInput_underlinesRemainder() {
        var source = "123abc";
        var diagnostic = Diagnostic.of(ODataParser.parseLiteral(source).getLeft(), source);

        assertEquals("E0200", diagnostic.code());
        assertEquals("abc", diagnostic.span().extract(source));
        assertTrue(diagnostic.format(source).contains("|    ^^^ not part of the integer literal"));
        assertEquals("1:4: error[E0200]: unexpected trailing input: not part of the integer literal",
                     diagnostic.formatSimple());
    }

    @Test
    void unexpectedEof_pointsPastLastCharacter() {
        var source = "1e";
        var diagnostic = Diagnostic.of(ODataParser.parseLiteral(source).getLeft(), source);
        var formatted = diagnostic.format(source);

        assertEquals("E0101", diagnostic.code());
        assertEquals(0, diagnostic.span().length());
        assertTrue(formatted.contains("  |   ^ input ends here"));
        assertTrue(formatted.contains("= help: expected digit"));
    }

    @Test
    void unexpectedInput_listsExpectation() {
        var source = "@";
        var diagnostic = Diagnostic.of(ODataParser.parseName(source).getLeft(), source);

        assertEquals("E0100", diagnostic.code());
        assertEquals("found '@'", diagnostic.label());
        assertEquals(1, diagnostic.notes().size());
        assertEquals("help: expected identifier", diagnostic.notes().get(0));
    }
}
