package org.pragmatica.odata.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.odata.ODataParser;
import org.pragmatica.odata.tree.CommonExpr;
import org.pragmatica.odata.tree.Literal;
import org.pragmatica.odata.tree.Name;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiteralFormatterTest {

    private static final List<Literal> SAMPLES = List.of(
        Literal.Null.INSTANCE,
        Literal.BooleanValue.TRUE,
        Literal.BooleanValue.FALSE,
        new Literal.IntegerValue(Long.MIN_VALUE),
        new Literal.IntegerValue(0),
        new Literal.FloatValue(3.25),
        new Literal.FloatValue(-1.0e-7),
        new Literal.FloatValue(1.0e300),
        Literal.FloatValue.POSITIVE_INFINITY,
        Literal.FloatValue.NEGATIVE_INFINITY,
        new Literal.StringValue("it's"),
        new Literal.StringValue(""),
        new Literal.GuidValue("01234567-89AB-cdef-0123-456789abcdef"),
        Literal.DateValue.of(2024, 2, 29),
        Literal.DateValue.of(-44, 3, 15),
        Literal.TimeValue.of(24, 0),
        Literal.TimeValue.of(1, 2, 3, 1),
        new Literal.DateTimeOffsetValue(LocalDate.of(2023, 1, 15), Literal.TimeValue.of(10, 30, 0, 120_000_000), -330),
        Literal.DateTimeOffsetValue.utc(LocalDate.of(1999, 12, 31), Literal.TimeValue.of(23, 59, 59)),
        new Literal.DurationValue(Duration.ZERO),
        new Literal.DurationValue(Duration.ofDays(2).plusHours(3).plusMinutes(4).plusMillis(500)),
        new Literal.DurationValue(Duration.ofHours(-36)),
        new Literal.DurationValue(Duration.ofNanos(1)),
        new Literal.BinaryValue(new byte[]{(byte) 0xFB, (byte) 0xFF, 0x00}),
        new Literal.BinaryValue(new byte[0]));

    // === Round trip ===

    @Test
    void format_reparsesToEqualLiteral() {
        for (var literal : SAMPLES) {
            var text = LiteralFormatter.format(literal);

            assertEquals(literal, ODataParser.parseLiteral(text).get(), text);
        }
    }

    @Test
    void format_nan_reparsesToNan() {
        var text = LiteralFormatter.format(Literal.FloatValue.NAN);
        var parsed = (Literal.FloatValue) ODataParser.parseLiteral(text).get();

        assertEquals("NaN", text);
        assertTrue(parsed.isNaN());
    }

    // === Canonical forms ===

    @Test
    void format_string_doublesQuotes() {
        assertEquals("'g''day sir'", LiteralFormatter.format(new Literal.StringValue("g'day sir")));
    }

    @Test
    void format_temporalValues() {
        assertEquals("-0044-03-15", LiteralFormatter.format(Literal.DateValue.of(-44, 3, 15)));
        assertEquals("01:02:03.5", LiteralFormatter.format(Literal.TimeValue.of(1, 2, 3, 500_000_000)));
        assertEquals("2023-01-15T10:30:00-05:30",
                     LiteralFormatter.format(new Literal.DateTimeOffsetValue(LocalDate.of(2023, 1, 15),
                                                                             Literal.TimeValue.of(10, 30),
                                                                             -330)));
    }

    @Test
    void format_durations() {
        assertEquals("duration'PT0S'", LiteralFormatter.format(new Literal.DurationValue(Duration.ZERO)));
        assertEquals("duration'-P1D'", LiteralFormatter.format(new Literal.DurationValue(Duration.ofDays(-1))));
        assertEquals("duration'PT1.2S'", LiteralFormatter.format(new Literal.DurationValue(Duration.ofMillis(1200))));
        assertEquals("P1DT1M", LiteralFormatter.formatDuration(Duration.ofDays(1).plusMinutes(1)));
    }

    @Test
    void format_binary_usesUrlSafeAlphabet() {
        assertEquals("binary'-_8='", LiteralFormatter.format(new Literal.BinaryValue(new byte[]{(byte) 0xFB, (byte) 0xFF})));
    }

    @Test
    void format_namesAndExpressions() {
        assertEquals("Ns.Sub.Type", LiteralFormatter.format(Name.of(List.of("Ns", "Sub", "Type"))));
        assertEquals("prop", LiteralFormatter.format(CommonExpr.name(new Name.Identifier("prop"))));
        assertEquals("42", LiteralFormatter.format(CommonExpr.literal(new Literal.IntegerValue(42))));
    }
}
