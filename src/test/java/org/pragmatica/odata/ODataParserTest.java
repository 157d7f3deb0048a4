package org.pragmatica.odata;

import org.junit.jupiter.api.Test;
import org.pragmatica.odata.error.ParseError;
import org.pragmatica.odata.parser.ParserConfig;
import org.pragmatica.odata.tree.CommonExpr;
import org.pragmatica.odata.tree.Literal;
import org.pragmatica.odata.tree.Name;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ODataParserTest {

    // === Literals ===

    @Test
    void parseLiteral_string_unescapesQuotes() {
        assertEquals(new Literal.StringValue("g'day sir"), ODataParser.parseLiteral("'g''day sir'").get());
        assertEquals(new Literal.StringValue(""), ODataParser.parseLiteral("''").get());
    }

    @Test
    void parseLiteral_integerLimits() {
        assertEquals(new Literal.IntegerValue(Long.MAX_VALUE),
                     ODataParser.parseLiteral("9223372036854775807").get());

        var error = ODataParser.parseLiteral("9223372036854775808").getLeft();
        assertEquals(ParseError.Category.DOMAIN, error.category());
    }

    @Test
    void parseLiteral_integerAndFloatAreDistinct() {
        assertInstanceOf(Literal.IntegerValue.class, ODataParser.parseLiteral("123").get());
        assertInstanceOf(Literal.FloatValue.class, ODataParser.parseLiteral("123.0").get());
        assertInstanceOf(Literal.FloatValue.class, ODataParser.parseLiteral("1e5").get());
        assertEquals(new Literal.FloatValue(1.0), ODataParser.parseLiteral("1.").get());
    }

    @Test
    void parseLiteral_leapYears() {
        assertEquals(Literal.DateValue.of(2024, 2, 29), ODataParser.parseLiteral("2024-02-29").get());
        assertEquals(ParseError.Category.DOMAIN, ODataParser.parseLiteral("2023-02-29").getLeft().category());
    }

    @Test
    void parseLiteral_negativeYear() {
        var date = assertInstanceOf(Literal.DateValue.class, ODataParser.parseLiteral("-0001-01-01").get());

        assertEquals(-1, date.date().getYear());
    }

    @Test
    void parseLiteral_durations() {
        var oneDay = new Literal.DurationValue(Duration.ofDays(1));

        assertEquals(oneDay, ODataParser.parseLiteral("duration'P1D'").get());
        assertEquals(oneDay, ODataParser.parseLiteral("'P1D'").get());
        assertEquals(new Literal.DurationValue(Duration.ofDays(-1)), ODataParser.parseLiteral("duration'-P1D'").get());
        assertEquals(new Literal.DurationValue(Duration.ofMillis(1200)),
                     ODataParser.parseLiteral("duration'PT1.2S'").get());
    }

    @Test
    void parseLiteral_binaryPaddingIsOptional() {
        var padded = (Literal.BinaryValue) ODataParser.parseLiteral("binary'AQI='").get();
        var unpadded = (Literal.BinaryValue) ODataParser.parseLiteral("binary'AQI'").get();

        assertThat(padded.bytes()).containsExactly(1, 2);
        assertEquals(padded, unpadded);
    }

    @Test
    void parseLiteral_timeTruncatesFraction() {
        var time = (Literal.TimeValue) ODataParser.parseLiteral("01:02:03.000000001234").get();

        assertEquals(1, time.nano());
    }

    @Test
    void parseLiteral_dateTimeOffset() {
        var value = (Literal.DateTimeOffsetValue) ODataParser.parseLiteral("2023-01-15T10:30:00+01:00").get();

        assertEquals(LocalDate.of(2023, 1, 15), value.date());
        assertEquals(60, value.offsetMinutes());
        assertEquals("2023-01-15T10:30+01:00", value.toOffsetDateTime().get().toString());
    }

    @Test
    void parseLiteral_specialFloats() {
        assertTrue(((Literal.FloatValue) ODataParser.parseLiteral("NaN").get()).isNaN());
        assertEquals(Literal.FloatValue.POSITIVE_INFINITY, ODataParser.parseLiteral("INF").get());
        assertEquals(Literal.FloatValue.NEGATIVE_INFINITY, ODataParser.parseLiteral("-INF").get());
    }

    // === Full consumption ===

    @Test
    void parseLiteral_trailingInput_isReported() {
        var error = ODataParser.parseLiteral("123abc").getLeft();

        var trailing = assertInstanceOf(ParseError.TrailingInput.class, error);
        assertEquals("abc", trailing.remainder());
        assertEquals("integer literal", trailing.matched());
        assertEquals(3, trailing.location().offset());
        assertEquals(ParseError.Category.TRAILING_INPUT, trailing.category());
    }

    @Test
    void parseLiteral_empty_isUnexpectedEof() {
        assertInstanceOf(ParseError.UnexpectedEof.class, ODataParser.parseLiteral("").getLeft());
    }

    @Test
    void parseLiteral_garbage_isSyntaxError() {
        var error = ODataParser.parseLiteral("@").getLeft();

        var unexpected = assertInstanceOf(ParseError.UnexpectedInput.class, error);
        assertEquals("@", unexpected.found());
        assertThat(unexpected.expected()).contains("integer", "guid", "binary");
    }

    // === Names ===

    @Test
    void parseName_identifierAndQualified() {
        assertEquals(new Name.Identifier("a"), ODataParser.parseName("a").get());

        var qualified = assertInstanceOf(Name.Qualified.class, ODataParser.parseName("a.b.c").get());
        assertThat(qualified.segments()).containsExactly("a", "b", "c");
    }

    @Test
    void parseName_trailingDot_isTrailingInput() {
        var error = ODataParser.parseName("a.b.").getLeft();

        var trailing = assertInstanceOf(ParseError.TrailingInput.class, error);
        assertEquals(".", trailing.remainder());
        assertEquals("name 'a.b'", trailing.matched());
    }

    @Test
    void parseName_digitStart_fails() {
        var error = ODataParser.parseName("1a").getLeft();

        assertEquals(ParseError.Category.SYNTAX, error.category());
        assertTrue(error.message().contains("identifier"));
    }

    // === Primary expression ===

    @Test
    void parse_keywordsAreLiterals() {
        assertEquals(CommonExpr.literal(Literal.Null.INSTANCE), ODataParser.parse("null").get());
        assertEquals(CommonExpr.literal(Literal.BooleanValue.TRUE), ODataParser.parse("true").get());
    }

    @Test
    void parse_qualifiedName() {
        var expr = assertInstanceOf(CommonExpr.NameExpr.class, ODataParser.parse("Namespace.Type").get());

        assertEquals("Namespace.Type", expr.name().fullName());
    }

    @Test
    void parse_literalPrefixFallsBackToName() {
        assertEquals(CommonExpr.name(new Name.Identifier("nullable")), ODataParser.parse("nullable").get());
        assertEquals(CommonExpr.name(new Name.Identifier("INFO")), ODataParser.parse("INFO").get());
    }

    @Test
    void parse_bothFail_reportsFurthestError() {
        var nameError = ODataParser.parse("a.b c").getLeft();
        assertInstanceOf(ParseError.TrailingInput.class, nameError);
        assertEquals(3, nameError.location().offset());

        var literalError = ODataParser.parse("123abc").getLeft();
        assertEquals("integer literal", ((ParseError.TrailingInput) literalError).matched());
    }

    @Test
    void parse_domainErrorWins() {
        var error = ODataParser.parse("binary'ab$c'").getLeft();

        assertEquals(ParseError.Category.DOMAIN, error.category());
    }

    // === Configuration ===

    @Test
    void builder_bareDurationsDisabled_yieldsString() {
        var parser = ODataParser.builder()
                                .bareDurationLiterals(false)
                                .build();

        assertFalse(parser.config().bareDurationLiterals());
        assertEquals(new Literal.StringValue("P1D"), parser.parseLiteral("'P1D'").get());
        assertEquals(new Literal.DurationValue(Duration.ofDays(1)), parser.parseLiteral("duration'P1D'").get());
    }

    @Test
    void create_usesDefaultConfig() {
        assertEquals(ParserConfig.DEFAULT, ODataParser.create().config());
        assertTrue(ODataParser.create().config().bareDurationLiterals());
    }

    @Test
    void create_nullConfig_throws() {
        assertThrows(IllegalArgumentException.class, () -> ODataParser.create(null));
    }
}
