package org.pragmatica.odata.parser;

import org.pragmatica.odata.tree.Literal;

import java.util.List;

/**
 * Literal dispatcher - ordered choice over all primitive literal kinds.
 *
 * <p>Alternatives are tried in a fixed order from the same position and the first match wins. Since duration is
 * tried before string, a bare quoted token such as {@code 'P1D'} is a duration unless bare durations are disabled
 * in the {@link ParserConfig}.
 */
public final class LiteralRules implements Rule<Literal> {

    private final List<Alternative> alternatives;

    private LiteralRules(List<Alternative> alternatives) {
        this.alternatives = alternatives;
    }

    public static LiteralRules create(ParserConfig config) {
        boolean bareDurations = config.bareDurationLiterals();
        return new LiteralRules(List.of(
            new Alternative("null", input -> ScalarRules.nullValue(input)
                                                        .map(Literal.class::cast)),
            new Alternative("duration", input -> TemporalRules.duration(input, bareDurations)
                                                              .map(Literal.DurationValue::new)),
            new Alternative("boolean", input -> ScalarRules.booleanValue(input)
                                                           .map(Literal.BooleanValue::of)),
            new Alternative("string", input -> ScalarRules.string(input)
                                                          .map(Literal.StringValue::new)),
            new Alternative("datetime", input -> TemporalRules.dateTimeOffset(input)
                                                              .map(Literal.class::cast)),
            new Alternative("date", input -> TemporalRules.date(input)
                                                          .map(Literal.DateValue::new)),
            new Alternative("time", input -> TemporalRules.time(input)
                                                          .map(Literal.class::cast)),
            new Alternative("guid", input -> ScalarRules.guid(input)
                                                        .map(Literal.GuidValue::new)),
            new Alternative("float", input -> ScalarRules.floatValue(input)
                                                         .map(Literal.FloatValue::new)),
            new Alternative("integer", input -> ScalarRules.integer(input)
                                                           .map(Literal.IntegerValue::new)),
            new Alternative("binary", input -> ScalarRules.binary(input)
                                                          .map(Literal.BinaryValue::new))));
    }

    /**
     * Named alternative. A failure at the very start of the input is reported with the alternative's name.
     */
    public record Alternative(String name, Rule<Literal> rule) implements Rule<Literal> {
        @Override
        public ParseResult<Literal> parse(Input input) {
            var result = rule.parse(input);
            if (result instanceof ParseResult.Failure<Literal> failure && failure.at().offset() == input.offset()) {
                return ParseResult.failure(input, name);
            }
            return result;
        }
    }

    public List<String> alternativeNames() {
        return alternatives.stream()
                           .map(Alternative::name)
                           .toList();
    }

    @Override
    public ParseResult<Literal> parse(Input input) {
        var result = alternatives.get(0).parse(input);
        for (var alternative : alternatives.subList(1, alternatives.size())) {
            result = result.or(() -> alternative.parse(input));
        }
        return result;
    }
}
