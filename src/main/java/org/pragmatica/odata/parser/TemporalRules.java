package org.pragmatica.odata.parser;

import io.vavr.control.Option;
import org.pragmatica.odata.tree.Literal;

import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Rules for dates, times, date-times with offset and durations.
 *
 * <p>Range violations are committed failures: once a component has the right shape (two digits in the right
 * place) an out-of-range value is reported as invalid instead of letting a shorter literal match a prefix.
 */
public final class TemporalRules {
    private static final int MAX_FRACTION_DIGITS = 12;
    private static final int NANO_DIGITS = 9;
    private static final int MAX_OFFSET_HOURS = 23;

    private static final Rule<Option<Integer>> OPTIONAL_FRACTION = ((Rule<Integer>) TemporalRules::fraction).optional();
    private static final Rule<Option<Second>> OPTIONAL_SECOND = ((Rule<Second>) input ->
        Terminals.character(input, ':')
                 .flatMap((colon, rest) -> second(rest))).optional();
    private static final Rule<Option<Integer>> OPTIONAL_OFFSET = ((Rule<Integer>) TemporalRules::offset).optional();
    private static final Rule<Option<String>> OPTIONAL_FRACTION_DIGITS = ((Rule<String>) input ->
        Terminals.character(input, '.')
                 .flatMap((dot, rest) -> Terminals.digits(rest))).optional();

    private TemporalRules() {}

    /**
     * Second of minute with its fractional part in nanoseconds.
     */
    public record Second(int value, int nano) {}

    /**
     * Optional minus sign followed by exactly four digits.
     */
    public static ParseResult<Integer> year(Input input) {
        var afterSign = input.startsWith('-') ? input.advance(1) : input;
        return Terminals.digits(afterSign, 4)
                        .flatMap((digits, rest) -> ParseResult.success(Integer.parseInt(input.textUpTo(rest)), rest));
    }

    public static ParseResult<Integer> month(Input input) {
        return bounded(input, "month", 1, 12);
    }

    public static ParseResult<Integer> day(Input input) {
        return bounded(input, "day", 1, 31);
    }

    /**
     * Hour 00 to 24. Hour 24 is accepted with any minute and second.
     */
    public static ParseResult<Integer> hour(Input input) {
        return bounded(input, "hour", 0, 24);
    }

    public static ParseResult<Integer> minute(Input input) {
        return bounded(input, "minute", 0, 59);
    }

    public static ParseResult<Second> second(Input input) {
        return bounded(input, "second", 0, 59)
            .flatMap((second, rest) -> OPTIONAL_FRACTION.parse(rest)
                                                        .map(nano -> new Second(second, nano.getOrElse(0))));
    }

    /**
     * {@code .} followed by 1 to 12 digits, as nanoseconds. Digits past the ninth are dropped, not rounded.
     */
    public static ParseResult<Integer> fraction(Input input) {
        return Terminals.character(input, '.')
                        .flatMap((dot, rest) -> Terminals.takeWhile(rest, Chars::isDigit, 1, MAX_FRACTION_DIGITS,
                                                                    "digit"))
                        .map(TemporalRules::toNanos);
    }

    /**
     * {@code year-month-day}, validated against the proleptic Gregorian calendar.
     */
    public static ParseResult<LocalDate> date(Input input) {
        return year(input)
            .flatMap((year, afterYear) -> Terminals.character(afterYear, '-')
                .flatMap((dash, afterDash) -> month(afterDash))
                .flatMap((month, afterMonth) -> Terminals.character(afterMonth, '-')
                    .flatMap((separator, afterSeparator) -> day(afterSeparator))
                    .flatMap((day, rest) -> calendarDate(input, rest, year, month, day))));
    }

    private static ParseResult<LocalDate> calendarDate(Input start, Input rest, int year, int month, int day) {
        var yearMonth = YearMonth.of(year, month);
        if (!yearMonth.isValidDay(day)) {
            return ParseResult.invalid(start, "date", start.textUpTo(rest),
                                       "day " + day + " is out of range for " + yearMonth);
        }
        return ParseResult.success(LocalDate.of(year, month, day), rest);
    }

    /**
     * {@code hour:minute}, optionally followed by {@code :second} with a fraction.
     */
    public static ParseResult<Literal.TimeValue> time(Input input) {
        // The hour is range-checked only once the colon confirms this is a time
        var shape = Terminals.digits(input, 2)
                             .flatMap((digits, rest) -> Terminals.character(rest, ':'));
        if (!(shape instanceof ParseResult.Success<Character> colon)) {
            return shape.cast();
        }
        return hour(input)
            .flatMap((hour, afterHour) -> minute(colon.rest())
                .flatMap((minute, afterMinute) -> OPTIONAL_SECOND.parse(afterMinute)
                    .map(second -> toTime(hour, minute, second))));
    }

    private static Literal.TimeValue toTime(int hour, int minute, Option<Second> second) {
        return second.map(s -> Literal.TimeValue.of(hour, minute, s.value(), s.nano()))
                     .getOrElse(() -> Literal.TimeValue.of(hour, minute));
    }

    /**
     * UTC offset in minutes: {@code Z} (any case) or {@code +hh:mm} / {@code -hh:mm}.
     */
    public static ParseResult<Integer> offset(Input input) {
        return Terminals.characterIgnoreCase(input, 'Z')
                        .map(zulu -> 0)
                        .or(() -> numericOffset(input));
    }

    private static ParseResult<Integer> numericOffset(Input input) {
        var sign = Terminals.oneOf(input, "+-");
        if (!(sign instanceof ParseResult.Success<Character> matched)) {
            return sign.cast();
        }
        var body = matched.rest();
        boolean wellFormed = body.matches(0, Chars::isDigit) && body.matches(1, Chars::isDigit)
                             && body.matches(2, c -> c == ':')
                             && body.matches(3, Chars::isDigit) && body.matches(4, Chars::isDigit);
        if (!wellFormed) {
            return ParseResult.failure(body, "offset in hh:mm form");
        }
        var rest = body.advance(5);
        var token = input.textUpTo(rest);
        int hours = Integer.parseInt(body.textUpTo(body.advance(2)));
        int minutes = Integer.parseInt(body.advance(3).textUpTo(rest));
        if (hours > MAX_OFFSET_HOURS) {
            return ParseResult.invalid(input, "offset", token, "hours must be between 00 and " + MAX_OFFSET_HOURS);
        }
        if (minutes > 59) {
            return ParseResult.invalid(input, "offset", token, "minutes must be between 00 and 59");
        }
        int total = hours * 60 + minutes;
        return ParseResult.success(matched.value() == '-' ? -total : total, rest);
    }

    /**
     * {@code date T time [offset]}; a missing offset means UTC.
     */
    public static ParseResult<Literal.DateTimeOffsetValue> dateTimeOffset(Input input) {
        return date(input)
            .flatMap((date, afterDate) -> Terminals.characterIgnoreCase(afterDate, 'T')
                .flatMap((separator, afterSeparator) -> time(afterSeparator))
                .flatMap((time, afterTime) -> OPTIONAL_OFFSET.parse(afterTime)
                    .map(offset -> new Literal.DateTimeOffsetValue(date, time, offset.getOrElse(0)))));
    }

    /**
     * Quoted duration: {@code duration'...'} (keyword in any case) or, when {@code allowBare} is set, the bare
     * {@code '...'} form. Both produce the same value.
     */
    public static ParseResult<Duration> duration(Input input, boolean allowBare) {
        var keyword = Terminals.textIgnoreCase(input, "duration'");
        if (keyword instanceof ParseResult.Success<String> matched) {
            return quotedDurationBody(matched.rest())
                .commit();
        }
        if (!allowBare) {
            return keyword.cast();
        }
        return Terminals.character(input, '\'')
                        .flatMap((quote, body) -> quotedDurationBody(body));
    }

    private static ParseResult<Duration> quotedDurationBody(Input body) {
        return durationValue(body)
            .flatMap((duration, rest) -> Terminals.character(rest, '\'')
                                                  .map(quote -> duration));
    }

    /**
     * {@code [+-]P[nD][T[nH][nM][n[.f]S]]}, designators in any case.
     */
    public static ParseResult<Duration> durationValue(Input input) {
        var afterSign = input.startsWith('+') || input.startsWith('-') ? input.advance(1) : input;
        boolean negative = input.startsWith('-');
        return Terminals.characterIgnoreCase(afterSign, 'P')
                        .flatMap((p, afterP) -> optionalComponent(afterP, 'D')
                            .flatMap((days, afterDays) -> timeComponents(afterDays)
                                .flatMap((time, rest) -> toDuration(input, rest, negative, days, time))));
    }

    private record TimeComponents(Option<String> hours, Option<String> minutes, Option<String> seconds) {
        static final TimeComponents NONE = new TimeComponents(Option.none(), Option.none(), Option.none());
    }

    private static ParseResult<TimeComponents> timeComponents(Input input) {
        var separator = Terminals.characterIgnoreCase(input, 'T');
        if (!(separator instanceof ParseResult.Success<Character> matched)) {
            return ParseResult.success(TimeComponents.NONE, input);
        }
        return optionalComponent(matched.rest(), 'H')
            .flatMap((hours, afterHours) -> optionalComponent(afterHours, 'M')
                .flatMap((minutes, afterMinutes) -> optionalSeconds(afterMinutes)
                    .map(seconds -> new TimeComponents(hours, minutes, seconds))));
    }

    /**
     * Digits followed by the designator, or nothing at all.
     */
    private static ParseResult<Option<String>> optionalComponent(Input input, char designator) {
        return ((Rule<String>) in -> Terminals.digits(in)
                                              .flatMap((digits, rest) -> Terminals.characterIgnoreCase(rest, designator)
                                                                                  .map(d -> digits)))
            .optional()
            .parse(input);
    }

    private static ParseResult<Option<String>> optionalSeconds(Input input) {
        return ((Rule<String>) in -> Terminals.digits(in)
                                              .flatMap((whole, afterWhole) -> OPTIONAL_FRACTION_DIGITS.parse(afterWhole))
                                              .flatMap((fraction, rest) -> Terminals.characterIgnoreCase(rest, 'S')
                                                                                    .map(s -> in.textUpTo(rest))))
            .optional()
            .parse(input);
    }

    private static ParseResult<Duration> toDuration(Input start, Input rest, boolean negative,
                                                    Option<String> days, TimeComponents time) {
        try {
            var total = Duration.ofDays(parseAmount(days))
                                .plusHours(parseAmount(time.hours()))
                                .plusMinutes(parseAmount(time.minutes()))
                                .plus(time.seconds()
                                          .map(TemporalRules::toSeconds)
                                          .getOrElse(Duration.ZERO));
            return ParseResult.success(negative ? total.negated() : total, rest);
        } catch (ArithmeticException | NumberFormatException e) {
            return ParseResult.invalid(start, "duration", start.textUpTo(rest),
                                       "exceeds the supported duration range");
        }
    }

    private static long parseAmount(Option<String> digits) {
        return digits.map(Long::parseLong)
                     .getOrElse(0L);
    }

    private static Duration toSeconds(String seconds) {
        int dot = seconds.indexOf('.');
        if (dot < 0) {
            return Duration.ofSeconds(Long.parseLong(seconds));
        }
        return Duration.ofSeconds(Long.parseLong(seconds.substring(0, dot)), toNanos(seconds.substring(dot + 1)));
    }

    /**
     * Fraction digits to nanoseconds: right-padded with zeros, truncated after nine digits.
     */
    static int toNanos(String digits) {
        var nanos = digits.length() >= NANO_DIGITS
                    ? digits.substring(0, NANO_DIGITS)
                    : digits + "0".repeat(NANO_DIGITS - digits.length());
        return Integer.parseInt(nanos);
    }

    private static ParseResult<Integer> bounded(Input input, String kind, int min, int max) {
        return Terminals.digits(input, 2)
                        .flatMap((digits, rest) -> {
                            int value = Integer.parseInt(digits);
                            if (value < min || value > max) {
                                return ParseResult.invalid(input, kind, digits,
                                                           String.format("must be between %02d and %02d", min, max));
                            }
                            return ParseResult.success(value, rest);
                        });
    }
}
