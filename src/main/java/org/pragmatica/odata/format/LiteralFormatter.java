package org.pragmatica.odata.format;

import org.pragmatica.odata.tree.CommonExpr;
import org.pragmatica.odata.tree.Literal;
import org.pragmatica.odata.tree.Name;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Base64;

/**
 * Renders literals and names back to canonical OData text. The output of {@link #format(Literal)} parses to an
 * equal literal, provided dates have four-digit years.
 */
public final class LiteralFormatter {
    private static final long SECONDS_PER_DAY = 86_400;

    private LiteralFormatter() {}

    public static String format(CommonExpr expr) {
        if (expr instanceof CommonExpr.LiteralExpr literal) {
            return format(literal.literal());
        }
        return format(((CommonExpr.NameExpr) expr).name());
    }

    public static String format(Name name) {
        return name.fullName();
    }

    public static String format(Literal literal) {
        if (literal instanceof Literal.Null) {
            return "null";
        }
        if (literal instanceof Literal.BooleanValue bool) {
            return String.valueOf(bool.value());
        }
        if (literal instanceof Literal.IntegerValue integer) {
            return String.valueOf(integer.value());
        }
        if (literal instanceof Literal.FloatValue number) {
            return formatFloat(number.value());
        }
        if (literal instanceof Literal.StringValue string) {
            return "'" + string.value().replace("'", "''") + "'";
        }
        if (literal instanceof Literal.GuidValue guid) {
            return guid.value();
        }
        if (literal instanceof Literal.DateValue date) {
            return formatDate(date.date());
        }
        if (literal instanceof Literal.TimeValue time) {
            return formatTime(time);
        }
        if (literal instanceof Literal.DateTimeOffsetValue dateTime) {
            return formatDate(dateTime.date()) + "T" + formatTime(dateTime.time())
                   + formatOffset(dateTime.offsetMinutes());
        }
        if (literal instanceof Literal.DurationValue duration) {
            return "duration'" + formatDuration(duration.duration()) + "'";
        }
        var binary = (Literal.BinaryValue) literal;
        return "binary'" + Base64.getUrlEncoder().encodeToString(binary.bytes()) + "'";
    }

    private static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "INF" : "-INF";
        }
        return Double.toString(value);
    }

    private static String formatDate(LocalDate date) {
        var sign = date.getYear() < 0 ? "-" : "";
        return String.format("%s%04d-%02d-%02d", sign, Math.abs(date.getYear()), date.getMonthValue(),
                             date.getDayOfMonth());
    }

    private static String formatTime(Literal.TimeValue time) {
        return String.format("%02d:%02d:%02d", time.hour(), time.minute(), time.second())
               + formatFraction(time.nano());
    }

    private static String formatFraction(int nano) {
        if (nano == 0) {
            return "";
        }
        var digits = String.format("%09d", nano);
        int end = digits.length();
        while (digits.charAt(end - 1) == '0') {
            end--;
        }
        return "." + digits.substring(0, end);
    }

    private static String formatOffset(int offsetMinutes) {
        if (offsetMinutes == 0) {
            return "Z";
        }
        int total = Math.abs(offsetMinutes);
        return String.format("%s%02d:%02d", offsetMinutes < 0 ? "-" : "+", total / 60, total % 60);
    }

    /**
     * {@code [-]P[nD][T[nH][nM][n[.f]S]]}; zero is {@code PT0S}.
     */
    static String formatDuration(Duration duration) {
        if (duration.isZero()) {
            return "PT0S";
        }
        if (duration.isNegative()) {
            return "-" + formatDuration(duration.negated());
        }
        long seconds = duration.getSeconds();
        long days = seconds / SECONDS_PER_DAY;
        long hours = seconds % SECONDS_PER_DAY / 3600;
        long minutes = seconds % 3600 / 60;
        long secs = seconds % 60;
        int nano = duration.getNano();

        var sb = new StringBuilder("P");
        if (days > 0) {
            sb.append(days).append('D');
        }
        if (hours > 0 || minutes > 0 || secs > 0 || nano > 0) {
            sb.append('T');
            if (hours > 0) {
                sb.append(hours).append('H');
            }
            if (minutes > 0) {
                sb.append(minutes).append('M');
            }
            if (secs > 0 || nano > 0) {
                sb.append(secs).append(formatFraction(nano)).append('S');
            }
        }
        return sb.toString();
    }
}
