package org.pragmatica.odata.tree;

import io.vavr.control.Option;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Base64;
import java.util.UUID;

/**
 * OData primitive literal - one case per primitive kind.
 *
 * <p>All cases are immutable and own their payload; none of them keeps a reference into the parsed text.
 */
public sealed interface Literal {

    /**
     * Short name of the literal kind, used in error messages.
     */
    String kind();

    /**
     * The {@code null} literal.
     */
    record Null() implements Literal {
        public static final Null INSTANCE = new Null();

        @Override
        public String kind() {
            return "null";
        }
    }

    record BooleanValue(boolean value) implements Literal {
        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        public static BooleanValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public String kind() {
            return "boolean";
        }
    }

    /**
     * Signed 64-bit integer.
     */
    record IntegerValue(long value) implements Literal {
        @Override
        public String kind() {
            return "integer";
        }
    }

    /**
     * IEEE double, including NaN and the infinities. Equality follows {@code ==}: NaN never equals itself and
     * {@code 0.0} equals {@code -0.0}. NaN must be checked with {@link #isNaN()}.
     */
    record FloatValue(double value) implements Literal {
        public static final FloatValue NAN = new FloatValue(Double.NaN);
        public static final FloatValue POSITIVE_INFINITY = new FloatValue(Double.POSITIVE_INFINITY);
        public static final FloatValue NEGATIVE_INFINITY = new FloatValue(Double.NEGATIVE_INFINITY);

        public boolean isNaN() {
            return Double.isNaN(value);
        }

        @Override
        public String kind() {
            return "float";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FloatValue other && value == other.value;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value == 0.0 ? 0.0 : value);
        }
    }

    /**
     * Unescaped string content.
     */
    record StringValue(String value) implements Literal {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("String literal value must not be null");
            }
        }

        @Override
        public String kind() {
            return "string";
        }
    }

    /**
     * GUID in its 8-4-4-4-12 form, case preserved as written.
     */
    record GuidValue(String value) implements Literal {
        public GuidValue {
            if (value == null || value.length() != 36) {
                throw new IllegalArgumentException("GUID must have 36 characters: " + value);
            }
        }

        public UUID toUuid() {
            return UUID.fromString(value);
        }

        @Override
        public String kind() {
            return "guid";
        }
    }

    /**
     * Calendar date. Years may be negative.
     */
    record DateValue(LocalDate date) implements Literal {
        public DateValue {
            if (date == null) {
                throw new IllegalArgumentException("Date must not be null");
            }
        }

        public static DateValue of(int year, int month, int day) {
            return new DateValue(LocalDate.of(year, month, day));
        }

        @Override
        public String kind() {
            return "date";
        }
    }

    /**
     * Time of day. Hour 24 is accepted with any minute and second.
     */
    record TimeValue(int hour, int minute, int second, int nano) implements Literal {
        public TimeValue {
            if (hour < 0 || hour > 24) {
                throw new IllegalArgumentException("Hour out of range: " + hour);
            }
            if (minute < 0 || minute > 59) {
                throw new IllegalArgumentException("Minute out of range: " + minute);
            }
            if (second < 0 || second > 59) {
                throw new IllegalArgumentException("Second out of range: " + second);
            }
            if (nano < 0 || nano > 999_999_999) {
                throw new IllegalArgumentException("Nanosecond out of range: " + nano);
            }
        }

        public static TimeValue of(int hour, int minute) {
            return new TimeValue(hour, minute, 0, 0);
        }

        public static TimeValue of(int hour, int minute, int second) {
            return new TimeValue(hour, minute, second, 0);
        }

        public static TimeValue of(int hour, int minute, int second, int nano) {
            return new TimeValue(hour, minute, second, nano);
        }

        /**
         * Convert to {@link LocalTime}; empty for hour 24, which {@code java.time} cannot represent.
         */
        public Option<LocalTime> toLocalTime() {
            return hour == 24
                   ? Option.none()
                   : Option.some(LocalTime.of(hour, minute, second, nano));
        }

        @Override
        public String kind() {
            return "time";
        }
    }

    /**
     * Date and time with a signed UTC offset in minutes.
     */
    record DateTimeOffsetValue(LocalDate date, TimeValue time, int offsetMinutes) implements Literal {
        public DateTimeOffsetValue {
            if (date == null || time == null) {
                throw new IllegalArgumentException("Date and time must not be null");
            }
        }

        public static DateTimeOffsetValue utc(LocalDate date, TimeValue time) {
            return new DateTimeOffsetValue(date, time, 0);
        }

        /**
         * Convert to {@link OffsetDateTime}; empty for hour 24 or offsets beyond {@code java.time} limits.
         */
        public Option<OffsetDateTime> toOffsetDateTime() {
            if (Math.abs(offsetMinutes) > 18 * 60) {
                return Option.none();
            }
            var offset = ZoneOffset.ofTotalSeconds(offsetMinutes * 60);
            return time.toLocalTime()
                       .map(localTime -> OffsetDateTime.of(LocalDateTime.of(date, localTime), offset));
        }

        @Override
        public String kind() {
            return "datetime";
        }
    }

    /**
     * Signed elapsed time.
     */
    record DurationValue(Duration duration) implements Literal {
        public DurationValue {
            if (duration == null) {
                throw new IllegalArgumentException("Duration must not be null");
            }
        }

        @Override
        public String kind() {
            return "duration";
        }
    }

    /**
     * Raw bytes. The array is copied on the way in and on the way out.
     */
    record BinaryValue(byte[] bytes) implements Literal {
        public BinaryValue {
            if (bytes == null) {
                throw new IllegalArgumentException("Binary content must not be null");
            }
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        public int length() {
            return bytes.length;
        }

        @Override
        public String kind() {
            return "binary";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BinaryValue other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "BinaryValue[" + Base64.getUrlEncoder().encodeToString(bytes) + "]";
        }
    }
}
