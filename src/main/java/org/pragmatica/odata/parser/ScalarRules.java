package org.pragmatica.odata.parser;

import org.pragmatica.odata.tree.Literal;

import java.util.Base64;

/**
 * Rules for the non-temporal primitive literals: null, boolean, integer, float, string, GUID and binary.
 */
public final class ScalarRules {
    private static final int[] GUID_GROUPS = {8, 4, 4, 4, 12};

    private ScalarRules() {}

    /**
     * {@code null}, case-sensitive.
     */
    public static ParseResult<Literal.Null> nullValue(Input input) {
        return Terminals.text(input, "null")
                        .map(text -> Literal.Null.INSTANCE);
    }

    /**
     * {@code true} or {@code false}, case-insensitive.
     */
    public static ParseResult<Boolean> booleanValue(Input input) {
        return Terminals.textIgnoreCase(input, "true")
                        .map(text -> Boolean.TRUE)
                        .or(() -> Terminals.textIgnoreCase(input, "false")
                                           .map(text -> Boolean.FALSE));
    }

    /**
     * Optionally signed decimal integer. Values outside the signed 64-bit range are rejected.
     */
    public static ParseResult<Long> integer(Input input) {
        return Terminals.digits(skipSign(input))
                        .flatMap((digits, rest) -> toLong(input, rest));
    }

    private static ParseResult<Long> toLong(Input start, Input rest) {
        var token = start.textUpTo(rest);
        try {
            return ParseResult.success(Long.parseLong(token), rest);
        } catch (NumberFormatException e) {
            return ParseResult.invalid(start, "integer", token, "magnitude exceeds the signed 64-bit range");
        }
    }

    /**
     * Decimal number with a fraction and/or an exponent, or one of {@code NaN}, {@code INF}, {@code -INF}.
     * Plain integers never match.
     */
    public static ParseResult<Double> floatValue(Input input) {
        return decimal(input)
            .or(() -> Terminals.text(input, "NaN")
                               .map(text -> Double.NaN))
            .or(() -> Terminals.text(input, "INF")
                               .map(text -> Double.POSITIVE_INFINITY))
            .or(() -> Terminals.text(input, "-INF")
                               .map(text -> Double.NEGATIVE_INFINITY));
    }

    private static ParseResult<Double> decimal(Input input) {
        var integral = Terminals.digits(skipSign(input));
        if (!(integral instanceof ParseResult.Success<String> matched)) {
            return integral.cast();
        }
        var rest = matched.rest();
        boolean hasFraction = rest.startsWith('.');
        if (hasFraction) {
            rest = rest.advance(1);
            rest = rest.advance(rest.countWhile(Chars::isDigit, Integer.MAX_VALUE));
        }
        boolean hasExponent = rest.startsWith('e') || rest.startsWith('E');
        if (hasExponent) {
            // An exponent marker must be followed by digits
            var exponent = Terminals.digits(skipSign(rest.advance(1)));
            if (!(exponent instanceof ParseResult.Success<String> exponentDigits)) {
                return exponent.commit()
                               .cast();
            }
            rest = exponentDigits.rest();
        }
        if (!hasFraction && !hasExponent) {
            return ParseResult.failure(rest, "fraction or exponent");
        }
        return ParseResult.success(Double.parseDouble(input.textUpTo(rest)), rest);
    }

    /**
     * Apostrophe-delimited string, where a doubled apostrophe stands for a single one.
     */
    public static ParseResult<String> string(Input input) {
        if (!input.startsWith('\'')) {
            return ParseResult.failure(input, "quote");
        }
        var source = input.source();
        var sb = new StringBuilder();
        int pos = input.offset() + 1;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\'') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                return ParseResult.success(sb.toString(), new Input(source, pos + 1));
            }
            sb.append(c);
            pos++;
        }
        return ParseResult.failure(new Input(source, pos), "closing quote");
    }

    /**
     * GUID in 8-4-4-4-12 hexadecimal form, returned as written. Once the first two groups and their hyphens are
     * seen, a malformed remainder is reported as an invalid GUID. A shorter prefix backtracks, since a float such
     * as {@code 1234567e-5} starts with eight hex digits and a hyphen too.
     */
    public static ParseResult<String> guid(Input input) {
        var head = hexGroup(input, GUID_GROUPS[0])
            .flatMap((first, afterFirst) -> Terminals.character(afterFirst, '-'))
            .flatMap((hyphen, afterHyphen) -> hexGroup(afterHyphen, GUID_GROUPS[1]))
            .flatMap((second, afterSecond) -> Terminals.character(afterSecond, '-'));
        if (!(head instanceof ParseResult.Success<Character> prefix)) {
            return head.cast();
        }
        var rest = prefix.rest();
        for (int i = 2; i < GUID_GROUPS.length; i++) {
            int width = GUID_GROUPS[i];
            if (rest.countWhile(Chars::isHexDigit, width) != width) {
                return invalidGuid(input);
            }
            rest = rest.advance(width);
            if (i < GUID_GROUPS.length - 1) {
                if (!rest.startsWith('-')) {
                    return invalidGuid(input);
                }
                rest = rest.advance(1);
            }
        }
        return ParseResult.success(input.textUpTo(rest), rest);
    }

    private static ParseResult<String> hexGroup(Input input, int width) {
        return Terminals.takeWhile(input, Chars::isHexDigit, width, width, "hex digit");
    }

    private static <T> ParseResult<T> invalidGuid(Input input) {
        var token = input.textUpTo(input.advance(input.countWhile(c -> Chars.isHexDigit(c) || c == '-',
                                                                  Integer.MAX_VALUE)));
        return ParseResult.invalid(input, "guid", token, "expected 8-4-4-4-12 hexadecimal digit groups");
    }

    /**
     * {@code binary'...'} with URL-safe base64 content. Padding is optional.
     */
    public static ParseResult<byte[]> binary(Input input) {
        return Terminals.textIgnoreCase(input, "binary'")
                        .flatMap((prefix, body) -> base64Body(body));
    }

    private static ParseResult<byte[]> base64Body(Input body) {
        var source = body.source();
        int close = source.indexOf('\'', body.offset());
        if (close < 0) {
            return ParseResult.<byte[]>failure(new Input(source, source.length()), "closing quote")
                              .commit();
        }
        var content = source.substring(body.offset(), close);
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (!Chars.isBase64UrlChar(c)) {
                return ParseResult.invalid(body.advance(i), "binary", String.valueOf(c),
                                           "character is not part of the base64url alphabet");
            }
        }
        byte[] bytes;
        try {
            bytes = Base64.getUrlDecoder().decode(content);
        } catch (IllegalArgumentException e) {
            return ParseResult.invalid(body, "binary", content, "malformed base64url data: " + e.getMessage());
        }
        if (!canonicalEncoding(bytes, content.endsWith("=")).equals(content)) {
            return ParseResult.invalid(body, "binary", content, "unused trailing bits must be zero");
        }
        return ParseResult.success(bytes, new Input(source, close + 1));
    }

    /**
     * Canonical encoding of {@code bytes} in the chosen padding style.
     */
    private static String canonicalEncoding(byte[] bytes, boolean padded) {
        var encoder = padded ? Base64.getUrlEncoder() : Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString(bytes);
    }

    private static Input skipSign(Input input) {
        return input.startsWith('+') || input.startsWith('-')
               ? input.advance(1)
               : input;
    }
}
