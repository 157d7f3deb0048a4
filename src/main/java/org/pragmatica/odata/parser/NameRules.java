package org.pragmatica.odata.parser;

import org.pragmatica.odata.tree.Name;

import java.util.ArrayList;
import java.util.List;

/**
 * Rules for identifiers and dot-separated qualified names.
 */
public final class NameRules {
    private NameRules() {}

    /**
     * A letter or underscore followed by letters, digits and underscores.
     */
    public static ParseResult<String> identifier(Input input) {
        if (input.isAtEnd() || !Chars.isIdentifierStart(input.codePoint())) {
            return ParseResult.failure(input, "identifier");
        }
        var rest = input.advanceCodePoint();
        while (!rest.isAtEnd() && Chars.isIdentifierPart(rest.codePoint())) {
            rest = rest.advanceCodePoint();
        }
        return ParseResult.success(input.textUpTo(rest), rest);
    }

    /**
     * One or more identifiers separated by dots, matched greedily. A dot not followed by an identifier is left
     * in the remaining input.
     */
    public static ParseResult<List<String>> qualifiedSegments(Input input) {
        var first = identifier(input);
        if (!(first instanceof ParseResult.Success<String> head)) {
            return first.cast();
        }
        var segments = new ArrayList<String>();
        segments.add(head.value());
        var rest = head.rest();
        while (rest.startsWith('.')) {
            if (!(identifier(rest.advance(1)) instanceof ParseResult.Success<String> next)) {
                break;
            }
            segments.add(next.value());
            rest = next.rest();
        }
        return ParseResult.success(List.copyOf(segments), rest);
    }

    /**
     * Qualified name; a single segment collapses to {@link Name.Identifier}.
     */
    public static ParseResult<Name> name(Input input) {
        return qualifiedSegments(input).map(Name::of);
    }
}
