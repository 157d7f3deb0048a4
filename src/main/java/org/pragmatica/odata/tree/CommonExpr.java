package org.pragmatica.odata.tree;

/**
 * Primary expression: either a literal or a name.
 */
public sealed interface CommonExpr {

    static CommonExpr literal(Literal literal) {
        return new LiteralExpr(literal);
    }

    static CommonExpr name(Name name) {
        return new NameExpr(name);
    }

    record LiteralExpr(Literal literal) implements CommonExpr {}

    record NameExpr(Name name) implements CommonExpr {}
}
