package com.acme.nummern.script.normalize;

import java.util.Objects;

/** One lexical token of a script line. {@code text} is the raw source slice. */
public record Token(Kind kind, String text) {
    public enum Kind {
        IDENTIFIER,
        NUMBER,
        STRING,
        OPERATOR,
        COMMENT,
        UNKNOWN
    }

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(Kind k, String t) {
        return kind == k && text.equals(t);
    }

    public boolean isOperator(String t) {
        return is(Kind.OPERATOR, t);
    }

    public boolean isIdentifier(String t) {
        return is(Kind.IDENTIFIER, t);
    }
}
