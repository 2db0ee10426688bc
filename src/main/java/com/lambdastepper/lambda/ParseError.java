package com.lambdastepper.lambda;

/**
 * Thrown by both parsers. Carries the input that was left when parsing
 * failed, starting at the offending token.
 */
public class ParseError extends RuntimeException {
    public enum Kind {
        MALFORMED_VARIABLE,
        MALFORMED_LAMBDA,
        UNMATCHED_PAREN,
        EMPTY_EXPRESSION,
        UNEXPECTED_CHARACTER,
        TRAILING_INPUT
    }

    private final Kind kind;
    private final String remaining;

    public ParseError(Kind kind, String message, String remaining) {
        super(message + " at '" + remaining + "'");
        this.kind = kind;
        this.remaining = remaining;
    }

    public Kind getKind() {
        return kind;
    }

    public String getRemaining() {
        return remaining;
    }
}
