package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.List;

import static com.lambdastepper.lambda.TokenType.*;

/**
 * Splits expression text into tokens. The same scanner serves both
 * notations: infix accepts parentheses and dots, prefix accepts '@'.
 */
class Scanner {
    private final String source;
    private final boolean prefix;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;

    Scanner(String source) {
        this(source, false);
    }

    Scanner(String source, boolean prefix) {
        this.source = source;
        this.prefix = prefix;
    }

    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            // We are at the beginning of the next lexeme.
            start = current;
            scanToken();
        }
        tokens.add(new Token(EOF, "", source.length()));
        return tokens;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ':': addToken(COLON); break;
            case '(':
                if (prefix) unexpected();
                addToken(LEFT_PAREN);
                break;
            case ')':
                if (prefix) unexpected();
                addToken(RIGHT_PAREN);
                break;
            case '.':
                if (prefix) unexpected();
                addToken(DOT);
                break;
            case '@':
                if (!prefix) unexpected();
                addToken(AT);
                break;
            default:
                if (Character.isWhitespace(c)) {
                    break;
                }
                if (LambdaUtil.isIdentifierChar(c)) {
                    identifier();
                } else {
                    unexpected();
                }
                break;
        }
    }

    private void identifier() {
        while (!isAtEnd() && LambdaUtil.isIdentifierChar(peek())) advance();
        addToken(IDENTIFIER);
    }

    private void unexpected() {
        String rest = source.substring(start).trim();
        String msg = "Unexpected character '" + source.charAt(start) + "'";
        LambdaCalculus.error(msg, rest);
        throw new ParseError(ParseError.Kind.UNEXPECTED_CHARACTER, msg, rest);
    }

    private char advance() {
        current++;
        return source.charAt(current-1);
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        } else {
            return source.charAt(current);
        }
    }

    private void addToken(TokenType ttype) {
        String text = source.substring(start, current);
        tokens.add(new Token(ttype, text, start));
    }
}
