package com.lambdastepper.lambda;

import java.util.List;

import static com.lambdastepper.lambda.TokenType.*;

/*
 * Grammar (prefix notation):
 *
 * expression     : "@" expression expression
 *                | ":" IDENTIFIER expression
 *                | IDENTIFIER ;
 *
 * Every operator has fixed arity, so no parentheses are needed.
 * Example: "@ :x :y x :x :y y" is "(:x y.x) (:x y.y)".
 */

public class PrefixParser {
    private final List<Token> tokens;
    private final String source;
    private int current = 0;

    PrefixParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static PrefixParser newFromSource(String source) {
        Scanner scanner = new Scanner(source, true);
        List<Token> tokens = scanner.scanTokens();
        return new PrefixParser(source, tokens);
    }

    public Term parseExpression() {
        return expression();
    }

    public Term parseAll() {
        Term term = expression();
        if (!isAtEnd()) {
            throw error(ParseError.Kind.TRAILING_INPUT, peekTok(), "Unexpected trailing input");
        }
        return term;
    }

    public String remaining() {
        return source.substring(peekTok().offset).trim();
    }

    public boolean isAtEnd() {
        return peekTok().type == EOF;
    }

    private Term expression() {
        if (matchAny(AT)) {
            Term left = expression();
            Term right = expression();
            return new Term.Application(left, right);
        }
        if (matchAny(COLON)) {
            Token colon = prevTok();
            if (!matchAny(IDENTIFIER)) {
                throw error(ParseError.Kind.MALFORMED_LAMBDA, colon, "Expected parameter after ':'");
            }
            String param = prevTok().lexeme;
            return new Term.Lambda(param, expression());
        }
        if (matchAny(IDENTIFIER)) {
            return new Term.Variable(prevTok().lexeme);
        }
        throw error(ParseError.Kind.MALFORMED_VARIABLE, peekTok(), "Expected variable");
    }

    private boolean matchAny(TokenType ttype) {
        if (isAtEnd() || peekTok().type != ttype) {
            return false;
        }
        current++;
        return true;
    }

    private Token peekTok() {
        return tokens.get(current);
    }

    private Token prevTok() {
        return tokens.get(current-1);
    }

    private ParseError error(ParseError.Kind kind, Token token, String msg) {
        String rest = source.substring(token.offset).trim();
        LambdaCalculus.error(msg, rest);
        return new ParseError(kind, msg, rest);
    }
}
