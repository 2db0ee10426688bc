package com.lambdastepper.lambda;

import java.util.ArrayList;
import java.util.List;

import static com.lambdastepper.lambda.TokenType.*;

/*
 * Grammar (infix notation):
 *
 * expression     : term+ ;                  left-associative application
 * term           : IDENTIFIER
 *                | "(" expression ")"
 *                | lambda ;
 * lambda         : ":" IDENTIFIER+ "." expression ;
 *
 * A lambda body extends as far right as possible, so "f :x.x y" is
 * "f (:x.(x y))". ":x y z.body" is sugar for ":x.:y.:z.body".
 */

public class Parser {
    private final List<Token> tokens;
    private final String source;
    private int current = 0;

    Parser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static Parser newFromSource(String source) {
        Scanner scanner = new Scanner(source);
        List<Token> tokens = scanner.scanTokens();
        return new Parser(source, tokens);
    }

    /**
     * Parses one expression starting at the current token. Parsing stops at
     * the end of input or at an unmatched ')'; whatever follows is left for
     * the caller to inspect with {@link #remaining()}.
     */
    public Term parseExpression() {
        Term term = expression();
        LambdaUtil.debug("parse", "parsed " + Terms.size(term) + " nodes, remaining '" + remaining() + "'");
        return term;
    }

    /**
     * Like {@link #parseExpression()} but rejects trailing input.
     */
    public Term parseAll() {
        Term term = parseExpression();
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
        List<Term> terms = new ArrayList<>();
        while (!isAtEnd() && !checkTok(RIGHT_PAREN)) {
            if (matchAny(LEFT_PAREN)) {
                terms.add(parenthetical(prevTok()));
            } else if (matchAny(COLON)) {
                terms.add(lambda(prevTok()));
            } else if (matchAny(IDENTIFIER)) {
                terms.add(new Term.Variable(prevTok().lexeme));
            } else {
                throw error(ParseError.Kind.UNEXPECTED_CHARACTER, peekTok(),
                    "Unexpected '" + peekTok().lexeme + "'");
            }
        }
        return applicationChain(terms, peekTok());
    }

    private Term parenthetical(Token lparen) {
        Term inner = expression();
        if (!matchAny(RIGHT_PAREN)) {
            throw error(ParseError.Kind.UNMATCHED_PAREN, lparen, "Expected ')' to close '('");
        }
        return inner;
    }

    private Term lambda(Token colon) {
        List<String> params = new ArrayList<>();
        while (matchAny(IDENTIFIER)) {
            params.add(prevTok().lexeme);
        }
        if (params.isEmpty() || !matchAny(DOT)) {
            throw error(ParseError.Kind.MALFORMED_LAMBDA, colon,
                "Expected one or more parameters followed by '.' after ':'");
        }
        Term body = expression();
        // innermost parameter first
        for (int i = params.size() - 1; i >= 0; i--) {
            body = new Term.Lambda(params.get(i), body);
        }
        return body;
    }

    private Term applicationChain(List<Term> terms, Token at) {
        if (terms.isEmpty()) {
            throw error(ParseError.Kind.EMPTY_EXPRESSION, at, "Expected expression");
        }
        Term chain = terms.get(0);
        for (int i = 1; i < terms.size(); i++) {
            chain = new Term.Application(chain, terms.get(i));
        }
        return chain;
    }

    private boolean matchAny(TokenType... ttypes) {
        for (TokenType ttype : ttypes) {
            if (checkTok(ttype)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean checkTok(TokenType ttype) {
        if (isAtEnd()) return false;
        return peekTok().type == ttype;
    }

    private Token peekTok() {
        return tokens.get(current);
    }

    private Token prevTok() {
        if (current == 0) return peekTok();
        return tokens.get(current-1);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return prevTok();
    }

    private ParseError error(ParseError.Kind kind, Token token, String msg) {
        String rest = source.substring(token.offset).trim();
        LambdaCalculus.error(msg, rest);
        return new ParseError(kind, msg, rest);
    }
}
