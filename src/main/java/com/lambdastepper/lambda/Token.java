package com.lambdastepper.lambda;

class Token {
    final TokenType type;
    final String lexeme;
    final int offset; // index of the first character in the source

    Token(TokenType type, String lexeme, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.offset = offset;
    }

    public String toString() {
        return type + " " + lexeme + " @" + offset;
    }
}
