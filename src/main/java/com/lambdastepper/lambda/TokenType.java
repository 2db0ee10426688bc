package com.lambdastepper.lambda;

enum TokenType {
    // infix only
    LEFT_PAREN, RIGHT_PAREN, DOT,

    // both notations
    COLON, IDENTIFIER,

    // prefix only
    AT,

    EOF
}
