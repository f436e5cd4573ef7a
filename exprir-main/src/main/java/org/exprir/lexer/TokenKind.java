package org.exprir.lexer;

public enum TokenKind {
    NUMBER,
    IDENTIFIER,
    PLUS,
    MINUS,
    MUL,
    DIV,
    LEFT_PAREN,
    RIGHT_PAREN,
    END_OF_FILE
}
