package org.carball.docsim.parser;

public enum TokenType {
    WORD,
    STRING,
    DOT,
    COMMA,
    EQUALS,
    LEFT_PAREN,
    RIGHT_PAREN,
    STAR,
    SEMICOLON,
    EOF
}
