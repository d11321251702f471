package com.spreadsheet.formula.parser;

enum TokenType {
    NUMBER,
    STRING,
    ERROR,
    IDENTIFIER,
    REFERENCE,
    STRUCTURED_REFERENCE,
    OPERATOR,
    COMPARATOR,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    COLON,
    END
}
