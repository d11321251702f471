package com.spreadsheet.formula.parser;

/**
 * A lexical token. Depending on the type:
 * - NUMBER: {@link #getNumber()}
 * - REFERENCE: {@link #getText()} is the A1 label, {@link #getQualifier()} the sheet (or null)
 * - STRUCTURED_REFERENCE: {@link #getText()} is the table, {@link #getQualifier()} the bracket body
 * - everything else: {@link #getText()}
 */
final class Token {
    private final TokenType type;
    private final String text;
    private final String qualifier;
    private final double number;

    private Token(TokenType type, String text, String qualifier, double number) {
        this.type = type;
        this.text = text;
        this.qualifier = qualifier;
        this.number = number;
    }

    static Token of(TokenType type, String text) {
        return new Token(type, text, null, 0);
    }

    static Token number(String text, double value) {
        return new Token(TokenType.NUMBER, text, null, value);
    }

    static Token reference(String sheetName, String label) {
        return new Token(TokenType.REFERENCE, label, sheetName, 0);
    }

    static Token structuredReference(String tableName, String body) {
        return new Token(TokenType.STRUCTURED_REFERENCE, tableName, body, 0);
    }

    TokenType getType() {
        return type;
    }

    String getText() {
        return text;
    }

    String getQualifier() {
        return qualifier;
    }

    double getNumber() {
        return number;
    }

    boolean is(TokenType expected, String expectedText) {
        return type == expected && expectedText.equals(text);
    }

    @Override
    public String toString() {
        return type + (text == null ? "" : "(" + text + ")");
    }
}
