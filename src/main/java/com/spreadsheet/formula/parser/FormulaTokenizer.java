package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits formula text into tokens. References are recognized here
 * (including sheet qualifiers, 3-D sheet spans and structured table
 * references) so the parser only has to deal with complete labels.
 */
final class FormulaTokenizer {

    private static final Pattern CELL_WORD = Pattern.compile("^[A-Za-z]{1,3}\\d+$");
    private static final Pattern COLUMN_WORD = Pattern.compile("^[A-Za-z]{1,3}$");
    private static final Pattern LETTERS = Pattern.compile("^[A-Za-z]+$");

    private final String input;
    private int pos;

    FormulaTokenizer(String input) {
        this.input = input;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"') {
                tokens.add(readString());
            } else if (c == '#') {
                tokens.add(readError());
            } else if (c == '\'') {
                tokens.add(readQuotedSheetReference());
            } else if (c == '$') {
                tokens.add(Token.reference(null, readReferenceLabel()));
            } else if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
                tokens.add(readNumberOrRowReference());
            } else if (isWordStart(c)) {
                tokens.add(readWord());
            } else {
                tokens.add(readPunctuation(c));
            }
        }
        tokens.add(Token.of(TokenType.END, null));
        return tokens;
    }

    // ----------------------------------------------------------------
    // Literals
    // ----------------------------------------------------------------

    private Token readString() {
        StringBuilder sb = new StringBuilder();
        int i = pos + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '"') {
                // "" inside a string is an escaped quote
                if (i + 1 < input.length() && input.charAt(i + 1) == '"') {
                    sb.append('"');
                    i += 2;
                    continue;
                }
                pos = i + 1;
                return Token.of(TokenType.STRING, sb.toString());
            }
            sb.append(c);
            i++;
        }
        throw new FormulaParseException("Unterminated string literal");
    }

    private Token readError() {
        int start = pos;
        pos++;
        while (pos < input.length() && isErrorBodyChar(input.charAt(pos))) {
            pos++;
        }
        return Token.of(TokenType.ERROR, input.substring(start, pos));
    }

    private Token readNumberOrRowReference() {
        int start = pos;
        int digitsEnd = skipDigits(pos);

        // "3:5" is a whole-row range, not a number
        if (digitsEnd > start && digitsEnd < input.length() && input.charAt(digitsEnd) == ':') {
            char afterColon = digitsEnd + 1 < input.length() ? input.charAt(digitsEnd + 1) : '\0';
            if (isDigit(afterColon) || afterColon == '$') {
                pos = digitsEnd;
                return Token.reference(null, input.substring(start, digitsEnd));
            }
        }

        int end = digitsEnd;
        if (end < input.length() && input.charAt(end) == '.') {
            end = skipDigits(end + 1);
        }
        if (end < input.length() && (input.charAt(end) == 'e' || input.charAt(end) == 'E')) {
            int exponent = end + 1;
            if (exponent < input.length() && (input.charAt(exponent) == '+' || input.charAt(exponent) == '-')) {
                exponent++;
            }
            int exponentEnd = skipDigits(exponent);
            if (exponentEnd == exponent) {
                throw new FormulaParseException("Invalid number literal \"" + input.substring(start, exponentEnd) + "\"");
            }
            end = exponentEnd;
        }

        String text = input.substring(start, end);
        pos = end;
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid number literal \"" + text + "\"", e);
        }
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new FormulaParseException("Number literal out of range \"" + text + "\"");
        }
        return Token.number(text, value);
    }

    // ----------------------------------------------------------------
    // References and identifiers
    // ----------------------------------------------------------------

    private Token readWord() {
        int start = pos;

        Token sheetSpan = tryReadSheetSpanReference();
        if (sheetSpan != null) {
            return sheetSpan;
        }

        int end = skipWordChars(start);
        String word = input.substring(start, end);
        char next = end < input.length() ? input.charAt(end) : '\0';

        if (next == '!') {
            pos = end + 1;
            return Token.reference(word, readReferenceLabel());
        }
        if (next == '[') {
            pos = end;
            return Token.structuredReference(word, readBracketBody());
        }
        if (next == '(') {
            pos = end;
            return Token.of(TokenType.IDENTIFIER, word);
        }
        if (next == '$' && LETTERS.matcher(word).matches()) {
            // "B$3": re-read the whole thing as a reference label
            return Token.reference(null, readReferenceLabel());
        }
        if (CELL_WORD.matcher(word).matches()) {
            pos = end;
            return Token.reference(null, word);
        }
        if (next == ':' && COLUMN_WORD.matcher(word).matches()) {
            pos = end;
            return Token.reference(null, word);
        }

        pos = end;
        return Token.of(TokenType.IDENTIFIER, word);
    }

    /**
     * Recognizes "Jan:Mar!A1" at the current position, or returns null
     * and leaves the position untouched.
     */
    private Token tryReadSheetSpanReference() {
        int firstEnd = skipWordChars(pos);
        if (firstEnd >= input.length() || input.charAt(firstEnd) != ':') {
            return null;
        }
        int secondStart = firstEnd + 1;
        if (secondStart >= input.length() || !isWordStart(input.charAt(secondStart))) {
            return null;
        }
        int secondEnd = skipWordChars(secondStart);
        if (secondEnd >= input.length() || input.charAt(secondEnd) != '!') {
            return null;
        }
        String sheetSpan = input.substring(pos, secondEnd);
        pos = secondEnd + 1;
        return Token.reference(sheetSpan, readReferenceLabel());
    }

    private Token readQuotedSheetReference() {
        StringBuilder sheetName = new StringBuilder();
        int i = pos + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\'') {
                if (i + 1 < input.length() && input.charAt(i + 1) == '\'') {
                    sheetName.append('\'');
                    i += 2;
                    continue;
                }
                i++;
                if (i >= input.length() || input.charAt(i) != '!') {
                    throw new FormulaParseException("Quoted sheet reference must be followed by '!'");
                }
                pos = i + 1;
                return Token.reference(sheetName.toString(), readReferenceLabel());
            }
            sheetName.append(c);
            i++;
        }
        throw new FormulaParseException("Unterminated quoted sheet reference");
    }

    /**
     * Reads a cell ("$B$3"), column ("$B") or row ("3") label.
     */
    private String readReferenceLabel() {
        int start = pos;
        int i = pos;
        if (i < input.length() && input.charAt(i) == '$') {
            i++;
        }
        int lettersStart = i;
        while (i < input.length() && isLetter(input.charAt(i))) {
            i++;
        }
        boolean hasLetters = i > lettersStart;

        int beforeSecondDollar = i;
        if (hasLetters && i < input.length() && input.charAt(i) == '$') {
            i++;
        }
        int digitsStart = i;
        i = skipDigits(i);
        boolean hasDigits = i > digitsStart;

        if (!hasLetters && !hasDigits) {
            throw new FormulaParseException("Expected a cell reference at position " + start);
        }
        if (hasLetters && !hasDigits) {
            // Column label; a trailing "$" without a row is not allowed
            i = beforeSecondDollar;
        }
        pos = i;
        return input.substring(start, i).toUpperCase(Locale.ROOT);
    }

    /**
     * Reads "[...]" after a table name, honouring nested brackets and
     * the "'" escape used in column names. Returns the text between the
     * outer brackets.
     */
    private String readBracketBody() {
        int depth = 0;
        int i = pos;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\'') {
                i += 2;
                continue;
            }
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    String body = input.substring(pos + 1, i);
                    pos = i + 1;
                    return body;
                }
            }
            i++;
        }
        throw new FormulaParseException("Unterminated structured reference");
    }

    // ----------------------------------------------------------------
    // Operators and punctuation
    // ----------------------------------------------------------------

    private Token readPunctuation(char c) {
        pos++;
        switch (c) {
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
            case '&':
                return Token.of(TokenType.OPERATOR, String.valueOf(c));
            case '=':
                return Token.of(TokenType.COMPARATOR, "=");
            case '<':
                if (peekChar(0) == '>' || peekChar(0) == '=') {
                    pos++;
                    return Token.of(TokenType.COMPARATOR, "<" + input.charAt(pos - 1));
                }
                return Token.of(TokenType.COMPARATOR, "<");
            case '>':
                if (peekChar(0) == '=') {
                    pos++;
                    return Token.of(TokenType.COMPARATOR, ">=");
                }
                return Token.of(TokenType.COMPARATOR, ">");
            case '(':
                return Token.of(TokenType.LPAREN, "(");
            case ')':
                return Token.of(TokenType.RPAREN, ")");
            case '{':
                return Token.of(TokenType.LBRACE, "{");
            case '}':
                return Token.of(TokenType.RBRACE, "}");
            case ',':
                return Token.of(TokenType.COMMA, ",");
            case ';':
                return Token.of(TokenType.SEMICOLON, ";");
            case ':':
                return Token.of(TokenType.COLON, ":");
            default:
                throw new FormulaParseException("Unexpected character \"" + c + "\" at position " + (pos - 1));
        }
    }

    // ----------------------------------------------------------------
    // Character helpers
    // ----------------------------------------------------------------

    private char peekChar(int offset) {
        int i = pos + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private int skipDigits(int from) {
        int i = from;
        while (i < input.length() && isDigit(input.charAt(i))) {
            i++;
        }
        return i;
    }

    private int skipWordChars(int from) {
        int i = from;
        while (i < input.length() && isWordChar(input.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '\\';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '\\';
    }

    private static boolean isErrorBodyChar(char c) {
        return isLetter(c) || isDigit(c) || c == '/' || c == '!' || c == '?' || c == '_';
    }
}
