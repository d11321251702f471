package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.ast.ArrayNode;
import com.spreadsheet.formula.ast.BinaryNode;
import com.spreadsheet.formula.ast.CompareNode;
import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.ast.FunctionNode;
import com.spreadsheet.formula.ast.LiteralNode;
import com.spreadsheet.formula.ast.NameNode;
import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.ReferenceNode;
import com.spreadsheet.formula.ast.StructuredReferenceNode;
import com.spreadsheet.formula.ast.TableItem;
import com.spreadsheet.formula.ast.UnaryNode;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.values.ErrorCode;
import com.spreadsheet.formula.values.FormulaScalar;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the formula grammar.
 * Precedence, lowest first:
 * 1) comparison  = <> < > <= >=
 * 2) concatenation  &
 * 3) additive  + -
 * 4) multiplicative  * /
 * 5) power  ^
 * 6) prefix  + -
 * All binary operators are left associative.
 */
@Component
public class DefaultFormulaParser implements FormulaParser {

    private static final Pattern COLUMN_LABEL = Pattern.compile("^(\\$)?([A-Z]{1,3})$");
    private static final Pattern ROW_LABEL = Pattern.compile("^(\\$)?(\\d+)$");

    @Override
    public FormulaNode parse(String formula) {
        Objects.requireNonNull(formula, "formula");
        if (formula.trim().isEmpty()) {
            throw new FormulaParseException("Empty formula");
        }
        ParserState state = new ParserState(new FormulaTokenizer(formula).tokenize());
        FormulaNode node = parseComparison(state);
        Token trailing = state.peek();
        if (trailing.getType() != TokenType.END) {
            throw new FormulaParseException("Unexpected trailing token " + trailing);
        }
        return node;
    }

    // ----------------------------------------------------------------
    // Operator levels
    // ----------------------------------------------------------------

    private FormulaNode parseComparison(ParserState state) {
        FormulaNode left = parseConcatenation(state);
        while (state.peek().getType() == TokenType.COMPARATOR) {
            CompareNode.Operator op = CompareNode.Operator.fromSymbol(state.next().getText());
            left = new CompareNode(op, left, parseConcatenation(state));
        }
        return left;
    }

    private FormulaNode parseConcatenation(ParserState state) {
        FormulaNode left = parseAdditive(state);
        while (state.peek().is(TokenType.OPERATOR, "&")) {
            state.next();
            left = new BinaryNode(BinaryNode.Operator.CONCAT, left, parseAdditive(state));
        }
        return left;
    }

    private FormulaNode parseAdditive(ParserState state) {
        FormulaNode left = parseMultiplicative(state);
        while (state.peek().is(TokenType.OPERATOR, "+") || state.peek().is(TokenType.OPERATOR, "-")) {
            BinaryNode.Operator op = BinaryNode.Operator.fromSymbol(state.next().getText());
            left = new BinaryNode(op, left, parseMultiplicative(state));
        }
        return left;
    }

    private FormulaNode parseMultiplicative(ParserState state) {
        FormulaNode left = parsePower(state);
        while (state.peek().is(TokenType.OPERATOR, "*") || state.peek().is(TokenType.OPERATOR, "/")) {
            BinaryNode.Operator op = BinaryNode.Operator.fromSymbol(state.next().getText());
            left = new BinaryNode(op, left, parsePower(state));
        }
        return left;
    }

    private FormulaNode parsePower(ParserState state) {
        FormulaNode left = parseUnary(state);
        while (state.peek().is(TokenType.OPERATOR, "^")) {
            state.next();
            left = new BinaryNode(BinaryNode.Operator.POWER, left, parseUnary(state));
        }
        return left;
    }

    private FormulaNode parseUnary(ParserState state) {
        Token token = state.peek();
        if (token.is(TokenType.OPERATOR, "-")) {
            state.next();
            return new UnaryNode(UnaryNode.Operator.MINUS, parseUnary(state));
        }
        if (token.is(TokenType.OPERATOR, "+")) {
            state.next();
            return new UnaryNode(UnaryNode.Operator.PLUS, parseUnary(state));
        }
        return parsePrimary(state);
    }

    // ----------------------------------------------------------------
    // Primary expressions
    // ----------------------------------------------------------------

    private FormulaNode parsePrimary(ParserState state) {
        Token token = state.next();
        switch (token.getType()) {
            case NUMBER:
                return new LiteralNode(FormulaScalar.number(token.getNumber()));
            case STRING:
                return new LiteralNode(FormulaScalar.text(token.getText()));
            case ERROR:
                return parseErrorLiteral(token);
            case REFERENCE:
                return parseReference(state, token);
            case STRUCTURED_REFERENCE:
                return parseStructuredReference(token.getText(), token.getQualifier());
            case IDENTIFIER:
                return parseIdentifier(state, token);
            case LBRACE:
                return parseArray(state);
            case LPAREN: {
                FormulaNode inner = parseComparison(state);
                state.expect(TokenType.RPAREN);
                return inner;
            }
            default:
                throw new FormulaParseException("Unexpected token " + token);
        }
    }

    private FormulaNode parseErrorLiteral(Token token) {
        ErrorCode code = ErrorCode.fromText(token.getText().toUpperCase(Locale.ROOT));
        if (code == null) {
            throw new FormulaParseException("Unknown error literal \"" + token.getText() + "\"");
        }
        return new LiteralNode(FormulaScalar.error(code));
    }

    private FormulaNode parseIdentifier(ParserState state, Token token) {
        String name = token.getText();
        if (state.peek().getType() == TokenType.LPAREN) {
            state.next();
            return new FunctionNode(name.toUpperCase(Locale.ROOT), parseArguments(state));
        }
        String upper = name.toUpperCase(Locale.ROOT);
        if ("TRUE".equals(upper) || "FALSE".equals(upper)) {
            return new LiteralNode(FormulaScalar.bool("TRUE".equals(upper)));
        }
        return new NameNode(name);
    }

    /**
     * Parses the argument list after "(". An omitted argument, as in
     * IF(A1,,0), becomes a blank literal.
     */
    private List<FormulaNode> parseArguments(ParserState state) {
        List<FormulaNode> args = new ArrayList<>();
        if (state.peek().getType() == TokenType.RPAREN) {
            state.next();
            return args;
        }
        while (true) {
            TokenType upcoming = state.peek().getType();
            if (upcoming == TokenType.COMMA || upcoming == TokenType.RPAREN) {
                args.add(new LiteralNode(FormulaScalar.blank()));
            } else {
                args.add(parseComparison(state));
            }
            if (state.peek().getType() == TokenType.COMMA) {
                state.next();
                continue;
            }
            break;
        }
        state.expect(TokenType.RPAREN);
        return args;
    }

    private FormulaNode parseArray(ParserState state) {
        List<List<FormulaNode>> rows = new ArrayList<>();
        List<FormulaNode> currentRow = new ArrayList<>();
        if (state.peek().getType() == TokenType.RBRACE) {
            state.next();
            rows.add(currentRow);
            return new ArrayNode(rows);
        }
        while (true) {
            currentRow.add(parseComparison(state));
            Token separator = state.next();
            if (separator.getType() == TokenType.COMMA) {
                continue;
            }
            if (separator.getType() == TokenType.SEMICOLON) {
                rows.add(currentRow);
                currentRow = new ArrayList<>();
                continue;
            }
            if (separator.getType() == TokenType.RBRACE) {
                rows.add(currentRow);
                int width = rows.get(0).size();
                for (List<FormulaNode> row : rows) {
                    if (row.size() != width) {
                        throw new FormulaParseException("Array literal rows differ in width");
                    }
                }
                return new ArrayNode(rows);
            }
            throw new FormulaParseException("Unexpected token in array literal: " + separator);
        }
    }

    // ----------------------------------------------------------------
    // References
    // ----------------------------------------------------------------

    private enum LabelKind { CELL, COLUMN, ROW }

    /**
     * A parsed reference label with the block of cells it covers on its own.
     */
    private static final class Label {
        final LabelKind kind;
        final CellAddress start;
        final CellAddress end;

        Label(LabelKind kind, CellAddress start, CellAddress end) {
            this.kind = kind;
            this.start = start;
            this.end = end;
        }
    }

    private FormulaNode parseReference(ParserState state, Token token) {
        Label left = parseLabel(token.getText());

        if (state.peek().getType() == TokenType.COLON) {
            state.next();
            Token endToken = readRangeEnd(state);
            Label right = parseLabel(endToken.getText());

            if (left.kind != right.kind) {
                throw new FormulaParseException("Mixed row/column/cell reference kinds are not supported");
            }
            String leftSheet = token.getQualifier();
            String rightSheet = endToken.getQualifier();
            if (leftSheet != null && rightSheet != null && !leftSheet.equalsIgnoreCase(rightSheet)) {
                throw new FormulaParseException("Range ends on different sheets: " + leftSheet + ", " + rightSheet);
            }
            String sheetName = leftSheet != null ? leftSheet : rightSheet;
            return new RangeNode(new CellRange(left.start, right.end, sheetName));
        }

        if (left.kind != LabelKind.CELL) {
            throw new FormulaParseException("Expected a cell reference, got " + token.getText());
        }
        String sheetName = token.getQualifier();
        if (sheetName != null && sheetName.indexOf(':') >= 0) {
            // Jan:Mar!B2 is a 3-D range of single cells
            return new RangeNode(new CellRange(left.start, left.end, sheetName));
        }
        return new ReferenceNode(left.start, sheetName);
    }

    /**
     * The right side of "A:C" or "1:3" is lexed as an identifier or a number
     * because the tokenizer has no look-behind; re-read it as a label here.
     */
    private Token readRangeEnd(ParserState state) {
        Token token = state.next();
        if (token.getType() == TokenType.REFERENCE) {
            return token;
        }
        if (token.getType() == TokenType.IDENTIFIER
                && COLUMN_LABEL.matcher(token.getText().toUpperCase(Locale.ROOT)).matches()) {
            return Token.reference(null, token.getText().toUpperCase(Locale.ROOT));
        }
        if (token.getType() == TokenType.NUMBER && ROW_LABEL.matcher(token.getText()).matches()) {
            return Token.reference(null, token.getText());
        }
        throw new FormulaParseException("Expected the end of a range, got " + token);
    }

    private Label parseLabel(String rawLabel) {
        String label = rawLabel.toUpperCase(Locale.ROOT);
        try {
            Matcher column = COLUMN_LABEL.matcher(label);
            if (column.matches()) {
                int index = CellAddress.columnLettersToIndex(column.group(2));
                boolean absolute = column.group(1) != null;
                return new Label(LabelKind.COLUMN,
                        new CellAddress(index, 1, absolute, true),
                        new CellAddress(index, CellAddress.MAX_ROWS, absolute, true));
            }
            Matcher row = ROW_LABEL.matcher(label);
            if (row.matches()) {
                int index = Integer.parseInt(row.group(2));
                boolean absolute = row.group(1) != null;
                return new Label(LabelKind.ROW,
                        new CellAddress(1, index, true, absolute),
                        new CellAddress(CellAddress.MAX_COLUMNS, index, true, absolute));
            }
            CellAddress address = CellAddress.parse(label);
            return new Label(LabelKind.CELL, address, address);
        } catch (InvalidReferenceException | NumberFormatException e) {
            throw new FormulaParseException("Invalid reference \"" + label + "\"", e);
        }
    }

    /**
     * Interprets the bracket body of Table[...]:
     * - "" -> whole data body
     * - "Col" -> one column
     * - "#Totals" -> one item
     * - "@Col" / "@[Col]" -> this row of a column
     * - "[#This Row],[A]:[C]" -> item plus column span
     */
    private FormulaNode parseStructuredReference(String tableName, String body) {
        String trimmed = body.trim();
        if (trimmed.isEmpty()) {
            return new StructuredReferenceNode(tableName, null, null, null);
        }
        if (trimmed.startsWith("@")) {
            String column = stripBrackets(trimmed.substring(1).trim());
            return column.isEmpty()
                    ? new StructuredReferenceNode(tableName, TableItem.THIS_ROW, null, null)
                    : new StructuredReferenceNode(tableName, TableItem.THIS_ROW, column, column);
        }
        if (!trimmed.startsWith("[")) {
            if (trimmed.startsWith("#")) {
                return new StructuredReferenceNode(tableName, parseTableItem(trimmed), null, null);
            }
            String column = unescapeColumnName(trimmed);
            return new StructuredReferenceNode(tableName, null, column, column);
        }

        TableItem item = null;
        String startColumn = null;
        String endColumn = null;
        for (String part : splitTopLevel(trimmed, ',')) {
            List<String> span = splitTopLevel(part, ':');
            if (span.size() == 2) {
                if (startColumn != null) {
                    throw new FormulaParseException("More than one column selector in " + tableName + "[" + body + "]");
                }
                startColumn = unescapeColumnName(stripBrackets(span.get(0)));
                endColumn = unescapeColumnName(stripBrackets(span.get(1)));
                continue;
            }
            String selector = stripBrackets(part);
            if (selector.startsWith("#")) {
                if (item != null) {
                    throw new FormulaParseException("Combined table items are not supported: " + tableName + "[" + body + "]");
                }
                item = parseTableItem(selector);
            } else {
                if (startColumn != null) {
                    throw new FormulaParseException("More than one column selector in " + tableName + "[" + body + "]");
                }
                startColumn = unescapeColumnName(selector);
                endColumn = startColumn;
            }
        }
        return new StructuredReferenceNode(tableName, item, startColumn, endColumn);
    }

    private TableItem parseTableItem(String text) {
        TableItem item = TableItem.fromKeyword(text);
        if (item == null) {
            throw new FormulaParseException("Unknown table item \"" + text + "\"");
        }
        return item;
    }

    private static String stripBrackets(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    // 'x escapes a special character in a column name
    private static String unescapeColumnName(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' && i + 1 < text.length()) {
                sb.append(text.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                i++;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }

    // ----------------------------------------------------------------
    // Token cursor
    // ----------------------------------------------------------------

    private static final class ParserState {
        private final List<Token> tokens;
        private int index;

        ParserState(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(Math.min(index, tokens.size() - 1));
        }

        Token next() {
            Token token = peek();
            index++;
            return token;
        }

        Token expect(TokenType type) {
            Token token = next();
            if (token.getType() != type) {
                throw new FormulaParseException("Expected " + type + ", got " + token);
            }
            return token;
        }
    }
}
