package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.ast.FormulaNode;

/**
 * Turns formula text into a syntax tree. The caller strips the leading "=".
 */
public interface FormulaParser {

    /**
     * @throws com.spreadsheet.formula.exceptions.FormulaParseException on malformed text
     */
    FormulaNode parse(String formula);
}
