package com.spreadsheet.formula.ast;

/**
 * Base of the parsed formula syntax tree. Nodes are immutable.
 */
public abstract class FormulaNode {

    FormulaNode() {
    }

    public abstract NodeType getType();
}
