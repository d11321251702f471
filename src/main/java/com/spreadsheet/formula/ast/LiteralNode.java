package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.values.EvalResult;

import java.util.Objects;

/**
 * A constant: number, text, boolean, error literal such as #N/A,
 * or a pre-built array value.
 */
public final class LiteralNode extends FormulaNode {
    private final EvalResult value;

    public LiteralNode(EvalResult value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType getType() {
        return NodeType.LITERAL;
    }

    public EvalResult getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralNode && value.equals(((LiteralNode) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Literal(" + value + ")";
    }
}
