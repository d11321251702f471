package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * Arithmetic (+ - * / ^) or text concatenation (&) of two operands.
 */
public final class BinaryNode extends FormulaNode {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        POWER("^"),
        CONCAT("&");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Not a binary operator: " + symbol);
        }
    }

    private final Operator operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryNode(Operator operator, FormulaNode left, FormulaNode right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeType getType() {
        return NodeType.BINARY;
    }

    public Operator getOperator() {
        return operator;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryNode)) {
            return false;
        }
        BinaryNode other = (BinaryNode) o;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "Binary(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
