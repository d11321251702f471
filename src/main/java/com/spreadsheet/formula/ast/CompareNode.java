package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * A comparison (= <> < > <= >=) producing TRUE or FALSE.
 */
public final class CompareNode extends FormulaNode {

    public enum Operator {
        EQUAL("="),
        NOT_EQUAL("<>"),
        GREATER(">"),
        LESS("<"),
        GREATER_OR_EQUAL(">="),
        LESS_OR_EQUAL("<=");

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
            throw new IllegalArgumentException("Not a comparison operator: " + symbol);
        }
    }

    private final Operator operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public CompareNode(Operator operator, FormulaNode left, FormulaNode right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeType getType() {
        return NodeType.COMPARE;
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
        if (!(o instanceof CompareNode)) {
            return false;
        }
        CompareNode other = (CompareNode) o;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "Compare(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
