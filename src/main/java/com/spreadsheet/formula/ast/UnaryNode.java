package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * Prefix "+" or "-" applied to an operand.
 */
public final class UnaryNode extends FormulaNode {

    public enum Operator {
        PLUS("+"),
        MINUS("-");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final FormulaNode operand;

    public UnaryNode(Operator operator, FormulaNode operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    @Override
    public NodeType getType() {
        return NodeType.UNARY;
    }

    public Operator getOperator() {
        return operator;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryNode)) {
            return false;
        }
        UnaryNode other = (UnaryNode) o;
        return operator == other.operator && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return "Unary(" + operator.getSymbol() + " " + operand + ")";
    }
}
