package com.spreadsheet.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An array literal {1,2;3,4}: rows of element expressions.
 */
public final class ArrayNode extends FormulaNode {
    private final List<List<FormulaNode>> rows;

    public ArrayNode(List<List<FormulaNode>> rows) {
        List<List<FormulaNode>> copy = new ArrayList<>(rows.size());
        for (List<FormulaNode> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    @Override
    public NodeType getType() {
        return NodeType.ARRAY;
    }

    public List<List<FormulaNode>> getRows() {
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayNode && rows.equals(((ArrayNode) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "Array(" + rows + ")";
    }
}
