package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.models.CellRange;

import java.util.Objects;

/**
 * A rectangular range; its sheet name may span sheets ("Jan:Mar").
 */
public final class RangeNode extends FormulaNode {
    private final CellRange range;

    public RangeNode(CellRange range) {
        this.range = Objects.requireNonNull(range, "range");
    }

    @Override
    public NodeType getType() {
        return NodeType.RANGE;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RangeNode && range.equals(((RangeNode) o).range);
    }

    @Override
    public int hashCode() {
        return range.hashCode();
    }

    @Override
    public String toString() {
        return "Range(" + range + ")";
    }
}
