package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * A structured table reference such as Sales[Amount],
 * Sales[#This Row] or Sales[[#Data],[Q1]:[Q4]].
 * Item and column names are all optional.
 */
public final class StructuredReferenceNode extends FormulaNode {
    private final String tableName;
    private final TableItem item;
    private final String startColumn;
    private final String endColumn;

    public StructuredReferenceNode(String tableName, TableItem item, String startColumn, String endColumn) {
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.item = item;
        this.startColumn = startColumn;
        this.endColumn = endColumn;
    }

    @Override
    public NodeType getType() {
        return NodeType.STRUCTURED_REFERENCE;
    }

    public String getTableName() {
        return tableName;
    }

    public TableItem getItem() {
        return item;
    }

    public String getStartColumn() {
        return startColumn;
    }

    public String getEndColumn() {
        return endColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StructuredReferenceNode)) {
            return false;
        }
        StructuredReferenceNode other = (StructuredReferenceNode) o;
        return tableName.equals(other.tableName)
                && item == other.item
                && Objects.equals(startColumn, other.startColumn)
                && Objects.equals(endColumn, other.endColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, item, startColumn, endColumn);
    }

    @Override
    public String toString() {
        return "StructuredReference(" + tableName + ", " + item + ", " + startColumn + ":" + endColumn + ")";
    }
}
