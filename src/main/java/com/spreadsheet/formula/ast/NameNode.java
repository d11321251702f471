package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * A defined name used in a formula, e.g. TaxRate.
 */
public final class NameNode extends FormulaNode {
    private final String name;

    public NameNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public NodeType getType() {
        return NodeType.NAME;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NameNode && name.equals(((NameNode) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Name(" + name + ")";
    }
}
