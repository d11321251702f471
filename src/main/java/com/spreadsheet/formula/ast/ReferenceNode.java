package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.models.CellAddress;

import java.util.Objects;

/**
 * A single-cell reference, optionally sheet-qualified ("Sheet2!B3").
 */
public final class ReferenceNode extends FormulaNode {
    private final CellAddress address;
    private final String sheetName;

    public ReferenceNode(CellAddress address, String sheetName) {
        this.address = Objects.requireNonNull(address, "address");
        this.sheetName = sheetName;
    }

    @Override
    public NodeType getType() {
        return NodeType.REFERENCE;
    }

    public CellAddress getAddress() {
        return address;
    }

    /**
     * @return the qualifying sheet name, or null for the formula's own sheet
     */
    public String getSheetName() {
        return sheetName;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ReferenceNode)) {
            return false;
        }
        ReferenceNode other = (ReferenceNode) o;
        return address.equals(other.address) && Objects.equals(sheetName, other.sheetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, sheetName);
    }

    @Override
    public String toString() {
        return "Reference(" + (sheetName == null ? "" : sheetName + "!") + address + ")";
    }
}
