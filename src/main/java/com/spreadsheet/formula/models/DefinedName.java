package com.spreadsheet.formula.models;

/**
 * A workbook defined name. {@code localSheetIndex} is null for
 * workbook-global names and the owning sheet's index for local ones.
 */
public class DefinedName {
    private String name;
    private String formulaText;
    private Integer localSheetIndex;

    // Default constructor needed for JSON (de)serialization
    public DefinedName() {
    }

    public DefinedName(String name, String formulaText) {
        this(name, formulaText, null);
    }

    public DefinedName(String name, String formulaText, Integer localSheetIndex) {
        this.name = name;
        this.formulaText = formulaText;
        this.localSheetIndex = localSheetIndex;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getFormulaText() {
        return formulaText;
    }

    public void setFormulaText(String formulaText) {
        this.formulaText = formulaText;
    }

    public Integer getLocalSheetIndex() {
        return localSheetIndex;
    }

    public void setLocalSheetIndex(Integer localSheetIndex) {
        this.localSheetIndex = localSheetIndex;
    }

    /**
     * Names copied from another workbook keep a "[1]Sheet!A1" style prefix.
     */
    public boolean isExternalReference() {
        return formulaText != null && formulaText.trim().startsWith("[");
    }
}
