package com.spreadsheet.formula.models;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable-by-convention snapshot of a workbook:
 * - ordered sheets (a sheet's index is its position here)
 * - defined names (global or sheet-local)
 * - tables
 * - the date system
 * Evaluators never modify it; a changed workbook needs a new evaluator.
 */
public class Workbook {
    private List<WorkbookSheet> sheets = new ArrayList<>();
    private List<DefinedName> definedNames = new ArrayList<>();
    private List<TableDefinition> tables = new ArrayList<>();
    private DateSystem dateSystem = DateSystem.SYSTEM_1900;

    // Default constructor needed for JSON (de)serialization
    public Workbook() {
    }

    public Workbook(List<WorkbookSheet> sheets, List<DefinedName> definedNames, List<TableDefinition> tables) {
        this.sheets = sheets;
        this.definedNames = definedNames;
        this.tables = tables;
    }

    public List<WorkbookSheet> getSheets() {
        return sheets;
    }

    public void setSheets(List<WorkbookSheet> sheets) {
        this.sheets = sheets == null ? new ArrayList<>() : sheets;
    }

    public List<DefinedName> getDefinedNames() {
        return definedNames;
    }

    public void setDefinedNames(List<DefinedName> definedNames) {
        this.definedNames = definedNames == null ? new ArrayList<>() : definedNames;
    }

    public List<TableDefinition> getTables() {
        return tables;
    }

    public void setTables(List<TableDefinition> tables) {
        this.tables = tables == null ? new ArrayList<>() : tables;
    }

    public DateSystem getDateSystem() {
        return dateSystem;
    }

    public void setDateSystem(DateSystem dateSystem) {
        this.dateSystem = dateSystem == null ? DateSystem.SYSTEM_1900 : dateSystem;
    }
}
