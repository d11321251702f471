package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.models.SheetCellReference;

/**
 * Context of one top-level evaluation, passed unchanged down the recursion:
 * the resolver, the sheet unqualified references point to, and the cell
 * the formula is evaluated at.
 */
public final class EvaluationScope {
    private final WorkbookResolver resolver;
    private final int defaultSheetIndex;
    private final SheetCellReference origin;

    public EvaluationScope(WorkbookResolver resolver, int defaultSheetIndex, SheetCellReference origin) {
        this.resolver = resolver;
        this.defaultSheetIndex = defaultSheetIndex;
        this.origin = origin;
    }

    /**
     * Resolves an explicit sheet qualifier; null means the default sheet.
     *
     * @return the sheet index, or null when the name is unknown
     */
    public Integer resolveSheetIndex(String explicitSheetName) {
        if (explicitSheetName == null || explicitSheetName.isEmpty()) {
            return defaultSheetIndex;
        }
        return resolver.resolveSheetIndex(explicitSheetName);
    }

    public WorkbookResolver getResolver() {
        return resolver;
    }

    public int getDefaultSheetIndex() {
        return defaultSheetIndex;
    }

    public SheetCellReference getOrigin() {
        return origin;
    }
}
