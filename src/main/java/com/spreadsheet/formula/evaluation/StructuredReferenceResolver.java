package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.ast.StructuredReferenceNode;
import com.spreadsheet.formula.ast.TableItem;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.exceptions.NameNotFoundException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.TableColumn;
import com.spreadsheet.formula.models.TableDefinition;
import com.spreadsheet.formula.values.ErrorCode;
import com.spreadsheet.formula.values.EvalResult;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns Table[item, columns] into an ordinary range on the table's sheet.
 */
class StructuredReferenceResolver {
    private final Map<String, TableDefinition> tablesByName = new HashMap<>();

    StructuredReferenceResolver(List<TableDefinition> tables) {
        for (TableDefinition table : tables) {
            if (table.getName() != null && table.getRef() != null) {
                tablesByName.put(table.getName().trim().toUpperCase(Locale.ROOT), table);
            }
        }
    }

    /**
     * 1) find the table (#NAME? if unknown)
     * 2) pick the rows from the item keyword, #DATA when none is given
     * 3) pick the columns from the column names, all declared columns when none are given
     * 4) read the block through the ordinary range resolver
     */
    EvalResult resolve(StructuredReferenceNode node, EvaluationScope scope) {
        // 1) Table
        TableDefinition table = tablesByName.get(node.getTableName().trim().toUpperCase(Locale.ROOT));
        if (table == null) {
            throw new NameNotFoundException("Table " + node.getTableName() + " not found");
        }
        CellRange ref = table.getRef();
        int headerRows = Math.max(0, table.getHeaderRowCount());
        int totalsRows = Math.max(0, table.getTotalsRowCount());
        int firstRow = ref.getMinRow();
        int lastRow = ref.getMaxRow();
        int dataStart = firstRow + headerRows;
        int dataEnd = lastRow - totalsRows;

        // 2) Rows
        TableItem item = node.getItem() == null ? TableItem.DATA : node.getItem();
        int rowStart;
        int rowEnd;
        switch (item) {
            case ALL:
                rowStart = firstRow;
                rowEnd = lastRow;
                break;
            case HEADERS:
                rowStart = firstRow;
                rowEnd = firstRow + headerRows - 1;
                break;
            case TOTALS:
                rowStart = lastRow - totalsRows + 1;
                rowEnd = lastRow;
                break;
            case THIS_ROW: {
                int originRow = scope.getOrigin().getAddress().getRow();
                if (originRow < dataStart || originRow > dataEnd) {
                    throw new FormulaErrorException(ErrorCode.REF,
                            "Row " + originRow + " is outside the data rows of table " + table.getName());
                }
                rowStart = originRow;
                rowEnd = originRow;
                break;
            }
            case DATA:
            default:
                rowStart = dataStart;
                rowEnd = dataEnd;
                break;
        }
        if (rowEnd < rowStart) {
            throw new FormulaErrorException(ErrorCode.REF,
                    "Table " + table.getName() + " has no " + item.getKeyword() + " rows");
        }

        // 3) Columns
        int firstColumn = ref.getMinColumn();
        int columnStart;
        int columnEnd;
        if (node.getStartColumn() == null && node.getEndColumn() == null) {
            columnStart = firstColumn;
            columnEnd = table.getColumns().isEmpty()
                    ? ref.getMaxColumn()
                    : firstColumn + table.getColumns().size() - 1;
        } else {
            String startName = node.getStartColumn() != null ? node.getStartColumn() : node.getEndColumn();
            String endName = node.getEndColumn() != null ? node.getEndColumn() : node.getStartColumn();
            int startOffset = findColumn(table, startName);
            int endOffset = findColumn(table, endName);
            columnStart = firstColumn + Math.min(startOffset, endOffset);
            columnEnd = firstColumn + Math.max(startOffset, endOffset);
        }

        // 4) Delegate
        CellRange range = new CellRange(new CellAddress(columnStart, rowStart), new CellAddress(columnEnd, rowEnd));
        return scope.getResolver().resolveRange(table.getSheetIndex(), range);
    }

    private static int findColumn(TableDefinition table, String columnName) {
        List<TableColumn> columns = table.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).getName();
            if (name != null && name.equalsIgnoreCase(columnName.trim())) {
                return i;
            }
        }
        throw new FormulaErrorException(ErrorCode.REF,
                "Column " + columnName + " not found in table " + table.getName());
    }
}
