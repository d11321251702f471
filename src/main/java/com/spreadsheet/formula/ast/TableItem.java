package com.spreadsheet.formula.ast;

import java.util.Locale;

/**
 * Row selectors of a structured table reference.
 */
public enum TableItem {
    ALL("#ALL"),
    DATA("#DATA"),
    HEADERS("#HEADERS"),
    TOTALS("#TOTALS"),
    THIS_ROW("#THIS ROW");

    private final String keyword;

    TableItem(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Case-insensitive, tolerant of repeated inner spaces ("#This  Row").
     * Returns null when the text is not an item keyword.
     */
    public static TableItem fromKeyword(String text) {
        String normalized = text.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        for (TableItem item : values()) {
            if (item.keyword.equals(normalized)) {
                return item;
            }
        }
        return null;
    }
}
