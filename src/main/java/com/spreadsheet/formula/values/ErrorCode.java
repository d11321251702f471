package com.spreadsheet.formula.values;

/**
 * Enumerates the spreadsheet error values a formula can produce.
 * Each constant carries the text Excel displays for it.
 */
public enum ErrorCode {
    NULL("#NULL!"),
    DIV_ZERO("#DIV/0!"),
    VALUE("#VALUE!"),
    REF("#REF!"),
    NAME("#NAME?"),
    NUM("#NUM!"),
    NA("#N/A"),
    GETTING_DATA("#GETTING_DATA");

    private final String text;

    ErrorCode(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * Looks up an error by its display text, e.g. "#REF!" -> REF.
     * Returns null for anything that isn't an error literal.
     */
    public static ErrorCode fromText(String text) {
        for (ErrorCode code : values()) {
            if (code.text.equals(text)) {
                return code;
            }
        }
        return null;
    }
}
