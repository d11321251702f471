package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.exceptions.InvalidTypeException;
import com.spreadsheet.formula.values.ErrorCode;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaArray;
import com.spreadsheet.formula.values.FormulaScalar;

import java.math.BigDecimal;
import java.text.Collator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Every coercion rule of the engine. The evaluator uses these for
 * operators and functions receive the same instance, so "2" + 1 and
 * SUM("2", 1) agree.
 */
public class FunctionHelpers {

    private static final Pattern NUMERIC_TEXT = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private final Collator collator;

    public FunctionHelpers(Locale collationLocale) {
        this.collator = Collator.getInstance(collationLocale);
    }

    /**
     * Flattens arguments (scalars, ranges, 3-D ranges) into one list of
     * scalars in row-major order, sheet by sheet.
     */
    public List<FormulaScalar> flattenArguments(List<? extends EvalResult> arguments) {
        List<FormulaScalar> flat = new ArrayList<>();
        for (EvalResult argument : arguments) {
            collect(argument, flat);
        }
        return flat;
    }

    private void collect(EvalResult value, List<FormulaScalar> into) {
        if (!value.isArray()) {
            into.add(value.asScalar());
            return;
        }
        for (EvalResult element : value.asArray().getElements()) {
            collect(element, into);
        }
    }

    /**
     * Reduces a result to one scalar: arrays give their top-left element.
     * Error scalars are raised as FormulaErrorException.
     *
     * @param context what needs the scalar, used in the failure message
     */
    public FormulaScalar coerceScalar(EvalResult value, String context) {
        EvalResult current = value;
        while (current.isArray()) {
            FormulaArray array = current.asArray();
            if (array.isEmpty()) {
                throw new InvalidTypeException("Empty array where " + context + " expects a single value");
            }
            current = array.get(0);
        }
        FormulaScalar scalar = current.asScalar();
        if (scalar.isError()) {
            throw new FormulaErrorException(scalar.getErrorCode());
        }
        return scalar;
    }

    /**
     * coerceScalar followed by toNumber.
     */
    public double requireNumber(EvalResult value, String context) {
        return toNumber(coerceScalar(value, context));
    }

    /**
     * Blank is 0, booleans are 1/0, numeric text is parsed.
     * Other text is #VALUE!; errors are raised as themselves.
     */
    public double toNumber(FormulaScalar scalar) {
        switch (scalar.getType()) {
            case BLANK:
                return 0;
            case NUMBER:
                return scalar.getNumber();
            case BOOLEAN:
                return scalar.getBoolean() ? 1 : 0;
            case TEXT: {
                String text = scalar.getText().trim();
                if (!NUMERIC_TEXT.matcher(text).matches()) {
                    throw new InvalidTypeException("Expected a number, got text \"" + scalar.getText() + "\"");
                }
                return Double.parseDouble(text);
            }
            case ERROR:
            default:
                throw new FormulaErrorException(scalar.getErrorCode());
        }
    }

    /**
     * Wraps an arithmetic result; NaN and infinities become #NUM!.
     */
    public FormulaScalar numberResult(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        return FormulaScalar.number(value);
    }

    /**
     * Text form used by "&" and text functions: 3 -> "3", 0.1 -> "0.1",
     * 1E+21 -> "1000000000000000000000", TRUE -> "TRUE", blank -> "".
     */
    public String valueToText(FormulaScalar scalar) {
        switch (scalar.getType()) {
            case BLANK:
                return "";
            case NUMBER:
                return BigDecimal.valueOf(scalar.getNumber()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return scalar.getBoolean() ? "TRUE" : "FALSE";
            case TEXT:
                return scalar.getText();
            case ERROR:
            default:
                throw new FormulaErrorException(scalar.getErrorCode());
        }
    }

    /**
     * Blank is FALSE, numbers are TRUE when non-zero,
     * text must read "TRUE" or "FALSE" (any case).
     */
    public boolean toBoolean(FormulaScalar scalar) {
        switch (scalar.getType()) {
            case BLANK:
                return false;
            case NUMBER:
                return scalar.getNumber() != 0;
            case BOOLEAN:
                return scalar.getBoolean();
            case TEXT: {
                String text = scalar.getText().trim();
                if ("TRUE".equalsIgnoreCase(text)) {
                    return true;
                }
                if ("FALSE".equalsIgnoreCase(text)) {
                    return false;
                }
                throw new InvalidTypeException("Expected a logical value, got text \"" + scalar.getText() + "\"");
            }
            case ERROR:
            default:
                throw new FormulaErrorException(scalar.getErrorCode());
        }
    }

    /**
     * Equality behind "=" and "<>":
     * 1) blank equals blank, 0, "" and FALSE
     * 2) otherwise values of different kinds are never equal (1 vs "1", TRUE vs 1)
     * 3) text compares case-insensitively
     * Errors are raised.
     */
    public boolean comparePrimitiveEquality(FormulaScalar left, FormulaScalar right) {
        if (left.isError()) {
            throw new FormulaErrorException(left.getErrorCode());
        }
        if (right.isError()) {
            throw new FormulaErrorException(right.getErrorCode());
        }
        if (left.isBlank() || right.isBlank()) {
            FormulaScalar other = left.isBlank() ? right : left;
            return isBlankEquivalent(other);
        }
        if (left.getType() != right.getType()) {
            return false;
        }
        switch (left.getType()) {
            case NUMBER:
                return left.getNumber() == right.getNumber();
            case BOOLEAN:
                return left.getBoolean() == right.getBoolean();
            case TEXT:
                return left.getText().toUpperCase(Locale.ROOT).equals(right.getText().toUpperCase(Locale.ROOT));
            default:
                return false;
        }
    }

    private static boolean isBlankEquivalent(FormulaScalar value) {
        switch (value.getType()) {
            case BLANK:
                return true;
            case NUMBER:
                return value.getNumber() == 0;
            case TEXT:
                return value.getText().isEmpty();
            case BOOLEAN:
                return !value.getBoolean();
            default:
                return false;
        }
    }

    /**
     * Locale-aware text ordering (negative, zero or positive).
     */
    public int compareText(String left, String right) {
        return collator.compare(left, right);
    }

    /**
     * Normalizes a result into rows of scalars:
     * - a scalar becomes a 1x1 matrix
     * - a flat array becomes a single row
     * - an array of rows is taken as is (nested elements are reduced to their top-left scalar)
     * Rows are not padded, so they may differ in length.
     */
    public List<List<FormulaScalar>> toScalarMatrix(EvalResult value) {
        List<List<FormulaScalar>> rows = new ArrayList<>();
        if (!value.isArray()) {
            List<FormulaScalar> single = new ArrayList<>();
            single.add(value.asScalar());
            rows.add(single);
            return rows;
        }
        FormulaArray array = value.asArray();
        boolean nested = !array.isEmpty() && array.get(0).isArray();
        if (!nested) {
            List<FormulaScalar> row = new ArrayList<>();
            for (EvalResult element : array.getElements()) {
                row.add(firstScalar(element));
            }
            rows.add(row);
            return rows;
        }
        for (EvalResult rowValue : array.getElements()) {
            List<FormulaScalar> row = new ArrayList<>();
            if (rowValue.isArray()) {
                for (EvalResult element : rowValue.asArray().getElements()) {
                    row.add(firstScalar(element));
                }
            } else {
                row.add(rowValue.asScalar());
            }
            rows.add(row);
        }
        return rows;
    }

    // Like coerceScalar, but keeps error elements as values
    private static FormulaScalar firstScalar(EvalResult value) {
        EvalResult current = value;
        while (current.isArray()) {
            FormulaArray array = current.asArray();
            if (array.isEmpty()) {
                return FormulaScalar.error(ErrorCode.VALUE);
            }
            current = array.get(0);
        }
        return current.asScalar();
    }
}
