package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.ast.BinaryNode;
import com.spreadsheet.formula.ast.UnaryNode;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.exceptions.InvalidTypeException;
import com.spreadsheet.formula.functions.FunctionHelpers;
import com.spreadsheet.formula.values.ErrorCode;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaArray;
import com.spreadsheet.formula.values.FormulaScalar;

import java.util.ArrayList;
import java.util.List;

/**
 * Arithmetic operators with array broadcasting:
 * - scalar op scalar: plain arithmetic, errors are raised
 * - 1x1 op matrix (either side): the single value is applied to every element
 * - matrix op matrix: element-wise, shapes must match
 * Inside an array a failing element (e.g. x/0) becomes an error element
 * instead of failing the whole operation.
 */
public class ArrayArithmetic {
    private final FunctionHelpers helpers;

    public ArrayArithmetic(FunctionHelpers helpers) {
        this.helpers = helpers;
    }

    public EvalResult apply(BinaryNode.Operator operator, EvalResult left, EvalResult right) {
        if (!left.isArray() && !right.isArray()) {
            return compute(operator,
                    helpers.requireNumber(left, operator.getSymbol()),
                    helpers.requireNumber(right, operator.getSymbol()));
        }

        List<List<FormulaScalar>> leftMatrix = toRectangularMatrix(left);
        List<List<FormulaScalar>> rightMatrix = toRectangularMatrix(right);
        boolean leftSingle = isSingle(leftMatrix);
        boolean rightSingle = isSingle(rightMatrix);

        if (leftSingle && rightSingle) {
            return compute(operator,
                    helpers.requireNumber(leftMatrix.get(0).get(0), operator.getSymbol()),
                    helpers.requireNumber(rightMatrix.get(0).get(0), operator.getSymbol()));
        }

        int rows;
        int columns;
        if (leftSingle) {
            rows = rightMatrix.size();
            columns = rightMatrix.get(0).size();
        } else if (rightSingle) {
            rows = leftMatrix.size();
            columns = leftMatrix.get(0).size();
        } else {
            rows = leftMatrix.size();
            columns = leftMatrix.get(0).size();
            if (rightMatrix.size() != rows || rightMatrix.get(0).size() != columns) {
                throw new InvalidTypeException("Array shapes differ: " + rows + "x" + columns + " vs "
                        + rightMatrix.size() + "x" + rightMatrix.get(0).size());
            }
        }

        List<List<FormulaScalar>> result = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            List<FormulaScalar> row = new ArrayList<>(columns);
            for (int c = 0; c < columns; c++) {
                FormulaScalar l = leftSingle ? leftMatrix.get(0).get(0) : leftMatrix.get(r).get(c);
                FormulaScalar rr = rightSingle ? rightMatrix.get(0).get(0) : rightMatrix.get(r).get(c);
                row.add(computeElement(operator, l, rr));
            }
            result.add(row);
        }
        return FormulaArray.ofRows(result);
    }

    /**
     * Unary minus negates, unary plus only converts to a number.
     * Arrays are handled element by element.
     */
    public EvalResult applyUnary(UnaryNode.Operator operator, EvalResult operand) {
        if (!operand.isArray()) {
            double value = helpers.requireNumber(operand, operator.getSymbol());
            return FormulaScalar.number(operator == UnaryNode.Operator.MINUS ? -value : value);
        }
        List<List<FormulaScalar>> matrix = toRectangularMatrix(operand);
        List<List<FormulaScalar>> result = new ArrayList<>(matrix.size());
        for (List<FormulaScalar> sourceRow : matrix) {
            List<FormulaScalar> row = new ArrayList<>(sourceRow.size());
            for (FormulaScalar element : sourceRow) {
                try {
                    double value = helpers.toNumber(element);
                    row.add(FormulaScalar.number(operator == UnaryNode.Operator.MINUS ? -value : value));
                } catch (FormulaErrorException e) {
                    row.add(FormulaScalar.error(e.getCode()));
                }
            }
            result.add(row);
        }
        return FormulaArray.ofRows(result);
    }

    private FormulaScalar computeElement(BinaryNode.Operator operator, FormulaScalar left, FormulaScalar right) {
        try {
            return compute(operator, helpers.toNumber(left), helpers.toNumber(right));
        } catch (FormulaErrorException e) {
            return FormulaScalar.error(e.getCode());
        }
    }

    private FormulaScalar compute(BinaryNode.Operator operator, double left, double right) {
        switch (operator) {
            case ADD:
                return helpers.numberResult(left + right);
            case SUBTRACT:
                return helpers.numberResult(left - right);
            case MULTIPLY:
                return helpers.numberResult(left * right);
            case DIVIDE:
                if (right == 0) {
                    throw new FormulaErrorException(ErrorCode.DIV_ZERO);
                }
                return helpers.numberResult(left / right);
            case POWER:
                if (left == 0 && right < 0) {
                    throw new FormulaErrorException(ErrorCode.DIV_ZERO);
                }
                return helpers.numberResult(Math.pow(left, right));
            default:
                throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
        }
    }

    private List<List<FormulaScalar>> toRectangularMatrix(EvalResult value) {
        List<List<FormulaScalar>> matrix = helpers.toScalarMatrix(value);
        if (matrix.isEmpty() || matrix.get(0).isEmpty()) {
            throw new InvalidTypeException("Empty array in arithmetic");
        }
        int width = matrix.get(0).size();
        for (List<FormulaScalar> row : matrix) {
            if (row.size() != width) {
                throw new InvalidTypeException("Array rows differ in length");
            }
        }
        return matrix;
    }

    private static boolean isSingle(List<List<FormulaScalar>> matrix) {
        return matrix.size() == 1 && matrix.get(0).size() == 1;
    }
}
