package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.ast.ArrayNode;
import com.spreadsheet.formula.ast.BinaryNode;
import com.spreadsheet.formula.ast.CompareNode;
import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.ast.FunctionNode;
import com.spreadsheet.formula.ast.LiteralNode;
import com.spreadsheet.formula.ast.NameNode;
import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.ReferenceNode;
import com.spreadsheet.formula.ast.StructuredReferenceNode;
import com.spreadsheet.formula.ast.UnaryNode;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.exceptions.InvalidTypeException;
import com.spreadsheet.formula.exceptions.SheetNotFoundException;
import com.spreadsheet.formula.functions.EagerFormulaFunction;
import com.spreadsheet.formula.functions.FormulaFunction;
import com.spreadsheet.formula.functions.FunctionHelpers;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.functions.LazyEvaluationContext;
import com.spreadsheet.formula.functions.LazyFormulaFunction;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.DateSystem;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaArray;
import com.spreadsheet.formula.values.FormulaScalar;

import java.util.ArrayList;
import java.util.List;

/**
 * The recursive interpreter: one switch over the node kinds.
 * Spreadsheet errors travel up as FormulaErrorException until a
 * scalar-producing boundary turns them back into error values.
 */
public class NodeEvaluator {
    private final FunctionRegistry registry;
    private final FunctionHelpers helpers;
    private final ArrayArithmetic arithmetic;
    private final DateSystem dateSystem;

    public NodeEvaluator(FunctionRegistry registry, FunctionHelpers helpers, DateSystem dateSystem) {
        this.registry = registry;
        this.helpers = helpers;
        this.arithmetic = new ArrayArithmetic(helpers);
        this.dateSystem = dateSystem;
    }

    public EvalResult evaluate(FormulaNode node, EvaluationScope scope) {
        switch (node.getType()) {
            case LITERAL:
                return evaluateLiteral((LiteralNode) node);
            case NAME:
                return scope.getResolver().resolveName(((NameNode) node).getName(), scope);
            case STRUCTURED_REFERENCE:
                return scope.getResolver().resolveStructuredReference((StructuredReferenceNode) node, scope);
            case REFERENCE:
                return evaluateReference((ReferenceNode) node, scope);
            case RANGE:
                return evaluateRange((RangeNode) node, scope);
            case ARRAY:
                return evaluateArray((ArrayNode) node, scope);
            case UNARY: {
                UnaryNode unary = (UnaryNode) node;
                return arithmetic.applyUnary(unary.getOperator(), evaluate(unary.getOperand(), scope));
            }
            case BINARY:
                return evaluateBinary((BinaryNode) node, scope);
            case COMPARE:
                return evaluateCompare((CompareNode) node, scope);
            case FUNCTION:
                return evaluateFunction((FunctionNode) node, scope);
            default:
                throw new IllegalStateException("Unhandled node type " + node.getType());
        }
    }

    private EvalResult evaluateLiteral(LiteralNode node) {
        EvalResult value = node.getValue();
        if (!value.isArray() && value.asScalar().isError()) {
            throw new FormulaErrorException(value.asScalar().getErrorCode());
        }
        return value;
    }

    private EvalResult evaluateReference(ReferenceNode node, EvaluationScope scope) {
        Integer sheetIndex = scope.resolveSheetIndex(node.getSheetName());
        if (sheetIndex == null) {
            throw new SheetNotFoundException("Sheet not found: " + node.getSheetName());
        }
        return scope.getResolver().resolveCell(sheetIndex, node.getAddress());
    }

    /**
     * A 3-D range ("Jan:Mar" as sheet qualifier) yields one matrix per
     * sheet in the span, in workbook order.
     */
    private EvalResult evaluateRange(RangeNode node, EvaluationScope scope) {
        CellRange range = node.getRange();
        String sheetName = range.getSheetName();
        WorkbookResolver resolver = scope.getResolver();

        int colon = sheetName == null ? -1 : sheetName.indexOf(':');
        if (colon > 0 && resolver.resolveSheetIndex(sheetName) == null) {
            String firstName = sheetName.substring(0, colon);
            String lastName = sheetName.substring(colon + 1);
            Integer first = resolver.resolveSheetIndex(firstName);
            Integer last = resolver.resolveSheetIndex(lastName);
            if (first == null || last == null) {
                throw new SheetNotFoundException("Sheet span not found: " + sheetName);
            }
            List<EvalResult> perSheet = new ArrayList<>();
            for (int index = Math.min(first, last); index <= Math.max(first, last); index++) {
                perSheet.add(resolver.resolveRange(index, range));
            }
            return FormulaArray.of(perSheet);
        }

        Integer sheetIndex = scope.resolveSheetIndex(sheetName);
        if (sheetIndex == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetName);
        }
        return resolver.resolveRange(sheetIndex, range);
    }

    // Elements of {...} must be single values
    private EvalResult evaluateArray(ArrayNode node, EvaluationScope scope) {
        List<List<FormulaScalar>> rows = new ArrayList<>();
        for (List<FormulaNode> rowNodes : node.getRows()) {
            List<FormulaScalar> row = new ArrayList<>();
            for (FormulaNode element : rowNodes) {
                row.add(helpers.coerceScalar(evaluate(element, scope), "array literal"));
            }
            rows.add(row);
        }
        return FormulaArray.ofRows(rows);
    }

    private EvalResult evaluateBinary(BinaryNode node, EvaluationScope scope) {
        EvalResult left = evaluate(node.getLeft(), scope);
        EvalResult right = evaluate(node.getRight(), scope);
        if (node.getOperator() == BinaryNode.Operator.CONCAT) {
            String leftText = helpers.valueToText(helpers.coerceScalar(left, "&"));
            String rightText = helpers.valueToText(helpers.coerceScalar(right, "&"));
            return FormulaScalar.text(leftText + rightText);
        }
        return arithmetic.apply(node.getOperator(), left, right);
    }

    /**
     * "=" and "<>" accept any two values. Ordering needs two numbers or
     * two texts; blanks, booleans and mixed kinds are #VALUE!.
     */
    private EvalResult evaluateCompare(CompareNode node, EvaluationScope scope) {
        String context = "comparator " + node.getOperator().getSymbol();
        FormulaScalar left = helpers.coerceScalar(evaluate(node.getLeft(), scope), context);
        FormulaScalar right = helpers.coerceScalar(evaluate(node.getRight(), scope), context);

        switch (node.getOperator()) {
            case EQUAL:
                return FormulaScalar.bool(helpers.comparePrimitiveEquality(left, right));
            case NOT_EQUAL:
                return FormulaScalar.bool(!helpers.comparePrimitiveEquality(left, right));
            default:
                break;
        }

        int order;
        if (left.isNumber() && right.isNumber()) {
            order = Double.compare(left.getNumber(), right.getNumber());
        } else if (left.isText() && right.isText()) {
            order = helpers.compareText(left.getText(), right.getText());
        } else {
            throw new InvalidTypeException("Cannot order " + left.getType() + " against " + right.getType());
        }

        switch (node.getOperator()) {
            case GREATER:
                return FormulaScalar.bool(order > 0);
            case LESS:
                return FormulaScalar.bool(order < 0);
            case GREATER_OR_EQUAL:
                return FormulaScalar.bool(order >= 0);
            case LESS_OR_EQUAL:
                return FormulaScalar.bool(order <= 0);
            default:
                throw new IllegalStateException("Unhandled comparator " + node.getOperator());
        }
    }

    /**
     * Lazy functions get the raw argument nodes and a context bound to
     * this scope; eager ones get every argument evaluated left to right.
     */
    private EvalResult evaluateFunction(FunctionNode node, EvaluationScope scope) {
        FormulaFunction function = registry.lookup(node.getName());

        if (function instanceof LazyFormulaFunction) {
            LazyEvaluationContext context = new LazyEvaluationContext(
                    child -> evaluate(child, scope), helpers, scope.getOrigin(), dateSystem);
            return ((LazyFormulaFunction) function).evaluate(node.getArguments(), context);
        }

        List<EvalResult> arguments = new ArrayList<>(node.getArguments().size());
        for (FormulaNode argument : node.getArguments()) {
            arguments.add(evaluate(argument, scope));
        }
        return ((EagerFormulaFunction) function).evaluate(arguments, helpers);
    }
}
