package com.spreadsheet.formula.support;

import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.evaluation.FormulaEvaluator;
import com.spreadsheet.formula.functions.EagerFormulaFunction;
import com.spreadsheet.formula.functions.FormulaFunction;
import com.spreadsheet.formula.functions.FunctionHelpers;
import com.spreadsheet.formula.functions.FunctionNamespace;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.functions.LazyEvaluationContext;
import com.spreadsheet.formula.functions.LazyFormulaFunction;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.parser.DefaultFormulaParser;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaScalar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stub functions standing in for a real function library, plus
 * factories wiring them into an evaluator without Spring.
 */
public final class TestFunctions {

    private TestFunctions() {
    }

    public static FunctionHelpers helpers() {
        return new FunctionHelpers(Locale.forLanguageTag("en-US"));
    }

    public static FunctionRegistry registry(FormulaFunction... functions) {
        List<FormulaFunction> all = new ArrayList<>();
        all.add(new Sum());
        all.add(new If());
        all.addAll(Arrays.asList(functions));
        return new FunctionRegistry(all, Arrays.asList("_xlfn.", "_xlws."));
    }

    public static FormulaEvaluator evaluator(Workbook workbook, FormulaFunction... functions) {
        return new FormulaEvaluator(workbook, new DefaultFormulaParser(), registry(functions), helpers());
    }

    /**
     * SUM over every number in its arguments; text and blanks are skipped.
     */
    public static class Sum implements EagerFormulaFunction {
        @Override
        public String getName() {
            return "SUM";
        }

        @Override
        public String getCategory() {
            return "aggregate";
        }

        @Override
        public EvalResult evaluate(List<EvalResult> arguments, FunctionHelpers helpers) {
            double total = 0;
            for (FormulaScalar value : helpers.flattenArguments(arguments)) {
                if (value.isError()) {
                    helpers.toNumber(value);
                }
                if (value.isNumber() || value.isBoolean()) {
                    total += helpers.toNumber(value);
                }
            }
            return FormulaScalar.number(total);
        }
    }

    /**
     * IF(condition, then, else): only the chosen branch is evaluated.
     */
    public static class If implements LazyFormulaFunction {
        @Override
        public String getName() {
            return "IF";
        }

        @Override
        public String getCategory() {
            return "logical";
        }

        @Override
        public EvalResult evaluate(List<FormulaNode> arguments, LazyEvaluationContext context) {
            FunctionHelpers helpers = context.getHelpers();
            boolean condition = helpers.toBoolean(helpers.coerceScalar(context.evaluate(arguments.get(0)), "IF"));
            if (condition) {
                return context.evaluate(arguments.get(1));
            }
            return arguments.size() > 2 ? context.evaluate(arguments.get(2)) : FormulaScalar.bool(false);
        }
    }

    /**
     * TRACK(label, value) returns value and counts how often each label was computed.
     */
    public static class Track implements EagerFormulaFunction {
        private final Map<String, Integer> calls = new HashMap<>();

        @Override
        public String getName() {
            return "TRACK";
        }

        @Override
        public EvalResult evaluate(List<EvalResult> arguments, FunctionHelpers helpers) {
            String label = helpers.valueToText(helpers.coerceScalar(arguments.get(0), "TRACK"));
            calls.merge(label, 1, Integer::sum);
            return arguments.get(1);
        }

        public int callsFor(String label) {
            return calls.getOrDefault(label, 0);
        }
    }

    /**
     * Echoes where it was called from: "Sheet1!B3".
     */
    public static class Origin implements LazyFormulaFunction {
        @Override
        public String getName() {
            return "ORIGIN";
        }

        @Override
        public EvalResult evaluate(List<FormulaNode> arguments, LazyEvaluationContext context) {
            return FormulaScalar.text(context.getOrigin().toString());
        }
    }

    /**
     * A function only found in the extended namespace, written _xlfn.CONCAT in files.
     */
    public static class Concat implements EagerFormulaFunction {
        @Override
        public String getName() {
            return "CONCAT";
        }

        @Override
        public FunctionNamespace getNamespace() {
            return FunctionNamespace.EXTENDED;
        }

        @Override
        public String getCategory() {
            return "text";
        }

        @Override
        public EvalResult evaluate(List<EvalResult> arguments, FunctionHelpers helpers) {
            StringBuilder sb = new StringBuilder();
            for (FormulaScalar value : helpers.flattenArguments(arguments)) {
                sb.append(helpers.valueToText(value));
            }
            return FormulaScalar.text(sb.toString());
        }
    }
}
