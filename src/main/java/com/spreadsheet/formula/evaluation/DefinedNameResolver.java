package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.ReferenceNode;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.exceptions.NameNotFoundException;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.DefinedName;
import com.spreadsheet.formula.values.EvalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves defined names. A sheet-local name wins over a global one,
 * and a name that refers back to itself (directly or through other
 * names) is #REF!.
 */
class DefinedNameResolver {
    private static final Logger log = LoggerFactory.getLogger(DefinedNameResolver.class);
    private static final String GLOBAL_SCOPE = "*";

    private final Map<String, List<DefinedName>> candidatesByKey = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();
    private final NodeEvaluator nodeEvaluator;
    private final FormulaEvaluator formulaEvaluator;

    DefinedNameResolver(List<DefinedName> definedNames, NodeEvaluator nodeEvaluator, FormulaEvaluator formulaEvaluator) {
        this.nodeEvaluator = nodeEvaluator;
        this.formulaEvaluator = formulaEvaluator;
        for (DefinedName definedName : definedNames) {
            if (definedName.getName() == null || definedName.getFormulaText() == null) {
                continue;
            }
            String scope = definedName.getLocalSheetIndex() == null
                    ? GLOBAL_SCOPE
                    : String.valueOf(definedName.getLocalSheetIndex());
            candidatesByKey.computeIfAbsent(key(scope, definedName.getName()), k -> new ArrayList<>()).add(definedName);
        }
    }

    /**
     * Evaluates a name at the scope's origin:
     * 1) pick the local candidate, else the global one (#NAME? if neither)
     * 2) refuse to re-enter a name that is already being resolved
     * 3) plain references are evaluated as references, anything else as a formula
     */
    EvalResult resolve(String name, EvaluationScope scope) {
        // 1) Find the candidate
        String localKey = key(String.valueOf(scope.getDefaultSheetIndex()), name);
        String globalKey = key(GLOBAL_SCOPE, name);
        String key = candidatesByKey.containsKey(localKey) ? localKey : globalKey;
        List<DefinedName> candidates = candidatesByKey.get(key);
        if (candidates == null) {
            throw new NameNotFoundException("Defined name " + name + " not found");
        }
        DefinedName definedName = pickCandidate(candidates);

        // 2) Cycle guard
        if (inProgress.contains(key)) {
            log.trace("Defined name {} re-entered while resolving", name);
            throw new CircularReferenceException("Defined name " + name + " refers to itself");
        }
        inProgress.add(key);
        try {
            // 3) Evaluate
            String text = FormulaEvaluator.normalizeFormulaText(definedName.getFormulaText());
            CellRange range = CellRange.tryParse(text);
            if (range != null) {
                boolean singleSheet = range.getSheetName() == null || range.getSheetName().indexOf(':') < 0;
                if (singleSheet && range.getStart().equals(range.getEnd())) {
                    return nodeEvaluator.evaluate(new ReferenceNode(range.getStart(), range.getSheetName()), scope);
                }
                return nodeEvaluator.evaluate(new RangeNode(range), scope);
            }
            EvalResult result = formulaEvaluator.evaluateFormulaResult(
                    scope.getDefaultSheetIndex(), scope.getOrigin().getAddress(), text);
            if (!result.isArray() && result.asScalar().isError()) {
                throw new FormulaErrorException(result.asScalar().getErrorCode(),
                        "Defined name " + name + " evaluates to " + result.asScalar());
            }
            return result;
        } finally {
            inProgress.remove(key);
        }
    }

    // Duplicates copied from other workbooks carry a "[n]" prefix; prefer the local one
    private static DefinedName pickCandidate(List<DefinedName> candidates) {
        for (DefinedName candidate : candidates) {
            if (!candidate.isExternalReference()) {
                return candidate;
            }
        }
        return candidates.get(0);
    }

    private static String key(String scope, String name) {
        return scope + "|" + name.trim().toUpperCase(Locale.ROOT);
    }
}
