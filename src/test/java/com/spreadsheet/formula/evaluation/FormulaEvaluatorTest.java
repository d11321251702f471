package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.exceptions.UnknownFunctionException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.Formula;
import com.spreadsheet.formula.models.FormulaType;
import com.spreadsheet.formula.models.Workbook;
import com.spreadsheet.formula.models.WorkbookCell;
import com.spreadsheet.formula.models.WorkbookRow;
import com.spreadsheet.formula.parser.DefaultFormulaParser;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.support.TestFunctions;
import com.spreadsheet.formula.support.TestWorkbooks;
import com.spreadsheet.formula.values.ErrorCode;
import com.spreadsheet.formula.values.EvalResult;
import com.spreadsheet.formula.values.FormulaArray;
import com.spreadsheet.formula.values.FormulaScalar;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for cell and formula evaluation against in-memory workbooks
 * (no Spring context).
 */
class FormulaEvaluatorTest {

    private static CellAddress at(String a1) {
        return CellAddress.parse(a1);
    }

    private static FormulaScalar n(double value) {
        return FormulaScalar.number(value);
    }

    private static FormulaScalar err(ErrorCode code) {
        return FormulaScalar.error(code);
    }

    /**
     * Counts parser invocations to observe the AST cache.
     */
    private static class CountingParser implements FormulaParser {
        private final DefaultFormulaParser delegate = new DefaultFormulaParser();
        private int calls;

        @Override
        public FormulaNode parse(String formula) {
            calls++;
            return delegate.parse(formula);
        }
    }

    @Test
    void testDivisionByZero() {
        FormulaEvaluator evaluator = TestFunctions.evaluator(TestWorkbooks.builder().sheet("Sheet1").build());
        assertEquals(err(ErrorCode.DIV_ZERO), evaluator.evaluateFormula(0, "=1/0"));
        assertEquals(n(0.5), evaluator.evaluateFormula(0, "=1/2"));
    }

    @Test
    void testSelfReferenceIsRef() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1").formula("A1", "=A1").build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(err(ErrorCode.REF), evaluator.evaluateCell(0, at("A1")));
        // Cached: the same answer again
        assertEquals(err(ErrorCode.REF), evaluator.evaluateCell(0, at("A1")));
    }

    @Test
    void testMutualCycle() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .formula("A1", "=B1+1")
                .formula("B1", "=A1+1")
                .formula("C1", "=5")
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(err(ErrorCode.REF), evaluator.evaluateCell(0, at("A1")));
        assertEquals(err(ErrorCode.REF), evaluator.evaluateCell(0, at("B1")));
        assertEquals(n(5), evaluator.evaluateCell(0, at("C1")));
    }

    /**
     * A1 = B1 + C1 with both branches reading D1: no cycle, and every cell
     * is computed exactly once.
     */
    @Test
    void testDiamondComputesEachCellOnce() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .formula("A1", "=B1+C1")
                .formula("B1", "=TRACK(\"B1\", D1*2)")
                .formula("C1", "=TRACK(\"C1\", D1*3)")
                .formula("D1", "=TRACK(\"D1\", 5)")
                .build();
        TestFunctions.Track track = new TestFunctions.Track();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook, track);

        assertEquals(n(25), evaluator.evaluateCell(0, at("A1")));
        assertEquals(n(25), evaluator.evaluateCell(0, at("A1")));
        assertEquals(n(10), evaluator.evaluateCell(0, at("B1")));

        assertEquals(1, track.callsFor("B1"));
        assertEquals(1, track.callsFor("C1"));
        assertEquals(1, track.callsFor("D1"));
    }

    @Test
    void testArrayLiteral() {
        FormulaEvaluator evaluator = TestFunctions.evaluator(TestWorkbooks.builder().sheet("Sheet1").build());

        EvalResult result = evaluator.evaluateFormulaResult(0, at("A1"), "={1,2;3,4}");
        assertEquals(FormulaArray.ofRows(Arrays.asList(
                Arrays.asList(n(1), n(2)),
                Arrays.asList(n(3), n(4)))), result);

        // Reduced to one value, an array gives its top-left element
        assertEquals(n(1), evaluator.evaluateFormula(0, "={1,2;3,4}"));
    }

    @Test
    void testRangeReachesEagerFunctionAsArray() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .value("A1", 1).value("A2", 2).value("A3", 3)
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(6), evaluator.evaluateFormula(0, "=SUM(A1:A3)"));
        assertEquals(n(6), evaluator.evaluateFormula(0, "=SUM(A3:A1)"));
        assertEquals(FormulaArray.ofRows(Arrays.asList(
                        Collections.singletonList(n(1)),
                        Collections.singletonList(n(2)),
                        Collections.singletonList(n(3)))),
                evaluator.evaluateFormulaResult(0, at("B1"), "A1:A3"));
    }

    @Test
    void testWholeColumnIsClampedToUsedRows() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .value("A1", 1).value("A2", 2).value("A3", 3)
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(6), evaluator.evaluateFormula(0, "=SUM(A:A)"));
        assertEquals(3, evaluator.evaluateFormulaResult(0, at("C1"), "=A:A").asArray().size());
    }

    @Test
    void testComparisons() {
        FormulaEvaluator evaluator = TestFunctions.evaluator(TestWorkbooks.builder().sheet("Sheet1").build());

        assertEquals(FormulaScalar.bool(true), evaluator.evaluateFormula(0, "=\"abc\"=\"abc\""));
        assertEquals(FormulaScalar.bool(true), evaluator.evaluateFormula(0, "=\"abc\"=\"ABC\""));
        assertEquals(err(ErrorCode.VALUE), evaluator.evaluateFormula(0, "=1>\"a\""));
        assertEquals(FormulaScalar.bool(false), evaluator.evaluateFormula(0, "=TRUE=1"));
        assertEquals(FormulaScalar.bool(true), evaluator.evaluateFormula(0, "=TRUE<>1"));
        assertEquals(FormulaScalar.bool(false), evaluator.evaluateFormula(0, "=1=\"1\""));
        assertEquals(FormulaScalar.bool(true), evaluator.evaluateFormula(0, "=Z99=0"));
        assertEquals(FormulaScalar.bool(true), evaluator.evaluateFormula(0, "=\"apple\"<\"Banana\""));
        assertEquals(FormulaScalar.bool(true), evaluator.evaluateFormula(0, "=2>=2"));
        assertEquals(FormulaScalar.bool(false), evaluator.evaluateFormula(0, "=3<2"));
        // Ordering refuses blanks and booleans
        assertEquals(err(ErrorCode.VALUE), evaluator.evaluateFormula(0, "=Z99<1"));
        assertEquals(err(ErrorCode.VALUE), evaluator.evaluateFormula(0, "=TRUE>FALSE"));
    }

    @Test
    void testPlainValuesRoundTrip() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .value("A1", 42.5)
                .value("A2", "hello")
                .value("A3", true)
                .error("A4", ErrorCode.NA)
                .date("A5", "2024-01-15T00:00:00Z")
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(42.5), evaluator.evaluateCell(0, at("A1")));
        assertEquals(FormulaScalar.text("hello"), evaluator.evaluateCell(0, at("A2")));
        assertEquals(FormulaScalar.bool(true), evaluator.evaluateCell(0, at("A3")));
        assertEquals(err(ErrorCode.NA), evaluator.evaluateCell(0, at("A4")));
        assertEquals(FormulaScalar.text("2024-01-15T00:00:00.000Z"), evaluator.evaluateCell(0, at("A5")));
        assertEquals(FormulaScalar.blank(), evaluator.evaluateCell(0, at("Z99")));
    }

    @Test
    void testErrorsPropagate() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .error("A1", ErrorCode.NA)
                .value("A2", 2)
                .formula("B1", "=A1+1")
                .formula("B2", "=B1*2")
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(err(ErrorCode.NA), evaluator.evaluateCell(0, at("B2")));
        assertEquals(err(ErrorCode.NA), evaluator.evaluateFormula(0, "=SUM(A1:A2)"));
        assertEquals(err(ErrorCode.NA), evaluator.evaluateFormula(0, "=#N/A"));
    }

    @Test
    void testArithmeticAndText() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1").value("A1", 4).build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(14), evaluator.evaluateFormula(0, "=2+A1*3"));
        assertEquals(n(1024), evaluator.evaluateFormula(0, "=2^10"));
        assertEquals(n(4), evaluator.evaluateFormula(0, "=-2^2"));
        assertEquals(n(3), evaluator.evaluateFormula(0, "=+\"3\""));
        assertEquals(err(ErrorCode.VALUE), evaluator.evaluateFormula(0, "=-\"x\""));
        assertEquals(err(ErrorCode.DIV_ZERO), evaluator.evaluateFormula(0, "=0^-1"));
        assertEquals(err(ErrorCode.NUM), evaluator.evaluateFormula(0, "=(-8)^(1/3)"));
        assertEquals(FormulaScalar.text("a4TRUE"), evaluator.evaluateFormula(0, "=\"a\"&A1&TRUE"));
        assertEquals(n(5), evaluator.evaluateFormula(0, "=\"1\"+A1"));
    }

    @Test
    void testArrayBroadcasting() {
        FormulaEvaluator evaluator = TestFunctions.evaluator(TestWorkbooks.builder().sheet("Sheet1").build());

        assertEquals(FormulaArray.ofRows(Collections.singletonList(Arrays.asList(n(2), n(4)))),
                evaluator.evaluateFormulaResult(0, at("A1"), "={1,2}*2"));
        assertEquals(FormulaArray.ofRows(Collections.singletonList(Arrays.asList(n(-1), n(-2)))),
                evaluator.evaluateFormulaResult(0, at("A1"), "=-{1,2}"));
        assertEquals(err(ErrorCode.VALUE), evaluator.evaluateFormulaResult(0, at("A1"), "={1,2}+{1;2}"));
        assertEquals(FormulaArray.ofRows(Collections.singletonList(Arrays.asList(err(ErrorCode.DIV_ZERO), n(0.5)))),
                evaluator.evaluateFormulaResult(0, at("A1"), "=1/{0,2}"));
    }

    @Test
    void testSheetQualifiedReferences() {
        Workbook workbook = TestWorkbooks.builder()
                .sheet("Sheet1").value("A1", 1)
                .sheet("My Data").value("B2", 21)
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(42), evaluator.evaluateFormula(0, "='My Data'!B2*2"));
        assertEquals(n(42), evaluator.evaluateFormula(0, "='my data'!B2*2"));
        assertEquals(n(1), evaluator.evaluateFormula(1, "=Sheet1!A1"));
        assertEquals(err(ErrorCode.REF), evaluator.evaluateFormula(0, "=Missing!A1"));
        assertEquals(err(ErrorCode.REF), evaluator.evaluateFormula(0, "=SUM(Missing!A1:A2)"));
        assertEquals(err(ErrorCode.REF), evaluator.evaluateFormulaResult(5, at("A1"), "=1"));
    }

    @Test
    void testThreeDimensionalRange() {
        Workbook workbook = TestWorkbooks.builder()
                .sheet("Jan").value("A1", 1).value("A2", 10)
                .sheet("Feb").value("A1", 2).value("A2", 20)
                .sheet("Mar").value("A1", 3).value("A2", 30)
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(6), evaluator.evaluateFormula(0, "=SUM(Jan:Mar!A1)"));
        assertEquals(n(66), evaluator.evaluateFormula(0, "=SUM(Mar:Jan!A1:A2)"));

        FormulaArray perSheet = evaluator.evaluateFormulaResult(0, at("B1"), "=Jan:Feb!A1:A2").asArray();
        assertEquals(2, perSheet.size());
        assertEquals(2, perSheet.get(1).asArray().size());
        assertEquals(err(ErrorCode.REF), evaluator.evaluateFormula(0, "=SUM(Jan:Dec!A1)"));
    }

    @Test
    void testLazyFunctionSkipsUnusedBranch() {
        TestFunctions.Track track = new TestFunctions.Track();
        FormulaEvaluator evaluator = TestFunctions.evaluator(TestWorkbooks.builder().sheet("Sheet1").build(), track);

        assertEquals(n(1), evaluator.evaluateFormula(0, "=IF(TRUE, 1, 1/0)"));
        assertEquals(n(2), evaluator.evaluateFormula(0, "=IF(FALSE, TRACK(\"skipped\", 1), 2)"));
        assertEquals(0, track.callsFor("skipped"));
    }

    @Test
    void testLazyFunctionSeesOrigin() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1").formula("B3", "=ORIGIN()").build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook, new TestFunctions.Origin());

        assertEquals(FormulaScalar.text("Sheet1!B3"), evaluator.evaluateCell(0, at("B3")));
        assertEquals(FormulaScalar.text("Sheet1!A1"), evaluator.evaluateFormula(0, "=ORIGIN()"));
    }

    @Test
    void testArrayFormulaSpills() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .value("A1", 1).value("A2", 2)
                .arrayFormula("C1", "=TRACK(\"C\", A1:A2*10)", "C1:C2")
                // Value left in the spill range by the last calculation
                .value("C2", 7)
                .arrayFormula("E1", "={1,2}", "E1:E2")
                .arrayFormula("G5", "={1}", "H1:H2")
                .build();
        TestFunctions.Track track = new TestFunctions.Track();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook, track);

        // 1) The cell carrying the formula gets its element of the result
        assertEquals(n(10), evaluator.evaluateCell(0, at("C1")));

        // 2) Other cells in the range keep their stored values
        assertEquals(n(7), evaluator.evaluateCell(0, at("C2")));
        assertEquals(1, track.callsFor("C"));

        // 3) Bad shapes
        assertEquals(n(1), evaluator.evaluateCell(0, at("E1")));
        assertEquals(err(ErrorCode.REF), evaluator.evaluateCell(0, at("G5")));
    }

    @Test
    void testArrayFormulaReadingItsOwnRange() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .arrayFormula("A1", "=A2+1", "A1:A2")
                .value("A2", 5)
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(6), evaluator.evaluateCell(0, at("A1")));
        assertEquals(n(5), evaluator.evaluateCell(0, at("A2")));
    }

    @Test
    void testArrayFormulaOffsetPastResult() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .arrayFormula("A1", "=1/0", "A1:A2")
                .arrayFormula("B2", "=1/0", "B1:B2")
                .arrayFormula("C2", "=5", "C1:C2")
                .arrayFormula("D2", "={1;2}", "D1:D2")
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        // 1) At the top-left the error itself is the element
        assertEquals(err(ErrorCode.DIV_ZERO), evaluator.evaluateCell(0, at("A1")));

        // 2) Below it, a single result has nothing to give
        assertEquals(err(ErrorCode.VALUE), evaluator.evaluateCell(0, at("B2")));
        assertEquals(err(ErrorCode.VALUE), evaluator.evaluateCell(0, at("C2")));

        // 3) A tall enough result does
        assertEquals(n(2), evaluator.evaluateCell(0, at("D2")));
    }

    @Test
    void testArrayFormulaWithoutRefIsOrdinary() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1").build();
        WorkbookCell cell = new WorkbookCell(at("A1"), new Formula("={5,6}", FormulaType.ARRAY, null));
        workbook.getSheets().get(0).getRows().add(new WorkbookRow(1, new ArrayList<>(Collections.singletonList(cell))));
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertEquals(n(5), evaluator.evaluateCell(0, at("A1")));
    }

    @Test
    void testUnparseableFormulaIsNameErrorAndParsedOnce() {
        CountingParser parser = new CountingParser();
        FormulaEvaluator evaluator = new FormulaEvaluator(TestWorkbooks.builder().sheet("Sheet1").build(),
                parser, TestFunctions.registry(), TestFunctions.helpers());

        assertEquals(err(ErrorCode.NAME), evaluator.evaluateFormula(0, "=1+"));
        assertEquals(err(ErrorCode.NAME), evaluator.evaluateFormula(0, " =1+ "));
        assertEquals(1, parser.calls);

        evaluator.evaluateFormula(0, "=1+1");
        evaluator.evaluateFormula(0, "1+1");
        assertEquals(2, parser.calls);
    }

    @Test
    void testOutOfRangeNumbersAndRaggedArraysAreNameErrors() {
        FormulaEvaluator evaluator = TestFunctions.evaluator(TestWorkbooks.builder().sheet("Sheet1").build());

        assertEquals(err(ErrorCode.NAME), evaluator.evaluateFormula(0, "=1e999"));
        assertEquals(err(ErrorCode.NAME), evaluator.evaluateFormula(0, "={1,2;3}"));
    }

    @Test
    void testUnknownFunctionPropagates() {
        Workbook workbook = TestWorkbooks.builder().sheet("Sheet1")
                .formula("A1", "=NOPE()")
                .formula("B1", "=A1+1")
                .build();
        FormulaEvaluator evaluator = TestFunctions.evaluator(workbook);

        assertThrows(UnknownFunctionException.class, () -> evaluator.evaluateCell(0, at("B1")));
        // Markers were released: a second attempt fails the same way instead of reporting a cycle
        assertThrows(UnknownFunctionException.class, () -> evaluator.evaluateCell(0, at("A1")));
        assertThrows(UnknownFunctionException.class, () -> evaluator.evaluateCell(0, at("B1")));
    }
}
