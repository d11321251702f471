package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.ast.ArrayNode;
import com.spreadsheet.formula.ast.BinaryNode;
import com.spreadsheet.formula.ast.CompareNode;
import com.spreadsheet.formula.ast.FormulaNode;
import com.spreadsheet.formula.ast.FunctionNode;
import com.spreadsheet.formula.ast.LiteralNode;
import com.spreadsheet.formula.ast.NameNode;
import com.spreadsheet.formula.ast.NodeType;
import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.ReferenceNode;
import com.spreadsheet.formula.ast.StructuredReferenceNode;
import com.spreadsheet.formula.ast.TableItem;
import com.spreadsheet.formula.ast.UnaryNode;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.values.ErrorCode;
import com.spreadsheet.formula.values.FormulaScalar;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the recursive-descent parser.
 */
class DefaultFormulaParserTest {

    private final DefaultFormulaParser parser = new DefaultFormulaParser();

    @Test
    void testLiterals() {
        assertEquals(new LiteralNode(FormulaScalar.number(1.5)), parser.parse("1.5"));
        assertEquals(new LiteralNode(FormulaScalar.number(2500)), parser.parse("2.5E3"));
        assertEquals(new LiteralNode(FormulaScalar.text("say \"hi\"")), parser.parse("\"say \"\"hi\"\"\""));
        assertEquals(new LiteralNode(FormulaScalar.bool(true)), parser.parse("true"));
        assertEquals(new LiteralNode(FormulaScalar.error(ErrorCode.NA)), parser.parse("#N/A"));
        assertEquals(new LiteralNode(FormulaScalar.error(ErrorCode.DIV_ZERO)), parser.parse("#DIV/0!"));
    }

    /**
     * Multiplication binds tighter than addition, "&" looser than both,
     * comparison loosest of all.
     */
    @Test
    void testOperatorPrecedence() {
        FormulaNode node = parser.parse("1+2*3&\"x\"=\"7x\"");
        assertEquals(NodeType.COMPARE, node.getType());

        CompareNode compare = (CompareNode) node;
        BinaryNode concat = (BinaryNode) compare.getLeft();
        assertEquals(BinaryNode.Operator.CONCAT, concat.getOperator());

        BinaryNode add = (BinaryNode) concat.getLeft();
        assertEquals(BinaryNode.Operator.ADD, add.getOperator());
        assertEquals(BinaryNode.Operator.MULTIPLY, ((BinaryNode) add.getRight()).getOperator());
    }

    @Test
    void testLeftAssociativity() {
        BinaryNode node = (BinaryNode) parser.parse("8-3-2");
        assertEquals(BinaryNode.Operator.SUBTRACT, node.getOperator());
        assertEquals(new LiteralNode(FormulaScalar.number(2)), node.getRight());
        assertEquals(BinaryNode.Operator.SUBTRACT, ((BinaryNode) node.getLeft()).getOperator());

        BinaryNode power = (BinaryNode) parser.parse("2^3^2");
        assertEquals(BinaryNode.Operator.POWER, ((BinaryNode) power.getLeft()).getOperator());
    }

    @Test
    void testUnaryBindsTighterThanPower() {
        BinaryNode node = (BinaryNode) parser.parse("-2^2");
        assertEquals(BinaryNode.Operator.POWER, node.getOperator());
        assertEquals(UnaryNode.Operator.MINUS, ((UnaryNode) node.getLeft()).getOperator());
    }

    @Test
    void testCellReferences() {
        assertEquals(new ReferenceNode(CellAddress.parse("B3"), null), parser.parse("b3"));
        assertEquals(new ReferenceNode(CellAddress.parse("C4"), "Data"), parser.parse("Data!$C$4"));
        assertEquals(new ReferenceNode(CellAddress.parse("A1"), "My Sheet"), parser.parse("'My Sheet'!A1"));
        assertEquals(new ReferenceNode(CellAddress.parse("A1"), "It's"), parser.parse("'It''s'!A1"));

        ReferenceNode mixed = (ReferenceNode) parser.parse("B$7");
        assertFalse(mixed.getAddress().isColumnAbsolute());
        assertTrue(mixed.getAddress().isRowAbsolute());
    }

    @Test
    void testRanges() {
        assertEquals(new RangeNode(CellRange.parse("A1:B3")), parser.parse("A1:B3"));
        assertEquals(new RangeNode(CellRange.parse("Sheet2!A1:A4")), parser.parse("Sheet2!A1:A4"));
        assertEquals(new RangeNode(CellRange.parse("A:C")), parser.parse("A:C"));
        assertEquals(new RangeNode(CellRange.parse("2:5")), parser.parse("2:5"));
        assertEquals(new RangeNode(CellRange.parse("Sheet2!B:B")), parser.parse("Sheet2!B:B"));
    }

    @Test
    void testThreeDimensionalReferences() {
        RangeNode range = (RangeNode) parser.parse("Jan:Mar!B2:C3");
        assertEquals("Jan:Mar", range.getRange().getSheetName());
        assertEquals(CellAddress.parse("B2"), range.getRange().getStart());

        RangeNode single = (RangeNode) parser.parse("Jan:Mar!B2");
        assertEquals(single.getRange().getStart(), single.getRange().getEnd());
    }

    @Test
    void testFunctionsAndNames() {
        FunctionNode sum = (FunctionNode) parser.parse("sum(A1:A3, 4)");
        assertEquals("SUM", sum.getName());
        assertEquals(2, sum.getArguments().size());

        FunctionNode prefixed = (FunctionNode) parser.parse("_xlfn.CONCAT(\"a\")");
        assertEquals("_XLFN.CONCAT", prefixed.getName());

        FunctionNode omitted = (FunctionNode) parser.parse("IF(A1,,0)");
        assertEquals(new LiteralNode(FormulaScalar.blank()), omitted.getArguments().get(1));

        assertEquals(0, ((FunctionNode) parser.parse("NOW()")).getArguments().size());
        assertEquals(new NameNode("TaxRate"), parser.parse("TaxRate"));
    }

    @Test
    void testArrayLiterals() {
        ArrayNode array = (ArrayNode) parser.parse("{1,2;3,4}");
        assertEquals(2, array.getRows().size());
        assertEquals(2, array.getRows().get(1).size());
        assertEquals(new LiteralNode(FormulaScalar.number(3)), array.getRows().get(1).get(0));

        ArrayNode empty = (ArrayNode) parser.parse("{}");
        assertEquals(1, empty.getRows().size());
        assertTrue(empty.getRows().get(0).isEmpty());
    }

    @Test
    void testStructuredReferences() {
        assertEquals(new StructuredReferenceNode("Sales", null, "Amount", "Amount"),
                parser.parse("Sales[Amount]"));
        assertEquals(new StructuredReferenceNode("Sales", null, null, null),
                parser.parse("Sales[]"));
        assertEquals(new StructuredReferenceNode("Sales", TableItem.THIS_ROW, null, null),
                parser.parse("Sales[#This Row]"));
        assertEquals(new StructuredReferenceNode("Sales", TableItem.TOTALS, null, null),
                parser.parse("Sales[#Totals]"));
        assertEquals(new StructuredReferenceNode("Sales", TableItem.THIS_ROW, "Q1", "Q1"),
                parser.parse("Sales[@Q1]"));
        assertEquals(new StructuredReferenceNode("Sales", TableItem.THIS_ROW, "Unit Price", "Unit Price"),
                parser.parse("Sales[@[Unit Price]]"));
        assertEquals(new StructuredReferenceNode("Sales", TableItem.DATA, "Q1", "Q4"),
                parser.parse("Sales[[#Data],[Q1]:[Q4]]"));
        assertEquals(new StructuredReferenceNode("Sales", null, "Q1", "Q2"),
                parser.parse("Sales[[Q1]:[Q2]]"));
    }

    @Test
    void testMalformedFormulasThrow() {
        assertThrows(FormulaParseException.class, () -> parser.parse(""));
        assertThrows(FormulaParseException.class, () -> parser.parse("1+"));
        assertThrows(FormulaParseException.class, () -> parser.parse("(1"));
        assertThrows(FormulaParseException.class, () -> parser.parse("\"open"));
        assertThrows(FormulaParseException.class, () -> parser.parse("1 2"));
        assertThrows(FormulaParseException.class, () -> parser.parse("#BOGUS!"));
        assertThrows(FormulaParseException.class, () -> parser.parse("A1:B"));
        assertThrows(FormulaParseException.class, () -> parser.parse("Sales[#Nope]"));
        assertThrows(FormulaParseException.class, () -> parser.parse("1 ~ 2"));
    }

    @Test
    void testNumberOutOfRangeThrows() {
        assertThrows(FormulaParseException.class, () -> parser.parse("1e999"));
        assertThrows(FormulaParseException.class, () -> parser.parse("{1,1E400}"));
        assertEquals(new LiteralNode(FormulaScalar.number(1e308)), parser.parse("1e308"));
    }

    @Test
    void testRaggedArrayLiteralThrows() {
        assertThrows(FormulaParseException.class, () -> parser.parse("{1,2;3}"));
        assertThrows(FormulaParseException.class, () -> parser.parse("{1;2,3}"));
        assertEquals(2, ((ArrayNode) parser.parse("{1;2}")).getRows().size());
    }
}
