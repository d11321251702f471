package com.spreadsheet.formula.ast;

/**
 * Discriminates the closed set of formula syntax tree nodes.
 * The evaluator matches on this in a single switch.
 */
public enum NodeType {
    LITERAL,
    REFERENCE,
    RANGE,
    NAME,
    STRUCTURED_REFERENCE,
    ARRAY,
    UNARY,
    BINARY,
    COMPARE,
    FUNCTION
}
