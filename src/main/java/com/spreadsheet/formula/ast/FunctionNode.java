package com.spreadsheet.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function call. The name is kept as written (upper-cased by the parser),
 * including any compatibility prefix such as "_xlfn.".
 */
public final class FunctionNode extends FormulaNode {
    private final String name;
    private final List<FormulaNode> arguments;

    public FunctionNode(String name, List<FormulaNode> arguments) {
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    @Override
    public NodeType getType() {
        return NodeType.FUNCTION;
    }

    public String getName() {
        return name;
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionNode)) {
            return false;
        }
        FunctionNode other = (FunctionNode) o;
        return name.equals(other.name) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return "Function(" + name + ", " + arguments + ")";
    }
}
