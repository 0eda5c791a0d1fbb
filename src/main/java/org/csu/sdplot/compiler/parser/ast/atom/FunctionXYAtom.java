package org.csu.sdplot.compiler.parser.ast.atom;

import lombok.Getter;
import org.csu.sdplot.catalog.FunctionRegistry;
import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.common.function.Function3D;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.AtomType;
import org.csu.sdplot.compiler.parser.ast.TreeElement;

/**
 * AST 节点: 调用一个已注册的双参数用户函数，如 g(x, y * 2)。
 */
public final class FunctionXYAtom implements Atom {

    @Getter
    private final String name;
    @Getter
    private final TreeElement firstArgument;
    @Getter
    private final TreeElement secondArgument;
    private final Function3D function;
    private final AtomType atomType;

    public FunctionXYAtom(String name, TreeElement firstArgument, TreeElement secondArgument, FunctionRegistry registry) {
        this.name = name;
        this.firstArgument = firstArgument;
        this.secondArgument = secondArgument;
        this.function = registry != null ? registry.getFunction3D(name) : null;
        this.atomType = function != null ? AtomType.FUNCTION_X_Y : AtomType.INVALID;
    }

    @Override
    public double getValue() {
        if (atomType != AtomType.FUNCTION_X_Y) {
            throw new ExpressionFormatException("Function '" + name + "(x, y)' is not defined.");
        }
        return function.f(firstArgument.getValue(), secondArgument.getValue());
    }

    @Override
    public boolean isVariable() {
        return firstArgument.isVariable() || secondArgument.isVariable();
    }

    @Override
    public AtomType getAtomType() {
        return atomType;
    }

    @Override
    public String toString() {
        return name + "(" + firstArgument + ", " + secondArgument + ")";
    }
}
