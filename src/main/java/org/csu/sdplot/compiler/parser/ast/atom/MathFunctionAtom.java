package org.csu.sdplot.compiler.parser.ast.atom;

import lombok.Getter;
import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.AtomType;
import org.csu.sdplot.compiler.parser.ast.TreeElement;

/**
 * AST 节点: 内置数学函数调用，如 sin(x)。
 */
public final class MathFunctionAtom implements Atom {

    @Getter
    private final String name;
    @Getter
    private final TreeElement argument;
    private final MathFunction function;
    private final AtomType atomType;

    public MathFunctionAtom(String name, TreeElement argument) {
        this.name = name;
        this.argument = argument;
        this.function = MathFunction.lookup(name).orElse(null);
        this.atomType = function != null ? AtomType.MATH_FUNCTION : AtomType.INVALID;
    }

    @Override
    public double getValue() {
        if (atomType != AtomType.MATH_FUNCTION) {
            throw new ExpressionFormatException("Unknown math function '" + name + "'.");
        }
        return function.apply(argument.getValue());
    }

    @Override
    public boolean isVariable() {
        return argument.isVariable();
    }

    @Override
    public AtomType getAtomType() {
        return atomType;
    }

    @Override
    public String toString() {
        return name + "(" + argument + ")";
    }
}
