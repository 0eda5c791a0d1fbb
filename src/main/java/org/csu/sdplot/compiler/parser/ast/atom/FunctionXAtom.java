package org.csu.sdplot.compiler.parser.ast.atom;

import lombok.Getter;
import org.csu.sdplot.catalog.FunctionRegistry;
import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.common.function.Function2D;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.AtomType;
import org.csu.sdplot.compiler.parser.ast.TreeElement;

/**
 * AST 节点: 调用一个已注册的单参数用户函数，如 f(x + 1)。
 * 函数在构造时从目录中解析并绑定，之后重新注册同名函数不影响已建好的树。
 */
public final class FunctionXAtom implements Atom {

    @Getter
    private final String name;
    @Getter
    private final TreeElement argument;
    private final Function2D function;
    private final AtomType atomType;

    public FunctionXAtom(String name, TreeElement argument, FunctionRegistry registry) {
        this.name = name;
        this.argument = argument;
        this.function = registry != null ? registry.getFunction2D(name) : null;
        this.atomType = function != null ? AtomType.FUNCTION_X : AtomType.INVALID;
    }

    @Override
    public double getValue() {
        if (atomType != AtomType.FUNCTION_X) {
            throw new ExpressionFormatException("Function '" + name + "(x)' is not defined.");
        }
        return function.f(argument.getValue());
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
