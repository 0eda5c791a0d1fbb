package org.csu.sdplot.compiler.parser.ast.atom;

import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.AtomType;

import java.util.Objects;

/**
 * AST 节点: 对自由变量 y 的引用。
 * <p>
 * 每次求值都读取上下文中 y 的当前值，不做缓存，
 * 因此在 y 上扫描取值 (例如绘图) 时同一个节点会依次得到不同的结果。
 */
public final class YVariableAtom implements Atom {

    private final EvaluationContext context;
    private final AtomType atomType = AtomType.VARIABLE;

    public YVariableAtom(EvaluationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public double getValue() {
        if (atomType == AtomType.VARIABLE) {
            return context.getY();
        }
        throw new ExpressionFormatException("Number is Invalid, cannot parse");
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    public AtomType getAtomType() {
        return atomType;
    }

    @Override
    public String toString() {
        return EvaluationContext.Y;
    }
}
