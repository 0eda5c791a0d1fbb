package org.csu.sdplot.compiler.parser.ast.atom;

import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.AtomType;

import java.util.Objects;

/**
 * AST 节点: 对自由变量 x 的引用。
 */
public final class XVariableAtom implements Atom {

    private final EvaluationContext context;
    private final AtomType atomType = AtomType.VARIABLE;

    public XVariableAtom(EvaluationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public double getValue() {
        if (atomType == AtomType.VARIABLE) {
            return context.getX();
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
        return EvaluationContext.X;
    }
}
