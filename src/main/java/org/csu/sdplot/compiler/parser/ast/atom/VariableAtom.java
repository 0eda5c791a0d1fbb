package org.csu.sdplot.compiler.parser.ast.atom;

import lombok.Getter;
import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.AtomType;

import java.util.Objects;

/**
 * AST 节点: 对命名变量 (如 pi、a) 的引用。
 * 构造时上下文中没有该变量，则节点被标记为 INVALID。
 */
public final class VariableAtom implements Atom {

    private final EvaluationContext context;
    @Getter
    private final String name;
    private final AtomType atomType;

    public VariableAtom(String name, EvaluationContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.name = name;
        this.atomType = context.hasVariable(name) ? AtomType.VARIABLE : AtomType.INVALID;
    }

    @Override
    public double getValue() {
        if (atomType != AtomType.VARIABLE) {
            throw new ExpressionFormatException("Variable '" + name + "' is not defined.");
        }
        return context.getVariable(name);
    }

    /**
     * 命名变量在一次绘图中视为常量。
     */
    @Override
    public boolean isVariable() {
        return false;
    }

    @Override
    public AtomType getAtomType() {
        return atomType;
    }

    @Override
    public String toString() {
        return name;
    }
}
