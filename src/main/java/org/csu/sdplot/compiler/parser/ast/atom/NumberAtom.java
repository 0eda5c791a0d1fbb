package org.csu.sdplot.compiler.parser.ast.atom;

import lombok.Getter;
import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.AtomType;

/**
 * AST 节点: 数字字面量。词素无法解析为数字时标记为 INVALID。
 */
public final class NumberAtom implements Atom {

    @Getter
    private final String lexeme;
    private final double number;
    private final AtomType atomType;

    public NumberAtom(String lexeme) {
        this.lexeme = lexeme;
        double parsed = Double.NaN;
        AtomType type = AtomType.INVALID;
        if (lexeme != null) {
            try {
                parsed = Double.parseDouble(lexeme);
                type = AtomType.NUMBER;
            } catch (NumberFormatException e) {
                // 保持 INVALID，求值时报错
                parsed = Double.NaN;
            }
        }
        this.number = parsed;
        this.atomType = type;
    }

    @Override
    public double getValue() {
        if (atomType != AtomType.NUMBER) {
            throw new ExpressionFormatException("Number '" + lexeme + "' is invalid, cannot parse");
        }
        return number;
    }

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
        return lexeme;
    }
}
