package org.csu.sdplot.compiler.parser.ast.expression;

import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.compiler.lexer.Token;
import org.csu.sdplot.compiler.parser.ast.TreeElement;

/**
 * AST 节点: 一元正负号 (e.g., -x)
 */
public record UnaryExpressionNode(Token operator, TreeElement operand) implements TreeElement {

    @Override
    public double getValue() {
        return switch (operator.type()) {
            case PLUS -> operand.getValue();
            case MINUS -> -operand.getValue();
            default -> throw new ExpressionFormatException("Unsupported unary operator: " + operator.lexeme());
        };
    }

    @Override
    public boolean isVariable() {
        return operand.isVariable();
    }

    @Override
    public String toString() {
        return operator.lexeme() + operand;
    }
}
