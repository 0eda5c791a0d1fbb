package org.csu.sdplot.compiler.parser.ast.expression;

import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.compiler.lexer.Token;
import org.csu.sdplot.compiler.parser.ast.TreeElement;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., x * 2, a ^ b)
 * 按 IEEE-754 双精度计算，1/0 得到 Infinity，0/0 得到 NaN。
 */
public record BinaryExpressionNode(
        TreeElement left,
        Token operator,
        TreeElement right
) implements TreeElement {

    @Override
    public double getValue() {
        double leftValue = left.getValue();
        double rightValue = right.getValue();
        return switch (operator.type()) {
            case PLUS -> leftValue + rightValue;
            case MINUS -> leftValue - rightValue;
            case ASTERISK -> leftValue * rightValue;
            case SLASH -> leftValue / rightValue;
            case CARET -> Math.pow(leftValue, rightValue);
            default -> throw new ExpressionFormatException("Unsupported binary operator: " + operator.lexeme());
        };
    }

    @Override
    public boolean isVariable() {
        return left.isVariable() || right.isVariable();
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.lexeme() + " " + right + ")";
    }
}
