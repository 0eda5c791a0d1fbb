package org.csu.sdplot.compiler.parser;

import org.csu.sdplot.catalog.FunctionRegistry;
import org.csu.sdplot.common.exception.ParseException;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.lexer.Token;
import org.csu.sdplot.compiler.lexer.TokenType;
import org.csu.sdplot.compiler.parser.ast.TreeElement;
import org.csu.sdplot.compiler.parser.ast.atom.FunctionXAtom;
import org.csu.sdplot.compiler.parser.ast.atom.FunctionXYAtom;
import org.csu.sdplot.compiler.parser.ast.atom.MathFunction;
import org.csu.sdplot.compiler.parser.ast.atom.MathFunctionAtom;
import org.csu.sdplot.compiler.parser.ast.atom.NumberAtom;
import org.csu.sdplot.compiler.parser.ast.atom.VariableAtom;
import org.csu.sdplot.compiler.parser.ast.atom.XVariableAtom;
import org.csu.sdplot.compiler.parser.ast.atom.YVariableAtom;
import org.csu.sdplot.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.sdplot.compiler.parser.ast.expression.UnaryExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为表达式树。
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := ('+' | '-') factor | pow
 * pow        := atom ('^' factor)?
 * atom       := NUMBER | x | y | IDENTIFIER | IDENTIFIER '(' args ')' | '(' expression ')'
 * </pre>
 * 语法错误抛出 {@link ParseException}；未知的变量名或函数名不算语法错误，
 * 而是生成标记为 INVALID 的节点，交给语义分析或求值时处理。
 */
public class Parser {

    /** 嵌套层数与表达式树高度的上限，超出时报语法错误。 */
    public static final int MAX_DEPTH = 500;

    private final List<Token> tokens;
    private final EvaluationContext context;
    private final FunctionRegistry registry;
    private int position = 0;
    // 当前递归嵌套层数
    private int depth = 0;
    // 最近解析出的子树高度
    private int height = 0;

    public Parser(List<Token> tokens, EvaluationContext context, FunctionRegistry registry) {
        this.tokens = tokens;
        this.context = context;
        this.registry = registry;
    }

    public TreeElement parse() {
        if (isAtEnd()) {
            throw new ParseException(peek(), "an expression");
        }
        TreeElement expression = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException(peek(), "an operator or end of expression");
        }
        return expression;
    }

    private TreeElement parseExpression() {
        TreeElement left = parseTerm();
        int h = height;
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            TreeElement right = parseTerm();
            h = grow(Math.max(h, height), operator);
            left = new BinaryExpressionNode(left, operator, right);
        }
        height = h;
        return left;
    }

    private TreeElement parseTerm() {
        TreeElement left = parseFactor();
        int h = height;
        while (match(TokenType.ASTERISK, TokenType.SLASH)) {
            Token operator = previous();
            TreeElement right = parseFactor();
            h = grow(Math.max(h, height), operator);
            left = new BinaryExpressionNode(left, operator, right);
        }
        height = h;
        return left;
    }

    private TreeElement parseFactor() {
        if (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            enter(operator);
            TreeElement operand = parseFactor();
            exit();
            height = grow(height, operator);
            return new UnaryExpressionNode(operator, operand);
        }
        return parsePow();
    }

    // 幂运算右结合，且优先级高于一元负号：-2^2 = -(2^2)，2^3^2 = 2^(3^2)
    private TreeElement parsePow() {
        TreeElement base = parseAtom();
        if (match(TokenType.CARET)) {
            int h = height;
            Token operator = previous();
            enter(operator);
            TreeElement exponent = parseFactor();
            exit();
            height = grow(Math.max(h, height), operator);
            return new BinaryExpressionNode(base, operator, exponent);
        }
        return base;
    }

    private TreeElement parseAtom() {
        if (match(TokenType.NUMBER)) {
            height = 1;
            return new NumberAtom(previous().lexeme());
        }
        if (match(TokenType.X_VAR)) {
            height = 1;
            return new XVariableAtom(context);
        }
        if (match(TokenType.Y_VAR)) {
            height = 1;
            return new YVariableAtom(context);
        }
        if (check(TokenType.IDENTIFIER)) {
            Token name = advance();
            if (match(TokenType.LPAREN)) {
                return parseFunctionCall(name);
            }
            height = 1;
            return new VariableAtom(name.lexeme(), context);
        }
        if (match(TokenType.LPAREN)) {
            enter(previous());
            TreeElement expr = parseExpression();
            exit();
            consume(TokenType.RPAREN, "')' after expression");
            return expr;
        }
        throw new ParseException(peek(), "an expression (a number, a variable, a function call or '(')");
    }

    private TreeElement parseFunctionCall(Token name) {
        enter(name);
        List<TreeElement> arguments = new ArrayList<>();
        int h = 0;
        do {
            arguments.add(parseExpression());
            h = Math.max(h, height);
        } while (match(TokenType.COMMA));
        exit();
        consume(TokenType.RPAREN, "')' after function arguments");
        height = grow(h, name);

        String functionName = name.lexeme();
        if (arguments.size() == 1) {
            if (MathFunction.isBuiltIn(functionName)) {
                return new MathFunctionAtom(functionName, arguments.get(0));
            }
            return new FunctionXAtom(functionName, arguments.get(0), registry);
        }
        if (arguments.size() == 2) {
            return new FunctionXYAtom(functionName, arguments.get(0), arguments.get(1), registry);
        }
        throw new ParseException(name, "at most two arguments for function '" + functionName + "'");
    }

    private void enter(Token token) {
        if (++depth > MAX_DEPTH) {
            throw tooDeep(token);
        }
    }

    private void exit() {
        depth--;
    }

    private int grow(int childHeight, Token token) {
        if (childHeight + 1 > MAX_DEPTH) {
            throw tooDeep(token);
        }
        return childHeight + 1;
    }

    private ParseException tooDeep(Token token) {
        return new ParseException(String.format("Syntax Error at line %d, column %d: Expression is nested more than %d levels deep.",
                token.line(), token.column(), MAX_DEPTH));
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
