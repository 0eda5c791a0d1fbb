package org.csu.sdplot.engine;

import lombok.Getter;
import org.csu.sdplot.catalog.FunctionRegistry;
import org.csu.sdplot.common.exception.ExpressionFormatException;
import org.csu.sdplot.common.exception.ParseException;
import org.csu.sdplot.common.exception.SemanticException;
import org.csu.sdplot.common.function.Function2D;
import org.csu.sdplot.common.function.Function3D;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.lexer.Lexer;
import org.csu.sdplot.compiler.parser.Parser;
import org.csu.sdplot.compiler.parser.ast.TreeElement;
import org.csu.sdplot.compiler.semantic.SemanticAnalyzer;

/**
 * 表达式处理器：把一个表达式字符串解析为表达式树，并在给定上下文上求值。
 * <p>
 * 构造时不会因为输入有误而抛出异常，而是把处理器标记为无效并记录错误信息；
 * 之后对无效处理器求值会抛出 {@link ExpressionFormatException}。
 * 处理器同时实现 {@link Function2D} 和 {@link Function3D}，可以作为用户函数注册到目录中。
 */
public class ExpressionProcessor implements Function2D, Function3D {

    @Getter
    private final String expression;
    @Getter
    private final EvaluationContext context;
    @Getter
    private final TreeElement tree;
    private final boolean valid;
    @Getter
    private final String errorMessage;

    public ExpressionProcessor(String expression) {
        this(expression, new FunctionRegistry());
    }

    public ExpressionProcessor(String expression, FunctionRegistry registry) {
        this(expression, registry, EvaluationContext.withDefaults());
    }

    public ExpressionProcessor(String expression, FunctionRegistry registry, EvaluationContext context) {
        this.expression = expression;
        this.context = context;

        TreeElement parsed = null;
        String error = null;
        if (expression == null) {
            error = "Expression must not be null.";
        } else {
            try {
                // 1. 词法分析 + 语法分析
                Lexer lexer = new Lexer(expression);
                Parser parser = new Parser(lexer.tokenize(), context, registry);
                parsed = parser.parse();
                // 2. 语义分析：检查未知变量、未知函数
                new SemanticAnalyzer().analyze(parsed);
            } catch (ParseException | SemanticException e) {
                error = e.getMessage();
            }
        }
        this.tree = parsed;
        this.errorMessage = error;
        this.valid = error == null;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * 使用上下文中当前的 x、y 求值。
     */
    public double getValue() {
        if (!valid) {
            throw new ExpressionFormatException("Expression '" + expression + "' is invalid: " + errorMessage);
        }
        return tree.getValue();
    }

    /**
     * @return 表达式是否依赖 x 或 y；无效表达式返回 false
     */
    public boolean isVariable() {
        return valid && tree.isVariable();
    }

    @Override
    public double f(double x) {
        context.setX(x);
        return getValue();
    }

    @Override
    public double f(double x, double y) {
        context.setX(x);
        context.setY(y);
        return getValue();
    }

    public void setX(double x) {
        context.setX(x);
    }

    public void setY(double y) {
        context.setY(y);
    }

    public void addVariable(String name, double value) {
        context.setVariable(name, value);
    }

    @Override
    public String toString() {
        return valid ? tree.toString() : "INVALID[" + expression + "]";
    }
}
