package org.csu.sdplot.compiler.parser.ast.atom;

import java.util.Locale;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * 内置数学函数，名称不区分大小写。
 */
public enum MathFunction {
    SIN("sin", Math::sin),
    COS("cos", Math::cos),
    TAN("tan", Math::tan),
    ASIN("asin", Math::asin),
    ACOS("acos", Math::acos),
    ATAN("atan", Math::atan),
    SINH("sinh", Math::sinh),
    COSH("cosh", Math::cosh),
    TANH("tanh", Math::tanh),
    SQRT("sqrt", Math::sqrt),
    EXP("exp", Math::exp),
    LN("ln", Math::log),      // 自然对数
    LG("lg", Math::log10),
    LOG("log", Math::log10),  // 与 lg 相同，以 10 为底
    ABS("abs", Math::abs),
    FLOOR("floor", Math::floor),
    CEIL("ceil", Math::ceil),
    SIGNUM("signum", Math::signum);

    private final String functionName;
    private final DoubleUnaryOperator operator;

    MathFunction(String functionName, DoubleUnaryOperator operator) {
        this.functionName = functionName;
        this.operator = operator;
    }

    public double apply(double argument) {
        return operator.applyAsDouble(argument);
    }

    public static Optional<MathFunction> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (MathFunction function : values()) {
            if (function.functionName.equals(lower)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    public static boolean isBuiltIn(String name) {
        return lookup(name).isPresent();
    }
}
