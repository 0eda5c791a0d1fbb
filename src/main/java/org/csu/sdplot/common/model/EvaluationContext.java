package org.csu.sdplot.common.model;

import lombok.Getter;
import lombok.Setter;
import org.csu.sdplot.common.exception.ExpressionFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 求值上下文：保存自由变量 x、y 的当前值以及命名变量。
 * <p>
 * 表达式树中的节点只持有对它的引用，不负责它的生命周期；
 * 由上下文的持有者决定何时写入 x / y，节点每次求值都读取最新的值。
 * <p>
 * 子上下文拥有独立的 x、y，命名变量找不到时回退到父上下文，
 * 这样每个用户函数可以在自己的 x、y 上求值而不改动调用者的值。
 */
public class EvaluationContext {

    public static final String X = "x";
    public static final String Y = "y";

    @Getter
    @Setter
    private double x;
    @Getter
    @Setter
    private double y;

    private final Map<String, Double> variables = new HashMap<>();
    private final EvaluationContext parent;

    public EvaluationContext() {
        this(null);
    }

    private EvaluationContext(EvaluationContext parent) {
        this.parent = parent;
    }

    public static EvaluationContext childOf(EvaluationContext parent) {
        if (parent == null) {
            throw new IllegalArgumentException("Parent context must not be null.");
        }
        return new EvaluationContext(parent);
    }

    /**
     * 预置了常量 pi 和 e 的上下文。
     */
    public static EvaluationContext withDefaults() {
        EvaluationContext context = new EvaluationContext();
        context.setVariable("pi", Math.PI);
        context.setVariable("e", Math.E);
        return context;
    }

    public boolean hasVariable(String name) {
        if (X.equals(name) || Y.equals(name) || variables.containsKey(name)) {
            return true;
        }
        return parent != null && parent.hasVariable(name);
    }

    /**
     * @throws ExpressionFormatException 如果变量不存在
     */
    public double getVariable(String name) {
        if (X.equals(name)) {
            return x;
        }
        if (Y.equals(name)) {
            return y;
        }
        Double value = variables.get(name);
        if (value == null && parent != null && parent.hasVariable(name)) {
            return parent.getVariable(name);
        }
        if (value == null) {
            throw new ExpressionFormatException("Variable '" + name + "' is not defined.");
        }
        return value;
    }

    /**
     * 写入一个变量，"x" 和 "y" 会直接写到自由变量上。
     */
    public void setVariable(String name, double value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name must not be empty.");
        }
        if (X.equals(name)) {
            this.x = value;
        } else if (Y.equals(name)) {
            this.y = value;
        } else {
            variables.put(name, value);
        }
    }

    public boolean removeVariable(String name) {
        return variables.remove(name) != null;
    }

    /**
     * @return 按名称排序的命名变量 (不含 x、y)，包括从父上下文继承的
     */
    public List<String> getVariableNames() {
        return new ArrayList<>(getVariables().keySet());
    }

    /**
     * @return 按名称排序的命名变量快照，本上下文的值覆盖父上下文的同名变量
     */
    public Map<String, Double> getVariables() {
        Map<String, Double> merged = new TreeMap<>();
        if (parent != null) {
            merged.putAll(parent.getVariables());
        }
        merged.putAll(variables);
        return Collections.unmodifiableMap(merged);
    }
}
