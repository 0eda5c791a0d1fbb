package org.csu.sdplot.catalog;

import org.csu.sdplot.common.function.Function2D;
import org.csu.sdplot.common.function.Function3D;
import org.csu.sdplot.common.model.EvaluationContext;
import org.csu.sdplot.compiler.parser.ast.atom.MathFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 用户函数目录，负责管理所有已注册的命名函数。
 * 单参数函数注册为 {@link Function2D}，双参数函数注册为 {@link Function3D}；
 * 同一个名字可以同时拥有两种元数。
 */
public class FunctionRegistry {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, Function2D> functions2D = new ConcurrentHashMap<>();
    private final Map<String, Function3D> functions3D = new ConcurrentHashMap<>();

    public void register(String name, Function2D function) {
        checkName(name);
        if (function == null) {
            throw new IllegalArgumentException("Function '" + name + "' must not be null.");
        }
        functions2D.put(name, function);
        System.out.println("Registered function " + name + "(x).");
    }

    public void register(String name, Function3D function) {
        checkName(name);
        if (function == null) {
            throw new IllegalArgumentException("Function '" + name + "' must not be null.");
        }
        functions3D.put(name, function);
        System.out.println("Registered function " + name + "(x, y).");
    }

    /**
     * @return 已注册的单参数函数，不存在时返回 null
     */
    public Function2D getFunction2D(String name) {
        return functions2D.get(name);
    }

    /**
     * @return 已注册的双参数函数，不存在时返回 null
     */
    public Function3D getFunction3D(String name) {
        return functions3D.get(name);
    }

    public boolean contains(String name) {
        return functions2D.containsKey(name) || functions3D.containsKey(name);
    }

    public boolean unregister(String name) {
        boolean removed2D = functions2D.remove(name) != null;
        boolean removed3D = functions3D.remove(name) != null;
        return removed2D || removed3D;
    }

    /**
     * @return 所有函数的签名，如 "f(x)"、"g(x, y)"，按字母排序
     */
    public List<String> names() {
        List<String> signatures = new ArrayList<>();
        functions2D.keySet().forEach(name -> signatures.add(name + "(x)"));
        functions3D.keySet().forEach(name -> signatures.add(name + "(x, y)"));
        Collections.sort(signatures);
        return signatures;
    }

    private void checkName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid function name '" + name + "'.");
        }
        if (EvaluationContext.X.equals(name) || EvaluationContext.Y.equals(name)) {
            throw new IllegalArgumentException("'" + name + "' is a free variable and cannot name a function.");
        }
        if (MathFunction.isBuiltIn(name)) {
            throw new IllegalArgumentException("'" + name + "' is a built-in math function.");
        }
    }
}
