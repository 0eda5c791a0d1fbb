package org.csu.sdplot.engine;

import lombok.Getter;
import org.csu.sdplot.catalog.FunctionRegistry;
import org.csu.sdplot.cli.tool.ResultFormatter;
import org.csu.sdplot.common.function.Function2D;
import org.csu.sdplot.common.function.Function3D;
import org.csu.sdplot.common.model.EvaluationContext;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 命令处理器：执行一行控制台命令并返回结果字符串，出错时返回以 "ERROR:" 开头的一行。
 * 所有命令共享同一个上下文和函数目录。
 */
public class CommandProcessor {

    public static final int DEFAULT_PRECISION = 10;

    private static final Pattern SET_PATTERN =
            Pattern.compile("^set\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    // 参数名 x、y 区分大小写，与表达式中的自由变量一致
    private static final Pattern DEF_PATTERN =
            Pattern.compile("^def\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*\\(\\s*(?-i:x)\\s*(,\\s*(?-i:y)\\s*)?\\)\\s*=\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEF_PREFIX_PATTERN =
            Pattern.compile("^def\\s+[A-Za-z_][A-Za-z0-9_]*\\s*\\(.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_PATTERN =
            Pattern.compile("^table\\s+(.+?)\\s+from\\s+(.+?)\\s+to\\s+(.+?)\\s+steps\\s+(\\d+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVAL_PATTERN =
            Pattern.compile("^eval\\s+(.+)$", Pattern.CASE_INSENSITIVE);

    private static final String HELP = String.join("\n",
            "Commands:",
            "  <expr> | eval <expr>                       evaluate an expression",
            "  set <name> = <expr>                        set x, y or a named variable",
            "  def <name>(x) = <expr>                     define a function of x",
            "  def <name>(x, y) = <expr>                  define a function of x and y",
            "  table <expr> from <a> to <b> steps <n>     tabulate an expression over x",
            "  vars | funcs | help | exit");

    @Getter
    private final EvaluationContext context;
    @Getter
    private final FunctionRegistry registry;
    @Getter
    private final int precision;

    public CommandProcessor() {
        this(DEFAULT_PRECISION);
    }

    public CommandProcessor(int precision) {
        this(EvaluationContext.withDefaults(), new FunctionRegistry(), precision);
    }

    public CommandProcessor(EvaluationContext context, FunctionRegistry registry, int precision) {
        if (precision < 1) {
            throw new IllegalArgumentException("Precision must be at least 1, got " + precision + ".");
        }
        this.context = context;
        this.registry = registry;
        this.precision = precision;
    }

    public String executeAndGetResult(String line) {
        try {
            String command = line == null ? "" : line.trim();
            if (command.endsWith(";")) {
                command = command.substring(0, command.length() - 1).trim();
            }
            if (command.isEmpty()) {
                return "Empty command.";
            }

            if (command.equalsIgnoreCase("help")) {
                return HELP;
            }
            if (command.equalsIgnoreCase("vars")) {
                return listVariables();
            }
            if (command.equalsIgnoreCase("funcs")) {
                return listFunctions();
            }

            Matcher matcher = SET_PATTERN.matcher(command);
            if (matcher.matches()) {
                return executeSet(matcher.group(1), matcher.group(2));
            }
            matcher = DEF_PATTERN.matcher(command);
            if (matcher.matches()) {
                return executeDef(matcher.group(1), matcher.group(2) != null, matcher.group(3));
            }
            if (DEF_PREFIX_PATTERN.matcher(command).matches()) {
                return "ERROR: Invalid function definition. Use def <name>(x) = <expr> or def <name>(x, y) = <expr>.";
            }
            matcher = TABLE_PATTERN.matcher(command);
            if (matcher.matches()) {
                return executeTable(matcher.group(1), matcher.group(2), matcher.group(3), Integer.parseInt(matcher.group(4)));
            }
            matcher = EVAL_PATTERN.matcher(command);
            if (matcher.matches()) {
                return format(evaluate(matcher.group(1)));
            }
            return format(evaluate(command));
        } catch (Exception e) {
            return "ERROR: " + e.getMessage();
        }
    }

    private String executeSet(String name, String expression) {
        double value = evaluate(expression);
        context.setVariable(name, value);
        return name + " = " + format(value);
    }

    private String executeDef(String name, boolean twoArguments, String expression) {
        // 每个函数在自己的子上下文中求值，调用它不会改动共享上下文的 x、y
        ExpressionProcessor function = new ExpressionProcessor(expression, registry, EvaluationContext.childOf(context));
        if (!function.isValid()) {
            return "ERROR: " + function.getErrorMessage();
        }
        if (twoArguments) {
            registry.register(name, (Function3D) function);
            return "Function " + name + "(x, y) defined.";
        }
        registry.register(name, (Function2D) function);
        return "Function " + name + "(x) defined.";
    }

    private String executeTable(String expression, String from, String to, int steps) {
        ExpressionProcessor function = new ExpressionProcessor(expression, registry, EvaluationContext.childOf(context));
        if (!function.isValid()) {
            return "ERROR: " + function.getErrorMessage();
        }
        List<SamplePoint> samples = FunctionSampler.sampleX(function, evaluate(from), evaluate(to), steps);
        return ResultFormatter.formatSamples(samples, precision);
    }

    private double evaluate(String expression) {
        return new ExpressionProcessor(expression, registry, context).getValue();
    }

    private String listVariables() {
        StringBuilder sb = new StringBuilder();
        sb.append("x = ").append(format(context.getX())).append("\n");
        sb.append("y = ").append(format(context.getY()));
        for (Map.Entry<String, Double> entry : context.getVariables().entrySet()) {
            sb.append("\n").append(entry.getKey()).append(" = ").append(format(entry.getValue()));
        }
        return sb.toString();
    }

    private String listFunctions() {
        List<String> names = registry.names();
        if (names.isEmpty()) {
            return "No functions defined.";
        }
        return String.join("\n", names);
    }

    private String format(double value) {
        return ResultFormatter.formatNumber(value, precision);
    }
}
