package org.csu.sdplot.compiler.semantic;

import org.csu.sdplot.common.exception.SemanticException;
import org.csu.sdplot.compiler.parser.ast.Atom;
import org.csu.sdplot.compiler.parser.ast.TreeElement;
import org.csu.sdplot.compiler.parser.ast.atom.FunctionXAtom;
import org.csu.sdplot.compiler.parser.ast.atom.FunctionXYAtom;
import org.csu.sdplot.compiler.parser.ast.atom.MathFunctionAtom;
import org.csu.sdplot.compiler.parser.ast.atom.NumberAtom;
import org.csu.sdplot.compiler.parser.ast.atom.VariableAtom;
import org.csu.sdplot.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.sdplot.compiler.parser.ast.expression.UnaryExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 语义分析器
 * 负责在求值之前找出表达式树中所有 INVALID 的节点 (未知变量、未知函数、非法数字)。
 */
public class SemanticAnalyzer {

    /**
     * @throws SemanticException 描述遇到的第一个无效节点
     */
    public void analyze(TreeElement root) {
        List<String> errors = collectErrors(root);
        if (!errors.isEmpty()) {
            throw new SemanticException(errors.get(0));
        }
    }

    /**
     * @return 按从左到右顺序列出的全部问题，没有问题时为空列表
     */
    public List<String> collectErrors(TreeElement root) {
        List<String> errors = new ArrayList<>();
        visit(root, errors);
        return errors;
    }

    private void visit(TreeElement node, List<String> errors) {
        if (node instanceof BinaryExpressionNode binary) {
            visit(binary.left(), errors);
            visit(binary.right(), errors);
        } else if (node instanceof UnaryExpressionNode unary) {
            visit(unary.operand(), errors);
        } else if (node instanceof MathFunctionAtom mathFunction) {
            checkAtom(mathFunction, errors);
            visit(mathFunction.getArgument(), errors);
        } else if (node instanceof FunctionXAtom functionX) {
            checkAtom(functionX, errors);
            visit(functionX.getArgument(), errors);
        } else if (node instanceof FunctionXYAtom functionXY) {
            checkAtom(functionXY, errors);
            visit(functionXY.getFirstArgument(), errors);
            visit(functionXY.getSecondArgument(), errors);
        } else if (node instanceof Atom atom) {
            checkAtom(atom, errors);
        } else if (node == null) {
            errors.add("Empty expression.");
        }
    }

    private void checkAtom(Atom atom, List<String> errors) {
        if (atom.isValid()) {
            return;
        }
        errors.add(describe(atom));
    }

    private String describe(Atom atom) {
        if (atom instanceof VariableAtom variable) {
            return "Unknown variable '" + variable.getName() + "'.";
        }
        if (atom instanceof MathFunctionAtom mathFunction) {
            return "Unknown math function '" + mathFunction.getName() + "'.";
        }
        if (atom instanceof FunctionXAtom functionX) {
            return "Unknown function '" + functionX.getName() + "' with one argument.";
        }
        if (atom instanceof FunctionXYAtom functionXY) {
            return "Unknown function '" + functionXY.getName() + "' with two arguments.";
        }
        if (atom instanceof NumberAtom number) {
            return "Malformed number '" + number.getLexeme() + "'.";
        }
        return "Invalid element '" + atom + "'.";
    }
}
