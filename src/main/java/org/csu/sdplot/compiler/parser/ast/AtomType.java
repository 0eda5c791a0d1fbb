package org.csu.sdplot.compiler.parser.ast;

/**
 * 叶子节点 (原子) 的分类标签。
 */
public enum AtomType {
    VARIABLE,
    NUMBER,
    MATH_FUNCTION,
    FUNCTION_X,
    FUNCTION_X_Y,
    INVALID
}
