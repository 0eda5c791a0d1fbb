package org.csu.sdplot.compiler.parser.ast;

import org.csu.sdplot.common.exception.ExpressionFormatException;

/**
 * 表达式树中的节点。所有节点 (常量、变量、运算符、函数调用) 都提供同样的两个操作。
 */
public interface TreeElement {

    /**
     * 计算该节点 (及其子树) 的数值。
     *
     * @throws ExpressionFormatException 如果子树中有无效节点
     */
    double getValue();

    /**
     * @return 该节点的值是否依赖自由变量 x 或 y
     */
    boolean isVariable();
}
