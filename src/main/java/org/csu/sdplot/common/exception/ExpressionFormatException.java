package org.csu.sdplot.common.exception;

/**
 * 对一个无效 (INVALID) 的表达式节点求值时抛出。
 * 求值失败时不返回任何默认值，直接交给执行树遍历的调用者处理。
 */
public class ExpressionFormatException extends RuntimeException {

    public ExpressionFormatException(String message) {
        super(message);
    }
}
