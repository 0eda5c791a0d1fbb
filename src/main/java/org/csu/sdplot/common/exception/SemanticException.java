package org.csu.sdplot.common.exception;

/**
 * @description: 语义分析阶段的自定义异常 (未知变量、未知函数、非法数字)
 */
public class SemanticException extends RuntimeException {
    public SemanticException(String message) {
        super(message);
    }
}
