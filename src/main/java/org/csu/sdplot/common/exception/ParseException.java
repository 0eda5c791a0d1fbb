package org.csu.sdplot.common.exception;

import org.csu.sdplot.compiler.lexer.Token;

/**
 * 语法分析阶段的异常，携带出错 Token 的位置信息。
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                token.line(),
                token.column(),
                expected,
                token.lexeme(),
                token.type()));
    }
}
