package org.csu.sdplot.compiler.lexer;

/**
 * @description: 定义数学表达式中词法单元（Token）的类型，即“种别码”
 */
public enum TokenType {
    // ---- 自由变量 (区分大小写) ----
    X_VAR,      // "x"
    Y_VAR,      // "y"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 函数名、命名变量

    // ---- 常量 (Constants) ----
    NUMBER,     // e.g., 42, 3.14, .5, 1.2e-3

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    MINUS,      // -
    ASTERISK,   // *
    SLASH,      // /
    CARET,      // ^

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )
    COMMA,      // ,

    // ---- 特殊 Token ----
    EOF,        // End-Of-File，表示输入流结束
    ILLEGAL     // 非法字符，用于错误处理
}
