package org.csu.sdplot.compiler.lexer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的数学表达式字符串分解为一系列的Token。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 变量映射表，区分大小写："X" 是一个普通的命名变量
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("x", TokenType.X_VAR);
        keywords.put("y", TokenType.Y_VAR);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        // 识别标识符或变量
        if (isLetter(currentChar)) {
            return readIdentifierOrVariable();
        }

        // 识别数字，".5" 这种写法也算
        if (isDigit(currentChar) || (currentChar == '.' && isDigit(peekNext()))) {
            return readNumber();
        }

        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '/':
                return consumeAndReturn(TokenType.SLASH, "/");
            case '^':
                return consumeAndReturn(TokenType.CARET, "^");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            default:
                return consumeAndReturn(TokenType.ILLEGAL, String.valueOf(currentChar));
        }
    }

    private Token readIdentifierOrVariable() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        if (position < input.length() && peek() == '.') {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }

        // 指数部分：只有在 e 后面确实跟着数字时才消耗，否则 "2e" 中的 e 留给标识符
        if (position < input.length() && (peek() == 'e' || peek() == 'E')) {
            char afterE = peekNext();
            boolean signed = afterE == '+' || afterE == '-';
            char firstDigit = signed ? peekAt(position + 2) : afterE;
            if (isDigit(firstDigit)) {
                advance(); // 'e'
                if (signed) {
                    advance();
                }
                while (position < input.length() && isDigit(peek())) {
                    advance();
                }
            }
        }

        String number = input.substring(startPos, position);
        return new Token(TokenType.NUMBER, number, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                advance();
            } else if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else {
                break;
            }
        }
    }

    private char peek() {
        return peekAt(position);
    }

    private char peekNext() {
        return peekAt(position + 1);
    }

    private char peekAt(int index) {
        if (index >= input.length()) return '\0';
        return input.charAt(index);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
