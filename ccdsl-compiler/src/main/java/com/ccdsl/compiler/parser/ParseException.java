package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.lexer.Token;

/**
 * 解析异常，仅在解析器内部传播，于恢复点转为 PARSE_ERROR 诊断
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;
    private final String baseMessage;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.baseMessage = message;
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 不带位置信息的原始消息 */
    public String getBaseMessage() {
        return baseMessage;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(baseMessage);
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found ").append(token.describe()).append(')');
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
