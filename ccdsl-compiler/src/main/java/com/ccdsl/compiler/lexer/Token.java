package com.ccdsl.compiler.lexer;

/**
 * 词法单元。offset 为源码中的字符偏移，length 取 lexeme 长度。
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;  // NumericLiteral / String / Intrinsic
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() { return type; }
    public String getLexeme() { return lexeme; }
    public Object getLiteral() { return literal; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }
    public int getLength() { return lexeme.length(); }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) return true;
        }
        return false;
    }

    /** 用于错误消息的简短描述 */
    public String describe() {
        return type == TokenType.EOF ? "end of file" : "'" + lexeme + "'";
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ") at " + line + ":" + column;
    }
}
