package com.ccdsl.compiler.lexer;

import java.math.BigInteger;

/**
 * 整数字面量的值与可选类型后缀（如 255u8 的 "u8"）
 */
public final class NumericLiteral {
    private final BigInteger value;
    private final String suffix;  // nullable

    public NumericLiteral(BigInteger value, String suffix) {
        this.value = value;
        this.suffix = suffix;
    }

    public BigInteger getValue() { return value; }
    public String getSuffix() { return suffix; }

    @Override
    public String toString() {
        return suffix != null ? value + suffix : value.toString();
    }
}
