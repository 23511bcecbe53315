package com.ccdsl.compiler.types;

import java.math.BigInteger;

/**
 * 定宽整数类型 u8..u256 / i8..i128
 */
public final class IntegerType extends Type {

    public static final IntegerType U8 = new IntegerType(8, false);
    public static final IntegerType U16 = new IntegerType(16, false);
    public static final IntegerType U32 = new IntegerType(32, false);
    public static final IntegerType U64 = new IntegerType(64, false);
    public static final IntegerType U128 = new IntegerType(128, false);
    public static final IntegerType U256 = new IntegerType(256, false);
    public static final IntegerType I8 = new IntegerType(8, true);
    public static final IntegerType I16 = new IntegerType(16, true);
    public static final IntegerType I32 = new IntegerType(32, true);
    public static final IntegerType I64 = new IntegerType(64, true);
    public static final IntegerType I128 = new IntegerType(128, true);

    private static final IntegerType[] ALL = {U8, U16, U32, U64, U128, U256, I8, I16, I32, I64, I128};

    private final int bits;
    private final boolean signed;
    private final BigInteger min;
    private final BigInteger max;

    private IntegerType(int bits, boolean signed) {
        this.bits = bits;
        this.signed = signed;
        if (signed) {
            this.min = BigInteger.ONE.shiftLeft(bits - 1).negate();
            this.max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        } else {
            this.min = BigInteger.ZERO;
            this.max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        }
    }

    /** 按名称查找，如 "u64"；不存在返回 null */
    public static IntegerType byName(String name) {
        for (IntegerType t : ALL) {
            if (t.toString().equals(name)) return t;
        }
        return null;
    }

    public int getBits() { return bits; }
    public boolean isSigned() { return signed; }
    public BigInteger getMin() { return min; }
    public BigInteger getMax() { return max; }

    /** 值是否落在该宽度的表示范围内 */
    public boolean fits(BigInteger value) {
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    @Override
    public Kind getKind() {
        return Kind.INTEGER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerType)) return false;
        IntegerType that = (IntegerType) o;
        return bits == that.bits && signed == that.signed;
    }

    @Override
    public int hashCode() {
        return bits * 2 + (signed ? 1 : 0);
    }

    @Override
    public String toString() {
        return (signed ? "i" : "u") + bits;
    }
}
