package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.types.IntegerType;
import com.ccdsl.compiler.types.PrimitiveType;
import com.ccdsl.compiler.types.Type;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final LiteralKind kind;
    private final Object value;
    private final String suffix;  // 整数类型后缀，nullable

    public Literal(SourceLocation location, LiteralKind kind, Object value, String suffix) {
        super(location);
        this.kind = kind;
        this.value = value;
        this.suffix = suffix;
    }

    public Literal(SourceLocation location, LiteralKind kind, Object value) {
        this(location, kind, value, null);
    }

    /** 构造已带类型的整数字面量（优化器使用） */
    public static Literal ofInteger(SourceLocation location, BigInteger value, IntegerType type) {
        Literal lit = new Literal(location, LiteralKind.INTEGER, value, null);
        lit.setType(type);
        return lit;
    }

    public static Literal ofBool(SourceLocation location, boolean value) {
        Literal lit = new Literal(location, LiteralKind.BOOL, Boolean.valueOf(value), null);
        lit.setType(PrimitiveType.BOOL);
        return lit;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public String getSuffix() {
        return suffix;
    }

    public BigInteger getIntegerValue() {
        return (BigInteger) value;
    }

    public boolean getBoolValue() {
        return (Boolean) value;
    }

    public String getStringValue() {
        return (String) value;
    }

    public boolean isInteger() { return kind == LiteralKind.INTEGER; }
    public boolean isBool() { return kind == LiteralKind.BOOL; }

    public boolean isTrue() {
        return kind == LiteralKind.BOOL && (Boolean) value;
    }

    public boolean isFalse() {
        return kind == LiteralKind.BOOL && !(Boolean) value;
    }

    /** 整数字面量是否等于给定值 */
    public boolean isIntegerValue(long v) {
        return kind == LiteralKind.INTEGER && BigInteger.valueOf(v).equals(value);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING: return "\"" + value + "\"";
            case BYTES: return "b\"" + value + "\"";
            case INTEGER:
                Type t = getType();
                return t != null ? value + "" + t : (suffix != null ? value + suffix : String.valueOf(value));
            default: return String.valueOf(value);
        }
    }

    /**
     * 字面量种类
     */
    public enum LiteralKind {
        INTEGER, BOOL, STRING, BYTES
    }
}
