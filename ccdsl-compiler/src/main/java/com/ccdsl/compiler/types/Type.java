package com.ccdsl.compiler.types;

/**
 * 语义类型基类（标签联合）。
 *
 * <p>类型按结构比较；命名结构体按名称加字段签名比较。{@code toString()} 给出 DSL 源码写法。</p>
 */
public abstract class Type {

    public enum Kind {
        INTEGER, BOOL, ADDRESS, STRING, BYTES, VOID,
        MAP, VECTOR, ARRAY, TUPLE, STRUCT, OPTION, RESULT,
        LAMBDA,
        /** 已报告过错误的表达式，抑制级联诊断 */
        ERROR
    }

    public abstract Kind getKind();

    public boolean isInteger() {
        return getKind() == Kind.INTEGER;
    }

    public boolean isUnsignedInteger() {
        return isInteger() && !((IntegerType) this).isSigned();
    }

    public boolean isBool() {
        return getKind() == Kind.BOOL;
    }

    public boolean isVoid() {
        return getKind() == Kind.VOID;
    }

    public boolean isError() {
        return getKind() == Kind.ERROR;
    }

    /**
     * 是否可作为 target 使用。错误类型与任何类型兼容。
     */
    public boolean isAssignableTo(Type target) {
        if (isError() || target.isError()) return true;
        return equals(target);
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
