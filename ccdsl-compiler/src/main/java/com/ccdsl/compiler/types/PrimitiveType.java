package com.ccdsl.compiler.types;

/**
 * 非整数的基础类型：bool, address, string, bytes, void，以及错误占位类型
 */
public final class PrimitiveType extends Type {

    public static final PrimitiveType BOOL = new PrimitiveType(Kind.BOOL, "bool");
    public static final PrimitiveType ADDRESS = new PrimitiveType(Kind.ADDRESS, "address");
    public static final PrimitiveType STRING = new PrimitiveType(Kind.STRING, "string");
    public static final PrimitiveType BYTES = new PrimitiveType(Kind.BYTES, "bytes");
    public static final PrimitiveType VOID = new PrimitiveType(Kind.VOID, "void");
    public static final PrimitiveType ERROR = new PrimitiveType(Kind.ERROR, "<error>");

    private final Kind kind;
    private final String name;

    private PrimitiveType(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    /** 按 DSL 名称查找；整数类型见 {@link IntegerType#byName} */
    public static PrimitiveType byName(String name) {
        if ("bool".equals(name)) return BOOL;
        if ("address".equals(name)) return ADDRESS;
        if ("string".equals(name)) return STRING;
        if ("bytes".equals(name)) return BYTES;
        return null;
    }

    @Override
    public Kind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PrimitiveType && ((PrimitiveType) o).kind == kind);
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
