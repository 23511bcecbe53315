package com.ccdsl.compiler.types;

/**
 * 定长数组 [T; N]
 */
public final class ArrayType extends Type {
    private final Type elementType;
    private final int size;

    public ArrayType(Type elementType, int size) {
        this.elementType = elementType;
        this.size = size;
    }

    public Type getElementType() { return elementType; }
    public int getSize() { return size; }

    @Override
    public Kind getKind() {
        return Kind.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) o;
        return size == that.size && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return 19 * elementType.hashCode() + size;
    }

    @Override
    public String toString() {
        return "[" + elementType + "; " + size + "]";
    }
}
