package com.ccdsl.compiler.types;

/**
 * 变长向量 vec&lt;T&gt;
 */
public final class VectorType extends Type {
    private final Type elementType;

    public VectorType(Type elementType) {
        this.elementType = elementType;
    }

    public Type getElementType() { return elementType; }

    @Override
    public Kind getKind() {
        return Kind.VECTOR;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof VectorType && elementType.equals(((VectorType) o).elementType));
    }

    @Override
    public int hashCode() {
        return 17 * elementType.hashCode() + 2;
    }

    @Override
    public String toString() {
        return "vec<" + elementType + ">";
    }
}
