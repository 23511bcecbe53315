package com.ccdsl.compiler.types;

public final class MapType extends Type {
    private final Type keyType;
    private final Type valueType;

    public MapType(Type keyType, Type valueType) {
        this.keyType = keyType;
        this.valueType = valueType;
    }

    public Type getKeyType() { return keyType; }
    public Type getValueType() { return valueType; }

    @Override
    public Kind getKind() {
        return Kind.MAP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MapType)) return false;
        MapType that = (MapType) o;
        return keyType.equals(that.keyType) && valueType.equals(that.valueType);
    }

    @Override
    public int hashCode() {
        return 31 * keyType.hashCode() + valueType.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "map<" + keyType + ", " + valueType + ">";
    }
}
