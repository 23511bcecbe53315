package com.ccdsl.compiler.types;

public final class OptionType extends Type {
    private final Type innerType;

    public OptionType(Type innerType) {
        this.innerType = innerType;
    }

    public Type getInnerType() { return innerType; }

    @Override
    public Kind getKind() {
        return Kind.OPTION;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof OptionType && innerType.equals(((OptionType) o).innerType));
    }

    @Override
    public int hashCode() {
        return 23 * innerType.hashCode() + 4;
    }

    @Override
    public String toString() {
        return "option<" + innerType + ">";
    }
}
