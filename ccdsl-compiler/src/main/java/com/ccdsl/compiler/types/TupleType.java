package com.ccdsl.compiler.types;

import java.util.Collections;
import java.util.List;

public final class TupleType extends Type {
    private final List<Type> elementTypes;

    public TupleType(List<Type> elementTypes) {
        this.elementTypes = Collections.unmodifiableList(elementTypes);
    }

    public List<Type> getElementTypes() { return elementTypes; }

    @Override
    public Kind getKind() {
        return Kind.TUPLE;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TupleType && elementTypes.equals(((TupleType) o).elementTypes));
    }

    @Override
    public int hashCode() {
        return elementTypes.hashCode() + 3;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elementTypes.get(i));
        }
        return sb.append(')').toString();
    }
}
