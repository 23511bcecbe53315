package com.ccdsl.compiler.types;

import java.util.Collections;
import java.util.List;

/**
 * lambda 的内部类型，只出现在 map/filter 的实参上
 */
public final class LambdaType extends Type {
    private final List<Type> parameterTypes;
    private final Type resultType;

    public LambdaType(List<Type> parameterTypes, Type resultType) {
        this.parameterTypes = Collections.unmodifiableList(parameterTypes);
        this.resultType = resultType;
    }

    public List<Type> getParameterTypes() { return parameterTypes; }
    public Type getResultType() { return resultType; }

    @Override
    public Kind getKind() {
        return Kind.LAMBDA;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LambdaType)) return false;
        LambdaType that = (LambdaType) o;
        return parameterTypes.equals(that.parameterTypes) && resultType.equals(that.resultType);
    }

    @Override
    public int hashCode() {
        return parameterTypes.hashCode() * 31 + resultType.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameterTypes.get(i));
        }
        return sb.append("| -> ").append(resultType).toString();
    }
}
