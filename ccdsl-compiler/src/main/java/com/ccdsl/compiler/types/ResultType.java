package com.ccdsl.compiler.types;

public final class ResultType extends Type {
    private final Type okType;
    private final Type errType;

    public ResultType(Type okType, Type errType) {
        this.okType = okType;
        this.errType = errType;
    }

    public Type getOkType() { return okType; }
    public Type getErrType() { return errType; }

    @Override
    public Kind getKind() {
        return Kind.RESULT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultType)) return false;
        ResultType that = (ResultType) o;
        return okType.equals(that.okType) && errType.equals(that.errType);
    }

    @Override
    public int hashCode() {
        return 29 * okType.hashCode() + errType.hashCode() + 5;
    }

    @Override
    public String toString() {
        return "result<" + okType + ", " + errType + ">";
    }
}
