package com.ccdsl.compiler.ast.type;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.types.Type;

/**
 * 源码中书写的类型引用。语义分析后携带解析出的 {@link Type}。
 */
public abstract class TypeRef extends AstNode {
    // 语义分析后填充
    protected Type resolvedType;

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    public Type getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(Type resolvedType) {
        this.resolvedType = resolvedType;
    }

    /** DSL 源码写法 */
    public abstract String toSourceString();

    @Override
    public String toString() {
        return toSourceString();
    }
}
