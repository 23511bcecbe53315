package com.ccdsl.compiler.ast.type;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 内置泛型类型：map&lt;K, V&gt;, vec&lt;T&gt;, option&lt;T&gt;, result&lt;T, E&gt;
 */
public class GenericTypeRef extends TypeRef {
    private final String name;
    private final List<TypeRef> typeArgs;

    public GenericTypeRef(SourceLocation location, String name, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = typeArgs;
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public String toSourceString() {
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).toSourceString());
        }
        return sb.append('>').toString();
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(typeArgs);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGenericTypeRef(this, context);
    }
}
