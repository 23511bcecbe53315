package com.ccdsl.compiler.ast.type;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 用户定义的结构体类型引用
 */
public class NamedTypeRef extends TypeRef {
    private final String name;

    public NamedTypeRef(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toSourceString() {
        return name;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedTypeRef(this, context);
    }
}
