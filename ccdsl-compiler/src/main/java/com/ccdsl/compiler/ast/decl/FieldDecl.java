package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 结构体字段
 */
public class FieldDecl extends Declaration {
    private final TypeRef type;

    public FieldDecl(SourceLocation location, String name, TypeRef type) {
        super(location, name);
        this.type = type;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(type);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldDecl(this, context);
    }
}
