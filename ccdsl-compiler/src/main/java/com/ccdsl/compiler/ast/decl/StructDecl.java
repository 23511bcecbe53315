package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

public class StructDecl extends Declaration {
    private final List<FieldDecl> fields;

    public StructDecl(SourceLocation location, String name, List<FieldDecl> fields) {
        super(location, name);
        this.fields = fields;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(fields);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
