package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 合约常量 const NAME: T = expr;
 */
public class ConstDecl extends Declaration {
    private final TypeRef type;
    private final Expression value;

    public ConstDecl(SourceLocation location, String name, TypeRef type, Expression value) {
        super(location, name);
        this.type = type;
        this.value = value;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    public ConstDecl withValue(Expression newValue) {
        return new ConstDecl(location, name, type, newValue);
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(type, value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstDecl(this, context);
    }
}
