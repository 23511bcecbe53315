package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 状态变量，位于合约的 state { } 块中
 */
public class StateVarDecl extends Declaration {
    private final TypeRef type;
    private final Expression defaultValue;  // nullable，常量表达式

    public StateVarDecl(SourceLocation location, String name, TypeRef type, Expression defaultValue) {
        super(location, name);
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public StateVarDecl withDefaultValue(Expression value) {
        return new StateVarDecl(location, name, type, value);
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(type, defaultValue);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStateVarDecl(this, context);
    }
}
