package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 参数（函数、修饰器、事件字段、lambda）。lambda 参数的类型可以省略。
 */
public class Parameter extends Declaration {
    private final TypeRef type;  // lambda 参数可为 null
    private Symbol symbol;

    public Parameter(SourceLocation location, String name, TypeRef type) {
        super(location, name);
        this.type = type;
    }

    public TypeRef getType() {
        return type;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public void setSymbol(Symbol symbol) {
        this.symbol = symbol;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(type);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
