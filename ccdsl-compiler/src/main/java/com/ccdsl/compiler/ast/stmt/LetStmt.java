package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 局部绑定 let [mut] name[: T] = init;
 */
public class LetStmt extends Statement {
    private final String name;
    private final boolean mutable;
    private final TypeRef declaredType;  // nullable
    private final Expression initializer;
    private Symbol symbol;

    public LetStmt(SourceLocation location, String name, boolean mutable,
                   TypeRef declaredType, Expression initializer) {
        super(location);
        this.name = name;
        this.mutable = mutable;
        this.declaredType = declaredType;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public boolean isMutable() {
        return mutable;
    }

    public TypeRef getDeclaredType() {
        return declaredType;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public void setSymbol(Symbol symbol) {
        this.symbol = symbol;
    }

    /** 以新的初始化表达式构造副本，保留符号绑定 */
    public LetStmt withInitializer(Expression newInit) {
        LetStmt copy = new LetStmt(location, name, mutable, declaredType, newInit);
        copy.symbol = symbol;
        return copy;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(declaredType, initializer);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
