package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 标识符引用。语义分析后绑定到唯一的 {@link Symbol}。
 */
public class Identifier extends Expression {
    private final String name;
    private Symbol symbol;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public void setSymbol(Symbol symbol) {
        this.symbol = symbol;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
