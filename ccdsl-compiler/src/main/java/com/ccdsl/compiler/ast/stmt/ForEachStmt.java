package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 遍历循环 for item in collection { }（vec 或定长数组）
 */
public class ForEachStmt extends Statement {
    private final String variable;
    private final Expression iterable;
    private final Block body;
    private Symbol symbol;

    public ForEachStmt(SourceLocation location, String variable, Expression iterable, Block body) {
        super(location);
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public void setSymbol(Symbol symbol) {
        this.symbol = symbol;
    }

    public ForEachStmt withParts(Expression newIterable, Block newBody) {
        ForEachStmt copy = new ForEachStmt(location, variable, newIterable, newBody);
        copy.symbol = symbol;
        return copy;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(iterable, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForEachStmt(this, context);
    }
}
