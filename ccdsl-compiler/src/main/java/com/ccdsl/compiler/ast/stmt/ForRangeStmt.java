package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 区间循环 for i in start..end { }（不含 end），循环变量不可变
 */
public class ForRangeStmt extends Statement {
    private final String variable;
    private final Expression start;
    private final Expression end;
    private final Block body;
    private Symbol symbol;

    public ForRangeStmt(SourceLocation location, String variable, Expression start, Expression end, Block body) {
        super(location);
        this.variable = variable;
        this.start = start;
        this.end = end;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
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

    public ForRangeStmt withParts(Expression newStart, Expression newEnd, Block newBody) {
        ForRangeStmt copy = new ForRangeStmt(location, variable, newStart, newEnd, newBody);
        copy.symbol = symbol;
        return copy;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(start, end, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForRangeStmt(this, context);
    }
}
