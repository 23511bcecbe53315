package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 合约函数调用 name(args)
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> arguments;
    private Symbol symbol;  // 被调函数，语义分析后填充

    public CallExpr(SourceLocation location, String callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = arguments;
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public void setSymbol(Symbol symbol) {
        this.symbol = symbol;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(arguments);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
