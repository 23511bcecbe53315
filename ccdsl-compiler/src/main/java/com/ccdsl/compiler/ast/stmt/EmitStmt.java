package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;

import java.util.List;

/**
 * emit Event(args);，实参按事件字段位置对应
 */
public class EmitStmt extends Statement {
    private final String eventName;
    private final List<Expression> arguments;

    public EmitStmt(SourceLocation location, String eventName, List<Expression> arguments) {
        super(location);
        this.eventName = eventName;
        this.arguments = arguments;
    }

    public String getEventName() {
        return eventName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(arguments);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEmitStmt(this, context);
    }
}
