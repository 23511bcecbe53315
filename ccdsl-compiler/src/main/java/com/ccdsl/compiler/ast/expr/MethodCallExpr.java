package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 内置集合方法调用 receiver.method(args)，方法限于 len / push / map / filter
 */
public class MethodCallExpr extends Expression {
    private final Expression receiver;
    private final String methodName;
    private final List<Expression> arguments;

    public MethodCallExpr(SourceLocation location, Expression receiver, String methodName,
                          List<Expression> arguments) {
        super(location);
        this.receiver = receiver;
        this.methodName = methodName;
        this.arguments = arguments;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(receiver, arguments);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCallExpr(this, context);
    }
}
