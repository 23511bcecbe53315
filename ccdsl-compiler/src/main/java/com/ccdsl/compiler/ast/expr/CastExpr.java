package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 显式整数宽度转换 expr as T
 */
public class CastExpr extends Expression {
    private final Expression operand;
    private final TypeRef targetType;

    public CastExpr(SourceLocation location, Expression operand, TypeRef targetType) {
        super(location);
        this.operand = operand;
        this.targetType = targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(operand, targetType);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
