package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字段访问 target.field；元组元素访问写作 target.0
 */
public class FieldAccessExpr extends Expression {
    private final Expression target;
    private final String fieldName;

    public FieldAccessExpr(SourceLocation location, Expression target, String fieldName) {
        super(location);
        this.target = target;
        this.fieldName = fieldName;
    }

    public Expression getTarget() {
        return target;
    }

    public String getFieldName() {
        return fieldName;
    }

    public boolean isTupleIndex() {
        return !fieldName.isEmpty() && Character.isDigit(fieldName.charAt(0));
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(target);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccessExpr(this, context);
    }
}
