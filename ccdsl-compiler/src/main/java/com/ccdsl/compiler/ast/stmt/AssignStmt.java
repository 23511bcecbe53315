package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 赋值 target = value;，target 为标识符、字段访问或索引访问
 */
public class AssignStmt extends Statement {
    private final Expression target;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(target, value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
