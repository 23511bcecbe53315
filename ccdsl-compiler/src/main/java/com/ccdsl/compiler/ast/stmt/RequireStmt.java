package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;

import java.util.List;

/**
 * require(cond, "message");
 *
 * <p>revert("message") 解析为条件恒为 false 的 require，{@link #isRevert()} 为 true。</p>
 */
public class RequireStmt extends Statement {
    private final Expression condition;
    private final String message;  // nullable
    private final boolean revert;

    public RequireStmt(SourceLocation location, Expression condition, String message, boolean revert) {
        super(location);
        this.condition = condition;
        this.message = message;
        this.revert = revert;
    }

    public Expression getCondition() {
        return condition;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRevert() {
        return revert;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(condition);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRequireStmt(this, context);
    }
}
