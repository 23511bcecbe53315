package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.expr.MatchArm;

import java.util.List;

/**
 * match 语句，分支体为代码块；按书写顺序取第一个匹配的分支
 */
public class MatchStmt extends Statement {
    private final Expression scrutinee;
    private final List<MatchArm> arms;

    public MatchStmt(SourceLocation location, Expression scrutinee, List<MatchArm> arms) {
        super(location);
        this.scrutinee = scrutinee;
        this.arms = arms;
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<MatchArm> getArms() {
        return arms;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(scrutinee, arms);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchStmt(this, context);
    }
}
