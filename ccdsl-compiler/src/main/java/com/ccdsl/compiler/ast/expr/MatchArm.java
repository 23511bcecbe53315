package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.stmt.Block;

import java.util.List;

/**
 * match 分支。match 语句的分支体是 {@link Block}，match 表达式的分支体是 {@link Expression}。
 */
public class MatchArm extends AstNode {
    private final MatchPattern pattern;
    private final AstNode body;

    public MatchArm(SourceLocation location, MatchPattern pattern, AstNode body) {
        super(location);
        this.pattern = pattern;
        this.body = body;
    }

    public MatchPattern getPattern() {
        return pattern;
    }

    public AstNode getBody() {
        return body;
    }

    public Block getBlock() {
        return (Block) body;
    }

    public Expression getValue() {
        return (Expression) body;
    }

    public MatchArm withBody(AstNode newBody) {
        return new MatchArm(location, pattern, newBody);
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(pattern, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchArm(this, context);
    }
}
