package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.lexer.Intrinsic;

import java.util.Collections;
import java.util.List;

/**
 * 内建链上值（msg_sender、block_number 等），裸写或调用形式均解析为本节点
 */
public class IntrinsicExpr extends Expression {
    private final Intrinsic intrinsic;

    public IntrinsicExpr(SourceLocation location, Intrinsic intrinsic) {
        super(location);
        this.intrinsic = intrinsic;
    }

    public Intrinsic getIntrinsic() {
        return intrinsic;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIntrinsicExpr(this, context);
    }
}
