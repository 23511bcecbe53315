package com.ccdsl.compiler.ast.stmt;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 修饰器体中的 _; 占位，标记被修饰函数体的位置
 */
public class PlaceholderStmt extends Statement {

    public PlaceholderStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPlaceholderStmt(this, context);
    }
}
