package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.SourceLocation;

/**
 * 命名声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
