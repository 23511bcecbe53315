package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 接口声明：只有函数签名，由 implements 它的合约实现
 */
public class InterfaceDecl extends Declaration {
    private final List<FunctionSignature> functions;

    public InterfaceDecl(SourceLocation location, String name, List<FunctionSignature> functions) {
        super(location, name);
        this.functions = functions;
    }

    public List<FunctionSignature> getFunctions() {
        return functions;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(functions);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInterfaceDecl(this, context);
    }
}
