package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 修饰器声明。体内最后一条顶层语句必须是 _;
 */
public class ModifierDecl extends Declaration {
    private final List<Parameter> parameters;
    private final Block body;

    public ModifierDecl(SourceLocation location, String name, List<Parameter> parameters, Block body) {
        super(location, name);
        this.parameters = parameters;
        this.body = body;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public Block getBody() {
        return body;
    }

    public ModifierDecl withBody(Block newBody) {
        return new ModifierDecl(location, name, parameters, newBody);
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(parameters, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModifierDecl(this, context);
    }
}
