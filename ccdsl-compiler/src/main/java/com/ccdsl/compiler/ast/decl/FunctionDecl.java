package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.stmt.Block;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 合约函数声明
 */
public class FunctionDecl extends Declaration {
    private final Visibility visibility;
    private final List<Parameter> parameters;
    private final TypeRef returnType;  // nullable = void
    private final List<ModifierInvocation> modifiers;
    private final Block body;

    public FunctionDecl(SourceLocation location, String name, Visibility visibility,
                        List<Parameter> parameters, TypeRef returnType,
                        List<ModifierInvocation> modifiers, Block body) {
        super(location, name);
        this.visibility = visibility;
        this.parameters = parameters;
        this.returnType = returnType;
        this.modifiers = modifiers;
        this.body = body;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public boolean hasReturnType() {
        return returnType != null;
    }

    public List<ModifierInvocation> getModifiers() {
        return modifiers;
    }

    public Block getBody() {
        return body;
    }

    public FunctionDecl withBody(List<ModifierInvocation> newModifiers, Block newBody) {
        return new FunctionDecl(location, name, visibility, parameters, returnType, newModifiers, newBody);
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(parameters, returnType, modifiers, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
