package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.type.TypeRef;

import java.util.List;

public class FunctionSignature extends Declaration {
    private final List<Parameter> parameters;
    private final TypeRef returnType;  // nullable = void

    public FunctionSignature(SourceLocation location, String name, List<Parameter> parameters, TypeRef returnType) {
        super(location, name);
        this.parameters = parameters;
        this.returnType = returnType;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(parameters, returnType);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionSignature(this, context);
    }
}
