package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 函数头上的修饰器应用，如 onlyOwner 或 onlyRole(1)
 */
public class ModifierInvocation extends AstNode {
    private final String name;
    private final List<Expression> arguments;

    public ModifierInvocation(SourceLocation location, String name, List<Expression> arguments) {
        super(location);
        this.name = name;
        this.arguments = arguments;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public ModifierInvocation withArguments(List<Expression> newArgs) {
        return new ModifierInvocation(location, name, newArgs);
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(arguments);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModifierInvocation(this, context);
    }
}
