package com.ccdsl.compiler.ast.type;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

public class TupleTypeRef extends TypeRef {
    private final List<TypeRef> elementTypes;

    public TupleTypeRef(SourceLocation location, List<TypeRef> elementTypes) {
        super(location);
        this.elementTypes = elementTypes;
    }

    public List<TypeRef> getElementTypes() {
        return elementTypes;
    }

    @Override
    public String toSourceString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elementTypes.get(i).toSourceString());
        }
        return sb.append(')').toString();
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(elementTypes);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleTypeRef(this, context);
    }
}
