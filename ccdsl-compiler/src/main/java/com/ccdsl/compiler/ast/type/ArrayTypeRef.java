package com.ccdsl.compiler.ast.type;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 定长数组类型 [T; N]
 */
public class ArrayTypeRef extends TypeRef {
    private final TypeRef elementType;
    private final int size;

    public ArrayTypeRef(SourceLocation location, TypeRef elementType, int size) {
        super(location);
        this.elementType = elementType;
        this.size = size;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public int getSize() {
        return size;
    }

    @Override
    public String toSourceString() {
        return "[" + elementType.toSourceString() + "; " + size + "]";
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(elementType);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayTypeRef(this, context);
    }
}
