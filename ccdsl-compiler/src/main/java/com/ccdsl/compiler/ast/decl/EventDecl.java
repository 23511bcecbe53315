package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 事件声明 event Name(field: T, ...);
 */
public class EventDecl extends Declaration {
    private final List<Parameter> fields;

    public EventDecl(SourceLocation location, String name, List<Parameter> fields) {
        super(location, name);
        this.fields = fields;
    }

    public List<Parameter> getFields() {
        return fields;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(fields);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventDecl(this, context);
    }
}
