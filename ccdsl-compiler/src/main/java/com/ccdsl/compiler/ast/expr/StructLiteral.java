package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构体字面量 Name { field: value, ... }
 */
public class StructLiteral extends Expression {
    private final String structName;
    private final List<String> fieldNames;
    private final List<Expression> values;

    public StructLiteral(SourceLocation location, String structName,
                         List<String> fieldNames, List<Expression> values) {
        super(location);
        this.structName = structName;
        this.fieldNames = fieldNames;
        this.values = values;
    }

    public String getStructName() {
        return structName;
    }

    /** 与 {@link #getValues()} 一一对应，按书写顺序 */
    public List<String> getFieldNames() {
        return fieldNames;
    }

    public List<Expression> getValues() {
        return values;
    }

    public Expression getValue(String field) {
        int idx = fieldNames.indexOf(field);
        return idx >= 0 ? values.get(idx) : null;
    }

    /** 以新的字段值构造副本（字段名不变） */
    public StructLiteral withValues(List<Expression> newValues) {
        StructLiteral copy = new StructLiteral(location, structName,
                new ArrayList<String>(fieldNames), newValues);
        copy.setType(type);
        return copy;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(values);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteral(this, context);
    }
}
