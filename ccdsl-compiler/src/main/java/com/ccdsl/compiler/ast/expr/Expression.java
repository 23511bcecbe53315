package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.types.Type;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
    // 类型信息（语义分析后填充，此后只读）
    protected Type type;

    protected Expression(SourceLocation location) {
        super(location);
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }
}
