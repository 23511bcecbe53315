package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.Parameter;

import java.util.List;

/**
 * lambda |x| body，参数类型可省略（由 map / filter 的接收者元素类型推断）
 */
public class LambdaExpr extends Expression {
    private final List<Parameter> parameters;
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<Parameter> parameters, Expression body) {
        super(location);
        this.parameters = parameters;
        this.body = body;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(parameters, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
