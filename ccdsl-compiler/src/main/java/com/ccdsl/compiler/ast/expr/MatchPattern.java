package com.ccdsl.compiler.ast.expr;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.List;

/**
 * match 分支模式：通配 _、字面量、半开整数区间 low..high
 */
public class MatchPattern extends AstNode {
    private final PatternKind kind;
    private final Literal low;    // LITERAL / RANGE
    private final Literal high;   // 仅 RANGE，不含上界

    public MatchPattern(SourceLocation location, PatternKind kind, Literal low, Literal high) {
        super(location);
        this.kind = kind;
        this.low = low;
        this.high = high;
    }

    public static MatchPattern wildcard(SourceLocation location) {
        return new MatchPattern(location, PatternKind.WILDCARD, null, null);
    }

    public PatternKind getKind() {
        return kind;
    }

    public Literal getLow() {
        return low;
    }

    public Literal getHigh() {
        return high;
    }

    public boolean isWildcard() {
        return kind == PatternKind.WILDCARD;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(low, high);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchPattern(this, context);
    }

    public enum PatternKind {
        WILDCARD, LITERAL, RANGE
    }
}
