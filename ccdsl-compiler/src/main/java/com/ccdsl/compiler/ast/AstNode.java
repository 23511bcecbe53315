package com.ccdsl.compiler.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * AST 节点基类。AST 是严格的树：任何节点都不是自己的祖先。
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /**
     * 直接子节点（按源码顺序，不含 null）
     */
    public abstract List<AstNode> getChildren();

    /** 把单个节点或节点集合展开为子节点列表 */
    protected static List<AstNode> nodes(Object... parts) {
        List<AstNode> result = new ArrayList<AstNode>();
        for (Object part : parts) {
            if (part instanceof AstNode) {
                result.add((AstNode) part);
            } else if (part instanceof Collection) {
                for (Object o : (Collection<?>) part) {
                    if (o instanceof AstNode) result.add((AstNode) o);
                }
            }
        }
        return result;
    }
}
