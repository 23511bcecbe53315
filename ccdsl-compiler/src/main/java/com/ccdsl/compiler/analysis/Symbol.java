package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.types.Type;

/**
 * 符号表中的符号：类型、可变性和声明节点。
 *
 * <p>符号以对象身份区分，同名遮蔽的两个绑定是不同的符号。</p>
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final Type type;              // 函数符号为返回类型
    private final boolean mutable;        // 状态变量与 let mut 为 true
    private final AstNode declaration;    // 声明的 AST 节点
    private final int scope;              // 所在作用域句柄
    private boolean used;

    public Symbol(String name, SymbolKind kind, Type type, boolean mutable,
                  AstNode declaration, int scope) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.mutable = mutable;
        this.declaration = declaration;
        this.scope = scope;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public Type getType() { return type; }
    public boolean isMutable() { return mutable; }
    public AstNode getDeclaration() { return declaration; }
    public int getScope() { return scope; }

    public SourceLocation getLocation() {
        return declaration != null ? declaration.getLocation() : SourceLocation.UNKNOWN;
    }

    public boolean isStateVar() {
        return kind == SymbolKind.STATE_VAR;
    }

    public boolean isUsed() { return used; }
    void markUsed() { this.used = true; }

    @Override
    public String toString() {
        return kind + " " + name + ": " + type;
    }
}
