package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域。父作用域以 {@link ScopeArena} 中的整数句柄引用。
 */
public final class Scope {

    public enum ScopeType {
        FILE,       // 文件顶层：结构体、接口
        CONTRACT,   // 合约体：状态变量、常量、函数
        FUNCTION,   // 函数 / 修饰器参数
        BLOCK,      // if / while / for / match 代码块
        LAMBDA      // lambda 参数
    }

    /** 根作用域的父句柄 */
    public static final int NO_PARENT = -1;

    private final int handle;
    private final ScopeType type;
    private final int parent;
    private final AstNode node;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    Scope(int handle, ScopeType type, int parent, AstNode node) {
        this.handle = handle;
        this.type = type;
        this.parent = parent;
        this.node = node;
    }

    public int getHandle() { return handle; }
    public ScopeType getType() { return type; }
    public int getParent() { return parent; }
    public AstNode getNode() { return node; }

    /** 注册符号到当前作用域 */
    void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }
}
