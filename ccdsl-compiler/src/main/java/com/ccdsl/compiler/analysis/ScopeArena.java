package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 作用域竞技场：所有作用域按创建顺序存放，以整数句柄互相引用。
 *
 * <p>只在一次合约分析期间存在，由 {@link SemanticAnalyzer} 独占。</p>
 */
final class ScopeArena {
    private final List<Scope> scopes = new ArrayList<Scope>();

    int create(Scope.ScopeType type, int parent, AstNode node) {
        int handle = scopes.size();
        scopes.add(new Scope(handle, type, parent, node));
        return handle;
    }

    Scope get(int handle) {
        return scopes.get(handle);
    }

    int size() {
        return scopes.size();
    }

    /**
     * 从 handle 开始沿父链查找
     */
    Symbol resolve(int handle, String name) {
        int h = handle;
        while (h != Scope.NO_PARENT) {
            Scope scope = scopes.get(h);
            Symbol s = scope.resolveLocal(name);
            if (s != null) return s;
            h = scope.getParent();
        }
        return null;
    }

    /** 在指定作用域定义符号；同一作用域内重名返回已有符号且不覆盖 */
    Symbol define(int handle, Symbol symbol) {
        Scope scope = scopes.get(handle);
        Symbol existing = scope.resolveLocal(symbol.getName());
        if (existing != null) return existing;
        scope.define(symbol);
        return null;
    }
}
