package com.ccdsl.ir.pass.ast;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.analysis.SymbolKind;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.decl.ConstDecl;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.ast.decl.ModifierDecl;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.stmt.AssignStmt;
import com.ccdsl.compiler.ast.stmt.LetStmt;
import com.ccdsl.compiler.ast.stmt.Statement;
import com.ccdsl.ir.pass.AstTransformer;
import com.ccdsl.ir.pass.OptimizationPass;
import com.ccdsl.ir.pass.OptimizationStats;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 常量传播。
 * - 以字面量初始化的不可变 let：后续引用替换为该字面量
 * - 在函数内从未被赋值的 let mut 同上
 * - 初始值已折叠为字面量的合约常量
 * 按解析后的 Symbol 查找，遮蔽不会串号。只传播整数与布尔字面量。
 */
public class ConstantPropagation extends AstTransformer implements OptimizationPass {

    private OptimizationStats stats;
    private final Map<String, Literal> constants = new HashMap<String, Literal>();
    private final Map<Symbol, Literal> locals = new IdentityHashMap<Symbol, Literal>();
    private Set<Symbol> assigned = Collections.emptySet();

    @Override
    public String getName() {
        return "ConstantPropagation";
    }

    @Override
    public ContractDecl run(ContractDecl contract, OptimizationStats stats) {
        this.stats = stats;
        constants.clear();
        for (ConstDecl c : contract.getConstants()) {
            if (isPropagatable(c.getValue())) {
                constants.put(c.getName(), (Literal) c.getValue());
            }
        }
        return transformContract(contract);
    }

    @Override
    protected FunctionDecl transformFunction(FunctionDecl function) {
        enterBody(function.getBody());
        return super.transformFunction(function);
    }

    @Override
    protected ModifierDecl transformModifier(ModifierDecl modifier) {
        enterBody(modifier.getBody());
        return super.transformModifier(modifier);
    }

    private void enterBody(AstNode body) {
        locals.clear();
        assigned = Collections.newSetFromMap(new IdentityHashMap<Symbol, Boolean>());
        collectAssigned(body);
    }

    @Override
    protected Statement transformStmt(Statement stmt) {
        Statement result = super.transformStmt(stmt);
        if (result instanceof LetStmt) {
            LetStmt let = (LetStmt) result;
            Symbol symbol = let.getSymbol();
            if (symbol != null && isPropagatable(let.getInitializer())
                    && (!let.isMutable() || !assigned.contains(symbol))) {
                locals.put(symbol, (Literal) let.getInitializer());
            }
        }
        return result;
    }

    @Override
    protected Expression transformExpr(Expression expr) {
        if (expr instanceof Identifier) {
            Identifier id = (Identifier) expr;
            Literal value = lookup(id.getSymbol());
            if (value != null) {
                stats.propagated();
                return rewrite(expr, copyLiteral(value, id.getLocation()));
            }
            return expr;
        }
        return super.transformExpr(expr);
    }

    private Literal lookup(Symbol symbol) {
        if (symbol == null) return null;
        if (symbol.getKind() == SymbolKind.CONSTANT) {
            return constants.get(symbol.getName());
        }
        if (symbol.getKind() == SymbolKind.LOCAL) {
            return locals.get(symbol);
        }
        return null;
    }

    // ==================== 辅助方法 ====================

    private static boolean isPropagatable(Expression expr) {
        if (!(expr instanceof Literal)) return false;
        Literal lit = (Literal) expr;
        return (lit.isInteger() || lit.isBool()) && lit.getType() != null;
    }

    /**
     * 收集被赋值（或 push）过的局部符号：赋值目标与 push 接收者的根标识符
     */
    private void collectAssigned(AstNode node) {
        if (node == null) return;
        if (node instanceof AssignStmt) {
            markRoot(((AssignStmt) node).getTarget());
        } else if (node instanceof MethodCallExpr) {
            MethodCallExpr mc = (MethodCallExpr) node;
            if ("push".equals(mc.getMethodName())) {
                markRoot(mc.getReceiver());
            }
        }
        for (AstNode child : node.getChildren()) {
            collectAssigned(child);
        }
    }

    private void markRoot(Expression target) {
        Expression current = target;
        while (current instanceof FieldAccessExpr || current instanceof IndexExpr) {
            current = current instanceof FieldAccessExpr
                    ? ((FieldAccessExpr) current).getTarget()
                    : ((IndexExpr) current).getTarget();
        }
        if (current instanceof Identifier && ((Identifier) current).getSymbol() != null) {
            assigned.add(((Identifier) current).getSymbol());
        }
    }
}
