package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.stmt.*;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;
import com.ccdsl.compiler.types.Type;

import java.util.List;

/**
 * 语义验证：诊断报告、类型兼容性检查和控制流判定。
 */
final class SemanticChecker {

    private final DiagnosticCollector diagnostics;

    SemanticChecker(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    // ============ 报告 ============

    void error(DiagnosticCode code, String message, AstNode node) {
        diagnostics.error(code, message, locationOf(node));
    }

    void warning(DiagnosticCode code, String message, AstNode node) {
        diagnostics.warning(code, message, locationOf(node));
    }

    /** 在当前作用域重复声明 */
    void duplicate(String what, String name, Symbol existing, AstNode node) {
        String where = existing != null && existing.getLocation().getLine() > 0
                ? " (first declared at line " + existing.getLocation().getLine() + ")" : "";
        error(DiagnosticCode.DUPLICATE_DECLARATION,
                "Duplicate " + what + " '" + name + "'" + where, node);
    }

    void undefined(String what, String name, AstNode node) {
        error(DiagnosticCode.UNDEFINED_SYMBOL, "Undefined " + what + " '" + name + "'", node);
    }

    /**
     * 类型兼容性检查，不兼容时报告 TYPE_MISMATCH 并返回 false
     */
    boolean checkAssignable(Type expected, Type actual, AstNode node) {
        if (expected == null || actual == null) return true;
        if (actual.isAssignableTo(expected)) return true;
        error(DiagnosticCode.TYPE_MISMATCH, mismatch(expected, actual), node);
        return false;
    }

    static String mismatch(Type expected, Type actual) {
        return "Type mismatch: expected " + expected + ", found " + actual;
    }

    private static SourceLocation locationOf(AstNode node) {
        return node != null ? node.getLocation() : SourceLocation.UNKNOWN;
    }

    // ============ 控制流 ============

    /**
     * 语句是否在所有路径上终止（return、revert、require(false)、全分支终止的 if/else 与带 _ 的 match）
     */
    static boolean terminates(Statement stmt) {
        if (stmt instanceof ReturnStmt) return true;
        if (stmt instanceof RequireStmt) {
            RequireStmt req = (RequireStmt) stmt;
            return req.isRevert() || isFalseLiteral(req.getCondition());
        }
        if (stmt instanceof Block) {
            for (Statement s : ((Block) stmt).getStatements()) {
                if (terminates(s)) return true;
            }
            return false;
        }
        if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            return ifStmt.hasElse() && terminates(ifStmt.getThenBranch())
                    && terminates(ifStmt.getElseBranch());
        }
        if (stmt instanceof MatchStmt) {
            MatchStmt match = (MatchStmt) stmt;
            if (!hasWildcard(match.getArms())) return false;
            for (MatchArm arm : match.getArms()) {
                if (!terminates(arm.getBlock())) return false;
            }
            return true;
        }
        return false;
    }

    static boolean hasWildcard(List<MatchArm> arms) {
        for (MatchArm arm : arms) {
            if (arm.getPattern().isWildcard()) return true;
        }
        return false;
    }

    private static boolean isFalseLiteral(Expression expr) {
        return expr instanceof Literal && ((Literal) expr).isFalse();
    }

    // ============ 表达式形态 ============

    /**
     * 常量表达式：字面量、运算符、类型转换和其他常量
     */
    static boolean isConstantExpression(Expression expr) {
        if (expr instanceof Literal) return true;
        if (expr instanceof Identifier) {
            Symbol symbol = ((Identifier) expr).getSymbol();
            return symbol == null || symbol.getKind() == SymbolKind.CONSTANT;
        }
        if (expr instanceof UnaryExpr) {
            return isConstantExpression(((UnaryExpr) expr).getOperand());
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            return isConstantExpression(bin.getLeft()) && isConstantExpression(bin.getRight());
        }
        if (expr instanceof TernaryExpr) {
            TernaryExpr t = (TernaryExpr) expr;
            return isConstantExpression(t.getCondition()) && isConstantExpression(t.getThenExpr())
                    && isConstantExpression(t.getElseExpr());
        }
        if (expr instanceof CastExpr) {
            return isConstantExpression(((CastExpr) expr).getOperand());
        }
        return false;
    }

    /**
     * 类型取决于上下文的表达式：无后缀整数字面量及其运算组合
     */
    static boolean isContextTyped(Expression expr) {
        if (expr instanceof Literal) {
            Literal lit = (Literal) expr;
            return lit.isInteger() && lit.getSuffix() == null;
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            return unary.getOperator() == UnaryExpr.UnaryOp.NEG && isContextTyped(unary.getOperand());
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            return bin.getOperator().isArithmetic()
                    && isContextTyped(bin.getLeft()) && isContextTyped(bin.getRight());
        }
        if (expr instanceof TernaryExpr) {
            TernaryExpr t = (TernaryExpr) expr;
            return isContextTyped(t.getThenExpr()) && isContextTyped(t.getElseExpr());
        }
        return false;
    }

    /**
     * 赋值目标的根标识符（a.b[c] 的 a），不是左值时返回 null
     */
    static Identifier assignmentRoot(Expression target) {
        Expression current = target;
        while (true) {
            if (current instanceof Identifier) return (Identifier) current;
            if (current instanceof FieldAccessExpr) {
                current = ((FieldAccessExpr) current).getTarget();
            } else if (current instanceof IndexExpr) {
                current = ((IndexExpr) current).getTarget();
            } else {
                return null;
            }
        }
    }
}
