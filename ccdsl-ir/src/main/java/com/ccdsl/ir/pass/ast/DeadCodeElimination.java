package com.ccdsl.ir.pass.ast;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.expr.Identifier;
import com.ccdsl.compiler.ast.expr.Literal;
import com.ccdsl.compiler.ast.stmt.*;
import com.ccdsl.ir.pass.AstTransformer;
import com.ccdsl.ir.pass.OptimizationPass;
import com.ccdsl.ir.pass.OptimizationStats;

import java.util.ArrayList;
import java.util.List;

/**
 * 死代码消除。
 * - return / revert / require(false) 之后同一块内的语句
 * - 条件为常量的 if 替换为被选中的分支（由常量折叠先处理条件）
 * - while(false)、require(true, ...)
 * - 纯字面量或标识符的表达式语句
 */
public class DeadCodeElimination extends AstTransformer implements OptimizationPass {

    private OptimizationStats stats;

    @Override
    public String getName() {
        return "DeadCodeElimination";
    }

    @Override
    public ContractDecl run(ContractDecl contract, OptimizationStats stats) {
        this.stats = stats;
        return transformContract(contract);
    }

    /**
     * else-if 链中条件为常量的分支
     */
    @Override
    protected Statement transformStmt(Statement stmt) {
        Statement result = super.transformStmt(stmt);
        if (!(result instanceof IfStmt)) return result;
        IfStmt ifStmt = (IfStmt) result;
        if (!(ifStmt.getElseBranch() instanceof IfStmt)) return result;
        IfStmt elseIf = (IfStmt) ifStmt.getElseBranch();
        Boolean cond = constantCondition(elseIf.getCondition());
        if (cond == null) return result;
        stats.removed(1);
        Statement taken = cond ? elseIf.getThenBranch() : elseIf.getElseBranch();
        return new IfStmt(ifStmt.getLocation(), ifStmt.getCondition(), ifStmt.getThenBranch(), taken);
    }

    @Override
    protected List<Statement> transformStmts(List<Statement> stmts) {
        List<Statement> base = super.transformStmts(stmts);
        List<Statement> out = new ArrayList<Statement>(base.size());
        boolean changed = base != stmts;

        for (int i = 0; i < base.size(); i++) {
            Statement stmt = base.get(i);

            if (stmt instanceof IfStmt) {
                IfStmt ifStmt = (IfStmt) stmt;
                Boolean cond = constantCondition(ifStmt.getCondition());
                if (cond != null) {
                    stats.removed(1);
                    changed = true;
                    Statement taken = cond ? ifStmt.getThenBranch() : ifStmt.getElseBranch();
                    splice(out, taken);
                    continue;
                }
            }
            if (isNoOp(stmt)) {
                stats.removed(1);
                changed = true;
                continue;
            }

            out.add(stmt);

            // 终止语句之后的都不可达
            if (isTerminator(stmt) && i < base.size() - 1) {
                stats.removed(base.size() - 1 - i);
                changed = true;
                break;
            }
        }
        return changed ? out : stmts;
    }

    /**
     * 被选中的分支：不声明局部变量的块直接展开到外层，否则保留为嵌套块
     */
    private static void splice(List<Statement> out, Statement taken) {
        if (taken == null) return;
        if (taken instanceof Block && !declaresLocals((Block) taken)) {
            out.addAll(((Block) taken).getStatements());
        } else {
            out.add(taken);
        }
    }

    private static boolean declaresLocals(Block block) {
        for (Statement s : block.getStatements()) {
            if (s instanceof LetStmt) return true;
        }
        return false;
    }

    private static boolean isNoOp(Statement stmt) {
        if (stmt instanceof WhileStmt) {
            return Boolean.FALSE.equals(constantCondition(((WhileStmt) stmt).getCondition()));
        }
        if (stmt instanceof RequireStmt) {
            RequireStmt req = (RequireStmt) stmt;
            return !req.isRevert() && Boolean.TRUE.equals(constantCondition(req.getCondition()));
        }
        if (stmt instanceof ExpressionStmt) {
            Expression expr = ((ExpressionStmt) stmt).getExpression();
            return expr instanceof Literal || expr instanceof Identifier;
        }
        return false;
    }

    private static boolean isTerminator(Statement stmt) {
        if (stmt instanceof ReturnStmt) return true;
        if (stmt instanceof RequireStmt) {
            RequireStmt req = (RequireStmt) stmt;
            return req.isRevert() || Boolean.FALSE.equals(constantCondition(req.getCondition()));
        }
        return false;
    }

    private static Boolean constantCondition(Expression expr) {
        if (expr instanceof Literal && ((Literal) expr).isBool()) {
            return ((Literal) expr).getBoolValue();
        }
        return null;
    }
}
