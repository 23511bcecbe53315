package com.ccdsl.ir.pass;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.*;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.stmt.*;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.ir.InternalInvariantViolation;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 恒等变换基类（copy-on-change）。
 * 自底向上递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点并保留类型与符号。
 * 子类覆盖 transformExpr / transformStmt / transformStmts 实现优化 pass。
 *
 * <p>输入树从不被修改。</p>
 */
public class AstTransformer {

    /**
     * 变换整个合约；没有任何改写时返回同一实例
     */
    public ContractDecl transformContract(ContractDecl contract) {
        List<StateVarDecl> stateVars = contract.getStateVars();
        List<StateVarDecl> newStateVars = null;
        for (int i = 0; i < stateVars.size(); i++) {
            StateVarDecl sv = stateVars.get(i);
            Expression value = transformExpr(sv.getDefaultValue());
            if (value != sv.getDefaultValue()) {
                if (newStateVars == null) newStateVars = new ArrayList<StateVarDecl>(stateVars);
                newStateVars.set(i, sv.withDefaultValue(value));
            }
        }

        List<ConstDecl> constants = contract.getConstants();
        List<ConstDecl> newConstants = null;
        for (int i = 0; i < constants.size(); i++) {
            ConstDecl c = constants.get(i);
            ConstDecl transformed = transformConstant(c);
            if (transformed != c) {
                if (newConstants == null) newConstants = new ArrayList<ConstDecl>(constants);
                newConstants.set(i, transformed);
            }
        }

        List<ModifierDecl> modifiers = contract.getModifiers();
        List<ModifierDecl> newModifiers = null;
        for (int i = 0; i < modifiers.size(); i++) {
            ModifierDecl m = modifiers.get(i);
            ModifierDecl transformed = transformModifier(m);
            if (transformed != m) {
                if (newModifiers == null) newModifiers = new ArrayList<ModifierDecl>(modifiers);
                newModifiers.set(i, transformed);
            }
        }

        List<FunctionDecl> functions = contract.getFunctions();
        List<FunctionDecl> newFunctions = null;
        for (int i = 0; i < functions.size(); i++) {
            FunctionDecl f = functions.get(i);
            FunctionDecl transformed = transformFunction(f);
            if (transformed != f) {
                if (newFunctions == null) newFunctions = new ArrayList<FunctionDecl>(functions);
                newFunctions.set(i, transformed);
            }
        }

        if (newStateVars == null && newConstants == null && newModifiers == null && newFunctions == null) {
            return contract;
        }
        return contract.withMembers(
                newStateVars != null ? newStateVars : stateVars,
                newModifiers != null ? newModifiers : modifiers,
                newConstants != null ? newConstants : constants,
                newFunctions != null ? newFunctions : functions);
    }

    protected ConstDecl transformConstant(ConstDecl constant) {
        Expression value = transformExpr(constant.getValue());
        return value == constant.getValue() ? constant : constant.withValue(value);
    }

    protected ModifierDecl transformModifier(ModifierDecl modifier) {
        Block body = transformBlock(modifier.getBody());
        return body == modifier.getBody() ? modifier : modifier.withBody(body);
    }

    protected FunctionDecl transformFunction(FunctionDecl function) {
        List<ModifierInvocation> invocations = function.getModifiers();
        List<ModifierInvocation> newInvocations = null;
        for (int i = 0; i < invocations.size(); i++) {
            ModifierInvocation inv = invocations.get(i);
            List<Expression> args = transformExprs(inv.getArguments());
            if (args != inv.getArguments()) {
                if (newInvocations == null) newInvocations = new ArrayList<ModifierInvocation>(invocations);
                newInvocations.set(i, inv.withArguments(args));
            }
        }
        Block body = transformBlock(function.getBody());
        if (newInvocations == null && body == function.getBody()) return function;
        return function.withBody(newInvocations != null ? newInvocations : invocations, body);
    }

    // ==================== 语句 ====================

    protected Block transformBlock(Block block) {
        if (block == null) return null;
        List<Statement> stmts = transformStmts(block.getStatements());
        if (stmts == block.getStatements()) return block;
        return new Block(block.getLocation(), stmts);
    }

    /**
     * 变换语句序列。transformStmt 返回 null 表示删除该语句。
     */
    protected List<Statement> transformStmts(List<Statement> stmts) {
        List<Statement> result = null;
        for (int i = 0; i < stmts.size(); i++) {
            Statement stmt = stmts.get(i);
            Statement transformed = transformStmt(stmt);
            if (transformed != stmt && result == null) {
                result = new ArrayList<Statement>(stmts.subList(0, i));
            }
            if (result != null && transformed != null) {
                result.add(transformed);
            }
        }
        return result != null ? result : stmts;
    }

    protected Statement transformStmt(Statement stmt) {
        if (stmt == null) return null;
        if (stmt instanceof Block) {
            return transformBlock((Block) stmt);
        }
        if (stmt instanceof LetStmt) {
            LetStmt let = (LetStmt) stmt;
            Expression init = transformExpr(let.getInitializer());
            if (init == let.getInitializer()) return stmt;
            return let.withInitializer(init);
        }
        if (stmt instanceof AssignStmt) {
            AssignStmt assign = (AssignStmt) stmt;
            Expression target = transformExpr(assign.getTarget());
            Expression value = transformExpr(assign.getValue());
            if (target == assign.getTarget() && value == assign.getValue()) return stmt;
            return new AssignStmt(assign.getLocation(), target, value);
        }
        if (stmt instanceof ExpressionStmt) {
            ExpressionStmt es = (ExpressionStmt) stmt;
            Expression expr = transformExpr(es.getExpression());
            if (expr == es.getExpression()) return stmt;
            return new ExpressionStmt(es.getLocation(), expr);
        }
        if (stmt instanceof IfStmt) {
            IfStmt is = (IfStmt) stmt;
            Expression cond = transformExpr(is.getCondition());
            Block then = transformBlock(is.getThenBranch());
            Statement els = transformStmt(is.getElseBranch());
            if (cond == is.getCondition() && then == is.getThenBranch()
                    && els == is.getElseBranch()) return stmt;
            return new IfStmt(is.getLocation(), cond, then, els);
        }
        if (stmt instanceof WhileStmt) {
            WhileStmt ws = (WhileStmt) stmt;
            Expression cond = transformExpr(ws.getCondition());
            Block body = transformBlock(ws.getBody());
            if (cond == ws.getCondition() && body == ws.getBody()) return stmt;
            return new WhileStmt(ws.getLocation(), cond, body);
        }
        if (stmt instanceof ForRangeStmt) {
            ForRangeStmt fr = (ForRangeStmt) stmt;
            Expression start = transformExpr(fr.getStart());
            Expression end = transformExpr(fr.getEnd());
            Block body = transformBlock(fr.getBody());
            if (start == fr.getStart() && end == fr.getEnd() && body == fr.getBody()) return stmt;
            return fr.withParts(start, end, body);
        }
        if (stmt instanceof ForEachStmt) {
            ForEachStmt fe = (ForEachStmt) stmt;
            Expression iter = transformExpr(fe.getIterable());
            Block body = transformBlock(fe.getBody());
            if (iter == fe.getIterable() && body == fe.getBody()) return stmt;
            return fe.withParts(iter, body);
        }
        if (stmt instanceof MatchStmt) {
            MatchStmt ms = (MatchStmt) stmt;
            Expression scrutinee = transformExpr(ms.getScrutinee());
            List<MatchArm> arms = transformArms(ms.getArms(), true);
            if (scrutinee == ms.getScrutinee() && arms == ms.getArms()) return stmt;
            return new MatchStmt(ms.getLocation(), scrutinee, arms);
        }
        if (stmt instanceof RequireStmt) {
            RequireStmt req = (RequireStmt) stmt;
            Expression cond = transformExpr(req.getCondition());
            if (cond == req.getCondition()) return stmt;
            return new RequireStmt(req.getLocation(), cond, req.getMessage(), req.isRevert());
        }
        if (stmt instanceof EmitStmt) {
            EmitStmt emit = (EmitStmt) stmt;
            List<Expression> args = transformExprs(emit.getArguments());
            if (args == emit.getArguments()) return stmt;
            return new EmitStmt(emit.getLocation(), emit.getEventName(), args);
        }
        if (stmt instanceof ReturnStmt) {
            ReturnStmt ret = (ReturnStmt) stmt;
            Expression value = transformExpr(ret.getValue());
            if (value == ret.getValue()) return stmt;
            return new ReturnStmt(ret.getLocation(), value);
        }
        // PlaceholderStmt 是叶子
        return stmt;
    }

    // ==================== 表达式 ====================

    protected Expression transformExpr(Expression expr) {
        if (expr == null) return null;
        if (expr instanceof UnaryExpr) {
            UnaryExpr un = (UnaryExpr) expr;
            Expression operand = transformExpr(un.getOperand());
            if (operand == un.getOperand()) return expr;
            return typed(expr, new UnaryExpr(un.getLocation(), un.getOperator(), operand));
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            Expression left = transformExpr(bin.getLeft());
            Expression right = transformExpr(bin.getRight());
            if (left == bin.getLeft() && right == bin.getRight()) return expr;
            return typed(expr, new BinaryExpr(bin.getLocation(), left, bin.getOperator(), right));
        }
        if (expr instanceof TernaryExpr) {
            TernaryExpr t = (TernaryExpr) expr;
            Expression cond = transformExpr(t.getCondition());
            Expression then = transformExpr(t.getThenExpr());
            Expression els = transformExpr(t.getElseExpr());
            if (cond == t.getCondition() && then == t.getThenExpr() && els == t.getElseExpr()) return expr;
            return typed(expr, new TernaryExpr(t.getLocation(), cond, then, els));
        }
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            List<Expression> args = transformExprs(call.getArguments());
            if (args == call.getArguments()) return expr;
            CallExpr result = new CallExpr(call.getLocation(), call.getCallee(), args);
            result.setSymbol(call.getSymbol());
            return typed(expr, result);
        }
        if (expr instanceof MethodCallExpr) {
            MethodCallExpr mc = (MethodCallExpr) expr;
            Expression receiver = transformExpr(mc.getReceiver());
            List<Expression> args = transformExprs(mc.getArguments());
            if (receiver == mc.getReceiver() && args == mc.getArguments()) return expr;
            return typed(expr, new MethodCallExpr(mc.getLocation(), receiver, mc.getMethodName(), args));
        }
        if (expr instanceof FieldAccessExpr) {
            FieldAccessExpr fa = (FieldAccessExpr) expr;
            Expression target = transformExpr(fa.getTarget());
            if (target == fa.getTarget()) return expr;
            return typed(expr, new FieldAccessExpr(fa.getLocation(), target, fa.getFieldName()));
        }
        if (expr instanceof IndexExpr) {
            IndexExpr idx = (IndexExpr) expr;
            Expression target = transformExpr(idx.getTarget());
            Expression index = transformExpr(idx.getIndex());
            if (target == idx.getTarget() && index == idx.getIndex()) return expr;
            return typed(expr, new IndexExpr(idx.getLocation(), target, index));
        }
        if (expr instanceof StructLiteral) {
            StructLiteral sl = (StructLiteral) expr;
            List<Expression> values = transformExprs(sl.getValues());
            if (values == sl.getValues()) return expr;
            return sl.withValues(values);
        }
        if (expr instanceof ArrayLiteral) {
            ArrayLiteral al = (ArrayLiteral) expr;
            List<Expression> elements = transformExprs(al.getElements());
            if (elements == al.getElements()) return expr;
            return typed(expr, new ArrayLiteral(al.getLocation(), elements));
        }
        if (expr instanceof TupleLiteral) {
            TupleLiteral tl = (TupleLiteral) expr;
            List<Expression> elements = transformExprs(tl.getElements());
            if (elements == tl.getElements()) return expr;
            return typed(expr, new TupleLiteral(tl.getLocation(), elements));
        }
        if (expr instanceof CastExpr) {
            CastExpr cast = (CastExpr) expr;
            Expression operand = transformExpr(cast.getOperand());
            if (operand == cast.getOperand()) return expr;
            return typed(expr, new CastExpr(cast.getLocation(), operand, cast.getTargetType()));
        }
        if (expr instanceof LambdaExpr) {
            LambdaExpr lambda = (LambdaExpr) expr;
            Expression body = transformExpr(lambda.getBody());
            if (body == lambda.getBody()) return expr;
            return typed(expr, new LambdaExpr(lambda.getLocation(), lambda.getParameters(), body));
        }
        if (expr instanceof MatchExpr) {
            MatchExpr me = (MatchExpr) expr;
            Expression scrutinee = transformExpr(me.getScrutinee());
            List<MatchArm> arms = transformArms(me.getArms(), false);
            if (scrutinee == me.getScrutinee() && arms == me.getArms()) return expr;
            return typed(expr, new MatchExpr(me.getLocation(), scrutinee, arms));
        }
        // Literal、Identifier、IntrinsicExpr 是叶子，原样返回
        return expr;
    }

    // ==================== 辅助方法 ====================

    protected List<Expression> transformExprs(List<Expression> exprs) {
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression e = exprs.get(i);
            Expression transformed = transformExpr(e);
            if (transformed != e) {
                if (result == null) result = new ArrayList<Expression>(exprs);
                result.set(i, transformed);
            }
        }
        return result != null ? result : exprs;
    }

    private List<MatchArm> transformArms(List<MatchArm> arms, boolean statementArms) {
        List<MatchArm> result = null;
        for (int i = 0; i < arms.size(); i++) {
            MatchArm arm = arms.get(i);
            AstNode body = statementArms
                    ? transformBlock(arm.getBlock())
                    : transformExpr(arm.getValue());
            if (body != arm.getBody()) {
                if (result == null) result = new ArrayList<MatchArm>(arms);
                result.set(i, arm.withBody(body));
            }
        }
        return result != null ? result : arms;
    }

    /** 新构造的节点继承原节点的类型 */
    protected static <T extends Expression> T typed(Expression original, T rebuilt) {
        rebuilt.setType(original.getType());
        return rebuilt;
    }

    /**
     * 以 replacement 替换 original。替换必须保持已解析类型不变，否则是编译器缺陷。
     */
    protected Expression rewrite(Expression original, Expression replacement) {
        Type before = original.getType();
        Type after = replacement.getType();
        if (before != null && !before.equals(after)) {
            throw new InternalInvariantViolation(getClass().getSimpleName()
                    + " changed the type of an expression from " + before + " to " + after,
                    original.getLocation());
        }
        return replacement;
    }

    /** 在新位置复制一个字面量（树中不共享节点） */
    protected static Literal copyLiteral(Literal literal, SourceLocation location) {
        Literal copy = new Literal(location, literal.getKind(), literal.getValue(), literal.getSuffix());
        copy.setType(literal.getType());
        return copy;
    }
}
