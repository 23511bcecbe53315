package com.ccdsl.ir.pass;

import com.ccdsl.compiler.ast.decl.ConstDecl;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.ast.expr.BinaryExpr;
import com.ccdsl.compiler.ast.expr.CastExpr;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.expr.Identifier;
import com.ccdsl.compiler.ast.expr.Literal;
import com.ccdsl.compiler.ast.expr.TernaryExpr;
import com.ccdsl.compiler.ast.expr.UnaryExpr;
import com.ccdsl.compiler.ast.stmt.AssignStmt;
import com.ccdsl.compiler.ast.stmt.Block;
import com.ccdsl.compiler.ast.stmt.ExpressionStmt;
import com.ccdsl.compiler.ast.stmt.ForRangeStmt;
import com.ccdsl.compiler.ast.stmt.IfStmt;
import com.ccdsl.compiler.ast.stmt.LetStmt;
import com.ccdsl.compiler.ast.stmt.RequireStmt;
import com.ccdsl.compiler.ast.stmt.ReturnStmt;
import com.ccdsl.compiler.ast.stmt.Statement;
import com.ccdsl.compiler.ast.stmt.WhileStmt;
import com.ccdsl.compiler.types.IntegerType;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用的参考解释器，只覆盖整数与布尔的纯计算子集。
 * 算术越界、除零和 require 失败都按 trap 处理。
 */
final class ReferenceInterpreter {

    private static final int LOOP_LIMIT = 10_000;

    private final ContractDecl contract;
    private final Deque<Map<String, Object>> scopes = new ArrayDeque<Map<String, Object>>();

    ReferenceInterpreter(ContractDecl contract) {
        this.contract = contract;
    }

    /**
     * 执行函数，返回值、void 时返回 {@link Outcome#VOID}，trap 时返回 {@link Outcome#TRAP}
     */
    Outcome call(String function, Object... args) {
        FunctionDecl fn = contract.findFunction(function);
        if (fn == null) throw new IllegalArgumentException("No function " + function);
        scopes.clear();
        Map<String, Object> params = new HashMap<String, Object>();
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            params.put(fn.getParameters().get(i).getName(),
                    arg instanceof Long ? BigInteger.valueOf((Long) arg)
                            : arg instanceof Integer ? BigInteger.valueOf((Integer) arg) : arg);
        }
        scopes.push(params);
        try {
            execBlock(fn.getBody());
            return Outcome.VOID;
        } catch (ReturnSignal r) {
            return Outcome.of(r.value);
        } catch (Trap t) {
            return Outcome.TRAP;
        }
    }

    // ============ 语句 ============

    private void execBlock(Block block) {
        scopes.push(new HashMap<String, Object>());
        try {
            for (Statement s : block.getStatements()) {
                exec(s);
            }
        } finally {
            scopes.pop();
        }
    }

    private void exec(Statement stmt) {
        if (stmt instanceof Block) {
            execBlock((Block) stmt);
        } else if (stmt instanceof LetStmt) {
            LetStmt let = (LetStmt) stmt;
            scopes.peek().put(let.getName(), eval(let.getInitializer()));
        } else if (stmt instanceof AssignStmt) {
            AssignStmt assign = (AssignStmt) stmt;
            String name = ((Identifier) assign.getTarget()).getName();
            Object value = eval(assign.getValue());
            for (Map<String, Object> scope : scopes) {
                if (scope.containsKey(name)) {
                    scope.put(name, value);
                    return;
                }
            }
            throw new IllegalStateException("Unbound " + name);
        } else if (stmt instanceof ExpressionStmt) {
            eval(((ExpressionStmt) stmt).getExpression());
        } else if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            if ((Boolean) eval(ifStmt.getCondition())) {
                execBlock(ifStmt.getThenBranch());
            } else if (ifStmt.getElseBranch() != null) {
                exec(ifStmt.getElseBranch());
            }
        } else if (stmt instanceof WhileStmt) {
            WhileStmt loop = (WhileStmt) stmt;
            int guard = 0;
            while ((Boolean) eval(loop.getCondition())) {
                if (++guard > LOOP_LIMIT) throw new IllegalStateException("Loop limit exceeded");
                execBlock(loop.getBody());
            }
        } else if (stmt instanceof ForRangeStmt) {
            ForRangeStmt loop = (ForRangeStmt) stmt;
            BigInteger start = (BigInteger) eval(loop.getStart());
            BigInteger end = (BigInteger) eval(loop.getEnd());
            for (BigInteger i = start; i.compareTo(end) < 0; i = i.add(BigInteger.ONE)) {
                Map<String, Object> scope = new HashMap<String, Object>();
                scope.put(loop.getVariable(), i);
                scopes.push(scope);
                try {
                    execBlock(loop.getBody());
                } finally {
                    scopes.pop();
                }
            }
        } else if (stmt instanceof RequireStmt) {
            RequireStmt req = (RequireStmt) stmt;
            if (req.isRevert() || !(Boolean) eval(req.getCondition())) throw new Trap();
        } else if (stmt instanceof ReturnStmt) {
            ReturnStmt ret = (ReturnStmt) stmt;
            throw new ReturnSignal(ret.getValue() != null ? eval(ret.getValue()) : null);
        } else {
            throw new UnsupportedOperationException(stmt.getClass().getSimpleName());
        }
    }

    // ============ 表达式 ============

    private Object eval(Expression expr) {
        if (expr instanceof Literal) {
            return ((Literal) expr).getValue();
        }
        if (expr instanceof Identifier) {
            return lookup(((Identifier) expr).getName());
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr un = (UnaryExpr) expr;
            Object operand = eval(un.getOperand());
            if (un.getOperator() == UnaryExpr.UnaryOp.NOT) return !(Boolean) operand;
            return checked(((BigInteger) operand).negate(), expr);
        }
        if (expr instanceof TernaryExpr) {
            TernaryExpr t = (TernaryExpr) expr;
            return (Boolean) eval(t.getCondition()) ? eval(t.getThenExpr()) : eval(t.getElseExpr());
        }
        if (expr instanceof CastExpr) {
            return checked((BigInteger) eval(((CastExpr) expr).getOperand()), expr);
        }
        if (expr instanceof BinaryExpr) {
            return evalBinary((BinaryExpr) expr);
        }
        throw new UnsupportedOperationException(expr.getClass().getSimpleName());
    }

    private Object evalBinary(BinaryExpr expr) {
        BinaryExpr.BinaryOp op = expr.getOperator();
        if (op == BinaryExpr.BinaryOp.AND) {
            return (Boolean) eval(expr.getLeft()) && (Boolean) eval(expr.getRight());
        }
        if (op == BinaryExpr.BinaryOp.OR) {
            return (Boolean) eval(expr.getLeft()) || (Boolean) eval(expr.getRight());
        }
        Object left = eval(expr.getLeft());
        Object right = eval(expr.getRight());
        switch (op) {
            case EQ: return left.equals(right);
            case NE: return !left.equals(right);
            default: break;
        }
        BigInteger l = (BigInteger) left;
        BigInteger r = (BigInteger) right;
        switch (op) {
            case LT: return l.compareTo(r) < 0;
            case GT: return l.compareTo(r) > 0;
            case LE: return l.compareTo(r) <= 0;
            case GE: return l.compareTo(r) >= 0;
            case ADD: return checked(l.add(r), expr);
            case SUB: return checked(l.subtract(r), expr);
            case MUL: return checked(l.multiply(r), expr);
            case DIV:
                if (r.signum() == 0) throw new Trap();
                return checked(l.divide(r), expr);
            case MOD:
                if (r.signum() == 0) throw new Trap();
                return checked(l.remainder(r), expr);
            default:
                throw new UnsupportedOperationException(op.name());
        }
    }

    private static BigInteger checked(BigInteger value, Expression expr) {
        IntegerType type = (IntegerType) expr.getType();
        if (!type.fits(value)) throw new Trap();
        return value;
    }

    private Object lookup(String name) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) return scope.get(name);
        }
        List<ConstDecl> constants = contract.getConstants();
        for (ConstDecl c : constants) {
            if (c.getName().equals(name)) return eval(c.getValue());
        }
        throw new IllegalStateException("Unbound " + name);
    }

    // ============ 结果 ============

    static final class Outcome {
        static final Outcome VOID = new Outcome("void");
        static final Outcome TRAP = new Outcome("trap");

        private final Object value;

        private Outcome(Object value) {
            this.value = value;
        }

        static Outcome of(Object value) {
            return value == null ? VOID : new Outcome(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Outcome && ((Outcome) o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    private static final class Trap extends RuntimeException {
        Trap() {
            super(null, null, false, false);
        }
    }

    private static final class ReturnSignal extends RuntimeException {
        final Object value;

        ReturnSignal(Object value) {
            super(null, null, false, false);
            this.value = value;
        }
    }
}
