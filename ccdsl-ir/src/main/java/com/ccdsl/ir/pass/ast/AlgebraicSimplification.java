package com.ccdsl.ir.pass.ast;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.ccdsl.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.ccdsl.compiler.types.IntegerType;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.ir.pass.AstTransformer;
import com.ccdsl.ir.pass.OptimizationPass;
import com.ccdsl.ir.pass.OptimizationStats;

import java.math.BigInteger;

/**
 * 代数简化。被丢弃的子表达式必须既无副作用也不会 trap
 * （算术、索引、调用和类型转换都可能 trap，不算纯）。
 *
 * <pre>
 *   x + 0, 0 + x, x - 0, x * 1, 1 * x   →  x
 *   x * 0, 0 * x                        →  0
 *   true &amp;&amp; x, x &amp;&amp; true, false || x, x || false  →  x
 *   false &amp;&amp; x → false      true || x → true
 *   !!x → x                  -(-x) → x（x 不可能是有符号最小值时）
 * </pre>
 */
public class AlgebraicSimplification extends AstTransformer implements OptimizationPass {

    private OptimizationStats stats;

    @Override
    public String getName() {
        return "AlgebraicSimplification";
    }

    @Override
    public ContractDecl run(ContractDecl contract, OptimizationStats stats) {
        this.stats = stats;
        return transformContract(contract);
    }

    @Override
    protected Expression transformExpr(Expression expr) {
        Expression result = super.transformExpr(expr);
        Expression simplified = null;
        if (result instanceof BinaryExpr) {
            simplified = simplifyBinary((BinaryExpr) result);
        } else if (result instanceof UnaryExpr) {
            simplified = simplifyUnary((UnaryExpr) result);
        }
        if (simplified == null) return result;
        stats.simplified();
        return rewrite(result, simplified);
    }

    private Expression simplifyBinary(BinaryExpr expr) {
        Expression left = expr.getLeft();
        Expression right = expr.getRight();
        switch (expr.getOperator()) {
            case ADD:
                if (isInt(right, 0)) return left;
                if (isInt(left, 0)) return right;
                return null;
            case SUB:
                return isInt(right, 0) ? left : null;
            case MUL:
                if (isInt(right, 1)) return left;
                if (isInt(left, 1)) return right;
                if (isInt(right, 0) && isTrapFree(left)) return zero(expr);
                if (isInt(left, 0) && isTrapFree(right)) return zero(expr);
                return null;
            case AND:
                if (isBool(left, true)) return right;
                if (isBool(right, true)) return left;
                if (isBool(left, false)) return left;
                return null;
            case OR:
                if (isBool(left, false)) return right;
                if (isBool(right, false)) return left;
                if (isBool(left, true)) return left;
                return null;
            default:
                return null;
        }
    }

    private Expression simplifyUnary(UnaryExpr expr) {
        if (!(expr.getOperand() instanceof UnaryExpr)) return null;
        UnaryExpr inner = (UnaryExpr) expr.getOperand();
        if (inner.getOperator() != expr.getOperator()) return null;
        if (expr.getOperator() == UnaryOp.NOT) {
            return inner.getOperand();
        }
        // 内层 -x 在 x 为最小值时会 trap，只在能排除这种情况时消去
        return cannotBeSignedMin(inner.getOperand()) ? inner.getOperand() : null;
    }

    // ==================== 辅助方法 ====================

    private static boolean isInt(Expression expr, long value) {
        return expr instanceof Literal && ((Literal) expr).isIntegerValue(value);
    }

    private static boolean isBool(Expression expr, boolean value) {
        return expr instanceof Literal && (value ? ((Literal) expr).isTrue() : ((Literal) expr).isFalse());
    }

    private static Literal zero(BinaryExpr expr) {
        return Literal.ofInteger(expr.getLocation(), BigInteger.ZERO, (IntegerType) expr.getType());
    }

    /**
     * 求值既无副作用也不会 trap
     */
    static boolean isTrapFree(Expression expr) {
        if (expr instanceof Literal || expr instanceof Identifier || expr instanceof IntrinsicExpr) {
            return true;
        }
        if (expr instanceof FieldAccessExpr) {
            return isTrapFree(((FieldAccessExpr) expr).getTarget());
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr un = (UnaryExpr) expr;
            return un.getOperator() == UnaryOp.NOT && isTrapFree(un.getOperand());
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            return !bin.getOperator().isArithmetic()
                    && isTrapFree(bin.getLeft()) && isTrapFree(bin.getRight());
        }
        return false;
    }

    /**
     * 字面量（非最小值），或从更窄整数类型转换而来的值
     */
    private static boolean cannotBeSignedMin(Expression expr) {
        Type type = expr.getType();
        if (!(type instanceof IntegerType)) return false;
        IntegerType intType = (IntegerType) type;
        if (expr instanceof Literal) {
            return !((Literal) expr).getIntegerValue().equals(intType.getMin());
        }
        if (expr instanceof CastExpr) {
            Type source = ((CastExpr) expr).getOperand().getType();
            return source instanceof IntegerType && ((IntegerType) source).getBits() < intType.getBits();
        }
        return false;
    }
}
