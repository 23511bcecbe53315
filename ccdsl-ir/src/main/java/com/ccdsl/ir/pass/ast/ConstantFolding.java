package com.ccdsl.ir.pass.ast;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.ccdsl.compiler.types.IntegerType;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.ir.pass.AstTransformer;
import com.ccdsl.ir.pass.OptimizationPass;
import com.ccdsl.ir.pass.OptimizationStats;

import java.math.BigInteger;

/**
 * 常量折叠（trap 语义）。
 * - 结果超出类型范围（上溢、下溢、有符号最小值取负）时不折叠
 * - 除数或模数为 0 时不折叠
 * - 除法向零截断，取余结果与被除数同号
 * 另外折叠字面量的比较与相等、!lit、条件为字面量的三元表达式、范围内字面量的类型转换。
 */
public class ConstantFolding extends AstTransformer implements OptimizationPass {

    private OptimizationStats stats;

    @Override
    public String getName() {
        return "ConstantFolding";
    }

    @Override
    public ContractDecl run(ContractDecl contract, OptimizationStats stats) {
        this.stats = stats;
        return transformContract(contract);
    }

    // ==================== 表达式常量折叠 ====================

    @Override
    protected Expression transformExpr(Expression expr) {
        Expression result = super.transformExpr(expr);
        Expression folded = null;
        if (result instanceof BinaryExpr) {
            folded = foldBinary((BinaryExpr) result);
        } else if (result instanceof UnaryExpr) {
            folded = foldUnary((UnaryExpr) result);
        } else if (result instanceof TernaryExpr) {
            folded = foldTernary((TernaryExpr) result);
        } else if (result instanceof CastExpr) {
            folded = foldCast((CastExpr) result);
        }
        if (folded == null) return result;
        stats.folded();
        return rewrite(result, folded);
    }

    private Expression foldBinary(BinaryExpr expr) {
        if (!(expr.getLeft() instanceof Literal) || !(expr.getRight() instanceof Literal)) return null;
        Literal left = (Literal) expr.getLeft();
        Literal right = (Literal) expr.getRight();
        BinaryOp op = expr.getOperator();
        SourceLocation loc = expr.getLocation();

        if (op.isArithmetic()) {
            if (!left.isInteger() || !right.isInteger() || !(expr.getType() instanceof IntegerType)) return null;
            IntegerType type = (IntegerType) expr.getType();
            BigInteger value = evalArithmetic(op, left.getIntegerValue(), right.getIntegerValue());
            if (value == null || !type.fits(value)) return null;
            return Literal.ofInteger(loc, value, type);
        }
        if (op.isRelational()) {
            if (!left.isInteger() || !right.isInteger()) return null;
            int cmp = left.getIntegerValue().compareTo(right.getIntegerValue());
            return Literal.ofBool(loc, evalComparison(op, cmp));
        }
        if (op.isEquality()) {
            if (left.getKind() != right.getKind()) return null;
            boolean equal = left.getValue().equals(right.getValue());
            return Literal.ofBool(loc, op == BinaryOp.EQ ? equal : !equal);
        }
        if (op.isLogical()) {
            if (!left.isBool() || !right.isBool()) return null;
            boolean l = left.getBoolValue();
            boolean r = right.getBoolValue();
            return Literal.ofBool(loc, op == BinaryOp.AND ? l && r : l || r);
        }
        return null;
    }

    private Expression foldUnary(UnaryExpr expr) {
        if (!(expr.getOperand() instanceof Literal)) return null;
        Literal operand = (Literal) expr.getOperand();
        switch (expr.getOperator()) {
            case NOT:
                if (!operand.isBool()) return null;
                return Literal.ofBool(expr.getLocation(), !operand.getBoolValue());
            case NEG:
                if (!operand.isInteger() || !(expr.getType() instanceof IntegerType)) return null;
                IntegerType type = (IntegerType) expr.getType();
                BigInteger value = operand.getIntegerValue().negate();
                if (!type.fits(value)) return null;
                return Literal.ofInteger(expr.getLocation(), value, type);
            default:
                return null;
        }
    }

    private Expression foldTernary(TernaryExpr expr) {
        if (!(expr.getCondition() instanceof Literal)) return null;
        Literal cond = (Literal) expr.getCondition();
        if (!cond.isBool()) return null;
        return cond.getBoolValue() ? expr.getThenExpr() : expr.getElseExpr();
    }

    private Expression foldCast(CastExpr expr) {
        if (!(expr.getOperand() instanceof Literal)) return null;
        Literal operand = (Literal) expr.getOperand();
        Type target = expr.getType();
        if (!operand.isInteger() || !(target instanceof IntegerType)) return null;
        if (!((IntegerType) target).fits(operand.getIntegerValue())) return null;
        return Literal.ofInteger(expr.getLocation(), operand.getIntegerValue(), (IntegerType) target);
    }

    // ==================== 求值 ====================

    /**
     * 精确整数运算；除数为 0 返回 null。范围检查由调用方负责。
     */
    public static BigInteger evalArithmetic(BinaryOp op, BigInteger l, BigInteger r) {
        switch (op) {
            case ADD: return l.add(r);
            case SUB: return l.subtract(r);
            case MUL: return l.multiply(r);
            // BigInteger.divide 向零截断，remainder 与被除数同号
            case DIV: return r.signum() == 0 ? null : l.divide(r);
            case MOD: return r.signum() == 0 ? null : l.remainder(r);
            default: return null;
        }
    }

    public static boolean evalComparison(BinaryOp op, int cmp) {
        switch (op) {
            case LT: return cmp < 0;
            case GT: return cmp > 0;
            case LE: return cmp <= 0;
            case GE: return cmp >= 0;
            case EQ: return cmp == 0;
            case NE: return cmp != 0;
            default: throw new IllegalArgumentException("Not a comparison: " + op);
        }
    }
}
