package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.ast.decl.Parameter;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.lexer.Intrinsic;
import com.ccdsl.compiler.types.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 表达式类型推断引擎（双向）：自底向上合成类型，同时把期望类型自顶向下传给无后缀字面量。
 *
 * <p>每个被推断的表达式都会回填 {@code type}，标识符与调用回填 {@link Symbol}。
 * 已报告错误的子表达式得到错误类型，与任何类型兼容，避免级联诊断。</p>
 */
final class TypeInferenceEngine {

    private final SemanticAnalyzer analyzer;
    private final SemanticChecker checker;
    private final TypeResolver typeResolver;

    TypeInferenceEngine(SemanticAnalyzer analyzer, SemanticChecker checker, TypeResolver typeResolver) {
        this.analyzer = analyzer;
        this.checker = checker;
        this.typeResolver = typeResolver;
    }

    /**
     * 推断表达式类型
     *
     * @param expected 上下文期望的类型，没有时为 null
     */
    Type infer(Expression expr, Type expected) {
        Type type = doInfer(expr, expected);
        expr.setType(type);
        return type;
    }

    /** 推断并检查与期望类型兼容 */
    Type inferExpecting(Expression expr, Type expected) {
        Type actual = infer(expr, expected);
        checker.checkAssignable(expected, actual, expr);
        return actual;
    }

    private Type doInfer(Expression expr, Type expected) {
        if (expr instanceof Literal) return inferLiteral((Literal) expr, expected);
        if (expr instanceof Identifier) return inferIdentifier((Identifier) expr);
        if (expr instanceof IntrinsicExpr) return intrinsicType(((IntrinsicExpr) expr).getIntrinsic());
        if (expr instanceof UnaryExpr) return inferUnary((UnaryExpr) expr, expected);
        if (expr instanceof BinaryExpr) return inferBinary((BinaryExpr) expr, expected);
        if (expr instanceof TernaryExpr) return inferTernary((TernaryExpr) expr, expected);
        if (expr instanceof CallExpr) return inferCall((CallExpr) expr);
        if (expr instanceof MethodCallExpr) return inferMethodCall((MethodCallExpr) expr);
        if (expr instanceof FieldAccessExpr) return inferFieldAccess((FieldAccessExpr) expr);
        if (expr instanceof IndexExpr) return inferIndex((IndexExpr) expr);
        if (expr instanceof StructLiteral) return inferStructLiteral((StructLiteral) expr);
        if (expr instanceof ArrayLiteral) return inferArrayLiteral((ArrayLiteral) expr, expected);
        if (expr instanceof TupleLiteral) return inferTupleLiteral((TupleLiteral) expr, expected);
        if (expr instanceof CastExpr) return inferCast((CastExpr) expr);
        if (expr instanceof MatchExpr) return inferMatch((MatchExpr) expr, expected);
        if (expr instanceof LambdaExpr) {
            checker.error(DiagnosticCode.INVALID_CONSTRUCT,
                    "Lambda is only allowed as the argument of map or filter", expr);
            return PrimitiveType.ERROR;
        }
        throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
    }

    // ============ 字面量与名称 ============

    private Type inferLiteral(Literal lit, Type expected) {
        switch (lit.getKind()) {
            case BOOL: return PrimitiveType.BOOL;
            case STRING: return PrimitiveType.STRING;
            case BYTES: return PrimitiveType.BYTES;
            default:
                break;
        }
        IntegerType type;
        if (lit.getSuffix() != null) {
            type = IntegerType.byName(lit.getSuffix());
        } else if (expected != null && expected.isInteger()) {
            type = (IntegerType) expected;
        } else {
            type = IntegerType.U64;
        }
        BigInteger value = lit.getIntegerValue();
        if (!type.fits(value)) {
            checker.error(DiagnosticCode.TYPE_MISMATCH,
                    "Type mismatch: literal " + value + " does not fit in " + type, lit);
            return PrimitiveType.ERROR;
        }
        return type;
    }

    private Type inferIdentifier(Identifier id) {
        Symbol symbol = analyzer.resolve(id.getName());
        if (symbol == null) {
            checker.undefined("symbol", id.getName(), id);
            return PrimitiveType.ERROR;
        }
        if (symbol.getKind() == SymbolKind.FUNCTION) {
            checker.error(DiagnosticCode.INVALID_CONSTRUCT,
                    "Function '" + id.getName() + "' cannot be used as a value", id);
            return PrimitiveType.ERROR;
        }
        symbol.markUsed();
        id.setSymbol(symbol);
        return symbol.getType();
    }

    static Type intrinsicType(Intrinsic intrinsic) {
        switch (intrinsic) {
            case MSG_SENDER: return PrimitiveType.ADDRESS;
            case MSG_VALUE:
            case BLOCK_NUMBER:
            case BLOCK_TIMESTAMP:
                return IntegerType.U64;
            default:
                throw new IllegalStateException("Unhandled intrinsic: " + intrinsic);
        }
    }

    // ============ 运算符 ============

    private Type inferUnary(UnaryExpr expr, Type expected) {
        if (expr.getOperator() == UnaryExpr.UnaryOp.NOT) {
            Type operand = infer(expr.getOperand(), PrimitiveType.BOOL);
            if (!checker.checkAssignable(PrimitiveType.BOOL, operand, expr.getOperand())) {
                return PrimitiveType.ERROR;
            }
            return PrimitiveType.BOOL;
        }
        Type operand = infer(expr.getOperand(), expected);
        if (operand.isError()) return operand;
        if (!operand.isInteger() || !((IntegerType) operand).isSigned()) {
            checker.error(DiagnosticCode.TYPE_MISMATCH,
                    "Unary '-' requires a signed integer, found " + operand, expr);
            return PrimitiveType.ERROR;
        }
        return operand;
    }

    private Type inferBinary(BinaryExpr expr, Type expected) {
        BinaryExpr.BinaryOp op = expr.getOperator();
        if (op.isLogical()) {
            Type left = infer(expr.getLeft(), PrimitiveType.BOOL);
            Type right = infer(expr.getRight(), PrimitiveType.BOOL);
            boolean ok = checker.checkAssignable(PrimitiveType.BOOL, left, expr.getLeft());
            ok &= checker.checkAssignable(PrimitiveType.BOOL, right, expr.getRight());
            return ok ? PrimitiveType.BOOL : PrimitiveType.ERROR;
        }

        Type operandHint = op.isArithmetic() ? expected : null;
        Type[] operands = inferPair(expr.getLeft(), expr.getRight(), operandHint);
        Type left = operands[0];
        Type right = operands[1];
        if (left.isError() || right.isError()) {
            return op.isArithmetic() ? PrimitiveType.ERROR : PrimitiveType.BOOL;
        }

        if (op.isArithmetic() || op.isRelational()) {
            if (!left.isInteger()) {
                checker.error(DiagnosticCode.TYPE_MISMATCH, "Operator '" + op.toSourceString()
                        + "' requires integer operands, found " + left, expr.getLeft());
                return op.isArithmetic() ? PrimitiveType.ERROR : PrimitiveType.BOOL;
            }
            if (!left.equals(right)) {
                checker.error(DiagnosticCode.TYPE_MISMATCH, SemanticChecker.mismatch(left, right), expr.getRight());
                return op.isArithmetic() ? PrimitiveType.ERROR : PrimitiveType.BOOL;
            }
            return op.isArithmetic() ? left : PrimitiveType.BOOL;
        }

        // == / !=
        if (!left.equals(right)) {
            checker.error(DiagnosticCode.TYPE_MISMATCH, SemanticChecker.mismatch(left, right), expr.getRight());
        }
        return PrimitiveType.BOOL;
    }

    /**
     * 推断同类型的一对操作数：上下文类型的一侧从另一侧取期望类型
     */
    Type[] inferPair(Expression left, Expression right, Type hint) {
        Type leftType;
        Type rightType;
        if (SemanticChecker.isContextTyped(left) && !SemanticChecker.isContextTyped(right)) {
            rightType = infer(right, hint);
            leftType = infer(left, rightType.isError() ? hint : rightType);
        } else {
            leftType = infer(left, hint);
            rightType = infer(right, leftType.isError() ? hint : leftType);
        }
        return new Type[]{leftType, rightType};
    }

    private Type inferTernary(TernaryExpr expr, Type expected) {
        Type cond = infer(expr.getCondition(), PrimitiveType.BOOL);
        checker.checkAssignable(PrimitiveType.BOOL, cond, expr.getCondition());
        Type[] arms = inferPair(expr.getThenExpr(), expr.getElseExpr(), expected);
        if (!arms[1].isAssignableTo(arms[0])) {
            checker.error(DiagnosticCode.TYPE_MISMATCH, SemanticChecker.mismatch(arms[0], arms[1]), expr.getElseExpr());
            return PrimitiveType.ERROR;
        }
        return arms[0].isError() ? arms[1] : arms[0];
    }

    private Type inferCast(CastExpr expr) {
        Type target = typeResolver.resolve(expr.getTargetType());
        Type source = infer(expr.getOperand(), null);
        if (source.isError() || target.isError()) return target;
        if (!source.isInteger() || !target.isInteger()) {
            checker.error(DiagnosticCode.TYPE_MISMATCH,
                    "Cannot cast " + source + " to " + target + ": only integer casts are allowed", expr);
            return PrimitiveType.ERROR;
        }
        return target;
    }

    // ============ 调用 ============

    private Type inferCall(CallExpr call) {
        Symbol symbol = analyzer.resolve(call.getCallee());
        if (symbol == null || symbol.getKind() != SymbolKind.FUNCTION) {
            for (Expression arg : call.getArguments()) {
                infer(arg, null);
            }
            if (symbol == null) {
                checker.undefined("function", call.getCallee(), call);
            } else {
                checker.error(DiagnosticCode.INVALID_CONSTRUCT, "'" + call.getCallee() + "' is not a function", call);
            }
            return PrimitiveType.ERROR;
        }
        symbol.markUsed();
        call.setSymbol(symbol);
        FunctionDecl fn = (FunctionDecl) symbol.getDeclaration();
        checkArguments("Function '" + fn.getName() + "'", fn.getParameters(), call.getArguments(), call);
        return symbol.getType();
    }

    /**
     * 实参个数与类型逐位检查（函数调用、修饰器调用、emit 共用）
     */
    void checkArguments(String what, List<Parameter> params, List<Expression> args,
                        AstNode site) {
        if (params.size() != args.size()) {
            checker.error(DiagnosticCode.ARITY_MISMATCH, what + " expects " + params.size()
                    + " argument(s), found " + args.size(), site);
        }
        for (int i = 0; i < args.size(); i++) {
            Type paramType = i < params.size() ? paramType(params.get(i)) : null;
            Type actual = infer(args.get(i), paramType);
            if (paramType != null) {
                checker.checkAssignable(paramType, actual, args.get(i));
            }
        }
    }

    private static Type paramType(Parameter param) {
        if (param.getType() == null || param.getType().getResolvedType() == null) return PrimitiveType.ERROR;
        return param.getType().getResolvedType();
    }

    private Type inferMethodCall(MethodCallExpr call) {
        Type receiver = infer(call.getReceiver(), null);
        String method = call.getMethodName();
        if (receiver.isError()) {
            for (Expression arg : call.getArguments()) {
                if (!(arg instanceof LambdaExpr)) infer(arg, null);
            }
            return PrimitiveType.ERROR;
        }

        Type element = elementType(receiver);
        if ("len".equals(method) && element != null) {
            expectArity(call, 0);
            return IntegerType.U64;
        }
        if ("push".equals(method) && receiver instanceof VectorType) {
            if (expectArity(call, 1)) {
                inferExpecting(call.getArguments().get(0), element);
            }
            analyzer.checkMutableRoot(call.getReceiver(), call);
            return PrimitiveType.VOID;
        }
        if (("map".equals(method) || "filter".equals(method)) && element != null) {
            if (!expectArity(call, 1)) return PrimitiveType.ERROR;
            Expression arg = call.getArguments().get(0);
            if (!(arg instanceof LambdaExpr)) {
                infer(arg, null);
                checker.error(DiagnosticCode.TYPE_MISMATCH,
                        "'" + method + "' expects a lambda argument", arg);
                return PrimitiveType.ERROR;
            }
            boolean filter = "filter".equals(method);
            Type result = inferLambda((LambdaExpr) arg, element, filter ? PrimitiveType.BOOL : null);
            if (result.isError()) return PrimitiveType.ERROR;
            if (filter) {
                checker.checkAssignable(PrimitiveType.BOOL, result, ((LambdaExpr) arg).getBody());
                return new VectorType(element);
            }
            if (result.isVoid()) {
                checker.error(DiagnosticCode.TYPE_MISMATCH, "Lambda passed to 'map' must produce a value", arg);
                return PrimitiveType.ERROR;
            }
            return new VectorType(result);
        }
        for (Expression a : call.getArguments()) {
            if (!(a instanceof LambdaExpr)) infer(a, null);
        }
        checker.error(DiagnosticCode.UNDEFINED_SYMBOL,
                "Unknown method '" + method + "' on " + receiver, call);
        return PrimitiveType.ERROR;
    }

    private boolean expectArity(MethodCallExpr call, int count) {
        if (call.getArguments().size() == count) return true;
        checker.error(DiagnosticCode.ARITY_MISMATCH, "Method '" + call.getMethodName() + "' expects "
                + count + " argument(s), found " + call.getArguments().size(), call);
        return false;
    }

    /**
     * lambda 只有一个参数，参数类型来自接收者元素类型；返回体的类型
     */
    private Type inferLambda(LambdaExpr lambda, Type paramType, Type bodyExpected) {
        if (lambda.getParameters().size() != 1) {
            checker.error(DiagnosticCode.ARITY_MISMATCH, "Lambda expects exactly 1 parameter, found "
                    + lambda.getParameters().size(), lambda);
            lambda.setType(PrimitiveType.ERROR);
            return PrimitiveType.ERROR;
        }
        Parameter param = lambda.getParameters().get(0);
        if (param.getType() != null) {
            Type declared = typeResolver.resolve(param.getType());
            checker.checkAssignable(paramType, declared, param);
        }
        analyzer.enterScope(Scope.ScopeType.LAMBDA, lambda);
        Symbol symbol = new Symbol(param.getName(), SymbolKind.LAMBDA_PARAM, paramType, false,
                param, analyzer.currentScope());
        analyzer.define(symbol, "parameter", param);
        param.setSymbol(symbol);
        Type body = infer(lambda.getBody(), bodyExpected);
        analyzer.exitScope();
        List<Type> params = new ArrayList<Type>();
        params.add(paramType);
        lambda.setType(new LambdaType(params, body));
        return body;
    }

    // ============ 成员与索引 ============

    private Type inferFieldAccess(FieldAccessExpr expr) {
        Type target = infer(expr.getTarget(), null);
        if (target.isError()) return target;
        if (expr.isTupleIndex()) {
            if (!(target instanceof TupleType)) {
                checker.error(DiagnosticCode.TYPE_MISMATCH,
                        "Tuple index on non-tuple type " + target, expr);
                return PrimitiveType.ERROR;
            }
            List<Type> elements = ((TupleType) target).getElementTypes();
            int index = Integer.parseInt(expr.getFieldName());
            if (index >= elements.size()) {
                checker.error(DiagnosticCode.UNDEFINED_SYMBOL,
                        "Tuple " + target + " has no element " + index, expr);
                return PrimitiveType.ERROR;
            }
            return elements.get(index);
        }
        if (!(target instanceof StructType)) {
            checker.error(DiagnosticCode.TYPE_MISMATCH, "Type " + target + " has no fields", expr);
            return PrimitiveType.ERROR;
        }
        StructType struct = (StructType) target;
        Type field = struct.getFieldType(expr.getFieldName());
        if (field == null) {
            checker.error(DiagnosticCode.UNDEFINED_SYMBOL, "Struct '" + struct.getName()
                    + "' has no field '" + expr.getFieldName() + "'", expr);
            return PrimitiveType.ERROR;
        }
        return field;
    }

    private Type inferIndex(IndexExpr expr) {
        Type target = infer(expr.getTarget(), null);
        if (target instanceof MapType) {
            MapType map = (MapType) target;
            inferExpecting(expr.getIndex(), map.getKeyType());
            return map.getValueType();
        }
        Type element = elementType(target);
        if (element != null) {
            Type index = infer(expr.getIndex(), IntegerType.U64);
            if (!index.isError() && !index.isUnsignedInteger()) {
                checker.error(DiagnosticCode.TYPE_MISMATCH,
                        "Index must be an unsigned integer, found " + index, expr.getIndex());
            }
            return element;
        }
        infer(expr.getIndex(), null);
        if (target.isError()) return target;
        checker.error(DiagnosticCode.TYPE_MISMATCH, "Type " + target + " cannot be indexed", expr);
        return PrimitiveType.ERROR;
    }

    /** vec / 定长数组的元素类型，其他类型返回 null */
    static Type elementType(Type type) {
        if (type instanceof VectorType) return ((VectorType) type).getElementType();
        if (type instanceof ArrayType) return ((ArrayType) type).getElementType();
        return null;
    }

    // ============ 复合字面量 ============

    private Type inferStructLiteral(StructLiteral lit) {
        StructType struct = typeResolver.hasStruct(lit.getStructName())
                ? typeResolver.resolveStruct(lit.getStructName()) : null;
        if (struct == null) {
            for (Expression value : lit.getValues()) {
                infer(value, null);
            }
            if (!typeResolver.hasStruct(lit.getStructName())) {
                checker.undefined("struct", lit.getStructName(), lit);
            }
            return PrimitiveType.ERROR;
        }
        Set<String> seen = new HashSet<String>();
        for (int i = 0; i < lit.getFieldNames().size(); i++) {
            String field = lit.getFieldNames().get(i);
            Expression value = lit.getValues().get(i);
            Type fieldType = struct.getFieldType(field);
            if (fieldType == null) {
                infer(value, null);
                checker.error(DiagnosticCode.UNDEFINED_SYMBOL, "Struct '" + struct.getName()
                        + "' has no field '" + field + "'", value);
                continue;
            }
            if (!seen.add(field)) {
                checker.error(DiagnosticCode.INVALID_CONSTRUCT,
                        "Field '" + field + "' is given more than once", value);
            }
            inferExpecting(value, fieldType);
        }
        for (String field : struct.getFields().keySet()) {
            if (!seen.contains(field)) {
                checker.error(DiagnosticCode.INVALID_CONSTRUCT, "Missing field '" + field
                        + "' in struct literal '" + struct.getName() + "'", lit);
            }
        }
        return struct;
    }

    private Type inferArrayLiteral(ArrayLiteral lit, Type expected) {
        Type elementHint = elementType(expected);
        if (lit.getElements().isEmpty()) {
            if (elementHint == null) {
                checker.error(DiagnosticCode.TYPE_MISMATCH,
                        "Cannot infer the element type of an empty literal", lit);
                return PrimitiveType.ERROR;
            }
            return expected instanceof VectorType ? expected : new ArrayType(elementHint, 0);
        }
        Type element = elementHint;
        if (element == null) {
            // 第一个非上下文类型的元素决定元素类型
            for (Expression e : lit.getElements()) {
                if (!SemanticChecker.isContextTyped(e)) {
                    element = infer(e, null);
                    break;
                }
            }
        }
        for (Expression e : lit.getElements()) {
            // 决定元素类型的那个元素已推断过
            Type t = e.getType() != null ? e.getType() : infer(e, element);
            if (element == null) element = t;
            checker.checkAssignable(element, t, e);
        }
        if (element == null || element.isError()) return PrimitiveType.ERROR;
        if (expected instanceof VectorType) return new VectorType(element);
        return new ArrayType(element, lit.getElements().size());
    }

    private Type inferTupleLiteral(TupleLiteral lit, Type expected) {
        List<Type> hints = expected instanceof TupleType ? ((TupleType) expected).getElementTypes() : null;
        if (hints != null && hints.size() != lit.getElements().size()) hints = null;
        List<Type> elements = new ArrayList<Type>();
        for (int i = 0; i < lit.getElements().size(); i++) {
            elements.add(infer(lit.getElements().get(i), hints != null ? hints.get(i) : null));
        }
        return new TupleType(elements);
    }

    // ============ match ============

    private Type inferMatch(MatchExpr match, Type expected) {
        Type scrutinee = infer(match.getScrutinee(), null);
        Type result = expected;
        boolean hasWildcard = false;
        boolean failed = false;
        for (MatchArm arm : match.getArms()) {
            checkPattern(arm.getPattern(), scrutinee);
            if (arm.getPattern().isWildcard()) hasWildcard = true;
            Type value = infer(arm.getValue(), result);
            if (result == null || result.isError()) {
                result = value;
            } else if (!checker.checkAssignable(result, value, arm.getValue())) {
                failed = true;
            }
        }
        if (!hasWildcard) {
            checker.error(DiagnosticCode.INVALID_CONSTRUCT, "match expression requires a '_' arm", match);
        }
        if (failed || result == null) return PrimitiveType.ERROR;
        return result;
    }

    /**
     * 模式必须与被匹配值同类型，区间模式要求整数
     */
    void checkPattern(MatchPattern pattern, Type scrutinee) {
        switch (pattern.getKind()) {
            case WILDCARD:
                return;
            case LITERAL: {
                Type t = infer(pattern.getLow(), scrutinee);
                checker.checkAssignable(scrutinee, t, pattern);
                return;
            }
            case RANGE: {
                if (!scrutinee.isError() && !scrutinee.isInteger()) {
                    checker.error(DiagnosticCode.TYPE_MISMATCH,
                            "Range pattern requires an integer scrutinee, found " + scrutinee, pattern);
                    return;
                }
                Type low = infer(pattern.getLow(), scrutinee);
                Type high = infer(pattern.getHigh(), scrutinee);
                checker.checkAssignable(scrutinee, low, pattern.getLow());
                checker.checkAssignable(scrutinee, high, pattern.getHigh());
                return;
            }
            default:
                throw new IllegalStateException("Unhandled pattern: " + pattern.getKind());
        }
    }
}
