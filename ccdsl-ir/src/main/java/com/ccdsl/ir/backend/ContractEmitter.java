package com.ccdsl.ir.backend;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.ast.decl.ModifierDecl;
import com.ccdsl.compiler.ast.decl.ModifierInvocation;
import com.ccdsl.compiler.ast.decl.Parameter;
import com.ccdsl.compiler.ast.expr.CallExpr;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.expr.FieldAccessExpr;
import com.ccdsl.compiler.ast.expr.Identifier;
import com.ccdsl.compiler.ast.expr.IndexExpr;
import com.ccdsl.compiler.ast.expr.IntrinsicExpr;
import com.ccdsl.compiler.ast.expr.Literal;
import com.ccdsl.compiler.ast.stmt.Block;
import com.ccdsl.compiler.ast.stmt.IfStmt;
import com.ccdsl.compiler.ast.stmt.PlaceholderStmt;
import com.ccdsl.compiler.ast.stmt.RequireStmt;
import com.ccdsl.compiler.ast.stmt.ReturnStmt;
import com.ccdsl.compiler.ast.stmt.Statement;
import com.ccdsl.compiler.ast.type.TypeRef;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;
import com.ccdsl.compiler.diagnostic.Severity;
import com.ccdsl.compiler.types.ArrayType;
import com.ccdsl.compiler.types.MapType;
import com.ccdsl.compiler.types.OptionType;
import com.ccdsl.compiler.types.PrimitiveType;
import com.ccdsl.compiler.types.ResultType;
import com.ccdsl.compiler.types.StructType;
import com.ccdsl.compiler.types.TupleType;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.compiler.types.VectorType;
import com.ccdsl.ir.InternalInvariantViolation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 单次生成调用的发射状态。
 *
 * <p>表达式访问方法返回目标代码文本；语句访问方法直接写入 {@link #out} 并返回 null。
 * 目标无法表达的构造抛出 {@link UnsupportedConstructException}，
 * 在最近的语句或声明边界转换为该目标的诊断，之后继续发射以收集更多诊断。</p>
 *
 * <p>实例不可复用，也不跨线程共享。</p>
 */
public abstract class ContractEmitter implements AstVisitor<String, Void> {

    private static final Logger LOG = Logger.getLogger(ContractEmitter.class.getName());

    protected final ContractDecl contract;
    protected final Target target;
    protected final TypeMappingTable types;
    protected final IntrinsicTable intrinsics;
    protected final CodeWriter out = new CodeWriter();
    protected final ErrorCodeRegistry errors;

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final Set<String> reserved;
    private int tempCounter;

    /** 当前函数的返回类型，无返回值时为 VOID */
    protected Type returnType = PrimitiveType.VOID;
    /** 正在发射的 lambda 嵌套深度 */
    protected int lambdaDepth;

    protected ContractEmitter(ContractDecl contract, Target target, TypeMappingTable types,
                              IntrinsicTable intrinsics, Set<String> reserved, ErrorCodeRegistry errors) {
        this.contract = contract;
        this.target = target;
        this.types = types;
        this.intrinsics = intrinsics;
        this.reserved = reserved;
        this.errors = errors;
    }

    /**
     * 发射整个合约。报告过任何错误时产物为 null。
     */
    public final CodegenResult emit() {
        try {
            emitContract();
        } catch (UnsupportedConstructException e) {
            report(e);
        }
        String text = diagnostics.hasErrors() ? null : out.getOutput();
        if (text == null) {
            LOG.fine(target.getId() + ": " + contract.getName() + " failed with "
                    + diagnostics.getErrorCount() + " error(s)");
        }
        return assemble(new CodegenResult(target, text, diagnostics.snapshot()));
    }

    protected abstract void emitContract();

    /** 对完整产物做最后的包装，默认原样返回 */
    protected CodegenResult assemble(CodegenResult result) {
        return result;
    }

    // ==================== 诊断 ====================

    protected void report(UnsupportedConstructException e) {
        diagnostics.report(new Diagnostic(e.getCode(), Severity.ERROR, e.getMessage(),
                e.getLocation(), target.getId()));
    }

    /**
     * 声明边界：内部抛出的不支持构造被记录，不影响后续声明
     */
    protected void guarded(Runnable action) {
        try {
            action.run();
        } catch (UnsupportedConstructException e) {
            report(e);
        }
    }

    protected UnsupportedConstructException unsupported(String message, SourceLocation loc) {
        return UnsupportedConstructException.unsupported(message + " on " + target.getId(), loc);
    }

    protected UnsupportedConstructException violation(String message, SourceLocation loc) {
        return UnsupportedConstructException.violation(message + " on " + target.getId(), loc);
    }

    // ==================== 语句 ====================

    /** 块内语句序列，子类可覆盖以处理尾部语句 */
    protected void emitStatements(List<Statement> stmts) {
        for (Statement stmt : stmts) {
            emitStatement(stmt);
        }
    }

    /** 语句边界 */
    protected void emitStatement(Statement stmt) {
        try {
            stmt.accept(this, null);
        } catch (UnsupportedConstructException e) {
            report(e);
        }
    }

    /**
     * 函数体：按调用顺序内联修饰器（参数绑定为嵌套块中的局部变量），然后是函数体本身。
     * 修饰器中的 _; 已被死代码消除移除时（其前方必然终止），函数体不再发射。
     *
     * @return 函数体是否被发射
     */
    protected boolean emitFunctionBody(FunctionDecl fn) {
        for (ModifierInvocation inv : fn.getModifiers()) {
            ModifierDecl mod = contract.findModifier(inv.getName());
            if (mod == null) {
                throw new InternalInvariantViolation("Unresolved modifier '" + inv.getName() + "'",
                        inv.getLocation());
            }
            out.open("");
            List<Parameter> params = mod.getParameters();
            for (int i = 0; i < params.size() && i < inv.getArguments().size(); i++) {
                Parameter p = params.get(i);
                emitBinding(localName(p.getName()), false, p.getType().getResolvedType(),
                        inv.getArguments().get(i), p.getLocation());
            }
            List<Statement> stmts = new ArrayList<Statement>();
            boolean hasPlaceholder = false;
            for (Statement s : mod.getBody().getStatements()) {
                if (s instanceof PlaceholderStmt) {
                    hasPlaceholder = true;
                } else {
                    stmts.add(s);
                }
            }
            emitStatements(stmts);
            out.close(blockTrailer());
            if (!hasPlaceholder) return false;
        }
        emitStatements(fn.getBody().getStatements());
        return true;
    }

    /** 独立块语句的结尾文本 */
    protected String blockTrailer() {
        return "";
    }

    /** 输出 let 绑定 */
    protected abstract void emitBinding(String name, boolean mutable, Type type, Expression value,
                                        SourceLocation loc);

    /**
     * 语句序列末尾是否必然终止（return、revert、require(false)、两个分支都终止的 if）
     */
    protected static boolean terminates(List<Statement> stmts) {
        if (stmts.isEmpty()) return false;
        Statement last = stmts.get(stmts.size() - 1);
        if (last instanceof ReturnStmt) return true;
        if (last instanceof RequireStmt) {
            RequireStmt req = (RequireStmt) last;
            return req.isRevert() || isFalseLiteral(req.getCondition());
        }
        if (last instanceof Block) return terminates(((Block) last).getStatements());
        if (last instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) last;
            if (!ifStmt.hasElse()) return false;
            Statement els = ifStmt.getElseBranch();
            List<Statement> elseStmts = els instanceof Block
                    ? ((Block) els).getStatements() : Collections.singletonList(els);
            return terminates(ifStmt.getThenBranch().getStatements()) && terminates(elseStmts);
        }
        return false;
    }

    /** 子树中是否出现内建值 */
    protected static boolean containsIntrinsic(AstNode node) {
        if (node instanceof IntrinsicExpr) return true;
        for (AstNode child : node.getChildren()) {
            if (child != null && containsIntrinsic(child)) return true;
        }
        return false;
    }

    protected static boolean isFalseLiteral(Expression expr) {
        return expr instanceof Literal && ((Literal) expr).isFalse();
    }

    // ==================== 表达式 ====================

    protected String expr(Expression e) {
        String code = e.accept(this, null);
        if (code == null) {
            throw new InternalInvariantViolation("No translation for " + e.getClass().getSimpleName(),
                    e.getLocation());
        }
        return code;
    }

    protected String joinExprs(List<Expression> exprs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expr(exprs.get(i)));
        }
        return sb.toString();
    }

    protected String intrinsic(IntrinsicExpr node) {
        String code = intrinsics.lookup(node.getIntrinsic());
        if (code == null) {
            throw unsupported("Intrinsic '" + node.getIntrinsic().getSourceName() + "' is not available",
                    node.getLocation());
        }
        return code;
    }

    /** lambda 体内禁止函数调用 */
    protected void checkCallAllowed(CallExpr call) {
        if (lambdaDepth > 0) {
            throw unsupported("Function call '" + call.getCallee() + "' inside a lambda is not supported",
                    call.getLocation());
        }
    }

    protected static boolean isStateVar(Expression expr) {
        return expr instanceof Identifier && ((Identifier) expr).getSymbol() != null
                && ((Identifier) expr).getSymbol().isStateVar();
    }

    /** 赋值目标在最外层之下是否经过 map 元素，如 m[k].f = v、m[k][i] = v */
    protected static boolean assignsThroughMapElement(Expression target) {
        Expression current = target;
        while (true) {
            Expression inner;
            if (current instanceof FieldAccessExpr) {
                inner = ((FieldAccessExpr) current).getTarget();
            } else if (current instanceof IndexExpr) {
                inner = ((IndexExpr) current).getTarget();
            } else {
                return false;
            }
            if (inner instanceof IndexExpr && ((IndexExpr) inner).getTarget().getType() instanceof MapType) {
                return true;
            }
            current = inner;
        }
    }

    // ==================== 类型 ====================

    protected String typeOf(TypeRef ref) {
        return typeName(ref.getResolvedType(), ref.getLocation());
    }

    /**
     * 查类型映射表翻译类型
     */
    protected String typeName(Type type, SourceLocation loc) {
        String result;
        switch (type.getKind()) {
            case INTEGER:
            case BOOL:
            case ADDRESS:
            case STRING:
            case BYTES:
                result = types.primitive(type.toString());
                break;
            case VECTOR:
                result = types.vector(typeName(((VectorType) type).getElementType(), loc));
                break;
            case ARRAY:
                ArrayType array = (ArrayType) type;
                result = types.array(typeName(array.getElementType(), loc), array.getSize());
                break;
            case MAP:
                return mapTypeName((MapType) type, loc);
            case TUPLE:
                return tupleTypeName((TupleType) type, loc);
            case OPTION:
                result = types.option(typeName(((OptionType) type).getInnerType(), loc));
                break;
            case RESULT:
                ResultType res = (ResultType) type;
                result = types.result(typeName(res.getOkType(), loc), typeName(res.getErrType(), loc));
                break;
            case STRUCT:
                return ((StructType) type).getName();
            default:
                throw new InternalInvariantViolation("Type " + type + " reached code generation", loc);
        }
        if (result == null) {
            throw unsupported("Type '" + type + "' is not supported", loc);
        }
        return result;
    }

    protected String mapTypeName(MapType type, SourceLocation loc) {
        String result = types.map(typeName(type.getKeyType(), loc), typeName(type.getValueType(), loc));
        if (result == null) throw unsupported("Type '" + type + "' is not supported", loc);
        return result;
    }

    protected String tupleTypeName(TupleType type, SourceLocation loc) {
        List<String> elements = new ArrayList<String>();
        for (Type t : type.getElementTypes()) {
            elements.add(typeName(t, loc));
        }
        String result = types.tuple(elements);
        if (result == null) throw unsupported("Type '" + type + "' is not supported", loc);
        return result;
    }

    protected static boolean containsMap(Type type) {
        switch (type.getKind()) {
            case MAP: return true;
            case VECTOR: return containsMap(((VectorType) type).getElementType());
            case ARRAY: return containsMap(((ArrayType) type).getElementType());
            case OPTION: return containsMap(((OptionType) type).getInnerType());
            case TUPLE:
                for (Type t : ((TupleType) type).getElementTypes()) {
                    if (containsMap(t)) return true;
                }
                return false;
            case STRUCT:
                for (Type t : ((StructType) type).getFields().values()) {
                    if (containsMap(t)) return true;
                }
                return false;
            default:
                return false;
        }
    }

    // ==================== 命名 ====================

    /** 局部变量与参数名，避开目标保留字和生成代码使用的名字 */
    protected String localName(String name) {
        return Names.escapeReserved(name, reserved);
    }

    protected String functionName(String name) {
        return Names.escapeReserved(Names.toSnake(name), reserved);
    }

    protected String constName(String name) {
        return Names.toSnake(name).toUpperCase();
    }

    /** 函数内唯一的临时变量名 */
    protected String temp(String prefix) {
        return "__" + prefix + "_" + tempCounter++;
    }

    /** 进入新函数：重置临时变量计数 */
    protected void beginFunction(Type returnType) {
        this.tempCounter = 0;
        this.returnType = returnType;
    }
}
