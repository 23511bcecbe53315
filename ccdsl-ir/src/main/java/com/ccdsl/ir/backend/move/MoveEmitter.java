package com.ccdsl.ir.backend.move;

import com.ccdsl.compiler.analysis.Symbol;
import com.ccdsl.compiler.analysis.SymbolKind;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.*;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.stmt.*;
import com.ccdsl.compiler.types.ArrayType;
import com.ccdsl.compiler.types.IntegerType;
import com.ccdsl.compiler.types.MapType;
import com.ccdsl.compiler.types.OptionType;
import com.ccdsl.compiler.types.PrimitiveType;
import com.ccdsl.compiler.types.StructType;
import com.ccdsl.compiler.types.TupleType;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.compiler.types.VectorType;
import com.ccdsl.ir.InternalInvariantViolation;
import com.ccdsl.ir.backend.CodegenResult;
import com.ccdsl.ir.backend.ContractEmitter;
import com.ccdsl.ir.backend.ErrorCodeRegistry;
import com.ccdsl.ir.backend.IntrinsicTable;
import com.ccdsl.ir.backend.Names;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.TypeMappingTable;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Move 系目标的公共发射逻辑。
 *
 * <p>Move 没有 match 和 for 语句，二者降级为基于临时变量的 if 链与 while 循环；
 * 块中最后一条 return/abort/if/while 语句不加分号，使块的值与函数返回类型一致。
 * 模块体先写入缓冲区，结束后按其中引用到的模块前缀生成 use 声明。</p>
 */
public abstract class MoveEmitter extends ContractEmitter {

    protected static final Set<String> MOVE_RESERVED = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "abort", "acquires", "as", "break", "const", "continue", "copy", "else", "entry", "enum",
            "false", "for", "friend", "fun", "has", "if", "invariant", "let", "loop", "macro", "match",
            "module", "move", "mut", "native", "phantom", "public", "return", "script", "spec", "struct",
            "true", "type", "use", "while",
            // 生成代码使用的名字
            "state", "caller", "ctx", "account", "init", "init_module", "table_get_or", "table_set")));

    private static final Pattern MODULE_PREFIX = Pattern.compile("(?<![A-Za-z0-9_:@])([a-z_][a-z0-9_]*)::");

    /** 下一条语句是否处于块尾 */
    private boolean tail;

    protected MoveEmitter(ContractDecl contract, Target target, TypeMappingTable types, IntrinsicTable intrinsics) {
        super(contract, target, types, intrinsics, MOVE_RESERVED,
                ErrorCodeRegistry.collect(contract, MoveEmitter::errorConstName, "_", "E_REQUIREMENT_FAILED",
                        Collections.<String>emptySet()));
    }

    private static String errorConstName(String message) {
        String name = Names.messageToUpperSnake(message);
        return name == null ? null : "E_" + name;
    }

    // ==================== 目标差异 ====================

    /** 可变局部变量的声明关键字 */
    protected abstract String letKeyword(boolean mutable);

    /** 结构体声明前缀（"struct" 或 "public struct"） */
    protected abstract String structKeyword();

    /** 事件结构体的能力列表 */
    protected abstract String eventAbilities();

    /** 事件结构体前的属性行，没有时为 null */
    protected String eventAttribute() {
        return null;
    }

    /** 状态结构体的固定首字段（Sui 的 id: UID） */
    protected void emitStateHeaderFields() {
    }

    /** 模块初始化函数 */
    protected abstract void emitInitializer();

    /** 一个公开函数的入口 */
    protected abstract void emitEntryPoint(FunctionDecl fn);

    /** 逻辑函数在 caller 之后的额外形参 */
    protected abstract String logicExtraParams();

    /** 调用逻辑函数时在参数列表最前的实参 */
    protected abstract String logicCallPrefix();

    /** 新建空表 */
    protected abstract String newTable();

    /** 按键读取 map，缺失时为默认值 */
    protected abstract String mapRead(String field, String key, Type valueType, SourceLocation loc);

    /** 按键写入 map */
    protected abstract void mapWrite(String field, String key, String value);

    /** map/filter 调用，closure 已是完整的 lambda 文本 */
    protected abstract String vectorHigherOrder(String method, String vector, String closure);

    /** 模块体末尾的辅助函数 */
    protected void emitHelpers() {
    }

    /** 模块别名 → use 路径；不在表中的前缀无需声明 */
    protected abstract Map<String, String> moduleUses();

    // ==================== 模块 ====================

    @Override
    protected CodegenResult assemble(CodegenResult result) {
        if (!result.isSuccess()) return result;
        String body = result.getText().replaceAll("\\n+$", "\n");
        Set<String> uses = new TreeSet<String>();
        Map<String, String> known = moduleUses();
        Matcher m = MODULE_PREFIX.matcher(body);
        while (m.find()) {
            String path = known.get(m.group(1));
            if (path != null) uses.add(path);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("module ccdsl::").append(Names.toSnake(contract.getName())).append(" {\n");
        for (String use : uses) {
            sb.append("    use ").append(use).append(";\n");
        }
        if (!uses.isEmpty()) sb.append('\n');
        sb.append(body);
        sb.append("}\n");
        return new CodegenResult(target, sb.toString(), result.getDiagnostics());
    }

    @Override
    protected void emitContract() {
        out.indent();
        emitConstants();
        emitErrorCodes();
        for (StructDecl struct : contract.getStructs()) {
            guarded(() -> emitStruct(struct));
        }
        for (EventDecl event : contract.getEvents()) {
            guarded(() -> emitEvent(event));
        }
        emitState();
        guarded(this::emitInitializer);
        out.blankLine();
        for (FunctionDecl fn : contract.getFunctions()) {
            if (!fn.isPublic()) continue;
            guarded(() -> emitEntryPoint(fn));
            out.blankLine();
        }
        for (FunctionDecl fn : contract.getFunctions()) {
            guarded(() -> emitLogicFunction(fn));
            out.blankLine();
        }
        emitHelpers();
        out.dedent();
    }

    private void emitConstants() {
        for (ConstDecl c : contract.getConstants()) {
            guarded(() -> emitConstant(c));
        }
        out.blankLine();
    }

    private void emitConstant(ConstDecl c) {
        if (!(c.getValue() instanceof Literal)) {
            throw unsupported("Constant '" + c.getName() + "' does not reduce to a literal", c.getLocation());
        }
        Literal value = (Literal) c.getValue();
        Type type = c.getType().getResolvedType();
        String typeName;
        String code;
        switch (type.getKind()) {
            case STRING:
            case BYTES:
                // 字符串常量以字节串存放，使用处再转换
                typeName = "vector<u8>";
                code = "b\"" + Names.escapeByteString(value.getStringValue()) + "\"";
                break;
            case INTEGER:
            case BOOL:
                typeName = typeName(type, c.getLocation());
                code = expr(value);
                break;
            default:
                throw unsupported("Constant of type '" + type + "' is not supported", c.getLocation());
        }
        out.line("const " + constName(c.getName()) + ": " + typeName + " = " + code + ";");
    }

    private void emitErrorCodes() {
        int code = 1;
        for (String name : errors.getCodes().values()) {
            out.line("const " + name + ": u64 = " + code++ + ";");
        }
        out.line("const " + errors.getDefaultCode() + ": u64 = " + code + ";");
        out.blankLine();
    }

    private void emitStruct(StructDecl struct) {
        out.open(structKeyword() + " " + struct.getName() + " has copy, drop, store");
        for (FieldDecl f : struct.getFields()) {
            out.line(localName(f.getName()) + ": " + typeOf(f.getType()) + ",");
        }
        out.close();
        out.blankLine();
    }

    private void emitEvent(EventDecl event) {
        String attribute = eventAttribute();
        if (attribute != null) out.line(attribute);
        out.open(structKeyword() + " " + event.getName() + " has " + eventAbilities());
        for (Parameter f : event.getFields()) {
            out.line(localName(f.getName()) + ": " + typeOf(f.getType()) + ",");
        }
        out.close();
        out.blankLine();
    }

    private void emitState() {
        out.open(structKeyword() + " State has key");
        emitStateHeaderFields();
        for (StateVarDecl sv : contract.getStateVars()) {
            guarded(() -> out.line(localName(sv.getName()) + ": " + stateFieldType(sv) + ","));
        }
        out.close();
        out.blankLine();
    }

    private String stateFieldType(StateVarDecl sv) {
        Type type = sv.getType().getResolvedType();
        if (type instanceof MapType) {
            MapType map = (MapType) type;
            String result = types.map(typeName(map.getKeyType(), sv.getLocation()),
                    typeName(map.getValueType(), sv.getLocation()));
            if (result == null) throw unsupported("Type '" + type + "' is not supported", sv.getLocation());
            return result;
        }
        return typeName(type, sv.getLocation());
    }

    /**
     * State 的字段初始化表达式，供初始化函数使用
     */
    protected void emitStateFieldValues() {
        for (StateVarDecl sv : contract.getStateVars()) {
            guarded(() -> {
                Type type = sv.getType().getResolvedType();
                String value;
                if (type instanceof MapType) {
                    value = newTable();
                } else if (sv.getDefaultValue() != null) {
                    value = expr(sv.getDefaultValue());
                } else {
                    value = defaultValue(type, sv.getLocation());
                }
                out.line(localName(sv.getName()) + ": " + value + ",");
            });
        }
    }

    /** 某个状态字段的默认值引用了内建值 */
    protected boolean stateDefaultsUseIntrinsics() {
        for (StateVarDecl sv : contract.getStateVars()) {
            if (sv.getDefaultValue() != null && containsIntrinsic(sv.getDefaultValue())) return true;
        }
        return false;
    }

    private void emitLogicFunction(FunctionDecl fn) {
        Type ret = fn.hasReturnType() ? fn.getReturnType().getResolvedType() : PrimitiveType.VOID;
        beginFunction(ret);
        out.open("fun " + functionName(fn.getName()) + "_logic(state: &mut State, caller: address"
                + logicExtraParams() + parameterList(fn) + ")" + returnClause(fn));
        emitFunctionBody(fn);
        out.close();
    }

    /** ", a: T, b: U" */
    protected String parameterList(FunctionDecl fn) {
        StringBuilder sb = new StringBuilder();
        for (Parameter p : fn.getParameters()) {
            sb.append(", ").append(localName(p.getName())).append(": ").append(typeOf(p.getType()));
        }
        return sb.toString();
    }

    /** ", a, b" */
    protected String argumentList(FunctionDecl fn) {
        StringBuilder sb = new StringBuilder();
        for (Parameter p : fn.getParameters()) {
            sb.append(", ").append(localName(p.getName()));
        }
        return sb.toString();
    }

    /** 返回类型子句；元组只允许出现在这里 */
    protected String returnClause(FunctionDecl fn) {
        if (!fn.hasReturnType()) return "";
        Type ret = fn.getReturnType().getResolvedType();
        if (ret instanceof TupleType) {
            StringBuilder sb = new StringBuilder(": (");
            List<Type> elements = ((TupleType) ret).getElementTypes();
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeName(elements.get(i), fn.getReturnType().getLocation()));
            }
            return sb.append(")").toString();
        }
        return ": " + typeOf(fn.getReturnType());
    }

    @Override
    protected String mapTypeName(MapType type, SourceLocation loc) {
        throw violation("Map type " + type + " can only be used as a state field", loc);
    }

    @Override
    protected String tupleTypeName(TupleType type, SourceLocation loc) {
        throw unsupported("Tuple type " + type + " is only supported as a return type", loc);
    }

    /**
     * 类型的默认值，用于缺省状态字段和缺失的 map 键
     */
    protected String defaultValue(Type type, SourceLocation loc) {
        switch (type.getKind()) {
            case INTEGER:
                typeName(type, loc);
                return "0" + type;
            case BOOL:
                return "false";
            case ADDRESS:
                return "@0x0";
            case STRING:
                return "string::utf8(b\"\")";
            case BYTES:
                return "vector<u8>[]";
            case VECTOR:
                return "vector<" + typeName(((VectorType) type).getElementType(), loc) + ">[]";
            case ARRAY: {
                ArrayType array = (ArrayType) type;
                String element = defaultValue(array.getElementType(), loc);
                StringBuilder sb = new StringBuilder("vector<")
                        .append(typeName(array.getElementType(), loc)).append(">[");
                for (int i = 0; i < array.getSize(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(element);
                }
                return sb.append("]").toString();
            }
            case OPTION:
                return "option::none<" + typeName(((OptionType) type).getInnerType(), loc) + ">()";
            case STRUCT: {
                StructType struct = (StructType) type;
                StringBuilder sb = new StringBuilder(struct.getName()).append(" { ");
                boolean first = true;
                for (Map.Entry<String, Type> f : struct.getFields().entrySet()) {
                    if (!first) sb.append(", ");
                    first = false;
                    sb.append(localName(f.getKey())).append(": ").append(defaultValue(f.getValue(), loc));
                }
                return sb.append(" }").toString();
            }
            default:
                throw unsupported("No default value for type '" + type + "'", loc);
        }
    }

    // ==================== 语句 ====================

    @Override
    protected void emitStatements(List<Statement> stmts) {
        for (int i = 0; i < stmts.size(); i++) {
            tail = i == stmts.size() - 1;
            emitStatement(stmts.get(i));
        }
        tail = false;
    }

    /** 当前语句的结尾：块尾不加分号 */
    private String semi() {
        boolean last = tail;
        tail = false;
        return last ? "" : ";";
    }

    @Override
    protected String blockTrailer() {
        return ";";
    }

    @Override
    protected void emitBinding(String name, boolean mutable, Type type, Expression value, SourceLocation loc) {
        out.line(letKeyword(mutable) + " " + name + ": " + typeName(type, loc) + " = " + expr(value) + ";");
    }

    @Override
    public String visitLetStmt(LetStmt node, Void ctx) {
        tail = false;
        Type type = node.getSymbol() != null ? node.getSymbol().getType() : node.getInitializer().getType();
        emitBinding(localName(node.getName()), node.isMutable(), type, node.getInitializer(), node.getLocation());
        return null;
    }

    @Override
    public String visitAssignStmt(AssignStmt node, Void ctx) {
        tail = false;
        Expression target = node.getTarget();
        if (assignsThroughMapElement(target)) {
            throw unsupported("Assignment through a map element is not supported", node.getLocation());
        }
        if (target instanceof IndexExpr && ((IndexExpr) target).getTarget().getType() instanceof MapType) {
            IndexExpr index = (IndexExpr) target;
            String field = stateMapField(index);
            String key = temp("key");
            String value = temp("value");
            out.line("let " + key + " = " + expr(index.getIndex()) + ";");
            out.line("let " + value + " = " + expr(node.getValue()) + ";");
            mapWrite(field, key, value);
            return null;
        }
        if (target instanceof Identifier) {
            out.line(path(target, true) + " = " + expr(node.getValue()) + ";");
            return null;
        }
        // 先求值右侧，再取可变引用
        String value = temp("value");
        out.line("let " + value + " = " + expr(node.getValue()) + ";");
        out.line(lvalue(target) + " = " + value + ";");
        return null;
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) {
        tail = false;
        out.line(expr(node.getExpression()) + ";");
        return null;
    }

    @Override
    public String visitIfStmt(IfStmt node, Void ctx) {
        String end = semi();
        out.open("if (" + expr(node.getCondition()) + ")");
        emitStatements(node.getThenBranch().getStatements());
        Statement els = node.getElseBranch();
        while (els instanceof IfStmt) {
            IfStmt elseIf = (IfStmt) els;
            out.dedent();
            out.open("} else if (" + expr(elseIf.getCondition()) + ")");
            emitStatements(elseIf.getThenBranch().getStatements());
            els = elseIf.getElseBranch();
        }
        if (els != null) {
            out.dedent();
            out.open("} else");
            emitStatements(els instanceof Block ? ((Block) els).getStatements() : Collections.singletonList(els));
        }
        out.close(end);
        return null;
    }

    @Override
    public String visitWhileStmt(WhileStmt node, Void ctx) {
        String end = semi();
        out.open("while (" + expr(node.getCondition()) + ")");
        emitStatements(node.getBody().getStatements());
        out.close(end);
        return null;
    }

    @Override
    public String visitForRangeStmt(ForRangeStmt node, Void ctx) {
        String end = semi();
        Type type = node.getSymbol() != null ? node.getSymbol().getType() : node.getStart().getType();
        String typeName = typeName(type, node.getLocation());
        String index = temp("i");
        String limit = temp("end");
        out.line(letKeyword(true) + " " + index + ": " + typeName + " = " + expr(node.getStart()) + ";");
        out.line("let " + limit + ": " + typeName + " = " + expr(node.getEnd()) + ";");
        out.open("while (" + index + " < " + limit + ")");
        out.line("let " + localName(node.getVariable()) + " = " + index + ";");
        emitLoopBody(node.getBody());
        out.line(index + " = " + index + " + 1" + type + ";");
        out.close(end);
        return null;
    }

    @Override
    public String visitForEachStmt(ForEachStmt node, Void ctx) {
        String end = semi();
        String vector = temp("v");
        String length = temp("n");
        String index = temp("i");
        out.line("let " + vector + " = " + expr(node.getIterable()) + ";");
        out.line("let " + length + " = vector::length(&" + vector + ");");
        out.line(letKeyword(true) + " " + index + " = 0;");
        out.open("while (" + index + " < " + length + ")");
        out.line("let " + localName(node.getVariable()) + " = *vector::borrow(&" + vector + ", " + index + ");");
        emitLoopBody(node.getBody());
        out.line(index + " = " + index + " + 1;");
        out.close(end);
        return null;
    }

    /** 循环体之后还有自增语句，循环体的最后一条不是块尾 */
    private void emitLoopBody(Block body) {
        for (Statement stmt : body.getStatements()) {
            tail = false;
            emitStatement(stmt);
        }
    }

    @Override
    public String visitMatchStmt(MatchStmt node, Void ctx) {
        String end = semi();
        String scrutinee = temp("m");
        out.line("let " + scrutinee + " = " + expr(node.getScrutinee()) + ";");
        boolean first = true;
        boolean open = false;
        for (MatchArm arm : node.getArms()) {
            if (arm.getPattern().isWildcard()) {
                if (first) {
                    out.open("");
                } else {
                    out.dedent();
                    out.open("} else");
                }
                emitStatements(arm.getBlock().getStatements());
                open = true;
                break;
            }
            String cond = patternCondition(scrutinee, arm.getPattern(), node.getScrutinee().getType());
            if (first) {
                out.open("if (" + cond + ")");
            } else {
                out.dedent();
                out.open("} else if (" + cond + ")");
            }
            emitStatements(arm.getBlock().getStatements());
            first = false;
            open = true;
        }
        if (open) out.close(end);
        return null;
    }

    @Override
    public String visitRequireStmt(RequireStmt node, Void ctx) {
        String code = errors.codeFor(node.getMessage());
        if (node.isRevert() || isFalseLiteral(node.getCondition())) {
            out.line("abort " + code + semi());
        } else {
            tail = false;
            out.line("assert!(" + expr(node.getCondition()) + ", " + code + ");");
        }
        return null;
    }

    @Override
    public String visitEmitStmt(EmitStmt node, Void ctx) {
        tail = false;
        EventDecl event = contract.findEvent(node.getEventName());
        if (event == null) {
            throw new InternalInvariantViolation("Unresolved event '" + node.getEventName() + "'", node.getLocation());
        }
        StringBuilder sb = new StringBuilder("event::emit(").append(event.getName()).append(" { ");
        for (int i = 0; i < event.getFields().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(localName(event.getFields().get(i).getName())).append(": ")
              .append(expr(node.getArguments().get(i)));
        }
        out.line(sb.append(" });").toString());
        return null;
    }

    @Override
    public String visitReturnStmt(ReturnStmt node, Void ctx) {
        String end = semi();
        Expression value = node.getValue();
        if (value == null) {
            out.line("return" + end);
        } else if (value instanceof TupleLiteral) {
            out.line("return (" + joinExprs(((TupleLiteral) value).getElements()) + ")" + end);
        } else {
            out.line("return " + expr(value) + end);
        }
        return null;
    }

    @Override
    public String visitBlock(Block node, Void ctx) {
        String end = semi();
        out.open("");
        emitStatements(node.getStatements());
        out.close(end);
        return null;
    }

    @Override
    public String visitPlaceholderStmt(PlaceholderStmt node, Void ctx) {
        tail = false;
        return null;
    }

    // ==================== 表达式 ====================

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INTEGER:
                typeName(node.getType(), node.getLocation());
                return node.getIntegerValue() + node.getType().toString();
            case BOOL:
                return String.valueOf(node.getBoolValue());
            case STRING:
                return "string::utf8(b\"" + Names.escapeByteString(node.getStringValue()) + "\")";
            case BYTES:
                return "b\"" + Names.escapeByteString(node.getStringValue()) + "\"";
            default:
                throw new InternalInvariantViolation("Unknown literal kind " + node.getKind(), node.getLocation());
        }
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        Symbol symbol = node.getSymbol();
        if (symbol != null && symbol.getKind() == SymbolKind.CONSTANT) {
            String name = constName(node.getName());
            return node.getType().getKind() == Type.Kind.STRING ? "string::utf8(" + name + ")" : name;
        }
        if (node.getType() instanceof MapType) {
            throw violation("Map '" + node.getName() + "' can only be accessed by key", node.getLocation());
        }
        return path(node, false);
    }

    @Override
    public String visitIntrinsicExpr(IntrinsicExpr node, Void ctx) {
        return intrinsic(node);
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        if (node.getOperator() == UnaryExpr.UnaryOp.NEG) {
            throw unsupported("Negation of signed integers is not supported", node.getLocation());
        }
        return "!" + operand(node.getOperand());
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return operand(node.getLeft()) + " " + node.getOperator().toSourceString() + " " + operand(node.getRight());
    }

    private String operand(Expression e) {
        String code = expr(e);
        boolean compound = e instanceof BinaryExpr || e instanceof TernaryExpr || e instanceof CastExpr;
        return compound ? "(" + code + ")" : code;
    }

    @Override
    public String visitTernaryExpr(TernaryExpr node, Void ctx) {
        return "if (" + expr(node.getCondition()) + ") " + expr(node.getThenExpr())
                + " else " + expr(node.getElseExpr());
    }

    @Override
    public String visitCastExpr(CastExpr node, Void ctx) {
        String operand = expr(node.getOperand());
        if (node.getOperand().getType().equals(node.getType())) return operand;
        return "(" + operand + " as " + typeName(node.getType(), node.getLocation()) + ")";
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        checkCallAllowed(node);
        String callee = functionName(node.getCallee()) + "_logic";
        if (node.getArguments().isEmpty()) {
            return callee + "(" + logicCallPrefix() + ")";
        }
        // 实参先求值到临时变量，再把 state 借给被调函数
        StringBuilder sb = new StringBuilder("{ ");
        StringBuilder args = new StringBuilder();
        for (Expression arg : node.getArguments()) {
            String t = temp("arg");
            sb.append("let ").append(t).append(" = ").append(expr(arg)).append("; ");
            args.append(", ").append(t);
        }
        return sb.append(callee).append("(").append(logicCallPrefix()).append(args).append(") }").toString();
    }

    @Override
    public String visitMethodCallExpr(MethodCallExpr node, Void ctx) {
        Expression receiver = node.getReceiver();
        String method = node.getMethodName();
        if ("len".equals(method)) {
            String ref = ref(receiver, false);
            if (ref != null) return "vector::length(" + ref + ")";
            String t = temp("t");
            return "{ let " + t + " = " + expr(receiver) + "; vector::length(&" + t + ") }";
        }
        if ("push".equals(method)) {
            String ref = ref(receiver, true);
            if (ref == null) {
                throw unsupported("Mutation through a map element is not supported", node.getLocation());
            }
            return "vector::push_back(" + ref + ", " + expr(node.getArguments().get(0)) + ")";
        }
        if ("map".equals(method) || "filter".equals(method)) {
            LambdaExpr lambda = (LambdaExpr) node.getArguments().get(0);
            String param = localName(lambda.getParameters().get(0).getName());
            String vector = expr(receiver);
            lambdaDepth++;
            String body;
            try {
                body = expr(lambda.getBody());
            } finally {
                lambdaDepth--;
            }
            String closure = "map".equals(method)
                    ? "|" + param + "| " + body
                    : "|" + param + "| { let " + param + " = *" + param + "; " + body + " }";
            return vectorHigherOrder(method, vector, closure);
        }
        throw new InternalInvariantViolation("Unknown method '" + method + "'", node.getLocation());
    }

    @Override
    public String visitFieldAccessExpr(FieldAccessExpr node, Void ctx) {
        if (node.isTupleIndex()) {
            throw unsupported("Tuple element access is not supported", node.getLocation());
        }
        String path = path(node, false);
        if (path != null) return path;
        String t = temp("t");
        return "{ let " + t + " = " + expr(node.getTarget()) + "; " + t + "." + localName(node.getFieldName()) + " }";
    }

    @Override
    public String visitIndexExpr(IndexExpr node, Void ctx) {
        if (node.getTarget().getType() instanceof MapType) {
            return mapRead(stateMapField(node), expr(node.getIndex()), node.getType(), node.getLocation());
        }
        String ref = ref(node.getTarget(), false);
        if (ref != null) return "*vector::borrow(" + ref + ", " + index(node.getIndex()) + ")";
        String t = temp("t");
        return "{ let " + t + " = " + expr(node.getTarget()) + "; *vector::borrow(&" + t + ", "
                + index(node.getIndex()) + ") }";
    }

    private String index(Expression index) {
        String code = expr(index);
        return IntegerType.U64.equals(index.getType()) ? code : "(" + code + " as u64)";
    }

    @Override
    public String visitStructLiteral(StructLiteral node, Void ctx) {
        StringBuilder sb = new StringBuilder(node.getStructName()).append(" { ");
        for (int i = 0; i < node.getFieldNames().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(localName(node.getFieldNames().get(i))).append(": ").append(expr(node.getValues().get(i)));
        }
        return sb.append(" }").toString();
    }

    @Override
    public String visitArrayLiteral(ArrayLiteral node, Void ctx) {
        Type element = node.getType() instanceof ArrayType
                ? ((ArrayType) node.getType()).getElementType()
                : ((VectorType) node.getType()).getElementType();
        return "vector<" + typeName(element, node.getLocation()) + ">[" + joinExprs(node.getElements()) + "]";
    }

    @Override
    public String visitTupleLiteral(TupleLiteral node, Void ctx) {
        throw unsupported("Tuple values are only supported in return statements", node.getLocation());
    }

    @Override
    public String visitLambdaExpr(LambdaExpr node, Void ctx) {
        throw unsupported("Lambda outside map/filter", node.getLocation());
    }

    @Override
    public String visitMatchExpr(MatchExpr node, Void ctx) {
        String scrutinee = temp("m");
        StringBuilder sb = new StringBuilder("{ let ").append(scrutinee).append(" = ")
                .append(expr(node.getScrutinee())).append("; ");
        boolean first = true;
        for (MatchArm arm : node.getArms()) {
            if (arm.getPattern().isWildcard()) {
                sb.append(first ? "" : " else ").append(expr(arm.getValue()));
                break;
            }
            String cond = patternCondition(scrutinee, arm.getPattern(), node.getScrutinee().getType());
            sb.append(first ? "" : " else ").append("if (").append(cond).append(") ").append(expr(arm.getValue()));
            first = false;
        }
        return sb.append(" }").toString();
    }

    private String patternCondition(String scrutinee, MatchPattern pattern, Type type) {
        if (pattern.getKind() == MatchPattern.PatternKind.RANGE) {
            BigInteger low = pattern.getLow().getIntegerValue();
            BigInteger high = pattern.getHigh().getIntegerValue();
            return "(" + scrutinee + " >= " + low + type + " && " + scrutinee + " < " + high + type + ")";
        }
        return scrutinee + " == " + expr(pattern.getLow());
    }

    // ==================== 路径与引用 ====================

    /**
     * 可直接读写的路径（变量、状态字段、字段链），不可寻址时返回 null
     */
    protected String path(Expression e, boolean mutable) {
        if (e instanceof Identifier) {
            Identifier id = (Identifier) e;
            Symbol symbol = id.getSymbol();
            if (symbol != null && symbol.getKind() == SymbolKind.CONSTANT) return null;
            String name = localName(id.getName());
            return isStateVar(id) ? "state." + name : name;
        }
        if (e instanceof FieldAccessExpr && !((FieldAccessExpr) e).isTupleIndex()) {
            FieldAccessExpr access = (FieldAccessExpr) e;
            Expression target = access.getTarget();
            String base = target instanceof IndexExpr ? ref(target, mutable) : path(target, mutable);
            return base == null ? null : base + "." + localName(access.getFieldName());
        }
        return null;
    }

    /**
     * 引用表达式（&amp;T 或 &amp;mut T），不可寻址时返回 null
     */
    protected String ref(Expression e, boolean mutable) {
        if (e instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) e;
            if (index.getTarget().getType() instanceof MapType) return null;
            String inner = ref(index.getTarget(), mutable);
            if (inner == null) return null;
            return (mutable ? "vector::borrow_mut(" : "vector::borrow(") + inner + ", " + index(index.getIndex()) + ")";
        }
        String path = path(e, mutable);
        if (path == null) return null;
        return (mutable ? "&mut " : "&") + path;
    }

    /** 赋值左侧 */
    private String lvalue(Expression target) {
        if (target instanceof IndexExpr) {
            String ref = ref(target, true);
            if (ref != null) return "*" + ref;
        } else {
            String path = path(target, true);
            if (path != null) return path;
        }
        throw new InternalInvariantViolation("Not an assignable expression: " + target.getClass().getSimpleName(),
                target.getLocation());
    }

    protected String stateMapField(IndexExpr index) {
        if (!isStateVar(index.getTarget())) {
            throw violation("Map type " + index.getTarget().getType() + " can only be used as a state field",
                    index.getLocation());
        }
        return "state." + localName(((Identifier) index.getTarget()).getName());
    }
}
