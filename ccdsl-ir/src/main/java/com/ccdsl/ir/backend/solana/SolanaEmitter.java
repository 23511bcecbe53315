package com.ccdsl.ir.backend.solana;

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
import com.ccdsl.compiler.types.TupleType;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.compiler.types.VectorType;
import com.ccdsl.ir.InternalInvariantViolation;
import com.ccdsl.ir.backend.ContractEmitter;
import com.ccdsl.ir.backend.ErrorCodeRegistry;
import com.ccdsl.ir.backend.MapStoragePolicy;
import com.ccdsl.ir.backend.Names;
import com.ccdsl.ir.backend.Target;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Anchor 程序发射器
 */
class SolanaEmitter extends ContractEmitter {

    private static final Set<String> RESERVED = new HashSet<String>(Arrays.asList(
            "as", "break", "const", "continue", "crate", "else", "enum", "extern", "false", "fn", "for",
            "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref", "return",
            "self", "Self", "static", "struct", "super", "trait", "true", "type", "unsafe", "use",
            "where", "while", "async", "await", "dyn", "abstract", "become", "box", "do", "final",
            "macro", "override", "priv", "typeof", "unsized", "virtual", "yield", "try",
            // 生成代码使用的名字
            "state", "caller", "ctx", "initialize_state", "map_get", "map_set"));

    private static final String OVERFLOW = "ArithmeticOverflow";
    private static final String CAPACITY = "MapCapacityExceeded";
    /** string、bytes 与 vec 字段在账户空间中的长度上限 */
    static final int MAX_COLLECTION_LEN = 32;

    private static final Pattern ATOM = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*|[0-9][A-Za-z0-9_]*");

    private final MapStoragePolicy mapPolicy;
    private final boolean usesMaps;

    SolanaEmitter(ContractDecl contract, MapStoragePolicy mapPolicy) {
        super(contract, Target.SOLANA, SolanaGenerator.TYPES, SolanaGenerator.INTRINSICS, RESERVED,
                ErrorCodeRegistry.collect(contract, Names::messageToPascal, "", "RequirementFailed",
                        new HashSet<String>(Arrays.asList(OVERFLOW, CAPACITY))));
        this.mapPolicy = mapPolicy;
        this.usesMaps = mapPolicy == MapStoragePolicy.BOUNDED && hasMapState(contract);
    }

    private static boolean hasMapState(ContractDecl contract) {
        for (StateVarDecl sv : contract.getStateVars()) {
            if (sv.getType().getResolvedType() instanceof MapType) return true;
        }
        return false;
    }

    @Override
    protected void emitContract() {
        out.line("use anchor_lang::prelude::*;");
        out.blankLine();
        out.line("declare_id!(\"11111111111111111111111111111111\");");
        out.blankLine();

        emitConstants();
        emitProgram();
        for (FunctionDecl fn : contract.getFunctions()) {
            guarded(() -> emitLogicFunction(fn));
        }
        emitAccountStructs();
        emitState();
        for (StructDecl struct : contract.getStructs()) {
            guarded(() -> emitStruct(struct));
        }
        for (EventDecl event : contract.getEvents()) {
            guarded(() -> emitEvent(event));
        }
        emitErrorCodes();
        if (usesMaps) {
            emitMapHelpers();
        }
    }

    // ==================== 声明 ====================

    private void emitConstants() {
        if (usesMaps) {
            out.line("pub const MAP_CAPACITY: usize = " + mapPolicy.getCapacity() + ";");
        }
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
                typeName = "&str";
                code = "\"" + Names.escapeString(value.getStringValue()) + "\"";
                break;
            case BYTES:
                typeName = "&[u8]";
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
        out.line("pub const " + constName(c.getName()) + ": " + typeName + " = " + code + ";");
    }

    private void emitProgram() {
        out.line("#[program]");
        out.open("pub mod " + Names.toSnake(contract.getName()));
        out.line("use super::*;");
        out.blankLine();

        out.open("pub fn initialize_state(ctx: Context<InitializeStateAccounts>) -> Result<()>");
        beginFunction(PrimitiveType.VOID);
        boolean hasDefaults = false;
        boolean needsCaller = false;
        for (StateVarDecl sv : contract.getStateVars()) {
            if (sv.getDefaultValue() == null) continue;
            hasDefaults = true;
            needsCaller |= containsIntrinsic(sv.getDefaultValue());
        }
        if (needsCaller) {
            out.line("let caller = ctx.accounts.user.key();");
        }
        if (hasDefaults) {
            out.line("let state = &mut ctx.accounts.state;");
        }
        for (StateVarDecl sv : contract.getStateVars()) {
            if (sv.getDefaultValue() == null) continue;
            guarded(() -> out.line("state." + localName(sv.getName()) + " = " + expr(sv.getDefaultValue()) + ";"));
        }
        out.line("Ok(())");
        out.close();

        for (FunctionDecl fn : contract.getFunctions()) {
            if (!fn.isPublic()) continue;
            guarded(() -> emitInstruction(fn));
        }
        out.close();
        out.blankLine();
    }

    private void emitInstruction(FunctionDecl fn) {
        String name = functionName(fn.getName());
        StringBuilder sig = new StringBuilder();
        StringBuilder args = new StringBuilder();
        sig.append("pub fn ").append(name).append("(ctx: Context<").append(accountsName(fn)).append(">");
        for (Parameter p : fn.getParameters()) {
            sig.append(", ").append(localName(p.getName())).append(": ").append(typeOf(p.getType()));
            args.append(", ").append(localName(p.getName()));
        }
        sig.append(") -> ").append(resultType(fn));

        out.blankLine();
        out.open(sig.toString());
        out.line("let caller = ctx.accounts.user.key();");
        out.line(name + "_logic(&mut ctx.accounts.state, caller" + args + ")");
        out.close();
    }

    private void emitLogicFunction(FunctionDecl fn) {
        StringBuilder sig = new StringBuilder();
        sig.append("fn ").append(functionName(fn.getName())).append("_logic(state: &mut State, caller: Pubkey");
        for (Parameter p : fn.getParameters()) {
            sig.append(", ").append(localName(p.getName())).append(": ").append(typeOf(p.getType()));
        }
        sig.append(") -> ").append(resultType(fn));

        Type ret = fn.hasReturnType() ? fn.getReturnType().getResolvedType()
                : PrimitiveType.VOID;
        beginFunction(ret);
        out.open(sig.toString());
        boolean bodyEmitted = emitFunctionBody(fn);
        if (bodyEmitted && ret.isVoid() && !terminates(fn.getBody().getStatements())) {
            out.line("Ok(())");
        }
        out.close();
        out.blankLine();
    }

    private String resultType(FunctionDecl fn) {
        if (!fn.hasReturnType()) return "Result<()>";
        return "Result<" + typeOf(fn.getReturnType()) + ">";
    }

    private String accountsName(FunctionDecl fn) {
        return Names.toPascal(functionName(fn.getName())) + "Accounts";
    }

    private void emitAccountStructs() {
        out.line("#[derive(Accounts)]");
        out.open("pub struct InitializeStateAccounts<'info>");
        out.line("#[account(init, payer = user, space = 8 + State::INIT_SPACE, seeds = [b\"state\"], bump)]");
        out.line("pub state: Account<'info, State>,");
        out.line("#[account(mut)]");
        out.line("pub user: Signer<'info>,");
        out.line("pub system_program: Program<'info, System>,");
        out.close();
        out.blankLine();

        for (FunctionDecl fn : contract.getFunctions()) {
            if (!fn.isPublic()) continue;
            out.line("#[derive(Accounts)]");
            out.open("pub struct " + accountsName(fn) + "<'info>");
            out.line("#[account(mut, seeds = [b\"state\"], bump)]");
            out.line("pub state: Account<'info, State>,");
            out.line("pub user: Signer<'info>,");
            out.close();
            out.blankLine();
        }
    }

    private void emitState() {
        out.line("#[account]");
        out.line("#[derive(InitSpace)]");
        out.open("pub struct State");
        for (StateVarDecl sv : contract.getStateVars()) {
            guarded(() -> emitStateField(sv));
        }
        out.close();
        out.blankLine();
    }

    private void emitStateField(StateVarDecl sv) {
        Type type = sv.getType().getResolvedType();
        String typeName;
        if (type instanceof MapType) {
            MapType map = (MapType) type;
            if (mapPolicy == MapStoragePolicy.REJECT) {
                throw violation("State field '" + sv.getName() + "' of type " + type
                        + " cannot be stored in an account under the REJECT map policy", sv.getLocation());
            }
            if (isCollection(map.getValueType())) {
                throw violation("Map value type " + map.getValueType()
                        + " is a nested collection and cannot be stored in a bounded map", sv.getLocation());
            }
            typeName = types.map(typeName(map.getKeyType(), sv.getLocation()),
                    typeName(map.getValueType(), sv.getLocation()));
        } else {
            typeName = typeName(type, sv.getLocation());
        }
        emitMaxLen(type);
        out.line("pub " + localName(sv.getName()) + ": " + typeName + ",");
    }

    private void emitStruct(StructDecl struct) {
        out.line("#[derive(AnchorSerialize, AnchorDeserialize, Clone, Debug, Default, PartialEq, InitSpace)]");
        out.open("pub struct " + struct.getName());
        for (FieldDecl f : struct.getFields()) {
            Type type = f.getType().getResolvedType();
            String typeName = typeOf(f.getType());
            emitMaxLen(type);
            out.line("pub " + localName(f.getName()) + ": " + typeName + ",");
        }
        out.close();
        out.blankLine();
    }

    private void emitEvent(EventDecl event) {
        out.line("#[event]");
        out.open("pub struct " + event.getName());
        for (Parameter f : event.getFields()) {
            out.line("pub " + localName(f.getName()) + ": " + typeOf(f.getType()) + ",");
        }
        out.close();
        out.blankLine();
    }

    private void emitErrorCodes() {
        out.line("#[error_code]");
        out.open("pub enum ErrorCode");
        for (Map.Entry<String, String> e : errors.getCodes().entrySet()) {
            out.line("#[msg(\"" + Names.escapeString(e.getKey()) + "\")]");
            out.line(e.getValue() + ",");
        }
        out.line("#[msg(\"Arithmetic overflow\")]");
        out.line(OVERFLOW + ",");
        out.line("#[msg(\"Requirement failed\")]");
        out.line(errors.getDefaultCode() + ",");
        if (usesMaps) {
            out.line("#[msg(\"Map capacity exceeded\")]");
            out.line(CAPACITY + ",");
        }
        out.close();
    }

    private void emitMapHelpers() {
        out.blankLine();
        out.open("fn map_get<K: PartialEq, V: Clone + Default>(entries: &Vec<(K, V)>, key: &K) -> V");
        out.line("entries.iter().find(|(k, _)| k == key).map(|(_, v)| v.clone()).unwrap_or_default()");
        out.close();
        out.blankLine();
        out.open("fn map_set<K: PartialEq, V>(entries: &mut Vec<(K, V)>, key: K, value: V) -> Result<()>");
        out.open("if let Some(entry) = entries.iter_mut().find(|(k, _)| *k == key)");
        out.line("entry.1 = value;");
        out.line("return Ok(());");
        out.close();
        out.line("require!(entries.len() < MAP_CAPACITY, ErrorCode::" + CAPACITY + ");");
        out.line("entries.push((key, value));");
        out.line("Ok(())");
        out.close();
    }

    /**
     * 变长字段的 InitSpace 长度上限
     */
    private void emitMaxLen(Type type) {
        List<Integer> dims = maxLenDims(type);
        if (dims.isEmpty()) return;
        StringBuilder sb = new StringBuilder("#[max_len(");
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(dims.get(i));
        }
        out.line(sb.append(")]").toString());
    }

    private List<Integer> maxLenDims(Type type) {
        List<Integer> dims = new ArrayList<Integer>();
        switch (type.getKind()) {
            case STRING:
            case BYTES:
                dims.add(MAX_COLLECTION_LEN);
                break;
            case VECTOR:
                dims.add(MAX_COLLECTION_LEN);
                dims.addAll(maxLenDims(((VectorType) type).getElementType()));
                break;
            case MAP:
                dims.add(mapPolicy.getCapacity());
                dims.addAll(maxLenDims(((MapType) type).getValueType()));
                break;
            case ARRAY:
                dims.addAll(maxLenDims(((ArrayType) type).getElementType()));
                break;
            case OPTION:
                dims.addAll(maxLenDims(((OptionType) type).getInnerType()));
                break;
            default:
                break;
        }
        return dims;
    }

    private static boolean isCollection(Type type) {
        Type.Kind kind = type.getKind();
        return kind == Type.Kind.VECTOR || kind == Type.Kind.ARRAY || kind == Type.Kind.MAP;
    }

    @Override
    protected String mapTypeName(MapType type, SourceLocation loc) {
        throw violation("Map type " + type + " can only be used as a state field", loc);
    }

    // ==================== 语句 ====================

    @Override
    protected void emitBinding(String name, boolean mutable, Type type, Expression value, SourceLocation loc) {
        out.line("let " + (mutable ? "mut " : "") + name + ": " + typeName(type, loc) + " = " + expr(value) + ";");
    }

    @Override
    public String visitLetStmt(LetStmt node, Void ctx) {
        Type type = node.getSymbol() != null ? node.getSymbol().getType() : node.getInitializer().getType();
        emitBinding(localName(node.getName()), node.isMutable(), type, node.getInitializer(), node.getLocation());
        return null;
    }

    @Override
    public String visitAssignStmt(AssignStmt node, Void ctx) {
        Expression target = node.getTarget();
        if (assignsThroughMapElement(target)) {
            throw violation("Assignment through a map element is not supported", node.getLocation());
        }
        if (target instanceof IndexExpr && ((IndexExpr) target).getTarget().getType() instanceof MapType) {
            IndexExpr index = (IndexExpr) target;
            String field = stateMapField(index);
            String key = temp("key");
            String value = temp("value");
            out.line("let " + key + " = " + expr(index.getIndex()) + ";");
            out.line("let " + value + " = " + expr(node.getValue()) + ";");
            out.line("map_set(&mut " + field + ", " + key + ", " + value + ")?;");
            return null;
        }
        out.line(place(target) + " = " + expr(node.getValue()) + ";");
        return null;
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) {
        out.line(expr(node.getExpression()) + ";");
        return null;
    }

    @Override
    public String visitIfStmt(IfStmt node, Void ctx) {
        out.open("if " + expr(node.getCondition()));
        emitStatements(node.getThenBranch().getStatements());
        Statement els = node.getElseBranch();
        while (els instanceof IfStmt) {
            IfStmt elseIf = (IfStmt) els;
            out.dedent();
            out.open("} else if " + expr(elseIf.getCondition()));
            emitStatements(elseIf.getThenBranch().getStatements());
            els = elseIf.getElseBranch();
        }
        if (els != null) {
            out.dedent();
            out.open("} else");
            emitStatements(asStatements(els));
        }
        out.close();
        return null;
    }

    @Override
    public String visitWhileStmt(WhileStmt node, Void ctx) {
        out.open("while " + expr(node.getCondition()));
        emitStatements(node.getBody().getStatements());
        out.close();
        return null;
    }

    @Override
    public String visitForRangeStmt(ForRangeStmt node, Void ctx) {
        out.open("for " + localName(node.getVariable()) + " in " + expr(node.getStart()) + ".." + expr(node.getEnd()));
        emitStatements(node.getBody().getStatements());
        out.close();
        return null;
    }

    @Override
    public String visitForEachStmt(ForEachStmt node, Void ctx) {
        out.open("for " + localName(node.getVariable()) + " in " + expr(node.getIterable()));
        emitStatements(node.getBody().getStatements());
        out.close();
        return null;
    }

    @Override
    public String visitMatchStmt(MatchStmt node, Void ctx) {
        Expression scrutinee = node.getScrutinee();
        out.open("match " + matchScrutinee(scrutinee));
        boolean wildcard = false;
        for (MatchArm arm : node.getArms()) {
            String pattern = pattern(arm.getPattern(), scrutinee.getType());
            if (pattern == null) continue;
            out.open(pattern + " =>");
            emitStatements(arm.getBlock().getStatements());
            out.close();
            if (arm.getPattern().isWildcard()) {
                wildcard = true;
                break;
            }
        }
        if (!wildcard) {
            out.line("_ => {}");
        }
        out.close();
        return null;
    }

    @Override
    public String visitRequireStmt(RequireStmt node, Void ctx) {
        String code = "ErrorCode::" + errors.codeFor(node.getMessage());
        if (node.isRevert() || isFalseLiteral(node.getCondition())) {
            out.line("return err!(" + code + ");");
        } else {
            out.line("require!(" + expr(node.getCondition()) + ", " + code + ");");
        }
        return null;
    }

    @Override
    public String visitEmitStmt(EmitStmt node, Void ctx) {
        out.line("emit!(" + eventValue(node) + ");");
        return null;
    }

    private String eventValue(EmitStmt node) {
        EventDecl event = contract.findEvent(node.getEventName());
        if (event == null) {
            throw new InternalInvariantViolation("Unresolved event '" + node.getEventName() + "'", node.getLocation());
        }
        StringBuilder sb = new StringBuilder(event.getName()).append(" { ");
        for (int i = 0; i < event.getFields().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(localName(event.getFields().get(i).getName())).append(": ")
              .append(expr(node.getArguments().get(i)));
        }
        return sb.append(" }").toString();
    }

    @Override
    public String visitReturnStmt(ReturnStmt node, Void ctx) {
        if (node.getValue() == null) {
            out.line("return Ok(());");
        } else {
            out.line("return Ok(" + expr(node.getValue()) + ");");
        }
        return null;
    }

    @Override
    public String visitBlock(Block node, Void ctx) {
        out.open("");
        emitStatements(node.getStatements());
        out.close();
        return null;
    }

    @Override
    public String visitPlaceholderStmt(PlaceholderStmt node, Void ctx) {
        return null;
    }

    private static List<Statement> asStatements(Statement stmt) {
        if (stmt instanceof Block) return ((Block) stmt).getStatements();
        return Collections.singletonList(stmt);
    }

    // ==================== 表达式 ====================

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INTEGER:
                return node.getIntegerValue() + node.getType().toString();
            case BOOL:
                return String.valueOf(node.getBoolValue());
            case STRING:
                return "String::from(\"" + Names.escapeString(node.getStringValue()) + "\")";
            case BYTES:
                return "b\"" + Names.escapeByteString(node.getStringValue()) + "\".to_vec()";
            default:
                throw new InternalInvariantViolation("Unknown literal kind " + node.getKind(), node.getLocation());
        }
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        Symbol symbol = node.getSymbol();
        if (symbol != null && symbol.getKind() == SymbolKind.CONSTANT) {
            String name = constName(node.getName());
            if (node.getType().getKind() == Type.Kind.STRING) return name + ".to_string()";
            if (node.getType().getKind() == Type.Kind.BYTES) return name + ".to_vec()";
            return name;
        }
        if (node.getType() instanceof MapType) {
            throw violation("Map '" + node.getName() + "' can only be accessed by key", node.getLocation());
        }
        return read(place(node), node.getType());
    }

    @Override
    public String visitIntrinsicExpr(IntrinsicExpr node, Void ctx) {
        String code = intrinsic(node);
        if (lambdaDepth > 0 && code.contains("?")) {
            throw unsupported("Intrinsic '" + node.getIntrinsic().getSourceName()
                    + "' inside a lambda is not supported", node.getLocation());
        }
        return code;
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        String operand = expr(node.getOperand());
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
            return "!" + atom(operand);
        }
        return checked(atom(operand) + ".checked_neg()");
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op.isArithmetic()) {
            return checked(atom(expr(node.getLeft())) + "." + checkedMethod(op)
                    + "(" + expr(node.getRight()) + ")");
        }
        return operand(node.getLeft()) + " " + op.toSourceString() + " " + operand(node.getRight());
    }

    private static String checkedMethod(BinaryExpr.BinaryOp op) {
        switch (op) {
            case ADD: return "checked_add";
            case SUB: return "checked_sub";
            case MUL: return "checked_mul";
            case DIV: return "checked_div";
            case MOD: return "checked_rem";
            default: throw new IllegalArgumentException("Not arithmetic: " + op);
        }
    }

    /** 比较与逻辑运算的操作数，必要时加括号 */
    private String operand(Expression e) {
        String code = expr(e);
        boolean compound = (e instanceof BinaryExpr && !((BinaryExpr) e).getOperator().isArithmetic())
                || e instanceof TernaryExpr || e instanceof CastExpr || e instanceof MatchExpr;
        return compound ? "(" + code + ")" : code;
    }

    /** 溢出即失败：指令中返回错误，lambda 中 panic */
    private String checked(String call) {
        if (lambdaDepth > 0) {
            return call + ".expect(\"arithmetic overflow\")";
        }
        return call + ".ok_or(ErrorCode::" + OVERFLOW + ")?";
    }

    @Override
    public String visitTernaryExpr(TernaryExpr node, Void ctx) {
        return "if " + expr(node.getCondition()) + " { " + expr(node.getThenExpr())
                + " } else { " + expr(node.getElseExpr()) + " }";
    }

    @Override
    public String visitCastExpr(CastExpr node, Void ctx) {
        Type source = node.getOperand().getType();
        Type targetType = node.getType();
        String operand = expr(node.getOperand());
        if (source.equals(targetType)) return operand;
        String typeName = typeName(targetType, node.getLocation());
        if (isLossless(source, targetType)) {
            return "(" + atom(operand) + " as " + typeName + ")";
        }
        if (lambdaDepth > 0) {
            return typeName + "::try_from(" + operand + ").expect(\"arithmetic overflow\")";
        }
        return typeName + "::try_from(" + operand + ").map_err(|_| ErrorCode::" + OVERFLOW + ")?";
    }

    private static boolean isLossless(Type source, Type target) {
        if (!(source instanceof IntegerType) || !(target instanceof IntegerType)) return false;
        IntegerType s = (IntegerType) source;
        IntegerType t = (IntegerType) target;
        if (s.isSigned() == t.isSigned()) return t.getBits() >= s.getBits();
        return !s.isSigned() && t.getBits() > s.getBits();
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        checkCallAllowed(node);
        String callee = functionName(node.getCallee()) + "_logic";
        if (node.getArguments().isEmpty()) {
            return callee + "(state, caller)?";
        }
        // 实参先求值到临时变量，再把 state 借给被调函数
        StringBuilder sb = new StringBuilder("{ ");
        StringBuilder args = new StringBuilder();
        for (Expression arg : node.getArguments()) {
            String t = temp("arg");
            sb.append("let ").append(t).append(" = ").append(expr(arg)).append("; ");
            args.append(", ").append(t);
        }
        return sb.append(callee).append("(state, caller").append(args).append(")? }").toString();
    }

    @Override
    public String visitMethodCallExpr(MethodCallExpr node, Void ctx) {
        Expression receiver = node.getReceiver();
        String method = node.getMethodName();
        if ("len".equals(method)) {
            return "(" + base(receiver) + ".len() as u64)";
        }
        if ("push".equals(method)) {
            if (!isPlace(receiver)) {
                throw violation("Mutation through a map element is not supported", node.getLocation());
            }
            return place(receiver) + ".push(" + expr(node.getArguments().get(0)) + ")";
        }
        if ("map".equals(method) || "filter".equals(method)) {
            LambdaExpr lambda = (LambdaExpr) node.getArguments().get(0);
            String param = localName(lambda.getParameters().get(0).getName());
            String elementType = typeName(((VectorType) node.getType()).getElementType(), node.getLocation());
            lambdaDepth++;
            String body;
            try {
                body = expr(lambda.getBody());
            } finally {
                lambdaDepth--;
            }
            String closure = "map".equals(method)
                    ? "|" + param + "| " + body
                    : "|" + param + "| { let " + param + " = " + param + ".clone(); " + body + " }";
            return base(receiver) + ".iter().cloned()." + method + "(" + closure + ").collect::<Vec<"
                    + elementType + ">>()";
        }
        throw new InternalInvariantViolation("Unknown method '" + method + "'", node.getLocation());
    }

    @Override
    public String visitFieldAccessExpr(FieldAccessExpr node, Void ctx) {
        String field = node.isTupleIndex() ? node.getFieldName() : localName(node.getFieldName());
        return read(base(node.getTarget()) + "." + field, node.getType());
    }

    @Override
    public String visitIndexExpr(IndexExpr node, Void ctx) {
        if (node.getTarget().getType() instanceof MapType) {
            return "map_get(&" + stateMapField(node) + ", &" + atom(expr(node.getIndex())) + ")";
        }
        return read(base(node.getTarget()) + "[" + atom(expr(node.getIndex())) + " as usize]", node.getType());
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
        String elements = joinExprs(node.getElements());
        return node.getType() instanceof ArrayType ? "[" + elements + "]" : "vec![" + elements + "]";
    }

    @Override
    public String visitTupleLiteral(TupleLiteral node, Void ctx) {
        return "(" + joinExprs(node.getElements()) + ")";
    }

    @Override
    public String visitLambdaExpr(LambdaExpr node, Void ctx) {
        throw unsupported("Lambda outside map/filter", node.getLocation());
    }

    @Override
    public String visitMatchExpr(MatchExpr node, Void ctx) {
        Expression scrutinee = node.getScrutinee();
        StringBuilder sb = new StringBuilder("match ").append(matchScrutinee(scrutinee)).append(" { ");
        for (MatchArm arm : node.getArms()) {
            String pattern = pattern(arm.getPattern(), scrutinee.getType());
            if (pattern == null) continue;
            sb.append(pattern).append(" => ").append(expr(arm.getValue())).append(", ");
            if (arm.getPattern().isWildcard()) break;
        }
        return sb.append("}").toString();
    }

    private String matchScrutinee(Expression scrutinee) {
        String code = expr(scrutinee);
        switch (scrutinee.getType().getKind()) {
            case STRING: return atom(code) + ".as_str()";
            case BYTES: return atom(code) + ".as_slice()";
            default: return code;
        }
    }

    /**
     * 目标模式；空区间返回 null
     */
    private String pattern(MatchPattern pattern, Type scrutineeType) {
        switch (pattern.getKind()) {
            case WILDCARD:
                return "_";
            case RANGE:
                BigInteger low = pattern.getLow().getIntegerValue();
                BigInteger last = pattern.getHigh().getIntegerValue().subtract(BigInteger.ONE);
                if (last.compareTo(low) < 0) return null;
                String suffix = scrutineeType.toString();
                return low + suffix + "..=" + last + suffix;
            default:
                Literal lit = pattern.getLow();
                switch (lit.getKind()) {
                    case STRING: return "\"" + Names.escapeString(lit.getStringValue()) + "\"";
                    case BYTES: return "b\"" + Names.escapeByteString(lit.getStringValue()) + "\"";
                    case INTEGER: return lit.getIntegerValue() + scrutineeType.toString();
                    default: return String.valueOf(lit.getBoolValue());
                }
        }
    }

    // ==================== 位置表达式 ====================

    /** 可以直接借用或赋值的路径：变量、字段、向量/数组元素 */
    private static boolean isPlace(Expression e) {
        if (e instanceof Identifier) {
            Symbol symbol = ((Identifier) e).getSymbol();
            return symbol == null || symbol.getKind() != SymbolKind.CONSTANT;
        }
        if (e instanceof FieldAccessExpr) return isPlace(((FieldAccessExpr) e).getTarget());
        if (e instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) e;
            return !(index.getTarget().getType() instanceof MapType) && isPlace(index.getTarget());
        }
        return false;
    }

    private String place(Expression e) {
        if (e instanceof Identifier) {
            Identifier id = (Identifier) e;
            String name = localName(id.getName());
            return isStateVar(id) ? "state." + name : name;
        }
        if (e instanceof FieldAccessExpr) {
            FieldAccessExpr access = (FieldAccessExpr) e;
            String field = access.isTupleIndex() ? access.getFieldName() : localName(access.getFieldName());
            return place(access.getTarget()) + "." + field;
        }
        if (e instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) e;
            if (index.getTarget().getType() instanceof MapType) {
                throw violation("Assignment through a map element is not supported", e.getLocation());
            }
            return place(index.getTarget()) + "[" + atom(expr(index.getIndex())) + " as usize]";
        }
        throw new InternalInvariantViolation("Not an assignable expression: " + e.getClass().getSimpleName(),
                e.getLocation());
    }

    /** 字段访问、索引和方法调用的接收者：路径不复制，其他表达式加括号 */
    private String base(Expression e) {
        if (isPlace(e)) return place(e);
        return "(" + expr(e) + ")";
    }

    private String stateMapField(IndexExpr index) {
        if (!isStateVar(index.getTarget())) {
            throw violation("Map type " + index.getTarget().getType() + " can only be used as a state field",
                    index.getLocation());
        }
        return "state." + localName(((Identifier) index.getTarget()).getName());
    }

    /** 读取非 Copy 类型的路径时复制一份 */
    private static String read(String place, Type type) {
        return isCopy(type) ? place : place + ".clone()";
    }

    private static boolean isCopy(Type type) {
        switch (type.getKind()) {
            case INTEGER:
            case BOOL:
            case ADDRESS:
                return true;
            case ARRAY:
                return isCopy(((ArrayType) type).getElementType());
            case OPTION:
                return isCopy(((OptionType) type).getInnerType());
            case TUPLE:
                for (Type t : ((TupleType) type).getElementTypes()) {
                    if (!isCopy(t)) return false;
                }
                return true;
            default:
                return false;
        }
    }

    private static String atom(String code) {
        return ATOM.matcher(code).matches() ? code : "(" + code + ")";
    }
}
