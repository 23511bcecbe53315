package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.decl.*;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.stmt.*;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;
import com.ccdsl.compiler.types.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 语义分析器：逐合约构建作用域竞技场，回填表达式类型与符号，收集诊断。
 *
 * <p>表达式类型推断委托给 {@link TypeInferenceEngine}，
 * 类型注解解析委托给 {@link TypeResolver}，
 * 诊断报告与控制流判定委托给 {@link SemanticChecker}。</p>
 *
 * <p>文件级结构体并入每个合约，每个合约单独分析、互不共享作用域。</p>
 */
public final class SemanticAnalyzer implements AstVisitor<Void, Void> {

    private static final Logger LOG = Logger.getLogger(SemanticAnalyzer.class.getName());

    private final DiagnosticCollector diagnostics;
    private final SemanticChecker checker;

    // 每个合约重建
    private ScopeArena arena;
    private int currentScope;
    private TypeResolver typeResolver;
    private TypeInferenceEngine inference;
    private final Map<String, EventDecl> events = new LinkedHashMap<String, EventDecl>();
    private final Map<String, ModifierDecl> modifiers = new LinkedHashMap<String, ModifierDecl>();

    // 每个函数 / 修饰器重建
    private Type returnType = PrimitiveType.VOID;
    private boolean inModifier;
    private PlaceholderStmt allowedPlaceholder;

    public SemanticAnalyzer() {
        this(new DiagnosticCollector());
    }

    public SemanticAnalyzer(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
        this.checker = new SemanticChecker(diagnostics);
    }

    /** 分析入口 */
    public AnalysisResult analyze(SourceFile file, String source) {
        Map<String, InterfaceDecl> interfaces = new LinkedHashMap<String, InterfaceDecl>();
        for (InterfaceDecl iface : file.getInterfaces()) {
            if (interfaces.containsKey(iface.getName())) {
                checker.duplicate("interface", iface.getName(), null, iface);
                continue;
            }
            interfaces.put(iface.getName(), iface);
        }

        List<ContractDecl> analyzed = new ArrayList<ContractDecl>();
        Set<String> contractNames = new HashSet<String>();
        for (ContractDecl contract : file.getContracts()) {
            if (!contractNames.add(contract.getName())) {
                checker.duplicate("contract", contract.getName(), null, contract);
                continue;
            }
            ContractDecl merged = contract.withSharedStructs(file.getStructs());
            analyzeContract(merged, interfaces);
            // 未被引用的文件级结构体不随合约进入后续阶段
            analyzed.add(merged.retainSharedStructs(SharedReferences.collect(merged, file.getStructs())));
        }
        LOG.fine("Analyzed " + analyzed.size() + " contract(s) in " + file.getFileName()
                + ", " + diagnostics.getErrorCount() + " error(s)");
        return new AnalysisResult(diagnostics.snapshot(), analyzed, file, source);
    }

    // ============ 作用域管理 ============

    void enterScope(Scope.ScopeType type, AstNode node) {
        currentScope = arena.create(type, currentScope, node);
    }

    /**
     * 离开作用域，未使用的局部绑定报告警告
     */
    void exitScope() {
        Scope scope = arena.get(currentScope);
        for (Symbol symbol : scope.getSymbols()) {
            if (symbol.getKind() == SymbolKind.LOCAL && !symbol.isUsed()
                    && !symbol.getName().startsWith("_")) {
                checker.warning(DiagnosticCode.UNUSED_BINDING,
                        "Unused binding '" + symbol.getName() + "'", symbol.getDeclaration());
            }
        }
        currentScope = scope.getParent();
    }

    int currentScope() {
        return currentScope;
    }

    Symbol resolve(String name) {
        return arena.resolve(currentScope, name);
    }

    /** 在当前作用域定义，重名报告 DUPLICATE_DECLARATION */
    void define(Symbol symbol, String what, AstNode node) {
        Symbol existing = arena.define(currentScope, symbol);
        if (existing != null) {
            checker.duplicate(what, symbol.getName(), existing, node);
        }
    }

    // ============ 合约 ============

    private void analyzeContract(ContractDecl contract, Map<String, InterfaceDecl> interfaces) {
        arena = new ScopeArena();
        currentScope = arena.create(Scope.ScopeType.FILE, Scope.NO_PARENT, contract);
        typeResolver = new TypeResolver(diagnostics);
        inference = new TypeInferenceEngine(this, checker, typeResolver);
        events.clear();
        modifiers.clear();

        for (StructDecl struct : contract.getStructs()) {
            if (!typeResolver.registerStruct(struct)) {
                checker.duplicate("struct", struct.getName(), null, struct);
            }
        }
        for (StructDecl struct : contract.getStructs()) {
            typeResolver.resolveStruct(struct.getName());
        }

        enterScope(Scope.ScopeType.CONTRACT, contract);
        declareMembers(contract);

        for (StateVarDecl var : contract.getStateVars()) {
            if (var.getDefaultValue() != null) {
                checkConstantInitializer(var.getDefaultValue(), var.getType().getResolvedType(),
                        "State default for '" + var.getName() + "'");
            }
        }
        for (ConstDecl constant : contract.getConstants()) {
            checkConstantInitializer(constant.getValue(), constant.getType().getResolvedType(),
                    "Initializer of constant '" + constant.getName() + "'");
        }
        checkConstantCycles(contract);

        for (String name : contract.getInterfaces()) {
            InterfaceDecl iface = interfaces.get(name);
            if (iface == null) {
                checker.undefined("interface", name, contract);
                continue;
            }
            checkImplements(contract, iface);
        }

        for (ModifierDecl modifier : contract.getModifiers()) {
            analyzeModifier(modifier);
        }
        for (FunctionDecl fn : contract.getFunctions()) {
            analyzeFunction(fn);
        }
        exitScope();
        arena = null;
    }

    /**
     * 先登记所有成员签名，函数体里可以前向引用
     */
    private void declareMembers(ContractDecl contract) {
        for (StateVarDecl var : contract.getStateVars()) {
            Type type = typeResolver.resolve(var.getType());
            define(new Symbol(var.getName(), SymbolKind.STATE_VAR, type, true, var, currentScope),
                    "state variable", var);
        }
        for (ConstDecl constant : contract.getConstants()) {
            Type type = typeResolver.resolve(constant.getType());
            define(new Symbol(constant.getName(), SymbolKind.CONSTANT, type, false, constant, currentScope),
                    "constant", constant);
        }
        for (FunctionDecl fn : contract.getFunctions()) {
            resolveParameters(fn.getParameters());
            Type ret = fn.getReturnType() != null ? typeResolver.resolve(fn.getReturnType()) : PrimitiveType.VOID;
            define(new Symbol(fn.getName(), SymbolKind.FUNCTION, ret, false, fn, currentScope),
                    "function", fn);
        }
        for (EventDecl event : contract.getEvents()) {
            resolveParameters(event.getFields());
            if (events.containsKey(event.getName())) {
                checker.duplicate("event", event.getName(), null, event);
                continue;
            }
            events.put(event.getName(), event);
        }
        for (ModifierDecl modifier : contract.getModifiers()) {
            resolveParameters(modifier.getParameters());
            if (modifiers.containsKey(modifier.getName())) {
                checker.duplicate("modifier", modifier.getName(), null, modifier);
                continue;
            }
            modifiers.put(modifier.getName(), modifier);
        }
    }

    private void resolveParameters(List<Parameter> params) {
        for (Parameter param : params) {
            if (param.getType() != null) {
                typeResolver.resolve(param.getType());
            }
        }
    }

    private void checkConstantInitializer(Expression value, Type type, String what) {
        inference.inferExpecting(value, type);
        if (!SemanticChecker.isConstantExpression(value)) {
            checker.error(DiagnosticCode.INVALID_CONSTRUCT, what + " must be a constant expression", value);
        }
    }

    /**
     * 常量之间不能循环引用
     */
    private void checkConstantCycles(ContractDecl contract) {
        Map<String, ConstDecl> byName = new LinkedHashMap<String, ConstDecl>();
        for (ConstDecl c : contract.getConstants()) {
            if (!byName.containsKey(c.getName())) byName.put(c.getName(), c);
        }
        Set<String> done = new HashSet<String>();
        for (ConstDecl c : byName.values()) {
            if (dependsOn(c, c.getName(), byName, new HashSet<String>()) && done.add(c.getName())) {
                checker.error(DiagnosticCode.INVALID_CONSTRUCT,
                        "Constant '" + c.getName() + "' is defined in terms of itself", c);
            }
        }
    }

    private boolean dependsOn(ConstDecl c, String target, Map<String, ConstDecl> byName, Set<String> visited) {
        for (String ref : constantReferences(c.getValue())) {
            if (ref.equals(target)) return true;
            ConstDecl next = byName.get(ref);
            if (next != null && visited.add(ref) && dependsOn(next, target, byName, visited)) return true;
        }
        return false;
    }

    private static List<String> constantReferences(AstNode node) {
        List<String> refs = new ArrayList<String>();
        collectConstantReferences(node, refs);
        return refs;
    }

    private static void collectConstantReferences(AstNode node, List<String> out) {
        if (node instanceof Identifier) {
            Symbol s = ((Identifier) node).getSymbol();
            if (s != null && s.getKind() == SymbolKind.CONSTANT) out.add(s.getName());
        }
        for (AstNode child : node.getChildren()) {
            collectConstantReferences(child, out);
        }
    }

    /**
     * 接口中每个签名都必须由参数与返回类型完全一致的 public 函数实现
     */
    private void checkImplements(ContractDecl contract, InterfaceDecl iface) {
        for (FunctionSignature sig : iface.getFunctions()) {
            FunctionDecl fn = contract.findFunction(sig.getName());
            String qualified = iface.getName() + "." + sig.getName();
            if (fn == null) {
                checker.error(DiagnosticCode.INVALID_CONSTRUCT, "Contract '" + contract.getName()
                        + "' does not implement '" + qualified + "'", contract);
                continue;
            }
            if (!fn.isPublic()) {
                checker.error(DiagnosticCode.INVALID_CONSTRUCT,
                        "Function '" + fn.getName() + "' implements '" + qualified + "' and must be public", fn);
                continue;
            }
            resolveParameters(sig.getParameters());
            Type sigReturn = sig.getReturnType() != null ? typeResolver.resolve(sig.getReturnType()) : PrimitiveType.VOID;
            Type fnReturn = fn.getReturnType() != null ? fn.getReturnType().getResolvedType() : PrimitiveType.VOID;
            boolean same = sigReturn.equals(fnReturn) && sig.getParameters().size() == fn.getParameters().size();
            for (int i = 0; same && i < sig.getParameters().size(); i++) {
                Type a = sig.getParameters().get(i).getType().getResolvedType();
                Type b = fn.getParameters().get(i).getType().getResolvedType();
                same = a != null && a.equals(b);
            }
            if (!same) {
                checker.error(DiagnosticCode.INVALID_CONSTRUCT, "Function '" + fn.getName()
                        + "' does not match the signature of '" + qualified + "'", fn);
            }
        }
    }

    // ============ 函数与修饰器 ============

    private void analyzeFunction(FunctionDecl fn) {
        enterScope(Scope.ScopeType.FUNCTION, fn);
        declareParameters(fn.getParameters());
        returnType = fn.getReturnType() != null ? fn.getReturnType().getResolvedType() : PrimitiveType.VOID;
        inModifier = false;
        allowedPlaceholder = null;

        for (ModifierInvocation invocation : fn.getModifiers()) {
            ModifierDecl modifier = modifiers.get(invocation.getName());
            if (modifier == null) {
                for (Expression arg : invocation.getArguments()) {
                    inference.infer(arg, null);
                }
                checker.undefined("modifier", invocation.getName(), invocation);
                continue;
            }
            inference.checkArguments("Modifier '" + modifier.getName() + "'", modifier.getParameters(),
                    invocation.getArguments(), invocation);
        }

        fn.getBody().accept(this, null);

        if (!returnType.isVoid() && !returnType.isError() && !SemanticChecker.terminates(fn.getBody())) {
            checker.error(DiagnosticCode.MISSING_RETURN,
                    "Function '" + fn.getName() + "' does not return a value on every path", fn);
        }
        exitScope();
    }

    /**
     * 修饰器体以 _; 结尾且只有这一处占位语句
     */
    private void analyzeModifier(ModifierDecl modifier) {
        enterScope(Scope.ScopeType.FUNCTION, modifier);
        declareParameters(modifier.getParameters());
        returnType = PrimitiveType.VOID;
        inModifier = true;

        List<Statement> body = modifier.getBody().getStatements();
        Statement last = body.isEmpty() ? null : body.get(body.size() - 1);
        allowedPlaceholder = last instanceof PlaceholderStmt ? (PlaceholderStmt) last : null;
        if (allowedPlaceholder == null) {
            checker.error(DiagnosticCode.INVALID_CONSTRUCT,
                    "Modifier '" + modifier.getName() + "' must end with '_;'", modifier);
        }

        modifier.getBody().accept(this, null);

        inModifier = false;
        allowedPlaceholder = null;
        exitScope();
    }

    private void declareParameters(List<Parameter> params) {
        for (Parameter param : params) {
            Type type = param.getType() != null ? param.getType().getResolvedType() : PrimitiveType.ERROR;
            Symbol symbol = new Symbol(param.getName(), SymbolKind.PARAMETER, type, false, param, currentScope);
            define(symbol, "parameter", param);
            param.setSymbol(symbol);
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, Void ctx) {
        enterScope(Scope.ScopeType.BLOCK, node);
        boolean reported = false;
        boolean terminated = false;
        for (Statement stmt : node.getStatements()) {
            if (terminated && !reported) {
                checker.warning(DiagnosticCode.UNREACHABLE_CODE, "Unreachable statement", stmt);
                reported = true;
            }
            stmt.accept(this, null);
            if (SemanticChecker.terminates(stmt)) terminated = true;
        }
        exitScope();
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, Void ctx) {
        Type declared = node.getDeclaredType() != null ? typeResolver.resolve(node.getDeclaredType()) : null;
        Type actual = inference.infer(node.getInitializer(), declared);
        Type type;
        if (declared != null) {
            checker.checkAssignable(declared, actual, node.getInitializer());
            type = declared;
        } else {
            type = actual;
        }
        if (type.isVoid()) {
            checker.error(DiagnosticCode.TYPE_MISMATCH,
                    "Cannot bind '" + node.getName() + "' to a value of type void", node.getInitializer());
            type = PrimitiveType.ERROR;
        }
        Symbol symbol = new Symbol(node.getName(), SymbolKind.LOCAL, type, node.isMutable(), node, currentScope);
        define(symbol, "variable", node);
        node.setSymbol(symbol);
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        Identifier root = SemanticChecker.assignmentRoot(node.getTarget());
        if (root == null) {
            inference.infer(node.getTarget(), null);
            inference.infer(node.getValue(), null);
            checker.error(DiagnosticCode.INVALID_CONSTRUCT, "Invalid assignment target", node.getTarget());
            return null;
        }
        Type target = inference.infer(node.getTarget(), null);
        inference.inferExpecting(node.getValue(), target.isError() ? null : target);
        checkMutableRoot(node.getTarget(), node);
        return null;
    }

    /**
     * 赋值或 push 的根必须是状态变量或 let mut 局部变量
     */
    void checkMutableRoot(Expression target, AstNode site) {
        Identifier root = SemanticChecker.assignmentRoot(target);
        if (root == null) {
            checker.error(DiagnosticCode.INVALID_CONSTRUCT, "Invalid assignment target", site);
            return;
        }
        Symbol symbol = root.getSymbol();
        if (symbol == null) return;
        if (symbol.isStateVar() || (symbol.getKind() == SymbolKind.LOCAL && symbol.isMutable())) return;
        String what;
        switch (symbol.getKind()) {
            case PARAMETER: what = "parameter"; break;
            case CONSTANT: what = "constant"; break;
            case LOOP_VAR: what = "loop variable"; break;
            case LAMBDA_PARAM: what = "lambda parameter"; break;
            default: what = "immutable binding"; break;
        }
        checker.error(DiagnosticCode.IMMUTABLE_ASSIGNMENT,
                "Cannot assign to " + what + " '" + symbol.getName() + "'", site);
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        inference.infer(node.getExpression(), null);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        checkCondition(node.getCondition());
        node.getThenBranch().accept(this, null);
        if (node.getElseBranch() != null) {
            node.getElseBranch().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        checkCondition(node.getCondition());
        node.getBody().accept(this, null);
        return null;
    }

    @Override
    public Void visitForRangeStmt(ForRangeStmt node, Void ctx) {
        Type[] bounds = inference.inferPair(node.getStart(), node.getEnd(), null);
        Type type = bounds[0];
        if (!type.isError() && !type.isInteger()) {
            checker.error(DiagnosticCode.TYPE_MISMATCH, "Range bounds must be integers, found " + type, node.getStart());
            type = PrimitiveType.ERROR;
        } else if (!bounds[1].isAssignableTo(type)) {
            checker.error(DiagnosticCode.TYPE_MISMATCH, SemanticChecker.mismatch(type, bounds[1]), node.getEnd());
        }
        enterScope(Scope.ScopeType.BLOCK, node);
        Symbol symbol = new Symbol(node.getVariable(), SymbolKind.LOOP_VAR, type, false, node, currentScope);
        define(symbol, "loop variable", node);
        node.setSymbol(symbol);
        node.getBody().accept(this, null);
        exitScope();
        return null;
    }

    @Override
    public Void visitForEachStmt(ForEachStmt node, Void ctx) {
        Type iterable = inference.infer(node.getIterable(), null);
        Type element = TypeInferenceEngine.elementType(iterable);
        if (element == null) {
            if (!iterable.isError()) {
                checker.error(DiagnosticCode.TYPE_MISMATCH, "Cannot iterate over " + iterable, node.getIterable());
            }
            element = PrimitiveType.ERROR;
        }
        enterScope(Scope.ScopeType.BLOCK, node);
        Symbol symbol = new Symbol(node.getVariable(), SymbolKind.LOOP_VAR, element, false, node, currentScope);
        define(symbol, "loop variable", node);
        node.setSymbol(symbol);
        node.getBody().accept(this, null);
        exitScope();
        return null;
    }

    @Override
    public Void visitMatchStmt(MatchStmt node, Void ctx) {
        Type scrutinee = inference.infer(node.getScrutinee(), null);
        for (MatchArm arm : node.getArms()) {
            inference.checkPattern(arm.getPattern(), scrutinee);
            arm.getBlock().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visitRequireStmt(RequireStmt node, Void ctx) {
        checkCondition(node.getCondition());
        return null;
    }

    @Override
    public Void visitEmitStmt(EmitStmt node, Void ctx) {
        EventDecl event = events.get(node.getEventName());
        if (event == null) {
            for (Expression arg : node.getArguments()) {
                inference.infer(arg, null);
            }
            checker.undefined("event", node.getEventName(), node);
            return null;
        }
        inference.checkArguments("Event '" + event.getName() + "'", event.getFields(), node.getArguments(), node);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        if (inModifier) {
            if (node.getValue() != null) inference.infer(node.getValue(), null);
            checker.error(DiagnosticCode.INVALID_CONSTRUCT, "'return' is not allowed in a modifier", node);
            return null;
        }
        if (node.getValue() == null) {
            if (!returnType.isVoid() && !returnType.isError()) {
                checker.error(DiagnosticCode.TYPE_MISMATCH,
                        SemanticChecker.mismatch(returnType, PrimitiveType.VOID), node);
            }
            return null;
        }
        Type expected = returnType.isVoid() ? null : returnType;
        Type actual = inference.infer(node.getValue(), expected);
        if (returnType.isVoid()) {
            if (!actual.isError()) {
                checker.error(DiagnosticCode.TYPE_MISMATCH, SemanticChecker.mismatch(PrimitiveType.VOID, actual), node);
            }
            return null;
        }
        checker.checkAssignable(returnType, actual, node);
        return null;
    }

    @Override
    public Void visitPlaceholderStmt(PlaceholderStmt node, Void ctx) {
        if (node != allowedPlaceholder) {
            checker.error(DiagnosticCode.INVALID_CONSTRUCT,
                    "'_;' is only allowed as the last statement of a modifier", node);
        }
        return null;
    }

    // ============ 辅助方法 ============

    private void checkCondition(Expression condition) {
        Type type = inference.infer(condition, PrimitiveType.BOOL);
        checker.checkAssignable(PrimitiveType.BOOL, type, condition);
    }
}
