package com.ccdsl.ir.backend.sui;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.ast.decl.StateVarDecl;
import com.ccdsl.compiler.types.MapType;
import com.ccdsl.compiler.types.PrimitiveType;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.move.MoveEmitter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Sui 方言：状态是共享对象，入口函数直接接收它和 TxContext。
 * object、transfer、tx_context 等模块由 2024 版默认引入，无需 use。
 */
final class SuiEmitter extends MoveEmitter {

    private static final Map<String, String> USES;

    static {
        Map<String, String> uses = new HashMap<String, String>();
        uses.put("string", "std::string");
        uses.put("table", "sui::table");
        uses.put("event", "sui::event");
        USES = Collections.unmodifiableMap(uses);
    }

    SuiEmitter(ContractDecl contract) {
        super(contract, Target.SUI, SuiGenerator.TYPES, SuiGenerator.INTRINSICS);
    }

    @Override
    protected Map<String, String> moduleUses() {
        return USES;
    }

    @Override
    protected String letKeyword(boolean mutable) {
        return mutable ? "let mut" : "let";
    }

    @Override
    protected String structKeyword() {
        return "public struct";
    }

    @Override
    protected String eventAbilities() {
        return "copy, drop";
    }

    @Override
    protected void emitStateHeaderFields() {
        out.line("id: UID,");
    }

    @Override
    protected void emitInitializer() {
        beginFunction(PrimitiveType.VOID);
        out.open("fun init(ctx: &mut TxContext)");
        if (stateDefaultsUseIntrinsics()) {
            out.line("let caller = tx_context::sender(ctx);");
        }
        out.open("transfer::share_object(State");
        out.line("id: object::new(ctx),");
        emitStateFieldValues();
        out.close(");");
        out.close();
    }

    @Override
    protected void emitEntryPoint(FunctionDecl fn) {
        String name = functionName(fn.getName());
        String head = "(state: &mut State" + parameterList(fn) + ", ctx: &mut TxContext)";
        String call = name + "_logic(state, caller, ctx" + argumentList(fn) + ")";
        if (fn.hasReturnType()) {
            out.open("public fun " + name + head + returnClause(fn));
            out.line("let caller = tx_context::sender(ctx);");
            out.line(call);
        } else {
            out.open("public entry fun " + name + head);
            out.line("let caller = tx_context::sender(ctx);");
            out.line(call + ";");
        }
        out.close();
    }

    @Override
    protected String logicExtraParams() {
        return ", ctx: &TxContext";
    }

    @Override
    protected String logicCallPrefix() {
        return "state, caller, ctx";
    }

    @Override
    protected String newTable() {
        return "table::new(ctx)";
    }

    @Override
    protected String mapRead(String field, String key, Type valueType, SourceLocation loc) {
        return "table_get_or(&" + field + ", " + key + ", " + defaultValue(valueType, loc) + ")";
    }

    @Override
    protected void mapWrite(String field, String key, String value) {
        out.line("table_set(&mut " + field + ", " + key + ", " + value + ");");
    }

    @Override
    protected String vectorHigherOrder(String method, String vector, String closure) {
        return "vector::" + method + "!(" + vector + ", " + closure + ")";
    }

    @Override
    protected void emitHelpers() {
        if (!usesMaps()) return;
        out.open("fun table_get_or<K: copy + drop + store, V: copy + drop + store>("
                + "t: &sui::table::Table<K, V>, key: K, default: V): V");
        out.line("if (table::contains(t, key)) *table::borrow(t, key) else default");
        out.close();
        out.blankLine();
        out.open("fun table_set<K: copy + drop + store, V: drop + store>("
                + "t: &mut sui::table::Table<K, V>, key: K, value: V)");
        out.open("if (table::contains(t, key))");
        out.line("*table::borrow_mut(t, key) = value;");
        out.dedent();
        out.open("} else");
        out.line("table::add(t, key, value);");
        out.close();
        out.close();
    }

    private boolean usesMaps() {
        for (StateVarDecl sv : contract.getStateVars()) {
            if (sv.getType().getResolvedType() instanceof MapType) return true;
        }
        return false;
    }
}
