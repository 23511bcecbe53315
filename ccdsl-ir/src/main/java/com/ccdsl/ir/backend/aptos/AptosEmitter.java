package com.ccdsl.ir.backend.aptos;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.types.PrimitiveType;
import com.ccdsl.compiler.types.Type;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.move.MoveEmitter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Aptos 方言：状态资源存于 @ccdsl，入口函数从 signer 取调用者。
 */
final class AptosEmitter extends MoveEmitter {

    private static final Map<String, String> USES;

    static {
        Map<String, String> uses = new HashMap<String, String>();
        uses.put("signer", "std::signer");
        uses.put("string", "std::string");
        uses.put("vector", "std::vector");
        uses.put("option", "std::option");
        uses.put("table", "aptos_std::table");
        uses.put("event", "aptos_framework::event");
        uses.put("timestamp", "aptos_framework::timestamp");
        uses.put("block", "aptos_framework::block");
        USES = Collections.unmodifiableMap(uses);
    }

    AptosEmitter(ContractDecl contract) {
        super(contract, Target.APTOS, AptosGenerator.TYPES, AptosGenerator.INTRINSICS);
    }

    @Override
    protected Map<String, String> moduleUses() {
        return USES;
    }

    @Override
    protected String letKeyword(boolean mutable) {
        return "let";
    }

    @Override
    protected String structKeyword() {
        return "struct";
    }

    @Override
    protected String eventAbilities() {
        return "drop, store";
    }

    @Override
    protected String eventAttribute() {
        return "#[event]";
    }

    @Override
    protected void emitInitializer() {
        beginFunction(PrimitiveType.VOID);
        out.open("fun init_module(account: &signer)");
        if (stateDefaultsUseIntrinsics()) {
            out.line("let caller = signer::address_of(account);");
        }
        out.open("move_to(account, State");
        emitStateFieldValues();
        out.close(");");
        out.close();
    }

    @Override
    protected void emitEntryPoint(FunctionDecl fn) {
        String name = functionName(fn.getName());
        String call = name + "_logic(state, signer::address_of(account)" + argumentList(fn) + ")";
        if (fn.hasReturnType()) {
            out.open("public fun " + name + "(account: &signer" + parameterList(fn) + ")"
                    + returnClause(fn) + " acquires State");
            out.line("let state = borrow_global_mut<State>(@ccdsl);");
            out.line(call);
        } else {
            out.open("public entry fun " + name + "(account: &signer" + parameterList(fn) + ") acquires State");
            out.line("let state = borrow_global_mut<State>(@ccdsl);");
            out.line(call + ";");
        }
        out.close();
    }

    @Override
    protected String logicExtraParams() {
        return "";
    }

    @Override
    protected String logicCallPrefix() {
        return "state, caller";
    }

    @Override
    protected String newTable() {
        return "table::new()";
    }

    @Override
    protected String mapRead(String field, String key, Type valueType, SourceLocation loc) {
        String fallback = temp("d");
        return "{ let " + fallback + " = " + defaultValue(valueType, loc) + "; *table::borrow_with_default(&"
                + field + ", " + key + ", &" + fallback + ") }";
    }

    @Override
    protected void mapWrite(String field, String key, String value) {
        out.line("table::upsert(&mut " + field + ", " + key + ", " + value + ");");
    }

    @Override
    protected String vectorHigherOrder(String method, String vector, String closure) {
        return "vector::" + method + "(" + vector + ", " + closure + ")";
    }
}
