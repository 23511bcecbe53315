package com.ccdsl.ir.backend.sui;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.ir.backend.BackendFixtures;
import com.ccdsl.ir.backend.CodegenResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Sui Move 生成器测试
 */
@DisplayName("Sui 生成器")
class SuiGeneratorTest {

    private static String text;

    @BeforeAll
    static void generate() {
        CodegenResult result = new SuiGenerator().generate(BackendFixtures.optimized(BackendFixtures.TOKEN));
        assertThat(result.getDiagnostics()).isEmpty();
        text = result.getText();
    }

    @Test
    @DisplayName("模块头")
    void testModuleHeader() {
        assertThat(text).startsWith("module ccdsl::token {\n");
        assertThat(text).endsWith("}\n");
        assertThat(text).contains("    use sui::event;\n");
    }

    @Test
    @DisplayName("状态是带 UID 的共享对象")
    void testSharedObject() {
        assertThat(text).contains("public struct State has key {\n        id: UID,");
        assertThat(text).contains("balances: sui::table::Table<address, u64>,");
        assertThat(text).contains("fun init(ctx: &mut TxContext)");
        assertThat(text).contains("transfer::share_object(State");
        assertThat(text).contains("id: object::new(ctx),");
    }

    @Test
    @DisplayName("入口函数接收共享对象与 TxContext")
    void testEntryPoints() {
        assertThat(text).contains(
                "public entry fun transfer(state: &mut State, to: address, amount: u64, ctx: &mut TxContext)");
        assertThat(text).contains(
                "public fun balance_of(state: &mut State, account_: address, ctx: &mut TxContext): u64");
        assertThat(text).contains("let caller = tx_context::sender(ctx);");
        assertThat(text).contains("fun transfer_logic(state: &mut State, caller: address, ctx: &TxContext");
    }

    @Test
    @DisplayName("map 辅助函数与错误码")
    void testHelpersAndErrors() {
        assertThat(text).contains("fun table_get_or<");
        assertThat(text).contains("fun table_set<");
        assertThat(text).contains("table_set(&mut ");
        assertThat(text).contains("const E_INSUFFICIENT_BALANCE: u64 = 3;");
        assertThat(text).contains("const E_REQUIREMENT_FAILED: u64 = 4;");
        assertThat(text).contains("public struct Transfer has copy, drop {");
    }

    @Test
    @DisplayName("可变绑定使用 let mut")
    void testMutableBinding() {
        ContractDecl counter = BackendFixtures.optimized(String.join("\n",
                "contract Counter {",
                "    state { count: u64 = 0; }",
                "    public fn bump(times: u64) {",
                "        let mut i = 0;",
                "        while i < times {",
                "            count = count + 1;",
                "            i = i + 1;",
                "        }",
                "    }",
                "}"));
        String counterText = new SuiGenerator().generate(counter).getText();
        assertThat(counterText).contains("let mut i: u64 = 0u64;");
    }

    @Test
    @DisplayName("有符号整数不受支持")
    void testSignedIntegerUnsupported() {
        CodegenResult result = new SuiGenerator().generate(BackendFixtures.optimized(BackendFixtures.SIGNED_LEDGER));

        assertThat(result.getText()).isNull();
        assertThat(result.getDiagnostics()).isNotEmpty();
        assertThat(result.getDiagnostics()).allSatisfy(d -> {
            assertThat(d.getCode()).isEqualTo(DiagnosticCode.UNSUPPORTED_CONSTRUCT);
            assertThat(d.getTarget()).isEqualTo("sui");
        });
    }
}
