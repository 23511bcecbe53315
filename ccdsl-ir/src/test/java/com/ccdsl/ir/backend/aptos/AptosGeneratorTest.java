package com.ccdsl.ir.backend.aptos;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.ir.backend.BackendFixtures;
import com.ccdsl.ir.backend.CodegenResult;
import com.ccdsl.ir.backend.Target;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Aptos Move 生成器测试
 */
@DisplayName("Aptos 生成器")
class AptosGeneratorTest {

    private static String text;

    @BeforeAll
    static void generate() {
        CodegenResult result = new AptosGenerator().generate(BackendFixtures.optimized(BackendFixtures.TOKEN));
        assertThat(result.getDiagnostics()).isEmpty();
        text = result.getText();
    }

    @Test
    @DisplayName("模块头与按字母排序的 use")
    void testModuleHeader() {
        assertThat(text).startsWith("module ccdsl::token {\n");
        assertThat(text).endsWith("}\n");
        assertThat(text).contains("    use aptos_framework::event;\n    use aptos_std::table;\n    use std::signer;\n");
    }

    @Test
    @DisplayName("错误码常量按出现顺序编号")
    void testErrorConstants() {
        assertThat(text).contains("const E_ONLY_OWNER: u64 = 1;");
        assertThat(text).contains("const E_ALREADY_INITIALIZED: u64 = 2;");
        assertThat(text).contains("const E_INSUFFICIENT_BALANCE: u64 = 3;");
        assertThat(text).contains("const E_REQUIREMENT_FAILED: u64 = 4;");
        assertThat(text).contains("assert!(");
        assertThat(text).contains(", E_INSUFFICIENT_BALANCE);");
    }

    @Test
    @DisplayName("状态资源与初始化")
    void testStateResource() {
        assertThat(text).contains("struct State has key {");
        assertThat(text).contains("balances: aptos_std::table::Table<address, u64>,");
        assertThat(text).contains("fun init_module(account: &signer)");
        assertThat(text).contains("move_to(account, State");
    }

    @Test
    @DisplayName("入口函数")
    void testEntryPoints() {
        assertThat(text).contains(
                "public entry fun transfer(account: &signer, to: address, amount: u64) acquires State");
        assertThat(text).contains(
                "public fun balance_of(account: &signer, account_: address): u64 acquires State");
        assertThat(text).contains("fun transfer_logic(state: &mut State, caller: address, to: address, amount: u64)");
        assertThat(text).contains("borrow_global_mut<State>(@ccdsl)");
    }

    @Test
    @DisplayName("map 访问与事件")
    void testTablesAndEvents() {
        assertThat(text).contains("table::upsert(&mut ");
        assertThat(text).contains("table::borrow_with_default(&");
        assertThat(text).contains("#[event]");
        assertThat(text).contains("struct Transfer has drop, store {");
        assertThat(text).contains("event::emit(Transfer { ");
    }

    @Test
    @DisplayName("相同输入生成相同文本")
    void testDeterministic() {
        ContractDecl contract = BackendFixtures.optimized(BackendFixtures.TOKEN);
        assertThat(new AptosGenerator().generate(contract).getText()).isEqualTo(text);
    }

    @Test
    @DisplayName("有符号整数不受支持")
    void testSignedIntegerUnsupported() {
        CodegenResult result = new AptosGenerator().generate(BackendFixtures.optimized(BackendFixtures.SIGNED_LEDGER));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getText()).isNull();
        assertThat(result.getTarget()).isEqualTo(Target.APTOS);
        assertThat(result.getDiagnostics()).isNotEmpty();
        assertThat(result.getDiagnostics()).allSatisfy(d -> {
            assertThat(d.getCode()).isEqualTo(DiagnosticCode.UNSUPPORTED_CONSTRUCT);
            assertThat(d.getTarget()).isEqualTo("aptos");
        });
        assertThat(result.getDiagnostics().get(0).getMessage()).isEqualTo("Type 'i64' is not supported on aptos");
    }
}
