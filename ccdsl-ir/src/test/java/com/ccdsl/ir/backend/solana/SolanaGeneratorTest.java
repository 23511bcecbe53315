package com.ccdsl.ir.backend.solana;

import com.ccdsl.compiler.Frontend;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.ir.backend.CodegenResult;
import com.ccdsl.ir.backend.MapStoragePolicy;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.pass.PassPipeline;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Solana/Anchor 生成器测试
 */
@DisplayName("Solana 生成器")
class SolanaGeneratorTest {

    private static final String TOKEN = String.join("\n",
            "contract Token {",
            "    state {",
            "        owner: address;",
            "        totalSupply: u64 = 0;",
            "        balances: map<address, u64>;",
            "    }",
            "",
            "    event Transfer(from: address, to: address, amount: u64);",
            "",
            "    public fn transfer(to: address, amount: u64) {",
            "        let from = msg_sender;",
            "        let balance = balances[from];",
            "        require(balance >= amount, \"Insufficient balance\");",
            "        balances[from] = balance - amount;",
            "        balances[to] = balances[to] + amount;",
            "        emit Transfer(from, to, amount);",
            "    }",
            "",
            "    public fn balanceOf(account: address) -> u64 {",
            "        return balances[account];",
            "    }",
            "}",
            "");

    private static ContractDecl token;

    @BeforeAll
    static void analyze() {
        token = contract(TOKEN);
    }

    private static ContractDecl contract(String source) {
        return PassPipeline.createDefault().optimize(Frontend.check(source, "token.ccdsl").getContracts().get(0));
    }

    @Nested
    @DisplayName("BOUNDED 策略")
    class BoundedTests {

        private String generate() {
            CodegenResult result = new SolanaGenerator().generate(token);
            assertThat(result.getDiagnostics()).isEmpty();
            assertThat(result.isSuccess()).isTrue();
            return result.getText();
        }

        @Test
        @DisplayName("程序骨架")
        void testProgramSkeleton() {
            String text = generate();
            assertThat(text).startsWith("use anchor_lang::prelude::*;");
            assertThat(text).contains("declare_id!(");
            assertThat(text).contains("#[program]");
            assertThat(text).contains("pub mod token {");
            assertThat(text).contains("pub fn initialize_state(ctx: Context<InitializeStateAccounts>) -> Result<()>");
            assertThat(text).contains("pub struct InitializeStateAccounts<'info>");
        }

        @Test
        @DisplayName("公开函数生成指令、逻辑函数和 Accounts 结构体")
        void testInstructions() {
            String text = generate();
            assertThat(text).contains(
                    "pub fn transfer(ctx: Context<TransferAccounts>, to: Pubkey, amount: u64) -> Result<()>");
            assertThat(text).contains(
                    "fn transfer_logic(state: &mut State, caller: Pubkey, to: Pubkey, amount: u64) -> Result<()>");
            assertThat(text).contains("transfer_logic(&mut ctx.accounts.state, caller, to, amount)");
            assertThat(text).contains(
                    "pub fn balance_of(ctx: Context<BalanceOfAccounts>, account: Pubkey) -> Result<u64>");
            assertThat(text).contains("pub struct TransferAccounts<'info>");
        }

        @Test
        @DisplayName("map 状态字段存为有界向量")
        void testBoundedMap() {
            String text = generate();
            assertThat(text).contains("#[account]");
            assertThat(text).contains("#[derive(InitSpace)]");
            assertThat(text).contains("pub struct State");
            assertThat(text).contains("#[max_len(64)]\n    pub balances: Vec<(Pubkey, u64)>,");
            assertThat(text).contains("pub const MAP_CAPACITY: usize = 64;");
            assertThat(text).contains("fn map_get<K: PartialEq, V: Clone + Default>");
            assertThat(text).contains("fn map_set<K: PartialEq, V>");
            assertThat(text).contains("map_set(&mut ");
            assertThat(text).contains("MapCapacityExceeded,");
        }

        @Test
        @DisplayName("算术使用 checked 运算")
        void testCheckedArithmetic() {
            String text = generate();
            assertThat(text).contains(".checked_sub(");
            assertThat(text).contains(".checked_add(");
            assertThat(text).contains("ErrorCode::ArithmeticOverflow");
        }

        @Test
        @DisplayName("require 与错误码枚举")
        void testRequireAndErrorCodes() {
            String text = generate();
            assertThat(text).contains("require!(");
            assertThat(text).contains("ErrorCode::InsufficientBalance);");
            assertThat(text).contains("#[error_code]");
            assertThat(text).contains("pub enum ErrorCode");
            assertThat(text).contains("#[msg(\"Insufficient balance\")]\n    InsufficientBalance,");
            assertThat(text).contains("ArithmeticOverflow,");
            assertThat(text).contains("RequirementFailed,");
        }

        @Test
        @DisplayName("事件")
        void testEvent() {
            String text = generate();
            assertThat(text).contains("#[event]\npub struct Transfer {");
            assertThat(text).contains("emit!(Transfer {");
        }

        @Test
        @DisplayName("相同输入生成相同文本")
        void testDeterministic() {
            SolanaGenerator generator = new SolanaGenerator();
            assertThat(generator.generate(token).getText()).isEqualTo(generator.generate(token).getText());
            assertThat(new SolanaGenerator().generate(contract(TOKEN)).getText())
                    .isEqualTo(generator.generate(token).getText());
        }

        @Test
        @DisplayName("没有 map 时不输出容量常量和辅助函数")
        void testNoMapHelpers() {
            ContractDecl counter = contract(String.join("\n",
                    "contract Counter {",
                    "    state { count: u64 = 0; }",
                    "    public fn increment() { count = count + 1; }",
                    "}"));
            String text = new SolanaGenerator().generate(counter).getText();
            assertThat(text).doesNotContain("MAP_CAPACITY");
            assertThat(text).doesNotContain("fn map_set");
            assertThat(text).contains("pub count: u64,");
        }

        @Test
        @DisplayName("有符号整数可以表达")
        void testSignedIntegers() {
            ContractDecl ledger = contract(String.join("\n",
                    "contract Ledger {",
                    "    state { delta: i64 = 0; }",
                    "    public fn adjust(by: i64) { delta = delta + by; }",
                    "}"));
            CodegenResult result = new SolanaGenerator().generate(ledger);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getText()).contains("pub delta: i64,");
        }

        @Test
        @DisplayName("变长字段用集合长度上限，只有 map 维度用容量")
        void testMaxLenDimensions() {
            ContractDecl registry = contract(String.join("\n",
                    "contract Registry {",
                    "    state {",
                    "        names: map<address, string>;",
                    "        tags: vec<string>;",
                    "        blob: bytes;",
                    "    }",
                    "    public fn count() -> u64 { return tags.len(); }",
                    "}"));
            CodegenResult result = new SolanaGenerator().generate(registry);
            assertThat(result.getDiagnostics()).isEmpty();
            String text = result.getText();
            assertThat(text).contains("#[max_len(64, 32)]\n    pub names: Vec<(Pubkey, String)>,");
            assertThat(text).contains("#[max_len(32, 32)]\n    pub tags: Vec<String>,");
            assertThat(text).contains("#[max_len(32)]\n    pub blob: Vec<u8>,");
        }
    }

    @Nested
    @DisplayName("REJECT 策略")
    class RejectTests {

        @Test
        @DisplayName("map 状态字段是目标约束违例")
        void testRejectMap() {
            SolanaGenerator generator = new SolanaGenerator(MapStoragePolicy.REJECT);
            assertThat(generator.getMapPolicy()).isEqualTo(MapStoragePolicy.REJECT);

            CodegenResult result = generator.generate(token);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getText()).isNull();
            assertThat(result.getTarget()).isEqualTo(Target.SOLANA);
            assertThat(result.getDiagnostics()).isNotEmpty();
            assertThat(result.getDiagnostics())
                    .allSatisfy(d -> assertThat(d.getTarget()).isEqualTo("solana"));
            Diagnostic field = null;
            for (Diagnostic d : result.getDiagnostics()) {
                if (d.getMessage().startsWith("State field 'balances'")) field = d;
            }
            assertThat(field).isNotNull();
            assertThat(field.getCode()).isEqualTo(DiagnosticCode.TARGET_CONSTRAINT_VIOLATION);
            assertThat(field.getMessage()).contains("REJECT map policy").endsWith("on solana");
            assertThat(field.getLocation().getLine()).isEqualTo(5);
        }

        @Test
        @DisplayName("没有 map 时照常生成")
        void testRejectWithoutMap() {
            ContractDecl counter = contract(String.join("\n",
                    "contract Counter {",
                    "    state { count: u64 = 0; }",
                    "    public fn increment() { count = count + 1; }",
                    "}"));
            assertThat(new SolanaGenerator(MapStoragePolicy.REJECT).generate(counter).isSuccess()).isTrue();
        }
    }
}
