package com.ccdsl.ir.backend;

import com.ccdsl.compiler.Frontend;
import com.ccdsl.compiler.analysis.AnalysisResult;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.ir.pass.PassPipeline;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 生成器测试共用的合约源码
 */
public final class BackendFixtures {

    public static final String TOKEN = String.join("\n",
            "contract Token {",
            "    const MAX_SUPPLY: u64 = 1_000_000;",
            "",
            "    state {",
            "        owner: address;",
            "        initialized: bool = false;",
            "        paused: bool = false;",
            "        totalSupply: u64 = 0;",
            "        balances: map<address, u64>;",
            "    }",
            "",
            "    event Transfer(from: address, to: address, amount: u64);",
            "",
            "    modifier onlyOwner() {",
            "        require(msg_sender == owner, \"Only owner\");",
            "        _;",
            "    }",
            "",
            "    public fn initialize() {",
            "        require(!initialized, \"Already initialized\");",
            "        owner = msg_sender;",
            "        initialized = true;",
            "    }",
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
            "    public fn setPaused(value: bool) onlyOwner {",
            "        paused = value;",
            "    }",
            "",
            "    public fn balanceOf(account: address) -> u64 {",
            "        return balances[account];",
            "    }",
            "}",
            "");

    /** 只有 Solana 能表达的有符号整数合约 */
    public static final String SIGNED_LEDGER = String.join("\n",
            "contract Ledger {",
            "    state {",
            "        delta: i64 = 0;",
            "    }",
            "",
            "    public fn adjust(by: i64) {",
            "        delta = delta + by;",
            "    }",
            "}",
            "");

    private BackendFixtures() {}

    public static ContractDecl optimized(String source) {
        AnalysisResult result = Frontend.check(source, "fixture.ccdsl");
        assertThat(result.hasErrors()).as("源码应通过语义分析: %s", result.getErrors()).isFalse();
        return PassPipeline.createDefault().optimize(result.getContracts().get(0));
    }
}
