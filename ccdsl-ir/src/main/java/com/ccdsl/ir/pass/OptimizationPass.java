package com.ccdsl.ir.pass;

import com.ccdsl.compiler.ast.decl.ContractDecl;

/**
 * AST 优化 pass 接口。
 *
 * <p>实现必须是 copy-on-change 的：没有任何改写时返回传入的同一实例。</p>
 */
public interface OptimizationPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对合约执行一遍优化，改写计数记入 stats。
     */
    ContractDecl run(ContractDecl contract, OptimizationStats stats);
}
