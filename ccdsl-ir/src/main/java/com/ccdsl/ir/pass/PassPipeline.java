package com.ccdsl.ir.pass;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.ir.InternalInvariantViolation;
import com.ccdsl.ir.pass.ast.AlgebraicSimplification;
import com.ccdsl.ir.pass.ast.ConstantFolding;
import com.ccdsl.ir.pass.ast.ConstantPropagation;
import com.ccdsl.ir.pass.ast.DeadCodeElimination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 优化 Pass 管线。
 * 按固定顺序反复执行所有 pass，直到一整轮没有任何改写（不动点）。
 *
 * <p>pass 实例在 run 期间持有状态，一条管线只能同时服务一个任务。</p>
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    /** 不动点迭代上限，超过即视为编译器缺陷 */
    public static final int MAX_ITERATIONS = 32;

    private final List<OptimizationPass> passes = new ArrayList<OptimizationPass>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线：常量传播 → 常量折叠 → 代数简化 → 死代码消除。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new ConstantPropagation());
        pipeline.addPass(new ConstantFolding());
        pipeline.addPass(new AlgebraicSimplification());
        pipeline.addPass(new DeadCodeElimination());
        return pipeline;
    }

    public void addPass(OptimizationPass pass) {
        passes.add(pass);
    }

    public List<OptimizationPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public ContractDecl optimize(ContractDecl contract) {
        return optimize(contract, new OptimizationStats());
    }

    /**
     * 运行到不动点。输入树不被修改。
     *
     * @throws InternalInvariantViolation 超过 {@link #MAX_ITERATIONS} 轮仍未收敛，或某次改写改变了类型
     */
    public ContractDecl optimize(ContractDecl contract, OptimizationStats stats) {
        ContractDecl current = contract;
        boolean changed = true;
        int iteration = 0;
        while (changed) {
            if (iteration == MAX_ITERATIONS) {
                throw new InternalInvariantViolation("Optimizer did not reach a fixed point within "
                        + MAX_ITERATIONS + " iterations for contract '" + contract.getName() + "'",
                        contract.getLocation());
            }
            iteration++;
            stats.iteration();
            changed = false;
            for (OptimizationPass pass : passes) {
                ContractDecl next = pass.run(current, stats);
                if (next != current) {
                    changed = true;
                    if (LOG.isLoggable(Level.FINER)) {
                        LOG.finer(contract.getName() + ": iteration " + iteration + ", " + pass.getName() + " rewrote");
                    }
                }
                current = next;
            }
        }
        LOG.fine("Optimized " + contract.getName() + ": " + stats);
        return current;
    }
}
