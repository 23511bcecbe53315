package com.ccdsl.ir;

import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticKind;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.pass.OptimizationStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个合约的编译结果：任务最终阶段、任务级诊断和每个目标的结果
 */
public final class ContractOutput {

    private final String contractName;
    private final JobState state;
    private final List<Diagnostic> diagnostics;
    private final List<TargetOutcome> outcomes;
    private final OptimizationStats stats;

    public ContractOutput(String contractName, JobState state, List<Diagnostic> diagnostics,
                          List<TargetOutcome> outcomes, OptimizationStats stats) {
        this.contractName = contractName;
        this.state = state;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
        this.outcomes = Collections.unmodifiableList(new ArrayList<TargetOutcome>(outcomes));
        this.stats = stats;
    }

    public String getContractName() { return contractName; }

    /**
     * 任务到达的阶段：前端或优化失败为 FAILED，否则为 OPTIMIZED（各目标的结果见 {@link #getOutcomes()}）
     */
    public JobState getState() { return state; }

    /** 任务级诊断（不属于任何目标） */
    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    /** 按目标枚举顺序 */
    public List<TargetOutcome> getOutcomes() { return outcomes; }

    public OptimizationStats getStats() { return stats; }

    public TargetOutcome getOutcome(Target target) {
        for (TargetOutcome outcome : outcomes) {
            if (outcome.getTarget() == target) return outcome;
        }
        return null;
    }

    /** 所有目标都生成成功 */
    public boolean isSuccess() {
        if (state == JobState.FAILED) return false;
        for (TargetOutcome outcome : outcomes) {
            if (!outcome.isGenerated()) return false;
        }
        return true;
    }

    /** 任务级与各目标的全部诊断 */
    public List<Diagnostic> getAllDiagnostics() {
        List<Diagnostic> all = new ArrayList<Diagnostic>(diagnostics);
        for (TargetOutcome outcome : outcomes) {
            all.addAll(outcome.getDiagnostics());
        }
        return all;
    }

    public boolean hasInternalErrors() {
        for (Diagnostic d : getAllDiagnostics()) {
            if (d.getKind() == DiagnosticKind.INTERNAL) return true;
        }
        return false;
    }
}
