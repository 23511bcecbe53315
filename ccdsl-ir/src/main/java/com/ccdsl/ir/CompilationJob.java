package com.ccdsl.ir;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.Severity;
import com.ccdsl.ir.backend.CodegenResult;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.TargetGenerator;
import com.ccdsl.ir.pass.OptimizationStats;
import com.ccdsl.ir.pass.PassPipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 驱动一个合约走完流水线：
 * PARSED → ANALYZED → OPTIMIZED → 每个目标 GENERATED 或 FAILED。
 *
 * <p>任何阶段的失败都以诊断形式记录，不会抛出任务边界。
 * 目标之间互不影响：一个生成器失败只让该目标 FAILED。</p>
 */
public final class CompilationJob {

    private static final Logger LOG = Logger.getLogger(CompilationJob.class.getName());

    private final ContractDecl contract;
    private final Map<Target, TargetGenerator> generators;
    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    private final OptimizationStats stats = new OptimizationStats();
    private JobState state = JobState.PARSED;
    private ContractDecl optimized;

    public CompilationJob(ContractDecl contract, Map<Target, TargetGenerator> generators) {
        this.contract = contract;
        this.generators = generators;
    }

    public JobState getState() {
        return state;
    }

    public ContractDecl getContract() {
        return contract;
    }

    /** 优化后的合约，尚未优化或优化失败时为 null */
    public ContractDecl getOptimized() {
        return optimized;
    }

    /**
     * 记录前端分析的结果。前端有错误时任务在此终止。
     */
    public void analyzed(boolean frontendErrors) {
        requireState(JobState.PARSED);
        state = frontendErrors ? JobState.FAILED : JobState.ANALYZED;
    }

    /**
     * 运行优化管线。每个任务使用自己的管线实例。
     */
    public void optimize() {
        requireState(JobState.ANALYZED);
        try {
            optimized = PassPipeline.createDefault().optimize(contract, stats);
            state = JobState.OPTIMIZED;
        } catch (InternalInvariantViolation e) {
            LOG.log(Level.WARNING, "Optimizer failed on contract '" + contract.getName() + "'", e);
            diagnostics.add(internal(e, null));
            state = JobState.FAILED;
        }
    }

    /**
     * 为每个请求的目标生成代码，在调用线程上依次执行。
     */
    public ContractOutput generate(Set<Target> targets) {
        return generate(targets, Runnable::run);
    }

    /**
     * 为每个请求的目标生成代码。生成提交到 executor，结果按目标枚举顺序收集。
     */
    public ContractOutput generate(Set<Target> targets, Executor executor) {
        if (state != JobState.OPTIMIZED) {
            return new ContractOutput(contract.getName(), JobState.FAILED, diagnostics,
                    Collections.<TargetOutcome>emptyList(), stats);
        }
        List<Target> ordered = new ArrayList<Target>(new TreeSet<Target>(targets));
        List<FutureTask<TargetOutcome>> tasks = new ArrayList<FutureTask<TargetOutcome>>();
        for (Target target : ordered) {
            FutureTask<TargetOutcome> task = new FutureTask<TargetOutcome>(() -> generateTarget(target));
            tasks.add(task);
            executor.execute(task);
        }
        List<TargetOutcome> outcomes = new ArrayList<TargetOutcome>();
        for (int i = 0; i < ordered.size(); i++) {
            outcomes.add(await(ordered.get(i), tasks.get(i)));
        }
        return new ContractOutput(contract.getName(), state, diagnostics, outcomes, stats);
    }

    private TargetOutcome generateTarget(Target target) {
        String path = target.artifactPath(contract.getName());
        TargetGenerator generator = generators.get(target);
        if (generator == null) {
            throw new InternalInvariantViolation("No generator registered for target '" + target.getId() + "'");
        }
        CodegenResult result = generator.generate(optimized);
        if (result.isSuccess()) {
            LOG.fine(contract.getName() + " → " + path);
            return new TargetOutcome(target, JobState.GENERATED, result.getText(), path, result.getDiagnostics());
        }
        return new TargetOutcome(target, JobState.FAILED, null, path, result.getDiagnostics());
    }

    private TargetOutcome await(Target target, FutureTask<TargetOutcome> task) {
        String path = target.artifactPath(contract.getName());
        try {
            return task.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InternalInvariantViolation) {
                LOG.log(Level.WARNING, target.getId() + " generator failed on contract '"
                        + contract.getName() + "'", cause);
                return failed(target, path, internal((InternalInvariantViolation) cause, target));
            }
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(target, path, internal(
                    new InternalInvariantViolation("Code generation was interrupted", contract.getLocation()), target));
        }
    }

    private static TargetOutcome failed(Target target, String path, Diagnostic diagnostic) {
        return new TargetOutcome(target, JobState.FAILED, null, path, Collections.singletonList(diagnostic));
    }

    private static Diagnostic internal(InternalInvariantViolation e, Target target) {
        return new Diagnostic(DiagnosticCode.INTERNAL_INVARIANT_VIOLATION, Severity.ERROR,
                "Internal compiler error: " + e.getMessage(), e.getLocation(),
                target != null ? target.getId() : null);
    }

    private void requireState(JobState expected) {
        if (state != expected) {
            throw new IllegalStateException("Job for '" + contract.getName() + "' is " + state
                    + ", expected " + expected);
        }
    }
}
