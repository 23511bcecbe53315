package com.ccdsl.ir;

import com.ccdsl.compiler.Frontend;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.ir.backend.BackendFixtures;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.TargetGenerator;
import com.ccdsl.ir.backend.solana.SolanaGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * 编译任务状态机测试
 */
@DisplayName("编译任务")
class CompilationJobTest {

    private static ContractDecl token() {
        return Frontend.check(BackendFixtures.TOKEN, "token.ccdsl").getContracts().get(0);
    }

    private static Map<Target, TargetGenerator> solanaOnly() {
        Map<Target, TargetGenerator> generators = new EnumMap<Target, TargetGenerator>(Target.class);
        generators.put(Target.SOLANA, new SolanaGenerator());
        return generators;
    }

    @Test
    @DisplayName("正常路径 PARSED → ANALYZED → OPTIMIZED")
    void testHappyPath() {
        CompilationJob job = new CompilationJob(token(), solanaOnly());
        assertThat(job.getState()).isEqualTo(JobState.PARSED);
        assertThat(job.getOptimized()).isNull();

        job.analyzed(false);
        assertThat(job.getState()).isEqualTo(JobState.ANALYZED);

        job.optimize();
        assertThat(job.getState()).isEqualTo(JobState.OPTIMIZED);
        assertThat(job.getOptimized()).isNotNull();

        ContractOutput output = job.generate(EnumSet.of(Target.SOLANA));
        assertThat(output.getState()).isEqualTo(JobState.OPTIMIZED);
        assertThat(output.getOutcome(Target.SOLANA).getState()).isEqualTo(JobState.GENERATED);
        assertThat(output.getOutcome(Target.SOLANA).getArtifactPath()).isEqualTo("solana/token.rs");
        assertThat(output.isSuccess()).isTrue();
        assertThat(output.getStats().getIterations()).isPositive();
    }

    @Test
    @DisplayName("前端错误使任务终止")
    void testFrontendFailure() {
        CompilationJob job = new CompilationJob(token(), solanaOnly());
        job.analyzed(true);

        assertThat(job.getState()).isEqualTo(JobState.FAILED);
        ContractOutput output = job.generate(EnumSet.allOf(Target.class));
        assertThat(output.getState()).isEqualTo(JobState.FAILED);
        assertThat(output.getOutcomes()).isEmpty();
        assertThat(output.isSuccess()).isFalse();
    }

    @Test
    @DisplayName("阶段顺序错误是编程错误")
    void testIllegalTransition() {
        CompilationJob job = new CompilationJob(token(), solanaOnly());

        assertThatThrownBy(job::optimize)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is PARSED, expected ANALYZED");

        job.analyzed(false);
        assertThatThrownBy(() -> job.analyzed(false))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("未注册生成器的目标以内部错误失败")
    void testMissingGenerator() {
        CompilationJob job = new CompilationJob(token(), solanaOnly());
        job.analyzed(false);
        job.optimize();

        ContractOutput output = job.generate(EnumSet.of(Target.SOLANA, Target.SUI));

        assertThat(output.getOutcome(Target.SOLANA).isGenerated()).isTrue();
        TargetOutcome sui = output.getOutcome(Target.SUI);
        assertThat(sui.getState()).isEqualTo(JobState.FAILED);
        assertThat(sui.getArtifactPath()).isEqualTo("sui/token.move");
        assertThat(sui.getDiagnostics()).hasSize(1);
        assertThat(sui.getDiagnostics().get(0).getCode()).isEqualTo(DiagnosticCode.INTERNAL_INVARIANT_VIOLATION);
        assertThat(sui.getDiagnostics().get(0).getMessage()).contains("No generator registered for target 'sui'");
        assertThat(output.hasInternalErrors()).isTrue();
    }

    @Test
    @DisplayName("不请求任何目标")
    void testNoTargets() {
        CompilationJob job = new CompilationJob(token(), solanaOnly());
        job.analyzed(false);
        job.optimize();

        ContractOutput output = job.generate(Collections.<Target>emptySet());
        assertThat(output.getOutcomes()).isEmpty();
        assertThat(output.isSuccess()).isTrue();
    }
}
