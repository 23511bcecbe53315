package com.ccdsl.ir;

import com.ccdsl.compiler.Frontend;
import com.ccdsl.compiler.analysis.AnalysisResult;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.ir.backend.MapStoragePolicy;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.TargetGenerator;
import com.ccdsl.ir.backend.aptos.AptosGenerator;
import com.ccdsl.ir.backend.solana.SolanaGenerator;
import com.ccdsl.ir.backend.sui.SuiGenerator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * 编译器门面。
 * 管线：源码 → Lexer → Parser → 语义分析 → 优化 → 各目标代码生成。
 *
 * <p>门面本身无状态：生成器每次调用都新建发射状态，优化管线每个任务新建，
 * 因此同一实例可以被多个线程同时使用。</p>
 */
public class CcdslCompiler implements CompilerApi {

    private static final Logger LOG = Logger.getLogger(CcdslCompiler.class.getName());

    private final Map<Target, TargetGenerator> generators;

    public CcdslCompiler() {
        this(MapStoragePolicy.BOUNDED);
    }

    /**
     * @param solanaMapPolicy Solana 状态中 map 字段的存储策略
     */
    public CcdslCompiler(MapStoragePolicy solanaMapPolicy) {
        this(Arrays.<TargetGenerator>asList(
                new SolanaGenerator(solanaMapPolicy), new AptosGenerator(), new SuiGenerator()));
    }

    public CcdslCompiler(List<TargetGenerator> generators) {
        Map<Target, TargetGenerator> map = new EnumMap<Target, TargetGenerator>(Target.class);
        for (TargetGenerator generator : generators) {
            map.put(generator.getTarget(), generator);
        }
        this.generators = Collections.unmodifiableMap(map);
    }

    public TargetGenerator getGenerator(Target target) {
        return generators.get(target);
    }

    @Override
    public AnalysisResult check(String source, String fileName) {
        return Frontend.check(source, fileName);
    }

    /**
     * 编译到所有目标。
     */
    public CompilationResult compile(String source, String fileName) {
        return compile(source, fileName, EnumSet.allOf(Target.class));
    }

    @Override
    public CompilationResult compile(String source, String fileName, Set<Target> targets) {
        return compile(source, fileName, targets, Runnable::run);
    }

    /**
     * 编译源码，每个合约的各目标生成提交到 executor 并行执行。结果仍按目标枚举顺序排列。
     */
    public CompilationResult compile(String source, String fileName, Set<Target> targets, Executor executor) {
        AnalysisResult analysis = check(source, fileName);
        List<ContractOutput> outputs = new ArrayList<ContractOutput>();
        for (ContractDecl contract : analysis.getContracts()) {
            CompilationJob job = new CompilationJob(contract, generators);
            // 语义错误只阻断所在合约及引用了出错文件级声明的合约
            job.analyzed(analysis.hasErrors(contract));
            if (job.getState() == JobState.ANALYZED) {
                job.optimize();
            }
            outputs.add(job.generate(targets, executor));
        }
        LOG.fine("Compiled " + fileName + ": " + outputs.size() + " contract(s), "
                + analysis.getDiagnostics().size() + " front-end diagnostic(s)");
        return new CompilationResult(fileName, analysis.getDiagnostics(), outputs);
    }

    /**
     * 编译文件（UTF-8）。
     */
    public CompilationResult compileFile(File file, Set<Target> targets) throws IOException {
        String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return compile(source, file.getName(), targets);
    }
}
