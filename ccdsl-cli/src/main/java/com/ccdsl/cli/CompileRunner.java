package com.ccdsl.cli;

import com.ccdsl.compiler.analysis.AnalysisResult;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.ir.CcdslCompiler;
import com.ccdsl.ir.CompilationResult;
import com.ccdsl.ir.ContractOutput;
import com.ccdsl.ir.TargetOutcome;
import com.ccdsl.ir.backend.MapStoragePolicy;
import com.ccdsl.ir.backend.Target;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * 编译、校验、示例执行器。返回进程退出码，不直接退出进程。
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    static final String EXAMPLE_RESOURCE = "/example.ccdsl";

    private final PrintWriter out;
    private final PrintWriter err;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public CompileRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 编译文件，把成功的目标写到 outputDir/&lt;target&gt;/&lt;contract&gt;.&lt;ext&gt;
     */
    public int compile(File input, Set<Target> targets, File outputDir, MapStoragePolicy mapPolicy,
                       boolean json, boolean parallel) {
        String source;
        try {
            source = read(input);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + input + " (" + e.getMessage() + ")");
            return ExitCodes.IO_ERROR;
        }

        CcdslCompiler compiler = new CcdslCompiler(mapPolicy);
        CompilationResult result;
        if (parallel) {
            ExecutorService pool = Executors.newFixedThreadPool(
                    Math.max(1, Math.min(targets.size(), Runtime.getRuntime().availableProcessors())));
            try {
                result = compiler.compile(source, input.getName(), targets, pool);
            } finally {
                pool.shutdown();
            }
        } else {
            result = compiler.compile(source, input.getName(), targets);
        }

        List<String> written = new ArrayList<String>();
        try {
            for (ContractOutput contract : result.getContracts()) {
                for (TargetOutcome outcome : contract.getOutcomes()) {
                    if (!outcome.isGenerated()) continue;
                    Path path = outputDir.toPath().resolve(outcome.getArtifactPath());
                    Files.createDirectories(path.getParent());
                    Files.write(path, outcome.getText().getBytes(StandardCharsets.UTF_8));
                    LOG.info("Wrote " + path);
                    written.add(path.toString());
                }
            }
        } catch (IOException e) {
            err.println("错误: 无法写入输出 - " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        if (json) {
            out.println(gson.toJson(JsonReport.of(result, written)));
        } else {
            printDiagnostics(result.getAllDiagnostics());
            for (ContractOutput contract : result.getContracts()) {
                for (TargetOutcome outcome : contract.getOutcomes()) {
                    out.println(contract.getContractName() + " [" + outcome.getTarget().getId() + "]: "
                            + (outcome.isGenerated() ? "已生成 " + outcome.getArtifactPath() : "失败"));
                }
                LOG.fine(contract.getContractName() + " optimizer: " + contract.getStats());
            }
        }
        out.flush();
        err.flush();
        return exitCode(result);
    }

    static int exitCode(CompilationResult result) {
        if (result.hasFrontendErrors()) return ExitCodes.FRONTEND_ERROR;
        if (result.hasInternalErrors()) return ExitCodes.INTERNAL_ERROR;
        if (!result.isSuccess()) return ExitCodes.CODEGEN_ERROR;
        return ExitCodes.OK;
    }

    /**
     * 只做解析与语义分析
     */
    public int validate(File input, boolean json) {
        String source;
        try {
            source = read(input);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + input + " (" + e.getMessage() + ")");
            return ExitCodes.IO_ERROR;
        }
        AnalysisResult analysis = new CcdslCompiler().check(source, input.getName());
        if (json) {
            out.println(gson.toJson(JsonReport.of(input.getName(), analysis)));
        } else {
            printDiagnostics(analysis.getDiagnostics());
            if (!analysis.hasErrors()) {
                out.println("校验通过: " + input.getName() + "（" + analysis.getContracts().size() + " 个合约）");
            }
        }
        out.flush();
        err.flush();
        return analysis.hasErrors() ? ExitCodes.FRONTEND_ERROR : ExitCodes.OK;
    }

    /**
     * 写出示例合约
     */
    public int writeExample(File output) {
        try (InputStream in = CompileRunner.class.getResourceAsStream(EXAMPLE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + EXAMPLE_RESOURCE);
            }
            Path target = output.toPath();
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            err.println("错误: 无法写入示例文件 - " + output + " (" + e.getMessage() + ")");
            err.flush();
            return ExitCodes.IO_ERROR;
        }
        out.println("已生成: " + output);
        out.flush();
        return ExitCodes.OK;
    }

    private void printDiagnostics(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            err.println(d.format());
        }
    }

    private static String read(File file) throws IOException {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }
}
