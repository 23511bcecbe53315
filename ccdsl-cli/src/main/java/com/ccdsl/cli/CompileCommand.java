package com.ccdsl.cli;

import com.ccdsl.ir.backend.MapStoragePolicy;
import com.ccdsl.ir.backend.Target;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * picocli compile 子命令：编译到一个或多个目标链
 */
@Command(name = "compile", mixinStandardHelpOptions = true, description = "编译合约到目标链源码")
public class CompileCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, required = true, description = "DSL 源文件（.ccdsl）")
    File input;

    @Option(names = {"-t", "--target"}, split = ",", defaultValue = "all",
            description = "目标：solana, aptos, sui 或 all（默认 all，可重复或逗号分隔）")
    List<String> targets;

    @Option(names = {"-o", "--output"}, defaultValue = "output", description = "输出目录（默认 ./output）")
    File outputDir;

    @Option(names = "--json", description = "以 JSON 输出诊断与结果")
    boolean json;

    @Option(names = "--parallel", description = "在线程池上并行生成各目标")
    boolean parallel;

    @Option(names = "--solana-map-policy", defaultValue = "bounded",
            description = "Solana 状态中 map 的存储策略：bounded 或 reject（默认 bounded）")
    String solanaMapPolicy;

    @Mixin
    LoggingOptions logging;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        logging.apply();
        Set<Target> selected;
        MapStoragePolicy policy;
        try {
            selected = resolveTargets(targets);
            policy = MapStoragePolicy.fromName(solanaMapPolicy);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
        CompileRunner runner = new CompileRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.compile(input, selected, outputDir, policy, json, parallel);
    }

    /**
     * 解析 -t 的取值，all 表示全部目标
     */
    static Set<Target> resolveTargets(List<String> names) {
        Set<Target> result = EnumSet.noneOf(Target.class);
        for (String name : names) {
            String trimmed = name.trim();
            if ("all".equalsIgnoreCase(trimmed)) {
                result.addAll(EnumSet.allOf(Target.class));
                continue;
            }
            Target target = Target.fromId(trimmed);
            if (target == null) {
                throw new IllegalArgumentException("Unknown target: " + trimmed + " (expected solana, aptos, sui or all)");
            }
            result.add(target);
        }
        if (result.isEmpty()) {
            result.addAll(EnumSet.allOf(Target.class));
        }
        return result;
    }
}
