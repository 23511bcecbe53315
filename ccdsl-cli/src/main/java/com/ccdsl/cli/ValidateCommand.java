package com.ccdsl.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * picocli validate 子命令：只做解析和语义检查
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "检查合约的语法与语义，不生成代码")
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, required = true, description = "DSL 源文件（.ccdsl）")
    File input;

    @Option(names = "--json", description = "以 JSON 输出诊断")
    boolean json;

    @Mixin
    LoggingOptions logging;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        logging.apply();
        return new CompileRunner(spec.commandLine().getOut(), spec.commandLine().getErr()).validate(input, json);
    }
}
