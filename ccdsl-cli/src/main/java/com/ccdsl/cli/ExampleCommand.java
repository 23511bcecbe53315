package com.ccdsl.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * picocli example 子命令：写出示例合约
 */
@Command(name = "example", mixinStandardHelpOptions = true, description = "生成示例代币合约")
public class ExampleCommand implements Callable<Integer> {

    @Option(names = {"-o", "--output"}, defaultValue = "example.ccdsl", description = "输出文件（默认 example.ccdsl）")
    File output;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        return new CompileRunner(spec.commandLine().getOut(), spec.commandLine().getErr()).writeExample(output);
    }
}
