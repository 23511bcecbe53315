package com.ccdsl.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CCDSL CLI 入口点（picocli）
 */
@Command(name = "ccdsl", version = "CCDSL v0.1.0",
         mixinStandardHelpOptions = true,
         description = "跨链合约 DSL 编译器",
         subcommands = {CompileCommand.class, ValidateCommand.class, ExampleCommand.class})
public class Main implements Runnable {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * 创建配置好的命令行：命令中未处理的异常按内部错误处理
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            LOG.log(Level.WARNING, "Unhandled error in command '" + commandLine.getCommandName() + "'", ex);
            commandLine.getErr().println("错误: 编译器内部错误 - " + ex);
            return ExitCodes.INTERNAL_ERROR;
        });
        return cmd;
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();
        CommandLine cmd = createCommandLine();
        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
        } catch (UnsupportedEncodingException e) {
            LOG.fine("Console charset " + charsetName + " unavailable, using defaults");
        }
        System.exit(cmd.execute(args));
    }

    /**
     * 控制台实际使用的字符编码名。Windows 控制台通常仍为 GBK/CP936，
     * native.encoding 属性（Java 17+）反映操作系统原生编码。
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
