package com.ccdsl.cli;

import picocli.CommandLine.Option;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * --verbose 选项：把 com.ccdsl 日志提升到 FINE 并输出到控制台
 */
public class LoggingOptions {

    private static final String ROOT_PACKAGE = "com.ccdsl";

    /** 保持强引用，避免 logger 被回收后级别丢失 */
    private static final Logger ROOT = Logger.getLogger(ROOT_PACKAGE);
    private static Handler verboseHandler;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志（优化统计、生成过程）")
    boolean verbose;

    public void apply() {
        configure(verbose);
    }

    static synchronized void configure(boolean verbose) {
        if (verbose) {
            ROOT.setLevel(Level.FINE);
            if (verboseHandler == null) {
                verboseHandler = new ConsoleHandler();
                verboseHandler.setLevel(Level.FINE);
                ROOT.addHandler(verboseHandler);
            }
        } else {
            ROOT.setLevel(Level.INFO);
            if (verboseHandler != null) {
                ROOT.removeHandler(verboseHandler);
                verboseHandler = null;
            }
        }
    }
}
