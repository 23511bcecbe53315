package com.ccdsl.cli;

/**
 * 进程退出码
 */
public final class ExitCodes {

    /** 所有请求的目标都生成成功 */
    public static final int OK = 0;
    /** 词法、语法或语义错误 */
    public static final int FRONTEND_ERROR = 1;
    /** 命令行用法错误（picocli 默认值） */
    public static final int USAGE = 2;
    /** 部分或全部目标生成失败 */
    public static final int CODEGEN_ERROR = 3;
    /** 读写文件失败 */
    public static final int IO_ERROR = 4;
    /** 编译器内部错误 */
    public static final int INTERNAL_ERROR = 70;

    private ExitCodes() {
    }
}
