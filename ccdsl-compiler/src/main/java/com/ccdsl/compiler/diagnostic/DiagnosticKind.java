package com.ccdsl.compiler.diagnostic;

/**
 * 诊断所属的编译阶段
 */
public enum DiagnosticKind {
    LEX,
    PARSE,
    SEMANTIC,
    CODEGEN,
    /** 编译器自身缺陷（优化器不收敛、改变类型的重写等） */
    INTERNAL
}
