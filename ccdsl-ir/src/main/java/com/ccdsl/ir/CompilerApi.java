package com.ccdsl.ir;

import com.ccdsl.compiler.analysis.AnalysisResult;
import com.ccdsl.ir.backend.Target;

import java.util.Set;

/**
 * 编译器统一接口。
 *
 * <p>输入只是 DSL 源码文本，与其来源无关（手写、编辑器或外部助手生成）。</p>
 */
public interface CompilerApi {

    /**
     * 只做解析与语义分析，供编辑器工具使用。
     *
     * @param source   源码
     * @param fileName 文件名（用于诊断位置）
     */
    AnalysisResult check(String source, String fileName);

    /**
     * 编译源码中的每个合约到请求的目标。
     *
     * @param source   源码
     * @param fileName 文件名（用于诊断位置）
     * @param targets  目标集合，结果按枚举顺序排列
     */
    CompilationResult compile(String source, String fileName, Set<Target> targets);
}
