package com.ccdsl.ir.backend;

import com.ccdsl.compiler.diagnostic.Diagnostic;

import java.util.Collections;
import java.util.List;

/**
 * 单个目标的生成结果：产物文本（失败时为 null）与该目标的诊断
 */
public final class CodegenResult {

    private final Target target;
    private final String text;
    private final List<Diagnostic> diagnostics;

    public CodegenResult(Target target, String text, List<Diagnostic> diagnostics) {
        this.target = target;
        this.text = text;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public Target getTarget() {
        return target;
    }

    public String getText() {
        return text;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isSuccess() {
        return text != null;
    }
}
