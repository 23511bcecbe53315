package com.ccdsl.compiler.diagnostic;

import com.ccdsl.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 诊断收集器，按报告顺序保存
 */
public final class DiagnosticCollector {
    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    private int errorCount;

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.isError()) errorCount++;
    }

    public void error(DiagnosticCode code, String message, SourceLocation location) {
        report(Diagnostic.error(code, message, location));
    }

    public void warning(DiagnosticCode code, String message, SourceLocation location) {
        report(Diagnostic.warning(code, message, location));
    }

    public void addAll(List<Diagnostic> others) {
        for (Diagnostic d : others) {
            report(d);
        }
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> snapshot() {
        return new ArrayList<Diagnostic>(diagnostics);
    }
}
