package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.ast.decl.SourceFile;
import com.ccdsl.compiler.diagnostic.Diagnostic;

import java.util.Collections;
import java.util.List;

/**
 * 解析结果：可能不完整的 AST 和收集到的 PARSE_ERROR 列表
 */
public final class ParseResult {
    private final SourceFile sourceFile;
    private final List<Diagnostic> errors;

    public ParseResult(SourceFile sourceFile, List<Diagnostic> errors) {
        this.sourceFile = sourceFile;
        this.errors = Collections.unmodifiableList(errors);
    }

    public SourceFile getSourceFile() {
        return sourceFile;
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
