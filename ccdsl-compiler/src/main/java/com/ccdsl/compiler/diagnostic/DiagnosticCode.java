package com.ccdsl.compiler.diagnostic;

/**
 * 诊断代码，每个代码固定归属于一个 {@link DiagnosticKind}
 */
public enum DiagnosticCode {
    // === 词法 / 语法 ===
    LEX_ERROR(DiagnosticKind.LEX),
    PARSE_ERROR(DiagnosticKind.PARSE),

    // === 语义 ===
    UNDEFINED_SYMBOL(DiagnosticKind.SEMANTIC),
    DUPLICATE_DECLARATION(DiagnosticKind.SEMANTIC),
    TYPE_MISMATCH(DiagnosticKind.SEMANTIC),
    MISSING_RETURN(DiagnosticKind.SEMANTIC),
    IMMUTABLE_ASSIGNMENT(DiagnosticKind.SEMANTIC),
    ARITY_MISMATCH(DiagnosticKind.SEMANTIC),
    INVALID_CONSTRUCT(DiagnosticKind.SEMANTIC),
    UNUSED_BINDING(DiagnosticKind.SEMANTIC),
    UNREACHABLE_CODE(DiagnosticKind.SEMANTIC),

    // === 代码生成（按目标隔离） ===
    UNSUPPORTED_CONSTRUCT(DiagnosticKind.CODEGEN),
    TARGET_CONSTRAINT_VIOLATION(DiagnosticKind.CODEGEN),

    // === 内部错误 ===
    INTERNAL_INVARIANT_VIOLATION(DiagnosticKind.INTERNAL);

    private final DiagnosticKind kind;

    DiagnosticCode(DiagnosticKind kind) {
        this.kind = kind;
    }

    public DiagnosticKind getKind() {
        return kind;
    }
}
