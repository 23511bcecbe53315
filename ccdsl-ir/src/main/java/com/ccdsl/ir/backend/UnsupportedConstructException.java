package com.ccdsl.ir.backend;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;

/**
 * 代码生成中遇到目标无法表达（或目标模型禁止）的构造。
 *
 * <p>只在生成器内部使用：在最近的语句或声明边界被捕获并转换为该目标的 CODEGEN 诊断。</p>
 */
public class UnsupportedConstructException extends RuntimeException {

    private final DiagnosticCode code;
    private final SourceLocation location;

    public UnsupportedConstructException(DiagnosticCode code, String message, SourceLocation location) {
        super(message);
        this.code = code;
        this.location = location;
    }

    /** 目标没有对应构造 */
    public static UnsupportedConstructException unsupported(String message, SourceLocation location) {
        return new UnsupportedConstructException(DiagnosticCode.UNSUPPORTED_CONSTRUCT, message, location);
    }

    /** 可以表达但违反目标的存储/执行模型 */
    public static UnsupportedConstructException violation(String message, SourceLocation location) {
        return new UnsupportedConstructException(DiagnosticCode.TARGET_CONSTRAINT_VIOLATION, message, location);
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
