package com.ccdsl.compiler.diagnostic;

import com.ccdsl.compiler.ast.SourceLocation;

/**
 * 编译诊断：阶段、代码、严重级别、消息和源码区间。
 *
 * <p>诊断只被收集，从不作为控制流抛出。代码生成阶段的诊断额外记录所属目标 id。</p>
 */
public final class Diagnostic {
    private final DiagnosticCode code;
    private final Severity severity;
    private final String message;
    private final SourceLocation location;
    private final String target;  // nullable，仅代码生成诊断

    public Diagnostic(DiagnosticCode code, Severity severity, String message,
                      SourceLocation location, String target) {
        this.code = code;
        this.severity = severity;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.target = target;
    }

    public static Diagnostic error(DiagnosticCode code, String message, SourceLocation location) {
        return new Diagnostic(code, Severity.ERROR, message, location, null);
    }

    public static Diagnostic warning(DiagnosticCode code, String message, SourceLocation location) {
        return new Diagnostic(code, Severity.WARNING, message, location, null);
    }

    public DiagnosticKind getKind() { return code.getKind(); }
    public DiagnosticCode getCode() { return code; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }
    public String getTarget() { return target; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** 返回绑定到指定目标的副本 */
    public Diagnostic forTarget(String targetId) {
        return new Diagnostic(code, severity, message, location, targetId);
    }

    /**
     * 格式化为 file:line:column: error[CODE]: message 形式
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(location.getFile()).append(':')
          .append(location.getLine()).append(':')
          .append(location.getColumn()).append(": ");
        sb.append(severity == Severity.ERROR ? "error" : "warning");
        sb.append('[').append(code.name()).append(']');
        if (target != null) {
            sb.append('(').append(target).append(')');
        }
        sb.append(": ").append(message);
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
