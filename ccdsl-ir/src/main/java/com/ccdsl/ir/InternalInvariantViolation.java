package com.ccdsl.ir;

import com.ccdsl.compiler.ast.SourceLocation;

/**
 * 编译器自身缺陷：优化器不收敛、改变节点类型的重写、产生环的树等。
 *
 * <p>不是用户错误。由 {@link CompilationJob} 捕获并转换为 INTERNAL 诊断。</p>
 */
public class InternalInvariantViolation extends RuntimeException {

    private final SourceLocation location;

    public InternalInvariantViolation(String message) {
        this(message, SourceLocation.UNKNOWN);
    }

    public InternalInvariantViolation(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
