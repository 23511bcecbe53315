package com.ccdsl.ir;

/**
 * 编译任务的阶段。FAILED 对所在阶段是终态。
 */
public enum JobState {
    PARSED,
    ANALYZED,
    OPTIMIZED,
    GENERATED,
    FAILED
}
