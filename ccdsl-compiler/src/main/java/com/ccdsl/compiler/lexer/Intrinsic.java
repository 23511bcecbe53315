package com.ccdsl.compiler.lexer;

/**
 * 编译器内建的链上环境值。
 *
 * <p>内建值不进入符号表，由语义分析器直接赋予固定类型，由各目标的内建映射表翻译。</p>
 */
public enum Intrinsic {
    /** 调用者地址 */
    MSG_SENDER("msg_sender"),
    /** 随调用附带的原生币数量 */
    MSG_VALUE("msg_value"),
    /** 当前区块高度 */
    BLOCK_NUMBER("block_number"),
    /** 当前时间戳（秒） */
    BLOCK_TIMESTAMP("block_timestamp");

    private final String sourceName;

    Intrinsic(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    public static Intrinsic fromName(String name) {
        for (Intrinsic i : values()) {
            if (i.sourceName.equals(name)) return i;
        }
        return null;
    }
}
