package com.ccdsl.ir.backend;

import com.ccdsl.compiler.lexer.Intrinsic;

import java.util.EnumMap;
import java.util.Map;

/**
 * 内建值到目标表达式的映射。缺失条目表示该目标不支持此内建值。
 */
public final class IntrinsicTable {

    private final Map<Intrinsic, String> entries;

    private IntrinsicTable(Map<Intrinsic, String> entries) {
        this.entries = entries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 目标表达式，不支持时为 null */
    public String lookup(Intrinsic intrinsic) {
        return entries.get(intrinsic);
    }

    public boolean supports(Intrinsic intrinsic) {
        return entries.containsKey(intrinsic);
    }

    public static final class Builder {
        private final Map<Intrinsic, String> entries = new EnumMap<Intrinsic, String>(Intrinsic.class);

        public Builder map(Intrinsic intrinsic, String expression) {
            entries.put(intrinsic, expression);
            return this;
        }

        public IntrinsicTable build() {
            return new IntrinsicTable(new EnumMap<Intrinsic, String>(entries));
        }
    }
}
