package com.ccdsl.ir.backend;

/**
 * 账户模型目标中 map 状态字段的存储策略
 */
public enum MapStoragePolicy {
    /** 有界向量 Vec&lt;(K, V)&gt;，容量满时写入失败 */
    BOUNDED(64),
    /** 任何 map 状态字段都是目标约束违例 */
    REJECT(0);

    private final int capacity;

    MapStoragePolicy(int capacity) {
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    public static MapStoragePolicy fromName(String name) {
        for (MapStoragePolicy p : values()) {
            if (p.name().equalsIgnoreCase(name)) return p;
        }
        throw new IllegalArgumentException("Unknown map policy: " + name + " (expected bounded or reject)");
    }
}
