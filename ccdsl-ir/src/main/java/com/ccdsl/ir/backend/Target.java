package com.ccdsl.ir.backend;

/**
 * 编译目标。枚举顺序即结果收集顺序。
 */
public enum Target {
    /** 账户模型：Rust / Anchor */
    SOLANA("solana", "rs"),
    /** 资源模型：Aptos Move */
    APTOS("aptos", "move"),
    /** 对象模型：Sui Move */
    SUI("sui", "move");

    private final String id;
    private final String extension;

    Target(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    public String getId() {
        return id;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * 产物相对路径：&lt;target&gt;/&lt;contract_snake&gt;.&lt;ext&gt;
     */
    public String artifactPath(String contractName) {
        return id + "/" + Names.toSnake(contractName) + "." + extension;
    }

    /** 按 id 查找（不区分大小写），不存在返回 null */
    public static Target fromId(String id) {
        for (Target t : values()) {
            if (t.id.equalsIgnoreCase(id)) return t;
        }
        return null;
    }
}
