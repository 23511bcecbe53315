package com.ccdsl.ir.backend;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.stmt.RequireStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 合约内 require/revert 消息到目标错误码标识符的映射。
 *
 * <p>每个不同的消息一个标识符，按源码中首次出现的顺序排列。无消息的 require 使用默认错误码。
 * 标识符冲突时追加序号。</p>
 */
public final class ErrorCodeRegistry {

    private final Map<String, String> codes = new LinkedHashMap<String, String>();
    private final String defaultCode;

    private ErrorCodeRegistry(String defaultCode) {
        this.defaultCode = defaultCode;
    }

    /**
     * @param naming    消息 → 标识符（无可用字符时返回 null）
     * @param separator 冲突序号前的分隔符
     * @param reserved  已被其他错误码占用的标识符
     */
    public static ErrorCodeRegistry collect(ContractDecl contract, Function<String, String> naming,
                                            String separator, String defaultCode, Set<String> reserved) {
        ErrorCodeRegistry registry = new ErrorCodeRegistry(defaultCode);
        List<RequireStmt> requires = new ArrayList<RequireStmt>();
        collectRequires(contract, requires);
        Collections.sort(requires, new Comparator<RequireStmt>() {
            @Override
            public int compare(RequireStmt a, RequireStmt b) {
                return Integer.compare(a.getLocation().getOffset(), b.getLocation().getOffset());
            }
        });

        Set<String> taken = new HashSet<String>(reserved);
        taken.add(defaultCode);
        for (RequireStmt req : requires) {
            String message = req.getMessage();
            if (message == null || registry.codes.containsKey(message)) continue;
            String base = naming.apply(message);
            if (base == null) base = defaultCode;
            String name = base;
            int n = 2;
            while (taken.contains(name)) {
                name = base + separator + n++;
            }
            taken.add(name);
            registry.codes.put(message, name);
        }
        return registry;
    }

    private static void collectRequires(AstNode node, List<RequireStmt> out) {
        if (node instanceof RequireStmt) {
            out.add((RequireStmt) node);
        }
        for (AstNode child : node.getChildren()) {
            if (child != null) collectRequires(child, out);
        }
    }

    /** 消息对应的标识符；消息为 null 时返回默认错误码 */
    public String codeFor(String message) {
        if (message == null) return defaultCode;
        String code = codes.get(message);
        return code != null ? code : defaultCode;
    }

    public String getDefaultCode() {
        return defaultCode;
    }

    /** 消息 → 标识符，按首次出现顺序 */
    public Map<String, String> getCodes() {
        return Collections.unmodifiableMap(codes);
    }
}
