package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.Declaration;
import com.ccdsl.compiler.ast.decl.StructDecl;
import com.ccdsl.compiler.ast.expr.StructLiteral;
import com.ccdsl.compiler.ast.type.NamedTypeRef;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 合约对文件级结构体与接口的引用
 */
final class SharedReferences {

    private SharedReferences() {
    }

    /**
     * 合约直接或经由结构体字段、接口签名间接引用的文件级声明名。
     * 合并进合约、位于合约区间外的结构体只在被引用时计入。
     */
    static Set<String> collect(ContractDecl contract, List<? extends Declaration> shared) {
        Map<String, Declaration> byName = new HashMap<String, Declaration>();
        for (Declaration decl : shared) {
            if (!byName.containsKey(decl.getName())) byName.put(decl.getName(), decl);
        }
        Set<String> used = new HashSet<String>();
        Deque<AstNode> pending = new ArrayDeque<AstNode>();
        for (AstNode child : contract.getChildren()) {
            if (child instanceof StructDecl && !contract.getLocation().containsOffset(child.getLocation().getOffset())) {
                continue;
            }
            pending.push(child);
        }
        for (String iface : contract.getInterfaces()) {
            if (byName.containsKey(iface) && used.add(iface)) pending.push(byName.get(iface));
        }
        while (!pending.isEmpty()) {
            AstNode node = pending.pop();
            String name = null;
            if (node instanceof NamedTypeRef) name = ((NamedTypeRef) node).getName();
            else if (node instanceof StructLiteral) name = ((StructLiteral) node).getStructName();
            if (name != null && byName.containsKey(name) && used.add(name)) {
                pending.push(byName.get(name));
            }
            for (AstNode child : node.getChildren()) {
                if (child != null) pending.push(child);
            }
        }
        return used;
    }
}
