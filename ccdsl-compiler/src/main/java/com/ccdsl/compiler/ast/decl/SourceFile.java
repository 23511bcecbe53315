package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个源文件的解析结果：顶层合约、结构体、接口，按出现顺序
 */
public class SourceFile extends AstNode {
    private final String fileName;
    private final List<Declaration> declarations;

    public SourceFile(SourceLocation location, String fileName, List<Declaration> declarations) {
        super(location);
        this.fileName = fileName;
        this.declarations = declarations;
    }

    public String getFileName() {
        return fileName;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public List<ContractDecl> getContracts() {
        return filter(ContractDecl.class);
    }

    public List<StructDecl> getStructs() {
        return filter(StructDecl.class);
    }

    public List<InterfaceDecl> getInterfaces() {
        return filter(InterfaceDecl.class);
    }

    private <T extends Declaration> List<T> filter(Class<T> kind) {
        List<T> result = new ArrayList<T>();
        for (Declaration d : declarations) {
            if (kind.isInstance(d)) result.add(kind.cast(d));
        }
        return result;
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(declarations);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSourceFile(this, context);
    }
}
