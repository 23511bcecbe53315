package com.ccdsl.compiler.ast.decl;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 合约声明。一个合约就是一个编译作业，拥有其全部嵌套实体。
 */
public class ContractDecl extends Declaration {
    private final List<String> interfaces;
    private final List<StateVarDecl> stateVars;
    private final List<StructDecl> structs;
    private final List<EventDecl> events;
    private final List<ModifierDecl> modifiers;
    private final List<ConstDecl> constants;
    private final List<FunctionDecl> functions;

    public ContractDecl(SourceLocation location, String name, List<String> interfaces,
                        List<StateVarDecl> stateVars, List<StructDecl> structs,
                        List<EventDecl> events, List<ModifierDecl> modifiers,
                        List<ConstDecl> constants, List<FunctionDecl> functions) {
        super(location, name);
        this.interfaces = interfaces;
        this.stateVars = stateVars;
        this.structs = structs;
        this.events = events;
        this.modifiers = modifiers;
        this.constants = constants;
        this.functions = functions;
    }

    public List<String> getInterfaces() { return interfaces; }
    public List<StateVarDecl> getStateVars() { return stateVars; }
    public List<StructDecl> getStructs() { return structs; }
    public List<EventDecl> getEvents() { return events; }
    public List<ModifierDecl> getModifiers() { return modifiers; }
    public List<ConstDecl> getConstants() { return constants; }
    public List<FunctionDecl> getFunctions() { return functions; }

    public FunctionDecl findFunction(String fnName) {
        for (FunctionDecl f : functions) {
            if (f.getName().equals(fnName)) return f;
        }
        return null;
    }

    public ModifierDecl findModifier(String modName) {
        for (ModifierDecl m : modifiers) {
            if (m.getName().equals(modName)) return m;
        }
        return null;
    }

    public EventDecl findEvent(String eventName) {
        for (EventDecl e : events) {
            if (e.getName().equals(eventName)) return e;
        }
        return null;
    }

    /**
     * 在结构体列表前插入文件级结构体，使合约自包含
     */
    public ContractDecl withSharedStructs(List<StructDecl> shared) {
        if (shared.isEmpty()) return this;
        List<StructDecl> merged = new ArrayList<StructDecl>(shared);
        merged.addAll(structs);
        return new ContractDecl(location, name, interfaces, stateVars, merged,
                events, modifiers, constants, functions);
    }

    /**
     * 只保留名字在 keep 中的文件级结构体，合约内声明的结构体不变
     */
    public ContractDecl retainSharedStructs(Set<String> keep) {
        List<StructDecl> kept = new ArrayList<StructDecl>();
        for (StructDecl struct : structs) {
            if (location.containsOffset(struct.getLocation().getOffset()) || keep.contains(struct.getName())) {
                kept.add(struct);
            }
        }
        if (kept.size() == structs.size()) return this;
        return new ContractDecl(location, name, interfaces, stateVars, kept,
                events, modifiers, constants, functions);
    }

    /** 以新的成员列表构造副本（优化器使用） */
    public ContractDecl withMembers(List<StateVarDecl> newStateVars, List<ModifierDecl> newModifiers,
                                   List<ConstDecl> newConstants, List<FunctionDecl> newFunctions) {
        return new ContractDecl(location, name, interfaces, newStateVars, structs,
                events, newModifiers, newConstants, newFunctions);
    }

    @Override
    public List<AstNode> getChildren() {
        return nodes(stateVars, structs, events, modifiers, constants, functions);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContractDecl(this, context);
    }
}
