package com.ccdsl.ir.backend;

import com.ccdsl.compiler.ast.decl.ContractDecl;

/**
 * 目标代码生成器。
 *
 * <p>实现只读取传入的优化后 AST，每次调用使用独立的发射状态，可被多个线程同时调用。</p>
 */
public interface TargetGenerator {

    Target getTarget();

    /** 类型映射表 */
    TypeMappingTable getTypeTable();

    /** 内建值映射表 */
    IntrinsicTable getIntrinsicTable();

    /**
     * 为一个合约生成目标源码。报告任何错误时产物为 null。
     */
    CodegenResult generate(ContractDecl contract);
}
