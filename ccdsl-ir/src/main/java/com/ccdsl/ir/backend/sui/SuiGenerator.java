package com.ccdsl.ir.backend.sui;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.lexer.Intrinsic;
import com.ccdsl.ir.backend.CodegenResult;
import com.ccdsl.ir.backend.IntrinsicTable;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.TargetGenerator;
import com.ccdsl.ir.backend.TypeMappingTable;

/**
 * Sui Move 代码生成器。
 *
 * <p>状态是在 init 中创建并共享的 {@code State} 对象，由入口函数以可变引用接收；
 * map 状态字段使用 {@code sui::table::Table}。</p>
 */
public class SuiGenerator implements TargetGenerator {

    public static final TypeMappingTable TYPES = TypeMappingTable.builder()
            .identity("u8", "u16", "u32", "u64", "u128", "u256", "bool")
            .primitive("address", "address")
            .primitive("string", "std::string::String")
            .primitive("bytes", "vector<u8>")
            .vector("vector<{0}>")
            .array("vector<{0}>")
            .map("sui::table::Table<{0}, {1}>")
            .option("std::option::Option<{0}>")
            .build();

    public static final IntrinsicTable INTRINSICS = IntrinsicTable.builder()
            .map(Intrinsic.MSG_SENDER, "caller")
            .map(Intrinsic.BLOCK_NUMBER, "tx_context::epoch(ctx)")
            .map(Intrinsic.BLOCK_TIMESTAMP, "(tx_context::epoch_timestamp_ms(ctx) / 1000)")
            .build();

    @Override
    public Target getTarget() {
        return Target.SUI;
    }

    @Override
    public TypeMappingTable getTypeTable() {
        return TYPES;
    }

    @Override
    public IntrinsicTable getIntrinsicTable() {
        return INTRINSICS;
    }

    @Override
    public CodegenResult generate(ContractDecl contract) {
        return new SuiEmitter(contract).emit();
    }
}
