package com.ccdsl.ir.backend.aptos;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.lexer.Intrinsic;
import com.ccdsl.ir.backend.CodegenResult;
import com.ccdsl.ir.backend.IntrinsicTable;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.TargetGenerator;
import com.ccdsl.ir.backend.TypeMappingTable;

/**
 * Aptos Move 代码生成器。
 *
 * <p>状态是发布账户 {@code @ccdsl} 下的 {@code State} 资源，在 init_module 中 move_to；
 * map 状态字段使用 {@code aptos_std::table::Table}。</p>
 */
public class AptosGenerator implements TargetGenerator {

    public static final TypeMappingTable TYPES = TypeMappingTable.builder()
            .identity("u8", "u16", "u32", "u64", "u128", "u256", "bool")
            .primitive("address", "address")
            .primitive("string", "std::string::String")
            .primitive("bytes", "vector<u8>")
            .vector("vector<{0}>")
            .array("vector<{0}>")
            .map("aptos_std::table::Table<{0}, {1}>")
            .option("std::option::Option<{0}>")
            .build();

    public static final IntrinsicTable INTRINSICS = IntrinsicTable.builder()
            .map(Intrinsic.MSG_SENDER, "caller")
            .map(Intrinsic.BLOCK_NUMBER, "block::get_current_block_height()")
            .map(Intrinsic.BLOCK_TIMESTAMP, "timestamp::now_seconds()")
            .build();

    @Override
    public Target getTarget() {
        return Target.APTOS;
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
        return new AptosEmitter(contract).emit();
    }
}
