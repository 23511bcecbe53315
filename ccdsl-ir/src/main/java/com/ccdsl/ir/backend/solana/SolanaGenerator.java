package com.ccdsl.ir.backend.solana;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.lexer.Intrinsic;
import com.ccdsl.ir.backend.CodegenResult;
import com.ccdsl.ir.backend.IntrinsicTable;
import com.ccdsl.ir.backend.MapStoragePolicy;
import com.ccdsl.ir.backend.Target;
import com.ccdsl.ir.backend.TargetGenerator;
import com.ccdsl.ir.backend.TypeMappingTable;

/**
 * Solana / Anchor 代码生成器。
 *
 * <p>状态存放在种子为 "state" 的 PDA 账户中；每个 DSL 函数生成一个逻辑函数，
 * 每个公开函数另外生成一条 #[program] 指令和对应的 Accounts 结构体。</p>
 */
public class SolanaGenerator implements TargetGenerator {

    public static final TypeMappingTable TYPES = TypeMappingTable.builder()
            .identity("u8", "u16", "u32", "u64", "u128", "i8", "i16", "i32", "i64", "i128", "bool")
            .primitive("address", "Pubkey")
            .primitive("string", "String")
            .primitive("bytes", "Vec<u8>")
            .vector("Vec<{0}>")
            .array("[{0}; {n}]")
            .map("Vec<({0}, {1})>")
            .tuple("({*})")
            .option("Option<{0}>")
            .result("std::result::Result<{0}, {1}>")
            .build();

    public static final IntrinsicTable INTRINSICS = IntrinsicTable.builder()
            .map(Intrinsic.MSG_SENDER, "caller")
            .map(Intrinsic.BLOCK_NUMBER, "Clock::get()?.slot")
            .map(Intrinsic.BLOCK_TIMESTAMP, "(Clock::get()?.unix_timestamp as u64)")
            .build();

    private final MapStoragePolicy mapPolicy;

    public SolanaGenerator() {
        this(MapStoragePolicy.BOUNDED);
    }

    public SolanaGenerator(MapStoragePolicy mapPolicy) {
        this.mapPolicy = mapPolicy;
    }

    public MapStoragePolicy getMapPolicy() {
        return mapPolicy;
    }

    @Override
    public Target getTarget() {
        return Target.SOLANA;
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
        return new SolanaEmitter(contract, mapPolicy).emit();
    }
}
