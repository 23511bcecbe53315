package com.ccdsl.ir.backend;

import com.ccdsl.ir.backend.aptos.AptosGenerator;
import com.ccdsl.ir.backend.solana.SolanaGenerator;
import com.ccdsl.ir.backend.sui.SuiGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("类型映射表")
class TypeMappingTableTest {

    @Test
    @DisplayName("模板占位符")
    void testTemplates() {
        TypeMappingTable table = TypeMappingTable.builder()
                .identity("u64")
                .primitive("address", "Pubkey")
                .vector("Vec<{0}>")
                .array("[{0}; {n}]")
                .map("Vec<({0}, {1})>")
                .tuple("({*})")
                .build();

        assertThat(table.primitive("u64")).isEqualTo("u64");
        assertThat(table.primitive("address")).isEqualTo("Pubkey");
        assertThat(table.vector("u8")).isEqualTo("Vec<u8>");
        assertThat(table.array("u8", 32)).isEqualTo("[u8; 32]");
        assertThat(table.map("Pubkey", "u64")).isEqualTo("Vec<(Pubkey, u64)>");
        assertThat(table.tuple(Arrays.asList("u64", "bool"))).isEqualTo("(u64, bool)");
    }

    @Test
    @DisplayName("缺失的映射返回 null")
    void testMissing() {
        TypeMappingTable table = TypeMappingTable.builder().identity("u64").build();
        assertThat(table.primitive("i64")).isNull();
        assertThat(table.vector("u64")).isNull();
        assertThat(table.tuple(Arrays.asList("u64"))).isNull();
        assertThat(table.option("u64")).isNull();
    }

    @Test
    @DisplayName("各目标的整数类型")
    void testTargetTables() {
        assertThat(SolanaGenerator.TYPES.primitive("i64")).isEqualTo("i64");
        assertThat(AptosGenerator.TYPES.primitive("i64")).isNull();
        assertThat(SuiGenerator.TYPES.primitive("i64")).isNull();
        assertThat(AptosGenerator.TYPES.primitive("u256")).isEqualTo("u256");
        assertThat(SuiGenerator.TYPES.map("address", "u64")).isEqualTo("sui::table::Table<address, u64>");
    }

    @Test
    @DisplayName("目标产物路径与查找")
    void testTargets() {
        assertThat(Target.SOLANA.artifactPath("TokenVault")).isEqualTo("solana/token_vault.rs");
        assertThat(Target.APTOS.artifactPath("TokenVault")).isEqualTo("aptos/token_vault.move");
        assertThat(Target.fromId("SUI")).isEqualTo(Target.SUI);
        assertThat(Target.fromId("evm")).isNull();
        assertThat(MapStoragePolicy.fromName("reject")).isEqualTo(MapStoragePolicy.REJECT);
        assertThatThrownBy(() -> MapStoragePolicy.fromName("unbounded"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bounded or reject");
    }
}
