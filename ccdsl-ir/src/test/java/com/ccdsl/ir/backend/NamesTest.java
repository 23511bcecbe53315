package com.ccdsl.ir.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("命名转换")
class NamesTest {

    @Test
    @DisplayName("驼峰转下划线")
    void testToSnake() {
        assertThat(Names.toSnake("TokenVault")).isEqualTo("token_vault");
        assertThat(Names.toSnake("getBalance")).isEqualTo("get_balance");
        assertThat(Names.toSnake("ERC20Token")).isEqualTo("erc20_token");
        assertThat(Names.toSnake("MAX_SUPPLY")).isEqualTo("max_supply");
        assertThat(Names.toSnake("transfer")).isEqualTo("transfer");
    }

    @Test
    @DisplayName("下划线转 Pascal")
    void testToPascal() {
        assertThat(Names.toPascal("get_balance")).isEqualTo("GetBalance");
        assertThat(Names.toPascal("transfer")).isEqualTo("Transfer");
    }

    @Test
    @DisplayName("保留字追加下划线")
    void testEscapeReserved() {
        Set<String> reserved = new HashSet<String>(Arrays.asList("state", "move"));
        assertThat(Names.escapeReserved("state", reserved)).isEqualTo("state_");
        assertThat(Names.escapeReserved("amount", reserved)).isEqualTo("amount");
    }

    @Test
    @DisplayName("消息转错误标识符")
    void testMessageNames() {
        assertThat(Names.messageToPascal("Insufficient balance!")).isEqualTo("InsufficientBalance");
        assertThat(Names.messageToPascal("ONLY owner")).isEqualTo("OnlyOwner");
        assertThat(Names.messageToPascal("404 not found")).isEqualTo("Error404NotFound");
        assertThat(Names.messageToPascal("!!!")).isNull();
        assertThat(Names.messageToUpperSnake("Insufficient balance!")).isEqualTo("INSUFFICIENT_BALANCE");
        assertThat(Names.messageToUpperSnake("  ")).isNull();
    }

    @Test
    @DisplayName("字符串转义")
    void testEscapes() {
        assertThat(Names.escapeString("say \"hi\"\n")).isEqualTo("say \\\"hi\\\"\\n");
        assertThat(Names.escapeString("a\\b")).isEqualTo("a\\\\b");
        assertThat(Names.escapeByteString("é")).isEqualTo("\\xc3\\xa9");
        assertThat(Names.escapeByteString("ok\t")).isEqualTo("ok\\t");
    }
}
