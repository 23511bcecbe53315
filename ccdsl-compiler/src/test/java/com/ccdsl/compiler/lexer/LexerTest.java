package com.ccdsl.compiler.lexer;

import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    private DiagnosticCollector diagnostics;

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        diagnostics = new DiagnosticCollector();
        return new Lexer(source, "<test>", diagnostics).scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        List<Token> result = new ArrayList<Token>();
        for (Token t : scan(source)) {
            if (t.getType() != TokenType.EOF) result.add(t);
        }
        return result;
    }

    private List<TokenType> types(String source) {
        List<TokenType> result = new ArrayList<TokenType>();
        for (Token t : tokens(source)) {
            result.add(t.getType());
        }
        return result;
    }

    /** 断言单个 token 的类型 */
    private Token assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
        return toks.get(0);
    }

    private List<Diagnostic> errors() {
        return diagnostics.getDiagnostics();
    }

    // ================================================================
    // 操作符与分隔符
    // ================================================================

    @Nested
    @DisplayName("操作符与分隔符")
    class OperatorTests {

        @Test
        @DisplayName("单字符 token")
        void testSingleChars() {
            assertSingleToken("(", TokenType.LPAREN);
            assertSingleToken("}", TokenType.RBRACE);
            assertSingleToken("[", TokenType.LBRACKET);
            assertSingleToken(";", TokenType.SEMICOLON);
            assertSingleToken("?", TokenType.QUESTION);
            assertSingleToken("%", TokenType.MOD);
        }

        @Test
        @DisplayName("双字符操作符优先于单字符")
        void testTwoCharOperators() {
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("<=", TokenType.LE);
            assertSingleToken(">=", TokenType.GE);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("=>", TokenType.DOUBLE_ARROW);
            assertSingleToken("..", TokenType.RANGE);
        }

        @Test
        @DisplayName("单独的 | 是 lambda 界定符")
        void testPipe() {
            assertEquals(java.util.Arrays.asList(TokenType.PIPE, TokenType.IDENTIFIER, TokenType.PIPE),
                    types("|x|"));
        }

        @Test
        @DisplayName("单独的 _ 是占位符，_name 是标识符")
        void testUnderscore() {
            assertSingleToken("_", TokenType.UNDERSCORE);
            assertSingleToken("_unused", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("范围表达式 0..10")
        void testRange() {
            assertEquals(java.util.Arrays.asList(TokenType.INT_LITERAL, TokenType.RANGE, TokenType.INT_LITERAL),
                    types("0..10"));
        }
    }

    // ================================================================
    // 关键词与标识符
    // ================================================================

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("声明关键词")
        void testDeclarationKeywords() {
            assertSingleToken("contract", TokenType.KW_CONTRACT);
            assertSingleToken("implements", TokenType.KW_IMPLEMENTS);
            assertSingleToken("modifier", TokenType.KW_MODIFIER);
            assertSingleToken("state", TokenType.KW_STATE);
            assertSingleToken("fn", TokenType.KW_FN);
        }

        @Test
        @DisplayName("泛型类型关键词")
        void testGenericTypeKeywords() {
            assertSingleToken("map", TokenType.KW_MAP);
            assertSingleToken("vec", TokenType.KW_VEC);
            assertSingleToken("option", TokenType.KW_OPTION);
            assertSingleToken("result", TokenType.KW_RESULT);
        }

        @Test
        @DisplayName("基本类型名")
        void testPrimitiveTypes() {
            for (String name : new String[]{"u8", "u256", "i128", "bool", "address", "string", "bytes"}) {
                assertSingleToken(name, TokenType.PRIMITIVE_TYPE);
            }
        }

        @Test
        @DisplayName("内建值是 INTRINSIC 而不是标识符")
        void testIntrinsics() {
            Token t = assertSingleToken("msg_sender", TokenType.INTRINSIC);
            assertEquals(Intrinsic.MSG_SENDER, t.getLiteral());
            assertEquals(Intrinsic.BLOCK_TIMESTAMP, assertSingleToken("block_timestamp", TokenType.INTRINSIC).getLiteral());
        }

        @Test
        @DisplayName("以 b 开头的标识符不是字节串")
        void testIdentifierStartingWithB() {
            Token t = assertSingleToken("balance", TokenType.IDENTIFIER);
            assertEquals("balance", t.getLexeme());
        }
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        private NumericLiteral number(String source) {
            return (NumericLiteral) assertSingleToken(source, TokenType.INT_LITERAL).getLiteral();
        }

        @Test
        @DisplayName("十进制整数")
        void testDecimal() {
            NumericLiteral n = number("42");
            assertEquals(BigInteger.valueOf(42), n.getValue());
            assertNull(n.getSuffix());
        }

        @Test
        @DisplayName("下划线分隔符与类型后缀")
        void testSeparatorsAndSuffix() {
            NumericLiteral n = number("1_000_000u64");
            assertEquals(BigInteger.valueOf(1000000), n.getValue());
            assertEquals("u64", n.getSuffix());
        }

        @Test
        @DisplayName("十六进制整数")
        void testHex() {
            assertEquals(BigInteger.valueOf(255), number("0xff").getValue());
            NumericLiteral n = number("0xFFu8");
            assertEquals(BigInteger.valueOf(255), n.getValue());
            assertEquals("u8", n.getSuffix());
        }

        @Test
        @DisplayName("超出 long 范围的整数保持精确")
        void testBigInteger() {
            String max = "115792089237316195423570985008687907853269984665640564039457584007913129639935";
            assertEquals(new BigInteger(max), number(max + "u256").getValue());
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            Token t = assertSingleToken("\"a\\n\\t\\\\\\\"\\0\"", TokenType.STRING_LITERAL);
            assertEquals("a\n\t\\\"\0", t.getLiteral());
        }

        @Test
        @DisplayName("字节串 b\"...\"")
        void testBytes() {
            Token t = assertSingleToken("b\"abc\"", TokenType.BYTES_LITERAL);
            assertEquals("abc", t.getLiteral());
        }
    }

    // ================================================================
    // 注释与位置
    // ================================================================

    @Nested
    @DisplayName("注释与位置")
    class CommentTests {

        @Test
        @DisplayName("单行注释被忽略")
        void testLineComment() {
            assertEquals(java.util.Collections.singletonList(TokenType.IDENTIFIER), types("// hello\nx"));
        }

        @Test
        @DisplayName("块注释可以嵌套")
        void testNestedBlockComment() {
            assertEquals(java.util.Collections.singletonList(TokenType.IDENTIFIER), types("/* a /* b */ c */ x"));
            assertTrue(errors().isEmpty());
        }

        @Test
        @DisplayName("行列号从 1 开始，偏移从 0 开始")
        void testPositions() {
            List<Token> toks = tokens("let\n  x");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(2, toks.get(1).getLine());
            assertEquals(3, toks.get(1).getColumn());
            assertEquals(6, toks.get(1).getOffset());
        }

        @Test
        @DisplayName("以 EOF 结尾")
        void testEof() {
            List<Token> all = scan("");
            assertEquals(1, all.size());
            assertEquals(TokenType.EOF, all.get(0).getType());
        }
    }

    // ================================================================
    // 错误恢复
    // ================================================================

    @Nested
    @DisplayName("错误恢复")
    class ErrorRecoveryTests {

        @Test
        @DisplayName("未知字符报告 LEX_ERROR 并在下一个空白处恢复")
        void testUnknownCharacter() {
            List<TokenType> result = types("a #junk b");
            assertEquals(java.util.Arrays.asList(TokenType.IDENTIFIER, TokenType.IDENTIFIER), result);
            assertEquals(1, errors().size());
            Diagnostic d = errors().get(0);
            assertEquals(DiagnosticCode.LEX_ERROR, d.getCode());
            assertEquals(2, d.getLocation().getOffset());
            assertEquals(5, d.getLocation().getLength());
        }

        @Test
        @DisplayName("未闭合的字符串")
        void testUnterminatedString() {
            types("\"abc\nx");
            assertEquals(1, errors().size());
            assertTrue(errors().get(0).getMessage().contains("Unterminated string"));
        }

        @Test
        @DisplayName("非法整数后缀")
        void testInvalidSuffix() {
            types("10u7 x");
            assertEquals(1, errors().size());
            assertTrue(errors().get(0).getMessage().contains("u7"));
        }

        @Test
        @DisplayName("空的十六进制体")
        void testEmptyHex() {
            types("0x ;");
            assertEquals(1, errors().size());
            assertEquals(DiagnosticCode.LEX_ERROR, errors().get(0).getCode());
        }

        @Test
        @DisplayName("单个 & 是错误")
        void testSingleAmpersand() {
            types("a & b");
            assertEquals(1, errors().size());
        }

        @Test
        @DisplayName("多个错误都被报告")
        void testMultipleErrors() {
            types("# x $ y");
            assertEquals(2, errors().size());
        }
    }
}
