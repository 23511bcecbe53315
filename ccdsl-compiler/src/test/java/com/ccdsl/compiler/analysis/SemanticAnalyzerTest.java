package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.Frontend;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.expr.Identifier;
import com.ccdsl.compiler.ast.stmt.LetStmt;
import com.ccdsl.compiler.ast.stmt.ReturnStmt;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.DiagnosticKind;
import com.ccdsl.compiler.diagnostic.Severity;
import com.ccdsl.compiler.types.IntegerType;
import com.ccdsl.compiler.types.PrimitiveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 语义分析测试
 */
class SemanticAnalyzerTest {

    private AnalysisResult analyze(String source) {
        return Frontend.check(source, "test.ccdsl");
    }

    /** 把函数体包进一个带常用状态的合约 */
    private AnalysisResult analyzeBody(String signature, String body) {
        return analyze("contract C {\n"
                + "    state { owner: address; total: u64 = 0; items: vec<u64>; }\n"
                + "    " + signature + " {\n"
                + body + "\n"
                + "    }\n"
                + "}\n");
    }

    private List<Diagnostic> withCode(AnalysisResult result, DiagnosticCode code) {
        List<Diagnostic> out = new ArrayList<Diagnostic>();
        for (Diagnostic d : result.getDiagnostics()) {
            if (d.getCode() == code) out.add(d);
        }
        return out;
    }

    private void assertClean(AnalysisResult result) {
        assertFalse(result.hasErrors(), "不应有错误: " + result.getErrors());
    }

    private Diagnostic assertSingleError(AnalysisResult result, DiagnosticCode code) {
        List<Diagnostic> errors = result.getErrors();
        assertEquals(1, errors.size(), "应恰好一个错误: " + errors);
        assertEquals(code, errors.get(0).getCode());
        assertEquals(DiagnosticKind.SEMANTIC, errors.get(0).getKind());
        return errors.get(0);
    }

    // ================================================================
    // 类型检查
    // ================================================================

    @Nested
    @DisplayName("类型检查")
    class TypeCheckTests {

        @Test
        @DisplayName("返回值类型不匹配时报告期望与实际类型，位置指向 return 语句")
        void testReturnTypeMismatch() {
            String source = "contract C {\n"
                    + "    fn f() -> u64 {\n"
                    + "        return \"hello\";\n"
                    + "    }\n"
                    + "}\n";
            Diagnostic d = assertSingleError(analyze(source), DiagnosticCode.TYPE_MISMATCH);
            assertTrue(d.getMessage().contains("u64"), d.getMessage());
            assertTrue(d.getMessage().contains("string"), d.getMessage());
            assertEquals(3, d.getLocation().getLine());
            assertEquals(9, d.getLocation().getColumn());
            assertEquals("test.ccdsl", d.getLocation().getFile());
        }

        @Test
        @DisplayName("无后缀整数字面量采用期望类型")
        void testLiteralTakesExpectedType() {
            assertClean(analyzeBody("fn f() -> u8", "return 200;"));
        }

        @Test
        @DisplayName("字面量超出目标类型范围")
        void testLiteralOutOfRange() {
            Diagnostic d = assertSingleError(analyzeBody("fn f() -> u8", "return 256;"),
                    DiagnosticCode.TYPE_MISMATCH);
            assertTrue(d.getMessage().contains("does not fit in u8"), d.getMessage());
        }

        @Test
        @DisplayName("不同宽度的整数不能混合运算")
        void testMixedIntegerWidths() {
            AnalysisResult result = analyzeBody("fn f(a: u8, b: u64) -> u64", "return a + b;");
            assertFalse(withCode(result, DiagnosticCode.TYPE_MISMATCH).isEmpty());
        }

        @Test
        @DisplayName("as 转换在整数之间放行")
        void testCast() {
            assertClean(analyzeBody("fn f(a: u8) -> u64", "return a as u64 + total;"));
        }

        @Test
        @DisplayName("条件必须是 bool")
        void testConditionMustBeBool() {
            assertSingleError(analyzeBody("fn f()", "if total { total = 1; }"), DiagnosticCode.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("无符号整数不能取负")
        void testNegateUnsigned() {
            Diagnostic d = assertSingleError(analyzeBody("fn f(a: u64) -> u64", "return -a;"),
                    DiagnosticCode.TYPE_MISMATCH);
            assertTrue(d.getMessage().contains("signed"), d.getMessage());
        }

        @Test
        @DisplayName("map 下标与结构体字段")
        void testIndexAndField() {
            String source = "contract C {\n"
                    + "    struct P { x: u64, y: u64 }\n"
                    + "    state { balances: map<address, u64>; }\n"
                    + "    fn f(who: address) -> u64 {\n"
                    + "        let p = P { x: 1, y: 2 };\n"
                    + "        return balances[who] + p.x;\n"
                    + "    }\n"
                    + "}\n";
            assertClean(analyze(source));
        }

        @Test
        @DisplayName("访问不存在的字段")
        void testUnknownField() {
            String source = "contract C {\n"
                    + "    struct P { x: u64 }\n"
                    + "    fn f() -> u64 { let p = P { x: 1 }; return p.z; }\n"
                    + "}\n";
            assertSingleError(analyze(source), DiagnosticCode.UNDEFINED_SYMBOL);
        }

        @Test
        @DisplayName("map 与 filter 的 lambda")
        void testHigherOrderMethods() {
            AnalysisResult result = analyzeBody("fn f() -> vec<u64>",
                    "let doubled = items.map(|x| x * 2);\n"
                    + "return doubled.filter(|x| x > 10);");
            assertClean(result);
        }

        @Test
        @DisplayName("lambda 只能作为 map / filter 的参数")
        void testLambdaOutsideHigherOrder() {
            assertSingleError(analyzeBody("fn f()", "let g = |x| x;"), DiagnosticCode.INVALID_CONSTRUCT);
        }

        @Test
        @DisplayName("match 表达式需要通配分支")
        void testMatchWildcard() {
            assertClean(analyzeBody("fn f(a: u64) -> u64", "return match a { 0 => 1, 1..10 => 2, _ => 3 };"));
            assertSingleError(analyzeBody("fn f(a: u64) -> u64", "return match a { 0 => 1, 1 => 2 };"),
                    DiagnosticCode.INVALID_CONSTRUCT);
        }
    }

    // ================================================================
    // 符号与声明
    // ================================================================

    @Nested
    @DisplayName("符号与声明")
    class SymbolTests {

        @Test
        @DisplayName("未定义的变量")
        void testUndefinedVariable() {
            Diagnostic d = assertSingleError(analyzeBody("fn f() -> u64", "return missing;"),
                    DiagnosticCode.UNDEFINED_SYMBOL);
            assertEquals("Undefined symbol 'missing'", d.getMessage());
        }

        @Test
        @DisplayName("未定义的函数")
        void testUndefinedFunction() {
            Diagnostic d = assertSingleError(analyzeBody("fn f()", "nothing(1);"), DiagnosticCode.UNDEFINED_SYMBOL);
            assertTrue(d.getMessage().contains("function 'nothing'"), d.getMessage());
        }

        @Test
        @DisplayName("同一作用域内重复声明")
        void testDuplicateLocal() {
            AnalysisResult result = analyzeBody("fn f() -> u64", "let a = 1;\nlet a = 2;\nreturn a;");
            Diagnostic d = assertSingleError(result, DiagnosticCode.DUPLICATE_DECLARATION);
            assertTrue(d.getMessage().contains("first declared at line"), d.getMessage());
        }

        @Test
        @DisplayName("函数与状态变量同名")
        void testDuplicateMember() {
            String source = "contract C { state { total: u64; } fn total() {} }";
            assertSingleError(analyze(source), DiagnosticCode.DUPLICATE_DECLARATION);
        }

        @Test
        @DisplayName("内层块可以遮蔽外层绑定")
        void testShadowingInNestedBlock() {
            assertClean(analyzeBody("fn f() -> u64", "let a = 1;\nif true { let a = 2; total = a; }\nreturn a;"));
        }

        @Test
        @DisplayName("函数可以前向引用")
        void testForwardReference() {
            String source = "contract C {\n"
                    + "    fn a() -> u64 { return b(); }\n"
                    + "    fn b() -> u64 { return 1; }\n"
                    + "}\n";
            assertClean(analyze(source));
        }

        @Test
        @DisplayName("调用实参个数不符")
        void testArity() {
            String source = "contract C {\n"
                    + "    fn add(a: u64, b: u64) -> u64 { return a + b; }\n"
                    + "    fn f() -> u64 { return add(1); }\n"
                    + "}\n";
            Diagnostic d = assertSingleError(analyze(source), DiagnosticCode.ARITY_MISMATCH);
            assertTrue(d.getMessage().contains("expects 2 argument(s), found 1"), d.getMessage());
        }

        @Test
        @DisplayName("emit 的事件必须声明")
        void testUndefinedEvent() {
            assertSingleError(analyzeBody("fn f()", "emit Missing(1);"), DiagnosticCode.UNDEFINED_SYMBOL);
        }

        @Test
        @DisplayName("未知类型名")
        void testUnknownType() {
            String source = "contract C { state { x: Unknown; } }";
            assertSingleError(analyze(source), DiagnosticCode.UNDEFINED_SYMBOL);
        }

        @Test
        @DisplayName("解析后标识符绑定到符号")
        void testSymbolBinding() {
            AnalysisResult result = analyzeBody("fn f() -> u64", "let a = total;\nreturn a;");
            assertClean(result);
            ContractDecl contract = result.getContracts().get(0);
            LetStmt let = (LetStmt) contract.getFunctions().get(0).getBody().getStatements().get(0);
            assertEquals(IntegerType.U64, let.getSymbol().getType());
            ReturnStmt ret = (ReturnStmt) contract.getFunctions().get(0).getBody().getStatements().get(1);
            assertSame(let.getSymbol(), ((Identifier) ret.getValue()).getSymbol());
        }
    }

    // ================================================================
    // 可变性与控制流
    // ================================================================

    @Nested
    @DisplayName("可变性与控制流")
    class MutabilityAndFlowTests {

        @Test
        @DisplayName("不可变绑定不能赋值")
        void testImmutableLocal() {
            Diagnostic d = assertSingleError(analyzeBody("fn f()", "let a = 1;\na = 2;"),
                    DiagnosticCode.IMMUTABLE_ASSIGNMENT);
            assertEquals("Cannot assign to immutable binding 'a'", d.getMessage());
        }

        @Test
        @DisplayName("参数不能赋值，let mut 与状态变量可以")
        void testMutability() {
            assertSingleError(analyzeBody("fn f(x: u64)", "x = 2;"), DiagnosticCode.IMMUTABLE_ASSIGNMENT);
            assertClean(analyzeBody("fn f()", "let mut a = 1;\na = a + 1;\ntotal = a;"));
        }

        @Test
        @DisplayName("向不可变 vec 推入元素")
        void testPushOnImmutable() {
            assertClean(analyzeBody("fn f()", "items.push(1);"));
            assertSingleError(analyzeBody("fn f()", "let v = items;\nv.push(1);"),
                    DiagnosticCode.IMMUTABLE_ASSIGNMENT);
        }

        @Test
        @DisplayName("并非所有路径都有返回值")
        void testMissingReturn() {
            Diagnostic d = assertSingleError(analyzeBody("fn f(a: bool) -> u64", "if a { return 1; }"),
                    DiagnosticCode.MISSING_RETURN);
            assertTrue(d.getMessage().contains("'f'"), d.getMessage());
        }

        @Test
        @DisplayName("if/else 全分支返回或 revert 结尾视为终止")
        void testTerminatingPaths() {
            assertClean(analyzeBody("fn f(a: bool) -> u64", "if a { return 1; } else { return 2; }"));
            assertClean(analyzeBody("fn f(a: bool) -> u64", "if a { return 1; }\nrevert(\"no\");"));
        }

        @Test
        @DisplayName("return 之后的语句报告不可达警告")
        void testUnreachable() {
            AnalysisResult result = analyzeBody("fn f() -> u64", "return 1;\ntotal = 2;");
            assertClean(result);
            List<Diagnostic> warnings = withCode(result, DiagnosticCode.UNREACHABLE_CODE);
            assertEquals(1, warnings.size());
            assertEquals(Severity.WARNING, warnings.get(0).getSeverity());
        }

        @Test
        @DisplayName("未使用的局部绑定报告警告，下划线开头的除外")
        void testUnusedBinding() {
            AnalysisResult result = analyzeBody("fn f()", "let unused = 1;\nlet _ignored = 2;");
            assertClean(result);
            List<Diagnostic> warnings = withCode(result, DiagnosticCode.UNUSED_BINDING);
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).getMessage().contains("'unused'"));
        }
    }

    // ================================================================
    // 修饰器与接口
    // ================================================================

    @Nested
    @DisplayName("修饰器与接口")
    class ModifierAndInterfaceTests {

        @Test
        @DisplayName("修饰器必须以 _; 结尾")
        void testModifierPlaceholder() {
            String source = "contract C {\n"
                    + "    state { owner: address; }\n"
                    + "    modifier onlyOwner() { require(msg_sender == owner, \"Only owner\"); }\n"
                    + "}\n";
            Diagnostic d = assertSingleError(analyze(source), DiagnosticCode.INVALID_CONSTRUCT);
            assertTrue(d.getMessage().contains("must end with '_;'"), d.getMessage());
        }

        @Test
        @DisplayName("函数体里不能出现 _;")
        void testPlaceholderOutsideModifier() {
            assertSingleError(analyzeBody("fn f()", "_;"), DiagnosticCode.INVALID_CONSTRUCT);
        }

        @Test
        @DisplayName("修饰器里不能 return")
        void testReturnInModifier() {
            String source = "contract C { modifier m() { return; _; } }";
            assertFalse(withCode(analyze(source), DiagnosticCode.INVALID_CONSTRUCT).isEmpty());
        }

        @Test
        @DisplayName("修饰器调用检查参数并拒绝未定义的修饰器")
        void testModifierInvocation() {
            String source = "contract C {\n"
                    + "    modifier atLeast(n: u64) { require(n > 0); _; }\n"
                    + "    fn a() atLeast(1) {}\n"
                    + "    fn b() atLeast {}\n"
                    + "    fn c() nope {}\n"
                    + "}\n";
            AnalysisResult result = analyze(source);
            assertEquals(1, withCode(result, DiagnosticCode.ARITY_MISMATCH).size());
            assertEquals(1, withCode(result, DiagnosticCode.UNDEFINED_SYMBOL).size());
        }

        @Test
        @DisplayName("实现接口的函数必须同签名且 public")
        void testInterfaceImplementation() {
            String ok = "interface I { fn get() -> u64; }\n"
                    + "contract C implements I { fn get() -> u64 { return 1; } }";
            assertClean(analyze(ok));

            String missing = "interface I { fn get() -> u64; }\ncontract C implements I { }";
            assertTrue(assertSingleError(analyze(missing), DiagnosticCode.INVALID_CONSTRUCT)
                    .getMessage().contains("does not implement 'I.get'"));

            String wrongType = "interface I { fn get() -> u64; }\n"
                    + "contract C implements I { fn get() -> u8 { return 1; } }";
            assertSingleError(analyze(wrongType), DiagnosticCode.INVALID_CONSTRUCT);

            String hidden = "interface I { fn get() -> u64; }\n"
                    + "contract C implements I { private fn get() -> u64 { return 1; } }";
            assertSingleError(analyze(hidden), DiagnosticCode.INVALID_CONSTRUCT);
        }

        @Test
        @DisplayName("状态默认值必须是常量表达式")
        void testConstantInitializer() {
            assertClean(analyze("contract C { const A: u64 = 10; state { x: u64 = A * 2; } }"));
            assertSingleError(analyze("contract C { state { x: address = msg_sender; } }"),
                    DiagnosticCode.INVALID_CONSTRUCT);
        }
    }

    // ================================================================
    // 位置查询与前端流程
    // ================================================================

    @Nested
    @DisplayName("错误归属")
    class ErrorAttributionTests {

        private ContractDecl contract(AnalysisResult result, String name) {
            for (ContractDecl c : result.getContracts()) {
                if (c.getName().equals(name)) return c;
            }
            throw new AssertionError("没有合约 " + name);
        }

        @Test
        @DisplayName("语义错误只归属所在合约")
        void testErrorStaysInContract() {
            AnalysisResult result = analyze(
                    "contract Good { state { x: u64 = 0; } public fn get() -> u64 { return x; } }\n"
                    + "contract Bad { public fn f() -> u64 { return true; } }\n");
            assertTrue(result.hasErrors());
            assertFalse(result.hasErrors(contract(result, "Good")));
            assertTrue(result.hasErrors(contract(result, "Bad")));
        }

        @Test
        @DisplayName("顶层结构体的错误只影响引用它的合约")
        void testSharedStructError() {
            AnalysisResult result = analyze(
                    "struct Pair { a: u64, b: Missing }\n"
                    + "struct Wrapper { inner: Pair }\n"
                    + "contract Direct { public fn f(p: Pair) -> u64 { return p.a; } }\n"
                    + "contract Indirect { public fn g(w: Wrapper) -> u64 { return w.inner.a; } }\n"
                    + "contract Plain { public fn h() -> u64 { return 1; } }\n");
            assertFalse(withCode(result, DiagnosticCode.UNDEFINED_SYMBOL).isEmpty());
            assertTrue(result.hasErrors(contract(result, "Direct")));
            assertTrue(result.hasErrors(contract(result, "Indirect")));
            assertFalse(result.hasErrors(contract(result, "Plain")));
            // 只带上引用到的文件级结构体
            assertEquals(2, contract(result, "Indirect").getStructs().size());
            assertEquals(1, contract(result, "Direct").getStructs().size());
            assertTrue(contract(result, "Plain").getStructs().isEmpty());
        }

        @Test
        @DisplayName("重名合约被丢弃，先出现的同名合约不受影响")
        void testDuplicateContract() {
            AnalysisResult result = analyze(
                    "contract A { public fn f() -> u64 { return 1; } }\n"
                    + "contract A { public fn g() -> u64 { return 2; } }\n");
            assertEquals(1, result.getContracts().size());
            assertTrue(result.hasErrors());
            assertFalse(result.hasErrors(result.getContracts().get(0)));
        }

        @Test
        @DisplayName("语法错误影响文件中所有合约")
        void testParseErrorFailsAll() {
            AnalysisResult result = analyze(
                    "contract Good { public fn get() -> u64 { return 1; } }\n"
                    + "contract Broken { public fn f() -> u64 { return 1 + ; } }\n");
            assertTrue(result.hasErrors());
            for (ContractDecl c : result.getContracts()) {
                assertTrue(result.hasErrors(c), c.getName());
            }
        }
    }

    @Nested
    @DisplayName("位置查询")
    class TypeAtTests {

        @Test
        @DisplayName("typeAt 返回最内层表达式的类型")
        void testTypeAt() {
            String source = "contract C {\n"
                    + "    fn f(a: u8, ok: bool) -> u8 {\n"
                    + "        return a + 1;\n"
                    + "    }\n"
                    + "}\n";
            AnalysisResult result = analyze(source);
            assertClean(result);
            assertEquals(IntegerType.U8, result.typeAt(3, 16));
            assertEquals(IntegerType.U8, result.typeAt(3, 20));
            assertNull(result.typeAt(1, 1));
            assertNull(result.typeAt(99, 1));
        }

        @Test
        @DisplayName("列号越过行尾或小于 1 时返回 null")
        void testTypeAtColumnOutOfLine() {
            String source = "contract C {\n"
                    + "    fn f(a: u8, ok: bool) -> u8 {\n"
                    + "        return a + 1;\n"
                    + "    }\n"
                    + "}\n";
            AnalysisResult result = analyze(source);
            assertEquals(IntegerType.U8, result.typeAt(3, 16));
            // 第 2 行第 50 列的偏移落在第 3 行的 a 上
            assertNull(result.typeAt(2, 50));
            assertNull(result.typeAt(3, 0));
            assertNull(result.typeAt(3, -4));
        }

        @Test
        @DisplayName("比较运算的结果是 bool")
        void testComparisonType() {
            String source = "contract C {\n"
                    + "    fn f(a: u64) -> bool {\n"
                    + "        return a > 1;\n"
                    + "    }\n"
                    + "}\n";
            AnalysisResult result = analyze(source);
            assertEquals(PrimitiveType.BOOL, result.typeAt(3, 18));
        }

        @Test
        @DisplayName("存在语法错误时跳过语义分析")
        void testSyntaxErrorSkipsAnalysis() {
            AnalysisResult result = analyze("contract C { fn f() -> u64 { return missing + ; } }");
            assertTrue(result.hasErrors());
            for (Diagnostic d : result.getErrors()) {
                assertEquals(DiagnosticKind.PARSE, d.getKind());
            }
        }

        @Test
        @DisplayName("一次分析报告多个语义错误")
        void testMultipleErrors() {
            String source = "contract C {\n"
                    + "    fn a() -> u64 { return x; }\n"
                    + "    fn b() -> u64 { return \"s\"; }\n"
                    + "}\n";
            AnalysisResult result = analyze(source);
            assertEquals(2, result.getErrors().size());
        }
    }
}
