package com.ccdsl.ir.pass;

import com.ccdsl.compiler.Frontend;
import com.ccdsl.compiler.analysis.AnalysisResult;
import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.expr.Literal;
import com.ccdsl.compiler.ast.stmt.Statement;
import com.ccdsl.ir.InternalInvariantViolation;
import com.ccdsl.ir.pass.ast.ConstantFolding;
import com.ccdsl.ir.pass.ast.DeadCodeElimination;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * 优化管线测试：各 pass 的改写、trap 语义边界、不动点与语义保持
 */
@DisplayName("优化管线")
class PassPipelineTest {

    private ContractDecl analyze(String source) {
        AnalysisResult result = Frontend.check(source, "opt.ccdsl");
        assertThat(result.hasErrors()).as("源码应通过语义分析: %s", result.getErrors()).isFalse();
        return result.getContracts().get(0);
    }

    private ContractDecl optimize(ContractDecl contract) {
        return PassPipeline.createDefault().optimize(contract);
    }

    /** 优化后函数体的逐条打印 */
    private List<String> optimizedBody(String members, String function) {
        ContractDecl optimized = optimize(analyze("contract C {\n" + members + "\n}\n"));
        FunctionDecl fn = optimized.findFunction(function);
        List<String> out = new ArrayList<String>();
        for (Statement s : fn.getBody().getStatements()) {
            out.add(AstPrinter.print(s));
        }
        return out;
    }

    private String optimizedReturn(String signature, String expression) {
        List<String> body = optimizedBody("fn f" + signature + " { return " + expression + "; }", "f");
        assertThat(body).hasSize(1);
        return body.get(0);
    }

    // ================================================================
    // 单项改写
    // ================================================================

    @Nested
    @DisplayName("改写规则")
    class RewriteTests {

        @Test
        @DisplayName("x * 0 化为 0")
        void testMultiplyByZero() {
            assertThat(optimizedReturn("(amount: u64) -> u64", "amount * 0")).isEqualTo("return 0u64;");
        }

        @Test
        @DisplayName("乘 1、加 0、减 0 消去")
        void testIdentities() {
            assertThat(optimizedReturn("(x: u64) -> u64", "(x * 1 + 0) - 0")).isEqualTo("return x;");
        }

        @Test
        @DisplayName("true && x 化为 x，false || x 化为 x")
        void testBooleanIdentities() {
            assertThat(optimizedReturn("(x: bool) -> bool", "true && x")).isEqualTo("return x;");
            assertThat(optimizedReturn("(x: bool) -> bool", "false || x")).isEqualTo("return x;");
            assertThat(optimizedReturn("(x: bool) -> bool", "false && x")).isEqualTo("return false;");
            assertThat(optimizedReturn("(x: bool) -> bool", "!!x")).isEqualTo("return x;");
        }

        @Test
        @DisplayName("可能 trap 的操作数不会被乘 0 丢弃")
        void testTrappingOperandKept() {
            String result = optimizedReturn("(x: u64, y: u64) -> u64", "(x + y) * 0");
            assertThat(result).isEqualTo("return ((x + y) * 0u64);");
        }

        @Test
        @DisplayName("-(-x) 只在 x 不可能是最小值时消去")
        void testDoubleNegation() {
            assertThat(optimizedReturn("(x: i64) -> i64", "-(-x)")).isEqualTo("return --x;");
            assertThat(optimizedReturn("(y: i32) -> i64", "-(-(y as i64))")).isEqualTo("return (y as i64);");
        }

        @Test
        @DisplayName("if(false) 选中 else 分支")
        void testConstantIf() {
            List<String> body = optimizedBody(
                    "fn a() {}\n"
                    + "fn b() {}\n"
                    + "fn f() { if false { a(); } else { b(); } }", "f");
            assertThat(body).containsExactly("b();");
        }

        @Test
        @DisplayName("终止语句之后的语句被删除")
        void testUnreachableRemoved() {
            List<String> body = optimizedBody(
                    "state { total: u64; }\n"
                    + "fn f() -> u64 { return 1; total = 2; }", "f");
            assertThat(body).containsExactly("return 1u64;");
        }

        @Test
        @DisplayName("require(true) 与 while(false) 被删除")
        void testNoOps() {
            List<String> body = optimizedBody(
                    "state { total: u64; }\n"
                    + "fn f() { require(true, \"ok\"); while false { total = 1; } total = 2; }", "f");
            assertThat(body).containsExactly("total = 2u64;");
        }

        @Test
        @DisplayName("不可变绑定与合约常量被传播并折叠")
        void testPropagation() {
            List<String> body = optimizedBody(
                    "const SCALE: u64 = 100;\n"
                    + "fn f() -> u64 { let a = 2; let b = a * 3; return b + SCALE; }", "f");
            assertThat(body).containsExactly("let a = 2u64;", "let b = 6u64;", "return 106u64;");
        }

        @Test
        @DisplayName("被赋值过的 let mut 不传播")
        void testMutableNotPropagated() {
            List<String> body = optimizedBody(
                    "fn f() -> u64 { let mut a = 1; a = a + 1; return a; }", "f");
            assertThat(body).containsExactly("let mut a = 1u64;", "a = (a + 1u64);", "return a;");
        }

        @Test
        @DisplayName("统计各类改写次数")
        void testStats() {
            OptimizationStats stats = new OptimizationStats();
            ContractDecl contract = analyze("contract C { fn f(x: u64) -> u64 { let k = 0; return x * k; } }");
            PassPipeline.createDefault().optimize(contract, stats);
            assertThat(stats.getConstantsPropagated()).isEqualTo(1);
            assertThat(stats.getExpressionsSimplified()).isEqualTo(1);
            assertThat(stats.getIterations()).isEqualTo(2);
            assertThat(stats.getTotalRewrites()).isGreaterThanOrEqualTo(2);
        }
    }

    // ================================================================
    // 折叠的溢出边界
    // ================================================================

    @Nested
    @DisplayName("折叠边界")
    class FoldingBoundaryTests {

        @Test
        @DisplayName("上溢不折叠")
        void testOverflowNotFolded() {
            assertThat(optimizedReturn("() -> u8", "255u8 + 1u8")).isEqualTo("return (255u8 + 1u8);");
        }

        @Test
        @DisplayName("无符号下溢不折叠")
        void testUnderflowNotFolded() {
            assertThat(optimizedReturn("() -> u64", "0u64 - 1u64")).isEqualTo("return (0u64 - 1u64);");
        }

        @Test
        @DisplayName("恰好到上界时折叠")
        void testFoldAtBoundary() {
            assertThat(optimizedReturn("() -> u8", "254u8 + 1u8")).isEqualTo("return 255u8;");
        }

        @Test
        @DisplayName("有符号最小值除以 -1 不折叠")
        void testSignedMinDivision() {
            assertThat(optimizedReturn("() -> i8", "-128i8 / -1i8")).isEqualTo("return (-128i8 / -1i8);");
        }

        @Test
        @DisplayName("除以 0 不折叠")
        void testDivisionByZero() {
            assertThat(optimizedReturn("(x: u64) -> u64", "x / 0")).isEqualTo("return (x / 0u64);");
            assertThat(optimizedReturn("() -> u64", "5 % 0")).isEqualTo("return (5u64 % 0u64);");
        }

        @Test
        @DisplayName("除法向零截断，取余与被除数同号")
        void testTruncation() {
            assertThat(optimizedReturn("() -> i64", "7i64 / -2i64")).isEqualTo("return -3i64;");
            assertThat(optimizedReturn("() -> i64", "-7i64 % 2i64")).isEqualTo("return -1i64;");
        }

        @Test
        @DisplayName("比较、三元与范围内的类型转换")
        void testOtherFolds() {
            assertThat(optimizedReturn("() -> bool", "3 < 5")).isEqualTo("return true;");
            assertThat(optimizedReturn("() -> u64", "1 > 2 ? 10 : 20")).isEqualTo("return 20u64;");
            assertThat(optimizedReturn("() -> u8", "200u64 as u8")).isEqualTo("return 200u8;");
            assertThat(optimizedReturn("() -> u8", "300u64 as u8")).isEqualTo("return (300u64 as u8);");
        }
    }

    // ================================================================
    // 不动点与结构性质
    // ================================================================

    @Nested
    @DisplayName("不动点")
    class FixedPointTests {

        private static final String SOURCE = "contract C {\n"
                + "    const LIMIT: u64 = 10 * 10;\n"
                + "    state { total: u64 = 1 + 1; }\n"
                + "    fn f(x: u64, flag: bool) -> u64 {\n"
                + "        let base = LIMIT - 50;\n"
                + "        if flag && true { total = x * 1; } else if false { total = 0; }\n"
                + "        require(base > 0, \"positive\");\n"
                + "        return base + x * 0;\n"
                + "    }\n"
                + "}\n";

        @Test
        @DisplayName("再次优化不再改变结果")
        void testIdempotent() {
            ContractDecl once = optimize(analyze(SOURCE));
            OptimizationStats stats = new OptimizationStats();
            ContractDecl twice = PassPipeline.createDefault().optimize(once, stats);
            assertThat(twice).isSameAs(once);
            assertThat(AstPrinter.print(twice)).isEqualTo(AstPrinter.print(once));
            assertThat(stats.getIterations()).isEqualTo(1);
        }

        @Test
        @DisplayName("输入树不被修改")
        void testInputUnchanged() {
            ContractDecl contract = analyze(SOURCE);
            String before = AstPrinter.print(contract);
            ContractDecl optimized = optimize(contract);
            assertThat(AstPrinter.print(contract)).isEqualTo(before);
            assertThat(AstPrinter.print(optimized)).isNotEqualTo(before);
        }

        @Test
        @DisplayName("没有改写时 pass 返回同一实例")
        void testCopyOnChange() {
            ContractDecl contract = analyze("contract C { fn f(x: u64) -> u64 { return x; } }");
            assertThat(new ConstantFolding().run(contract, new OptimizationStats())).isSameAs(contract);
            assertThat(new DeadCodeElimination().run(contract, new OptimizationStats())).isSameAs(contract);
        }

        @Test
        @DisplayName("优化后的树没有环")
        void testAcyclic() {
            ContractDecl optimized = optimize(analyze(SOURCE));
            Set<AstNode> path = Collections.newSetFromMap(new IdentityHashMap<AstNode, Boolean>());
            assertAcyclic(optimized, path);
        }

        private void assertAcyclic(AstNode node, Set<AstNode> path) {
            assertThat(path.add(node)).as("节点在自身路径上重复出现: %s", node).isTrue();
            for (AstNode child : node.getChildren()) {
                assertAcyclic(child, path);
            }
            path.remove(node);
        }

        @Test
        @DisplayName("超过迭代上限视为内部错误")
        void testIterationLimit() {
            PassPipeline pipeline = new PassPipeline();
            pipeline.addPass(new LiteralCopyingPass());
            ContractDecl contract = analyze("contract C { fn f() -> u64 { return 1; } }");
            OptimizationStats stats = new OptimizationStats();
            assertThatThrownBy(() -> pipeline.optimize(contract, stats))
                    .isInstanceOf(InternalInvariantViolation.class)
                    .hasMessageContaining("fixed point")
                    .hasMessageContaining(String.valueOf(PassPipeline.MAX_ITERATIONS));
            assertThat(stats.getIterations()).isEqualTo(PassPipeline.MAX_ITERATIONS);
        }

        @Test
        @DisplayName("改变表达式类型的改写视为内部错误")
        void testTypeChangingRewrite() {
            PassPipeline pipeline = new PassPipeline();
            pipeline.addPass(new RetypingPass());
            ContractDecl contract = analyze("contract C { fn f() -> u64 { return 1; } }");
            assertThatThrownBy(() -> pipeline.optimize(contract))
                    .isInstanceOf(InternalInvariantViolation.class)
                    .hasMessageContaining("changed the type");
        }
    }

    /** 每次都复制字面量，永远不收敛 */
    private static final class LiteralCopyingPass extends AstTransformer implements OptimizationPass {
        @Override
        public String getName() {
            return "LiteralCopying";
        }

        @Override
        public ContractDecl run(ContractDecl contract, OptimizationStats stats) {
            return transformContract(contract);
        }

        @Override
        protected Expression transformExpr(Expression expr) {
            if (expr instanceof Literal) return copyLiteral((Literal) expr, expr.getLocation());
            return super.transformExpr(expr);
        }
    }

    /** 把整数字面量换成布尔字面量 */
    private static final class RetypingPass extends AstTransformer implements OptimizationPass {
        @Override
        public String getName() {
            return "Retyping";
        }

        @Override
        public ContractDecl run(ContractDecl contract, OptimizationStats stats) {
            return transformContract(contract);
        }

        @Override
        protected Expression transformExpr(Expression expr) {
            if (expr instanceof Literal && ((Literal) expr).isInteger()) {
                return rewrite(expr, Literal.ofBool(expr.getLocation(), true));
            }
            return super.transformExpr(expr);
        }
    }

    // ================================================================
    // 语义保持
    // ================================================================

    @Nested
    @DisplayName("语义保持")
    class SemanticsPreservationTests {

        private static final String PROGRAM = "contract Calc {\n"
                + "    const SCALE: u64 = 10;\n"
                + "    fn clamp(x: u64, limit: u64) -> u64 {\n"
                + "        let zero = 0;\n"
                + "        let mut acc = x * 1 + zero;\n"
                + "        if acc > limit { acc = limit; }\n"
                + "        if false { acc = acc * 0; }\n"
                + "        return acc * SCALE;\n"
                + "    }\n"
                + "    fn sum(n: u64) -> u64 {\n"
                + "        let mut total = 0;\n"
                + "        for i in 0..n { total = total + i * 1; }\n"
                + "        return total;\n"
                + "    }\n"
                + "    fn risky(a: u8, b: u8) -> u8 {\n"
                + "        let one: u8 = 1;\n"
                + "        require(true, \"never\");\n"
                + "        return a + b * one;\n"
                + "    }\n"
                + "    fn signed(a: i64, b: i64) -> i64 {\n"
                + "        let k: i64 = 2;\n"
                + "        return -(-(a / k)) + b % 3;\n"
                + "    }\n"
                + "    fn logic(a: bool, b: bool) -> bool {\n"
                + "        return !!(a && true) || (false && b) || (b == true ? !a : a);\n"
                + "    }\n"
                + "    fn choose(x: u64) -> u64 {\n"
                + "        if x > 10 { return 1 + 1; } else if true { return x; }\n"
                + "        return 99;\n"
                + "    }\n"
                + "}\n";

        private final ContractDecl original = analyze(PROGRAM);
        private final ContractDecl optimized = optimize(original);

        private void assertPreserved(String function, Object... args) {
            ReferenceInterpreter.Outcome before = new ReferenceInterpreter(original).call(function, args);
            ReferenceInterpreter.Outcome after = new ReferenceInterpreter(optimized).call(function, args);
            assertThat(after).as("%s%s", function, java.util.Arrays.toString(args)).isEqualTo(before);
        }

        @Test
        @DisplayName("程序确实被改写过")
        void testProgramChanged() {
            assertThat(AstPrinter.print(optimized)).isNotEqualTo(AstPrinter.print(original));
        }

        @Test
        @DisplayName("整数运算与上溢 trap 保持一致")
        void testArithmetic() {
            assertPreserved("clamp", 0L, 5L);
            assertPreserved("clamp", 7L, 5L);
            assertPreserved("clamp", 5L, 7L);
            assertPreserved("clamp", new java.math.BigInteger("18446744073709551615"),
                    new java.math.BigInteger("18446744073709551615"));
            assertPreserved("risky", 1, 2);
            assertPreserved("risky", 200, 100);
        }

        @Test
        @DisplayName("循环")
        void testLoop() {
            for (long n : new long[]{0, 1, 5, 10}) {
                assertPreserved("sum", n);
            }
        }

        @Test
        @DisplayName("有符号除法与取余")
        void testSigned() {
            assertPreserved("signed", -7L, 5L);
            assertPreserved("signed", 7L, -5L);
            assertPreserved("signed", Long.MIN_VALUE, 0L);
            assertPreserved("signed", Long.MAX_VALUE, -1L);
        }

        @Test
        @DisplayName("布尔逻辑")
        void testLogic() {
            for (boolean a : new boolean[]{false, true}) {
                for (boolean b : new boolean[]{false, true}) {
                    assertPreserved("logic", a, b);
                }
            }
        }

        @Test
        @DisplayName("else-if 链中的常量条件")
        void testElseIfChain() {
            assertPreserved("choose", 3L);
            assertPreserved("choose", 30L);
        }
    }
}
