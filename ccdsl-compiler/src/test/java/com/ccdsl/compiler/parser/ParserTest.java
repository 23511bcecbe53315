package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.FunctionDecl;
import com.ccdsl.compiler.ast.decl.InterfaceDecl;
import com.ccdsl.compiler.ast.decl.SourceFile;
import com.ccdsl.compiler.ast.decl.Visibility;
import com.ccdsl.compiler.ast.expr.BinaryExpr;
import com.ccdsl.compiler.ast.expr.CallExpr;
import com.ccdsl.compiler.ast.expr.CastExpr;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.expr.FieldAccessExpr;
import com.ccdsl.compiler.ast.expr.Identifier;
import com.ccdsl.compiler.ast.expr.IndexExpr;
import com.ccdsl.compiler.ast.expr.IntrinsicExpr;
import com.ccdsl.compiler.ast.expr.LambdaExpr;
import com.ccdsl.compiler.ast.expr.Literal;
import com.ccdsl.compiler.ast.expr.MatchExpr;
import com.ccdsl.compiler.ast.expr.MatchPattern;
import com.ccdsl.compiler.ast.expr.MethodCallExpr;
import com.ccdsl.compiler.ast.expr.StructLiteral;
import com.ccdsl.compiler.ast.expr.TernaryExpr;
import com.ccdsl.compiler.ast.expr.TupleLiteral;
import com.ccdsl.compiler.ast.expr.UnaryExpr;
import com.ccdsl.compiler.ast.stmt.AssignStmt;
import com.ccdsl.compiler.ast.stmt.ExpressionStmt;
import com.ccdsl.compiler.ast.stmt.ForEachStmt;
import com.ccdsl.compiler.ast.stmt.ForRangeStmt;
import com.ccdsl.compiler.ast.stmt.IfStmt;
import com.ccdsl.compiler.ast.stmt.LetStmt;
import com.ccdsl.compiler.ast.stmt.MatchStmt;
import com.ccdsl.compiler.ast.stmt.PlaceholderStmt;
import com.ccdsl.compiler.ast.stmt.RequireStmt;
import com.ccdsl.compiler.ast.stmt.ReturnStmt;
import com.ccdsl.compiler.ast.stmt.Statement;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;
import com.ccdsl.compiler.lexer.Intrinsic;
import com.ccdsl.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private ParseResult parse(String source) {
        Lexer lexer = new Lexer(source, "<test>", new DiagnosticCollector());
        return new Parser(lexer, "<test>").parse();
    }

    /** 解析并断言没有语法错误 */
    private SourceFile parseOk(String source) {
        ParseResult result = parse(source);
        assertFalse(result.hasErrors(), "不应有语法错误: " + result.getErrors());
        return result.getSourceFile();
    }

    /** 函数体中的语句 */
    private List<Statement> body(String statements) {
        SourceFile file = parseOk("contract C { fn f() { " + statements + " } }");
        return file.getContracts().get(0).getFunctions().get(0).getBody().getStatements();
    }

    /** 解析单个表达式（作为 return 的值） */
    private Expression expr(String expression) {
        List<Statement> stmts = body("return " + expression + ";");
        return ((ReturnStmt) stmts.get(0)).getValue();
    }

    // ================================================================
    // 声明
    // ================================================================

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("合约的各类成员按声明顺序收集")
        void testContractMembers() {
            SourceFile file = parseOk(
                    "contract Vault implements IVault {\n"
                    + "    const LIMIT: u64 = 100;\n"
                    + "    state { owner: address; total: u64 = 0; }\n"
                    + "    struct Entry { who: address, amount: u64 }\n"
                    + "    event Deposited(who: address, amount: u64);\n"
                    + "    modifier onlyOwner() { require(msg_sender == owner, \"Only owner\"); _; }\n"
                    + "    fn deposit(amount: u64) onlyOwner { total = total + amount; }\n"
                    + "    private fn helper() -> u64 { return total; }\n"
                    + "}\n");
            ContractDecl c = file.getContracts().get(0);
            assertEquals("Vault", c.getName());
            assertEquals(java.util.Collections.singletonList("IVault"), c.getInterfaces());
            assertEquals(1, c.getConstants().size());
            assertEquals(2, c.getStateVars().size());
            assertNull(c.getStateVars().get(0).getDefaultValue());
            assertNotNull(c.getStateVars().get(1).getDefaultValue());
            assertEquals(1, c.getStructs().size());
            assertEquals(2, c.getStructs().get(0).getFields().size());
            assertEquals(2, c.getEvents().get(0).getFields().size());
            assertEquals("onlyOwner", c.getModifiers().get(0).getName());
            assertEquals(2, c.getFunctions().size());
        }

        @Test
        @DisplayName("函数默认 public，private 需显式声明")
        void testVisibility() {
            SourceFile file = parseOk("contract C { fn a() {} public fn b() {} private fn c() {} }");
            List<FunctionDecl> fns = file.getContracts().get(0).getFunctions();
            assertEquals(Visibility.PUBLIC, fns.get(0).getVisibility());
            assertTrue(fns.get(1).isPublic());
            assertEquals(Visibility.PRIVATE, fns.get(2).getVisibility());
        }

        @Test
        @DisplayName("修饰器调用可以带参数")
        void testModifierInvocation() {
            SourceFile file = parseOk("contract C { fn f(x: u64) -> u64 guard(1, x) other { return x; } }");
            FunctionDecl fn = file.getContracts().get(0).getFunctions().get(0);
            assertEquals(2, fn.getModifiers().size());
            assertEquals("guard", fn.getModifiers().get(0).getName());
            assertEquals(2, fn.getModifiers().get(0).getArguments().size());
            assertTrue(fn.getModifiers().get(1).getArguments().isEmpty());
            assertTrue(fn.hasReturnType());
        }

        @Test
        @DisplayName("修饰器体以 _; 结尾")
        void testModifierPlaceholder() {
            SourceFile file = parseOk("contract C { modifier m { require(true); _; } }");
            List<Statement> stmts = file.getContracts().get(0).getModifiers().get(0).getBody().getStatements();
            assertInstanceOf(PlaceholderStmt.class, stmts.get(1));
        }

        @Test
        @DisplayName("顶层结构体与接口")
        void testTopLevelDeclarations() {
            SourceFile file = parseOk(
                    "struct Point { x: u64; y: u64 }\n"
                    + "interface Token { fn balanceOf(who: address) -> u64; public fn burn(amount: u64); }\n"
                    + "contract A {} contract B {}");
            assertEquals(1, file.getStructs().size());
            InterfaceDecl iface = file.getInterfaces().get(0);
            assertEquals(2, iface.getFunctions().size());
            assertEquals(2, file.getContracts().size());
        }

        @Test
        @DisplayName("复合类型")
        void testTypes() {
            SourceFile file = parseOk("contract C { state {"
                    + " a: map<address, vec<u64>>;"
                    + " b: [u8; 32];"
                    + " c: (u64, bool);"
                    + " d: option<string>;"
                    + " e: result<u64, string>;"
                    + " } }");
            ContractDecl c = file.getContracts().get(0);
            assertEquals("map<address, vec<u64>>", c.getStateVars().get(0).getType().toSourceString());
            assertEquals("[u8; 32]", c.getStateVars().get(1).getType().toSourceString());
            assertEquals(5, c.getStateVars().size());
        }
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("加法左结合")
        void testLeftAssociative() {
            BinaryExpr sub = (BinaryExpr) expr("a - b - c");
            assertInstanceOf(BinaryExpr.class, sub.getLeft());
            assertInstanceOf(Identifier.class, sub.getRight());
        }

        @Test
        @DisplayName("as 绑定紧于乘法")
        void testCastPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("a + b as u64");
            assertInstanceOf(CastExpr.class, add.getRight());
        }

        @Test
        @DisplayName("逻辑运算优先级：&& 高于 ||")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) expr("a || b && c");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            assertEquals(BinaryExpr.BinaryOp.AND, ((BinaryExpr) or.getRight()).getOperator());
        }

        @Test
        @DisplayName("三元表达式最低")
        void testTernary() {
            TernaryExpr t = (TernaryExpr) expr("a > b ? a : b");
            assertInstanceOf(BinaryExpr.class, t.getCondition());
        }

        @Test
        @DisplayName("负整数字面量直接折叠")
        void testNegativeLiteral() {
            Literal lit = (Literal) expr("-128i8");
            assertEquals(BigInteger.valueOf(-128), lit.getIntegerValue());
            assertEquals("i8", lit.getSuffix());
            assertInstanceOf(UnaryExpr.class, expr("-x"));
        }

        @Test
        @DisplayName("内建值可以写成调用形式")
        void testIntrinsicCallForm() {
            assertEquals(Intrinsic.MSG_SENDER, ((IntrinsicExpr) expr("msg_sender")).getIntrinsic());
            assertEquals(Intrinsic.BLOCK_NUMBER, ((IntrinsicExpr) expr("block_number()")).getIntrinsic());
        }

        @Test
        @DisplayName("后缀：调用、字段、元组下标、方法、索引")
        void testPostfix() {
            assertInstanceOf(CallExpr.class, expr("f(1, 2)"));
            FieldAccessExpr field = (FieldAccessExpr) expr("p.x");
            assertEquals("x", field.getFieldName());
            assertTrue(((FieldAccessExpr) expr("t.0")).isTupleIndex());
            MethodCallExpr method = (MethodCallExpr) expr("items.map(|x| x + 1)");
            assertEquals("map", method.getMethodName());
            assertInstanceOf(LambdaExpr.class, method.getArguments().get(0));
            assertInstanceOf(IndexExpr.class, expr("balances[msg_sender]"));
        }

        @Test
        @DisplayName("结构体、数组与元组字面量")
        void testCompositeLiterals() {
            StructLiteral s = (StructLiteral) expr("Point { x: 1, y: 2 }");
            assertEquals(java.util.Arrays.asList("x", "y"), s.getFieldNames());
            assertEquals(3, ((com.ccdsl.compiler.ast.expr.ArrayLiteral) expr("[1, 2, 3]")).getElements().size());
            assertEquals(2, ((TupleLiteral) expr("(1, true)")).getElements().size());
        }

        @Test
        @DisplayName("match 表达式")
        void testMatchExpression() {
            MatchExpr m = (MatchExpr) expr("match x { 0 => 1, 1..10 => 2, _ => 3 }");
            assertEquals(3, m.getArms().size());
            assertEquals(MatchPattern.PatternKind.RANGE, m.getArms().get(1).getPattern().getKind());
            assertTrue(m.getArms().get(2).getPattern().isWildcard());
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("let 与 let mut")
        void testLet() {
            List<Statement> stmts = body("let a = 1; let mut b: u8 = 2;");
            assertFalse(((LetStmt) stmts.get(0)).isMutable());
            assertTrue(((LetStmt) stmts.get(1)).isMutable());
        }

        @Test
        @DisplayName("赋值与表达式语句")
        void testAssignment() {
            List<Statement> stmts = body("x = 1; m[k] = v; f();");
            assertInstanceOf(AssignStmt.class, stmts.get(0));
            assertInstanceOf(IndexExpr.class, ((AssignStmt) stmts.get(1)).getTarget());
            assertInstanceOf(ExpressionStmt.class, stmts.get(2));
        }

        @Test
        @DisplayName("条件头部不识别结构体字面量")
        void testBareConditionHead() {
            List<Statement> stmts = body("if flag { x = 1; } else if other { x = 2; } else { x = 3; }");
            IfStmt ifStmt = (IfStmt) stmts.get(0);
            assertInstanceOf(Identifier.class, ifStmt.getCondition());
            assertInstanceOf(IfStmt.class, ifStmt.getElseBranch());
        }

        @Test
        @DisplayName("for 区间与 for-each，头部可加括号")
        void testFor() {
            List<Statement> stmts = body("for i in 0..10 { } for (x in items) { }");
            ForRangeStmt range = (ForRangeStmt) stmts.get(0);
            assertEquals("i", range.getVariable());
            ForEachStmt each = (ForEachStmt) stmts.get(1);
            assertEquals("x", each.getVariable());
        }

        @Test
        @DisplayName("match 语句的分支可以是单条语句")
        void testMatchStatement() {
            List<Statement> stmts = body("match x { 0 => y = 1, _ => { y = 2; } }");
            MatchStmt m = (MatchStmt) stmts.get(0);
            assertEquals(1, m.getArms().get(0).getBlock().getStatements().size());
            assertInstanceOf(AssignStmt.class, m.getArms().get(0).getBlock().getStatements().get(0));
        }

        @Test
        @DisplayName("revert 是 require(false) 的语法糖")
        void testRevert() {
            List<Statement> stmts = body("require(x > 0, \"positive\"); revert(\"nope\");");
            RequireStmt require = (RequireStmt) stmts.get(0);
            assertEquals("positive", require.getMessage());
            assertFalse(require.isRevert());
            RequireStmt revert = (RequireStmt) stmts.get(1);
            assertTrue(revert.isRevert());
            assertTrue(((Literal) revert.getCondition()).isFalse());
        }

        @Test
        @DisplayName("return 可以没有值")
        void testReturnWithoutValue() {
            List<Statement> stmts = body("return;");
            assertNull(((ReturnStmt) stmts.get(0)).getValue());
        }
    }

    // ================================================================
    // 错误恢复
    // ================================================================

    @Nested
    @DisplayName("错误恢复")
    class RecoveryTests {

        @Test
        @DisplayName("语句错误后继续解析同一块和后续声明")
        void testStatementRecovery() {
            String source = "contract C {\n"
                    + "    fn broken() {\n"
                    + "        let x = ;\n"
                    + "        let y = 2;\n"
                    + "    }\n"
                    + "    fn ok() -> u64 { return 1; }\n"
                    + "}\n";
            ParseResult result = parse(source);
            assertTrue(result.hasErrors());
            for (Diagnostic d : result.getErrors()) {
                assertEquals(DiagnosticCode.PARSE_ERROR, d.getCode());
                assertEquals(3, d.getLocation().getLine(), "错误应位于损坏的语句: " + d);
            }
            ContractDecl c = result.getSourceFile().getContracts().get(0);
            assertEquals(2, c.getFunctions().size());
            assertEquals(1, c.getFunctions().get(0).getBody().getStatements().size());
            assertEquals("ok", c.getFunctions().get(1).getName());
        }

        @Test
        @DisplayName("一次解析报告多个错误")
        void testMultipleErrors() {
            String source = "contract C {\n"
                    + "    fn a() { let = 1; }\n"
                    + "    fn b() { x = ; }\n"
                    + "}\n";
            ParseResult result = parse(source);
            assertEquals(2, result.getErrors().size());
            assertEquals(2, result.getErrors().get(0).getLocation().getLine());
            assertEquals(3, result.getErrors().get(1).getLocation().getLine());
        }

        @Test
        @DisplayName("成员级错误跳到下一个成员")
        void testMemberRecovery() {
            ParseResult result = parse("contract C { garbage here; fn ok() {} }");
            assertEquals(1, result.getErrors().size());
            assertEquals(1, result.getSourceFile().getContracts().get(0).getFunctions().size());
        }

        @Test
        @DisplayName("顶层错误跳到下一个声明")
        void testTopLevelRecovery() {
            ParseResult result = parse("junk junk contract A {}");
            assertEquals(1, result.getErrors().size());
            assertEquals("A", result.getSourceFile().getContracts().get(0).getName());
        }

        @Test
        @DisplayName("错误消息包含实际遇到的 token")
        void testErrorMessage() {
            ParseResult result = parse("contract C { fn f() { let x = ; } }");
            assertTrue(result.getErrors().get(0).getMessage().contains("found ';'"),
                    result.getErrors().get(0).getMessage());
        }
    }
}
