package com.ccdsl.compiler.ast;

import com.ccdsl.compiler.ast.decl.*;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.stmt.*;
import com.ccdsl.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitSourceFile(SourceFile node, C ctx) { return null; }

    default R visitContractDecl(ContractDecl node, C ctx) { return null; }

    default R visitInterfaceDecl(InterfaceDecl node, C ctx) { return null; }

    default R visitFunctionSignature(FunctionSignature node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitFieldDecl(FieldDecl node, C ctx) { return null; }

    default R visitEventDecl(EventDecl node, C ctx) { return null; }

    default R visitStateVarDecl(StateVarDecl node, C ctx) { return null; }

    default R visitConstDecl(ConstDecl node, C ctx) { return null; }

    default R visitModifierDecl(ModifierDecl node, C ctx) { return null; }

    default R visitModifierInvocation(ModifierInvocation node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitForRangeStmt(ForRangeStmt node, C ctx) { return null; }

    default R visitForEachStmt(ForEachStmt node, C ctx) { return null; }

    default R visitMatchStmt(MatchStmt node, C ctx) { return null; }

    default R visitRequireStmt(RequireStmt node, C ctx) { return null; }

    default R visitEmitStmt(EmitStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitPlaceholderStmt(PlaceholderStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitIntrinsicExpr(IntrinsicExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitTernaryExpr(TernaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitMethodCallExpr(MethodCallExpr node, C ctx) { return null; }

    default R visitFieldAccessExpr(FieldAccessExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitStructLiteral(StructLiteral node, C ctx) { return null; }

    default R visitArrayLiteral(ArrayLiteral node, C ctx) { return null; }

    default R visitTupleLiteral(TupleLiteral node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitLambdaExpr(LambdaExpr node, C ctx) { return null; }

    default R visitMatchExpr(MatchExpr node, C ctx) { return null; }

    default R visitMatchArm(MatchArm node, C ctx) { return null; }

    default R visitMatchPattern(MatchPattern node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitPrimitiveTypeRef(PrimitiveTypeRef node, C ctx) { return null; }

    default R visitGenericTypeRef(GenericTypeRef node, C ctx) { return null; }

    default R visitArrayTypeRef(ArrayTypeRef node, C ctx) { return null; }

    default R visitTupleTypeRef(TupleTypeRef node, C ctx) { return null; }

    default R visitNamedTypeRef(NamedTypeRef node, C ctx) { return null; }
}
