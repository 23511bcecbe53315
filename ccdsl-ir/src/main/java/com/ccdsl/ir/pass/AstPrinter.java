package com.ccdsl.ir.pass;

import com.ccdsl.compiler.ast.AstVisitor;
import com.ccdsl.compiler.ast.decl.*;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.stmt.*;

import java.util.List;

/**
 * AST 规范打印器。
 *
 * <p>输出接近 DSL 源码：二元与三元表达式完全加括号，整数字面量带类型后缀。
 * 同一棵树总是打印出相同文本，用于比较优化前后的结构。</p>
 */
public final class AstPrinter implements AstVisitor<Void, StringBuilder> {

    private int indent;

    private AstPrinter() {
    }

    public static String print(ContractDecl contract) {
        StringBuilder sb = new StringBuilder();
        contract.accept(new AstPrinter(), sb);
        return sb.toString();
    }

    public static String print(Statement stmt) {
        StringBuilder sb = new StringBuilder();
        stmt.accept(new AstPrinter(), sb);
        return sb.toString();
    }

    public static String print(Expression expr) {
        StringBuilder sb = new StringBuilder();
        expr.accept(new AstPrinter(), sb);
        return sb.toString();
    }

    // ============ 声明 ============

    @Override
    public Void visitContractDecl(ContractDecl node, StringBuilder sb) {
        sb.append("contract ").append(node.getName());
        if (!node.getInterfaces().isEmpty()) {
            sb.append(" implements ").append(String.join(", ", node.getInterfaces()));
        }
        sb.append(" {\n");
        indent++;
        if (!node.getStateVars().isEmpty()) {
            line(sb).append("state {\n");
            indent++;
            for (StateVarDecl sv : node.getStateVars()) {
                sv.accept(this, sb);
            }
            indent--;
            line(sb).append("}\n");
        }
        for (StructDecl s : node.getStructs()) s.accept(this, sb);
        for (EventDecl e : node.getEvents()) e.accept(this, sb);
        for (ConstDecl c : node.getConstants()) c.accept(this, sb);
        for (ModifierDecl m : node.getModifiers()) m.accept(this, sb);
        for (FunctionDecl f : node.getFunctions()) f.accept(this, sb);
        indent--;
        sb.append("}\n");
        return null;
    }

    @Override
    public Void visitStateVarDecl(StateVarDecl node, StringBuilder sb) {
        line(sb).append(node.getName()).append(": ").append(node.getType().toSourceString());
        if (node.getDefaultValue() != null) {
            sb.append(" = ");
            node.getDefaultValue().accept(this, sb);
        }
        sb.append(";\n");
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, StringBuilder sb) {
        line(sb).append("struct ").append(node.getName()).append(" { ");
        List<FieldDecl> fields = node.getFields();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(fields.get(i).getName()).append(": ").append(fields.get(i).getType().toSourceString());
        }
        sb.append(" }\n");
        return null;
    }

    @Override
    public Void visitEventDecl(EventDecl node, StringBuilder sb) {
        line(sb).append("event ").append(node.getName());
        params(node.getFields(), sb);
        sb.append(";\n");
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node, StringBuilder sb) {
        line(sb).append("const ").append(node.getName()).append(": ")
                .append(node.getType().toSourceString()).append(" = ");
        node.getValue().accept(this, sb);
        sb.append(";\n");
        return null;
    }

    @Override
    public Void visitModifierDecl(ModifierDecl node, StringBuilder sb) {
        line(sb).append("modifier ").append(node.getName());
        params(node.getParameters(), sb);
        sb.append(' ');
        node.getBody().accept(this, sb);
        sb.append('\n');
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, StringBuilder sb) {
        line(sb).append(node.isPublic() ? "public" : "private").append(" fn ").append(node.getName());
        params(node.getParameters(), sb);
        if (node.hasReturnType()) {
            sb.append(" -> ").append(node.getReturnType().toSourceString());
        }
        for (ModifierInvocation inv : node.getModifiers()) {
            sb.append(' ').append(inv.getName());
            if (!inv.getArguments().isEmpty()) args(inv.getArguments(), sb);
        }
        sb.append(' ');
        node.getBody().accept(this, sb);
        sb.append('\n');
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, StringBuilder sb) {
        sb.append("{\n");
        indent++;
        for (Statement s : node.getStatements()) {
            line(sb);
            s.accept(this, sb);
            sb.append('\n');
        }
        indent--;
        line(sb).append('}');
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, StringBuilder sb) {
        sb.append(node.isMutable() ? "let mut " : "let ").append(node.getName());
        if (node.getDeclaredType() != null) {
            sb.append(": ").append(node.getDeclaredType().toSourceString());
        }
        sb.append(" = ");
        node.getInitializer().accept(this, sb);
        sb.append(';');
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, StringBuilder sb) {
        node.getTarget().accept(this, sb);
        sb.append(" = ");
        node.getValue().accept(this, sb);
        sb.append(';');
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, StringBuilder sb) {
        node.getExpression().accept(this, sb);
        sb.append(';');
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, StringBuilder sb) {
        sb.append("if ");
        node.getCondition().accept(this, sb);
        sb.append(' ');
        node.getThenBranch().accept(this, sb);
        if (node.hasElse()) {
            sb.append(" else ");
            node.getElseBranch().accept(this, sb);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, StringBuilder sb) {
        sb.append("while ");
        node.getCondition().accept(this, sb);
        sb.append(' ');
        node.getBody().accept(this, sb);
        return null;
    }

    @Override
    public Void visitForRangeStmt(ForRangeStmt node, StringBuilder sb) {
        sb.append("for ").append(node.getVariable()).append(" in ");
        node.getStart().accept(this, sb);
        sb.append("..");
        node.getEnd().accept(this, sb);
        sb.append(' ');
        node.getBody().accept(this, sb);
        return null;
    }

    @Override
    public Void visitForEachStmt(ForEachStmt node, StringBuilder sb) {
        sb.append("for ").append(node.getVariable()).append(" in ");
        node.getIterable().accept(this, sb);
        sb.append(' ');
        node.getBody().accept(this, sb);
        return null;
    }

    @Override
    public Void visitMatchStmt(MatchStmt node, StringBuilder sb) {
        sb.append("match ");
        node.getScrutinee().accept(this, sb);
        sb.append(" {\n");
        indent++;
        for (MatchArm arm : node.getArms()) {
            line(sb);
            arm.getPattern().accept(this, sb);
            sb.append(" => ");
            arm.getBlock().accept(this, sb);
            sb.append(",\n");
        }
        indent--;
        line(sb).append('}');
        return null;
    }

    @Override
    public Void visitRequireStmt(RequireStmt node, StringBuilder sb) {
        if (node.isRevert()) {
            sb.append("revert(");
            if (node.getMessage() != null) quote(node.getMessage(), sb);
        } else {
            sb.append("require(");
            node.getCondition().accept(this, sb);
            if (node.getMessage() != null) {
                sb.append(", ");
                quote(node.getMessage(), sb);
            }
        }
        sb.append(");");
        return null;
    }

    @Override
    public Void visitEmitStmt(EmitStmt node, StringBuilder sb) {
        sb.append("emit ").append(node.getEventName());
        args(node.getArguments(), sb);
        sb.append(';');
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, StringBuilder sb) {
        sb.append("return");
        if (node.getValue() != null) {
            sb.append(' ');
            node.getValue().accept(this, sb);
        }
        sb.append(';');
        return null;
    }

    @Override
    public Void visitPlaceholderStmt(PlaceholderStmt node, StringBuilder sb) {
        sb.append("_;");
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, StringBuilder sb) {
        sb.append(node.toString());
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, StringBuilder sb) {
        sb.append(node.getName());
        return null;
    }

    @Override
    public Void visitIntrinsicExpr(IntrinsicExpr node, StringBuilder sb) {
        sb.append(node.getIntrinsic().getSourceName());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, StringBuilder sb) {
        sb.append(node.getOperator().toSourceString());
        node.getOperand().accept(this, sb);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, StringBuilder sb) {
        sb.append('(');
        node.getLeft().accept(this, sb);
        sb.append(' ').append(node.getOperator().toSourceString()).append(' ');
        node.getRight().accept(this, sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitTernaryExpr(TernaryExpr node, StringBuilder sb) {
        sb.append('(');
        node.getCondition().accept(this, sb);
        sb.append(" ? ");
        node.getThenExpr().accept(this, sb);
        sb.append(" : ");
        node.getElseExpr().accept(this, sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, StringBuilder sb) {
        sb.append(node.getCallee());
        args(node.getArguments(), sb);
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, StringBuilder sb) {
        node.getReceiver().accept(this, sb);
        sb.append('.').append(node.getMethodName());
        args(node.getArguments(), sb);
        return null;
    }

    @Override
    public Void visitFieldAccessExpr(FieldAccessExpr node, StringBuilder sb) {
        node.getTarget().accept(this, sb);
        sb.append('.').append(node.getFieldName());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, StringBuilder sb) {
        node.getTarget().accept(this, sb);
        sb.append('[');
        node.getIndex().accept(this, sb);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitStructLiteral(StructLiteral node, StringBuilder sb) {
        sb.append(node.getStructName()).append(" { ");
        for (int i = 0; i < node.getFieldNames().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(node.getFieldNames().get(i)).append(": ");
            node.getValues().get(i).accept(this, sb);
        }
        sb.append(" }");
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node, StringBuilder sb) {
        sb.append('[');
        list(node.getElements(), sb);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitTupleLiteral(TupleLiteral node, StringBuilder sb) {
        args(node.getElements(), sb);
        return null;
    }

    @Override
    public Void visitCastExpr(CastExpr node, StringBuilder sb) {
        sb.append('(');
        node.getOperand().accept(this, sb);
        sb.append(" as ").append(node.getTargetType().toSourceString()).append(')');
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, StringBuilder sb) {
        sb.append('|');
        for (int i = 0; i < node.getParameters().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(node.getParameters().get(i).getName());
        }
        sb.append("| ");
        node.getBody().accept(this, sb);
        return null;
    }

    @Override
    public Void visitMatchExpr(MatchExpr node, StringBuilder sb) {
        sb.append("match ");
        node.getScrutinee().accept(this, sb);
        sb.append(" { ");
        for (MatchArm arm : node.getArms()) {
            arm.getPattern().accept(this, sb);
            sb.append(" => ");
            arm.getValue().accept(this, sb);
            sb.append(", ");
        }
        sb.append('}');
        return null;
    }

    @Override
    public Void visitMatchPattern(MatchPattern node, StringBuilder sb) {
        switch (node.getKind()) {
            case WILDCARD:
                sb.append('_');
                break;
            case LITERAL:
                node.getLow().accept(this, sb);
                break;
            case RANGE:
                node.getLow().accept(this, sb);
                sb.append("..");
                node.getHigh().accept(this, sb);
                break;
            default:
                break;
        }
        return null;
    }

    // ============ 辅助方法 ============

    private StringBuilder line(StringBuilder sb) {
        for (int i = 0; i < indent; i++) sb.append("    ");
        return sb;
    }

    private void params(List<Parameter> params, StringBuilder sb) {
        sb.append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            Parameter p = params.get(i);
            sb.append(p.getName());
            if (p.getType() != null) sb.append(": ").append(p.getType().toSourceString());
        }
        sb.append(')');
    }

    private void args(List<Expression> args, StringBuilder sb) {
        sb.append('(');
        list(args, sb);
        sb.append(')');
    }

    private void list(List<Expression> exprs, StringBuilder sb) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(", ");
            exprs.get(i).accept(this, sb);
        }
    }

    private static void quote(String s, StringBuilder sb) {
        sb.append('"').append(s.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
    }
}
