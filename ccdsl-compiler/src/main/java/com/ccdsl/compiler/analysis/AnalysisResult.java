package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.AstNode;
import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.ast.decl.Declaration;
import com.ccdsl.compiler.ast.decl.SourceFile;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticKind;
import com.ccdsl.compiler.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 语义分析结果：诊断、已标注的合约和按位置查询类型的索引
 */
public final class AnalysisResult {
    private final List<Diagnostic> diagnostics;
    private final List<ContractDecl> contracts;
    /** 文件中全部合约的区间，含因重名未分析的合约 */
    private final List<SourceLocation> contractSpans = new ArrayList<SourceLocation>();
    /** 文件级结构体与接口 */
    private final List<Declaration> shared = new ArrayList<Declaration>();
    private final int[] lineStarts;
    private List<Expression> typedExpressions;  // 首次查询时建立

    public AnalysisResult(List<Diagnostic> diagnostics, List<ContractDecl> contracts, SourceFile file, String source) {
        this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
        this.contracts = Collections.unmodifiableList(new ArrayList<ContractDecl>(contracts));
        if (file != null) {
            for (ContractDecl contract : file.getContracts()) {
                contractSpans.add(contract.getLocation());
            }
            shared.addAll(file.getStructs());
            shared.addAll(file.getInterfaces());
        }
        this.lineStarts = computeLineStarts(source != null ? source : "");
    }

    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public List<ContractDecl> getContracts() { return contracts; }

    public boolean hasErrors() {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    /**
     * 错误是否阻断该合约的流水线。
     *
     * <p>词法和语法错误阻断整个文件。语义错误只阻断区间包含它的合约；
     * 位于文件级结构体或接口中的错误阻断直接或间接引用该声明的合约。</p>
     */
    public boolean hasErrors(ContractDecl contract) {
        Set<String> used = null;
        for (Diagnostic d : diagnostics) {
            if (!d.isError()) continue;
            if (d.getKind() != DiagnosticKind.SEMANTIC || d.getLocation() == SourceLocation.UNKNOWN) return true;
            int offset = d.getLocation().getOffset();
            if (contract.getLocation().containsOffset(offset)) return true;
            if (insideContract(offset)) continue;
            Declaration owner = sharedAt(offset);
            if (owner == null) return true;
            if (used == null) used = SharedReferences.collect(contract, shared);
            if (used.contains(owner.getName())) return true;
        }
        return false;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<Diagnostic>();
        for (Diagnostic d : diagnostics) {
            if (d.isError()) errors.add(d);
        }
        return errors;
    }

    /**
     * 覆盖 (line, column) 的最内层表达式的类型，行列从 1 开始；没有返回 null
     */
    public Type typeAt(int line, int column) {
        if (line < 1 || line > lineStarts.length) return null;
        if (column < 1) return null;
        int offset = lineStarts[line - 1] + column - 1;
        if (line < lineStarts.length && offset >= lineStarts[line]) return null;
        Expression best = null;
        for (Expression expr : typedExpressions()) {
            SourceLocation loc = expr.getLocation();
            if (!loc.containsOffset(offset)) continue;
            if (best == null || loc.getLength() <= best.getLocation().getLength()) {
                best = expr;
            }
        }
        return best != null ? best.getType() : null;
    }

    private boolean insideContract(int offset) {
        for (SourceLocation span : contractSpans) {
            if (span.containsOffset(offset)) return true;
        }
        return false;
    }

    private Declaration sharedAt(int offset) {
        for (Declaration decl : shared) {
            if (decl.getLocation().containsOffset(offset)) return decl;
        }
        return null;
    }

    private synchronized List<Expression> typedExpressions() {
        if (typedExpressions == null) {
            List<Expression> out = new ArrayList<Expression>();
            for (ContractDecl contract : contracts) {
                collect(contract, out);
            }
            typedExpressions = out;
        }
        return typedExpressions;
    }

    private static void collect(AstNode node, List<Expression> out) {
        if (node instanceof Expression && ((Expression) node).getType() != null) {
            out.add((Expression) node);
        }
        for (AstNode child : node.getChildren()) {
            collect(child, out);
        }
    }

    private static int[] computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') starts.add(i + 1);
        }
        int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }
}
