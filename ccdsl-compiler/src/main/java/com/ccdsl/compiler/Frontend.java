package com.ccdsl.compiler;

import com.ccdsl.compiler.analysis.AnalysisResult;
import com.ccdsl.compiler.analysis.SemanticAnalyzer;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;
import com.ccdsl.compiler.lexer.Lexer;
import com.ccdsl.compiler.lexer.Token;
import com.ccdsl.compiler.parser.ParseResult;
import com.ccdsl.compiler.parser.Parser;

import java.util.List;

/**
 * 前端流水线：词法 → 语法 → 语义。
 *
 * <p>存在词法或语法错误时不进入语义分析，结果中的合约是未标注的解析树。</p>
 */
public final class Frontend {

    private Frontend() {
    }

    public static AnalysisResult check(String source, String fileName) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        Lexer lexer = new Lexer(source, fileName, diagnostics);
        List<Token> tokens = lexer.scanTokens();
        ParseResult parsed = new Parser(tokens, fileName).parse();
        diagnostics.addAll(parsed.getErrors());
        if (diagnostics.hasErrors()) {
            List<ContractDecl> contracts = parsed.getSourceFile().getContracts();
            return new AnalysisResult(diagnostics.snapshot(), contracts, parsed.getSourceFile(), source);
        }
        return new SemanticAnalyzer(diagnostics).analyze(parsed.getSourceFile(), source);
    }
}
