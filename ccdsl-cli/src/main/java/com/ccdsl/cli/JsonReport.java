package com.ccdsl.cli;

import com.ccdsl.compiler.analysis.AnalysisResult;
import com.ccdsl.compiler.ast.decl.ContractDecl;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.ir.CompilationResult;
import com.ccdsl.ir.ContractOutput;
import com.ccdsl.ir.TargetOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * --json 输出的报告结构，由 Gson 按字段序列化
 */
final class JsonReport {

    String file;
    boolean success;
    int exitCode;
    List<DiagnosticEntry> diagnostics = new ArrayList<DiagnosticEntry>();
    List<ContractEntry> contracts = new ArrayList<ContractEntry>();
    List<String> written = new ArrayList<String>();

    static JsonReport of(CompilationResult result, List<String> written) {
        JsonReport report = new JsonReport();
        report.file = result.getFileName();
        report.success = result.isSuccess();
        report.exitCode = CompileRunner.exitCode(result);
        for (Diagnostic d : result.getFrontendDiagnostics()) {
            report.diagnostics.add(DiagnosticEntry.of(d));
        }
        for (ContractOutput output : result.getContracts()) {
            ContractEntry contract = new ContractEntry();
            contract.name = output.getContractName();
            contract.state = output.getState().name();
            for (Diagnostic d : output.getDiagnostics()) {
                contract.diagnostics.add(DiagnosticEntry.of(d));
            }
            for (TargetOutcome outcome : output.getOutcomes()) {
                TargetEntry target = new TargetEntry();
                target.target = outcome.getTarget().getId();
                target.state = outcome.getState().name();
                target.path = outcome.getArtifactPath();
                for (Diagnostic d : outcome.getDiagnostics()) {
                    target.diagnostics.add(DiagnosticEntry.of(d));
                }
                contract.targets.add(target);
            }
            report.contracts.add(contract);
        }
        report.written.addAll(written);
        return report;
    }

    static JsonReport of(String fileName, AnalysisResult analysis) {
        JsonReport report = new JsonReport();
        report.file = fileName;
        report.success = !analysis.hasErrors();
        report.exitCode = analysis.hasErrors() ? ExitCodes.FRONTEND_ERROR : ExitCodes.OK;
        for (Diagnostic d : analysis.getDiagnostics()) {
            report.diagnostics.add(DiagnosticEntry.of(d));
        }
        for (ContractDecl contract : analysis.getContracts()) {
            ContractEntry entry = new ContractEntry();
            entry.name = contract.getName();
            entry.state = analysis.hasErrors(contract) ? "FAILED" : "ANALYZED";
            report.contracts.add(entry);
        }
        return report;
    }

    static final class ContractEntry {
        String name;
        String state;
        List<DiagnosticEntry> diagnostics = new ArrayList<DiagnosticEntry>();
        List<TargetEntry> targets = new ArrayList<TargetEntry>();
    }

    static final class TargetEntry {
        String target;
        String state;
        String path;
        List<DiagnosticEntry> diagnostics = new ArrayList<DiagnosticEntry>();
    }

    static final class DiagnosticEntry {
        String kind;
        String code;
        String severity;
        String message;
        String file;
        int line;
        int column;
        String target;

        static DiagnosticEntry of(Diagnostic d) {
            DiagnosticEntry entry = new DiagnosticEntry();
            entry.kind = d.getKind().name();
            entry.code = d.getCode().name();
            entry.severity = d.getSeverity().name();
            entry.message = d.getMessage();
            entry.file = d.getLocation().getFile();
            entry.line = d.getLocation().getLine();
            entry.column = d.getLocation().getColumn();
            entry.target = d.getTarget();
            return entry;
        }
    }
}
