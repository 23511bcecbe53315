package com.ccdsl.ir;

import com.ccdsl.compiler.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个源文件的编译结果：前端诊断与每个合约的输出（按声明顺序）
 */
public final class CompilationResult {

    private final String fileName;
    private final List<Diagnostic> frontendDiagnostics;
    private final List<ContractOutput> contracts;

    public CompilationResult(String fileName, List<Diagnostic> frontendDiagnostics, List<ContractOutput> contracts) {
        this.fileName = fileName;
        this.frontendDiagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(frontendDiagnostics));
        this.contracts = Collections.unmodifiableList(new ArrayList<ContractOutput>(contracts));
    }

    public String getFileName() { return fileName; }

    /** 词法、语法、语义诊断（含警告） */
    public List<Diagnostic> getFrontendDiagnostics() { return frontendDiagnostics; }

    public List<ContractOutput> getContracts() { return contracts; }

    public ContractOutput getContract(String name) {
        for (ContractOutput output : contracts) {
            if (output.getContractName().equals(name)) return output;
        }
        return null;
    }

    public boolean hasFrontendErrors() {
        for (Diagnostic d : frontendDiagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    public boolean hasInternalErrors() {
        for (ContractOutput output : contracts) {
            if (output.hasInternalErrors()) return true;
        }
        return false;
    }

    /** 前端无错误且每个合约的每个目标都生成成功 */
    public boolean isSuccess() {
        if (hasFrontendErrors()) return false;
        for (ContractOutput output : contracts) {
            if (!output.isSuccess()) return false;
        }
        return true;
    }

    /** 全部诊断：前端诊断在前，随后按合约、目标顺序 */
    public List<Diagnostic> getAllDiagnostics() {
        List<Diagnostic> all = new ArrayList<Diagnostic>(frontendDiagnostics);
        for (ContractOutput output : contracts) {
            all.addAll(output.getAllDiagnostics());
        }
        return all;
    }
}
