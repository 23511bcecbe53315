package com.ccdsl.ir;

import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.ir.backend.Target;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个合约在一个目标上的结果
 */
public final class TargetOutcome {

    private final Target target;
    private final JobState state;
    private final String text;
    private final String artifactPath;
    private final List<Diagnostic> diagnostics;

    public TargetOutcome(Target target, JobState state, String text, String artifactPath,
                         List<Diagnostic> diagnostics) {
        this.target = target;
        this.state = state;
        this.text = text;
        this.artifactPath = artifactPath;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
    }

    public Target getTarget() { return target; }
    public JobState getState() { return state; }

    /** 产物文本，失败时为 null */
    public String getText() { return text; }

    /** 相对输出目录的产物路径，如 solana/token_vault.rs */
    public String getArtifactPath() { return artifactPath; }

    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    public boolean isGenerated() {
        return state == JobState.GENERATED;
    }

    @Override
    public String toString() {
        return target.getId() + ": " + state + (diagnostics.isEmpty() ? "" : " (" + diagnostics.size() + " diagnostic(s))");
    }
}
