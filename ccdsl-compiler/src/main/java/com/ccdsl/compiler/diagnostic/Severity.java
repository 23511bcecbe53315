package com.ccdsl.compiler.diagnostic;

public enum Severity {
    ERROR,
    WARNING
}
