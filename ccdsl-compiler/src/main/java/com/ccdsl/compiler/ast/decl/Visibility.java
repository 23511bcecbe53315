package com.ccdsl.compiler.ast.decl;

public enum Visibility {
    PUBLIC,
    PRIVATE
}
