package com.ccdsl.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    STATE_VAR,          // state { } 中的状态变量
    CONSTANT,           // const 声明
    FUNCTION,           // fn 声明
    PARAMETER,          // 函数 / 修饰器参数
    LOCAL,              // let 绑定
    LOOP_VAR,           // for 循环变量
    LAMBDA_PARAM        // lambda 参数
}
