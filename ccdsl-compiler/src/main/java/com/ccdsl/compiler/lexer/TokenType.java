package com.ccdsl.compiler.lexer;

/**
 * 合约 DSL 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,            // 42, 0xff, 255u8, 1_000_000u64
    STRING_LITERAL,         // "..."
    BYTES_LITERAL,          // b"..."

    // === 标识符 ===
    IDENTIFIER,
    INTRINSIC,              // msg_sender, block_number ...（编译器内建值）
    PRIMITIVE_TYPE,         // u8..u256, i8..i128, bool, address, string, bytes

    // === 关键词 - 声明 ===
    KW_CONTRACT, KW_INTERFACE, KW_IMPLEMENTS, KW_STRUCT, KW_STATE,
    KW_EVENT, KW_MODIFIER, KW_CONST, KW_FN, KW_LET, KW_MUT,

    // === 关键词 - 可见性 ===
    KW_PUBLIC, KW_PRIVATE,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHILE, KW_FOR, KW_IN, KW_MATCH,
    KW_REQUIRE, KW_REVERT, KW_EMIT, KW_RETURN,

    // === 关键词 - 其他 ===
    KW_AS, KW_TRUE, KW_FALSE,

    // === 关键词 - 泛型类型 ===
    KW_MAP, KW_VEC, KW_OPTION, KW_RESULT,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 其他操作符 ===
    ASSIGN,         // =
    QUESTION,       // ?
    COLON,          // :
    DOT,            // .
    RANGE,          // ..
    ARROW,          // ->
    DOUBLE_ARROW,   // =>
    PIPE,           // |（lambda 参数界定）
    UNDERSCORE,     // _

    // === 分隔符 ===
    COMMA, SEMICOLON,
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,

    EOF;

    /** 是否为关键词 */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
