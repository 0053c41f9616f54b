package com.pipelang.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    FSTRING_LITERAL,        // f"..."

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_LAMBDA, KW_FOR, KW_IN, KW_IF,
    KW_NOT, KW_AND, KW_OR,
    KW_TRUE, KW_FALSE, KW_NONE,

    // === 运算符 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    DOUBLE_STAR,    // **
    SLASH,          // /
    DOUBLE_SLASH,   // //
    PERCENT,        // %
    AT,             // @（矩阵乘 或 前缀标记）
    LSHIFT,         // <<
    RSHIFT,         // >>
    AMP,            // &
    BAR,            // |
    CARET,          // ^
    TILDE,          // ~
    PIPELINE,       // |>
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=
    ASSIGN,         // =（仅命名参数）

    // === 分隔符 ===
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    COMMA, COLON, DOT,

    // === 特殊 ===
    EOF,
    ERROR
}
