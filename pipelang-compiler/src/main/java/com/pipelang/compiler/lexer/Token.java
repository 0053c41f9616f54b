package com.pipelang.compiler.lexer;

/**
 * 词法单元
 *
 * <p>{@code lexeme} 为源码原文（数字里的 {@code _} 也保留），
 * 因此 {@code offset + lexeme.length()} 即结束偏移。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndOffset() {
        return offset + lexeme.length();
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /**
     * 本 token 是否紧跟在 {@code previous} 之后（中间没有空白）
     *
     * <p>{@code @name(args)} 与 {@code @name (expr)} 靠它区分。</p>
     */
    public boolean follows(Token previous) {
        return previous != null && offset == previous.getEndOffset();
    }

    /**
     * 诊断用的文本：EOF 显示为 end of input
     */
    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + lexeme + "'";
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ") at " + line + ":" + column;
    }
}
