package com.pipelang.compiler.parser;

import com.pipelang.compiler.ast.SourceLocation;
import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.compiler.lexer.Lexer;
import com.pipelang.compiler.lexer.Token;
import com.pipelang.compiler.lexer.TokenType;

import java.util.List;

/**
 * 表达式语法分析器（递归下降）
 *
 * <p>本类维护 token 游标，语法规则见 {@link ExprParser}。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int pos;
    Token current;
    Token previous;

    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this.fileName = lexer.getFileName();
        this.tokens = lexer.scanTokens();
        this.pos = 0;
        this.current = tokens.get(0);
        failOnError(current);
    }

    /**
     * 解析完整输入为单个表达式
     */
    public static Expression parse(String source, String fileName) {
        return new Parser(new Lexer(source, fileName)).parseExpression();
    }

    /**
     * 解析单个表达式，要求其后为 EOF
     */
    public Expression parseExpression() {
        try {
            Expression expr = exprParser.parseExpression();
            if (!check(TokenType.EOF)) {
                throw new ParseException("Unexpected token after expression", current);
            }
            return expr;
        } catch (ParseException e) {
            throw e.inFile(fileName);
        }
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (pos < tokens.size() - 1) {
            pos++;
        }
        current = tokens.get(pos);
        failOnError(current);
        return previous;
    }

    /**
     * 向前查看 offset 个 token（0 即当前）
     */
    Token peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 创建当前 token 的源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    private void failOnError(Token token) {
        if (token.is(TokenType.ERROR)) {
            throw new ParseException(String.valueOf(token.getLiteral()), fileName, token, null);
        }
    }
}
