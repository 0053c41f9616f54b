package com.pipelang.compiler.parser;

import com.pipelang.compiler.lexer.Token;
import com.pipelang.compiler.lexer.TokenType;

/**
 * 解析异常
 *
 * <p>位置取自出错的 token；{@link #getRawMessage()} 为不含位置的原始描述。</p>
 */
public class ParseException extends RuntimeException {
    private final String fileName;
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, null, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        this(message, null, token, expected);
    }

    public ParseException(String message, String fileName, Token token, String expected) {
        super(message);
        this.fileName = fileName;
        this.token = token;
        this.expected = expected;
    }

    /**
     * 补上文件名（已有文件名时原样返回）
     */
    public ParseException inFile(String fileName) {
        if (this.fileName != null || fileName == null) {
            return this;
        }
        ParseException located = new ParseException(super.getMessage(), fileName, token, expected);
        located.setStackTrace(getStackTrace());
        return located;
    }

    public String getFileName() {
        return fileName;
    }

    /** 出错行号，无 token 时为 0 */
    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    /** 出错列号，无 token 时为 0 */
    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    public String getExpected() {
        return expected;
    }

    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (token != null) {
            sb.append(" at ");
            if (fileName != null) sb.append(fileName).append(':');
            sb.append("line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (!token.is(TokenType.ERROR)) {
                sb.append(" (found ").append(token.describe()).append(')');
            }
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
