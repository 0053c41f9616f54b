package com.pipelang.compiler.lexer;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表达式词法分析器
 *
 * <p>换行与空白同等对待；{@code #} 开始单行注释。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("lambda", TokenType.KW_LAMBDA);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("if", TokenType.KW_IF);
        map.put("not", TokenType.KW_NOT);
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("True", TokenType.KW_TRUE);
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    /** 是否为合法标识符（且不是关键词） */
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty() || KEYWORDS.containsKey(name)) return false;
        if (!isAlpha(name.charAt(0))) return false;
        for (int i = 1; i < name.length(); i++) {
            if (!isAlphaNumeric(name.charAt(i))) return false;
        }
        return true;
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, null);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) break;
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else if (c == '#') {
                while (peek() != '\n' && !isAtEnd()) advance();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '@': addToken(TokenType.AT); break;
            case '~': addToken(TokenType.TILDE); break;
            case '^': addToken(TokenType.CARET); break;
            case '&': addToken(TokenType.AMP); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '%': addToken(TokenType.PERCENT); break;

            // 可能是多字符的 Token
            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '*':
                addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR);
                break;

            case '/':
                addToken(match('/') ? TokenType.DOUBLE_SLASH : TokenType.SLASH);
                break;

            case '|':
                addToken(match('>') ? TokenType.PIPELINE : TokenType.BAR);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character '!'. Did you mean '!=' or 'not'?");
                }
                break;

            case '<':
                if (match('<')) addToken(TokenType.LSHIFT);
                else if (match('=')) addToken(TokenType.LE);
                else addToken(TokenType.LT);
                break;

            case '>':
                if (match('>')) addToken(TokenType.RSHIFT);
                else if (match('=')) addToken(TokenType.GE);
                else addToken(TokenType.GT);
                break;

            // 字符串
            case '"':
            case '\'':
                string(c, false);
                break;

            // f-string f"..."
            case 'f':
            case 'F':
                if (peek() == '"' || peek() == '\'') {
                    string(advance(), true);
                } else {
                    identifier();
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, start));
    }

    // === 各类 Token 扫描 ===

    /**
     * 字符串与 f-string。f-string 保留原始花括号，由解析器拆分插值部分；
     * 花括号内部允许出现另一种引号的字符串。
     */
    private void string(char quote, boolean interpolated) {
        StringBuilder value = new StringBuilder();
        int braceDepth = 0;

        while (!isAtEnd()) {
            char c = peek();
            if (c == quote && braceDepth == 0) {
                break;
            }
            if (c == '\n') {
                error("Unterminated string");
                return;
            }
            if (c == '\\' && braceDepth == 0) {
                advance();
                value.append(escapeChar());
                continue;
            }
            advance();
            value.append(c);
            if (interpolated) {
                if (c == '{') {
                    if (braceDepth == 0 && peek() == '{') {
                        value.append(advance()); // {{ 转义
                    } else {
                        braceDepth++;
                    }
                } else if (c == '}' && braceDepth > 0) {
                    braceDepth--;
                }
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合引号
        addToken(interpolated ? TokenType.FSTRING_LITERAL : TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) return '\\';
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case '\\': return '\\';
            case '"': return '"';
            case '\'': return '\'';
            default:
                error("Invalid escape sequence: \\" + c);
                return c;
        }
    }

    private void number() {
        boolean isFloat = source.charAt(start) == '.';
        advanceDigits();

        // 小数部分
        if (!isFloat && peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            advanceDigits();
            isFloat = true;
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            if (isDigit(next) || next == '+' || next == '-') {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                advanceDigits();
                isFloat = true;
            }
        }

        String text = source.substring(start, current).replace("_", "");
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
            } else {
                addToken(TokenType.INT_LITERAL, Long.parseLong(text));
            }
        } catch (NumberFormatException e) {
            error("Invalid number literal: " + source.substring(start, current));
        }
    }

    private void advanceDigits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) {
            advance();
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void error(String message) {
        if (errStream != null) {
            errStream.println(String.format("[%s:%d:%d] Lexer error: %s",
                    fileName, startLine, startColumn, message));
        }
        addToken(TokenType.ERROR, message);
    }
}
