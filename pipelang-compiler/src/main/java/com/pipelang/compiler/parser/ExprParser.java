package com.pipelang.compiler.parser;

import com.pipelang.compiler.ast.SourceLocation;
import com.pipelang.compiler.ast.expr.*;
import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pipelang.compiler.lexer.Lexer;
import com.pipelang.compiler.lexer.Token;
import com.pipelang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.pipelang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：标记 / lambda、|>、or、and、not、比较、|、^、&amp;、
 * 移位、加减、乘除、一元、**、后缀。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        if (parser.check(AT)) {
            return parseAnnotatedExpr();
        }
        if (parser.check(KW_LAMBDA)) {
            return parseLambdaExpr();
        }
        return parsePipelineExpr();
    }

    // 前缀标记 @name(args) expr
    // 参数列表的 ( 必须紧贴名称；@name (expr) 中的括号属于表达式
    private Expression parseAnnotatedExpr() {
        SourceLocation loc = parser.location();
        List<AnnotatedExpr.Annotation> annotations = new ArrayList<>();
        while (parser.match(AT)) {
            SourceLocation annLoc = parser.previousLocation();
            Token name = parser.expect(IDENTIFIER, "Expected annotation name after '@'");
            List<CallExpr.Argument> args = Collections.emptyList();
            if (parser.check(LPAREN) && parser.current.follows(name)) {
                parser.advance();
                args = parseArguments();
            }
            annotations.add(new AnnotatedExpr.Annotation(annLoc, name.getLexeme(), args));
        }
        Expression body = parseExpression();
        return new AnnotatedExpr(loc, annotations, body);
    }

    // lambda a, b: body
    private Expression parseLambdaExpr() {
        Token kw = parser.expect(KW_LAMBDA, "Expected 'lambda'");
        SourceLocation loc = parser.locationOf(kw);
        List<String> params = new ArrayList<>();
        if (!parser.check(COLON)) {
            do {
                params.add(parser.expect(IDENTIFIER, "Expected lambda parameter name").getLexeme());
            } while (parser.match(COMMA));
        }
        parser.expect(COLON, "Expected ':' after lambda parameters");
        Expression body = parseExpression();
        return new LambdaExpr(loc, params, body);
    }

    // 管道 |>（最低优先级的二元运算符）
    private Expression parsePipelineExpr() {
        Expression left = parseDisjunctionExpr();

        while (parser.match(PIPELINE)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseDisjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryOp.PIPE, right);
        }

        return left;
    }

    // 逻辑或 or
    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();

        while (parser.match(KW_OR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseConjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 and
    private Expression parseConjunctionExpr() {
        Expression left = parseInversionExpr();

        while (parser.match(KW_AND)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseInversionExpr();
            left = new BinaryExpr(loc, left, BinaryOp.AND, right);
        }

        return left;
    }

    // 逻辑非 not
    private Expression parseInversionExpr() {
        if (parser.match(KW_NOT)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, parseInversionExpr());
        }
        return parseComparisonExpr();
    }

    // 比较 == != < > <= >=（支持链式比较 a < b < c -> a < b and b < c）
    private Expression parseComparisonExpr() {
        Expression left = parseBitOrExpr();

        if (!parser.checkAny(EQ, NE, LT, GT, LE, GE)) {
            return left;
        }

        // 收集所有比较
        Expression result = null;
        Expression prevRight = left;

        while (parser.checkAny(EQ, NE, LT, GT, LE, GE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseBitOrExpr();
            BinaryOp binOp;
            switch (op.getType()) {
                case EQ: binOp = BinaryOp.EQ; break;
                case NE: binOp = BinaryOp.NE; break;
                case LT: binOp = BinaryOp.LT; break;
                case GT: binOp = BinaryOp.GT; break;
                case LE: binOp = BinaryOp.LE; break;
                case GE: binOp = BinaryOp.GE; break;
                default: throw new ParseException("Unexpected operator", op);
            }

            Expression comparison = new BinaryExpr(loc, prevRight, binOp, right);

            if (result == null) {
                result = comparison;
            } else {
                // 链式比较：用 and 连接
                result = new BinaryExpr(loc, result, BinaryOp.AND, comparison);
            }

            prevRight = right;
        }

        return result;
    }

    // 按位或 |
    private Expression parseBitOrExpr() {
        Expression left = parseBitXorExpr();

        while (parser.match(BAR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseBitXorExpr();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_OR, right);
        }

        return left;
    }

    // 按位异或 ^
    private Expression parseBitXorExpr() {
        Expression left = parseBitAndExpr();

        while (parser.match(CARET)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseBitAndExpr();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_XOR, right);
        }

        return left;
    }

    // 按位与 &
    private Expression parseBitAndExpr() {
        Expression left = parseShiftExpr();

        while (parser.match(AMP)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseShiftExpr();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_AND, right);
        }

        return left;
    }

    // 移位 << >>
    private Expression parseShiftExpr() {
        Expression left = parseAdditiveExpr();

        while (parser.checkAny(LSHIFT, RSHIFT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseAdditiveExpr();
            BinaryOp binOp = op.is(LSHIFT) ? BinaryOp.SHL : BinaryOp.SHR;
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseMultiplicativeExpr();
            BinaryOp binOp = op.is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 乘除 * / // % @
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();

        while (parser.checkAny(STAR, SLASH, DOUBLE_SLASH, PERCENT, AT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseUnaryExpr();
            BinaryOp binOp;
            switch (op.getType()) {
                case STAR: binOp = BinaryOp.MUL; break;
                case SLASH: binOp = BinaryOp.DIV; break;
                case DOUBLE_SLASH: binOp = BinaryOp.FLOOR_DIV; break;
                case PERCENT: binOp = BinaryOp.MOD; break;
                case AT: binOp = BinaryOp.MAT_MUL; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 一元 - + ~
    private Expression parseUnaryExpr() {
        if (parser.checkAny(MINUS, PLUS, TILDE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression operand = parseUnaryExpr();
            UnaryExpr.UnaryOp unaryOp;
            switch (op.getType()) {
                case MINUS: unaryOp = UnaryExpr.UnaryOp.NEG; break;
                case PLUS: unaryOp = UnaryExpr.UnaryOp.POS; break;
                default: unaryOp = UnaryExpr.UnaryOp.INVERT; break;
            }
            return new UnaryExpr(loc, unaryOp, operand);
        }
        return parsePowerExpr();
    }

    // 幂 **（右结合，右操作数可带一元运算符）
    private Expression parsePowerExpr() {
        Expression base = parsePostfixExpr();

        if (parser.match(DOUBLE_STAR)) {
            SourceLocation loc = parser.previousLocation();
            Expression exponent = parseUnaryExpr();
            return new BinaryExpr(loc, base, BinaryOp.POW, exponent);
        }

        return base;
    }

    // 后缀 .member (args) [index]
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            if (parser.match(DOT)) {
                SourceLocation loc = parser.previousLocation();
                String member = parser.expect(IDENTIFIER, "Expected member name after '.'").getLexeme();
                expr = new MemberExpr(loc, expr, member);
            } else if (parser.match(LPAREN)) {
                SourceLocation loc = parser.previousLocation();
                expr = new CallExpr(loc, expr, parseArguments());
            } else if (parser.match(LBRACKET)) {
                SourceLocation loc = parser.previousLocation();
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else {
                break;
            }
        }

        return expr;
    }

    /**
     * 解析调用参数（已消费 '('，消费到 ')'）。
     * 支持命名参数 name=value，以及唯一参数为生成器推导式的写法 f(x for x in xs)。
     */
    private List<CallExpr.Argument> parseArguments() {
        List<CallExpr.Argument> args = new ArrayList<>();
        boolean seenNamed = false;
        while (!parser.check(RPAREN)) {
            SourceLocation loc = parser.location();
            if (parser.check(IDENTIFIER) && parser.peek(1).is(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance(); // =
                args.add(new CallExpr.Argument(loc, name, parseExpression()));
                seenNamed = true;
            } else {
                if (seenNamed) {
                    throw new ParseException("Positional argument follows named argument", parser.current);
                }
                Expression value = parseExpression();
                if (args.isEmpty() && parser.check(KW_FOR)) {
                    value = parseComprehensionTail(loc, ComprehensionExpr.ComprehensionKind.GENERATOR, value, null);
                }
                args.add(new CallExpr.Argument(loc, null, value));
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parsePrimaryExpr() {
        Token token = parser.current;
        SourceLocation loc = parser.location();

        switch (token.getType()) {
            case INT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT);
            case FLOAT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.FLOAT);
            case STRING_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING);
            case FSTRING_LITERAL:
                parser.advance();
                return parseInterpolation(loc, (String) token.getLiteral(), token);
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Boolean.TRUE, Literal.LiteralKind.BOOLEAN);
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Boolean.FALSE, Literal.LiteralKind.BOOLEAN);
            case KW_NONE:
                parser.advance();
                return new Literal(loc, null, Literal.LiteralKind.NONE);
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case LPAREN:
                parser.advance();
                return parseParenthesized(loc);
            case LBRACKET:
                parser.advance();
                return parseListLiteral(loc);
            case LBRACE:
                parser.advance();
                return parseBraceLiteral(loc);
            case KW_LAMBDA:
                throw new ParseException("Lambda must be parenthesized when used as an operand", token);
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    // ( ) / (expr) / (a, b) / (x for x in xs)
    private Expression parseParenthesized(SourceLocation loc) {
        if (parser.match(RPAREN)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.TUPLE,
                    Collections.emptyList(), null);
        }
        Expression first = parseExpression();
        if (parser.check(KW_FOR)) {
            Expression comp = parseComprehensionTail(loc, ComprehensionExpr.ComprehensionKind.GENERATOR, first, null);
            parser.expect(RPAREN, "Expected ')' after generator expression");
            return comp;
        }
        if (!parser.match(COMMA)) {
            parser.expect(RPAREN, "Expected ')'");
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (!parser.check(RPAREN)) {
            elements.add(parseExpression());
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after tuple elements");
        return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.TUPLE, elements, null);
    }

    // [ ] / [a, b] / [x for x in xs]
    private Expression parseListLiteral(SourceLocation loc) {
        if (parser.match(RBRACKET)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST,
                    Collections.emptyList(), null);
        }
        Expression first = parseExpression();
        if (parser.check(KW_FOR)) {
            Expression comp = parseComprehensionTail(loc, ComprehensionExpr.ComprehensionKind.LIST, first, null);
            parser.expect(RBRACKET, "Expected ']' after list comprehension");
            return comp;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseExpression());
        }
        parser.expect(RBRACKET, "Expected ']' after list elements");
        return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST, elements, null);
    }

    // { } / {a, b} / {k: v} / 推导式
    private Expression parseBraceLiteral(SourceLocation loc) {
        if (parser.match(RBRACE)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.DICT,
                    null, Collections.emptyList());
        }
        Expression first = parseExpression();

        if (parser.match(COLON)) {
            Expression firstValue = parseExpression();
            if (parser.check(KW_FOR)) {
                Expression comp = parseComprehensionTail(loc, ComprehensionExpr.ComprehensionKind.DICT, first, firstValue);
                parser.expect(RBRACE, "Expected '}' after dict comprehension");
                return comp;
            }
            List<CollectionLiteral.MapEntry> entries = new ArrayList<>();
            entries.add(new CollectionLiteral.MapEntry(first.getLocation(), first, firstValue));
            while (parser.match(COMMA)) {
                if (parser.check(RBRACE)) break;
                Expression key = parseExpression();
                parser.expect(COLON, "Expected ':' in dict entry");
                Expression value = parseExpression();
                entries.add(new CollectionLiteral.MapEntry(key.getLocation(), key, value));
            }
            parser.expect(RBRACE, "Expected '}' after dict entries");
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.DICT, null, entries);
        }

        if (parser.check(KW_FOR)) {
            Expression comp = parseComprehensionTail(loc, ComprehensionExpr.ComprehensionKind.SET, first, null);
            parser.expect(RBRACE, "Expected '}' after set comprehension");
            return comp;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACE)) break;
            elements.add(parseExpression());
        }
        parser.expect(RBRACE, "Expected '}' after set elements");
        return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.SET, elements, null);
    }

    // for a, b in iterable if cond ...（可重复）
    private Expression parseComprehensionTail(SourceLocation loc, ComprehensionExpr.ComprehensionKind kind,
                                              Expression element, Expression value) {
        List<ComprehensionExpr.Generator> generators = new ArrayList<>();
        while (parser.match(KW_FOR)) {
            SourceLocation genLoc = parser.previousLocation();
            List<String> targets = new ArrayList<>();
            do {
                targets.add(parser.expect(IDENTIFIER, "Expected loop variable").getLexeme());
            } while (parser.match(COMMA));
            parser.expect(KW_IN, "Expected 'in' in comprehension");
            Expression iterable = parseDisjunctionExpr();
            List<Expression> conditions = new ArrayList<>();
            while (parser.match(KW_IF)) {
                conditions.add(parseDisjunctionExpr());
            }
            generators.add(new ComprehensionExpr.Generator(genLoc, targets, iterable, conditions));
        }
        return new ComprehensionExpr(loc, kind, element, value, generators);
    }

    /**
     * 拆分 f-string 原始内容：{{ 与 }} 为转义花括号，{expr} 为插值表达式。
     */
    private Expression parseInterpolation(SourceLocation loc, String raw, Token token) {
        List<StringInterpolation.StringPart> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '{' && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < raw.length() && raw.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
            } else if (c == '{') {
                int end = findClosingBrace(raw, i + 1, token);
                String inner = raw.substring(i + 1, end).trim();
                if (inner.isEmpty()) {
                    throw new ParseException("Empty expression in f-string", token);
                }
                if (text.length() > 0) {
                    parts.add(new StringInterpolation.LiteralPart(loc, text.toString()));
                    text.setLength(0);
                }
                Expression expr = new Parser(new Lexer(inner, parser.fileName)).parseExpression();
                parts.add(new StringInterpolation.ExprPart(loc, expr));
                i = end + 1;
            } else if (c == '}') {
                throw new ParseException("Single '}' is not allowed in f-string", token);
            } else {
                text.append(c);
                i++;
            }
        }
        if (text.length() > 0) {
            parts.add(new StringInterpolation.LiteralPart(loc, text.toString()));
        }
        return new StringInterpolation(loc, parts);
    }

    private static int findClosingBrace(String raw, int from, Token token) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) return i;
                depth--;
            }
        }
        throw new ParseException("Unterminated '{' in f-string", token);
    }
}
