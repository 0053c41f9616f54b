package com.pipelang.compiler.formatter;

import com.pipelang.compiler.ast.AstVisitor;
import com.pipelang.compiler.ast.expr.*;
import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;

import java.util.List;

/**
 * 表达式源码打印器
 *
 * <p>按运算符优先级输出最少的括号，结果可被 {@link com.pipelang.compiler.parser.Parser} 重新解析。
 * 不保留原始格式与注释。</p>
 */
public class ExprFormatter implements AstVisitor<Void, StringBuilder> {

    // 优先级层级（与 BinaryOp.getPrecedence 同一刻度）
    private static final int PREC_LOWEST = 0;
    private static final int PREC_NOT = 4;
    private static final int PREC_UNARY = 12;
    private static final int PREC_POSTFIX = 14;

    /**
     * 打印表达式
     */
    public static String format(Expression expr) {
        StringBuilder sb = new StringBuilder();
        new ExprFormatter().formatExpression(expr, PREC_LOWEST, sb);
        return sb.toString();
    }

    private void formatExpression(Expression expr, int minPrec, StringBuilder sb) {
        boolean parens = precedenceOf(expr) < minPrec;
        if (parens) sb.append('(');
        expr.accept(this, sb);
        if (parens) sb.append(')');
    }

    private static int precedenceOf(Expression expr) {
        if (expr instanceof BinaryExpr) {
            return ((BinaryExpr) expr).getOperator().getPrecedence();
        }
        if (expr instanceof UnaryExpr) {
            return ((UnaryExpr) expr).getOperator() == UnaryExpr.UnaryOp.NOT ? PREC_NOT : PREC_UNARY;
        }
        if (expr instanceof LambdaExpr || expr instanceof AnnotatedExpr) {
            return PREC_LOWEST;
        }
        if (expr instanceof Literal) {
            Object value = ((Literal) expr).getValue();
            if (value instanceof Number && ((Number) value).doubleValue() < 0) {
                return PREC_UNARY;
            }
        }
        return PREC_POSTFIX;
    }

    private void formatJoined(List<Expression> exprs, int minPrec, StringBuilder sb) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(", ");
            formatExpression(exprs.get(i), minPrec, sb);
        }
    }

    // ============ 叶节点 ============

    @Override
    public Void visitIdentifier(Identifier node, StringBuilder sb) {
        sb.append(node.getName());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, StringBuilder sb) {
        switch (node.getKind()) {
            case STRING:
                sb.append(quote(String.valueOf(node.getValue()), false));
                break;
            case BOOLEAN:
                sb.append(Boolean.TRUE.equals(node.getValue()) ? "True" : "False");
                break;
            case NONE:
                sb.append("None");
                break;
            default:
                sb.append(node.getValue());
                break;
        }
        return null;
    }

    // ============ 运算 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, StringBuilder sb) {
        BinaryOp op = node.getOperator();
        int prec = op.getPrecedence();
        int leftPrec;
        int rightPrec;
        if (op == BinaryOp.POW) {
            // 底数只能是后缀表达式，指数可以带一元运算符
            leftPrec = PREC_POSTFIX;
            rightPrec = PREC_UNARY;
        } else if (op.getCategory() == BinaryExpr.Category.COMPARISON) {
            // 比较不可结合：a < b < c 会被解析为链式比较
            leftPrec = prec + 1;
            rightPrec = prec + 1;
        } else {
            leftPrec = prec;
            rightPrec = prec + 1;
        }
        formatExpression(node.getLeft(), leftPrec, sb);
        sb.append(' ').append(op.toSourceString()).append(' ');
        formatExpression(node.getRight(), rightPrec, sb);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, StringBuilder sb) {
        sb.append(node.getOperator().toSourceString());
        int operandPrec = node.getOperator() == UnaryExpr.UnaryOp.NOT ? PREC_NOT : PREC_UNARY;
        formatExpression(node.getOperand(), operandPrec, sb);
        return null;
    }

    // ============ 后缀 ============

    @Override
    public Void visitMemberExpr(MemberExpr node, StringBuilder sb) {
        formatExpression(node.getTarget(), PREC_POSTFIX, sb);
        sb.append('.').append(node.getMember());
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, StringBuilder sb) {
        formatExpression(node.getCallee(), PREC_POSTFIX, sb);
        sb.append('(');
        List<CallExpr.Argument> args = node.getArgs();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            CallExpr.Argument arg = args.get(i);
            if (arg.isNamed()) {
                sb.append(arg.getName()).append('=');
            }
            formatExpression(arg.getValue(), PREC_LOWEST, sb);
        }
        sb.append(')');
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, StringBuilder sb) {
        formatExpression(node.getTarget(), PREC_POSTFIX, sb);
        sb.append('[');
        formatExpression(node.getIndex(), PREC_LOWEST, sb);
        sb.append(']');
        return null;
    }

    // ============ 集合与推导式 ============

    @Override
    public Void visitCollectionLiteral(CollectionLiteral node, StringBuilder sb) {
        switch (node.getKind()) {
            case LIST:
                sb.append('[');
                formatJoined(node.getElements(), PREC_LOWEST, sb);
                sb.append(']');
                break;
            case SET:
                if (node.getElements().isEmpty()) {
                    sb.append("set()");
                    break;
                }
                sb.append('{');
                formatJoined(node.getElements(), PREC_LOWEST, sb);
                sb.append('}');
                break;
            case TUPLE:
                sb.append('(');
                formatJoined(node.getElements(), PREC_LOWEST, sb);
                if (node.getElements().size() == 1) sb.append(',');
                sb.append(')');
                break;
            case DICT:
                sb.append('{');
                List<CollectionLiteral.MapEntry> entries = node.getMapEntries();
                for (int i = 0; i < entries.size(); i++) {
                    if (i > 0) sb.append(", ");
                    formatExpression(entries.get(i).getKey(), PREC_LOWEST, sb);
                    sb.append(": ");
                    formatExpression(entries.get(i).getValue(), PREC_LOWEST, sb);
                }
                sb.append('}');
                break;
        }
        return null;
    }

    @Override
    public Void visitComprehensionExpr(ComprehensionExpr node, StringBuilder sb) {
        String open;
        String close;
        switch (node.getKind()) {
            case LIST: open = "["; close = "]"; break;
            case SET:
            case DICT: open = "{"; close = "}"; break;
            default: open = "("; close = ")"; break;
        }
        sb.append(open);
        formatExpression(node.getElement(), PREC_LOWEST, sb);
        if (node.getKind() == ComprehensionExpr.ComprehensionKind.DICT) {
            sb.append(": ");
            formatExpression(node.getValue(), PREC_LOWEST, sb);
        }
        for (ComprehensionExpr.Generator gen : node.getGenerators()) {
            sb.append(" for ").append(String.join(", ", gen.getTargets())).append(" in ");
            // 迭代对象与条件按 or 层级解析
            formatExpression(gen.getIterable(), BinaryOp.OR.getPrecedence(), sb);
            for (Expression cond : gen.getConditions()) {
                sb.append(" if ");
                formatExpression(cond, BinaryOp.OR.getPrecedence(), sb);
            }
        }
        sb.append(close);
        return null;
    }

    @Override
    public Void visitStringInterpolation(StringInterpolation node, StringBuilder sb) {
        sb.append("f\"");
        for (StringInterpolation.StringPart part : node.getParts()) {
            if (part instanceof StringInterpolation.LiteralPart) {
                String text = ((StringInterpolation.LiteralPart) part).getValue();
                String escaped = quote(text, true);
                sb.append(escaped, 1, escaped.length() - 1);
            } else {
                sb.append('{');
                formatExpression(((StringInterpolation.ExprPart) part).getExpression(), PREC_LOWEST, sb);
                sb.append('}');
            }
        }
        sb.append('"');
        return null;
    }

    // ============ lambda 与标记 ============

    @Override
    public Void visitLambdaExpr(LambdaExpr node, StringBuilder sb) {
        sb.append("lambda");
        if (!node.getParams().isEmpty()) {
            sb.append(' ').append(String.join(", ", node.getParams()));
        }
        sb.append(": ");
        formatExpression(node.getBody(), PREC_LOWEST, sb);
        return null;
    }

    @Override
    public Void visitAnnotatedExpr(AnnotatedExpr node, StringBuilder sb) {
        // 参数列表紧贴名称，主体前保留空格，否则 (expr) 会被读成参数
        for (AnnotatedExpr.Annotation annotation : node.getAnnotations()) {
            sb.append('@').append(annotation.getName());
            if (annotation.hasArgs()) {
                sb.append('(');
                List<CallExpr.Argument> args = annotation.getArgs();
                for (int i = 0; i < args.size(); i++) {
                    if (i > 0) sb.append(", ");
                    if (args.get(i).isNamed()) sb.append(args.get(i).getName()).append('=');
                    formatExpression(args.get(i).getValue(), PREC_LOWEST, sb);
                }
                sb.append(')');
            }
            sb.append(' ');
        }
        formatExpression(node.getBody(), PREC_LOWEST, sb);
        return null;
    }

    /**
     * 双引号字符串字面量；interpolated 时花括号加倍转义
     */
    private static String quote(String text, boolean interpolated) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                case '{':
                case '}':
                    sb.append(c);
                    if (interpolated) sb.append(c);
                    break;
                default: sb.append(c); break;
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
