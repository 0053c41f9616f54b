package com.pipelang.compiler.ast.expr;

import com.pipelang.compiler.ast.AstVisitor;
import com.pipelang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 运算符类别
     */
    public enum Category {
        ARITHMETIC,
        SHIFT,
        BITWISE,
        PIPE,
        COMPARISON,
        LOGICAL
    }

    /**
     * 二元运算符（封闭枚举）
     *
     * <p>precedence 越大绑定越紧，与宿主语法的解析优先级一致。</p>
     */
    public enum BinaryOp {
        // 算术
        ADD("+", Category.ARITHMETIC, 10),
        SUB("-", Category.ARITHMETIC, 10),
        MUL("*", Category.ARITHMETIC, 11),
        DIV("/", Category.ARITHMETIC, 11),
        FLOOR_DIV("//", Category.ARITHMETIC, 11),
        MOD("%", Category.ARITHMETIC, 11),
        MAT_MUL("@", Category.ARITHMETIC, 11),
        POW("**", Category.ARITHMETIC, 13),

        // 移位
        SHL("<<", Category.SHIFT, 9),
        SHR(">>", Category.SHIFT, 9),

        // 位运算
        BIT_AND("&", Category.BITWISE, 8),
        BIT_XOR("^", Category.BITWISE, 7),
        BIT_OR("|", Category.BITWISE, 6),

        // 管道
        PIPE("|>", Category.PIPE, 1),

        // 比较
        EQ("==", Category.COMPARISON, 5),
        NE("!=", Category.COMPARISON, 5),
        LT("<", Category.COMPARISON, 5),
        GT(">", Category.COMPARISON, 5),
        LE("<=", Category.COMPARISON, 5),
        GE(">=", Category.COMPARISON, 5),

        // 逻辑
        AND("and", Category.LOGICAL, 3),
        OR("or", Category.LOGICAL, 2);

        private final String source;
        private final Category category;
        private final int precedence;

        BinaryOp(String source, Category category, int precedence) {
            this.source = source;
            this.category = category;
            this.precedence = precedence;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public Category getCategory() {
            return category;
        }

        public int getPrecedence() {
            return precedence;
        }

        /** 右结合运算符（仅 **） */
        public boolean isRightAssociative() {
            return this == POW;
        }

        /**
         * 按源码符号查找运算符
         *
         * @return 对应运算符，未知符号返回 null
         */
        public static BinaryOp fromSource(String token) {
            if (token == null) return null;
            for (BinaryOp op : values()) {
                if (op.source.equals(token)) return op;
            }
            return null;
        }
    }
}
