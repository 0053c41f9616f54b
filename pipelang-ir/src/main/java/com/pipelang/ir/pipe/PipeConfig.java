package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pipelang.compiler.ast.expr.BinaryExpr.Category;
import com.pipelang.compiler.lexer.Lexer;

import java.util.Objects;

/**
 * 管道改写配置（不可变）
 *
 * <p>默认值：运算符 {@code >>}，占位符 {@code _}，lambda 变量 {@code Z}，
 * 方向 {@link Direction#FORWARD}，关闭调试。</p>
 */
public final class PipeConfig {

    public static final String DEFAULT_OPERATOR = ">>";
    public static final String DEFAULT_PLACEHOLDER = "_";
    public static final String DEFAULT_LAMBDA_VAR = "Z";

    private static final PipeConfig DEFAULTS = builder().build();

    /**
     * 管道值插入调用参数的位置
     */
    public enum Direction {
        /** 作为第一个位置参数 */
        FORWARD,
        /** 作为最后一个位置参数 */
        REVERSE
    }

    private final BinaryOp operator;
    private final String placeholder;
    private final String lambdaVar;
    private final Direction direction;
    private final boolean debug;

    private PipeConfig(Builder builder) {
        this.operator = resolveOperator(builder.operator);
        this.placeholder = requireIdentifier("placeholder", builder.placeholder);
        this.lambdaVar = requireIdentifier("lambdaVar", builder.lambdaVar);
        if (placeholder.equals(lambdaVar)) {
            throw new PipeConfigurationException("placeholder and lambdaVar must differ, both are `"
                    + placeholder + "`");
        }
        if (builder.direction == null) {
            throw new PipeConfigurationException("direction must not be null");
        }
        this.direction = builder.direction;
        this.debug = builder.debug;
    }

    public static PipeConfig defaults() {
        return DEFAULTS;
    }

    public static PipeConfig of(String operator, String placeholder, String lambdaVar) {
        return builder().operator(operator).placeholder(placeholder).lambdaVar(lambdaVar).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 以当前配置为初始值的构建器 */
    public Builder toBuilder() {
        return new Builder()
                .operator(operator.toSourceString())
                .placeholder(placeholder)
                .lambdaVar(lambdaVar)
                .direction(direction)
                .debug(debug);
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public String getLambdaVar() {
        return lambdaVar;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isDebug() {
        return debug;
    }

    private static BinaryOp resolveOperator(String token) {
        BinaryOp op = BinaryOp.fromSource(token);
        if (op == null) {
            throw new PipeConfigurationException("Unknown pipe operator: " + token);
        }
        Category category = op.getCategory();
        if (category != Category.ARITHMETIC && category != Category.SHIFT
                && category != Category.BITWISE && category != Category.PIPE) {
            throw new PipeConfigurationException("Operator `" + token
                    + "` cannot be used as a pipe token (" + category + ")");
        }
        return op;
    }

    private static String requireIdentifier(String what, String name) {
        if (!Lexer.isValidIdentifier(name)) {
            throw new PipeConfigurationException(what + " is not a valid identifier: " + name);
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipeConfig)) return false;
        PipeConfig that = (PipeConfig) o;
        return debug == that.debug
                && operator == that.operator
                && placeholder.equals(that.placeholder)
                && lambdaVar.equals(that.lambdaVar)
                && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, placeholder, lambdaVar, direction, debug);
    }

    @Override
    public String toString() {
        return "PipeConfig{operator=" + operator.toSourceString()
                + ", placeholder=" + placeholder
                + ", lambdaVar=" + lambdaVar
                + ", direction=" + direction
                + ", debug=" + debug + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private String operator = DEFAULT_OPERATOR;
        private String placeholder = DEFAULT_PLACEHOLDER;
        private String lambdaVar = DEFAULT_LAMBDA_VAR;
        private Direction direction = Direction.FORWARD;
        private boolean debug = false;

        Builder() {
        }

        public Builder operator(String operator) {
            this.operator = operator;
            return this;
        }

        public Builder placeholder(String placeholder) {
            this.placeholder = placeholder;
            return this;
        }

        public Builder lambdaVar(String lambdaVar) {
            this.lambdaVar = lambdaVar;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /**
         * @throws PipeConfigurationException 配置非法
         */
        public PipeConfig build() {
            return new PipeConfig(this);
        }
    }
}
