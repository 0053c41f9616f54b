package com.pipelang.compiler.ast.expr;

import com.pipelang.compiler.ast.AstNode;
import com.pipelang.compiler.ast.AstVisitor;
import com.pipelang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调用表达式
 *
 * <p>参数按源码顺序保存；位置参数与命名参数可通过
 * {@link #getPositionalArgs()} / {@link #getNamedArgs()} 分别获取。</p>
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Argument> args;

    public CallExpr(SourceLocation location, Expression callee, List<Argument> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * 仅含位置参数的调用
     */
    public static CallExpr of(SourceLocation location, Expression callee, List<Expression> positional) {
        List<Argument> args = new ArrayList<>(positional.size());
        for (Expression e : positional) {
            args.add(Argument.positional(e));
        }
        return new CallExpr(location, callee, args);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Argument> getArgs() {
        return args;
    }

    public List<Argument> getPositionalArgs() {
        List<Argument> result = new ArrayList<>();
        for (Argument arg : args) {
            if (!arg.isNamed()) result.add(arg);
        }
        return result;
    }

    public List<Argument> getNamedArgs() {
        List<Argument> result = new ArrayList<>();
        for (Argument arg : args) {
            if (arg.isNamed()) result.add(arg);
        }
        return result;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    /**
     * 调用参数
     */
    public static final class Argument extends AstNode {
        private final String name;           // 命名参数
        private final Expression value;

        public Argument(SourceLocation location, String name, Expression value) {
            super(location);
            this.name = name;
            this.value = value;
        }

        public static Argument positional(Expression value) {
            return new Argument(value.getLocation(), null, value);
        }

        public String getName() {
            return name;
        }

        public boolean isNamed() {
            return name != null;
        }

        public Expression getValue() {
            return value;
        }

        /** 替换参数值，保留名称与位置 */
        public Argument withValue(Expression newValue) {
            if (newValue == value) return this;
            return new Argument(location, name, newValue);
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return null;
        }
    }
}
