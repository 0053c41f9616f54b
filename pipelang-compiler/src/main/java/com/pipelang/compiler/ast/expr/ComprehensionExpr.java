package com.pipelang.compiler.ast.expr;

import com.pipelang.compiler.ast.AstNode;
import com.pipelang.compiler.ast.AstVisitor;
import com.pipelang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 推导式（如 [x * 2 for x in xs if x > 0]）
 *
 * <p>DICT 推导式中 element 为键，value 为值；其余种类 value 为 null。</p>
 */
public class ComprehensionExpr extends Expression {
    private final ComprehensionKind kind;
    private final Expression element;
    private final Expression value;
    private final List<Generator> generators;

    public ComprehensionExpr(SourceLocation location, ComprehensionKind kind, Expression element,
                             Expression value, List<Generator> generators) {
        super(location);
        this.kind = kind;
        this.element = element;
        this.value = value;
        this.generators = generators;
    }

    public ComprehensionKind getKind() {
        return kind;
    }

    public Expression getElement() {
        return element;
    }

    public Expression getValue() {
        return value;
    }

    public List<Generator> getGenerators() {
        return generators;
    }

    @Override
    public String getNodeKind() {
        return kind.name() + " comprehension";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionExpr(this, context);
    }

    /**
     * 推导式种类
     */
    public enum ComprehensionKind {
        LIST,
        SET,
        DICT,
        GENERATOR
    }

    /**
     * for 子句：for targets in iterable if cond...
     *
     * <p>targets 是绑定名称，不是 {@link Identifier} 节点。</p>
     */
    public static final class Generator extends AstNode {
        private final List<String> targets;
        private final Expression iterable;
        private final List<Expression> conditions;

        public Generator(SourceLocation location, List<String> targets, Expression iterable,
                         List<Expression> conditions) {
            super(location);
            this.targets = targets;
            this.iterable = iterable;
            this.conditions = conditions != null ? conditions : Collections.emptyList();
        }

        public List<String> getTargets() {
            return targets;
        }

        public Expression getIterable() {
            return iterable;
        }

        public List<Expression> getConditions() {
            return conditions;
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return null;
        }
    }
}
