package com.pipelang.compiler.ast.expr;

import com.pipelang.compiler.ast.AstNode;
import com.pipelang.compiler.ast.AstVisitor;
import com.pipelang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 带前缀标记的表达式（如 @pipes(placeholder="__") a >> f）
 *
 * <p>标记只在编译期有意义，求值时直接求值 body。</p>
 */
public class AnnotatedExpr extends Expression {
    private final List<Annotation> annotations;
    private final Expression body;

    public AnnotatedExpr(SourceLocation location, List<Annotation> annotations, Expression body) {
        super(location);
        this.annotations = annotations;
        this.body = body;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public Expression getBody() {
        return body;
    }

    public Annotation findAnnotation(String name) {
        for (Annotation annotation : annotations) {
            if (annotation.getName().equals(name)) return annotation;
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnnotatedExpr(this, context);
    }

    /**
     * 单个标记：@name 或 @name(args)
     */
    public static final class Annotation extends AstNode {
        private final String name;
        private final List<CallExpr.Argument> args;

        public Annotation(SourceLocation location, String name, List<CallExpr.Argument> args) {
            super(location);
            this.name = name;
            this.args = args != null ? args : Collections.emptyList();
        }

        public String getName() {
            return name;
        }

        public List<CallExpr.Argument> getArgs() {
            return args;
        }

        public boolean hasArgs() {
            return !args.isEmpty();
        }

        public Annotation withArgs(List<CallExpr.Argument> newArgs) {
            return newArgs == args ? this : new Annotation(getLocation(), name, newArgs);
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return null;
        }
    }
}
