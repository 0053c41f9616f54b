package com.pipelang.compiler.ast;

import com.pipelang.compiler.ast.expr.*;

/**
 * 只读深度遍历。子类覆盖 visit 方法收集信息，
 * 默认实现访问所有子表达式（含 Lambda 体与推导式子句）。
 */
public class AstScanner implements AstVisitor<Void, Void> {

    public void scan(Expression node) {
        if (node != null) node.accept(this, null);
    }

    /**
     * 子树中是否存在名为 name 的 {@link Identifier}
     */
    public static boolean containsIdentifier(Expression tree, String name) {
        IdentifierFinder finder = new IdentifierFinder(name);
        finder.scan(tree);
        return finder.found;
    }

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, Void ctx) {
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, Void ctx) {
        scan(node.getTarget());
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        scan(node.getCallee());
        for (CallExpr.Argument arg : node.getArgs()) {
            scan(arg.getValue());
        }
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        scan(node.getLeft());
        scan(node.getRight());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        scan(node.getOperand());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, Void ctx) {
        scan(node.getTarget());
        scan(node.getIndex());
        return null;
    }

    @Override
    public Void visitCollectionLiteral(CollectionLiteral node, Void ctx) {
        for (Expression element : node.getElements()) {
            scan(element);
        }
        for (CollectionLiteral.MapEntry entry : node.getMapEntries()) {
            scan(entry.getKey());
            scan(entry.getValue());
        }
        return null;
    }

    @Override
    public Void visitComprehensionExpr(ComprehensionExpr node, Void ctx) {
        scan(node.getElement());
        scan(node.getValue());
        for (ComprehensionExpr.Generator gen : node.getGenerators()) {
            scan(gen.getIterable());
            for (Expression cond : gen.getConditions()) {
                scan(cond);
            }
        }
        return null;
    }

    @Override
    public Void visitStringInterpolation(StringInterpolation node, Void ctx) {
        for (StringInterpolation.StringPart part : node.getParts()) {
            if (part instanceof StringInterpolation.ExprPart) {
                scan(((StringInterpolation.ExprPart) part).getExpression());
            }
        }
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, Void ctx) {
        scan(node.getBody());
        return null;
    }

    @Override
    public Void visitAnnotatedExpr(AnnotatedExpr node, Void ctx) {
        for (AnnotatedExpr.Annotation annotation : node.getAnnotations()) {
            for (CallExpr.Argument arg : annotation.getArgs()) {
                scan(arg.getValue());
            }
        }
        scan(node.getBody());
        return null;
    }

    private static final class IdentifierFinder extends AstScanner {
        private final String name;
        private boolean found;

        IdentifierFinder(String name) {
            this.name = name;
        }

        @Override
        public void scan(Expression node) {
            if (!found) super.scan(node);
        }

        @Override
        public Void visitIdentifier(Identifier node, Void ctx) {
            if (node.is(name)) found = true;
            return null;
        }
    }
}
