package com.pipelang.compiler.ast;

import com.pipelang.compiler.ast.expr.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点。
 * 子类可覆盖特定 visit 方法实现改写 pass。
 */
public class AstTransformer implements AstVisitor<Expression, Void> {

    /**
     * 变换入口。
     */
    public Expression transform(Expression node) {
        if (node == null) return null;
        Expression result = node.accept(this, null);
        return result != null ? result : node;
    }

    // ==================== 辅助方法 ====================

    protected List<Expression> transformExprs(List<Expression> exprs) {
        if (exprs == null || exprs.isEmpty()) return exprs;
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression transformed = transform(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(exprs.size());
                for (int j = 0; j < i; j++) result.add(exprs.get(j));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : exprs;
    }

    protected List<CallExpr.Argument> transformArgs(List<CallExpr.Argument> args) {
        if (args == null || args.isEmpty()) return args;
        List<CallExpr.Argument> result = null;
        for (int i = 0; i < args.size(); i++) {
            CallExpr.Argument original = args.get(i);
            CallExpr.Argument transformed = original.withValue(transform(original.getValue()));
            if (transformed != original && result == null) {
                result = new ArrayList<>(args.size());
                for (int j = 0; j < i; j++) result.add(args.get(j));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : args;
    }

    // ==================== 叶节点（直接返回） ====================

    @Override
    public Expression visitIdentifier(Identifier node, Void ctx) {
        return node;
    }

    @Override
    public Expression visitLiteral(Literal node, Void ctx) {
        return node;
    }

    // ==================== 复合节点 ====================

    @Override
    public Expression visitMemberExpr(MemberExpr node, Void ctx) {
        Expression target = transform(node.getTarget());
        if (target == node.getTarget()) return node;
        return new MemberExpr(node.getLocation(), target, node.getMember());
    }

    @Override
    public Expression visitCallExpr(CallExpr node, Void ctx) {
        Expression callee = transform(node.getCallee());
        List<CallExpr.Argument> args = transformArgs(node.getArgs());
        if (callee == node.getCallee() && args == node.getArgs()) return node;
        return new CallExpr(node.getLocation(), callee, args);
    }

    @Override
    public Expression visitBinaryExpr(BinaryExpr node, Void ctx) {
        Expression left = transform(node.getLeft());
        Expression right = transform(node.getRight());
        if (left == node.getLeft() && right == node.getRight()) return node;
        return new BinaryExpr(node.getLocation(), left, node.getOperator(), right);
    }

    @Override
    public Expression visitUnaryExpr(UnaryExpr node, Void ctx) {
        Expression operand = transform(node.getOperand());
        if (operand == node.getOperand()) return node;
        return new UnaryExpr(node.getLocation(), node.getOperator(), operand);
    }

    @Override
    public Expression visitIndexExpr(IndexExpr node, Void ctx) {
        Expression target = transform(node.getTarget());
        Expression index = transform(node.getIndex());
        if (target == node.getTarget() && index == node.getIndex()) return node;
        return new IndexExpr(node.getLocation(), target, index);
    }

    @Override
    public Expression visitCollectionLiteral(CollectionLiteral node, Void ctx) {
        List<Expression> elements = transformExprs(node.getElements());
        List<CollectionLiteral.MapEntry> entries = node.getMapEntries();
        List<CollectionLiteral.MapEntry> newEntries = null;
        for (int i = 0; i < entries.size(); i++) {
            CollectionLiteral.MapEntry entry = entries.get(i);
            Expression key = transform(entry.getKey());
            Expression value = transform(entry.getValue());
            boolean changed = key != entry.getKey() || value != entry.getValue();
            if (changed && newEntries == null) {
                newEntries = new ArrayList<>(entries.size());
                for (int j = 0; j < i; j++) newEntries.add(entries.get(j));
            }
            if (newEntries != null) {
                newEntries.add(changed
                        ? new CollectionLiteral.MapEntry(entry.getLocation(), key, value)
                        : entry);
            }
        }
        List<CollectionLiteral.MapEntry> finalEntries = newEntries != null ? newEntries : entries;
        if (elements == node.getElements() && finalEntries == entries) return node;
        return new CollectionLiteral(node.getLocation(), node.getKind(), elements, finalEntries);
    }

    @Override
    public Expression visitComprehensionExpr(ComprehensionExpr node, Void ctx) {
        Expression element = transform(node.getElement());
        Expression value = transform(node.getValue());
        List<ComprehensionExpr.Generator> generators = node.getGenerators();
        List<ComprehensionExpr.Generator> newGenerators = null;
        for (int i = 0; i < generators.size(); i++) {
            ComprehensionExpr.Generator gen = generators.get(i);
            Expression iterable = transform(gen.getIterable());
            List<Expression> conditions = transformExprs(gen.getConditions());
            boolean changed = iterable != gen.getIterable() || conditions != gen.getConditions();
            if (changed && newGenerators == null) {
                newGenerators = new ArrayList<>(generators.size());
                for (int j = 0; j < i; j++) newGenerators.add(generators.get(j));
            }
            if (newGenerators != null) {
                newGenerators.add(changed
                        ? new ComprehensionExpr.Generator(gen.getLocation(), gen.getTargets(), iterable, conditions)
                        : gen);
            }
        }
        List<ComprehensionExpr.Generator> finalGenerators = newGenerators != null ? newGenerators : generators;
        if (element == node.getElement() && value == node.getValue()
                && finalGenerators == generators) return node;
        return new ComprehensionExpr(node.getLocation(), node.getKind(), element, value, finalGenerators);
    }

    @Override
    public Expression visitStringInterpolation(StringInterpolation node, Void ctx) {
        List<StringInterpolation.StringPart> parts = node.getParts();
        List<StringInterpolation.StringPart> newParts = null;
        for (int i = 0; i < parts.size(); i++) {
            StringInterpolation.StringPart part = parts.get(i);
            StringInterpolation.StringPart transformed = part;
            if (part instanceof StringInterpolation.ExprPart) {
                StringInterpolation.ExprPart ep = (StringInterpolation.ExprPart) part;
                Expression expr = transform(ep.getExpression());
                if (expr != ep.getExpression()) {
                    transformed = new StringInterpolation.ExprPart(ep.getLocation(), expr);
                }
            }
            if (transformed != part && newParts == null) {
                newParts = new ArrayList<>(parts.size());
                for (int j = 0; j < i; j++) newParts.add(parts.get(j));
            }
            if (newParts != null) newParts.add(transformed);
        }
        if (newParts == null) return node;
        return new StringInterpolation(node.getLocation(), newParts);
    }

    @Override
    public Expression visitLambdaExpr(LambdaExpr node, Void ctx) {
        Expression body = transform(node.getBody());
        if (body == node.getBody()) return node;
        return new LambdaExpr(node.getLocation(), node.getParams(), body);
    }

    @Override
    public Expression visitAnnotatedExpr(AnnotatedExpr node, Void ctx) {
        List<AnnotatedExpr.Annotation> annotations = transformAnnotations(node.getAnnotations());
        Expression body = transform(node.getBody());
        if (annotations == node.getAnnotations() && body == node.getBody()) return node;
        return new AnnotatedExpr(node.getLocation(), annotations, body);
    }

    /**
     * 变换标记参数；全部未变时返回原列表
     */
    protected List<AnnotatedExpr.Annotation> transformAnnotations(List<AnnotatedExpr.Annotation> annotations) {
        List<AnnotatedExpr.Annotation> result = null;
        for (int i = 0; i < annotations.size(); i++) {
            AnnotatedExpr.Annotation original = annotations.get(i);
            AnnotatedExpr.Annotation transformed = original.withArgs(transformArgs(original.getArgs()));
            if (transformed != original && result == null) {
                result = new ArrayList<>(annotations.size());
                for (int j = 0; j < i; j++) result.add(annotations.get(j));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : annotations;
    }
}
