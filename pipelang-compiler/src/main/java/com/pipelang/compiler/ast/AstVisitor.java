package com.pipelang.compiler.ast;

import com.pipelang.compiler.ast.expr.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitCollectionLiteral(CollectionLiteral node, C ctx) { return null; }

    default R visitComprehensionExpr(ComprehensionExpr node, C ctx) { return null; }

    default R visitStringInterpolation(StringInterpolation node, C ctx) { return null; }

    default R visitLambdaExpr(LambdaExpr node, C ctx) { return null; }

    default R visitAnnotatedExpr(AnnotatedExpr node, C ctx) { return null; }
}
