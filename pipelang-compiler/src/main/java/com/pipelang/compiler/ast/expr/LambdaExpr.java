package com.pipelang.compiler.ast.expr;

import com.pipelang.compiler.ast.AstVisitor;
import com.pipelang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * Lambda 表达式（如 lambda x, y: x + y）
 */
public class LambdaExpr extends Expression {
    private final List<String> params;
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<String> params, Expression body) {
        super(location);
        this.params = params;
        this.body = body;
    }

    public List<String> getParams() {
        return params;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
