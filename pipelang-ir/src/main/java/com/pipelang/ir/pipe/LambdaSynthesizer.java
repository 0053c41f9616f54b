package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.AstScanner;
import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.compiler.ast.expr.LambdaExpr;

import java.util.Collections;

/**
 * 把含占位符的表达式包装为单参数 lambda：{@code lambda Z: expr[_ -> Z]}
 */
public final class LambdaSynthesizer {
    private final String placeholder;
    private final String lambdaVar;

    public LambdaSynthesizer(PipeConfig config) {
        this.placeholder = config.getPlaceholder();
        this.lambdaVar = config.getLambdaVar();
    }

    /**
     * @throws IllegalArgumentException tree 中不含占位符
     */
    public LambdaExpr toLambda(Expression tree) {
        if (!AstScanner.containsIdentifier(tree, placeholder)) {
            throw new IllegalArgumentException("Expression has no `" + placeholder + "` placeholder: "
                    + tree.getNodeKind());
        }
        Expression body = IdentifierSubstitutor.substitute(tree, placeholder, lambdaVar);
        return new LambdaExpr(tree.getLocation(), Collections.singletonList(lambdaVar), body);
    }
}
