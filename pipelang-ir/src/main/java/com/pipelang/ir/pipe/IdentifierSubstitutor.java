package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.AstTransformer;
import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.compiler.ast.expr.Identifier;

/**
 * 标识符替换：把子树中所有 {@code Identifier(target)} 换成 {@code Identifier(replacement)}。
 *
 * <p>lambda 参数名与推导式目标名是绑定名（字符串），不参与替换。
 * 未命中的子树保持原实例。</p>
 */
public final class IdentifierSubstitutor extends AstTransformer {
    private final String target;
    private final String replacement;

    private IdentifierSubstitutor(String target, String replacement) {
        this.target = target;
        this.replacement = replacement;
    }

    /**
     * @throws IllegalArgumentException target 与 replacement 相同
     */
    public static Expression substitute(Expression tree, String target, String replacement) {
        if (target.equals(replacement)) {
            throw new IllegalArgumentException("Cannot substitute `" + target + "` with itself");
        }
        return new IdentifierSubstitutor(target, replacement).transform(tree);
    }

    @Override
    public Expression visitIdentifier(Identifier node, Void ctx) {
        if (node.is(target)) {
            return new Identifier(node.getLocation(), replacement);
        }
        return node;
    }
}
