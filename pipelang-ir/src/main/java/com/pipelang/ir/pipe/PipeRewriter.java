package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.ir.pass.ExprPass;

/**
 * 管道改写入口
 *
 * <p>把以配置的运算符连接的链改写为等价的嵌套调用，例如（默认配置）：</p>
 * <pre>
 * 3 >> double >> add(1)      →  add(double(3), 1)
 * xs >> _.count(1)           →  xs.count(1)
 * 2 >> _ * 10                →  (lambda Z: Z * 10)(2)
 * </pre>
 *
 * <p>改写前先剥离 {@code @pipes} 标记。实例无可变状态，可在多线程间共享；
 * 每次调用使用独立的 {@link RewriteContext}。</p>
 */
public class PipeRewriter implements ExprPass {

    /** 调试模式下包装每个管道阶段的函数名，由运行时绑定 */
    public static final String DEBUG_TAP_FUNCTION = "__pipe_debug__";

    private final PipeConfig config;

    public PipeRewriter() {
        this(PipeConfig.defaults());
    }

    public PipeRewriter(PipeConfig config) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        this.config = config;
    }

    public static Expression rewrite(Expression tree, PipeConfig config) {
        return new PipeRewriter(config).rewrite(tree);
    }

    /**
     * @throws AmbiguousRewriteException 需要 lambda 包装的右操作数中没有占位符
     */
    public Expression rewrite(Expression tree) {
        Expression stripped = PipeMarkers.strip(tree);
        return new PipeTransformer(config).transform(stripped);
    }

    public PipeConfig getConfig() {
        return config;
    }

    @Override
    public String getName() {
        return "PipeRewriter";
    }

    @Override
    public Expression run(Expression tree) {
        return rewrite(tree);
    }
}
