package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.AstTransformer;
import com.pipelang.compiler.ast.expr.Expression;

/**
 * 单次改写调用的上下文：配置、lambda 合成器与用于重访新节点的变换器。
 * 每次顶层 rewrite 新建，不跨调用共享。
 */
final class RewriteContext {
    private final PipeConfig config;
    private final LambdaSynthesizer synthesizer;
    private final AstTransformer transformer;

    RewriteContext(PipeConfig config, AstTransformer transformer) {
        this.config = config;
        this.synthesizer = new LambdaSynthesizer(config);
        this.transformer = transformer;
    }

    PipeConfig getConfig() {
        return config;
    }

    LambdaSynthesizer getSynthesizer() {
        return synthesizer;
    }

    /** 重新访问刚构造的子树，展开其中剩余的管道 */
    Expression revisit(Expression node) {
        return transformer.transform(node);
    }
}
