package com.pipelang.ir.pass;

import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.ir.pipe.PipeConfig;
import com.pipelang.ir.pipe.PipeRewriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 表达式 pass 管线，按添加顺序依次执行。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<ExprPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线（仅包含管道改写）。
     */
    public static PassPipeline createDefault(PipeConfig config) {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new PipeRewriter(config));
        return pipeline;
    }

    public PassPipeline addPass(ExprPass pass) {
        passes.add(pass);
        return this;
    }

    public List<ExprPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * 执行全部 pass。任一 pass 抛出的异常直接向上传播。
     */
    public Expression execute(Expression tree) {
        Expression current = tree;
        for (ExprPass pass : passes) {
            long start = System.nanoTime();
            Expression next = pass.run(current);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("pass %s: %s (%d us)", pass.getName(),
                        next == current ? "unchanged" : "rewritten",
                        (System.nanoTime() - start) / 1000));
            }
            current = next;
        }
        return current;
    }
}
