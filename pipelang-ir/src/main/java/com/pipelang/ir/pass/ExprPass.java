package com.pipelang.ir.pass;

import com.pipelang.compiler.ast.expr.Expression;

/**
 * 表达式树 pass 接口。
 */
public interface ExprPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对表达式树执行变换，返回新树（无变化时可返回原树）。
     */
    Expression run(Expression tree);
}
