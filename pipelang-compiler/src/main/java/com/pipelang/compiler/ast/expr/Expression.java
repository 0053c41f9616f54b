package com.pipelang.compiler.ast.expr;

import com.pipelang.compiler.ast.AstNode;
import com.pipelang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    /**
     * 节点种类名称（用于诊断信息）
     */
    public String getNodeKind() {
        return getClass().getSimpleName();
    }
}
