package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.SourceLocation;

/**
 * 管道配置非法（占位符与 lambda 变量冲突、名称不是合法标识符、运算符不可用作管道等）
 */
public class PipeConfigurationException extends PipeRewriteException {

    public PipeConfigurationException(String message) {
        super(message, SourceLocation.UNKNOWN);
    }

    public PipeConfigurationException(String message, SourceLocation location) {
        super(message, location);
    }
}
