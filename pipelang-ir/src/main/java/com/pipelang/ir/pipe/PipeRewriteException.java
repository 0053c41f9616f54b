package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.SourceLocation;

/**
 * 管道改写异常基类
 */
public class PipeRewriteException extends RuntimeException {
    private final SourceLocation location;

    public PipeRewriteException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (!location.isKnown()) {
            return super.getMessage();
        }
        return super.getMessage() + " at " + location;
    }
}
