package com.pipelang.ir.pipe;

import com.pipelang.compiler.ast.SourceLocation;

/**
 * 右操作数是需要 lambda 包装的节点，但其中没有占位符
 */
public class AmbiguousRewriteException extends PipeRewriteException {
    private final String nodeKind;
    private final String placeholder;

    public AmbiguousRewriteException(String nodeKind, String placeholder, SourceLocation location) {
        super("`" + nodeKind + "` operation requires the `" + placeholder + "` variable at least once",
                location);
        this.nodeKind = nodeKind;
        this.placeholder = placeholder;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public String getPlaceholder() {
        return placeholder;
    }
}
