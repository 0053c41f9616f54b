package com.pipelang.compiler.ast;

/**
 * 源码位置：编译单元名、行列（从 1 开始）与字符偏移
 *
 * <p>合成节点（lambda 包装、调试探针）沿用被改写节点的位置；
 * 无法定位时为 {@link #UNKNOWN}，其行号为 0。</p>
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    /**
     * 是否指向真实源码（诊断里才输出 --> 指示行）
     */
    public boolean isKnown() {
        return line > 0;
    }

    /**
     * 诊断形式 file:line:col
     */
    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
