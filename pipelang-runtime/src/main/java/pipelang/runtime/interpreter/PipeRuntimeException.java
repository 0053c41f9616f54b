package pipelang.runtime.interpreter;

import com.pipelang.compiler.ast.SourceLocation;

/**
 * 求值期异常
 *
 * 支持源代码位置信息；提供源码行时输出带指示符的错误位置。
 */
public class PipeRuntimeException extends RuntimeException {

    private final SourceLocation location;
    private final String sourceLine;

    public PipeRuntimeException(String message) {
        this(message, null, null, null);
    }

    public PipeRuntimeException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public PipeRuntimeException(String message, SourceLocation location) {
        this(message, location, null, null);
    }

    public PipeRuntimeException(String message, SourceLocation location, String sourceLine, Throwable cause) {
        super(message, cause);
        this.location = location;
        this.sourceLine = sourceLine;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    /** 是否已带有有效位置 */
    public boolean hasLocation() {
        return location != null && location.isKnown();
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    /** 补充位置与源码行，已有位置时返回自身 */
    public PipeRuntimeException withLocation(SourceLocation location, String sourceLine) {
        if (hasLocation() || location == null) return this;
        PipeRuntimeException located = new PipeRuntimeException(getRawMessage(), location, sourceLine, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }

    @Override
    public String getMessage() {
        if (!hasLocation()) {
            return super.getMessage();
        }
        return super.getMessage() + "\n" + formatErrorWithLocation();
    }

    /**
     * 输出格式:
     * <pre>
     *   --> unit:1:6
     *   |
     * 1 | x >> f
     *   |      ^
     * </pre>
     */
    private String formatErrorWithLocation() {
        StringBuilder sb = new StringBuilder();
        String file = location.getFile();
        if (file == null || file.isEmpty()) {
            file = "<script>";
        }
        sb.append("  --> ").append(file)
          .append(":").append(location.getLine())
          .append(":").append(location.getColumn());

        if (sourceLine != null && !sourceLine.isEmpty()) {
            String lineNum = String.valueOf(location.getLine());
            String padding = repeat(" ", lineNum.length());
            sb.append("\n").append(padding).append(" |\n");
            sb.append(lineNum).append(" | ").append(sourceLine).append("\n");
            sb.append(padding).append(" | ");
            sb.append(repeat(" ", location.getColumn() - 1));
            sb.append(repeat("^", Math.max(1, location.getLength())));
        }
        return sb.toString();
    }

    private static String repeat(String s, int count) {
        if (count <= 0) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
