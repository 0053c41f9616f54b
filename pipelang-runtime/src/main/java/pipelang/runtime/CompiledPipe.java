package pipelang.runtime;

import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.compiler.formatter.ExprFormatter;
import com.pipelang.ir.pipe.PipeConfig;
import pipelang.runtime.interpreter.Interpreter;

import java.util.Collections;
import java.util.Map;

/**
 * 已完成管道改写的表达式（不可变，可被多个线程共享求值）
 *
 * <pre>
 * CompiledPipe pipe = new Pipes().compile("x >> double >> add(1)", "rule");
 * Object result = pipe.eval(Map.of("x", 3L, "double", ..., "add", ...));
 * </pre>
 */
public final class CompiledPipe {

    private final String unitName;
    private final String source;              // nullable
    private final Expression original;
    private final Expression rewritten;
    private final PipeConfig config;

    CompiledPipe(String unitName, String source, Expression original, Expression rewritten, PipeConfig config) {
        this.unitName = unitName;
        this.source = source;
        this.original = original;
        this.rewritten = rewritten;
        this.config = config;
    }

    public String getUnitName() {
        return unitName;
    }

    /** 编译时的源码；由已解析的树编译时为 null */
    public String getSource() {
        return source;
    }

    public Expression getOriginal() {
        return original;
    }

    public Expression getRewritten() {
        return rewritten;
    }

    /** 生效的配置（默认配置叠加 @pipes 标记参数） */
    public PipeConfig getConfig() {
        return config;
    }

    /** 改写结果的源码形式 */
    public String getRewrittenSource() {
        return ExprFormatter.format(rewritten);
    }

    /**
     * 用新的解释器在给定绑定表中求值
     */
    public Object eval(Map<String, ?> bindings) {
        return eval(new Interpreter(), bindings);
    }

    public Object eval() {
        return eval(Collections.emptyMap());
    }

    /**
     * 用给定解释器求值，bindings 放在解释器全局环境之下的新作用域中
     */
    public Object eval(Interpreter interpreter, Map<String, ?> bindings) {
        interpreter.setSource(source);
        return interpreter.evaluate(rewritten, interpreter.createScope(bindings));
    }

    @Override
    public String toString() {
        return "CompiledPipe{" + unitName + ": " + getRewrittenSource() + "}";
    }
}
