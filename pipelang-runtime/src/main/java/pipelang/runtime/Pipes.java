package pipelang.runtime;

import com.pipelang.compiler.ast.expr.Expression;
import com.pipelang.compiler.parser.Parser;
import com.pipelang.ir.pass.PassPipeline;
import com.pipelang.ir.pipe.PipeConfig;
import com.pipelang.ir.pipe.PipeMarkers;
import pipelang.runtime.interpreter.Interpreter;
import pipelang.runtime.interpreter.cache.BoundedCache;
import pipelang.runtime.interpreter.cache.CacheStats;
import pipelang.runtime.interpreter.cache.CaffeineCache;

import java.io.PrintStream;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 管道表达式便捷 API：解析、读取标记配置、改写、求值。
 *
 * <p>静态调用：</p>
 * <pre>
 * Object result = Pipes.run("[3, 1, 2] >> sorted");
 * </pre>
 *
 * <p>实例调用（共享编译缓存与输出设置）：</p>
 * <pre>
 * Pipes pipes = new Pipes();
 * CompiledPipe rule = pipes.compile("@pipes(debug=True) x >> double >> add(1)", "rule");
 * Object value = pipes.eval(rule, bindings);
 * </pre>
 *
 * <p>源码编译结果按（单元名、源码、默认配置）缓存，缓存线程安全；
 * 求值每次使用新的 {@link Interpreter}。</p>
 */
public final class Pipes {

    private static final Logger LOG = Logger.getLogger(Pipes.class.getName());

    public static final long DEFAULT_CACHE_SIZE = 256;
    private static final String DEFAULT_UNIT_NAME = "<pipe>";

    private final PipeConfig defaultConfig;
    private final BoundedCache<CacheKey, CompiledPipe> cache;
    private volatile PrintStream stdout = System.out;
    private volatile Consumer<Object> debugObserver;

    public Pipes() {
        this(PipeConfig.defaults());
    }

    public Pipes(PipeConfig defaultConfig) {
        this(defaultConfig, DEFAULT_CACHE_SIZE);
    }

    public Pipes(PipeConfig defaultConfig, long cacheSize) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.cache = new CaffeineCache<>(cacheSize);
    }

    /**
     * 一次性求值（默认配置）
     */
    public static Object run(String source) {
        return new Pipes().eval(source, Collections.emptyMap());
    }

    public static Object run(String source, Map<String, ?> bindings) {
        return new Pipes().eval(source, bindings);
    }

    // ── 配置 ─────────────────────────────────────────

    public PipeConfig getDefaultConfig() {
        return defaultConfig;
    }

    public Pipes setStdout(PrintStream out) {
        this.stdout = Objects.requireNonNull(out, "out");
        return this;
    }

    /**
     * 调试模式下每个管道阶段的值都会交给该观察者；未设置时打印到 stdout
     */
    public Pipes setDebugObserver(Consumer<Object> observer) {
        this.debugObserver = observer;
        return this;
    }

    // ── 编译 ─────────────────────────────────────────

    /**
     * 编译源码（带缓存）
     *
     * @throws com.pipelang.compiler.parser.ParseException 语法错误
     * @throws com.pipelang.ir.pipe.PipeConfigurationException 标记参数非法
     * @throws com.pipelang.ir.pipe.AmbiguousRewriteException 运算右操作数缺少占位符
     */
    public CompiledPipe compile(String source, String unitName) {
        Objects.requireNonNull(source, "source");
        String unit = unitName != null ? unitName : DEFAULT_UNIT_NAME;
        return cache.computeIfAbsent(new CacheKey(unit, source, defaultConfig), key -> {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("compile cache miss: " + unit);
            }
            Expression tree = Parser.parse(source, unit);
            return compile(tree, defaultConfig, unit, source);
        });
    }

    public CompiledPipe compile(String source) {
        return compile(source, DEFAULT_UNIT_NAME);
    }

    /**
     * 编译已解析的树（不缓存）。根部 {@code @pipes(...)} 标记的参数叠加在 config 之上。
     */
    public CompiledPipe compile(Expression tree, PipeConfig config, String unitName) {
        return compile(tree, config, unitName != null ? unitName : DEFAULT_UNIT_NAME, null);
    }

    private static CompiledPipe compile(Expression tree, PipeConfig config, String unitName, String source) {
        PipeConfig effective = PipeMarkers.configure(tree, config);
        Expression rewritten = PassPipeline.createDefault(effective).execute(tree);
        return new CompiledPipe(unitName, source, tree, rewritten, effective);
    }

    // ── 求值 ─────────────────────────────────────────

    public Object eval(String source, Map<String, ?> bindings) {
        return eval(compile(source), bindings);
    }

    public Object eval(String source) {
        return eval(source, Collections.emptyMap());
    }

    /**
     * 用按当前输出设置创建的解释器求值
     */
    public Object eval(CompiledPipe compiled, Map<String, ?> bindings) {
        return compiled.eval(newInterpreter(), bindings);
    }

    /**
     * 创建带当前 stdout 与调试观察者设置的解释器
     */
    public Interpreter newInterpreter() {
        Interpreter interpreter = new Interpreter();
        interpreter.setStdout(stdout);
        interpreter.setDebugObserver(debugObserver);
        return interpreter;
    }

    // ── 缓存 ─────────────────────────────────────────

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public long getCacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    private static final class CacheKey {
        private final String unitName;
        private final String source;
        private final PipeConfig config;

        CacheKey(String unitName, String source, PipeConfig config) {
            this.unitName = unitName;
            this.source = source;
            this.config = config;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CacheKey)) return false;
            CacheKey that = (CacheKey) o;
            return unitName.equals(that.unitName) && source.equals(that.source) && config.equals(that.config);
        }

        @Override
        public int hashCode() {
            return Objects.hash(unitName, source, config);
        }
    }
}
