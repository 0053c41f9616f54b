package pipelang.runtime;

import com.pipelang.compiler.parser.ParseException;
import com.pipelang.compiler.parser.Parser;
import com.pipelang.ir.pipe.AmbiguousRewriteException;
import com.pipelang.ir.pipe.PipeConfig;
import com.pipelang.ir.pipe.PipeConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pipelang.runtime.interpreter.NativeFunction;
import pipelang.runtime.interpreter.PipeRuntimeException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Pipes 便捷 API")
class PipesTest {

    private Pipes pipes;
    private Map<String, Object> bindings;

    @BeforeEach
    void setUp() {
        pipes = new Pipes();
        bindings = new HashMap<>();
        bindings.put("add", NativeFunction.create("add", (a, b) -> (Long) a + (Long) b));
        bindings.put("double", NativeFunction.create("double", a -> 2 * (Long) a));
        bindings.put("_sum", NativeFunction.varargs("_sum", (interp, args, kwargs) -> {
            long total = 0;
            for (Object arg : args) total += (Long) arg;
            return total;
        }));
        bindings.put("rshift", NativeFunction.create("rshift", (a, b) -> (Long) a >> (Long) b));
        bindings.put("BasicClass", BasicClass.class);
    }

    private Object eval(String source) {
        return pipes.eval(source, bindings);
    }

    // ── 管道链求值 ──────────────────────────────────────

    @Nested
    @DisplayName("管道链求值")
    class Chains {

        @Test
        @DisplayName("左结合：3 >> double >> add(1) = 7")
        void leftAssociative() {
            assertThat(eval("3 >> double >> add(1)")).isEqualTo(7L);
        }

        @Test
        @DisplayName("函数调用")
        void functionCalls() {
            assertThat(eval("1 >> double >> double() >> add(1) >> _sum(2, 3)")).isEqualTo(10L);
        }

        @Test
        @DisplayName("二元运算")
        void binaryOperators() {
            bindings.put("x", 50L);
            String source = "1_000 >> _ + 3 >> double >> _ + _ >> _ * 10 + 3 >> 10 + _ - 5"
                    + " >> 10 - 12 + _ >> 1 + _ + _ + 1 >> _ + x";
            assertThat(eval(source)).isEqualTo(80304L);
        }

        @Test
        @DisplayName("lambda 调用")
        void lambdaCalls() {
            assertThat(eval("2 >> (lambda a: a ** 2) >> (lambda a: a ** 2)")).isEqualTo(16L);
        }

        @Test
        @DisplayName("右操作数中的 >> 不参与管道")
        void shiftInsideCallUntouched() {
            assertThat(eval("1000 >> rshift(4)")).isEqualTo(62L);
            assertThat(eval("rshift(1000, 4)")).isEqualTo(62L);
        }

        @Test
        @DisplayName("lambda 变量与外部绑定同名时以管道值为准")
        void customNames() {
            bindings.put("foo", 10L);
            assertThat(eval("@pipes() 33 >> double >> add(10) >> _ + foo")).isEqualTo(86L);
            assertThat(eval("@pipes(placeholder='__', lambda_var='foo') 33 >> double >> add(10) >> __ + foo"))
                    .isEqualTo(152L);
        }

        @Test
        @DisplayName("逐步计分")
        void computeScore() {
            bindings.put("value", 1L);
            assertThat(eval("value >> double >> add(10) >> _sum(1, 2, 3, 4) >> pow(2) >> add(-20) >> double"))
                    .isEqualTo(928L);
        }

        @Test
        @DisplayName("tap 只做副作用")
        void tap() {
            List<Object> seen = new ArrayList<>();
            bindings.put("record", (Function<Object, Object>) v -> {
                seen.add(v);
                return "ignored";
            });
            assertThat(eval("4 >> add(10) >> tap(lambda a: a ** 3) >> tap(double) >> double"
                    + " >> tap(lambda a: a ** 3) >> add(1)")).isEqualTo(29L);
            assertThat(eval("5 >> tap(record) >> double")).isEqualTo(10L);
            assertThat(seen).containsExactly(5L);
        }

        @Test
        @DisplayName("REVERSE 方向把值放在最后一个位置参数")
        void reverseDirection() {
            bindings.put("sub", NativeFunction.create("sub", (a, b) -> (Long) a - (Long) b));
            assertThat(eval("@pipes(direction='reverse') 3 >> sub(10)")).isEqualTo(7L);
            assertThat(eval("3 >> sub(10)")).isEqualTo(-7L);
        }

        @Test
        @DisplayName("内置值上的方法与推导式")
        void builtinValues() {
            assertThat(eval("' a,b ,c ' >> _.strip() >> _.split(',') >> [s.strip() for s in _] >> ', '.join()"))
                    .isEqualTo("a, b, c");
            assertThat(eval("range(5) >> [x * x for x in _ if x % 2 == 0] >> sum")).isEqualTo(20L);
            assertThat(eval("{'a': 1} >> _.get('a') >> f\"a={_}\"")).isEqualTo("a=1");
        }
    }

    // ── 宿主类 ──────────────────────────────────────────

    @Nested
    @DisplayName("宿主类")
    class HostClasses {

        @Test
        @DisplayName("类作为可调用对象")
        void classCalls() {
            Object result = eval("1 >> BasicClass >> _.value >> BasicClass()");
            assertThat(result).isInstanceOf(BasicClass.class);
            assertThat(((BasicClass) result).value).isEqualTo(1L);
        }

        @Test
        @DisplayName("属性与 getter")
        void attributeCalls() {
            assertThat(eval("33 >> BasicClass >> _.value")).isEqualTo(33L);
            assertThat(eval("33 >> BasicClass >> _.valueProperty")).isEqualTo(33L);
        }

        @Test
        @DisplayName("方法调用")
        void methodCalls() {
            assertThat(eval("33 >> BasicClass >> _.getValueMethod()")).isEqualTo(33L);
            assertThat(eval("33 >> BasicClass >> _.getValuePlusArg(10)")).isEqualTo(43L);
        }

        @Test
        @DisplayName("综合链")
        void complexChain() {
            String source = "1 >> BasicClass >> _.value >> BasicClass() >> _.valueProperty"
                    + " >> BasicClass() >> _.getValueMethod() >> BasicClass() >> _.getValuePlusArg(10)"
                    + " >> 10 + _ - 5 >> double >> tap(double) >> double() >> add(1) >> _sum(2, 3)"
                    + " >> (lambda a: a * 2)";
            assertThat(eval(source)).isEqualTo(140L);
        }

        @Test
        @DisplayName("宿主对象的状态变化可见")
        void mutation() {
            BasicClass instance = new BasicClass(1);
            bindings.put("instance", instance);
            eval("instance >> _.increment()");
            assertThat(instance.value).isEqualTo(2L);
        }
    }

    // ── 调试模式 ─────────────────────────────────────────

    @Nested
    @DisplayName("调试模式")
    class Debug {

        @Test
        @DisplayName("观察者按求值顺序在每个阶段收到一次值")
        void observerOncePerStage() {
            List<Object> seen = new ArrayList<>();
            pipes.setDebugObserver(seen::add);
            assertThat(eval("@pipes(debug=True) 3 >> double >> add(1) >> _ * 2")).isEqualTo(14L);
            assertThat(seen).containsExactly(6L, 7L, 14L);
        }

        @Test
        @DisplayName("关闭调试时观察者不被调用")
        void observerSilentWhenOff() {
            List<Object> seen = new ArrayList<>();
            pipes.setDebugObserver(seen::add);
            assertThat(eval("3 >> double >> add(1)")).isEqualTo(7L);
            assertThat(seen).isEmpty();
        }

        @Test
        @DisplayName("默认观察者打印到 stdout")
        void defaultObserverPrints() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            pipes.setStdout(new PrintStream(out, true, StandardCharsets.UTF_8));
            eval("@pipes(debug=True) 'a' >> _.upper() >> [_]");
            assertThat(out.toString(StandardCharsets.UTF_8))
                    .isEqualTo("A" + System.lineSeparator() + "['A']" + System.lineSeparator());
        }

        @Test
        @DisplayName("引擎级配置开启调试")
        void debugFromDefaultConfig() {
            List<Object> seen = new ArrayList<>();
            Pipes debugPipes = new Pipes(PipeConfig.builder().debug(true).build()).setDebugObserver(seen::add);
            assertThat(debugPipes.eval("2 >> double >> double", bindings)).isEqualTo(8L);
            assertThat(seen).containsExactly(4L, 8L);
        }
    }

    // ── 编译 ─────────────────────────────────────────────

    @Nested
    @DisplayName("编译")
    class Compile {

        @Test
        @DisplayName("改写结果与生效配置")
        void rewrittenSource() {
            CompiledPipe compiled = pipes.compile("@pipes(operator='|') x | f | g(1)", "unit");
            assertThat(compiled.getRewrittenSource()).isEqualTo("g(f(x), 1)");
            assertThat(compiled.getConfig().getOperator().toSourceString()).isEqualTo("|");
            assertThat(compiled.getUnitName()).isEqualTo("unit");
        }

        @Test
        @DisplayName("编译已解析的树")
        void compileTree() {
            CompiledPipe compiled = pipes.compile(Parser.parse("x >> double", "tree"), PipeConfig.defaults(), "tree");
            assertThat(compiled.getSource()).isNull();
            assertThat(compiled.eval(Map.of("x", 4L, "double", bindings.get("double")))).isEqualTo(8L);
        }

        @Test
        @DisplayName("同一源码命中缓存")
        void cacheHit() {
            CompiledPipe first = pipes.compile("1 >> double", "a");
            CompiledPipe second = pipes.compile("1 >> double", "a");
            assertThat(second).isSameAs(first);
            assertThat(pipes.getCacheStats().getHitCount()).isEqualTo(1);
            assertThat(pipes.getCacheStats().getMissCount()).isEqualTo(1);
            assertThat(pipes.compile("1 >> double", "b")).isNotSameAs(first);
        }

        @Test
        @DisplayName("清空缓存")
        void clearCache() {
            pipes.compile("1 >> double", "a");
            pipes.clearCache();
            assertThat(pipes.getCacheSize()).isZero();
        }

        @Test
        @DisplayName("失败的编译不进入缓存")
        void failuresNotCached() {
            assertThatThrownBy(() -> pipes.compile("x >> 1 + 2", "bad")).isInstanceOf(AmbiguousRewriteException.class);
            assertThatThrownBy(() -> pipes.compile("x >> 1 + 2", "bad")).isInstanceOf(AmbiguousRewriteException.class);
            assertThat(pipes.getCacheStats().getLoadFailureCount()).isEqualTo(2);
            assertThat(pipes.getCacheSize()).isZero();
        }
    }

    // ── 错误 ─────────────────────────────────────────────

    @Nested
    @DisplayName("错误")
    class Errors {

        @Test
        @DisplayName("编译期错误原样抛出")
        void compileErrors() {
            assertThatThrownBy(() -> pipes.compile("x >>", "u")).isInstanceOf(ParseException.class);
            assertThatThrownBy(() -> pipes.compile("@pipes(bogus=1) x >> f", "u"))
                    .isInstanceOf(PipeConfigurationException.class)
                    .hasMessageContaining("bogus");
            assertThatThrownBy(() -> pipes.compile("@pipes(placeholder='Z') x >> f", "u"))
                    .isInstanceOf(PipeConfigurationException.class)
                    .hasMessageContaining("must differ");
        }

        @Test
        @DisplayName("运行期错误带位置与源码行")
        void runtimeErrorLocation() {
            PipeRuntimeException e = catchThrowableOfType(
                    () -> pipes.eval(pipes.compile("1 >> missing", "rule"), bindings),
                    PipeRuntimeException.class);
            assertThat(e.getRawMessage()).isEqualTo("name 'missing' is not defined");
            assertThat(e.getLocation().getColumn()).isEqualTo(6);
            assertThat(e.getMessage())
                    .contains("  --> rule:1:6")
                    .contains("1 | 1 >> missing")
                    .contains("^");
        }

        @Test
        @DisplayName("宿主函数抛出的异常被包装")
        void hostFailureWrapped() {
            bindings.put("boom", (Function<Object, Object>) v -> {
                throw new IllegalStateException("bad " + v);
            });
            assertThatThrownBy(() -> eval("1 >> boom"))
                    .isInstanceOf(PipeRuntimeException.class)
                    .hasMessageContaining("IllegalStateException: bad 1")
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("静态 run()")
    void staticRun() {
        assertThat(Pipes.run("[3, 1, 2] >> sorted")).isEqualTo(List.of(1L, 2L, 3L));
        assertThat(Pipes.run("x >> str", Map.of("x", 1.5))).isEqualTo("1.5");
    }

    @Test
    @DisplayName("标记后的括号属于表达式")
    void markerFollowedByParenthesis() {
        assertThat(Pipes.run("@pipes (1 + 2) * 10")).isEqualTo(30L);
        assertThat(Pipes.run("@pipes(placeholder='__') (2 >> __ + 1) * 10")).isEqualTo(30L);
        assertThat(Pipes.run("@pipes (lambda Z: Z * 10 + 3)(4 >> double)",
                Map.of("double", (Function<Object, Object>) v -> (Long) v * 2))).isEqualTo(83L);
    }

    @Test
    @DisplayName("整数溢出在求值时报错")
    void integerOverflow() {
        assertThatThrownBy(() -> Pipes.run("3 << 62"))
                .isInstanceOf(PipeRuntimeException.class)
                .hasMessageContaining("left shift overflow");
        assertThatThrownBy(() -> Pipes.run("-x", Map.of("x", Long.MIN_VALUE)))
                .isInstanceOf(PipeRuntimeException.class)
                .hasMessageContaining("integer overflow in unary '-'");
        assertThatThrownBy(() -> Pipes.run("x >> abs", Map.of("x", Long.MIN_VALUE)))
                .isInstanceOf(PipeRuntimeException.class)
                .hasMessageContaining("integer overflow in abs()");
    }
}
