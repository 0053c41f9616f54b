package pipelang.runtime.interpreter;

import com.pipelang.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

/**
 * 解释器单元测试（直接求值未改写的树）
 */
@DisplayName("Interpreter 测试")
class InterpreterTest {

    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter();
    }

    private Object eval(String source) {
        return eval(source, Collections.emptyMap());
    }

    private Object eval(String source, Map<String, ?> bindings) {
        interpreter.setSource(source);
        return interpreter.evaluate(Parser.parse(source, "<test>"), interpreter.createScope(bindings));
    }

    @Nested
    @DisplayName("表达式")
    class Expressions {

        @Test
        @DisplayName("算术与优先级")
        void testArithmetic() {
            assertThat(eval("1 + 2 * 3")).isEqualTo(7L);
            assertThat(eval("7 // 2")).isEqualTo(3L);
            assertThat(eval("-7 // 2")).isEqualTo(-4L);
            assertThat(eval("7 / 2")).isEqualTo(3.5);
            assertThat(eval("-7 % 3")).isEqualTo(2L);
            assertThat(eval("2 ** 10")).isEqualTo(1024L);
            assertThat(eval("2 ** -1")).isEqualTo(0.5);
            assertThat(eval("-2 ** 2")).isEqualTo(-4L);
        }

        @Test
        @DisplayName("and / or 返回操作数")
        void testLogical() {
            assertThat(eval("0 or 'x'")).isEqualTo("x");
            assertThat(eval("'' and missing")).isEqualTo("");
            assertThat(eval("not []")).isEqualTo(true);
        }

        @Test
        @DisplayName("比较链")
        void testComparisonChain() {
            assertThat(eval("1 < 2 < 3")).isEqualTo(true);
            assertThat(eval("1 < 3 < 2")).isEqualTo(false);
            assertThat(eval("1 == 1.0")).isEqualTo(true);
        }

        @Test
        @DisplayName("集合字面量与索引")
        void testCollections() {
            assertThat(eval("[1, 2, 3][-1]")).isEqualTo(3L);
            assertThat(eval("(1, 'a')")).isEqualTo(PipeTuple.of(1L, "a"));
            assertThat(eval("{1, 2} | {3}")).isEqualTo(Set.of(1L, 2L, 3L));
            assertThat(eval("{'a': 1, 'b': 2}['b']")).isEqualTo(2L);
            assertThat(eval("'abc'[1]")).isEqualTo("b");
        }

        @Test
        @DisplayName("推导式")
        void testComprehensions() {
            assertThat(eval("[x * y for x in range(1, 3) for y in range(x)]")).isEqualTo(List.of(0L, 0L, 2L));
            assertThat(eval("{k: v for k, v in {'a': 1}.items()}")).isEqualTo(Map.of("a", 1L));
            assertThat(eval("sum(x for x in range(4))")).isEqualTo(6L);
            assertThat(eval("{c for c in 'aab'}")).isEqualTo(Set.of("a", "b"));
        }

        @Test
        @DisplayName("f-string")
        void testInterpolation() {
            assertThat(eval("f\"{a} + {b} = {a + b}\"", Map.of("a", 1L, "b", 2.5))).isEqualTo("1 + 2.5 = 3.5");
            assertThat(eval("f\"{None} {True} {[1, 'x']}\"")).isEqualTo("None True [1, 'x']");
        }

        @Test
        @DisplayName("lambda 闭包与命名参数")
        void testLambda() {
            assertThat(eval("(lambda a, b: a - b)(b=1, a=5)")).isEqualTo(4L);
            assertThat(eval("(lambda n: (lambda m: n * m))(3)(4)")).isEqualTo(12L);
        }

        @Test
        @DisplayName("未改写的 |> 直接调用右侧")
        void testPipeOperatorFallback() {
            assertThat(eval("3 |> (lambda v: v + 1)")).isEqualTo(4L);
        }

        @Test
        @DisplayName("None 是合法的绑定值")
        void testNoneBinding() {
            Map<String, Object> bindings = new HashMap<>();
            bindings.put("x", null);
            assertThat(eval("x", bindings)).isNull();
            assertThat(eval("x == None", bindings)).isEqualTo(true);
        }
    }

    @Nested
    @DisplayName("内置函数")
    class BuiltinFunctions {

        @Test
        @DisplayName("转换")
        void testConversions() {
            assertThat(eval("int('42') + int(2.9)")).isEqualTo(44L);
            assertThat(eval("float(1)")).isEqualTo(1.0);
            assertThat(eval("str(1.0)")).isEqualTo("1.0");
            assertThat(eval("tuple([1])")).isEqualTo(PipeTuple.of(1L));
            assertThat(eval("repr('a')")).isEqualTo("'a'");
        }

        @Test
        @DisplayName("聚合")
        void testAggregates() {
            assertThat(eval("len('abc') + len([1]) + len({})")).isEqualTo(4L);
            assertThat(eval("max([3, 9, 2])")).isEqualTo(9L);
            assertThat(eval("min(3, 1, 2)")).isEqualTo(1L);
            assertThat(eval("sorted([3, 1, 2], reverse=True)")).isEqualTo(List.of(3L, 2L, 1L));
            assertThat(eval("abs(-2) + pow(2, 3)")).isEqualTo(10L);
        }

        @Test
        @DisplayName("print 输出到 stdout")
        void testPrint() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            interpreter.setStdout(new PrintStream(out, true, StandardCharsets.UTF_8));
            assertThat(eval("print(1, 'a', None, sep='-')")).isNull();
            assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("1-a-None\n");
        }

        @Test
        @DisplayName("tap 返回原值")
        void testTap() {
            assertThat(eval("tap(5, lambda v: v * 100)")).isEqualTo(5L);
        }
    }

    @Nested
    @DisplayName("宿主值")
    class HostValues {

        @Test
        @DisplayName("java.util.function 接口可调用")
        void testFunctionalInterfaces() {
            BiFunction<Object, Object, Object> concat = (a, b) -> a + "" + b;
            Supplier<Object> answer = () -> 42;
            assertThat(eval("concat('a', 1)", Map.of("concat", concat))).isEqualTo("a1");
            assertThat(eval("answer()", Map.of("answer", answer))).isEqualTo(42L);
        }

        @Test
        @DisplayName("Java 方法与内置方法")
        void testMethods() {
            assertThat(eval("'abc'.upper()")).isEqualTo("ABC");
            assertThat(eval("'abc'.length()")).isEqualTo(3L);
            assertThat(eval("Math.max(3, 7)", Map.of("Math", Math.class))).isEqualTo(7L);
            assertThat(eval("StringBuilder('ab').append('c').toString()",
                    Map.of("StringBuilder", StringBuilder.class))).isEqualTo("abc");
        }

        @Test
        @DisplayName("非公共实现类的方法通过接口调用")
        void testNonPublicImplementation() {
            assertThat(eval("m.keySet().size()", Map.of("m", Map.of("k", 1)))).isEqualTo(1L);
        }

        @Test
        @DisplayName("不可调用的值")
        void testNotCallable() {
            assertThatThrownBy(() -> eval("1(2)"))
                    .isInstanceOf(PipeRuntimeException.class)
                    .hasMessageContaining("'int' object is not callable");
        }
    }

    @Nested
    @DisplayName("错误")
    class Errors {

        @Test
        @DisplayName("未定义名称带位置")
        void testUndefinedName() {
            PipeRuntimeException e = catchThrowableOfType(() -> eval("1 + nope"), PipeRuntimeException.class);
            assertThat(e.getRawMessage()).isEqualTo("name 'nope' is not defined");
            assertThat(e.getLocation().getColumn()).isEqualTo(5);
            assertThat(e.getMessage()).contains("  --> <test>:1:5").contains("1 | 1 + nope");
        }

        @Test
        @DisplayName("除零")
        void testDivisionByZero() {
            assertThatThrownBy(() -> eval("1 // 0")).hasMessageContaining("division or modulo by zero");
            assertThatThrownBy(() -> eval("1 / 0.0")).hasMessageContaining("division by zero");
        }

        @Test
        @DisplayName("字典缺少键")
        void testKeyError() {
            assertThatThrownBy(() -> eval("{}['k']")).hasMessageContaining("KeyError: 'k'");
        }

        @Test
        @DisplayName("lambda 参数个数不符")
        void testLambdaArity() {
            assertThatThrownBy(() -> eval("(lambda a: a)(1, 2)"))
                    .hasMessageContaining("takes 1 positional arguments but 2 were given");
            assertThatThrownBy(() -> eval("(lambda a: a)()"))
                    .hasMessageContaining("missing required argument: 'a'");
        }
    }
}
