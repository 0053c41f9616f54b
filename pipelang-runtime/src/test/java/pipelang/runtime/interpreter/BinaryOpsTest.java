package pipelang.runtime.interpreter;

import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BinaryOps 测试")
class BinaryOpsTest {

    @Nested
    @DisplayName("算术")
    class Arithmetic {

        @Test
        @DisplayName("整数与浮点混合")
        void testMixed() {
            assertThat(BinaryOps.apply(BinaryOp.ADD, 1L, 2L)).isEqualTo(3L);
            assertThat(BinaryOps.apply(BinaryOp.ADD, 1L, 0.5)).isEqualTo(1.5);
            assertThat(BinaryOps.apply(BinaryOp.MUL, true, 3L)).isEqualTo(3L);
        }

        @Test
        @DisplayName("序列拼接与重复")
        void testSequences() {
            assertThat(BinaryOps.apply(BinaryOp.ADD, "a", "b")).isEqualTo("ab");
            assertThat(BinaryOps.apply(BinaryOp.MUL, "ab", 2L)).isEqualTo("abab");
            assertThat(BinaryOps.apply(BinaryOp.ADD, List.of(1L), List.of(2L))).isEqualTo(List.of(1L, 2L));
            assertThat(BinaryOps.apply(BinaryOp.MUL, PipeTuple.of(1L), 2L)).isEqualTo(PipeTuple.of(1L, 1L));
        }

        @Test
        @DisplayName("整数溢出报错")
        void testOverflow() {
            assertThatThrownBy(() -> BinaryOps.apply(BinaryOp.MUL, Long.MAX_VALUE, 2L))
                    .isInstanceOf(PipeRuntimeException.class)
                    .hasMessageContaining("overflow");
        }

        @Test
        @DisplayName("取负与 abs 在最小值上溢出")
        void testNegateAndAbsOverflow() {
            assertThat(BinaryOps.negate(5L)).isEqualTo(-5L);
            assertThat(BinaryOps.negate(true)).isEqualTo(-1L);
            assertThat(BinaryOps.negate(1.5)).isEqualTo(-1.5);
            assertThat(BinaryOps.abs(-7L)).isEqualTo(7L);
            assertThat(BinaryOps.abs(-2.5)).isEqualTo(2.5);
            assertThatThrownBy(() -> BinaryOps.negate(Long.MIN_VALUE))
                    .isInstanceOf(PipeRuntimeException.class)
                    .hasMessage("integer overflow in unary '-'");
            assertThatThrownBy(() -> BinaryOps.abs(Long.MIN_VALUE))
                    .isInstanceOf(PipeRuntimeException.class)
                    .hasMessage("integer overflow in abs()");
            assertThatThrownBy(() -> BinaryOps.negate("a"))
                    .hasMessage("bad operand type for unary -: 'str'");
        }

        @Test
        @DisplayName("类型不支持")
        void testUnsupported() {
            assertThatThrownBy(() -> BinaryOps.apply(BinaryOp.SUB, "a", 1L))
                    .isInstanceOf(PipeRuntimeException.class)
                    .hasMessage("unsupported operand type(s) for -: 'str' and 'int'");
        }
    }

    @Nested
    @DisplayName("位运算")
    class Bitwise {

        @Test
        @DisplayName("移位")
        void testShift() {
            assertThat(BinaryOps.apply(BinaryOp.SHR, 1000L, 4L)).isEqualTo(62L);
            assertThat(BinaryOps.apply(BinaryOp.SHL, 1L, 4L)).isEqualTo(16L);
            assertThatThrownBy(() -> BinaryOps.apply(BinaryOp.SHR, 1L, -1L)).hasMessage("negative shift count");
        }

        @Test
        @DisplayName("左移溢出报错")
        void testShiftOverflow() {
            assertThat(BinaryOps.apply(BinaryOp.SHL, 1L, 62L)).isEqualTo(1L << 62);
            assertThat(BinaryOps.apply(BinaryOp.SHL, -1L, 63L)).isEqualTo(Long.MIN_VALUE);
            assertThatThrownBy(() -> BinaryOps.apply(BinaryOp.SHL, 3L, 62L)).hasMessage("left shift overflow");
            assertThatThrownBy(() -> BinaryOps.apply(BinaryOp.SHL, 1L, 63L)).hasMessage("left shift overflow");
            assertThatThrownBy(() -> BinaryOps.apply(BinaryOp.SHL, 1L, 64L)).hasMessage("left shift overflow");
        }

        @Test
        @DisplayName("字典合并")
        void testDictMerge() {
            Map<Object, Object> a = new LinkedHashMap<>(Map.of("a", 1L));
            Object merged = BinaryOps.apply(BinaryOp.BIT_OR, a, Map.of("a", 2L));
            assertThat(merged).isEqualTo(Map.of("a", 2L));
            assertThat(a).containsEntry("a", 1L);
        }
    }

    @Nested
    @DisplayName("比较与真值")
    class Comparison {

        @Test
        @DisplayName("元组与列表不相等")
        void testTupleVsList() {
            assertThat(BinaryOps.isEqual(PipeTuple.of(1L), new ArrayList<>(List.of(1L)))).isFalse();
            assertThat(BinaryOps.isEqual(Arrays.asList(1L, 2.0), List.of(1.0, 2L))).isTrue();
        }

        @Test
        @DisplayName("序列逐元素比较")
        void testSequenceOrdering() {
            assertThat(BinaryOps.compare(List.of(1L, 2L), List.of(1L, 3L))).isNegative();
            assertThat(BinaryOps.compare(List.of(1L), List.of(1L, 0L))).isNegative();
            assertThatThrownBy(() -> BinaryOps.compare("a", 1L))
                    .hasMessageContaining("not supported between instances of 'str' and 'int'");
        }

        @Test
        @DisplayName("真值")
        void testTruthiness() {
            assertThat(BinaryOps.isTruthy(null)).isFalse();
            assertThat(BinaryOps.isTruthy(0L)).isFalse();
            assertThat(BinaryOps.isTruthy(0.0)).isFalse();
            assertThat(BinaryOps.isTruthy("")).isFalse();
            assertThat(BinaryOps.isTruthy(List.of())).isFalse();
            assertThat(BinaryOps.isTruthy(new Object())).isTrue();
        }
    }

    @Test
    @DisplayName("值的字符串表示")
    void testRepr() {
        Map<Object, Object> dict = new LinkedHashMap<>();
        dict.put("a", 1L);
        dict.put(2L, PipeTuple.of(3L));
        assertThat(Builtins.repr(dict)).isEqualTo("{'a': 1, 2: (3,)}");
        assertThat(Builtins.repr(List.of(1.0, true, "it's"))).isEqualTo("[1.0, True, \"it's\"]");
        assertThat(Builtins.str(new java.util.LinkedHashSet<>())).isEqualTo("set()");
    }
}
