package pipelang.runtime.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Environment 测试")
class EnvironmentTest {

    @Test
    @DisplayName("子作用域遮蔽父作用域")
    void testShadowing() {
        Environment parent = new Environment();
        parent.define("x", 1L);
        Environment child = new Environment(parent);
        child.define("x", 2L);
        assertThat(child.lookup("x")).isEqualTo(2L);
        assertThat(parent.lookup("x")).isEqualTo(1L);
        assertThat(child.getParent()).isSameAs(parent);
    }

    @Test
    @DisplayName("绑定为 null 与未定义不同")
    void testNullIsDefined() {
        Environment parent = new Environment();
        parent.define("x", 1L);
        Environment child = new Environment(parent);
        child.define("x", null);
        assertThat(child.contains("x")).isTrue();
        assertThat(child.lookup("x")).isNull();
    }

    @Test
    @DisplayName("未定义名称")
    void testUndefined() {
        Environment env = new Environment();
        assertThat(env.contains("y")).isFalse();
        assertThatThrownBy(() -> env.lookup("y"))
                .isInstanceOf(PipeRuntimeException.class)
                .hasMessage("name 'y' is not defined");
    }

    @Test
    @DisplayName("只列出当前作用域的名称")
    void testLocalNames() {
        Environment parent = new Environment();
        parent.define("a", 1L);
        Environment child = new Environment(parent);
        child.define("b", 2L);
        assertThat(child.localNames()).containsExactly("b");
    }
}
