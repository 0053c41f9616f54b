package pipelang.runtime.interpreter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 绑定表（作用域）
 *
 * <p>名称可以绑定到 null（即 None），因此用 containsKey 区分“未定义”。</p>
 */
public final class Environment {

    private final Environment parent;
    private final Map<String, Object> values = new HashMap<>();

    /**
     * 创建全局环境
     */
    public Environment() {
        this(null);
    }

    /**
     * 创建子环境
     */
    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment getParent() {
        return parent;
    }

    /**
     * 在当前作用域定义（或覆盖）名称
     */
    public void define(String name, Object value) {
        values.put(name, value);
    }

    public void defineAll(Map<String, ?> bindings) {
        if (bindings != null) values.putAll(bindings);
    }

    /** 名称在当前或任一外层作用域中是否已定义 */
    public boolean contains(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) return true;
        }
        return false;
    }

    /**
     * 查找名称，沿作用域链向外
     *
     * @throws PipeRuntimeException 未定义
     */
    public Object lookup(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            Map<String, Object> scope = env.values;
            Object value = scope.get(name);
            if (value != null || scope.containsKey(name)) return value;
        }
        throw new PipeRuntimeException("name '" + name + "' is not defined");
    }

    /** 当前作用域（不含外层）的名称 */
    public Set<String> localNames() {
        return Collections.unmodifiableSet(values.keySet());
    }
}
