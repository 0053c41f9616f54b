package pipelang.runtime.interpreter.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>编译缓存的抽象，默认实现为 {@link CaffeineCache}。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    void put(K key, V value);

    /**
     * 不存在时计算并缓存。计算函数抛出的非受检异常原样传播，且不缓存任何值。
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    long size();

    void clear();

    CacheStats getStats();
}
