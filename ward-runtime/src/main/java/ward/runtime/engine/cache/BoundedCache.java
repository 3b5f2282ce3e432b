package ward.runtime.engine.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>用于缓存不随运行时状态变化的判定结果（例如普通 Java 类型对接口的结构符合性）。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * 如果不存在则计算并缓存
     *
     * @return 缓存值（可能是新计算的）
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    CacheStats getStats();
}
