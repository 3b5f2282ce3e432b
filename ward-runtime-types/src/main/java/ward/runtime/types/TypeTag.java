package ward.runtime.types;

/**
 * 运行时类型约束。
 *
 * <p>{@link #accepts} 判断值是否已经属于该类型；{@link #coerce} 做一次性转换，
 * 无法转换时抛出 {@link IllegalArgumentException} 或 {@link ClassCastException}。</p>
 */
public interface TypeTag {

    String getName();

    boolean accepts(Object value);

    default Object coerce(Object value) {
        throw new ClassCastException("Cannot coerce " + value + " to " + getName());
    }
}
