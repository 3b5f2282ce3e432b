package ward.runtime.engine;

import ward.runtime.types.TypeTag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 内置类型标签
 *
 * <p>每个标签接受对应 Java 类型的值；单一类型声明下的转换规则：</p>
 * <ul>
 *   <li>INT / LONG：数字截断、布尔转 1/0、字符串解析</li>
 *   <li>FLOAT：数字、布尔、字符串解析</li>
 *   <li>STRING：任意值的 {@code String.valueOf}</li>
 *   <li>BOOL：真值判定（0、空串、空集合为 false）</li>
 *   <li>LIST：集合或数组复制为 ArrayList</li>
 * </ul>
 */
public final class TypeTags {

    public static final TypeTag ANY = new TypeTag() {
        @Override
        public String getName() {
            return "any";
        }

        @Override
        public boolean accepts(Object value) {
            return true;
        }

        @Override
        public Object coerce(Object value) {
            return value;
        }

        @Override
        public String toString() {
            return getName();
        }
    };

    public static final TypeTag INT = new JavaTypeTag("int", Integer.class, value -> {
        long l = toLong(value);
        if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("int out of range: " + value);
        }
        return (int) l;
    });

    public static final TypeTag LONG = new JavaTypeTag("long", Long.class, value -> toLong(value));

    public static final TypeTag FLOAT = new JavaTypeTag("float", Double.class, value -> {
        if (value instanceof Number) return ((Number) value).doubleValue();
        if (value instanceof Boolean) return (Boolean) value ? 1.0 : 0.0;
        if (value instanceof CharSequence) return Double.parseDouble(value.toString().trim());
        throw new ClassCastException("Cannot coerce " + value + " to float");
    });

    public static final TypeTag STRING = new JavaTypeTag("str", String.class, value -> String.valueOf(value));

    public static final TypeTag BOOL = new JavaTypeTag("bool", Boolean.class, value -> truthy(value));

    public static final TypeTag LIST = new JavaTypeTag("list", List.class, value -> {
        if (value instanceof Collection) return new ArrayList<Object>((Collection<?>) value);
        if (value instanceof Object[]) return new ArrayList<Object>(Arrays.asList((Object[]) value));
        throw new ClassCastException("Cannot coerce " + value + " to list");
    });

    public static final TypeTag MAP = new JavaTypeTag("map", Map.class, null);

    private TypeTags() {
    }

    /**
     * 以 Java 类型作为标签，只做 instanceof 判断，不做转换
     */
    public static TypeTag of(Class<?> type) {
        return new JavaTypeTag(type.getSimpleName(), box(type), null);
    }

    private static long toLong(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Cannot convert " + value + " to integer");
            }
            return (long) d;
        }
        if (value instanceof Number) return ((Number) value).longValue();
        if (value instanceof Boolean) return (Boolean) value ? 1L : 0L;
        if (value instanceof CharSequence) return Long.parseLong(value.toString().trim());
        throw new ClassCastException("Cannot coerce " + value + " to integer");
    }

    static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0.0;
        if (value instanceof CharSequence) return ((CharSequence) value).length() > 0;
        if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        return true;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        return type;
    }

    private static final class JavaTypeTag implements TypeTag {
        private final String name;
        private final Class<?> type;
        private final Function<Object, Object> coercer;

        JavaTypeTag(String name, Class<?> type, Function<Object, Object> coercer) {
            this.name = name;
            this.type = type;
            this.coercer = coercer;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean accepts(Object value) {
            return type.isInstance(value);
        }

        @Override
        public Object coerce(Object value) {
            if (coercer == null) {
                throw new ClassCastException("Cannot coerce " + value + " to " + name);
            }
            return coercer.apply(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof JavaTypeTag)) return false;
            JavaTypeTag other = (JavaTypeTag) o;
            return type == other.type && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return type.hashCode() * 31 + name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
