package ward.runtime.engine;

import java.util.logging.Level;

/**
 * 引擎策略配置
 *
 * <p>控制类型转换、instanceOf 的默认判定方式、缓存容量和拒绝访问的日志级别。</p>
 *
 * <p>使用示例：</p>
 * <pre>
 * // 预定义模式
 * WardRuntime runtime = new WardRuntime(WardPolicy.strict());
 *
 * // 自定义策略
 * WardPolicy policy = WardPolicy.custom()
 *     .coercion(false)
 *     .conformanceCacheSize(256)
 *     .denialLogLevel(Level.INFO)
 *     .build();
 * </pre>
 */
public final class WardPolicy {

    /** 策略模式 */
    public enum Mode { DEFAULT, STRICT, CUSTOM }

    private final Mode mode;
    private final boolean coercionEnabled;
    private final boolean duckTypedByDefault;
    private final long conformanceCacheSize;
    private final Level denialLogLevel;

    private WardPolicy(Builder builder) {
        this.mode = builder.mode;
        this.coercionEnabled = builder.coercionEnabled;
        this.duckTypedByDefault = builder.duckTypedByDefault;
        this.conformanceCacheSize = builder.conformanceCacheSize;
        this.denialLogLevel = builder.denialLogLevel;
    }

    // ============ 预定义工厂方法 ============

    /** 默认模式：单类型转换开启，instanceOf 默认鸭子类型 */
    public static WardPolicy defaults() {
        return new Builder(Mode.DEFAULT).build();
    }

    /** 严格模式：不做类型转换，instanceOf 默认按显式声明判定 */
    public static WardPolicy strict() {
        return new Builder(Mode.STRICT)
                .coercion(false)
                .duckTypedByDefault(false)
                .denialLogLevel(Level.INFO)
                .build();
    }

    /** 从默认值开始自定义 */
    public static Builder custom() {
        return new Builder(Mode.CUSTOM);
    }

    // ============ Getters ============

    public Mode getMode() {
        return mode;
    }

    public boolean isCoercionEnabled() {
        return coercionEnabled;
    }

    public boolean isDuckTypedByDefault() {
        return duckTypedByDefault;
    }

    public long getConformanceCacheSize() {
        return conformanceCacheSize;
    }

    public Level getDenialLogLevel() {
        return denialLogLevel;
    }

    @Override
    public String toString() {
        return "WardPolicy{mode=" + mode + ", coercion=" + coercionEnabled
                + ", duckTyped=" + duckTypedByDefault + ", cacheSize=" + conformanceCacheSize
                + ", denialLogLevel=" + denialLogLevel + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private final Mode mode;
        private boolean coercionEnabled = true;
        private boolean duckTypedByDefault = true;
        private long conformanceCacheSize = 1024;
        private Level denialLogLevel = Level.FINE;

        private Builder(Mode mode) {
            this.mode = mode;
        }

        public Builder coercion(boolean enabled) {
            this.coercionEnabled = enabled;
            return this;
        }

        public Builder duckTypedByDefault(boolean duckTyped) {
            this.duckTypedByDefault = duckTyped;
            return this;
        }

        public Builder conformanceCacheSize(long size) {
            if (size <= 0) {
                throw new IllegalArgumentException("conformanceCacheSize must be positive");
            }
            this.conformanceCacheSize = size;
            return this;
        }

        public Builder denialLogLevel(Level level) {
            if (level == null) {
                throw new IllegalArgumentException("denialLogLevel must not be null");
            }
            this.denialLogLevel = level;
            return this;
        }

        public WardPolicy build() {
            return new WardPolicy(this);
        }
    }
}
