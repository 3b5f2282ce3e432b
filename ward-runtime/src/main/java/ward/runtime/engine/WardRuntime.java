package ward.runtime.engine;

import ward.runtime.DefinitionException;
import ward.runtime.engine.cache.CacheStats;
import ward.runtime.types.TypeTag;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ward 运行时入口
 *
 * <p>使用示例：</p>
 * <pre>
 * WardRuntime runtime = new WardRuntime();
 * WardClass apple = runtime.defineClass("Apple")
 *     .member(Members.privateVar("weight", TypeTags.FLOAT))
 *     .member(Members.method("getWeight", 0, (self, args) -&gt; self.get("weight"))
 *             .visibility(Visibility.PROTECTED))
 *     .constructor(1, (self, args) -&gt; { self.set("weight", args.get(0)); return null; })
 *     .define();
 * WardObject a = apple.newInstance(2.0);
 * </pre>
 */
public final class WardRuntime {

    private static final Logger LOG = Logger.getLogger(WardRuntime.class.getName());

    private final WardPolicy policy;
    private final AbstractFinalEnforcer enforcer;
    private final ConformanceChecker conformance;
    private final InterfaceRegistry interfaces;
    private final ClassAugmenter augmenter;

    public WardRuntime() {
        this(WardPolicy.defaults());
    }

    public WardRuntime(WardPolicy policy) {
        this.policy = policy;
        AccessResolver resolver = new AccessResolver(policy);
        this.enforcer = new AbstractFinalEnforcer();
        this.conformance = new ConformanceChecker(resolver, policy);
        this.interfaces = new InterfaceRegistry(conformance);
        this.augmenter = new ClassAugmenter(resolver, new TypeValidator(policy), enforcer, conformance);
    }

    public WardPolicy getPolicy() {
        return policy;
    }

    // ============ 定义 ============

    public ClassDefinition.Builder defineClass(String id) {
        return new ClassDefinition.Builder(id, this::encapsulate);
    }

    public InterfaceDefinition.Builder defineInterface(String id) {
        return new InterfaceDefinition.Builder(id, this::defineInterface);
    }

    /**
     * 增强类定义；对同一个定义重复调用返回同一个类
     */
    public WardClass encapsulate(ClassDefinition definition) {
        try {
            return augmenter.augment(definition);
        } catch (DefinitionException e) {
            LOG.log(Level.WARNING, "Rejected class '" + definition.getId() + "': " + e.getMessage());
            throw e;
        }
    }

    /** 已增强的类原样返回 */
    public WardClass encapsulate(WardClass cls) {
        return encapsulate(cls.getDefinition());
    }

    public WardInterface defineInterface(InterfaceDefinition definition) {
        try {
            return interfaces.define(definition);
        } catch (DefinitionException e) {
            LOG.log(Level.WARNING, "Rejected interface '" + definition.getId() + "': " + e.getMessage());
            throw e;
        }
    }

    /** 不存在时返回 null */
    public WardClass findClass(String id) {
        return augmenter.find(id);
    }

    /** 不存在时返回 null */
    public WardInterface findInterface(String id) {
        return interfaces.find(id);
    }

    // ============ 实例化与类型判断 ============

    public Object instantiate(TypeTag type, Object... args) {
        if (type instanceof WardClass) {
            return ((WardClass) type).newInstance(args);
        }
        if (type instanceof WardInterface) {
            throw enforcer.interfaceInstantiation((WardInterface) type);
        }
        throw new IllegalArgumentException("Cannot instantiate " + type);
    }

    /**
     * 按策略的默认方式（默认鸭子类型）判断
     */
    public boolean instanceOf(Object object, Object type) {
        return instanceOf(object, type, policy.isDuckTypedByDefault());
    }

    public boolean instanceOf(Object object, Object type, boolean duckTyped) {
        return conformance.instanceOf(object, type, duckTyped);
    }

    public CacheStats getConformanceCacheStats() {
        return conformance.getCacheStats();
    }
}
