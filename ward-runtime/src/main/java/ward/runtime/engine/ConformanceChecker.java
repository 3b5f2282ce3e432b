package ward.runtime.engine;

import ward.runtime.DefinitionException;
import ward.runtime.engine.cache.BoundedCache;
import ward.runtime.engine.cache.CacheStats;
import ward.runtime.engine.cache.CaffeineCache;
import ward.runtime.types.ClassDescriptor;
import ward.runtime.types.InterfaceDescriptor;
import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.MemberKind;
import ward.runtime.types.MemberSignature;

import java.lang.reflect.Field;
import java.lang.reflect.Method;

/**
 * 接口符合性检查
 *
 * <ul>
 *   <li>显式：类定义时检查 implements 声明的每个要求成员都在自身或继承的成员表中</li>
 *   <li>结构（鸭子类型）：要求成员都能以外部上下文访问到，私有 / 受保护成员视为不存在</li>
 *   <li>精确：继承链上某个类显式声明了该接口（或其子接口）</li>
 * </ul>
 */
public final class ConformanceChecker {

    private final AccessResolver resolver;
    // 普通 Java 类型的结构判定只取决于 (Class, 接口)，结果可缓存
    private final BoundedCache<ConformanceKey, Boolean> reflectiveCache;

    public ConformanceChecker(AccessResolver resolver, WardPolicy policy) {
        this.resolver = resolver;
        this.reflectiveCache = new CaffeineCache<ConformanceKey, Boolean>(policy.getConformanceCacheSize());
    }

    // ============ 显式声明 ============

    /**
     * 检查类自身声明的接口，缺失成员立即报错
     */
    public void checkImplements(ClassDescriptor cls) {
        for (InterfaceDescriptor iface : cls.getInterfaces()) {
            for (MemberSignature required : iface.getRequiredMembers().values()) {
                MemberDescriptor member = cls.findMember(required.getName());
                if (member == null) {
                    throw new DefinitionException("Class '" + cls.getClassId() + "' is missing member '"
                            + required.getName() + "' required by interface '" + iface.getInterfaceId() + "'");
                }
                if (!required.isSatisfiedBy(member)) {
                    throw new DefinitionException("Class '" + cls.getClassId() + "' member '" + member.getName()
                            + "' does not satisfy '" + iface.getInterfaceId() + "." + required
                            + "' (found " + member + ")");
                }
            }
        }
    }

    // ============ instanceOf ============

    /**
     * @param type {@link WardClass}、{@link WardInterface} 或 Java {@link Class}
     * @throws IllegalArgumentException type 为 null 或不是上述类型
     */
    public boolean instanceOf(Object object, Object type, boolean duckTyped) {
        if (type == null) {
            throw new IllegalArgumentException("instanceOf() requires a class or an interface");
        }
        if (type instanceof WardClass) {
            return object instanceof WardObject && ((WardObject) object).isInstanceOf((WardClass) type);
        }
        if (type instanceof WardInterface) {
            if (object == null) return false;
            WardInterface iface = (WardInterface) type;
            return duckTyped ? conformsStructurally(object, iface) : conformsExplicitly(object, iface);
        }
        if (type instanceof Class) {
            return ((Class<?>) type).isInstance(object);
        }
        throw new IllegalArgumentException("instanceOf() expects a class or an interface, got "
                + type.getClass().getName());
    }

    public boolean conformsExplicitly(Object object, WardInterface iface) {
        if (!(object instanceof WardObject)) return false;
        return ((WardObject) object).getWardClass().getDescriptor().implementsInterface(iface.getDescriptor());
    }

    public boolean conformsStructurally(Object object, WardInterface iface) {
        if (object instanceof WardObject) {
            WardObject instance = (WardObject) object;
            return exposesAll(instance.getWardClass(), instance, iface);
        }
        if (object instanceof WardClass) {
            return exposesAll((WardClass) object, null, iface);
        }
        final Class<?> type = object.getClass();
        return reflectiveCache.computeIfAbsent(new ConformanceKey(type, iface),
                key -> probeReflectively(type, iface));
    }

    public CacheStats getCacheStats() {
        return reflectiveCache.getStats();
    }

    /**
     * @param target 被探测的实例，探测类对象本身时为 null
     */
    private boolean exposesAll(WardClass cls, WardObject target, WardInterface iface) {
        for (MemberSignature required : iface.getRequiredMembers().values()) {
            if (!exposes(cls, target, required)) return false;
        }
        return true;
    }

    /**
     * 以外部上下文探测成员：必须可见；方法还必须非抽象且参数个数兼容，
     * 数据成员还必须有值可读（声明了但从未赋值且无默认值视为不存在）
     */
    private boolean exposes(WardClass cls, WardObject target, MemberSignature required) {
        Property property = cls.findProperty(required.getName());
        if (property == null) return false;
        MemberDescriptor member = property.getDescriptor();
        if (!resolver.checkVisibility(member, property.getOwner().getDescriptor(), AccessContext.EXTERNAL).isAllowed()) {
            return false;
        }
        // 类级只能看到静态成员和常量
        if (target == null && !member.isStatic() && !member.isConstant()) return false;
        if (required.getKind() == MemberKind.METHOD) {
            return member.isMethod() && !member.isAbstract() && required.isArityCompatible(member.getArity());
        }
        return !member.isMethod() && property.isBound(target);
    }

    private static boolean probeReflectively(Class<?> type, WardInterface iface) {
        for (MemberSignature required : iface.getRequiredMembers().values()) {
            if (required.getKind() == MemberKind.METHOD ? !hasPublicMethod(type, required) : !hasPublicField(type, required)) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasPublicMethod(Class<?> type, MemberSignature required) {
        for (Method m : type.getMethods()) {
            if (!m.getName().equals(required.getName())) continue;
            if (required.isArityCompatible(m.isVarArgs() ? -1 : m.getParameterCount())) return true;
        }
        return false;
    }

    private static boolean hasPublicField(Class<?> type, MemberSignature required) {
        for (Field f : type.getFields()) {
            if (f.getName().equals(required.getName())) return true;
        }
        return false;
    }

    /** 以身份比较的 (Java 类型, 接口) 键 */
    private static final class ConformanceKey {
        private final Class<?> type;
        private final WardInterface iface;

        ConformanceKey(Class<?> type, WardInterface iface) {
            this.type = type;
            this.iface = iface;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ConformanceKey)) return false;
            ConformanceKey other = (ConformanceKey) o;
            return type == other.type && iface == other.iface;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(type) * 31 + System.identityHashCode(iface);
        }
    }
}
