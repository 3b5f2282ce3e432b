package ward.runtime.engine;

import ward.runtime.DefinitionException;
import ward.runtime.MemberNotFoundException;
import ward.runtime.WardException;
import ward.runtime.types.ClassDescriptor;
import ward.runtime.types.MemberDeclaration;
import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.MethodBody;
import ward.runtime.types.Operation;
import ward.runtime.types.TypeTag;
import ward.runtime.types.Visibility;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 增强后的 Ward 类
 *
 * <p>持有封闭的成员表（{@link ClassDescriptor}）、名称到 get/set/delete 处理器的属性表
 * 以及静态成员的共享存储。作为类型标签时接受本类继承链上的实例，不做转换。</p>
 */
public final class WardClass implements TypeTag {

    private final ClassDefinition definition;
    private final ClassDescriptor descriptor;
    private final WardClass parent;
    private final List<WardInterface> interfaces;
    private final AccessResolver resolver;
    private final AbstractFinalEnforcer enforcer;
    private final Slots staticSlots = new Slots();
    private Map<String, Property> properties = Collections.emptyMap();
    // 未声明的类级属性（惰性）
    private Map<String, Object> classAttributes;

    WardClass(ClassDefinition definition, ClassDescriptor descriptor, WardClass parent,
              AccessResolver resolver, AbstractFinalEnforcer enforcer) {
        this.definition = definition;
        this.descriptor = descriptor;
        this.parent = parent;
        this.interfaces = definition.getInterfaces();
        this.resolver = resolver;
        this.enforcer = enforcer;
    }

    /** 类定义时调用一次 */
    void install(Map<String, Property> table) {
        this.properties = Collections.unmodifiableMap(table);
    }

    @Override
    public String getName() {
        return descriptor.getClassId();
    }

    public ClassDescriptor getDescriptor() {
        return descriptor;
    }

    public ClassDefinition getDefinition() {
        return definition;
    }

    public WardClass getParent() {
        return parent;
    }

    /** 本类直接声明实现的接口 */
    public List<WardInterface> getInterfaces() {
        return interfaces;
    }

    public boolean isAbstract() {
        return descriptor.isAbstract();
    }

    public boolean isFinal() {
        return descriptor.isFinal();
    }

    Slots getStaticSlots() {
        return staticSlots;
    }

    AccessResolver getResolver() {
        return resolver;
    }

    /** 最派生的定义 */
    Property findProperty(String name) {
        return properties.get(name);
    }

    /**
     * 按访问上下文解析成员。
     *
     * <p>上下文类在本类继承链上且自己声明了同名私有成员时，使用上下文类自己的定义：
     * 私有成员不参与覆盖，子类的同名声明遮蔽不了父类代码对自身私有成员的访问。
     * 其他情况取最派生的定义（虚分派）。</p>
     */
    Property resolveProperty(String name, AccessContext context) {
        if (!context.isExternal()) {
            for (WardClass c = this; c != null; c = c.parent) {
                if (c.descriptor == context.getEnclosingClass()) {
                    MemberDescriptor own = c.descriptor.getOwnMember(name);
                    if (own != null && own.getVisibility() == Visibility.PRIVATE) {
                        return c.properties.get(name);
                    }
                    break;
                }
            }
        }
        return properties.get(name);
    }

    Map<String, Property> getProperties() {
        return properties;
    }

    public boolean hasMember(String name) {
        return properties.containsKey(name);
    }

    // ============ 实例化 ============

    /**
     * 创建实例：检查抽象性，拷贝实例级常量，执行最派生的构造器
     */
    public WardObject newInstance(Object... args) {
        enforcer.checkInstantiable(this);
        WardObject instance = new WardObject(this);
        for (Property property : properties.values()) {
            if (property instanceof ConstantProperty) {
                ((ConstantProperty) property).snapshot(instance);
            }
        }
        initialize(findInitializerClass(), instance, args != null ? args : new Object[0]);
        return instance;
    }

    /** 执行当前类之上最近的祖先构造器 */
    void initializeFromParent(WardObject instance, Object[] args) {
        initialize(parent != null ? parent.findInitializerClass() : null, instance, args);
    }

    private WardClass findInitializerClass() {
        for (WardClass c = this; c != null; c = c.parent) {
            if (c.definition.getInitializer() != null) return c;
        }
        return null;
    }

    private void initialize(WardClass initClass, WardObject instance, Object[] args) {
        if (initClass == null) {
            if (args.length > 0) {
                throw new WardException(getName() + "() takes no arguments (" + args.length + " given)");
            }
            return;
        }
        MethodBody body = initClass.definition.getInitializer();
        int arity = initClass.definition.getInitializerArity();
        if (arity >= 0 && args.length != arity) {
            throw new WardException("Constructor of '" + initClass.getName() + "' expects " + arity
                    + " argument(s), got " + args.length);
        }
        body.call(new BoundSelf(instance, initClass), Collections.unmodifiableList(Arrays.asList(args)));
    }

    // ============ 类级属性操作 ============

    public Object get(String name) {
        return get(name, AccessContext.EXTERNAL);
    }

    public Object get(String name, AccessContext context) {
        Property property = resolveProperty(name, context);
        if (property != null) {
            return property.get(null, context);
        }
        if (classAttributes == null || !classAttributes.containsKey(name)) {
            throw new MemberNotFoundException(getName(), name);
        }
        resolver.enforceUndeclared(name, descriptor, context, Operation.READ);
        return classAttributes.get(name);
    }

    public void set(String name, Object value) {
        set(name, value, AccessContext.EXTERNAL);
    }

    public void set(String name, Object value, AccessContext context) {
        rejectDynamicDeclaration(getName(), name, value);
        Property property = resolveProperty(name, context);
        if (property != null) {
            property.set(null, value, context);
            return;
        }
        resolver.enforceUndeclared(name, descriptor, context, Operation.WRITE);
        if (classAttributes == null) classAttributes = new HashMap<String, Object>(4);
        classAttributes.put(name, value);
    }

    public void delete(String name) {
        delete(name, AccessContext.EXTERNAL);
    }

    public void delete(String name, AccessContext context) {
        Property property = resolveProperty(name, context);
        if (property != null) {
            property.delete(null, context);
            return;
        }
        if (classAttributes == null || !classAttributes.containsKey(name)) {
            throw new MemberNotFoundException(getName(), name);
        }
        resolver.enforceUndeclared(name, descriptor, context, Operation.DELETE);
        classAttributes.remove(name);
    }

    public Object invoke(String name, Object... args) {
        return invoke(AccessContext.EXTERNAL, name, args);
    }

    public Object invoke(AccessContext context, String name, Object... args) {
        Object member = get(name, context);
        if (!(member instanceof BoundMethod)) {
            throw new WardException("'" + getName() + "." + name + "' is not callable");
        }
        return ((BoundMethod) member).call(args);
    }

    /**
     * 成员表在类编译后封闭，运行期写入声明对象视为动态声明成员
     */
    static void rejectDynamicDeclaration(String className, String name, Object value) {
        if (value instanceof MemberDeclaration || value instanceof MemberDeclaration.Builder) {
            throw new DefinitionException("Cannot declare member '" + name + "' on '" + className
                    + "' after class creation");
        }
    }

    // ============ 继承检查 ============

    public boolean isSubclassOf(WardClass other) {
        return other != null && descriptor.isSubclassOf(other.descriptor);
    }

    @Override
    public boolean accepts(Object value) {
        return value instanceof WardObject && ((WardObject) value).getWardClass().isSubclassOf(this);
    }

    @Override
    public String toString() {
        return "class " + getName();
    }
}
