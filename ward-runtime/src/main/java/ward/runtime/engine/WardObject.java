package ward.runtime.engine;

import ward.runtime.MemberNotFoundException;
import ward.runtime.WardException;
import ward.runtime.types.Operation;

import java.util.HashMap;
import java.util.Map;

/**
 * Ward 对象实例
 *
 * <p>声明成员的值存放在实例存储中，静态成员落到声明类的共享存储。
 * 未声明的普通属性（仅类内部方法可读写）使用惰性 dynamicAttributes HashMap。</p>
 *
 * <p>不带 {@link AccessContext} 的重载都以外部上下文访问。</p>
 */
public final class WardObject {

    private final WardClass wardClass;
    private final Slots slots = new Slots();
    private Map<String, Object> dynamicAttributes;

    WardObject(WardClass wardClass) {
        this.wardClass = wardClass;
    }

    public WardClass getWardClass() {
        return wardClass;
    }

    Slots getSlots() {
        return slots;
    }

    // ============ 属性操作 ============

    public Object get(String name) {
        return get(name, AccessContext.EXTERNAL);
    }

    public Object get(String name, AccessContext context) {
        Property property = wardClass.resolveProperty(name, context);
        if (property != null) {
            return property.get(this, context);
        }
        if (dynamicAttributes == null || !dynamicAttributes.containsKey(name)) {
            throw new MemberNotFoundException(wardClass.getName(), name);
        }
        wardClass.getResolver().enforceUndeclared(name, wardClass.getDescriptor(), context, Operation.READ);
        return dynamicAttributes.get(name);
    }

    public void set(String name, Object value) {
        set(name, value, AccessContext.EXTERNAL);
    }

    public void set(String name, Object value, AccessContext context) {
        WardClass.rejectDynamicDeclaration(wardClass.getName(), name, value);
        Property property = wardClass.resolveProperty(name, context);
        if (property != null) {
            property.set(this, value, context);
            return;
        }
        wardClass.getResolver().enforceUndeclared(name, wardClass.getDescriptor(), context, Operation.WRITE);
        if (dynamicAttributes == null) dynamicAttributes = new HashMap<String, Object>(4);
        dynamicAttributes.put(name, value);
    }

    public void delete(String name) {
        delete(name, AccessContext.EXTERNAL);
    }

    public void delete(String name, AccessContext context) {
        Property property = wardClass.resolveProperty(name, context);
        if (property != null) {
            property.delete(this, context);
            return;
        }
        if (dynamicAttributes == null || !dynamicAttributes.containsKey(name)) {
            throw new MemberNotFoundException(wardClass.getName(), name);
        }
        wardClass.getResolver().enforceUndeclared(name, wardClass.getDescriptor(), context, Operation.DELETE);
        dynamicAttributes.remove(name);
    }

    // ============ 方法调用 ============

    public Object invoke(String name, Object... args) {
        return invoke(AccessContext.EXTERNAL, name, args);
    }

    public Object invoke(AccessContext context, String name, Object... args) {
        Object member = get(name, context);
        if (!(member instanceof BoundMethod)) {
            throw new WardException("'" + wardClass.getName() + "." + name + "' is not callable");
        }
        return ((BoundMethod) member).call(args);
    }

    // ============ 类型检查 ============

    public boolean isInstanceOf(WardClass cls) {
        return wardClass.isSubclassOf(cls);
    }

    @Override
    public String toString() {
        return "<" + wardClass.getName() + " object@" + Integer.toHexString(System.identityHashCode(this)) + ">";
    }
}
