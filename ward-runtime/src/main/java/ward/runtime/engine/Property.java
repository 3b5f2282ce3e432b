package ward.runtime.engine;

import ward.runtime.WardException;
import ward.runtime.types.MemberDescriptor;

/**
 * 属性表中的一项：某个成员名对应的 get / set / delete 处理器。
 *
 * <p>类定义时为每个成员安装一次；继承的成员直接复用父类的处理器。
 * {@code target} 为 null 表示类级访问。</p>
 */
abstract class Property {

    protected final MemberDescriptor descriptor;
    protected final WardClass owner;
    protected final AccessResolver resolver;

    Property(MemberDescriptor descriptor, WardClass owner, AccessResolver resolver) {
        this.descriptor = descriptor;
        this.owner = owner;
        this.resolver = resolver;
    }

    MemberDescriptor getDescriptor() {
        return descriptor;
    }

    /** 声明该成员的类 */
    WardClass getOwner() {
        return owner;
    }

    abstract Object get(WardObject target, AccessContext context);

    abstract void set(WardObject target, Object value, AccessContext context);

    abstract void delete(WardObject target, AccessContext context);

    /**
     * 成员在目标上是否有值可读（已赋值、有默认值或已提交）；方法总是有值
     */
    abstract boolean isBound(WardObject target);

    /**
     * 静态成员重定向到声明类的共享存储
     */
    protected Slots storeFor(WardObject target) {
        if (descriptor.isStatic()) {
            return owner.getStaticSlots();
        }
        if (target == null) {
            throw new WardException("Instance member '" + descriptor.getQualifiedName()
                    + "' cannot be accessed from the class scope");
        }
        return target.getSlots();
    }
}
