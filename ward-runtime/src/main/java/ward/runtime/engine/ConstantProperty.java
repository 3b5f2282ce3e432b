package ward.runtime.engine;

import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.Operation;

/**
 * 常量成员。
 *
 * <p>每个所有者（类或实例）只允许一次提交。类级值在类体求值时提交；
 * 实例创建时若类级值已提交则拷贝为实例自己的值，否则实例保持未提交，
 * 由它自己的首次写入提交。实例从不回退读取类级存储。</p>
 */
final class ConstantProperty extends Property {

    private final TypeValidator validator;

    ConstantProperty(MemberDescriptor descriptor, WardClass owner, AccessResolver resolver, TypeValidator validator) {
        super(descriptor, owner, resolver);
        this.validator = validator;
    }

    @Override
    Object get(WardObject target, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.READ, false);
        return ownerStore(target).read(descriptor);
    }

    @Override
    void set(WardObject target, Object value, AccessContext context) {
        Slots store = ownerStore(target);
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.WRITE, store.isCommitted(descriptor));
        store.commit(descriptor, validator.validate(descriptor, value));
    }

    @Override
    void delete(WardObject target, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.DELETE, true);
    }

    @Override
    boolean isBound(WardObject target) {
        return ownerStore(target).isCommitted(descriptor);
    }

    /**
     * 实例化时把已提交的类级值拷贝到实例
     */
    void snapshot(WardObject instance) {
        if (descriptor.isStatic()) return;
        Slots classStore = owner.getStaticSlots();
        if (classStore.isCommitted(descriptor)) {
            instance.getSlots().commit(descriptor, classStore.read(descriptor));
        }
    }

    private Slots ownerStore(WardObject target) {
        return descriptor.isStatic() || target == null ? owner.getStaticSlots() : target.getSlots();
    }
}
