package ward.runtime.engine;

import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.Operation;

/**
 * 变量成员：可反复赋值，每次写入都经过校验。未赋值时读到默认值（无默认值为 null）。
 */
final class VariableProperty extends Property {

    private final TypeValidator validator;

    VariableProperty(MemberDescriptor descriptor, WardClass owner, AccessResolver resolver, TypeValidator validator) {
        super(descriptor, owner, resolver);
        this.validator = validator;
    }

    @Override
    Object get(WardObject target, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.READ, false);
        Slots store = storeFor(target);
        return store.contains(descriptor) ? store.read(descriptor) : descriptor.getDefaultValue();
    }

    @Override
    void set(WardObject target, Object value, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.WRITE, false);
        Slots store = storeFor(target);
        store.write(descriptor, validator.validate(descriptor, value));
    }

    @Override
    void delete(WardObject target, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.DELETE, false);
        storeFor(target).clear(descriptor);
    }

    @Override
    boolean isBound(WardObject target) {
        if (descriptor.hasDefault()) return true;
        if (!descriptor.isStatic() && target == null) return false;
        return storeFor(target).contains(descriptor);
    }
}
