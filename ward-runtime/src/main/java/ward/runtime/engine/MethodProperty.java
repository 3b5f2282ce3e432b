package ward.runtime.engine;

import ward.runtime.WardException;
import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.Operation;

/**
 * 方法成员：读取得到 {@link BoundMethod}；写入和删除总是被拒绝。
 */
final class MethodProperty extends Property {

    private final AbstractFinalEnforcer enforcer;

    MethodProperty(MemberDescriptor descriptor, WardClass owner, AccessResolver resolver, AbstractFinalEnforcer enforcer) {
        super(descriptor, owner, resolver);
        this.enforcer = enforcer;
    }

    @Override
    Object get(WardObject target, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.READ, false);
        enforcer.checkConcrete(descriptor);
        if (descriptor.isStatic()) {
            return new BoundMethod(null, descriptor, owner);
        }
        if (target == null) {
            throw new WardException("Instance method '" + descriptor.getQualifiedName()
                    + "' cannot be accessed from the class scope");
        }
        return new BoundMethod(target, descriptor, owner);
    }

    @Override
    void set(WardObject target, Object value, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.WRITE, false);
    }

    @Override
    void delete(WardObject target, AccessContext context) {
        resolver.enforce(descriptor, owner.getDescriptor(), context, Operation.DELETE, false);
    }

    @Override
    boolean isBound(WardObject target) {
        return true;
    }
}
