package ward.runtime.engine;

import ward.runtime.WardException;
import ward.runtime.types.Self;

/**
 * 方法体内的 self，词法绑定到方法所属类
 */
final class BoundSelf implements Self {

    private final WardObject receiver;
    private final WardClass lexicalClass;
    private final AccessContext context;

    BoundSelf(WardObject receiver, WardClass lexicalClass) {
        this.receiver = receiver;
        this.lexicalClass = lexicalClass;
        this.context = AccessContext.of(lexicalClass);
    }

    @Override
    public Object get(String name) {
        return receiver != null ? receiver.get(name, context) : lexicalClass.get(name, context);
    }

    @Override
    public void set(String name, Object value) {
        if (receiver != null) {
            receiver.set(name, value, context);
        } else {
            lexicalClass.set(name, value, context);
        }
    }

    @Override
    public void delete(String name) {
        if (receiver != null) {
            receiver.delete(name, context);
        } else {
            lexicalClass.delete(name, context);
        }
    }

    @Override
    public Object invoke(String name, Object... args) {
        return receiver != null ? receiver.invoke(context, name, args) : lexicalClass.invoke(context, name, args);
    }

    @Override
    public void superInit(Object... args) {
        if (receiver == null) {
            throw new WardException("superInit() called without an instance in '" + lexicalClass.getName() + "'");
        }
        lexicalClass.initializeFromParent(receiver, args != null ? args : new Object[0]);
    }

    @Override
    public String getClassId() {
        return lexicalClass.getName();
    }

    @Override
    public Object getReceiver() {
        return receiver;
    }
}
