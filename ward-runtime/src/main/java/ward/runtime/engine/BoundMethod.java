package ward.runtime.engine;

import ward.runtime.WardException;
import ward.runtime.types.MemberDescriptor;

import java.util.Arrays;
import java.util.Collections;

/**
 * 绑定方法（对象方法调用）
 *
 * <p>方法体以声明类作为访问上下文执行，与接收者的实际类无关。</p>
 */
public final class BoundMethod {

    private final WardObject receiver;
    private final MemberDescriptor method;
    private final WardClass declaringClass;

    BoundMethod(WardObject receiver, MemberDescriptor method, WardClass declaringClass) {
        this.receiver = receiver;
        this.method = method;
        this.declaringClass = declaringClass;
    }

    /** 静态方法为 null */
    public WardObject getReceiver() {
        return receiver;
    }

    public String getName() {
        return method.getName();
    }

    public int getArity() {
        return method.getArity();
    }

    public WardClass getDeclaringClass() {
        return declaringClass;
    }

    public Object call(Object... args) {
        Object[] actual = args != null ? args : new Object[0];
        int arity = method.getArity();
        if (arity >= 0 && actual.length != arity) {
            throw new WardException("Method '" + method.getQualifiedName() + "' expects " + arity
                    + " argument(s), got " + actual.length);
        }
        return method.getBody().call(new BoundSelf(receiver, declaringClass),
                Collections.unmodifiableList(Arrays.asList(actual)));
    }

    @Override
    public String toString() {
        return "<bound method " + method.getQualifiedName() + ">";
    }
}
