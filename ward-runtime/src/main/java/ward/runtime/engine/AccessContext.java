package ward.runtime.engine;

import ward.runtime.types.ClassDescriptor;

/**
 * 访问上下文：当前正在执行的代码在词法上所属的类，或外部（不在任何类中）。
 *
 * <p>上下文由调用方显式传入，方法体通过 {@link ward.runtime.types.Self} 自动携带其所属类。</p>
 */
public final class AccessContext {

    public static final AccessContext EXTERNAL = new AccessContext(null);

    private final ClassDescriptor enclosingClass;

    private AccessContext(ClassDescriptor enclosingClass) {
        this.enclosingClass = enclosingClass;
    }

    public static AccessContext of(ClassDescriptor enclosingClass) {
        return enclosingClass == null ? EXTERNAL : new AccessContext(enclosingClass);
    }

    public static AccessContext of(WardClass enclosingClass) {
        return enclosingClass == null ? EXTERNAL : of(enclosingClass.getDescriptor());
    }

    public boolean isExternal() {
        return enclosingClass == null;
    }

    /** 外部上下文为 null */
    public ClassDescriptor getEnclosingClass() {
        return enclosingClass;
    }

    @Override
    public String toString() {
        return isExternal() ? "<external>" : enclosingClass.getClassId();
    }
}
